package com.communitybot.model;

/**
 * What to do about an offense at a given escalation level: warn, or time the member out.
 */
public final class EscalationAction {
    public enum Type { WARN, TIMEOUT }

    private static final EscalationAction WARN = new EscalationAction(Type.WARN, 0);

    private final Type type;
    private final int minutes;

    private EscalationAction(Type type, int minutes) {
        this.type = type;
        this.minutes = minutes;
    }

    public static EscalationAction warn() {
        return WARN;
    }

    public static EscalationAction timeout(int minutes) {
        return new EscalationAction(Type.TIMEOUT, minutes);
    }

    public Type getType() { return type; }

    /** Timeout length; 0 for a warning. */
    public int getMinutes() { return minutes; }

    public boolean isTimeout() {
        return type == Type.TIMEOUT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EscalationAction)) return false;
        EscalationAction other = (EscalationAction) o;
        return type == other.type && minutes == other.minutes;
    }

    @Override
    public int hashCode() {
        return type.hashCode() * 31 + minutes;
    }

    @Override
    public String toString() {
        return type == Type.WARN ? "Warn" : "Timeout(" + minutes + "m)";
    }
}
