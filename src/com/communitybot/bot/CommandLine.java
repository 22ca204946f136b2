package com.communitybot.bot;

import java.util.Locale;

/**
 * A slash command split into name and argument text. {@code /poll@my_bot a | b} gives
 * name "poll" and args "a | b".
 */
public final class CommandLine {
    public final String name;
    public final String args;

    private CommandLine(String name, String args) {
        this.name = name;
        this.args = args;
    }

    /**
     * @return null if the text is not a command, or is addressed to a different bot
     */
    public static CommandLine parse(String text, String botUsername) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (!trimmed.startsWith("/") || trimmed.length() < 2) {
            return null;
        }
        int space = indexOfWhitespace(trimmed);
        String head = space < 0 ? trimmed.substring(1) : trimmed.substring(1, space);
        String args = space < 0 ? "" : trimmed.substring(space + 1).trim();

        int at = head.indexOf('@');
        if (at >= 0) {
            String target = head.substring(at + 1);
            if (botUsername != null && !target.equalsIgnoreCase(botUsername)) {
                return null;
            }
            head = head.substring(0, at);
        }
        if (head.isEmpty()) {
            return null;
        }
        return new CommandLine(head.toLowerCase(Locale.ROOT), args);
    }

    private static int indexOfWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
