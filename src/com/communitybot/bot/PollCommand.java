package com.communitybot.bot;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Arguments of {@code /poll} and {@code /closepoll}. Segments are separated by '|';
 * {@code key=value} segments set options, the rest are positional.
 *
 * <pre>
 * /poll Pizza or Tacos? | Pizza | Tacos | duration=2 | title=Lunch
 * /closepoll k3x9a1 | footer=Tacos it is
 * </pre>
 */
public final class PollCommand {
    public static final String CREATE_USAGE =
            "Usage: /poll <question> | <option 1> | <option 2> ... [| duration=<hours>] [| title=<text>] [| footer=<text>] [| role=<role>]";
    public static final String CLOSE_USAGE =
            "Usage: /closepoll <poll id> [| title=<text>] [| footer=<text>] [| role=<role>]";

    private static final Pattern SETTING = Pattern.compile("^(duration|title|footer|role)\\s*=\\s*(.*)$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    public String pollId;       // closepoll only
    public String question;     // poll only
    public List<String> options = new ArrayList<>();
    public int durationHours = 1;
    public String title;
    public String footer;
    public String voterRole;

    private PollCommand() {}

    /**
     * @throws IllegalArgumentException with a message fit for the member who typed the command
     */
    public static PollCommand parseCreate(String args) {
        PollCommand cmd = new PollCommand();
        List<String> positional = cmd.readSegments(args, true);
        if (positional.isEmpty()) {
            throw new IllegalArgumentException(CREATE_USAGE);
        }
        cmd.question = positional.get(0);
        cmd.options.addAll(positional.subList(1, positional.size()));
        return cmd;
    }

    /**
     * @throws IllegalArgumentException with a message fit for the member who typed the command
     */
    public static PollCommand parseClose(String args) {
        PollCommand cmd = new PollCommand();
        List<String> positional = cmd.readSegments(args, false);
        if (positional.size() != 1) {
            throw new IllegalArgumentException(CLOSE_USAGE);
        }
        cmd.pollId = positional.get(0);
        return cmd;
    }

    private List<String> readSegments(String args, boolean durationAllowed) {
        List<String> positional = new ArrayList<>();
        if (args == null) {
            return positional;
        }
        for (String raw : args.split("\\|")) {
            String segment = raw.trim();
            if (segment.isEmpty()) {
                continue;
            }
            Matcher m = SETTING.matcher(segment);
            if (!m.matches()) {
                positional.add(segment);
                continue;
            }
            String key = m.group(1).toLowerCase(Locale.ROOT);
            String value = m.group(2).trim();
            switch (key) {
                case "duration":
                    if (!durationAllowed) {
                        throw new IllegalArgumentException(CLOSE_USAGE);
                    }
                    try {
                        durationHours = Integer.parseInt(value);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Duration must be a whole number of hours.");
                    }
                    break;
                case "title":
                    title = value.isEmpty() ? null : value;
                    break;
                case "footer":
                    footer = value.isEmpty() ? null : value;
                    break;
                case "role":
                    voterRole = value.isEmpty() ? null : value;
                    break;
                default:
                    positional.add(segment);
            }
        }
        return positional;
    }
}
