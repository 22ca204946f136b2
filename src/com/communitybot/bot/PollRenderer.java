package com.communitybot.bot;

import com.communitybot.model.PollSnapshot;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Projects a poll snapshot to message text and buttons. Nothing rendered is stored;
 * every change is drawn again from the engine's state.
 */
public final class PollRenderer {
    public static final String CALLBACK_PREFIX = "poll:";
    static final int MAX_LABEL = 80;

    private PollRenderer() {}

    public static String render(PollSnapshot poll, Instant now) {
        String title = poll.getTitle() != null ? poll.getTitle() : (poll.isEnded() ? "Poll (Closed)" : "Poll");

        StringBuilder sb = new StringBuilder();
        sb.append("📊 ").append(title).append("\n\n");
        sb.append(poll.getQuestion()).append("\n\n");
        List<String> options = poll.getOptions();
        for (int i = 0; i < options.size(); i++) {
            sb.append(i + 1).append(". ").append(options.get(i))
                    .append(" — ").append(poll.votesFor(i)).append(" votes\n\n");
        }
        sb.append(footer(poll, now));
        return sb.toString();
    }

    static String footer(PollSnapshot poll, Instant now) {
        if (poll.getFooter() != null) {
            return poll.getFooter();
        }
        if (poll.isEnded()) {
            return "Poll ended";
        }
        long remainingMs = Math.max(0, Duration.between(now, poll.getEndAt()).toMillis());
        long hours = (remainingMs + 3_600_000 - 1) / 3_600_000;
        return "Poll closes in " + hours + " hour(s)";
    }

    /**
     * One button per option, one option per row.
     */
    public static InlineKeyboardMarkup keyboard(PollSnapshot poll) {
        InlineKeyboardMarkup markup = new InlineKeyboardMarkup();
        List<List<InlineKeyboardButton>> keyboard = new ArrayList<>();

        List<String> options = poll.getOptions();
        for (int i = 0; i < options.size(); i++) {
            InlineKeyboardButton button = new InlineKeyboardButton();
            button.setText(buttonLabel(i, options.get(i)));
            button.setCallbackData(callbackData(poll.getId(), i));

            List<InlineKeyboardButton> row = new ArrayList<>();
            row.add(button);
            keyboard.add(row);
        }

        markup.setKeyboard(keyboard);
        return markup;
    }

    static String buttonLabel(int index, String label) {
        String trimmed = label.length() > MAX_LABEL ? label.substring(0, MAX_LABEL - 3) + "..." : label;
        return (index + 1) + ". " + trimmed;
    }

    static String callbackData(String pollId, int index) {
        return CALLBACK_PREFIX + pollId + ":" + index;
    }

    /**
     * A parsed vote button press.
     */
    public static final class VoteClick {
        public final String pollId;
        public final int optionIndex;

        VoteClick(String pollId, int optionIndex) {
            this.pollId = pollId;
            this.optionIndex = optionIndex;
        }
    }

    /**
     * Parses {@code poll:<pollId>:<index>}.
     * @return null when the data is malformed; such presses are dropped without an answer
     */
    public static VoteClick parseCallback(String data) {
        if (data == null || !data.startsWith(CALLBACK_PREFIX)) {
            return null;
        }
        String[] parts = data.substring(CALLBACK_PREFIX.length()).split(":");
        if (parts.length != 2 || parts[0].isEmpty()) {
            return null;
        }
        try {
            return new VoteClick(parts[0], Integer.parseInt(parts[1]));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
