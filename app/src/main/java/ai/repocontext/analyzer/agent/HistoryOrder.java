package ai.repocontext.analyzer.agent;

import java.util.Locale;

/**
 * Order in which a turn's tool replies and assistant message are appended to the history.
 */
public enum HistoryOrder {
    /** Tool replies first, then the assistant text. */
    RESULTS_FIRST,
    /** Assistant message with its tool requests first, then the tool replies. */
    ASSISTANT_FIRST;

    public static HistoryOrder from(String raw) {
        if (raw == null || raw.isBlank()) {
            return RESULTS_FIRST;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT).replace('_', '-')) {
            case "results-first" -> RESULTS_FIRST;
            case "assistant-first" -> ASSISTANT_FIRST;
            default -> throw new IllegalArgumentException("Unsupported history order: " + raw);
        };
    }
}
