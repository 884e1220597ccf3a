package ai.repocontext.analyzer.agent.tools;

import java.util.Objects;

/**
 * Result of one requested tool call, keyed by the call id the model assigned.
 */
public record ToolCallOutcome(String callId, String toolName, ToolResult result) {

    public static final String EMPTY_REPLY = "(empty)";

    public ToolCallOutcome {
        callId = Objects.requireNonNullElse(callId, "");
        toolName = Objects.requireNonNullElse(toolName, "");
        result = Objects.requireNonNull(result, "result");
    }

    public boolean succeeded() {
        return result.isSuccess();
    }

    /**
     * Text shown to the model for this call: the result, or a placeholder naming the failure.
     * Never blank, since tool replies must carry text.
     */
    public String replyText() {
        if (result.error().isPresent()) {
            return "Error: " + result.error().get();
        }
        return result.text().isBlank() ? EMPTY_REPLY : result.text();
    }
}
