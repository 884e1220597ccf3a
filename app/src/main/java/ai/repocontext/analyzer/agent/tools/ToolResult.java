package ai.repocontext.analyzer.agent.tools;

import java.util.Objects;
import java.util.Optional;

/**
 * Text produced by one tool dispatch, or the reason it failed.
 */
public record ToolResult(String text, Optional<String> error) {

    public ToolResult {
        text = Objects.requireNonNullElse(text, "");
        error = error == null ? Optional.empty() : error;
    }

    public static ToolResult success(String text) {
        return new ToolResult(text, Optional.empty());
    }

    public static ToolResult failure(String error) {
        return new ToolResult("", Optional.of(Objects.requireNonNullElse(error, "unknown error")));
    }

    public boolean isSuccess() {
        return error.isEmpty();
    }
}
