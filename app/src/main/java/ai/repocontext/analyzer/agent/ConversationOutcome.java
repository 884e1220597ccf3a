package ai.repocontext.analyzer.agent;

import ai.repocontext.analyzer.agent.tools.ToolCallOutcome;
import java.util.List;
import java.util.Objects;

/**
 * What the conversation loop produced before final summarization.
 */
public record ConversationOutcome(AnalysisStatus status,
                                  String context,
                                  int iterations,
                                  List<ToolCallOutcome> toolCalls) {

    public ConversationOutcome {
        status = Objects.requireNonNull(status, "status");
        if (status == AnalysisStatus.FAILED) {
            throw new IllegalArgumentException("failures are raised as AnalysisException");
        }
        context = Objects.requireNonNullElse(context, "");
        toolCalls = List.copyOf(toolCalls == null ? List.of() : toolCalls);
    }
}
