package ai.repocontext.analyzer.agent;

import ai.repocontext.analyzer.agent.tools.ToolCallOutcome;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import java.util.List;
import java.util.Objects;

/**
 * Appends the messages of a finished turn to the conversation history.
 *
 * <p>Every requested call id receives exactly one tool reply, whether the call succeeded or not.
 */
class HistoryWriter {

    private final HistoryOrder order;

    HistoryWriter(HistoryOrder order) {
        this.order = Objects.requireNonNull(order, "order");
    }

    void appendTurn(ConversationState state, AiMessage assistant, List<ToolCallOutcome> outcomes) {
        switch (order) {
            case RESULTS_FIRST -> {
                appendReplies(state, outcomes);
                state.append(AiMessage.from(Objects.requireNonNullElse(assistant.text(), "")));
            }
            case ASSISTANT_FIRST -> {
                state.append(withRequests(assistant));
                appendReplies(state, outcomes);
            }
        }
    }

    private void appendReplies(ConversationState state, List<ToolCallOutcome> outcomes) {
        for (ToolCallOutcome outcome : outcomes) {
            state.append(ToolExecutionResultMessage.from(outcome.callId(), outcome.toolName(), outcome.replyText()));
        }
    }

    private AiMessage withRequests(AiMessage assistant) {
        List<ToolExecutionRequest> requests = assistant.toolExecutionRequests();
        if (assistant.text() == null) {
            return AiMessage.from(requests);
        }
        return AiMessage.from(assistant.text(), requests);
    }
}
