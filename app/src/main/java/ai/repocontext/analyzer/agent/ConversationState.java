package ai.repocontext.analyzer.agent;

import dev.langchain4j.data.message.ChatMessage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Mutable state of one analysis: message history, turn count and context buffer.
 * Created per invocation and never shared between threads.
 */
public final class ConversationState {

    private final int maxIterations;
    private final List<ChatMessage> messages = new ArrayList<>();
    private final StringBuilder contextBuffer = new StringBuilder();
    private int iterationCount;

    ConversationState(int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1");
        }
        this.maxIterations = maxIterations;
    }

    void append(ChatMessage message) {
        messages.add(Objects.requireNonNull(message, "message"));
    }

    void appendContext(String text) {
        contextBuffer.append(text);
    }

    void appendToolOutput(String toolName, String text) {
        contextBuffer.append(toolName).append(":\n").append(text).append("\n\n");
    }

    void startTurn() {
        if (iterationCount >= maxIterations) {
            throw new IllegalStateException("iteration ceiling of " + maxIterations + " already reached");
        }
        iterationCount++;
    }

    boolean ceilingReached() {
        return iterationCount >= maxIterations;
    }

    public List<ChatMessage> messages() {
        return Collections.unmodifiableList(messages);
    }

    public int iterationCount() {
        return iterationCount;
    }

    public String context() {
        return contextBuffer.toString();
    }
}
