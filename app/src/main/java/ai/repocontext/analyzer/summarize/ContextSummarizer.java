package ai.repocontext.analyzer.summarize;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-shot, tool-free chat calls used to condense text.
 */
public class ContextSummarizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ContextSummarizer.class);

    public static final String FALLBACK_SUMMARY = "Error occurred while summarizing the context";
    public static final String NO_SUMMARY = "No summary generated";

    static final String SUMMARIZER_PERSONA =
            "You are a helpful assistant that summarizes content. Provide concise summaries.";
    static final String CONTEXT_SUMMARIZER_PERSONA =
            "You are a helpful assistant that summarizes repository contexts. "
                    + "Provide concise summaries focusing on the user's prompt.";

    private final ChatModel model;
    private final String modelLabel;

    public ContextSummarizer(ChatModel model, String modelLabel) {
        this.model = Objects.requireNonNull(model, "model");
        this.modelLabel = Objects.requireNonNullElse(modelLabel, "model");
    }

    /**
     * Summarizes arbitrary content.
     *
     * @throws SummarizationException when the call fails or the model returns no text
     */
    public String summarize(String content) {
        String text = complete(SUMMARIZER_PERSONA,
                "Please summarize the following content:\n\n" + Objects.requireNonNullElse(content, ""));
        if (text == null) {
            throw new SummarizationException("No summary generated");
        }
        return text;
    }

    /**
     * Compresses the accumulated repository context into an answer for {@code prompt}.
     * Never throws; failures resolve to {@link #FALLBACK_SUMMARY}.
     */
    public String finalizeContext(String context, String prompt) {
        String request = "Please summarize the following repository context, focusing on the user's prompt: '%s'\n\n%s"
                .formatted(Objects.requireNonNullElse(prompt, ""), Objects.requireNonNullElse(context, ""));
        try {
            String text = complete(CONTEXT_SUMMARIZER_PERSONA, request);
            return text == null ? NO_SUMMARY : text;
        } catch (RuntimeException ex) {
            LOGGER.warn("Error summarizing context: {}", ex.getMessage());
            return FALLBACK_SUMMARY;
        }
    }

    private String complete(String persona, String userText) {
        ChatRequest request = ChatRequest.builder()
                .messages(SystemMessage.from(persona), UserMessage.from(userText))
                .build();
        ChatResponse response;
        try {
            response = model.chat(request);
        } catch (RuntimeException ex) {
            if (isModelMissing(ex)) {
                throw new SummarizationException("Model '%s' is not available.".formatted(modelLabel), ex);
            }
            throw new SummarizationException("Summarization call failed: " + ex.getMessage(), ex);
        }
        AiMessage message = response == null ? null : response.aiMessage();
        if (message == null || message.text() == null) {
            return null;
        }
        return message.text();
    }

    private boolean isModelMissing(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof ModelNotFoundException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }
}
