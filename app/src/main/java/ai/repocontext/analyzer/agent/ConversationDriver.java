package ai.repocontext.analyzer.agent;

import ai.repocontext.analyzer.agent.tools.ToolCallOutcome;
import ai.repocontext.analyzer.agent.tools.ToolCatalog;
import ai.repocontext.analyzer.agent.tools.ToolDispatcher;
import ai.repocontext.analyzer.agent.tools.ToolResult;
import ai.repocontext.analyzer.events.EventNotifier;
import ai.repocontext.analyzer.repository.RepositoryContentService;
import ai.repocontext.analyzer.summarize.ContextSummarizer;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Drives the bounded tool-calling conversation that gathers repository context.
 *
 * <p>The root folder listing is fetched once and embedded in the first user message. Each turn issues
 * one blocking chat call with the full history and the {@link ToolCatalog}, then dispatches the
 * requested tool calls one after another. The loop stops when the model requests no tools or after
 * {@link #MAX_ITERATIONS} turns; tool calls requested on the last turn are still executed.
 *
 * <p>A failing tool call never aborts the run. A failing root fetch or chat call does, by throwing
 * {@link AnalysisException}.
 */
public class ConversationDriver {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConversationDriver.class);

    public static final int MAX_ITERATIONS = 5;

    static final String MDC_REPOSITORY = "repository";
    static final String MDC_TURN = "turn";

    private final ChatModel chatModel;
    private final RepositoryContentService contentService;
    private final ContextSummarizer summarizer;
    private final HistoryWriter historyWriter;

    public ConversationDriver(ChatModel chatModel,
                              RepositoryContentService contentService,
                              ContextSummarizer summarizer,
                              HistoryOrder historyOrder) {
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
        this.contentService = Objects.requireNonNull(contentService, "contentService");
        this.summarizer = Objects.requireNonNull(summarizer, "summarizer");
        this.historyWriter = new HistoryWriter(historyOrder);
    }

    public ConversationOutcome run(AnalysisRequest request, EventNotifier notifier, CancellationToken cancellation) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(notifier, "notifier");
        Objects.requireNonNull(cancellation, "cancellation");

        ConversationState state = new ConversationState(MAX_ITERATIONS);
        List<ToolCallOutcome> toolCalls = new ArrayList<>();
        MDC.put(MDC_REPOSITORY, request.repository().fullName());
        try {
            if (cancellation.isCancelled()) {
                return finish(AnalysisStatus.CANCELLED, state, toolCalls);
            }
            String rootListing = fetchRootListing(request);
            state.append(AnalyzerPrompts.persona());
            state.append(AnalyzerPrompts.initialRequest(request.prompt(), rootListing));
            state.appendContext(rootListing);

            ToolDispatcher dispatcher = new ToolDispatcher(contentService, summarizer, notifier,
                    request.repository(), request.branch());

            while (true) {
                if (cancellation.isCancelled()) {
                    return finish(AnalysisStatus.CANCELLED, state, toolCalls);
                }
                state.startTurn();
                MDC.put(MDC_TURN, Integer.toString(state.iterationCount()));

                AiMessage reply = chat(state);
                if (reply == null || !reply.hasToolExecutionRequests()) {
                    LOGGER.info("Model finished after {} turn(s)", state.iterationCount());
                    return finish(AnalysisStatus.COMPLETED, state, toolCalls);
                }

                List<ToolCallOutcome> turnOutcomes = new ArrayList<>();
                for (ToolExecutionRequest call : reply.toolExecutionRequests()) {
                    if (cancellation.isCancelled()) {
                        return finish(AnalysisStatus.CANCELLED, state, toolCalls);
                    }
                    ToolCallOutcome outcome = execute(dispatcher, call, state);
                    turnOutcomes.add(outcome);
                    toolCalls.add(outcome);
                }
                historyWriter.appendTurn(state, reply, turnOutcomes);

                if (state.ceilingReached()) {
                    LOGGER.info("Stopping after reaching the limit of {} turns", MAX_ITERATIONS);
                    return finish(AnalysisStatus.ITERATION_LIMIT_REACHED, state, toolCalls);
                }
            }
        } finally {
            MDC.remove(MDC_TURN);
            MDC.remove(MDC_REPOSITORY);
        }
    }

    private String fetchRootListing(AnalysisRequest request) {
        try {
            return contentService.getFolder(request.repository(), "", request.branch());
        } catch (RuntimeException ex) {
            throw new AnalysisException("error viewing root folder: " + ex.getMessage(), ex);
        }
    }

    private AiMessage chat(ConversationState state) {
        ChatRequest chatRequest = ChatRequest.builder()
                .messages(List.copyOf(state.messages()))
                .toolSpecifications(ToolCatalog.specifications())
                .build();
        ChatResponse response;
        try {
            response = chatModel.chat(chatRequest);
        } catch (RuntimeException ex) {
            throw new AnalysisException("error in chat completion: " + ex.getMessage(), ex);
        }
        return response == null ? null : response.aiMessage();
    }

    private ToolCallOutcome execute(ToolDispatcher dispatcher, ToolExecutionRequest call, ConversationState state) {
        ToolResult result = dispatcher.dispatch(call.name(), call.arguments());
        if (result.isSuccess()) {
            state.appendToolOutput(call.name(), result.text());
        } else {
            LOGGER.warn("Error executing tool call {} ({}): {}", call.name(), call.id(), result.error().orElse(""));
        }
        return new ToolCallOutcome(call.id(), call.name(), result);
    }

    private ConversationOutcome finish(AnalysisStatus status, ConversationState state, List<ToolCallOutcome> toolCalls) {
        return new ConversationOutcome(status, state.context(), state.iterationCount(), toolCalls);
    }
}
