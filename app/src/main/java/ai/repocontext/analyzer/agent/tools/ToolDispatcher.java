package ai.repocontext.analyzer.agent.tools;

import ai.repocontext.analyzer.events.EventNotifier;
import ai.repocontext.analyzer.repository.HostingException;
import ai.repocontext.analyzer.repository.RepositoryContentService;
import ai.repocontext.analyzer.repository.RepositoryRef;
import ai.repocontext.analyzer.summarize.ContextSummarizer;
import ai.repocontext.analyzer.summarize.SummarizationException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes one named tool call for a single repository analysis.
 *
 * <p>Every failure, including undecodable arguments and unknown tool names, is returned as a
 * {@link ToolResult#failure(String)}; this class never throws for a bad call.
 */
public class ToolDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(ToolDispatcher.class);

    private final RepositoryContentService contentService;
    private final ContextSummarizer summarizer;
    private final EventNotifier notifier;
    private final RepositoryRef repository;
    private final Optional<String> branch;

    public ToolDispatcher(RepositoryContentService contentService,
                          ContextSummarizer summarizer,
                          EventNotifier notifier,
                          RepositoryRef repository,
                          Optional<String> branch) {
        this.contentService = Objects.requireNonNull(contentService, "contentService");
        this.summarizer = Objects.requireNonNull(summarizer, "summarizer");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.repository = Objects.requireNonNull(repository, "repository");
        this.branch = branch == null ? Optional.empty() : branch;
    }

    public ToolResult dispatch(String toolName, String rawArguments) {
        ToolArguments arguments;
        try {
            arguments = ToolArguments.decode(rawArguments);
        } catch (IllegalArgumentException ex) {
            return ToolResult.failure(ex.getMessage());
        }
        LOGGER.debug("Dispatching {} with {}", toolName, arguments.asMap());

        try {
            return switch (Objects.requireNonNullElse(toolName, "")) {
                case ToolCatalog.VIEW_FILE -> viewFile(arguments.require(ToolCatalog.PATH_ARGUMENT));
                case ToolCatalog.VIEW_FOLDER -> ToolResult.success(
                        contentService.getFolder(repository, arguments.require(ToolCatalog.PATH_ARGUMENT), branch));
                case ToolCatalog.GENERATE_SUMMARY -> ToolResult.success(
                        summarizer.summarize(arguments.require(ToolCatalog.CONTENT_ARGUMENT)));
                default -> ToolResult.failure("unknown tool: " + toolName);
            };
        } catch (IllegalArgumentException | HostingException | SummarizationException ex) {
            return ToolResult.failure(ex.getMessage());
        } catch (RuntimeException ex) {
            LOGGER.debug("Unexpected failure in tool {}", toolName, ex);
            return ToolResult.failure(ex.getClass().getSimpleName() + ": " + ex.getMessage());
        }
    }

    private ToolResult viewFile(String path) {
        String content = contentService.getFile(repository, path, branch);
        notifier.notifyViewed(path);
        return ToolResult.success(content);
    }
}
