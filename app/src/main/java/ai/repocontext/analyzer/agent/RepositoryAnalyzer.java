package ai.repocontext.analyzer.agent;

import ai.repocontext.analyzer.events.EventChannel;
import ai.repocontext.analyzer.events.EventNotifier;
import ai.repocontext.analyzer.repository.HostingException;
import ai.repocontext.analyzer.repository.RepositoryRef;
import ai.repocontext.analyzer.repository.RepositoryRefParser;
import ai.repocontext.analyzer.summarize.ContextSummarizer;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point answering a prompt about a hosted repository.
 *
 * <p>Never throws for collaborator failures: every path resolves to an {@link AnalysisResult} with
 * descriptive text.
 */
public class RepositoryAnalyzer {

    private static final Logger LOGGER = LoggerFactory.getLogger(RepositoryAnalyzer.class);

    public static final String INVALID_REPOSITORY_MESSAGE =
            "Error: Invalid repository format. Expected 'owner/repo' or a valid GitHub URL.";
    public static final String CANCELLED_MESSAGE = "Analysis cancelled before completion";

    private final RepositoryRefParser parser;
    private final ConversationDriver driver;
    private final ContextSummarizer summarizer;
    private final Optional<String> branch;
    private final int eventQueueCapacity;

    public RepositoryAnalyzer(RepositoryRefParser parser,
                              ConversationDriver driver,
                              ContextSummarizer summarizer,
                              Optional<String> branch,
                              int eventQueueCapacity) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.driver = Objects.requireNonNull(driver, "driver");
        this.summarizer = Objects.requireNonNull(summarizer, "summarizer");
        this.branch = branch == null ? Optional.empty() : branch;
        this.eventQueueCapacity = eventQueueCapacity;
    }

    public AnalysisResult analyze(String repositoryIdentifier, String prompt) {
        return analyze(repositoryIdentifier, prompt, Optional.empty(), CancellationToken.none());
    }

    public AnalysisResult analyze(String repositoryIdentifier,
                                  String prompt,
                                  Optional<EventChannel> channel,
                                  CancellationToken cancellation) {
        LOGGER.info("Analyzing repository {}", repositoryIdentifier);
        LOGGER.debug("User prompt: {}", prompt);

        RepositoryRef repository = parser.parse(repositoryIdentifier);
        if (repository.isEmpty()) {
            return AnalysisResult.failed(INVALID_REPOSITORY_MESSAGE);
        }

        ConversationOutcome outcome;
        try (EventNotifier notifier = new EventNotifier(channel, eventQueueCapacity)) {
            outcome = driver.run(new AnalysisRequest(repository, prompt, branch), notifier,
                    cancellation == null ? CancellationToken.none() : cancellation);
        } catch (AnalysisException ex) {
            return failure(ex);
        } catch (RuntimeException ex) {
            LOGGER.error("Unexpected failure analyzing {}", repository, ex);
            return AnalysisResult.failed("Error analyzing repository: " + ex.getMessage());
        }

        if (outcome.status() == AnalysisStatus.CANCELLED) {
            LOGGER.info("Analysis of {} cancelled after {} turn(s)", repository, outcome.iterations());
            return new AnalysisResult(AnalysisStatus.CANCELLED, CANCELLED_MESSAGE, outcome.iterations());
        }
        String summary = summarizer.finalizeContext(outcome.context(), prompt);
        return new AnalysisResult(outcome.status(), summary, outcome.iterations());
    }

    private AnalysisResult failure(AnalysisException ex) {
        if (ex.getCause() instanceof HostingException hosting && hosting.isCredentialMissing()) {
            LOGGER.error("Hosting credential is missing");
            return AnalysisResult.failed("Error: " + hosting.getMessage());
        }
        LOGGER.error("Error analyzing repository: {}", ex.getMessage(), ex);
        return AnalysisResult.failed("Error analyzing repository: " + ex.getMessage());
    }
}
