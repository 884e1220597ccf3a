package ai.repocontext.analyzer.agent;

import static ai.repocontext.analyzer.agent.ScriptedChatModel.callsTools;
import static ai.repocontext.analyzer.agent.ScriptedChatModel.toolCall;
import static org.assertj.core.api.Assertions.assertThat;

import ai.repocontext.analyzer.events.EventNotifier;
import ai.repocontext.analyzer.events.RecordingEventChannel;
import ai.repocontext.analyzer.repository.GitHubContentClient;
import ai.repocontext.analyzer.repository.InMemoryContentService;
import ai.repocontext.analyzer.repository.RecordingHttpClient;
import ai.repocontext.analyzer.repository.RepositoryContentService;
import ai.repocontext.analyzer.repository.RepositoryRefParser;
import ai.repocontext.analyzer.summarize.ContextSummarizer;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import java.net.URI;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RepositoryAnalyzerTest {

    private final InMemoryContentService contentService = new InMemoryContentService()
            .withFolder("", "README.md (file)\n")
            .withFile("README.md", "# Demo\nA command line tool.");

    @Test
    void returnsFinalSummaryOfGatheredContext() {
        ScriptedChatModel model = ScriptedChatModel.replying(
                callsTools(toolCall("call-1", "view_file", "{\"path\":\"README.md\"}")),
                AiMessage.from("I have what I need"))
                .withSummary("A command line tool.");

        AnalysisResult result = analyzer(model, contentService).analyze("octo/demo", "What is it?");

        assertThat(result.status()).isEqualTo(AnalysisStatus.COMPLETED);
        assertThat(result.text()).isEqualTo("A command line tool.");
        assertThat(result.iterations()).isEqualTo(2);
        String finalRequest = ((UserMessage) model.summaryRequests().get(0).messages().get(1)).singleText();
        assertThat(finalRequest).contains("'What is it?'")
                .endsWith("README.md (file)\nview_file:\n# Demo\nA command line tool.\n\n");
    }

    @Test
    void acceptsRepositoryUrls() {
        ScriptedChatModel model = ScriptedChatModel.replying(AiMessage.from("done"));

        AnalysisResult result = analyzer(model, contentService).analyze("https://github.com/octo/demo.git", "prompt");

        assertThat(result.status()).isEqualTo(AnalysisStatus.COMPLETED);
        assertThat(contentService.lookups()).containsExactly("folder:");
    }

    @Test
    void invalidRepositoryIsReportedWithoutAnyCall() {
        ScriptedChatModel model = ScriptedChatModel.replying();

        AnalysisResult result = analyzer(model, contentService).analyze("not-a-repository", "prompt");

        assertThat(result.status()).isEqualTo(AnalysisStatus.FAILED);
        assertThat(result.text()).isEqualTo(
                "Error: Invalid repository format. Expected 'owner/repo' or a valid GitHub URL.");
        assertThat(contentService.lookups()).isEmpty();
        assertThat(model.turnRequests()).isEmpty();
        assertThat(model.summaryRequests()).isEmpty();
    }

    @Test
    void missingTokenIsReportedWithoutNetworkOrModelCalls() {
        RecordingHttpClient httpClient = new RecordingHttpClient();
        GitHubContentClient gitHub = new GitHubContentClient(httpClient,
                URI.create("https://api.github.com"), Optional.empty(), Duration.ofSeconds(5));
        ScriptedChatModel model = ScriptedChatModel.replying();

        AnalysisResult result = analyzer(model, gitHub).analyze("octo/demo", "prompt");

        assertThat(result.status()).isEqualTo(AnalysisStatus.FAILED);
        assertThat(result.text()).isEqualTo("Error: " + GitHubContentClient.TOKEN_MISSING_MESSAGE);
        assertThat(httpClient.requests()).isEmpty();
        assertThat(model.turnRequests()).isEmpty();
        assertThat(model.summaryRequests()).isEmpty();
    }

    @Test
    void chatFailureIsReportedAsText() {
        ScriptedChatModel model = ScriptedChatModel.replying()
                .failingTurns(new IllegalStateException("model unavailable"));

        AnalysisResult result = analyzer(model, contentService).analyze("octo/demo", "prompt");

        assertThat(result.status()).isEqualTo(AnalysisStatus.FAILED);
        assertThat(result.text()).isEqualTo("Error analyzing repository: error in chat completion: model unavailable");
        assertThat(model.summaryRequests()).isEmpty();
    }

    @Test
    void iterationLimitStillProducesSummary() {
        ScriptedChatModel model = ScriptedChatModel.answering(
                turn -> callsTools(toolCall("call-" + turn, "view_folder", "{\"path\":\"\"}")))
                .withSummary("partial answer");

        AnalysisResult result = analyzer(model, contentService).analyze("octo/demo", "prompt");

        assertThat(result.status()).isEqualTo(AnalysisStatus.ITERATION_LIMIT_REACHED);
        assertThat(result.status().isSuccessful()).isTrue();
        assertThat(result.text()).isEqualTo("partial answer");
        assertThat(result.iterations()).isEqualTo(ConversationDriver.MAX_ITERATIONS);
    }

    @Test
    void failingFinalSummaryFallsBackToFixedText() {
        ScriptedChatModel model = ScriptedChatModel.replying(AiMessage.from("done"))
                .failingSummaries(new IllegalStateException("timeout"));

        AnalysisResult result = analyzer(model, contentService).analyze("octo/demo", "prompt");

        assertThat(result.status()).isEqualTo(AnalysisStatus.COMPLETED);
        assertThat(result.text()).isEqualTo(ContextSummarizer.FALLBACK_SUMMARY);
    }

    @Test
    void cancelledAnalysisSkipsSummary() {
        CancellationToken token = CancellationToken.create();
        token.cancel();
        ScriptedChatModel model = ScriptedChatModel.replying();

        AnalysisResult result = analyzer(model, contentService)
                .analyze("octo/demo", "prompt", Optional.empty(), token);

        assertThat(result.status()).isEqualTo(AnalysisStatus.CANCELLED);
        assertThat(result.text()).isEqualTo(RepositoryAnalyzer.CANCELLED_MESSAGE);
        assertThat(model.summaryRequests()).isEmpty();
    }

    @Test
    void viewedFilesReachTheCallerChannel() {
        RecordingEventChannel channel = new RecordingEventChannel();
        ScriptedChatModel model = ScriptedChatModel.replying(
                callsTools(toolCall("call-1", "view_file", "{\"path\":\"README.md\"}")));

        analyzer(model, contentService).analyze("octo/demo", "prompt", Optional.of(channel), CancellationToken.none());

        assertThat(channel.messages()).singleElement()
                .satisfies(message -> assertThat(message).startsWith("[\"EVENT\",").contains("Viewed README.md"));
    }

    @Test
    void emptyFileStillProducesSummary() {
        contentService.withFile("pkg/__init__.py", "");
        ScriptedChatModel model = ScriptedChatModel.replying(
                callsTools(toolCall("call-1", "view_file", "{\"path\":\"pkg/__init__.py\"}")),
                AiMessage.from("done"))
                .withSummary("An empty package marker.");

        AnalysisResult result = analyzer(model, contentService).analyze("o/r", "p");

        assertThat(result.status()).isEqualTo(AnalysisStatus.COMPLETED);
        assertThat(result.text()).isEqualTo("An empty package marker.");
    }

    @Test
    void unexpectedDriverFailureIsReportedAsText() {
        ScriptedChatModel model = ScriptedChatModel.replying();
        ContextSummarizer summarizer = new ContextSummarizer(model, "test:model");
        ConversationDriver brokenDriver = new ConversationDriver(model, contentService, summarizer, HistoryOrder.RESULTS_FIRST) {
            @Override
            public ConversationOutcome run(AnalysisRequest request, EventNotifier notifier, CancellationToken cancellation) {
                throw new IllegalStateException("history rejected");
            }
        };
        RepositoryAnalyzer analyzer = new RepositoryAnalyzer(new RepositoryRefParser(), brokenDriver, summarizer,
                Optional.empty(), 8);

        AnalysisResult result = analyzer.analyze("octo/demo", "prompt");

        assertThat(result.status()).isEqualTo(AnalysisStatus.FAILED);
        assertThat(result.text()).isEqualTo("Error analyzing repository: history rejected");
        assertThat(model.summaryRequests()).isEmpty();
    }

    private static RepositoryAnalyzer analyzer(ScriptedChatModel model, RepositoryContentService contentService) {
        ContextSummarizer summarizer = new ContextSummarizer(model, "test:model");
        ConversationDriver driver = new ConversationDriver(model, contentService, summarizer, HistoryOrder.RESULTS_FIRST);
        return new RepositoryAnalyzer(new RepositoryRefParser(), driver, summarizer, Optional.empty(), 8);
    }
}
