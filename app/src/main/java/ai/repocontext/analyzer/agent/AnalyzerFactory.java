package ai.repocontext.analyzer.agent;

import ai.repocontext.analyzer.config.Config;
import ai.repocontext.analyzer.config.LlmConfig;
import ai.repocontext.analyzer.config.Secrets;
import ai.repocontext.analyzer.repository.GitHubContentClient;
import ai.repocontext.analyzer.repository.RepositoryContentService;
import ai.repocontext.analyzer.repository.RepositoryRefParser;
import ai.repocontext.analyzer.summarize.ContextSummarizer;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires a {@link RepositoryAnalyzer} from configuration.
 */
public class AnalyzerFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnalyzerFactory.class);
    private static final double TEMPERATURE = 0.1;

    public RepositoryAnalyzer create(Config config) {
        ChatModel chatModel = createChatModel(config.llmConfig(), config.secrets());
        RepositoryContentService contentService = new GitHubContentClient(
                config.gitHubConfig().apiBase(),
                config.secrets().githubToken(),
                config.gitHubConfig().timeout());
        return create(config, chatModel, contentService);
    }

    public RepositoryAnalyzer create(Config config, ChatModel chatModel, RepositoryContentService contentService) {
        ContextSummarizer summarizer = new ContextSummarizer(chatModel, config.llmConfig().label());
        ConversationDriver driver = new ConversationDriver(chatModel, contentService, summarizer, config.historyOrder());
        return new RepositoryAnalyzer(new RepositoryRefParser(), driver, summarizer,
                config.gitHubConfig().branch(), config.eventQueueCapacity());
    }

    ChatModel createChatModel(LlmConfig llmConfig, Secrets secrets) {
        return switch (llmConfig.provider()) {
            case OLLAMA -> createOllamaChatModel(llmConfig);
            case GEMINI -> createGeminiChatModel(llmConfig, secrets);
            case GROQ -> createGroqChatModel(llmConfig, secrets);
        };
    }

    private ChatModel createOllamaChatModel(LlmConfig llmConfig) {
        String baseUrl = llmConfig.baseUrl()
                .orElseThrow(() -> new IllegalStateException("OLLAMA_BASE_URL must be configured when LLM_PROVIDER=ollama"));
        try {
            LOGGER.info("Using Ollama model '{}' via {}", llmConfig.modelName(), baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(llmConfig.modelName())
                    .temperature(TEMPERATURE)
                    .timeout(llmConfig.timeout())
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }

    private ChatModel createGeminiChatModel(LlmConfig llmConfig, Secrets secrets) {
        String apiKey = secrets.geminiApiKey()
                .orElseThrow(() -> new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini"));
        try {
            LOGGER.info("Using Gemini model '{}'", llmConfig.modelName());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(llmConfig.modelName())
                    .temperature(TEMPERATURE)
                    .timeout(llmConfig.timeout())
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }

    private ChatModel createGroqChatModel(LlmConfig llmConfig, Secrets secrets) {
        String apiKey = secrets.groqApiKey()
                .orElseThrow(() -> new IllegalStateException("GROQ_API_KEY must be provided when LLM_PROVIDER=groq"));
        String baseUrl = llmConfig.baseUrl()
                .orElseThrow(() -> new IllegalStateException("Groq base URL is not configured"));
        try {
            LOGGER.info("Using Groq model '{}' via {}", llmConfig.modelName(), baseUrl);
            return OpenAiChatModel.builder()
                    .baseUrl(baseUrl)
                    .apiKey(apiKey)
                    .modelName(llmConfig.modelName())
                    .temperature(TEMPERATURE)
                    .timeout(llmConfig.timeout())
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Groq chat model", ex);
        }
    }
}
