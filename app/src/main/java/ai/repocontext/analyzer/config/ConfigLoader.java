package ai.repocontext.analyzer.config;

import ai.repocontext.analyzer.agent.HistoryOrder;
import ai.repocontext.analyzer.cli.CliArguments;
import ai.repocontext.analyzer.repository.GitHubContentClient;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} by combining CLI arguments with environment variables and defaults.
 *
 * <p>A missing {@code GITHUB_TOKEN} is not a loading error; the analyzer reports it to the caller.
 */
public class ConfigLoader {

    static final String ENV_REPOSITORY = "ANALYZER_REPOSITORY";
    static final String ENV_PROMPT = "ANALYZER_PROMPT";
    static final String ENV_GITHUB_REF = "GITHUB_REF";
    static final String ENV_EVENTS_URL = "EVENTS_URL";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_HISTORY_ORDER = "HISTORY_ORDER";
    static final String ENV_EVENT_QUEUE_CAPACITY = "EVENT_QUEUE_CAPACITY";
    static final String ENV_GITHUB_TOKEN = "GITHUB_TOKEN";
    static final String ENV_GITHUB_API_URL = "GITHUB_API_URL";
    static final String ENV_GITHUB_TIMEOUT_SECONDS = "GITHUB_TIMEOUT_SECONDS";
    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_LLM_TIMEOUT_SECONDS = "LLM_TIMEOUT_SECONDS";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_GROQ_API_KEY = "GROQ_API_KEY";

    static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";
    static final String DEFAULT_GROQ_BASE_URL = "https://api.groq.com/openai/v1";
    private static final int DEFAULT_GITHUB_TIMEOUT_SECONDS = 30;
    private static final int DEFAULT_LLM_TIMEOUT_SECONDS = 120;
    private static final int DEFAULT_EVENT_QUEUE_CAPACITY = 64;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");

        String repository = firstNonBlank(arguments.repository(), ENV_REPOSITORY)
                .orElseThrow(() -> new IllegalArgumentException("repository must be provided (--repo or " + ENV_REPOSITORY + ")"));
        String prompt = firstNonBlank(arguments.prompt(), ENV_PROMPT)
                .orElseThrow(() -> new IllegalArgumentException("prompt must be provided (--prompt or " + ENV_PROMPT + ")"));

        Optional<String> branch = firstNonBlank(arguments.branch(), ENV_GITHUB_REF);
        Optional<URI> eventsUrl = Optional.ofNullable(arguments.eventsUrl())
                .or(() -> environmentReader.getNonBlank(ENV_EVENTS_URL).map(ConfigLoader::parseUri));

        LogFormat logFormat = Optional.ofNullable(arguments.logFormat())
                .or(() -> environmentReader.getNonBlank(ENV_LOG_FORMAT).map(LogFormat::from))
                .orElse(LogFormat.TEXT);
        int eventQueueCapacity = environmentReader.getNonBlank(ENV_EVENT_QUEUE_CAPACITY)
                .map(value -> parsePositiveInteger(value, ENV_EVENT_QUEUE_CAPACITY))
                .orElse(DEFAULT_EVENT_QUEUE_CAPACITY);

        URI apiBase = environmentReader.getNonBlank(ENV_GITHUB_API_URL)
                .map(ConfigLoader::parseUri)
                .orElse(GitHubContentClient.DEFAULT_API_BASE);
        Duration githubTimeout = Duration.ofSeconds(environmentReader.getNonBlank(ENV_GITHUB_TIMEOUT_SECONDS)
                .map(value -> parsePositiveInteger(value, ENV_GITHUB_TIMEOUT_SECONDS))
                .orElse(DEFAULT_GITHUB_TIMEOUT_SECONDS));
        GitHubConfig gitHubConfig = new GitHubConfig(apiBase, branch, githubTimeout);

        LlmConfig llmConfig = resolveLlmConfig();
        HistoryOrder historyOrder = Optional.ofNullable(arguments.historyOrder())
                .or(() -> environmentReader.getNonBlank(ENV_HISTORY_ORDER).map(HistoryOrder::from))
                .orElseGet(() -> defaultHistoryOrder(llmConfig.provider()));

        Secrets secrets = new Secrets(
                environmentReader.getNonBlank(ENV_GITHUB_TOKEN),
                environmentReader.getNonBlank(ENV_GEMINI_API_KEY),
                environmentReader.getNonBlank(ENV_GROQ_API_KEY));

        return new Config(repository, prompt, eventsUrl, logFormat, arguments.verbose(), historyOrder,
                eventQueueCapacity, gitHubConfig, llmConfig, secrets);
    }

    private LlmConfig resolveLlmConfig() {
        LlmProvider provider = environmentReader.getNonBlank(ENV_LLM_PROVIDER)
                .map(LlmProvider::from)
                .orElse(LlmProvider.OLLAMA);
        String modelName = environmentReader.getNonBlank(ENV_LLM_MODEL)
                .orElse(provider.defaultModel());
        Optional<String> baseUrl = switch (provider) {
            case OLLAMA -> Optional.of(environmentReader.getNonBlank(ENV_OLLAMA_BASE_URL).orElse(DEFAULT_OLLAMA_BASE_URL));
            case GROQ -> Optional.of(DEFAULT_GROQ_BASE_URL);
            case GEMINI -> Optional.empty();
        };
        Duration timeout = Duration.ofSeconds(environmentReader.getNonBlank(ENV_LLM_TIMEOUT_SECONDS)
                .map(value -> parsePositiveInteger(value, ENV_LLM_TIMEOUT_SECONDS))
                .orElse(DEFAULT_LLM_TIMEOUT_SECONDS));
        return new LlmConfig(provider, modelName, baseUrl, timeout);
    }

    /**
     * OpenAI-compatible endpoints reject tool replies that do not follow the assistant message
     * carrying the matching tool calls.
     */
    static HistoryOrder defaultHistoryOrder(LlmProvider provider) {
        return provider == LlmProvider.GROQ ? HistoryOrder.ASSISTANT_FIRST : HistoryOrder.RESULTS_FIRST;
    }

    private Optional<String> firstNonBlank(String cliValue, String envKey) {
        if (cliValue != null && !cliValue.isBlank()) {
            return Optional.of(cliValue.trim());
        }
        return environmentReader.getNonBlank(envKey);
    }

    private static int parsePositiveInteger(String raw, String key) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(key + " must be greater than zero");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static URI parseUri(String raw) {
        try {
            return URI.create(raw);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Invalid URL: " + raw, ex);
        }
    }
}
