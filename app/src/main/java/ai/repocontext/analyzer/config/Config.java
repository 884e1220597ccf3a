package ai.repocontext.analyzer.config;

import ai.repocontext.analyzer.agent.HistoryOrder;
import java.net.URI;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        String repository,
        String prompt,
        Optional<URI> eventsUrl,
        LogFormat logFormat,
        boolean verbose,
        HistoryOrder historyOrder,
        int eventQueueCapacity,
        GitHubConfig gitHubConfig,
        LlmConfig llmConfig,
        Secrets secrets
) {

    public Config {
        repository = requireNonBlank(repository, "repository");
        prompt = requireNonBlank(prompt, "prompt");
        eventsUrl = eventsUrl == null ? Optional.empty() : eventsUrl;
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
        historyOrder = Objects.requireNonNull(historyOrder, "historyOrder");
        if (eventQueueCapacity < 1) {
            throw new IllegalArgumentException("eventQueueCapacity must be at least 1");
        }
        gitHubConfig = Objects.requireNonNull(gitHubConfig, "gitHubConfig");
        llmConfig = Objects.requireNonNull(llmConfig, "llmConfig");
        secrets = Objects.requireNonNull(secrets, "secrets");
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
