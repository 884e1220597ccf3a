package ai.repocontext.analyzer.config;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Runtime settings for the chat model provider.
 */
public record LlmConfig(LlmProvider provider, String modelName, Optional<String> baseUrl, Duration timeout) {

    public LlmConfig {
        provider = Objects.requireNonNull(provider, "provider");
        if (modelName == null || modelName.isBlank()) {
            throw new IllegalArgumentException("modelName must not be blank");
        }
        baseUrl = baseUrl == null ? Optional.empty() : baseUrl;
        timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    public String label() {
        return provider.name().toLowerCase(Locale.ROOT) + ":" + modelName;
    }
}
