package ai.repocontext.analyzer.config;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings for the hosting content API.
 */
public record GitHubConfig(URI apiBase, Optional<String> branch, Duration timeout) {

    public GitHubConfig {
        apiBase = Objects.requireNonNull(apiBase, "apiBase");
        branch = branch == null ? Optional.empty() : branch.filter(value -> !value.isBlank());
        timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }
}
