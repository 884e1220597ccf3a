package ai.repocontext.analyzer.config;

import java.util.Optional;

/**
 * Credentials for the hosting API and the remote model providers.
 */
public record Secrets(Optional<String> githubToken, Optional<String> geminiApiKey, Optional<String> groqApiKey) {

    public Secrets {
        githubToken = normalize(githubToken);
        geminiApiKey = normalize(geminiApiKey);
        groqApiKey = normalize(groqApiKey);
    }

    public static Secrets none() {
        return new Secrets(Optional.empty(), Optional.empty(), Optional.empty());
    }

    public boolean hasGithubToken() {
        return githubToken.isPresent();
    }

    private static Optional<String> normalize(Optional<String> value) {
        return value == null ? Optional.empty() : value.filter(s -> !s.isBlank());
    }

    @Override
    public String toString() {
        return "Secrets[githubToken=" + mask(githubToken)
                + ", geminiApiKey=" + mask(geminiApiKey)
                + ", groqApiKey=" + mask(groqApiKey) + "]";
    }

    private static String mask(Optional<String> value) {
        return value.isPresent() ? "****" : "<unset>";
    }
}
