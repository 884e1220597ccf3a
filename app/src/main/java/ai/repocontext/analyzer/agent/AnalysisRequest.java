package ai.repocontext.analyzer.agent;

import ai.repocontext.analyzer.repository.RepositoryRef;
import java.util.Objects;
import java.util.Optional;

/**
 * Inputs of one conversation run.
 */
public record AnalysisRequest(RepositoryRef repository, String prompt, Optional<String> branch) {

    public AnalysisRequest {
        Objects.requireNonNull(repository, "repository");
        if (repository.isEmpty()) {
            throw new IllegalArgumentException("repository must have an owner and a name");
        }
        prompt = Objects.requireNonNullElse(prompt, "");
        branch = branch == null ? Optional.empty() : branch.filter(value -> !value.isBlank());
    }
}
