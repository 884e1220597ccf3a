package ai.repocontext.analyzer.agent;

import java.util.Objects;

/**
 * Outcome returned to callers of {@link RepositoryAnalyzer}. {@code text} is always human readable.
 */
public record AnalysisResult(AnalysisStatus status, String text, int iterations) {

    public AnalysisResult {
        status = Objects.requireNonNull(status, "status");
        text = Objects.requireNonNullElse(text, "");
    }

    public static AnalysisResult failed(String text) {
        return new AnalysisResult(AnalysisStatus.FAILED, text, 0);
    }
}
