package ai.repocontext.analyzer.agent;

/**
 * How an analysis ended.
 */
public enum AnalysisStatus {
    /** The model stopped requesting tools. */
    COMPLETED,
    /** The turn ceiling was reached while the model still requested tools. */
    ITERATION_LIMIT_REACHED,
    CANCELLED,
    FAILED;

    public boolean isSuccessful() {
        return this == COMPLETED || this == ITERATION_LIMIT_REACHED;
    }
}
