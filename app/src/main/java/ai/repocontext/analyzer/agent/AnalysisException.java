package ai.repocontext.analyzer.agent;

/**
 * Fatal failure that aborts a whole analysis: the initial folder fetch or a chat call failed.
 */
public class AnalysisException extends RuntimeException {

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
