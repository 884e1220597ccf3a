package ai.repocontext.analyzer.summarize;

/**
 * Runtime exception used to propagate summarization failures.
 */
public class SummarizationException extends RuntimeException {

    public SummarizationException(String message) {
        super(message);
    }

    public SummarizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
