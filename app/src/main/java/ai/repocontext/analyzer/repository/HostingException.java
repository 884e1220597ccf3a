package ai.repocontext.analyzer.repository;

import java.util.Objects;

/**
 * Runtime exception raised by the hosting content collaborator.
 */
public class HostingException extends RuntimeException {

    public enum Kind {
        NOT_FOUND,
        CREDENTIAL_MISSING,
        DECODE_ERROR,
        TRANSPORT_ERROR
    }

    private final Kind kind;

    public HostingException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public HostingException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind kind() {
        return kind;
    }

    public boolean isCredentialMissing() {
        return kind == Kind.CREDENTIAL_MISSING;
    }
}
