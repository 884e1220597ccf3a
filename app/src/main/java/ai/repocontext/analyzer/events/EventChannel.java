package ai.repocontext.analyzer.events;

import java.io.IOException;

/**
 * Outbound side of an open bidirectional connection to the caller.
 */
@FunctionalInterface
public interface EventChannel {

    void send(String message) throws IOException;
}
