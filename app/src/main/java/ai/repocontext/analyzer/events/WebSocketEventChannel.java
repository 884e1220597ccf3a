package ai.repocontext.analyzer.events;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventChannel} writing text frames to a WebSocket relay.
 *
 * <p>Writes are serialized; the JDK client allows one outstanding text message at a time.
 */
public class WebSocketEventChannel implements EventChannel, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketEventChannel.class);

    private final WebSocket webSocket;
    private final Duration sendTimeout;
    private final Object writeLock = new Object();

    WebSocketEventChannel(WebSocket webSocket, Duration sendTimeout) {
        this.webSocket = Objects.requireNonNull(webSocket, "webSocket");
        this.sendTimeout = Objects.requireNonNull(sendTimeout, "sendTimeout");
    }

    public static WebSocketEventChannel connect(URI uri, Duration timeout) throws IOException {
        Objects.requireNonNull(uri, "uri");
        HttpClient client = HttpClient.newBuilder().connectTimeout(timeout).build();
        try {
            WebSocket socket = client.newWebSocketBuilder()
                    .connectTimeout(timeout)
                    .buildAsync(uri, new LoggingListener())
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            LOGGER.info("Connected event channel to {}", uri);
            return new WebSocketEventChannel(socket, timeout);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while connecting to " + uri, ex);
        } catch (ExecutionException | TimeoutException ex) {
            throw new IOException("Failed to connect event channel to " + uri, ex);
        }
    }

    @Override
    public void send(String message) throws IOException {
        synchronized (writeLock) {
            try {
                webSocket.sendText(message, true).get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while writing event", ex);
            } catch (ExecutionException | TimeoutException ex) {
                throw new IOException("Failed to write event", ex);
            }
        }
    }

    @Override
    public void close() {
        if (!webSocket.isOutputClosed()) {
            webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "done");
        }
    }

    private static final class LoggingListener implements WebSocket.Listener {

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            LOGGER.debug("Relay message: {}", data);
            webSocket.request(1);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            LOGGER.warn("Event channel error: {}", error.getMessage());
        }
    }
}
