package ai.repocontext.analyzer.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes "file viewed" events to the caller's channel off the analysis thread.
 *
 * <p>Events are queued to a single worker, so at most one write is in flight. A full queue, a
 * serialization problem or a failed write is logged and the event is dropped; none of them reach the
 * caller of {@link #notifyViewed(String)}.
 */
public class EventNotifier implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventNotifier.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(5);

    private final Optional<EventChannel> channel;
    private final Clock clock;
    private final ThreadPoolExecutor executor;

    public EventNotifier(Optional<EventChannel> channel, int queueCapacity) {
        this(channel, queueCapacity, Clock.systemUTC());
    }

    EventNotifier(Optional<EventChannel> channel, int queueCapacity, Clock clock) {
        this.channel = channel == null ? Optional.empty() : channel;
        this.clock = Objects.requireNonNull(clock, "clock");
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be at least 1");
        }
        this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                runnable -> {
                    Thread thread = new Thread(runnable, "event-notifier");
                    thread.setDaemon(true);
                    return thread;
                },
                (runnable, pool) -> LOGGER.warn("Event queue full or closed; dropping event"));
    }

    public static EventNotifier disabled() {
        return new EventNotifier(Optional.empty(), 1);
    }

    public void notifyViewed(String path) {
        if (channel.isEmpty()) {
            LOGGER.info("Event channel is not set; skipping viewed event for {}", path);
            return;
        }
        RelayEvent event = RelayEvent.fileViewed(path, clock.instant());
        executor.execute(() -> publish(channel.get(), event));
    }

    private void publish(EventChannel target, RelayEvent event) {
        try {
            String message = OBJECT_MAPPER.writeValueAsString(event.toEnvelope(OBJECT_MAPPER));
            target.send(message);
        } catch (JsonProcessingException ex) {
            LOGGER.warn("Failed to serialize event '{}': {}", event.content(), ex.getMessage());
        } catch (IOException | RuntimeException ex) {
            LOGGER.warn("Error writing event '{}' to channel: {}", event.content(), ex.getMessage());
        }
    }

    /**
     * Stops accepting events and waits a bounded time for queued writes.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                int pending = executor.shutdownNow().size();
                LOGGER.warn("Event notifier did not drain in {}; discarded {} pending events", DRAIN_TIMEOUT, pending);
            }
        } catch (InterruptedException ex) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
