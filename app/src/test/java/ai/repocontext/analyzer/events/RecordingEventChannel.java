package ai.repocontext.analyzer.events;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Channel keeping every message it receives. Written from the notifier thread.
 */
public final class RecordingEventChannel implements EventChannel {

    private final List<String> messages = new CopyOnWriteArrayList<>();

    @Override
    public void send(String message) throws IOException {
        messages.add(message);
    }

    public List<String> messages() {
        return messages;
    }
}
