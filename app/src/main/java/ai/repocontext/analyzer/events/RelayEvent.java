package ai.repocontext.analyzer.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Observability record published to the relay channel.
 */
public record RelayEvent(int kind, String content, Instant createdAt, List<List<String>> tags) {

    public static final int KIND_FILE_VIEWED = 6838;
    static final String ENVELOPE_TYPE = "EVENT";

    public RelayEvent {
        content = Objects.requireNonNull(content, "content");
        createdAt = Objects.requireNonNull(createdAt, "createdAt");
        tags = tags == null ? List.of() : tags.stream().map(List::copyOf).toList();
    }

    public static RelayEvent fileViewed(String path, Instant now) {
        return new RelayEvent(KIND_FILE_VIEWED, "Viewed " + path, now, List.of());
    }

    /**
     * Wraps the event in the relay envelope {@code ["EVENT", {...}]}.
     */
    ArrayNode toEnvelope(ObjectMapper mapper) {
        ObjectNode event = mapper.createObjectNode();
        event.put("kind", kind);
        event.put("content", content);
        event.put("created_at", createdAt.getEpochSecond());
        ArrayNode tagArray = event.putArray("tags");
        for (List<String> tag : tags) {
            ArrayNode entry = tagArray.addArray();
            tag.forEach(entry::add);
        }
        ArrayNode envelope = mapper.createArrayNode();
        envelope.add(ENVELOPE_TYPE);
        envelope.add(event);
        return envelope;
    }
}
