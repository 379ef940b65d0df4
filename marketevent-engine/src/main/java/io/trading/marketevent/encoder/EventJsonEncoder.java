package io.trading.marketevent.encoder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.trading.marketevent.model.EmittedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Encodes events as single-line JSON objects.
 *
 * Layout: {@code t} (epoch seconds), {@code sym}, {@code type}, payload fields in
 * insertion order, then {@code chart}. Non-finite numbers are left out since JSON
 * cannot represent them. Thread-safe and reusable.
 */
public final class EventJsonEncoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventJsonEncoder.class);

    private static final EventJsonEncoder INSTANCE = new EventJsonEncoder();

    private final ObjectMapper objectMapper;

    private EventJsonEncoder() {
        this.objectMapper = new ObjectMapper();
    }

    public static EventJsonEncoder getInstance() {
        return INSTANCE;
    }

    public String encode(EmittedEvent event) {
        try {
            return objectMapper.writeValueAsString(toNode(event));
        } catch (JsonProcessingException e) {
            LOGGER.error("Failed to encode {} event to JSON: {}", event.type(), e.getMessage(), e);
            throw new RuntimeException("Failed to encode event to JSON", e);
        }
    }

    /**
     * Builds the JSON tree of an event without serializing it.
     */
    public ObjectNode toNode(EmittedEvent event) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("t", event.epochSeconds());
        node.put("sym", event.source().symbol());
        node.put("type", event.type().getTag());
        for (Map.Entry<String, Object> field : event.fields().entrySet()) {
            putField(node, field.getKey(), field.getValue());
        }
        node.put("chart", event.source().chart());
        return node;
    }

    private static void putField(ObjectNode node, String name, Object value) {
        if (value instanceof Double) {
            double d = (Double) value;
            if (Double.isFinite(d)) {
                node.put(name, d);
            } else {
                LOGGER.debug("Skipping non-finite field {}", name);
            }
        } else if (value instanceof Long) {
            node.put(name, (Long) value);
        } else if (value instanceof Integer) {
            node.put(name, (Integer) value);
        } else if (value instanceof Boolean) {
            node.put(name, (Boolean) value);
        } else if (value instanceof String) {
            node.put(name, (String) value);
        } else {
            node.putPOJO(name, value);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
