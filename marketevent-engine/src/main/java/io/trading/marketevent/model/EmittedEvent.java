package io.trading.marketevent.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, flat record written once to the event log.
 * Field order is preserved so serialized lines stay stable.
 */
public final class EmittedEvent {

    private final long timestampMillis;
    private final EventType type;
    private final SourceId source;
    private final Map<String, Object> fields;

    private EmittedEvent(long timestampMillis, EventType type, SourceId source, Map<String, Object> fields) {
        this.timestampMillis = timestampMillis;
        this.type = type;
        this.source = source;
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static Builder builder(EventType type, SourceId source, long timestampMillis) {
        return new Builder(type, source, timestampMillis);
    }

    /**
     * Creates a diagnostic record carrying only a message.
     */
    public static EmittedEvent diagnostic(EventType type, SourceId source, long timestampMillis, String msg) {
        return builder(type, source, timestampMillis).field("msg", msg).build();
    }

    public long timestampMillis() {
        return timestampMillis;
    }

    /**
     * Event time in epoch seconds, as written to the {@code t} field.
     */
    public double epochSeconds() {
        return timestampMillis / 1000.0;
    }

    public EventType type() {
        return type;
    }

    public SourceId source() {
        return source;
    }

    /**
     * Payload fields, excluding {@code t}, {@code sym}, {@code type} and {@code chart}.
     */
    public Map<String, Object> fields() {
        return fields;
    }

    public Object field(String name) {
        return fields.get(name);
    }

    /**
     * Returns the diagnostic message, or null for data records.
     */
    public String message() {
        Object msg = fields.get("msg");
        return msg == null ? null : msg.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EmittedEvent that = (EmittedEvent) o;
        return timestampMillis == that.timestampMillis
            && type == that.type
            && source.equals(that.source)
            && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestampMillis, type, source, fields);
    }

    @Override
    public String toString() {
        return "EmittedEvent{" +
            "type=" + type +
            ", source=" + source +
            ", t=" + timestampMillis +
            ", fields=" + fields +
            '}';
    }

    /**
     * Builder collecting fields in insertion order.
     */
    public static final class Builder {
        private final EventType type;
        private final SourceId source;
        private final long timestampMillis;
        private final LinkedHashMap<String, Object> fields = new LinkedHashMap<>();

        private Builder(EventType type, SourceId source, long timestampMillis) {
            this.type = Objects.requireNonNull(type, "type cannot be null");
            this.source = Objects.requireNonNull(source, "source cannot be null");
            this.timestampMillis = timestampMillis;
        }

        public Builder field(String name, Object value) {
            Objects.requireNonNull(name, "field name cannot be null");
            if (value == null) {
                throw new IllegalArgumentException("field " + name + " cannot be null");
            }
            fields.put(name, value);
            return this;
        }

        public Builder field(String name, double value) {
            return field(name, Double.valueOf(value));
        }

        public Builder field(String name, long value) {
            return field(name, Long.valueOf(value));
        }

        public Builder field(String name, int value) {
            return field(name, Integer.valueOf(value));
        }

        public EmittedEvent build() {
            return new EmittedEvent(timestampMillis, type, source, new LinkedHashMap<>(fields));
        }
    }
}
