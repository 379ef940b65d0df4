package io.trading.marketevent.encoder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trading.marketevent.model.EmittedEvent;
import io.trading.marketevent.model.EventType;
import io.trading.marketevent.model.SourceId;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for EventJsonEncoder.
 */
class EventJsonEncoderTest {

    private static final SourceId ES = new SourceId(3, "ESU25_FUT_CME");

    private final EventJsonEncoder encoder = EventJsonEncoder.getInstance();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testLayout() throws Exception {
        EmittedEvent event = EmittedEvent.builder(EventType.VWAP, ES, 1_735_812_000_500L)
            .field("src", "study")
            .field("i", 12)
            .field("v", 5432.25)
            .build();

        String line = encoder.encode(event);
        JsonNode node = mapper.readTree(line);

        assertFalse(line.contains("\n"));
        assertEquals(1_735_812_000.5, node.get("t").asDouble(), 1e-9);
        assertEquals("ESU25_FUT_CME", node.get("sym").asText());
        assertEquals("vwap", node.get("type").asText());
        assertEquals("study", node.get("src").asText());
        assertEquals(12, node.get("i").asInt());
        assertEquals(5432.25, node.get("v").asDouble(), 0.0);
        assertEquals(3, node.get("chart").asInt());

        List<String> names = new ArrayList<>();
        Iterator<String> it = node.fieldNames();
        it.forEachRemaining(names::add);
        assertEquals(List.of("t", "sym", "type", "src", "i", "v", "chart"), names);
    }

    @Test
    void testNonFiniteFieldIsLeftOut() throws Exception {
        EmittedEvent event = EmittedEvent.builder(EventType.VWAP, ES, 0L)
            .field("v", 100.0)
            .field("up1", Double.NaN)
            .build();

        JsonNode node = mapper.readTree(encoder.encode(event));

        assertTrue(node.has("v"));
        assertFalse(node.has("up1"));
    }

    @Test
    void testDiagnosticCarriesMessage() throws Exception {
        EmittedEvent event = EmittedEvent.diagnostic(EventType.PREVIOUS_SESSION_DIAG, ES, 0L, "insufficient_history");

        JsonNode node = mapper.readTree(encoder.encode(event));

        assertEquals("pvwap_diag", node.get("type").asText());
        assertEquals("insufficient_history", node.get("msg").asText());
        assertTrue(event.type().isDiagnostic());
    }

    @Test
    void testNullFieldIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> EmittedEvent.builder(EventType.VWAP, ES, 0L).field("v", (Object) null));
    }
}
