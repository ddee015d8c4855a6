package com.demo.instrument.observability;

import io.grpc.Metadata;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PayloadFormatterTest {

    private final PayloadFormatter formatter = new PayloadFormatter();

    @Test
    void testFormatsBeanAsJson() {
        String rendered = formatter.format(new Order("r-1", 2));

        assertTrue(rendered.startsWith("{"));
        assertTrue(rendered.contains("\"id\":\"r-1\""));
        assertTrue(rendered.contains("\"qty\":2"));
    }

    @Test
    void testStringIsKeptAsIs() {
        assertEquals("hello", formatter.format("hello"));
    }

    @Test
    void testNullPayload() {
        assertEquals("null", formatter.format(null));
    }

    @Test
    void testUnserializableFallsBackToToString() {
        Object opaque = new Object() {
            @Override
            public String toString() {
                return "opaque-message";
            }
        };
        assertEquals("opaque-message", formatter.format(opaque));
    }

    @Test
    void testUnprintablePayloadIsNamedByType() {
        Object broken = new Object() {
            @Override
            public String toString() {
                throw new IllegalStateException("no text");
            }
        };

        String rendered = formatter.format(broken);

        assertTrue(rendered.startsWith(broken.getClass().getName()), rendered);
        assertTrue(rendered.contains("no text"), rendered);
    }

    @Test
    void testServerRequestCarriesMetadata() {
        Metadata headers = new Metadata();
        headers.put(Metadata.Key.of("app", Metadata.ASCII_STRING_MARSHALLER), "checkout");
        headers.put(Metadata.Key.of("trace-bin", Metadata.BINARY_BYTE_MARSHALLER), new byte[] {1, 2});

        String rendered = formatter.format(Map.of("id", "r-1"), headers);

        assertEquals("{\"payload\":{\"id\":\"r-1\"},\"metadata\":{\"app\":\"checkout\"}}", rendered);
    }

    public record Order(String id, int qty) {
    }
}
