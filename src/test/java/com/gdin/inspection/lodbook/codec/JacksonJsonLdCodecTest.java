package com.gdin.inspection.lodbook.codec;

import com.gdin.inspection.lodbook.config.LodBookConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class JacksonJsonLdCodecTest {

    private final JacksonJsonLdCodec codec = new JacksonJsonLdCodec();

    @Test
    void testWrap() {
        Map<String, Object> lod = codec.wrap("http://schema.org/", Map.of("@id", "urn:x"));
        assertEquals(List.of("@context", "@graph"), List.copyOf(lod.keySet()));
        assertTrue(codec.toJsonLd("http://schema.org/", Map.of("@id", "urn:x")).contains("\"@graph\""));
    }

    @Test
    void testMissingInputs() {
        assertThrows(LinkedDataCodecException.class, () -> codec.toJsonLd(null, Map.of("@id", "urn:x")));
        assertThrows(LinkedDataCodecException.class, () -> codec.toJsonLd("http://schema.org/", null));
    }

    @Test
    void testContextResolution() {
        assertEquals("https://custom/", LodBookConfig.resolveContext("https://custom/", "http://data/"));
        assertEquals("http://data/", LodBookConfig.resolveContext(" ", "http://data/"));
        assertEquals("http://schema.org/", LodBookConfig.resolveContext(null, null));
    }
}
