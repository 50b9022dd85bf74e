package com.gdin.inspection.lodbook.repository;

import com.gdin.inspection.lodbook.models.PropertyValue;
import com.gdin.inspection.lodbook.models.Record;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RecordLoaderTest {

    private RecordLoader.RecordSource load(String json) throws Exception {
        return new RecordLoader().load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void testLoadGraphDocument() throws Exception {
        RecordLoader.RecordSource source = load("{\"@context\":\"http://schema.org/\",\"@graph\":["
                + "{\"name\":\"Dublin\",\"type\":\"place\",\"@id\":\"urn:dublin\",\"geo\":{\"latitude\":53.35}},"
                + "{\"name\":\"Cork\",\"knows\":[{\"name\":\"Dublin\"},\"x\"]}]}");

        assertEquals("http://schema.org/", source.getContext());
        List<Record> records = source.getRecords();
        assertEquals(2, records.size());
        assertEquals("urn:dublin", records.get(0).getId());
        assertEquals(PropertyValue.Kind.NESTED_OBJECT, records.get(0).get("geo").kind());
        assertEquals(PropertyValue.Kind.LIST, records.get(1).get("knows").kind());
        assertNull(records.get(1).getType());
    }

    @Test
    void testJsonLdKeywords() throws Exception {
        RecordLoader.RecordSource source = load("{\"@graph\":["
                + "{\"@id\":\"https://x.org/jm\",\"@type\":\"person\",\"name\":\"James Minahan\"}]}");

        Record record = source.getRecords().get(0);
        assertEquals("https://x.org/jm", record.getId());
        assertEquals("person", record.getType());
    }

    @Test
    void testDuplicateAndBlankNames() throws Exception {
        RecordLoader.RecordSource source = load("["
                + "{\"name\":\"Dublin\",\"type\":\"place\"},"
                + "{\"name\":\"Dublin\",\"type\":\"person\"},"
                + "{\"type\":\"person\"}]");
        assertNull(source.getContext());

        InMemoryRecordStore store = new InMemoryRecordStore(source.getRecords());
        assertEquals(1, store.listAll().size());
        // 同名以第一条为准
        assertEquals("place", store.findByName("Dublin").orElseThrow().getType());
        assertTrue(store.findByName("Cork").isEmpty());
        assertTrue(store.findByName(null).isEmpty());
    }
}
