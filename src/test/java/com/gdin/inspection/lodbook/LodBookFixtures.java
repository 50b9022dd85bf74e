package com.gdin.inspection.lodbook;

import com.gdin.inspection.lodbook.models.BuildContext;
import com.gdin.inspection.lodbook.models.TypeMapping;
import com.gdin.inspection.lodbook.registry.ConfiguredTypeRegistry;
import com.gdin.inspection.lodbook.repository.InMemoryRecordStore;
import com.gdin.inspection.lodbook.repository.RecordLoader;
import com.gdin.inspection.lodbook.state.InMemoryAdvisoryStore;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单元测试共用的构建上下文：站点 https://example.org/lodbook，person/place/image 三种类型。
 */
public final class LodBookFixtures {

    public static final String SITE_URL = "https://example.org";
    public static final String BASE_URL = "/lodbook";

    public static final String RECORDS = "["
            + "{\"name\":\"James Minahan\",\"type\":\"person\",\"birthPlace\":{\"name\":\"Dublin\"},"
            + "\"image\":{\"name\":\"Minahan Portrait\"}},"
            + "{\"name\":\"James\",\"type\":\"person\"},"
            + "{\"name\":\"Dublin\",\"type\":\"place\"},"
            + "{\"name\":\"Art\",\"type\":\"place\"},"
            + "{\"name\":\"Minahan Portrait\",\"type\":\"image\",\"image\":\"minahan-portrait.jpg\"},"
            + "{\"name\":\"Old Ledger\",\"type\":\"manuscript\"}"
            + "]";

    private LodBookFixtures() {
    }

    public static Map<String, TypeMapping> dataTypes() {
        Map<String, TypeMapping> types = new LinkedHashMap<>();
        types.put("person", new TypeMapping("Person", "people", "person"));
        types.put("place", new TypeMapping("Place", "places", "place"));
        types.put("image", new TypeMapping("ImageObject", "images", "image"));
        return types;
    }

    public static BuildContext context() {
        return context(RECORDS);
    }

    public static BuildContext context(String recordsJson) {
        RecordLoader.RecordSource source;
        try {
            source = new RecordLoader().load(new ByteArrayInputStream(recordsJson.getBytes(StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return BuildContext.builder()
                .recordStore(new InMemoryRecordStore(source.getRecords()))
                .typeRegistry(new ConfiguredTypeRegistry(dataTypes()))
                .advisories(new InMemoryAdvisoryStore())
                .siteUrl(SITE_URL)
                .baseUrl(BASE_URL)
                .build();
    }
}
