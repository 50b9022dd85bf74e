package com.gdin.inspection.lodbook.models;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 实体记录，name 在整个记录库内唯一。
 * properties 保留记录的全部键（包括 name/type/id），顺序与数据文件一致。
 */
@Value
@Builder
public class Record {
    String name;
    String type;
    String id;
    Map<String, PropertyValue> properties;

    public static Record of(Map<?, ?> raw) {
        Map<String, PropertyValue> entries = PropertyValues.entriesOf(raw);
        return Record.builder()
                .name(scalar(entries.get("name")))
                .type(scalar(entries.containsKey("type") ? entries.get("type") : entries.get("@type")))
                .id(scalar(entries.containsKey("id") ? entries.get("id") : entries.get("@id")))
                .properties(entries)
                .build();
    }

    public PropertyValue get(String key) {
        return properties == null ? null : properties.get(key);
    }

    private static String scalar(PropertyValue value) {
        return value instanceof ScalarValue ? ((ScalarValue) value).asString() : null;
    }
}
