package com.gdin.inspection.lodbook.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 将 Jackson 读出的原始 Map/List 树归类为 {@link PropertyValue}。
 */
public final class PropertyValues {

    private PropertyValues() {
    }

    public static PropertyValue of(Object raw) {
        if (raw instanceof Map) {
            Map<String, PropertyValue> entries = entriesOf((Map<?, ?>) raw);
            PropertyValue name = entries.get("name");
            if (name instanceof ScalarValue && ((ScalarValue) name).getValue() instanceof String) {
                return new ReferenceValue(entries);
            }
            return new NestedObjectValue(entries);
        }
        if (raw instanceof List) {
            List<PropertyValue> items = new ArrayList<>();
            for (Object item : (List<?>) raw) {
                items.add(of(item));
            }
            return new ListValue(Collections.unmodifiableList(items));
        }
        return new ScalarValue(raw);
    }

    public static Map<String, PropertyValue> entriesOf(Map<?, ?> raw) {
        Map<String, PropertyValue> entries = new LinkedHashMap<>();
        raw.forEach((k, v) -> entries.put(String.valueOf(k), of(v)));
        return Collections.unmodifiableMap(entries);
    }
}
