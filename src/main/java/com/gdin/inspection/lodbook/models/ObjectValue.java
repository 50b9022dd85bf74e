package com.gdin.inspection.lodbook.models;

import java.util.Map;

/**
 * 带键的属性集合（引用或嵌套对象）。
 */
public interface ObjectValue extends PropertyValue {

    Map<String, PropertyValue> getEntries();

    /**
     * 该对象自身是否已带有 id（"id" 或 "@id"）。
     */
    default boolean hasId() {
        return getEntries().containsKey("id") || getEntries().containsKey("@id");
    }

    default boolean hasType() {
        return getEntries().containsKey("type") || getEntries().containsKey("@type");
    }
}
