package com.gdin.inspection.lodbook.models;

import lombok.Value;

import java.util.Map;

@Value
public class NestedObjectValue implements ObjectValue {
    Map<String, PropertyValue> entries;

    @Override
    public Kind kind() {
        return Kind.NESTED_OBJECT;
    }
}
