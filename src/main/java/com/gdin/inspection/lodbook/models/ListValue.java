package com.gdin.inspection.lodbook.models;

import lombok.Value;

import java.util.List;

@Value
public class ListValue implements PropertyValue {
    List<PropertyValue> items;

    @Override
    public Kind kind() {
        return Kind.LIST;
    }
}
