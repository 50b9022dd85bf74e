package com.gdin.inspection.lodbook.models;

import lombok.Value;

import java.util.Map;

/**
 * 至少包含 name 的映射，按 name 指向另一条实体记录，可附带 id/type/image 等属性。
 */
@Value
public class ReferenceValue implements ObjectValue {
    Map<String, PropertyValue> entries;

    @Override
    public Kind kind() {
        return Kind.REFERENCE;
    }

    public String getName() {
        PropertyValue name = entries.get("name");
        return name instanceof ScalarValue ? ((ScalarValue) name).asString() : null;
    }
}
