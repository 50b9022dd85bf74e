package com.gdin.inspection.lodbook.models;

import lombok.Value;

/**
 * 字符串、数字、日期等原样输出的值。
 */
@Value
public class ScalarValue implements PropertyValue {
    Object value;

    @Override
    public Kind kind() {
        return Kind.SCALAR;
    }

    public String asString() {
        return value == null ? null : String.valueOf(value);
    }
}
