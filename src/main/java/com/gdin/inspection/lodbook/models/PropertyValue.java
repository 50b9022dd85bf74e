package com.gdin.inspection.lodbook.models;

/**
 * 实体记录中的属性值：标量、引用、嵌套对象或列表之一。
 */
public interface PropertyValue {

    enum Kind {
        SCALAR,
        REFERENCE,
        NESTED_OBJECT,
        LIST
    }

    Kind kind();
}
