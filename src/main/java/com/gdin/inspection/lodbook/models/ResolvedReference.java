package com.gdin.inspection.lodbook.models;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ResolvedReference {
    /** 标记中可见的文字 */
    String label;
    String name;
    String collection;
    String url;
}
