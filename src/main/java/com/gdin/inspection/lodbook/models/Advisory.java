package com.gdin.inspection.lodbook.models;

import lombok.Builder;
import lombok.Value;

/**
 * 构建过程中的非致命问题，汇总后交由外部记录。
 */
@Value
@Builder
public class Advisory {
    AdvisoryKind kind;
    String subject;
    String message;
}
