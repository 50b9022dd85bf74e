package com.gdin.inspection.lodbook.pojo;

import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * 文本中的一个词元，start/end 为在原文中的字符偏移（end 不含）。
 */
@NoArgsConstructor
@SuperBuilder
@Data
public class Token {
    private String word;
    private int start;
    private int end;
}
