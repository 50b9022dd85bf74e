package com.gdin.inspection.lodbook.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 数据类型配置：记录 type -> 图谱类型 / 输出集合 / 页面模板。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TypeMapping implements Serializable {
    private String type;
    private String collection;
    private String template;
}
