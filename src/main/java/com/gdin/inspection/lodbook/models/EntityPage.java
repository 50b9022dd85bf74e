package com.gdin.inspection.lodbook.models;

import lombok.Builder;
import lombok.Data;

/**
 * 一条实体记录对应的页面数据：图谱、展示用图片以及序列化后的 JSON-LD。
 */
@Data
@Builder
public class EntityPage {
    private String name;
    private String collection;
    private String template;
    /** 输出目录，例如 people/james-minahan/ */
    private String dir;
    private GraphNode graph;
    private String imageFile;
    private String jsonld;
}
