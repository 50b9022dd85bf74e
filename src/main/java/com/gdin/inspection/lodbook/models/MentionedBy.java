package com.gdin.inspection.lodbook.models;

import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 实体图谱中记录的反向引用：哪篇文档提到了它。
 */
@Value
public class MentionedBy {
    public static final String WEB_PAGE = "WebPage";

    String id;
    String name;
    String type;

    public static MentionedBy webPage(String id, String name) {
        return new MentionedBy(id, name, WEB_PAGE);
    }

    public Map<String, Object> toGraph() {
        Map<String, Object> graph = new LinkedHashMap<>();
        graph.put("id", id);
        graph.put("name", name);
        graph.put("type", type);
        return graph;
    }
}
