package com.gdin.inspection.lodbook.models;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 叙事文档的图谱：文档本身（WebPage）及其提到的全部实体图谱。
 */
@Value
@Builder
public class DocumentGraph {
    String id;
    String name;
    @Builder.Default
    String type = MentionedBy.WEB_PAGE;
    @Builder.Default
    List<Map<String, Object>> mentions = new ArrayList<>();

    public boolean mentionsEntity(String entityId) {
        if (entityId == null) return false;
        for (Map<String, Object> mention : mentions) {
            if (entityId.equals(mention.get("@id"))) return true;
        }
        return false;
    }

    public Map<String, Object> toGraph() {
        Map<String, Object> graph = new LinkedHashMap<>();
        graph.put("@id", id);
        graph.put("name", name);
        graph.put("@type", type);
        graph.put("mentions", mentions);
        return graph;
    }
}
