package com.gdin.inspection.lodbook.models;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 实体的规范化图谱节点。
 * contexts 是页面展示用的提及上下文，不属于图谱本身，不会出现在 {@link #toGraph()} 中。
 */
@Getter
public class GraphNode {

    private final String id;
    private final String type;
    private final String name;
    private final Map<String, Object> properties;

    @Setter
    private String mainEntityOfPage;

    private List<MentionedBy> mentionedBy;

    private final List<Mention> contexts = new ArrayList<>();

    private boolean assembled;

    public GraphNode(String id, String type, String name, Map<String, Object> properties) {
        this.id = id;
        this.type = type;
        this.name = name;
        this.properties = properties == null ? new LinkedHashMap<>() : properties;
    }

    public Object get(String key) {
        return properties.get(key);
    }

    public List<Mention> getContexts() {
        return Collections.unmodifiableList(contexts);
    }

    /**
     * 写入反向引用与上下文，每个实体每次构建只允许调用一次。
     */
    public void merge(List<MentionedBy> mentionedBy, List<Mention> contexts) {
        if (assembled) {
            throw new IllegalStateException("GraphNode 已合并过提及信息: " + name);
        }
        assembled = true;
        if (mentionedBy != null && !mentionedBy.isEmpty()) {
            this.mentionedBy = new ArrayList<>(mentionedBy);
        }
        if (contexts != null) {
            this.contexts.addAll(contexts);
        }
    }

    /**
     * 交给编解码器的（压缩前）图谱对象。
     */
    public Map<String, Object> toGraph() {
        Map<String, Object> graph = new LinkedHashMap<>();
        graph.put("@id", id);
        if (type != null) graph.put("@type", type);
        graph.put("name", name);
        graph.putAll(properties);
        if (mentionedBy != null) {
            List<Map<String, Object>> entries = new ArrayList<>();
            for (MentionedBy m : mentionedBy) {
                entries.add(m.toGraph());
            }
            graph.put("mentionedBy", entries);
        }
        if (mainEntityOfPage != null) graph.put("mainEntityOfPage", mainEntityOfPage);
        return graph;
    }
}
