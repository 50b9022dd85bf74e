package com.gdin.inspection.lodbook.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 单篇文档内 可见标签 -> 已解析引用 的索引，构建后只读。
 */
public class ReferenceIndex {

    private final Map<String, ResolvedReference> references;

    public ReferenceIndex(Map<String, ResolvedReference> references) {
        this.references = Collections.unmodifiableMap(new LinkedHashMap<>(references));
    }

    public static ReferenceIndex empty() {
        return new ReferenceIndex(Map.of());
    }

    public ResolvedReference get(String label) {
        return references.get(label);
    }

    public boolean isEmpty() {
        return references.isEmpty();
    }

    public int size() {
        return references.size();
    }

    public Map<String, ResolvedReference> asMap() {
        return references;
    }

    /**
     * 按长度降序排列的标签；长度相同时保持出现顺序。
     */
    public List<String> labelsByLengthDesc() {
        List<String> labels = new ArrayList<>(references.keySet());
        labels.sort(Comparator.comparingInt(String::length).reversed());
        return labels;
    }

    /**
     * 文档引用到的实体名（去重，按首次出现顺序）。
     */
    public Set<String> resolvedNames() {
        Set<String> names = new LinkedHashSet<>();
        for (ResolvedReference reference : references.values()) {
            names.add(reference.getName());
        }
        return names;
    }
}
