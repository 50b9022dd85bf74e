package com.gdin.inspection.lodbook.registry;

import com.gdin.inspection.lodbook.models.TypeMapping;

import java.util.Optional;

/**
 * 记录类型 -> {图谱类型, 输出集合, 模板} 的只读映射。
 */
public interface TypeRegistry {

    Optional<TypeMapping> lookup(String typeTag);

    default boolean isConfigured(String typeTag) {
        return lookup(typeTag).isPresent();
    }

    /**
     * 图谱类型；未配置时原样返回 typeTag。
     */
    default String graphType(String typeTag) {
        return lookup(typeTag)
                .map(TypeMapping::getType)
                .filter(t -> !t.isBlank())
                .orElse(typeTag);
    }

    /**
     * 输出集合；未配置或缺省时使用 typeTag 本身。
     */
    default String collection(String typeTag) {
        return lookup(typeTag)
                .map(TypeMapping::getCollection)
                .filter(c -> !c.isBlank())
                .orElse(typeTag);
    }
}
