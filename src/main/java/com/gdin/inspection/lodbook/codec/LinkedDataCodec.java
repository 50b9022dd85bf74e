package com.gdin.inspection.lodbook.codec;

import java.util.Map;

/**
 * 图谱对象的序列化契约。展开/压缩等语义处理由实现方负责；
 * 图谱不合法时抛出 {@link LinkedDataCodecException}，调用方不做兜底。
 */
public interface LinkedDataCodec {

    /**
     * 组装为 {"@context": context, "@graph": graph}
     */
    Map<String, Object> wrap(Object context, Map<String, Object> graph);

    /**
     * 序列化为 JSON-LD 文本
     */
    String toJsonLd(Object context, Map<String, Object> graph);
}
