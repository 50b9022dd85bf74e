package com.gdin.inspection.lodbook.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.gdin.inspection.lodbook.util.IOUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
public class JacksonJsonLdCodec implements LinkedDataCodec {

    @Override
    public Map<String, Object> wrap(Object context, Map<String, Object> graph) {
        if (graph == null) {
            throw new LinkedDataCodecException("graph 不能为空");
        }
        if (context == null) {
            throw new LinkedDataCodecException("@context 不能为空: " + graph.get("@id"));
        }
        Map<String, Object> lod = new LinkedHashMap<>();
        lod.put("@context", context);
        lod.put("@graph", graph);
        return lod;
    }

    @Override
    public String toJsonLd(Object context, Map<String, Object> graph) {
        Map<String, Object> lod = wrap(context, graph);
        try {
            return IOUtil.jsonSerializeWithNoType(lod, true);
        } catch (JsonProcessingException e) {
            throw new LinkedDataCodecException("JSON-LD 序列化失败: " + graph.get("@id"), e);
        }
    }
}
