package com.gdin.inspection.lodbook.index.pipeline.context;

import lombok.Getter;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Getter
public class PipelineRunContext {

    private final PipelineRunStats stats = new PipelineRunStats();
    private final Map<String, Object> state = new ConcurrentHashMap<>();

    public void put(String key, Object value) { state.put(key, value); }

    @SuppressWarnings("unchecked")
    public <T> T get(String key) { return (T) state.get(key); }

    @SuppressWarnings("unchecked")
    public <T> T getOrDefault(String key, T defaultValue) {
        Object value = state.get(key);
        return value == null ? defaultValue : (T) value;
    }

    public Set<String> keySet() {
        return state.keySet();
    }

    public Object remove(Object key) {
        return state.remove(key);
    }
}
