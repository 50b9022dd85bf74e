package com.gdin.inspection.lodbook.registry;

import com.gdin.inspection.lodbook.models.TypeMapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class ConfiguredTypeRegistry implements TypeRegistry {

    private final Map<String, TypeMapping> types;

    public ConfiguredTypeRegistry(Map<String, TypeMapping> types) {
        this.types = types == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(types));
    }

    @Override
    public Optional<TypeMapping> lookup(String typeTag) {
        if (typeTag == null) return Optional.empty();
        return Optional.ofNullable(types.get(typeTag));
    }
}
