package com.peerwarden.api.saga;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Values handed from one saga step to later steps and to compensations.
 */
public class SagaContext {

    private final Map<String, Object> values = new HashMap<>();

    public void put(String key, Object value) {
        values.put(key, value);
    }

    public <T> T get(String key, Class<T> type) {
        Object value = values.get(key);
        if (value == null) {
            throw new IllegalStateException("Saga context has no value for '" + key + "'");
        }
        return type.cast(value);
    }

    public <T> Optional<T> find(String key, Class<T> type) {
        return Optional.ofNullable(values.get(key)).map(type::cast);
    }
}
