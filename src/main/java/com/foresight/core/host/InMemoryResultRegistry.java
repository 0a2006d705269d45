package com.foresight.core.host;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryResultRegistry implements ResultRegistry {

    private final Map<String, CapabilityResult> results = new ConcurrentHashMap<>();

    @Override
    public void put(String correlationId, CapabilityResult result) {
        results.put(correlationId, result);
    }

    @Override
    public Optional<CapabilityResult> get(String correlationId) {
        return Optional.ofNullable(results.get(correlationId));
    }

    @Override
    public void remove(String correlationId) {
        results.remove(correlationId);
    }

    int size() {
        return results.size();
    }
}
