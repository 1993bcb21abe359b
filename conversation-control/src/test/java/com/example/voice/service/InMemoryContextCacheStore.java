package com.example.voice.service;

import com.example.voice.service.cache.ContextCacheStore;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

class InMemoryContextCacheStore implements ContextCacheStore {

    private final Map<String, String> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        entries.put(key, value);
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    boolean contains(String key) {
        return entries.containsKey(key);
    }

    void put(String key, String value) {
        entries.put(key, value);
    }
}
