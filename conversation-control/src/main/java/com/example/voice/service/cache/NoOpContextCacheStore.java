package com.example.voice.service.cache;

import java.time.Duration;
import java.util.Optional;

public class NoOpContextCacheStore implements ContextCacheStore {

    @Override
    public Optional<String> get(String key) {
        return Optional.empty();
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        // caching disabled
    }

    @Override
    public void delete(String key) {
        // caching disabled
    }
}
