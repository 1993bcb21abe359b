package com.example.voice.service.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Look-aside store for serialized conversation contexts. Implementations never throw: an
 * unreachable backend behaves like an empty cache.
 */
public interface ContextCacheStore {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    void delete(String key);
}
