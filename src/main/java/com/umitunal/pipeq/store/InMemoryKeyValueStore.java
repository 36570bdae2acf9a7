package com.umitunal.pipeq.store;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local store backed by a sorted concurrent map.
 * Expired keys are dropped lazily when they are read or listed.
 */
public class InMemoryKeyValueStore implements KeyValueStore {
    private final ConcurrentSkipListMap<String, ExpiringValue> entries = new ConcurrentSkipListMap<>();
    private final Clock clock;

    public InMemoryKeyValueStore() {
        this(Clock.systemUTC());
    }

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void put(String key, byte[] value, Duration ttl) {
        KeyValueStore.checkTtl(ttl);
        entries.put(key, new ExpiringValue(expiryFor(ttl), value.clone()));
    }

    @Override
    public Optional<byte[]> get(String key) {
        ExpiringValue stored = entries.get(key);
        if (stored == null) {
            return Optional.empty();
        }
        if (stored.isExpired(clock.millis())) {
            entries.remove(key, stored);
            return Optional.empty();
        }
        return Optional.of(stored.getValue().clone());
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    @Override
    public List<String> list(String prefix, int limit) {
        List<String> keys = new ArrayList<>();
        long now = clock.millis();
        ConcurrentNavigableMap<String, ExpiringValue> tail = entries.tailMap(prefix, true);

        for (Map.Entry<String, ExpiringValue> entry : tail.entrySet()) {
            if (keys.size() >= limit || !entry.getKey().startsWith(prefix)) {
                break;
            }
            if (entry.getValue().isExpired(now)) {
                entries.remove(entry.getKey(), entry.getValue());
                continue;
            }
            keys.add(entry.getKey());
        }
        return keys;
    }

    @Override
    public boolean putIfAbsent(String key, byte[] value, Duration ttl) {
        KeyValueStore.checkTtl(ttl);
        AtomicBoolean created = new AtomicBoolean(false);
        long now = clock.millis();

        entries.compute(key, (k, existing) -> {
            if (existing != null && !existing.isExpired(now)) {
                return existing;
            }
            created.set(true);
            return new ExpiringValue(expiryFor(ttl), value.clone());
        });
        return created.get();
    }

    /**
     * Number of live keys, for tests and diagnostics.
     */
    public int size() {
        long now = clock.millis();
        entries.values().removeIf(v -> v.isExpired(now));
        return entries.size();
    }

    @Override
    public void close() {
        entries.clear();
    }

    private long expiryFor(Duration ttl) {
        return clock.millis() + ttl.toMillis();
    }
}
