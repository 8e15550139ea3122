package com.eyelevel.uploadengine.selection;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts how many times each provider has been selected.
 */
@Component
public class LoadCounter {

    private final ConcurrentMap<String, AtomicLong> counters = new ConcurrentHashMap<>();

    public void increment(final String providerId) {
        counters.computeIfAbsent(providerId, id -> new AtomicLong()).incrementAndGet();
    }

    public long get(final String providerId) {
        final AtomicLong counter = counters.get(providerId);
        return counter != null ? counter.get() : 0L;
    }

    public void remove(final String providerId) {
        counters.remove(providerId);
    }

    public void reset() {
        counters.values().forEach(counter -> counter.set(0L));
    }

    public Map<String, Long> snapshot() {
        final Map<String, Long> snapshot = new TreeMap<>();
        counters.forEach((id, counter) -> snapshot.put(id, counter.get()));
        return snapshot;
    }
}
