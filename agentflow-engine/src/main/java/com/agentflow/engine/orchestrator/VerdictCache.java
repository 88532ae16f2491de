package com.agentflow.engine.orchestrator;

import com.agentflow.core.model.Verdict;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Least-recently-used store of finished verdicts, keyed by pipeline id.
 */
final class VerdictCache {

    private final int capacity;
    private final Map<String, Verdict> entries;

    VerdictCache(int capacity) {
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(Math.min(capacity, 256), 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Verdict> eldest) {
                return size() > VerdictCache.this.capacity;
            }
        };
    }

    synchronized Verdict get(String pipelineId) {
        return entries.get(pipelineId);
    }

    synchronized boolean contains(String pipelineId) {
        return entries.containsKey(pipelineId);
    }

    synchronized void put(String pipelineId, Verdict verdict) {
        entries.put(pipelineId, verdict);
    }

    /**
     * The loader runs outside the lock; if two callers race, the first stored verdict wins.
     */
    Verdict getOrLoad(String pipelineId, Supplier<Verdict> loader) {
        Verdict cached = get(pipelineId);
        if (cached != null) {
            return cached;
        }
        Verdict loaded = loader.get();
        synchronized (this) {
            Verdict raced = entries.putIfAbsent(pipelineId, loaded);
            return raced != null ? raced : loaded;
        }
    }

    synchronized int size() {
        return entries.size();
    }
}
