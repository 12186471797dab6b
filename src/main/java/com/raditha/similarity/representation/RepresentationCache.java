package com.raditha.similarity.representation;

import com.raditha.similarity.config.TuningConfig;
import com.raditha.similarity.model.FunctionInfo;
import com.raditha.similarity.model.FunctionRepresentation;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Caller owned memo of built representations, keyed by function id.
 * An entry is reused only when the incoming function record and the tuning
 * are equal to the ones it was built from.
 */
public class RepresentationCache {

    private record Entry(FunctionInfo source, TuningConfig tuning, FunctionRepresentation representation) {
    }

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicInteger hits = new AtomicInteger();
    private final AtomicInteger misses = new AtomicInteger();

    public Optional<FunctionRepresentation> lookup(FunctionInfo function, TuningConfig tuning) {
        Entry entry = entries.get(function.id());
        if (entry != null && entry.source().equals(function) && entry.tuning().equals(tuning)) {
            hits.incrementAndGet();
            return Optional.of(entry.representation());
        }
        misses.incrementAndGet();
        return Optional.empty();
    }

    public void store(FunctionInfo function, TuningConfig tuning, FunctionRepresentation representation) {
        entries.put(function.id(), new Entry(function, tuning, representation));
    }

    public int size() {
        return entries.size();
    }

    public int getHits() {
        return hits.get();
    }

    public int getMisses() {
        return misses.get();
    }

    public void clear() {
        entries.clear();
        hits.set(0);
        misses.set(0);
    }
}
