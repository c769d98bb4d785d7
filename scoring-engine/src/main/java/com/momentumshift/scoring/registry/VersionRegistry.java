package com.momentumshift.scoring.registry;

import com.momentumshift.common.exception.UnknownVersionException;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Append-only, in-memory store of immutable versioned entries.
 *
 * <p>Entries are never replaced. A refit registers a new entry and moves the
 * {@code current} pointer; in-flight readers that already resolved a version keep
 * using it unchanged.
 */
public abstract class VersionRegistry<T> {

    private record Slot<T>(int order, T entry) {}

    private final String registryName;
    private final String prefix;
    private final Map<String, Slot<T>> entries = new ConcurrentHashMap<>();
    private final AtomicInteger sequence = new AtomicInteger();
    private final AtomicInteger registered = new AtomicInteger();
    private final AtomicReference<T> current = new AtomicReference<>();

    protected VersionRegistry(String registryName, String prefix, int firstSequence) {
        this.registryName = registryName;
        this.prefix       = prefix;
        this.sequence.set(firstSequence - 1);
    }

    protected abstract String versionOf(T entry);

    /** Reserves the next version label, e.g. {@code weights-v3}. */
    public String nextVersion() {
        String candidate;
        do {
            candidate = prefix + sequence.incrementAndGet();
        } while (entries.containsKey(candidate));
        return candidate;
    }

    /**
     * Adds an entry and makes it current.
     *
     * @throws IllegalStateException if the version is already registered
     */
    public T register(T entry) {
        String version = versionOf(entry);
        Slot<T> slot = new Slot<>(registered.getAndIncrement(), entry);
        if (entries.putIfAbsent(version, slot) != null) {
            throw new IllegalStateException(registryName + " version already registered: " + version);
        }
        current.set(entry);
        return entry;
    }

    public T current() {
        T entry = current.get();
        if (entry == null) {
            throw new IllegalStateException(registryName + " registry is empty");
        }
        return entry;
    }

    /** @throws UnknownVersionException if nothing was registered under {@code version} */
    public T get(String version) {
        Slot<T> slot = version == null ? null : entries.get(version);
        if (slot == null) {
            throw new UnknownVersionException(registryName, version);
        }
        return slot.entry();
    }

    /** {@link #current()} when {@code version} is null or blank, otherwise {@link #get(String)}. */
    public T resolve(String version) {
        return version == null || version.isBlank() ? current() : get(version);
    }

    /** All entries in registration order. */
    public List<T> all() {
        return entries.values().stream()
            .sorted(Comparator.comparingInt(Slot::order))
            .map(Slot::entry)
            .toList();
    }
}
