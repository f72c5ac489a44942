package com.di.querybench.load;

import com.di.querybench.exception.MissingReferenceException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Keys of already-inserted entities, kept in memory so dependent rows can be generated
 * without querying the store per row.
 *
 * <p>Small entities are registered with their full key list; the large ones (tasks,
 * distribution groups) only with their count, since their ids are the dense range
 * {@code 1..count}. Each type is registered once, after its insert phase completes, and
 * is read-only afterwards. One index lives for one schema variant of one reload; it is
 * not shared between threads.
 */
public final class ReferenceIndex {

    private final Map<EntityType, List<EntityRef>> keys   = new EnumMap<>(EntityType.class);
    private final Map<EntityType, Long>            counts = new EnumMap<>(EntityType.class);

    /**
     * Registers the ordered keys of an entity.
     *
     * @throws IllegalStateException when the type was already registered
     */
    public void register(EntityType type, List<EntityRef> refs) {
        requireUnregistered(type);
        List<EntityRef> snapshot = List.copyOf(refs);
        keys.put(type, snapshot);
        counts.put(type, (long) snapshot.size());
    }

    /**
     * Registers an entity by count only; its ids are {@code 1..count}.
     *
     * @throws IllegalStateException when the type was already registered
     */
    public void registerCount(EntityType type, long count) {
        requireUnregistered(type);
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0: " + count);
        }
        counts.put(type, count);
    }

    /**
     * Ordered keys of {@code type}.
     *
     * @throws MissingReferenceException when the type is unregistered, empty, or
     *                                   registered by count only
     */
    public List<EntityRef> resolve(EntityType type) {
        List<EntityRef> refs = keys.get(type);
        if (refs == null) {
            if (counts.containsKey(type)) {
                throw new MissingReferenceException(type, type + " is registered as a key range only");
            }
            throw new MissingReferenceException(type, type + " has not been loaded yet");
        }
        if (refs.isEmpty()) {
            throw new MissingReferenceException(type, type + " was loaded with zero rows");
        }
        return Collections.unmodifiableList(refs);
    }

    /**
     * Number of loaded rows of {@code type}.
     *
     * @throws MissingReferenceException when the type is unregistered or empty
     */
    public long count(EntityType type) {
        Long count = counts.get(type);
        if (count == null) {
            throw new MissingReferenceException(type, type + " has not been loaded yet");
        }
        if (count == 0) {
            throw new MissingReferenceException(type, type + " was loaded with zero rows");
        }
        return count;
    }

    public boolean isRegistered(EntityType type) {
        return counts.containsKey(type);
    }

    private void requireUnregistered(EntityType type) {
        if (counts.containsKey(type)) {
            throw new IllegalStateException(type + " is already registered");
        }
    }
}
