// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime.kernel;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;

import uk.co.farowl.dispatch.runtime.Shape;

/**
 * An immutable, small, ordered collection of {@link CacheEntry}s. A
 * call site holds its current {@code InlineCache} in an atomic
 * reference and replaces it (compare-and-set) with a copy made by
 * {@link #with(CacheEntry, int)} or {@link #without(Predicate)}, so a
 * reader always sees a consistent set of entries without locking.
 */
public final class InlineCache {

    /** The cache with no entries. */
    public static final InlineCache EMPTY =
            new InlineCache(new CacheEntry[0], null);

    private final CacheEntry[] entries;
    /** The entry pushed out when this cache was made, or {@code null}. */
    private final CacheEntry evicted;

    private InlineCache(CacheEntry[] entries, CacheEntry evicted) {
        this.entries = entries;
        this.evicted = evicted;
    }

    /**
     * Find the entry for the given shapes.
     *
     * @param shapes of the operands
     * @return matching entry or {@code null}
     */
    public CacheEntry lookup(Shape[] shapes) {
        for (CacheEntry e : entries) {
            if (e.matches(shapes)) { return e; }
        }
        return null;
    }

    /**
     * Return a cache that contains the given entry. An existing entry
     * for the same shapes is replaced. Otherwise, if the cache is full,
     * the least recently used entry is evicted, and may be retrieved
     * with {@link #evicted()} on the result.
     *
     * @param entry to add
     * @param capacity maximum number of entries
     * @return the new cache
     */
    public InlineCache with(CacheEntry entry, int capacity) {
        for (int i = 0; i < entries.length; i++) {
            if (entries[i].sameShapes(entry)) {
                CacheEntry[] e = entries.clone();
                e[i] = entry;
                return new InlineCache(e, null);
            }
        }
        if (entries.length < capacity) {
            CacheEntry[] e = Arrays.copyOf(entries, entries.length + 1);
            e[entries.length] = entry;
            return new InlineCache(e, null);
        }
        int lru = 0;
        for (int i = 1; i < entries.length; i++) {
            if (entries[i].lastUsed() < entries[lru].lastUsed()) { lru = i; }
        }
        CacheEntry[] e = entries.clone();
        e[lru] = entry;
        return new InlineCache(e, entries[lru]);
    }

    /**
     * Return a cache without the entries matching a condition.
     *
     * @param condition to remove an entry
     * @return the new cache (or this one if nothing is removed)
     */
    public InlineCache without(Predicate<CacheEntry> condition) {
        List<CacheEntry> kept = new ArrayList<>(entries.length);
        for (CacheEntry e : entries) {
            if (!condition.test(e)) { kept.add(e); }
        }
        if (kept.size() == entries.length) { return this; }
        return new InlineCache(kept.toArray(new CacheEntry[0]), null);
    }

    /** @return number of entries */
    public int size() { return entries.length; }

    /** @return the entry evicted to make this cache, or {@code null} */
    public CacheEntry evicted() { return evicted; }

    /** @return the entries, most recently added last */
    public List<CacheEntry> entries() { return List.of(entries); }

    @Override
    public String toString() {
        return "InlineCache" + Arrays.toString(entries);
    }
}
