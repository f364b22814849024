// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime.kernel;

import java.util.Arrays;
import java.util.List;

import uk.co.farowl.dispatch.runtime.Binding;
import uk.co.farowl.dispatch.runtime.Shape;

/**
 * A {@link Binding} cached at a call site against the tuple of operand
 * shapes for which it was bound. The entry is immutable apart from the
 * time it was last used, which orders entries for eviction.
 */
public final class CacheEntry {

    private final Shape[] shapes;
    private final Binding binding;
    private volatile long lastUsed;

    /**
     * Create an entry.
     *
     * @param shapes of the operands (not copied)
     * @param binding valid for those shapes
     * @param stamp the time of creation (from the site's clock)
     */
    public CacheEntry(Shape[] shapes, Binding binding, long stamp) {
        this.shapes = shapes;
        this.binding = binding;
        this.lastUsed = stamp;
    }

    /**
     * Whether this entry is for exactly the given shapes.
     *
     * @param s shapes of the operands
     * @return {@code true} if it matches
     */
    public boolean matches(Shape[] s) {
        if (s.length != shapes.length) { return false; }
        for (int i = 0; i < s.length; i++) {
            // Usually the same object, but a custom shape need not be
            Shape a = shapes[i], b = s[i];
            if (a != b && !a.equals(b)) { return false; }
        }
        return true;
    }

    /**
     * Whether this entry is for the same shapes as another.
     *
     * @param other entry
     * @return {@code true} if the shapes match
     */
    boolean sameShapes(CacheEntry other) { return matches(other.shapes); }

    /** @return the cached binding */
    public Binding binding() { return binding; }

    /** @return the shapes (as an unmodifiable list) */
    public List<Shape> shapes() { return Arrays.asList(shapes.clone()); }

    /** @return the time this entry was last used */
    public long lastUsed() { return lastUsed; }

    /**
     * Note a use. Races between threads may lose an update, which only
     * makes eviction slightly less fair.
     *
     * @param stamp the time (from the site's clock)
     */
    public void touch(long stamp) {
        if (stamp > lastUsed) { lastUsed = stamp; }
    }

    @Override
    public String toString() {
        return String.format("CacheEntry[%s -> %s]", Arrays.toString(shapes),
                binding);
    }
}
