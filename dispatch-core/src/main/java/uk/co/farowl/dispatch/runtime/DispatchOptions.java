// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime;

import java.util.Properties;

/**
 * Tuning of the call sites created by a {@link DispatchEngine}. Options
 * are immutable: the {@code with*} methods return a modified copy. The
 * defaults come from system properties, read once:
 * <table class="striped">
 * <caption>System properties</caption>
 * <tr><th>Property</th><th>Default</th><th>Meaning</th></tr>
 * <tr><td>{@value #INLINE_CAPACITY}</td><td>4</td>
 * <td>entries in the inline cache of a site (1 to 4)</td></tr>
 * <tr><td>{@value #PROMOTION_THRESHOLD}</td><td>8</td>
 * <td>evictions after which a site uses its polymorphic table (0 means
 * never)</td></tr>
 * <tr><td>{@value #CACHE_FAILURES}</td><td>true</td>
 * <td>whether permanent binding failures are cached</td></tr>
 * </table>
 */
public final class DispatchOptions {

    /** Name of the property giving the inline cache capacity. */
    public static final String INLINE_CAPACITY =
            "uk.co.farowl.dispatch.inlineCapacity";
    /** Name of the property giving the promotion threshold. */
    public static final String PROMOTION_THRESHOLD =
            "uk.co.farowl.dispatch.promotionThreshold";
    /** Name of the property enabling failure caching. */
    public static final String CACHE_FAILURES =
            "uk.co.farowl.dispatch.cacheFailures";

    /** Largest allowed inline cache capacity. */
    public static final int MAX_INLINE_CAPACITY = 4;

    private final int inlineCapacity;
    private final int promotionThreshold;
    private final boolean cacheFailures;

    /**
     * Create options explicitly.
     *
     * @param inlineCapacity entries in the inline cache (1 to 4)
     * @param promotionThreshold evictions before promotion (0 means
     *     never)
     * @param cacheFailures whether to cache permanent failures
     * @throws IllegalArgumentException if a value is out of range
     */
    public DispatchOptions(int inlineCapacity, int promotionThreshold,
            boolean cacheFailures) throws IllegalArgumentException {
        if (inlineCapacity < 1 || inlineCapacity > MAX_INLINE_CAPACITY) {
            throw new IllegalArgumentException(String.format(
                    "inline capacity must be 1 to %d, not %d",
                    MAX_INLINE_CAPACITY, inlineCapacity));
        } else if (promotionThreshold < 0) {
            throw new IllegalArgumentException(
                    "promotion threshold must not be negative, not "
                            + promotionThreshold);
        }
        this.inlineCapacity = inlineCapacity;
        this.promotionThreshold = promotionThreshold;
        this.cacheFailures = cacheFailures;
    }

    private static class DefaultHolder {
        static final DispatchOptions DEFAULT =
                fromProperties(System.getProperties());
    }

    /**
     * The options given by the system properties (or their defaults)
     * when first requested.
     *
     * @return default options
     */
    public static DispatchOptions defaults() { return DefaultHolder.DEFAULT; }

    /**
     * Create options from a set of properties, named as the system
     * properties are. Absent properties take their defaults.
     *
     * @param props to read
     * @return the options
     * @throws IllegalArgumentException if a value is malformed or out of
     *     range
     */
    public static DispatchOptions fromProperties(Properties props)
            throws IllegalArgumentException {
        return new DispatchOptions(intProperty(props, INLINE_CAPACITY, 4),
                intProperty(props, PROMOTION_THRESHOLD, 8),
                booleanProperty(props, CACHE_FAILURES, true));
    }

    /** @return entries in the inline cache of a site */
    public int inlineCapacity() { return inlineCapacity; }

    /** @return evictions before promotion (0 means never) */
    public int promotionThreshold() { return promotionThreshold; }

    /** @return whether permanent failures are cached */
    public boolean cacheFailures() { return cacheFailures; }

    /**
     * @param capacity new inline capacity
     * @return a copy with that capacity
     */
    public DispatchOptions withInlineCapacity(int capacity) {
        return new DispatchOptions(capacity, promotionThreshold,
                cacheFailures);
    }

    /**
     * @param threshold new promotion threshold
     * @return a copy with that threshold
     */
    public DispatchOptions withPromotionThreshold(int threshold) {
        return new DispatchOptions(inlineCapacity, threshold, cacheFailures);
    }

    /**
     * @param cache whether to cache permanent failures
     * @return a copy with that setting
     */
    public DispatchOptions withCacheFailures(boolean cache) {
        return new DispatchOptions(inlineCapacity, promotionThreshold, cache);
    }

    private static int intProperty(Properties props, String name, int dflt) {
        String v = props.getProperty(name);
        if (v == null) { return dflt; }
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format(
                    "property %s is not an integer: '%s'", name, v), e);
        }
    }

    private static boolean booleanProperty(Properties props, String name,
            boolean dflt) {
        String v = props.getProperty(name);
        if (v == null) { return dflt; }
        switch (v.trim().toLowerCase()) {
            case "true":
                return true;
            case "false":
                return false;
            default:
                throw new IllegalArgumentException(String.format(
                        "property %s is not a boolean: '%s'", name, v));
        }
    }

    @Override
    public String toString() {
        return String.format(
                "DispatchOptions[inlineCapacity=%d, promotionThreshold=%d, "
                        + "cacheFailures=%b]",
                inlineCapacity, promotionThreshold, cacheFailures);
    }
}
