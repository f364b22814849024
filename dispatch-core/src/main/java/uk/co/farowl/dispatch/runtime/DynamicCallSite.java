// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime;

import static java.lang.invoke.MethodType.methodType;
import static uk.co.farowl.dispatch.support.JavaClassShorthand.O;
import static uk.co.farowl.dispatch.support.JavaClassShorthand.OA;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.dispatch.runtime.kernel.CacheEntry;
import uk.co.farowl.dispatch.runtime.kernel.InlineCache;
import uk.co.farowl.dispatch.support.EngineError;

/**
 * A {@code DynamicCallSite} stands for one place in a program where an
 * operation is performed dynamically, and caches the {@link Binding}s
 * made there against the shapes of the operands they were made for.
 * <p>
 * On each {@link #execute(Object...) execution}, the site computes the
 * shapes of the operands and looks for a matching entry, first in a
 * small inline cache (compared in order), then in a polymorphic table
 * if the site has been promoted. A hit invokes the cached binding
 * directly. A miss asks the {@link Binder} for a binding, installs it,
 * and invokes it.
 * <p>
 * The inline cache is an immutable snapshot replaced atomically, so
 * threads may execute the site concurrently without locking. Threads
 * that miss on the same shapes at the same time each bind and install
 * an entry: the last to install replaces the others.
 * <p>
 * When the inline cache has had to evict entries
 * {@link DispatchOptions#promotionThreshold()} times, the site is
 * deemed megamorphic. It keeps the inline cache as it is and adds new
 * entries to an unbounded concurrent table.
 */
public class DynamicCallSite {

    /** Logger for call site activity. */
    static final Logger logger = LoggerFactory.getLogger(DynamicCallSite.class);

    /** The state of a site with respect to one tuple of shapes. */
    public enum State {
        /** No binding is cached for the shapes. */
        UNBOUND,
        /** A binding is cached for the shapes. */
        BOUND,
        /** A permanent failure is cached for the shapes. */
        PERMANENTLY_FAILING
    }

    /**
     * Counts of activity at a site.
     *
     * @param hits executions that found a cached binding
     * @param misses executions that had to bind
     * @param binds successful binds (including retries)
     * @param evictions entries pushed out of the inline cache
     * @param promoted whether the site uses its polymorphic table
     */
    public record Stats(long hits, long misses, long binds, long evictions,
            boolean promoted) {}

    private static final MethodHandle EXECUTE;

    static {
        try {
            EXECUTE = MethodHandles.lookup().findVirtual(
                    DynamicCallSite.class, "execute", methodType(O, OA));
        } catch (ReflectiveOperationException e) {
            throw EngineError.staticInitError(e, DynamicCallSite.class);
        }
    }

    private final Operation operation;
    private final Binder binder;
    private final DispatchOptions options;

    private final AtomicReference<InlineCache> inline =
            new AtomicReference<>(InlineCache.EMPTY);
    /** Created on promotion and discarded on invalidation. */
    private volatile Map<List<Shape>, CacheEntry> polymorphic;

    /** Source of use stamps for the cache entries. */
    private final AtomicLong clock = new AtomicLong();
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder binds = new LongAdder();
    private final AtomicLong evictions = new AtomicLong();
    /** Evictions since the site was last invalidated. */
    private final AtomicInteger pressure = new AtomicInteger();

    /**
     * Create a call site for the given operation.
     *
     * @param operation to perform at the site
     * @param binder to bind the operation on a cache miss
     * @param options tuning of the cache
     */
    public DynamicCallSite(Operation operation, Binder binder,
            DispatchOptions options) {
        this.operation = Objects.requireNonNull(operation, "operation");
        this.binder = Objects.requireNonNull(binder, "binder");
        this.options = Objects.requireNonNull(options, "options");
    }

    /** @return the operation performed at this site */
    public Operation operation() { return operation; }

    /**
     * Perform the operation on the given operands (receiver first).
     *
     * @param values the operands
     * @return the result of the operation
     * @throws DispatchError if the operation cannot be bound
     * @throws Throwable from the bound operation itself
     */
    public Object execute(Object... values) throws DispatchError, Throwable {
        checkArity(values);
        Shape[] shapes = shapesOf(values);
        CacheEntry entry = find(shapes);
        if (entry != null) {
            hits.increment();
            touch(entry);
            return entry.binding().invoke(values);
        }
        misses.increment();
        return bindAndInstall(values).invoke(values);
    }

    /**
     * Report the state of this site for operands of the shapes of
     * those given.
     *
     * @param values example operands
     * @return the state for their shapes
     */
    public State state(Object... values) {
        checkArity(values);
        CacheEntry entry = find(shapesOf(values));
        if (entry == null) {
            return State.UNBOUND;
        } else if (entry.binding().isFailure()) {
            return State.PERMANENTLY_FAILING;
        } else {
            return State.BOUND;
        }
    }

    /**
     * Remove the cached permanent failures, so the next execution for
     * those shapes binds again.
     */
    public void clearFailures() {
        InlineCache current, next;
        do {
            current = inline.get();
            next = current.without(e -> e.binding().isFailure());
        } while (!inline.compareAndSet(current, next));
        Map<List<Shape>, CacheEntry> poly = polymorphic;
        if (poly != null) {
            poly.values().removeIf(e -> e.binding().isFailure());
        }
    }

    /** Discard every cached binding and return to the inline cache. */
    public void invalidate() {
        inline.set(InlineCache.EMPTY);
        polymorphic = null;
        pressure.set(0);
        logger.atDebug().addArgument(operation::describe)
                .log("Invalidated site for {}");
    }

    /** @return counts of activity at this site */
    public Stats stats() {
        return new Stats(hits.sum(), misses.sum(), binds.sum(),
                evictions.get(), polymorphic != null);
    }

    /**
     * Return a handle that executes this site, taking the operands as
     * separate {@code Object} arguments.
     *
     * @return handle of type {@code (Object, ...)Object}
     */
    public MethodHandle dynamicInvoker() {
        int n = operation.operandCount();
        return EXECUTE.bindTo(this).asFixedArity().asCollector(OA, n);
    }

    /**
     * The entries currently cached, inline then polymorphic.
     *
     * @return the entries
     */
    List<CacheEntry> entries() {
        List<CacheEntry> all = new ArrayList<>(inline.get().entries());
        Map<List<Shape>, CacheEntry> poly = polymorphic;
        if (poly != null) { all.addAll(poly.values()); }
        return all;
    }

    /** @return the type of {@link #dynamicInvoker()} */
    public MethodType type() {
        return MethodType.genericMethodType(operation.operandCount());
    }

    /**
     * Find the entry for the shapes in the inline cache, then in the
     * polymorphic table (if there is one).
     */
    private CacheEntry find(Shape[] shapes) {
        CacheEntry entry = inline.get().lookup(shapes);
        if (entry == null) {
            Map<List<Shape>, CacheEntry> poly = polymorphic;
            if (poly != null) { entry = poly.get(Arrays.asList(shapes)); }
        }
        return entry;
    }

    /**
     * Bind the operation for the shapes of the operands and install
     * the binding (or the sentinel for a permanent failure). The shapes
     * of the operands are checked again when the bind completes, since
     * a meta-object may change its shape key: if one has, the bind is
     * retried once.
     */
    private Binding bindAndInstall(Object[] values) throws DispatchError {
        for (int attempt = 0;; attempt++) {
            Envelope[] operands = Envelope.wrapAll(values);
            Shape[] shapes = new Shape[operands.length];
            for (int i = 0; i < shapes.length; i++) {
                shapes[i] = operands[i].shape();
            }

            Binding binding;
            try {
                binding = binder.bind(operation, operands);
            } catch (BindingFailure f) {
                if (!f.isPermanent() || !options.cacheFailures()) {
                    throw f.toError();
                }
                binding = Binding.permanentFailure(f);
                install(shapes, binding);
                logger.atDebug().setMessage("Cached failure {} at site for {}")
                        .addArgument(f::getKind)
                        .addArgument(operation::describe).log();
                return binding;
            }
            binds.increment();

            if (Arrays.equals(shapes, shapesOf(values))) {
                install(shapes, binding);
                logger.atDebug().setMessage("Bound {} for {} ({})")
                        .addArgument(operation::describe)
                        .addArgument(() -> Arrays.toString(shapes))
                        .addArgument(binding::origin).log();
                return binding;
            } else if (attempt > 0) {
                throw new DispatchError(
                        DispatchError.Kind.SHAPE_CHANGED_DURING_BIND,
                        operation, Arrays.asList(shapes),
                        "shape changed again on retry");
            }
            logger.atDebug().setMessage("Shape changed binding {}: retrying")
                    .addArgument(operation::describe).log();
        }
    }

    /** Mark an entry used, unless it is already the most recent. */
    private void touch(CacheEntry entry) {
        if (entry.lastUsed() != clock.get()) {
            entry.touch(clock.incrementAndGet());
        }
    }

    /** Install an entry for the shapes, in whichever cache is in use. */
    private void install(Shape[] shapes, Binding binding) {
        CacheEntry entry =
                new CacheEntry(shapes, binding, clock.incrementAndGet());
        Map<List<Shape>, CacheEntry> poly = polymorphic;
        if (poly != null) {
            poly.put(List.of(shapes), entry);
            return;
        }

        InlineCache current, next;
        do {
            current = inline.get();
            next = current.with(entry, options.inlineCapacity());
        } while (!inline.compareAndSet(current, next));

        CacheEntry evicted = next.evicted();
        if (evicted != null) {
            evictions.incrementAndGet();
            int n = pressure.incrementAndGet();
            logger.atDebug().setMessage("Evicted {} at site for {}")
                    .addArgument(evicted::shapes)
                    .addArgument(operation::describe).log();
            int threshold = options.promotionThreshold();
            if (threshold > 0 && n >= threshold) { promote(); }
        }
    }

    /** Start using the polymorphic table for new entries. */
    private synchronized void promote() {
        if (polymorphic == null) {
            polymorphic = new ConcurrentHashMap<>();
            logger.atDebug().setMessage("Promoted site for {} after {} evictions")
                    .addArgument(operation::describe)
                    .addArgument(pressure::get).log();
        }
    }

    /** Shapes of the operands, without wrapping them. */
    private static Shape[] shapesOf(Object[] values) {
        Shape[] shapes = new Shape[values.length];
        for (int i = 0; i < values.length; i++) {
            shapes[i] = Envelope.shapeOf(values[i]);
        }
        return shapes;
    }

    private void checkArity(Object[] values) {
        int n = operation.operandCount();
        if (values.length != n) {
            throw new IllegalArgumentException(String.format(
                    "%s takes %d operands but %d given",
                    operation.describe(), n, values.length));
        }
    }

    @Override
    public String toString() {
        return String.format("DynamicCallSite[%s, %s]", operation.describe(),
                inline.get());
    }
}
