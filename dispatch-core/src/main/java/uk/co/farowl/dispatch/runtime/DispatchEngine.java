// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The entry point through which a caller performs dynamic operations.
 * An engine holds the {@link DispatchOptions} and the {@link Binder}
 * shared by all the call sites it creates.
 * <p>
 * A caller that performs the same operation repeatedly at one place
 * should obtain a {@link DynamicCallSite} for it with
 * {@link #site(Operation)} and keep it, so that the cost of binding is
 * paid once per shape. The convenience methods
 * ({@link #getMember(Object, String)} and so on) use a site shared by
 * all callers of the engine for the same operation: convenient, but the
 * shared site is only as effective as the callers are alike.
 */
public class DispatchEngine {

    /** Logger for the engine. */
    static final Logger logger = LoggerFactory.getLogger(DispatchEngine.class);

    private final DispatchOptions options;
    private final Binder binder;
    private final Map<Operation, DynamicCallSite> shared =
            new ConcurrentHashMap<>();

    /** Create an engine with the default options. */
    public DispatchEngine() { this(DispatchOptions.defaults()); }

    /**
     * Create an engine with the given options.
     *
     * @param options for the call sites of this engine
     */
    public DispatchEngine(DispatchOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.binder = new Binder();
        logger.atInfo().addArgument(options).log("Dispatch engine with {}");
    }

    private static class DefaultHolder {
        static final DispatchEngine ENGINE = new DispatchEngine();
    }

    /**
     * An engine shared by all users of this class, created when first
     * requested.
     *
     * @return the default engine
     */
    public static DispatchEngine getDefault() { return DefaultHolder.ENGINE; }

    /** @return the options of this engine */
    public DispatchOptions options() { return options; }

    /** @return the binder shared by sites of this engine */
    public Binder binder() { return binder; }

    /**
     * Create a new call site for the operation.
     *
     * @param op to perform at the site
     * @return a new site
     */
    public DynamicCallSite site(Operation op) {
        return new DynamicCallSite(op, binder, options);
    }

    /**
     * Return the site for the operation shared by all users of this
     * engine, creating it if necessary.
     *
     * @param op to perform at the site
     * @return the shared site
     */
    public DynamicCallSite sharedSite(Operation op) {
        return shared.computeIfAbsent(op, this::site);
    }

    /**
     * Perform an operation once, through a new site that is then
     * discarded.
     *
     * @param op to perform
     * @param values operands (receiver first)
     * @return result of the operation
     * @throws DispatchError if the operation cannot be bound
     * @throws Throwable from the bound operation itself
     */
    public Object execute(Operation op, Object... values)
            throws DispatchError, Throwable {
        return site(op).execute(values);
    }

    /**
     * Get a member of an object: {@code obj.name}.
     *
     * @param obj the receiver
     * @param name of the member
     * @return value of the member
     * @throws Throwable on failure to bind or from the member
     */
    public Object getMember(Object obj, String name) throws Throwable {
        return sharedSite(Operation.getMember(name)).execute(obj);
    }

    /**
     * Set a member of an object: {@code obj.name = value}.
     *
     * @param obj the receiver
     * @param name of the member
     * @param value to assign
     * @return {@code value}
     * @throws Throwable on failure to bind or from the member
     */
    public Object setMember(Object obj, String name, Object value)
            throws Throwable {
        return sharedSite(Operation.setMember(name)).execute(obj, value);
    }

    /**
     * Invoke a method of an object: {@code obj.name(args...)}.
     *
     * @param obj the receiver
     * @param name of the method
     * @param args arguments
     * @return result of the method
     * @throws Throwable on failure to bind or from the method
     */
    public Object invokeMember(Object obj, String name, Object... args)
            throws Throwable {
        return sharedSite(Operation.invokeMember(name, args.length))
                .execute(prepend(obj, args));
    }

    /**
     * Invoke an object: {@code obj(args...)}.
     *
     * @param obj to invoke
     * @param args arguments
     * @return result of the invocation
     * @throws Throwable on failure to bind or from the object
     */
    public Object invoke(Object obj, Object... args) throws Throwable {
        return sharedSite(Operation.invoke(args.length))
                .execute(prepend(obj, args));
    }

    /**
     * Convert an object to a given type: {@code (T)obj}.
     *
     * @param <T> type to convert to
     * @param obj to convert
     * @param type to convert to
     * @return the converted object
     * @throws Throwable on failure to bind or from the conversion
     */
    @SuppressWarnings("unchecked")
    public <T> T convert(Object obj, Class<T> type) throws Throwable {
        return (T)sharedSite(Operation.convert(type)).execute(obj);
    }

    /**
     * Apply a binary operator: {@code left op right}.
     *
     * @param op the operator
     * @param left operand
     * @param right operand
     * @return result of the operation
     * @throws Throwable on failure to bind or from the operator
     */
    public Object binaryOp(Operator op, Object left, Object right)
            throws Throwable {
        return sharedSite(Operation.binaryOp(op)).execute(left, right);
    }

    /**
     * Apply a unary operator: {@code op operand}.
     *
     * @param op the operator
     * @param operand the operand
     * @return result of the operation
     * @throws Throwable on failure to bind or from the operator
     */
    public Object unaryOp(Operator op, Object operand) throws Throwable {
        return sharedSite(Operation.unaryOp(op)).execute(operand);
    }

    /**
     * Get an element: {@code obj[indexes...]}.
     *
     * @param obj the receiver
     * @param indexes the index values
     * @return the element
     * @throws Throwable on failure to bind or from the indexer
     */
    public Object getIndex(Object obj, Object... indexes) throws Throwable {
        return sharedSite(Operation.getIndex(indexes.length))
                .execute(prepend(obj, indexes));
    }

    /**
     * Set an element: {@code obj[index] = value}.
     *
     * @param obj the receiver
     * @param index the index value
     * @param value to assign
     * @return {@code value}
     * @throws Throwable on failure to bind or from the indexer
     */
    public Object setIndex(Object obj, Object index, Object value)
            throws Throwable {
        return sharedSite(Operation.setIndex(1)).execute(obj, index, value);
    }

    private static Object[] prepend(Object obj, Object[] args) {
        Object[] values = new Object[args.length + 1];
        values[0] = obj;
        System.arraycopy(args, 0, values, 1, args.length);
        return values;
    }
}
