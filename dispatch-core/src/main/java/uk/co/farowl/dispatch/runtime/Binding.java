// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime;

import static uk.co.farowl.dispatch.support.JavaClassShorthand.SPREAD;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.WrongMethodTypeException;
import java.util.Objects;

/**
 * A {@code Binding} is the executable plan the {@link Binder} produces
 * for one operation on operands of particular shapes. It is either a
 * method handle of type {@code (Object[])Object}, that receives the
 * operands of an execution as an array and returns the result, or a
 * sentinel recording a permanent failure to bind.
 * <p>
 * A binding is valid only for the exact tuple of operand shapes it was
 * produced for, and the call site caches it against that tuple.
 */
public final class Binding {

    /** Where the binding came from. */
    public enum Origin {
        /** Supplied by the meta-object of the receiver. */
        META_OBJECT,
        /** Resolved by reflection on a member of the operand class. */
        REFLECTION,
        /** A built-in implementation (numeric operators, arrays). */
        BUILTIN,
        /** The dedicated path for a null operand. */
        NULL_HANDLING,
        /** A permanent failure sentinel. */
        FAILURE
    }

    private final MethodHandle target;
    private final Origin origin;
    private final BindingFailure failure;

    private Binding(MethodHandle target, Origin origin,
            BindingFailure failure) {
        this.target = target;
        this.origin = origin;
        this.failure = failure;
    }

    /**
     * Create a binding from a method handle of type
     * {@code (Object[])Object}.
     *
     * @param target to carry out the operation
     * @param origin where the binding came from
     * @return the binding
     * @throws WrongMethodTypeException if the handle is of the wrong
     *     type
     */
    public static Binding of(MethodHandle target, Origin origin)
            throws WrongMethodTypeException {
        if (!target.type().equals(SPREAD)) {
            throw new WrongMethodTypeException(
                    "binding target must be " + SPREAD + " not "
                            + target.type());
        }
        return new Binding(target, Objects.requireNonNull(origin), null);
    }

    /**
     * Create a sentinel binding recording that the operation will
     * always fail for the shapes against which it is cached.
     *
     * @param failure the permanent failure
     * @return the sentinel
     */
    public static Binding permanentFailure(BindingFailure failure) {
        return new Binding(null, Origin.FAILURE,
                Objects.requireNonNull(failure));
    }

    /**
     * Carry out the operation on the operands of one execution.
     *
     * @param operands receiver first
     * @return the result of the operation
     * @throws DispatchError if this is a failure sentinel
     * @throws Throwable from the bound operation
     */
    public Object invoke(Object[] operands) throws DispatchError, Throwable {
        if (failure != null) { throw failure.toError(); }
        return target.invokeExact(operands);
    }

    /** @return whether this is a permanent failure sentinel. */
    public boolean isFailure() { return failure != null; }

    /** @return the failure if this is a sentinel, or {@code null}. */
    public BindingFailure failure() { return failure; }

    /** @return the target handle, or {@code null} for a sentinel. */
    public MethodHandle target() { return target; }

    /** @return where the binding came from. */
    public Origin origin() { return origin; }

    @Override
    public String toString() {
        return failure != null ? "Binding[" + failure + "]"
                : "Binding[" + origin + "]";
    }
}
