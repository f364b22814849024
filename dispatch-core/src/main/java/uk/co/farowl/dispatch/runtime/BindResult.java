// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime;

import static uk.co.farowl.dispatch.support.JavaClassShorthand.SPREAD;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.util.Objects;

import uk.co.farowl.dispatch.support.EngineError;

/**
 * The answer a {@link MetaObject} gives when asked to resolve an
 * operation. It is one of three things: {@link Resolved},
 * {@link NotApplicable} or {@link Error}. "Not applicable" is the
 * routine answer of a meta-object that does not customise the
 * operation, so it is a value, not an exception.
 */
public sealed interface BindResult permits BindResult.Resolved,
        BindResult.NotApplicable, BindResult.Error {

    /**
     * The meta-object resolves the operation with this fragment.
     *
     * @param fragment to carry out the operation
     * @return the result
     */
    static BindResult resolved(Fragment fragment) {
        Objects.requireNonNull(fragment, "fragment");
        return new Resolved(Resolved.FRAGMENT_INVOKE.bindTo(fragment));
    }

    /**
     * The meta-object resolves the operation with a method handle. The
     * handle must either have the type {@code (Object[])Object}, when
     * it receives all the operands as an array, or accept exactly as
     * many arguments as the operation has operands (receiver first).
     * The engine adapts it to the call site.
     *
     * @param target to carry out the operation
     * @return the result
     */
    static BindResult resolved(MethodHandle target) {
        return new Resolved(Objects.requireNonNull(target, "target"));
    }

    /**
     * The meta-object does not customise this operation.
     *
     * @return the result
     */
    static BindResult notApplicable() { return NotApplicable.INSTANCE; }

    /**
     * The meta-object definitely cannot carry out this operation.
     *
     * @param reason for a message
     * @return the result
     */
    static BindResult error(String reason) { return new Error(reason); }

    /** A meta-object resolution, as a method handle. */
    record Resolved(MethodHandle target) implements BindResult {

        /** Handle on {@link Fragment#invoke(Object[])}. */
        private static final MethodHandle FRAGMENT_INVOKE;

        static {
            try {
                FRAGMENT_INVOKE = MethodHandles.publicLookup()
                        .findVirtual(Fragment.class, "invoke", SPREAD);
            } catch (NoSuchMethodException | IllegalAccessException e) {
                throw EngineError.staticInitError(e, Resolved.class);
            }
        }
    }

    /** The meta-object does not customise the operation. */
    final class NotApplicable implements BindResult {

        private static final NotApplicable INSTANCE = new NotApplicable();

        private NotApplicable() {}

        @Override
        public String toString() { return "NotApplicable"; }
    }

    /**
     * The meta-object reports it cannot carry out the operation.
     *
     * @param reason for a message
     */
    record Error(String reason) implements BindResult {}
}
