// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime;

/**
 * A function that carries out a resolved operation, given the operands
 * of one execution (receiver first, in operand order). A
 * {@link MetaObject} returns a {@code Fragment} as its resolution of
 * an operation and the engine installs it in the call site cache for
 * the shapes of the operands at the time of binding. It will be called
 * again, without consulting the meta-object, for later operands of the
 * same shapes.
 */
@FunctionalInterface
public interface Fragment {

    /**
     * Carry out the operation.
     *
     * @param operands of this execution, receiver first
     * @return the result of the operation
     * @throws Throwable from the implementation of the operation
     */
    Object invoke(Object[] operands) throws Throwable;
}
