// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime;

/**
 * The set of callbacks through which a host value supplies its own
 * resolution of dynamic operations. There is one method for each kind
 * of {@link Operation}. Each returns a {@link BindResult}:
 * <ul>
 * <li>{@link BindResult#resolved(Fragment)} when the meta-object takes
 * responsibility for the operation,</li>
 * <li>{@link BindResult#notApplicable()} when the engine should go on to
 * reflection on the class of the value, and</li>
 * <li>{@link BindResult#error(String)} when the operation is definitely
 * not supported. The engine reports this as a
 * {@link DispatchError.Kind#META_OBJECT_ERROR} and does not consult
 * reflection.</li>
 * </ul>
 * Every method has a default that answers "not applicable", so a
 * meta-object need implement only the operations it customises. A
 * meta-object implementing none of them behaves as a plain value.
 * <p>
 * A meta-object must not modify the envelopes it is given. It may
 * allocate storage in the host value (a property bag, for example).
 * The resolution it returns is cached against the shapes of all the
 * operands. When the resolution depends on state of the host value,
 * {@link #shapeKey()} must change when that state does.
 */
public interface MetaObject {

    /**
     * A key that distinguishes this value from others of the same Java
     * class, for the purpose of caching bindings. When {@code null}
     * (the default) the class alone identifies the shape. Keys are
     * compared with {@code equals()}.
     *
     * @return custom shape key or {@code null}
     */
    default Object shapeKey() { return null; }

    /**
     * Resolve getting a member of the host value.
     *
     * @param op the operation
     * @param self envelope of the host value
     * @return result of the attempt
     */
    default BindResult tryGetMember(Operation.GetMember op, Envelope self) {
        return BindResult.notApplicable();
    }

    /**
     * Resolve setting a member of the host value.
     *
     * @param op the operation
     * @param self envelope of the host value
     * @param value envelope of the value to set
     * @return result of the attempt
     */
    default BindResult trySetMember(Operation.SetMember op, Envelope self,
            Envelope value) {
        return BindResult.notApplicable();
    }

    /**
     * Resolve invoking a named method of the host value.
     *
     * @param op the operation
     * @param self envelope of the host value
     * @param args envelopes of the arguments
     * @return result of the attempt
     */
    default BindResult tryInvokeMember(Operation.InvokeMember op,
            Envelope self, Envelope[] args) {
        return BindResult.notApplicable();
    }

    /**
     * Resolve invoking the host value itself.
     *
     * @param op the operation
     * @param self envelope of the host value
     * @param args envelopes of the arguments
     * @return result of the attempt
     */
    default BindResult tryInvoke(Operation.Invoke op, Envelope self,
            Envelope[] args) {
        return BindResult.notApplicable();
    }

    /**
     * Resolve converting the host value to another type.
     *
     * @param op the operation
     * @param self envelope of the host value
     * @return result of the attempt
     */
    default BindResult tryConvert(Operation.Convert op, Envelope self) {
        return BindResult.notApplicable();
    }

    /**
     * Resolve a binary operation where the host value is the left
     * operand.
     *
     * @param op the operation
     * @param self envelope of the host value (left operand)
     * @param right envelope of the right operand
     * @return result of the attempt
     */
    default BindResult tryBinaryOp(Operation.BinaryOp op, Envelope self,
            Envelope right) {
        return BindResult.notApplicable();
    }

    /**
     * Resolve a unary operation on the host value.
     *
     * @param op the operation
     * @param self envelope of the host value
     * @return result of the attempt
     */
    default BindResult tryUnaryOp(Operation.UnaryOp op, Envelope self) {
        return BindResult.notApplicable();
    }

    /**
     * Resolve getting an element of the host value by index.
     *
     * @param op the operation
     * @param self envelope of the host value
     * @param indexes envelopes of the index values
     * @return result of the attempt
     */
    default BindResult tryGetIndex(Operation.GetIndex op, Envelope self,
            Envelope[] indexes) {
        return BindResult.notApplicable();
    }

    /**
     * Resolve setting an element of the host value by index.
     *
     * @param op the operation
     * @param self envelope of the host value
     * @param indexes envelopes of the index values
     * @param value envelope of the value to set
     * @return result of the attempt
     */
    default BindResult trySetIndex(Operation.SetIndex op, Envelope self,
            Envelope[] indexes, Envelope value) {
        return BindResult.notApplicable();
    }
}
