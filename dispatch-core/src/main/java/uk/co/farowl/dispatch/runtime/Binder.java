// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime;

import static uk.co.farowl.dispatch.support.JavaClassShorthand.SPREAD;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodType;
import java.util.Arrays;

import uk.co.farowl.dispatch.runtime.Binding.Origin;
import uk.co.farowl.dispatch.runtime.Operation.BinaryOp;
import uk.co.farowl.dispatch.runtime.Operation.Convert;
import uk.co.farowl.dispatch.runtime.Operation.GetIndex;
import uk.co.farowl.dispatch.runtime.Operation.GetMember;
import uk.co.farowl.dispatch.runtime.Operation.Invoke;
import uk.co.farowl.dispatch.runtime.Operation.InvokeMember;
import uk.co.farowl.dispatch.runtime.Operation.SetIndex;
import uk.co.farowl.dispatch.runtime.Operation.SetMember;
import uk.co.farowl.dispatch.runtime.Operation.UnaryOp;
import uk.co.farowl.dispatch.runtime.kernel.ReflectionBinder;

/**
 * The {@code Binder} produces a {@link Binding} for an operation on
 * operands of particular shapes. It first consults the meta-object of
 * the receiver (the first operand), if it has one, and otherwise (or
 * if the meta-object answers "not applicable") resolves the operation
 * by reflection on the classes of the operands.
 * <p>
 * The binder holds no state of its own and one instance is shared by
 * all the call sites of an engine.
 */
public final class Binder {

    private final ReflectionBinder reflection = new ReflectionBinder();

    /** Create a binder. */
    public Binder() {}

    /**
     * Bind the operation for operands of the shapes of those given.
     *
     * @param op the operation
     * @param operands wrapped operands, receiver first
     * @return a binding valid for those shapes
     * @throws BindingFailure if the operation cannot be bound
     */
    public Binding bind(Operation op, Envelope[] operands)
            throws BindingFailure {
        Envelope self = operands[0];

        if (self.hasMetaObject()) {
            BindResult result = consult(self.metaObject(), op, operands);
            if (result instanceof BindResult.Resolved r) {
                MethodHandle target = adapt(op, operands, r.target());
                return Binding.of(target, Origin.META_OBJECT);
            } else if (result instanceof BindResult.Error e) {
                // Host state may change, so never permanent
                throw new BindingFailure(DispatchError.Kind.META_OBJECT_ERROR,
                        op, BindingFailure.shapes(operands), e.reason(),
                        false);
            }
        }

        try {
            return reflection.resolve(op, operands);
        } catch (BindingFailure f) {
            throw anyMetaObject(operands) ? f.asTransient() : f;
        }
    }

    /** Call the callback of the meta-object that matches the operation. */
    private static BindResult consult(MetaObject mo, Operation op,
            Envelope[] operands) throws BindingFailure {
        Envelope self = operands[0];
        BindResult result = switch (op.kind()) {
            case GET_MEMBER -> mo.tryGetMember((GetMember)op, self);
            case SET_MEMBER -> mo.trySetMember((SetMember)op, self,
                    operands[1]);
            case INVOKE_MEMBER -> mo.tryInvokeMember((InvokeMember)op, self,
                    rest(operands, 1));
            case INVOKE -> mo.tryInvoke((Invoke)op, self, rest(operands, 1));
            case CONVERT -> mo.tryConvert((Convert)op, self);
            case BINARY_OP -> mo.tryBinaryOp((BinaryOp)op, self, operands[1]);
            case UNARY_OP -> mo.tryUnaryOp((UnaryOp)op, self);
            case GET_INDEX -> mo.tryGetIndex((GetIndex)op, self,
                    rest(operands, 1));
            case SET_INDEX -> mo.trySetIndex((SetIndex)op, self,
                    Arrays.copyOfRange(operands, 1, operands.length - 1),
                    operands[operands.length - 1]);
        };
        if (result == null) {
            throw new BindingFailure(DispatchError.Kind.META_OBJECT_ERROR,
                    op, BindingFailure.shapes(operands),
                    "meta-object gave no result", false);
        }
        return result;
    }

    /**
     * Adapt a handle from a meta-object to the type of a binding. It
     * may already be {@code (Object[])Object}, or take each operand as
     * a separate argument.
     */
    private static MethodHandle adapt(Operation op, Envelope[] operands,
            MethodHandle target) throws BindingFailure {
        int n = operands.length;
        MethodType type = target.type();
        if (type.equals(SPREAD)) {
            return target;
        } else if (type.parameterCount() == n && !target.isVarargsCollector()) {
            return target.asType(MethodType.genericMethodType(n))
                    .asSpreader(Object[].class, n);
        }
        throw new BindingFailure(DispatchError.Kind.META_OBJECT_ERROR, op,
                BindingFailure.shapes(operands),
                String.format("meta-object handle %s does not take %d operands",
                        type, n),
                false);
    }

    private static Envelope[] rest(Envelope[] operands, int from) {
        return Arrays.copyOfRange(operands, from, operands.length);
    }

    private static boolean anyMetaObject(Envelope[] operands) {
        for (Envelope e : operands) {
            if (e.hasMetaObject()) { return true; }
        }
        return false;
    }
}
