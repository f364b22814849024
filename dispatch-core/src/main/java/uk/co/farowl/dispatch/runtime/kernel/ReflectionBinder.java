// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime.kernel;

import static java.lang.invoke.MethodType.methodType;
import static uk.co.farowl.dispatch.support.JavaClassShorthand.I;
import static uk.co.farowl.dispatch.support.JavaClassShorthand.O;
import static uk.co.farowl.dispatch.support.JavaClassShorthand.SPREAD;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.dispatch.runtime.Binding;
import uk.co.farowl.dispatch.runtime.Binding.Origin;
import uk.co.farowl.dispatch.runtime.BindingFailure;
import uk.co.farowl.dispatch.runtime.DispatchError.Kind;
import uk.co.farowl.dispatch.runtime.Envelope;
import uk.co.farowl.dispatch.runtime.Operation;
import uk.co.farowl.dispatch.runtime.Operation.BinaryOp;
import uk.co.farowl.dispatch.runtime.Operation.Convert;
import uk.co.farowl.dispatch.runtime.Operation.GetMember;
import uk.co.farowl.dispatch.runtime.Operation.InvokeMember;
import uk.co.farowl.dispatch.runtime.Operation.SetMember;
import uk.co.farowl.dispatch.runtime.Operation.UnaryOp;
import uk.co.farowl.dispatch.runtime.Operator;
import uk.co.farowl.dispatch.support.EngineError;

/**
 * Bind operations on ordinary Java objects by reflection on their
 * classes (through {@link TypeSurface}), applying {@link
 * OverloadResolver} where there is a choice of member, and falling back
 * on {@link BuiltinOperators} for the primitive shapes. The result is
 * always a {@link Binding} of type {@code (Object[])Object}, or a
 * (permanent) {@link BindingFailure}.
 * <p>
 * The binding depends only on the shapes of the operands, never on
 * their values, so it is valid for any operands of the same shapes.
 */
public final class ReflectionBinder {

    /** Logger for binding by reflection. */
    static final Logger logger =
            LoggerFactory.getLogger(ReflectionBinder.class);

    /** Invoke a {@code MethodHandle} operand with the rest. */
    private static final MethodHandle INVOKE_HANDLE;

    static {
        try {
            INVOKE_HANDLE = MethodHandles.lookup().findStatic(
                    ReflectionBinder.class, "invokeHandle", SPREAD);
        } catch (ReflectiveOperationException e) {
            throw EngineError.staticInitError(e, ReflectionBinder.class);
        }
    }

    /** Create a binder (which holds no state). */
    public ReflectionBinder() {}

    /**
     * Bind the operation for operands of the shapes given.
     *
     * @param op to bind
     * @param operands wrapped operands (receiver first)
     * @return binding of type {@code (Object[])Object}
     * @throws BindingFailure if the operation cannot be bound
     */
    public Binding resolve(Operation op, Envelope[] operands)
            throws BindingFailure {

        // Only operators have a say about null operands
        if (op instanceof BinaryOp b) {
            return binaryOp(b, operands);
        } else if (operands[0].isNull()) {
            throw BindingFailure.of(Kind.NULL_RECEIVER, op, operands,
                    "cannot %s of null", op.describe());
        }

        return switch (op.kind()) {
            case GET_MEMBER -> getMember((GetMember)op, operands);
            case SET_MEMBER -> setMember((SetMember)op, operands);
            case INVOKE_MEMBER -> invokeMember((InvokeMember)op, operands);
            case INVOKE -> invoke(op, operands);
            case CONVERT -> convert((Convert)op, operands);
            case UNARY_OP -> unaryOp((UnaryOp)op, operands);
            case GET_INDEX -> getIndex(op, operands);
            case SET_INDEX -> setIndex(op, operands);
            case BINARY_OP -> throw new EngineError("unreachable");
        };
    }

    private static Binding getMember(GetMember op, Envelope[] operands)
            throws BindingFailure {
        TypeSurface s = surface(operands[0]);
        Candidate getter = s.getter(op.name());
        if (getter == null) {
            throw BindingFailure.of(Kind.MEMBER_NOT_FOUND, op, operands,
                    "%s has no readable member '%s'", name(s), op.name());
        }
        return spread(getter.handle(), operands.length, Origin.REFLECTION);
    }

    private static Binding setMember(SetMember op, Envelope[] operands)
            throws BindingFailure {
        TypeSurface s = surface(operands[0]);
        List<Candidate> setters = s.setters(op.name());
        if (setters.isEmpty()) {
            String what = s.getter(op.name()) != null ? "read-only"
                    : "no writable";
            throw BindingFailure.of(Kind.MEMBER_NOT_FOUND, op, operands,
                    "%s has %s member '%s'", name(s), what, op.name());
        }
        MethodHandle mh = choose(op, operands, setters, 1);
        return spread(returningLast(mh, 2), 2, Origin.REFLECTION);
    }

    private static Binding invokeMember(InvokeMember op, Envelope[] operands)
            throws BindingFailure {
        TypeSurface s = surface(operands[0]);
        List<Candidate> methods = s.methods(op.name());
        if (methods.isEmpty()) {
            throw BindingFailure.of(Kind.MEMBER_NOT_FOUND, op, operands,
                    "%s has no method '%s'", name(s), op.name());
        }
        MethodHandle mh = choose(op, operands, methods, 1);
        return spread(mh, operands.length, Origin.REFLECTION);
    }

    private static Binding invoke(Operation op, Envelope[] operands)
            throws BindingFailure {
        if (operands[0].value() instanceof MethodHandle) {
            return Binding.of(INVOKE_HANDLE, Origin.BUILTIN);
        }
        TypeSurface s = surface(operands[0]);
        List<Candidate> callables = s.callables();
        if (callables.isEmpty()) {
            throw BindingFailure.of(Kind.MEMBER_NOT_FOUND, op, operands,
                    "%s is not invocable", name(s));
        }
        MethodHandle mh = choose(op, operands, callables, 1);
        return spread(mh, operands.length, Origin.REFLECTION);
    }

    private static Binding convert(Convert op, Envelope[] operands)
            throws BindingFailure {
        Class<?> from = operands[0].value().getClass();
        Class<?> to = op.targetType();
        Conversion c = Conversion.find(from, to);
        if (c == null) {
            throw BindingFailure.of(Kind.MEMBER_NOT_FOUND, op, operands,
                    "no implicit conversion from %s to %s",
                    from.getSimpleName(), to.getSimpleName());
        }
        MethodHandle mh = MethodHandles.identity(to);
        if (c.filter() != null) {
            mh = MethodHandles.filterArguments(mh, 0, c.filter());
        }
        return spread(mh, 1, Origin.REFLECTION);
    }

    private static Binding binaryOp(BinaryOp op, Envelope[] operands)
            throws BindingFailure {
        Operator o = op.operator();
        Envelope left = operands[0], right = operands[1];

        if (o == Operator.COALESCE) {
            Origin origin = left.isNull() ? Origin.NULL_HANDLING
                    : Origin.BUILTIN;
            return spread(BuiltinOperators.COALESCE, 2, origin);
        } else if (left.isNull() || right.isNull()) {
            if (o == Operator.EQUAL) {
                return spread(BuiltinOperators.EQUALS, 2,
                        Origin.NULL_HANDLING);
            } else if (o == Operator.NOT_EQUAL) {
                return spread(BuiltinOperators.NOT_EQUALS, 2,
                        Origin.NULL_HANDLING);
            }
            throw BindingFailure.of(Kind.NULL_RECEIVER, op, operands,
                    "%s does not accept a null operand", o);
        }

        OperatorSearch search = new OperatorSearch(op, operands);
        MethodHandle mh = search.find(o);
        if (mh != null) { return spread(mh, 2, search.origin); }

        if (o == Operator.NOT_EQUAL) {
            // The negation of a user-defined equality
            mh = search.find(Operator.EQUAL);
            if (mh != null) {
                mh = MethodHandles.filterReturnValue(
                        mh.asType(BuiltinOperators.BINARY_TYPE),
                        BuiltinOperators.NEGATE_RESULT);
                return spread(mh, 2, search.origin);
            }
        }
        if (o == Operator.EQUAL) {
            return spread(BuiltinOperators.EQUALS, 2, Origin.BUILTIN);
        } else if (o == Operator.NOT_EQUAL) {
            return spread(BuiltinOperators.NOT_EQUALS, 2, Origin.BUILTIN);
        }

        Kind kind = search.sawCandidates ? Kind.ARGUMENT_MISMATCH
                : Kind.MEMBER_NOT_FOUND;
        throw BindingFailure.of(kind, op, operands,
                "%s is not defined for (%s, %s)", o, operands[0].shape(),
                operands[1].shape());
    }

    /**
     * Search for a binary operator implementation: the builtin if the
     * left operand has a primitive shape, then the operators declared by
     * the class of the left operand, then the same for the right.
     */
    private static class OperatorSearch {

        final Operation op;
        final Envelope[] operands;
        final Class<?>[] classes;
        boolean sawCandidates;
        Origin origin;

        OperatorSearch(Operation op, Envelope[] operands) {
            this.op = op;
            this.operands = operands;
            this.classes = argumentClasses(operands, 0);
        }

        MethodHandle find(Operator o) throws BindingFailure {
            for (int i = 0; i < 2; i++) {
                if (i == 1 && classes[1] == classes[0]) { break; }
                if (operands[i].shape().isPrimitive()) {
                    MethodHandle b = BuiltinOperators.binary(o, classes[0],
                            classes[1]);
                    if (b != null) {
                        origin = Origin.BUILTIN;
                        return b;
                    }
                }
                List<Candidate> cands =
                        TypeSurface.of(classes[i]).operators(o);
                if (!cands.isEmpty()) {
                    sawCandidates = true;
                    OverloadResolver.Outcome out =
                            OverloadResolver.resolve(cands, classes);
                    if (out.resolved()) {
                        origin = Origin.REFLECTION;
                        return out.best().adapt();
                    } else if (out.ambiguous()) {
                        throw ambiguous(op, operands, out);
                    }
                }
            }
            return null;
        }
    }

    private static Binding unaryOp(UnaryOp op, Envelope[] operands)
            throws BindingFailure {
        Operator o = op.operator();
        Class<?> c = operands[0].value().getClass();
        if (operands[0].shape().isPrimitive()) {
            MethodHandle b = BuiltinOperators.unary(o, c);
            if (b != null) { return spread(b, 1, Origin.BUILTIN); }
        }
        List<Candidate> cands = TypeSurface.of(c).operators(o);
        if (cands.isEmpty()) {
            throw BindingFailure.of(Kind.MEMBER_NOT_FOUND, op, operands,
                    "%s is not defined for %s", o, operands[0].shape());
        }
        MethodHandle mh = choose(op, operands, cands, 0);
        return spread(mh, 1, Origin.REFLECTION);
    }

    private static Binding getIndex(Operation op, Envelope[] operands)
            throws BindingFailure {
        Class<?> c = operands[0].value().getClass();
        if (c.isArray()) {
            MethodHandle mh = MethodHandles.arrayElementGetter(c);
            mh = arrayIndex(op, operands, mh);
            return spread(mh, 2, Origin.BUILTIN);
        }
        TypeSurface s = TypeSurface.of(c);
        List<Candidate> getters = s.methods("get");
        if (getters.isEmpty()) {
            throw BindingFailure.of(Kind.MEMBER_NOT_FOUND, op, operands,
                    "%s has no indexer", name(s));
        }
        MethodHandle mh = choose(op, operands, getters, 1);
        return spread(mh, operands.length, Origin.REFLECTION);
    }

    private static Binding setIndex(Operation op, Envelope[] operands)
            throws BindingFailure {
        int n = operands.length;
        Class<?> c = operands[0].value().getClass();
        if (c.isArray()) {
            MethodHandle mh = MethodHandles.arrayElementSetter(c);
            mh = arrayIndex(op, operands, mh);
            Class<?> component = c.getComponentType();
            Conversion v = Conversion.find(classOf(operands[n - 1]),
                    component);
            if (v == null) {
                throw BindingFailure.of(Kind.ARGUMENT_MISMATCH, op,
                        operands, "cannot store %s in %s",
                        operands[n - 1].shape(), c.getSimpleName());
            } else if (v.filter() != null) {
                mh = MethodHandles.filterArguments(mh, 2, v.filter());
            }
            return spread(returningLast(mh, n), n, Origin.BUILTIN);
        }
        TypeSurface s = TypeSurface.of(c);
        List<Candidate> setters = s.methods("set");
        if (setters.isEmpty()) { setters = s.methods("put"); }
        if (setters.isEmpty()) {
            throw BindingFailure.of(Kind.MEMBER_NOT_FOUND, op, operands,
                    "%s has no writable indexer", name(s));
        }
        MethodHandle mh = choose(op, operands, setters, 1);
        return spread(returningLast(mh, n), n, Origin.REFLECTION);
    }

    /** Apply the conversion of a single index to {@code int}. */
    private static MethodHandle arrayIndex(Operation op, Envelope[] operands,
            MethodHandle mh) throws BindingFailure {
        int indexes = op.operandCount()
                - (op.kind() == Operation.Kind.SET_INDEX ? 2 : 1);
        if (indexes != 1) {
            throw BindingFailure.of(Kind.ARGUMENT_MISMATCH, op, operands,
                    "an array takes exactly one index");
        }
        Conversion c = Conversion.find(classOf(operands[1]), I);
        if (c == null) {
            throw BindingFailure.of(Kind.ARGUMENT_MISMATCH, op, operands,
                    "cannot index an array with %s", operands[1].shape());
        } else if (c.filter() != null) {
            mh = MethodHandles.filterArguments(mh, 1, c.filter());
        }
        return mh;
    }

    /**
     * Choose among candidates by the classes of the operands after the
     * first {@code skip}, and return the adapted handle, or fail with
     * the appropriate kind.
     */
    private static MethodHandle choose(Operation op, Envelope[] operands,
            List<Candidate> candidates, int skip) throws BindingFailure {
        Class<?>[] args = argumentClasses(operands, skip);
        OverloadResolver.Outcome out =
                OverloadResolver.resolve(candidates, args);
        if (out.resolved()) {
            return out.best().adapt();
        } else if (out.ambiguous()) {
            throw ambiguous(op, operands, out);
        } else {
            throw BindingFailure.of(Kind.ARGUMENT_MISMATCH, op, operands,
                    "no overload of %s accepts (%s)",
                    describe(candidates), names(args));
        }
    }

    private static BindingFailure ambiguous(Operation op,
            Envelope[] operands, OverloadResolver.Outcome out) {
        return BindingFailure.of(Kind.AMBIGUOUS_MATCH, op, operands,
                "the call is ambiguous between %s", out.describeTied());
    }

    /**
     * Adapt a handle to type {@code (Object[])Object}, taking {@code n}
     * operands.
     */
    private static Binding spread(MethodHandle mh, int n, Origin origin) {
        MethodHandle target = mh.asType(MethodType.genericMethodType(n))
                .asSpreader(Object[].class, n);
        return Binding.of(target, origin);
    }

    /**
     * Adapt a handle taking {@code n} operands so that it returns the
     * last of them, whatever it returned before (often {@code void}).
     */
    private static MethodHandle returningLast(MethodHandle mh, int n) {
        Class<?>[] objects = new Class<?>[n];
        Arrays.fill(objects, O);
        MethodHandle action = mh.asType(methodType(void.class, objects));
        MethodHandle last = MethodHandles.dropArguments(
                MethodHandles.identity(O), 0,
                Arrays.copyOf(objects, n - 1));
        return MethodHandles.foldArguments(last, action);
    }

    /**
     * Classes of the operand values after the first {@code skip}
     * ({@code null} for a null value).
     */
    private static Class<?>[] argumentClasses(Envelope[] operands,
            int skip) {
        Class<?>[] args = new Class<?>[operands.length - skip];
        for (int i = 0; i < args.length; i++) {
            args[i] = classOf(operands[skip + i]);
        }
        return args;
    }

    private static Class<?> classOf(Envelope e) {
        return e.isNull() ? null : e.value().getClass();
    }

    private static TypeSurface surface(Envelope receiver) {
        return TypeSurface.of(receiver.value().getClass());
    }

    private static String name(TypeSurface s) {
        return s.javaClass().getSimpleName();
    }

    private static String names(Class<?>[] args) {
        List<String> names = new ArrayList<>(args.length);
        for (Class<?> c : args) {
            names.add(c == null ? "null" : c.getSimpleName());
        }
        return String.join(", ", names);
    }

    private static String describe(List<Candidate> candidates) {
        Candidate first = candidates.get(0);
        return candidates.size() == 1 ? first.description()
                : "'" + first.name() + "'";
    }

    /**
     * Invoke the method handle that is the first operand, with the
     * rest as arguments.
     */
    private static Object invokeHandle(Object[] operands) throws Throwable {
        MethodHandle mh = (MethodHandle)operands[0];
        return mh.invokeWithArguments(
                Arrays.copyOfRange(operands, 1, operands.length));
    }
}
