// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime;

import java.util.Objects;

/**
 * An {@code Operation} describes what a caller wants done to the
 * operands at a dynamic call site: get a member, invoke a method, apply
 * an operator, and so on. Exactly one kind of operation is described
 * by each instance, and it is immutable once constructed.
 * <p>
 * The operands are supplied at execution time, in a fixed order: the
 * receiver first, then the arguments left to right. For
 * {@link SetMember} the value to assign follows the receiver. For
 * {@link SetIndex} the index values follow the receiver and the value
 * to assign comes last. {@link #operandCount()} is the number of
 * operands (receiver included) every execution must supply.
 */
public sealed interface Operation
        permits Operation.GetMember, Operation.SetMember,
        Operation.InvokeMember, Operation.Invoke, Operation.Convert,
        Operation.BinaryOp, Operation.UnaryOp, Operation.GetIndex,
        Operation.SetIndex {

    /** The kinds of {@code Operation}. */
    enum Kind {
        GET_MEMBER, SET_MEMBER, INVOKE_MEMBER, INVOKE, CONVERT,
        BINARY_OP, UNARY_OP, GET_INDEX, SET_INDEX
    }

    /** @return the kind of this operation */
    Kind kind();

    /**
     * The name of the member this operation concerns, if it concerns a
     * named member.
     *
     * @return member name or {@code null}
     */
    default String memberName() { return null; }

    /**
     * The number of operands an execution of this operation takes,
     * including the receiver.
     *
     * @return number of operands
     */
    int operandCount();

    /**
     * A short description for messages, for example
     * {@code "get-member 'Value'"}.
     *
     * @return description of the operation
     */
    String describe();

    /**
     * Get the value of a named member of the receiver.
     *
     * @param name of the member
     * @return the operation
     */
    static GetMember getMember(String name) { return new GetMember(name); }

    /**
     * Set the value of a named member of the receiver. The operands
     * are the receiver and the value.
     *
     * @param name of the member
     * @return the operation
     */
    static SetMember setMember(String name) { return new SetMember(name); }

    /**
     * Invoke a named method of the receiver with a given number of
     * arguments.
     *
     * @param name of the method
     * @param argCount number of arguments (excluding the receiver)
     * @return the operation
     */
    static InvokeMember invokeMember(String name, int argCount) {
        return new InvokeMember(name, argCount);
    }

    /**
     * Invoke the receiver itself (a callable) with a given number of
     * arguments.
     *
     * @param argCount number of arguments (excluding the receiver)
     * @return the operation
     */
    static Invoke invoke(int argCount) { return new Invoke(argCount); }

    /**
     * Convert the receiver to a given type.
     *
     * @param targetType of the conversion
     * @return the operation
     */
    static Convert convert(Class<?> targetType) {
        return new Convert(targetType);
    }

    /**
     * Apply a binary operator to the receiver (left) and one argument
     * (right).
     *
     * @param operator to apply
     * @return the operation
     */
    static BinaryOp binaryOp(Operator operator) {
        return new BinaryOp(operator);
    }

    /**
     * Apply a unary operator to the receiver.
     *
     * @param operator to apply
     * @return the operation
     */
    static UnaryOp unaryOp(Operator operator) {
        return new UnaryOp(operator);
    }

    /**
     * Get an element of the receiver by index (or key).
     *
     * @param indexCount number of index values
     * @return the operation
     */
    static GetIndex getIndex(int indexCount) {
        return new GetIndex(indexCount);
    }

    /**
     * Set an element of the receiver by index (or key).
     *
     * @param indexCount number of index values
     * @return the operation
     */
    static SetIndex setIndex(int indexCount) {
        return new SetIndex(indexCount);
    }

    /** Get the value of a named member. */
    record GetMember(String name) implements Operation {

        public GetMember { checkName(name); }

        @Override
        public Kind kind() { return Kind.GET_MEMBER; }

        @Override
        public String memberName() { return name; }

        @Override
        public int operandCount() { return 1; }

        @Override
        public String describe() { return "get-member '" + name + "'"; }
    }

    /** Set the value of a named member. */
    record SetMember(String name) implements Operation {

        public SetMember { checkName(name); }

        @Override
        public Kind kind() { return Kind.SET_MEMBER; }

        @Override
        public String memberName() { return name; }

        @Override
        public int operandCount() { return 2; }

        @Override
        public String describe() { return "set-member '" + name + "'"; }
    }

    /** Invoke a named method with a fixed number of arguments. */
    record InvokeMember(String name, int argCount) implements Operation {

        public InvokeMember {
            checkName(name);
            checkCount(argCount, 0, "argument");
        }

        @Override
        public Kind kind() { return Kind.INVOKE_MEMBER; }

        @Override
        public String memberName() { return name; }

        @Override
        public int operandCount() { return 1 + argCount; }

        @Override
        public String describe() {
            return String.format("invoke-member '%s' with %d arguments",
                    name, argCount);
        }
    }

    /** Invoke the receiver with a fixed number of arguments. */
    record Invoke(int argCount) implements Operation {

        public Invoke { checkCount(argCount, 0, "argument"); }

        @Override
        public Kind kind() { return Kind.INVOKE; }

        @Override
        public int operandCount() { return 1 + argCount; }

        @Override
        public String describe() {
            return String.format("invoke with %d arguments", argCount);
        }
    }

    /** Convert the receiver to a target type. */
    record Convert(Class<?> targetType) implements Operation {

        public Convert { Objects.requireNonNull(targetType, "targetType"); }

        @Override
        public Kind kind() { return Kind.CONVERT; }

        @Override
        public int operandCount() { return 1; }

        @Override
        public String describe() {
            return "convert to " + targetType.getTypeName();
        }
    }

    /** Apply a binary operator. */
    record BinaryOp(Operator operator) implements Operation {

        public BinaryOp {
            Objects.requireNonNull(operator, "operator");
            if (!operator.isBinary()) {
                throw new IllegalArgumentException(
                        operator.name() + " is not a binary operator");
            }
        }

        @Override
        public Kind kind() { return Kind.BINARY_OP; }

        @Override
        public String memberName() { return operator.symbol; }

        @Override
        public int operandCount() { return 2; }

        @Override
        public String describe() { return "binary " + operator; }
    }

    /** Apply a unary operator. */
    record UnaryOp(Operator operator) implements Operation {

        public UnaryOp {
            Objects.requireNonNull(operator, "operator");
            if (operator.isBinary()) {
                throw new IllegalArgumentException(
                        operator.name() + " is not a unary operator");
            }
        }

        @Override
        public Kind kind() { return Kind.UNARY_OP; }

        @Override
        public String memberName() { return operator.symbol; }

        @Override
        public int operandCount() { return 1; }

        @Override
        public String describe() { return "unary " + operator; }
    }

    /** Get an element by index. */
    record GetIndex(int indexCount) implements Operation {

        public GetIndex { checkCount(indexCount, 1, "index"); }

        @Override
        public Kind kind() { return Kind.GET_INDEX; }

        @Override
        public int operandCount() { return 1 + indexCount; }

        @Override
        public String describe() {
            return String.format("get-index with %d indexes", indexCount);
        }
    }

    /** Set an element by index. */
    record SetIndex(int indexCount) implements Operation {

        public SetIndex { checkCount(indexCount, 1, "index"); }

        @Override
        public Kind kind() { return Kind.SET_INDEX; }

        @Override
        public int operandCount() { return 2 + indexCount; }

        @Override
        public String describe() {
            return String.format("set-index with %d indexes", indexCount);
        }
    }

    private static void checkName(String name) {
        Objects.requireNonNull(name, "member name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("member name is empty");
        }
    }

    private static void checkCount(int n, int min, String what) {
        if (n < min) {
            throw new IllegalArgumentException(
                    String.format("%s count %d < %d", what, n, min));
        }
    }
}
