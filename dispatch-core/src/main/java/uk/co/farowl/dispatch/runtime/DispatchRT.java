// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime;

import java.lang.invoke.CallSite;
import java.lang.invoke.ConstantCallSite;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.invoke.MethodType;

/**
 * Run-time support for {@code invokedynamic} instructions that perform
 * dynamic operations. The name given to the instruction selects the
 * operation. The operand count comes from the type of the instruction:
 * <table class="striped">
 * <caption>Operation names</caption>
 * <tr><th>Name</th><th>Operation</th></tr>
 * <tr><td>{@code getMember:}<i>name</i></td><td>{@code obj.name}</td></tr>
 * <tr><td>{@code setMember:}<i>name</i></td><td>{@code obj.name = v}</td></tr>
 * <tr><td>{@code invokeMember:}<i>name</i></td>
 * <td>{@code obj.name(args...)}</td></tr>
 * <tr><td>{@code invoke}</td><td>{@code obj(args...)}</td></tr>
 * <tr><td>{@code convert}</td><td>{@code (T)obj}, where {@code T} is the
 * return type of the instruction</td></tr>
 * <tr><td>{@code binaryOp:}<i>OPERATOR</i></td>
 * <td>{@code a op b}, e.g. {@code binaryOp:ADD}</td></tr>
 * <tr><td>{@code unaryOp:}<i>OPERATOR</i></td>
 * <td>{@code op a}</td></tr>
 * <tr><td>{@code getIndex}</td><td>{@code obj[i...]}</td></tr>
 * <tr><td>{@code setIndex}</td><td>{@code obj[i...] = v}</td></tr>
 * </table>
 * The call site returned is constant: its target executes a
 * {@link DynamicCallSite} (of the {@link DispatchEngine#getDefault()
 * default engine}) which does its own caching.
 */
public class DispatchRT {

    private DispatchRT() {} // no instances

    /**
     * Bootstrap an {@code invokedynamic} instruction.
     *
     * @param lookup of the calling class (not used)
     * @param name encoding the operation
     * @param type of the instruction
     * @return the call site
     * @throws IllegalArgumentException if the name is not recognised or
     *     does not agree with the type
     */
    public static CallSite bootstrap(Lookup lookup, String name,
            MethodType type) throws IllegalArgumentException {
        Operation op = operation(name, type);
        if (op.operandCount() != type.parameterCount()) {
            throw new IllegalArgumentException(String.format(
                    "%s takes %d operands, not %s", op.describe(),
                    op.operandCount(), type));
        }
        DynamicCallSite site = DispatchEngine.getDefault().site(op);
        MethodHandle mh = site.dynamicInvoker().asType(type);
        return new ConstantCallSite(mh);
    }

    /**
     * Decode the name and type of an {@code invokedynamic} instruction
     * as an {@link Operation}.
     *
     * @param name encoding the operation
     * @param type of the instruction
     * @return the operation
     * @throws IllegalArgumentException if the name is not recognised
     */
    static Operation operation(String name, MethodType type)
            throws IllegalArgumentException {
        int colon = name.indexOf(':');
        String kind = colon < 0 ? name : name.substring(0, colon);
        String arg = colon < 0 ? null : name.substring(colon + 1);
        int n = type.parameterCount();
        return switch (kind) {
            case "getMember" -> Operation.getMember(required(name, arg));
            case "setMember" -> Operation.setMember(required(name, arg));
            case "invokeMember" -> Operation
                    .invokeMember(required(name, arg), n - 1);
            case "invoke" -> Operation.invoke(n - 1);
            case "convert" -> Operation.convert(type.returnType());
            case "binaryOp" -> Operation
                    .binaryOp(Operator.valueOf(required(name, arg)));
            case "unaryOp" -> Operation
                    .unaryOp(Operator.valueOf(required(name, arg)));
            case "getIndex" -> Operation.getIndex(n - 1);
            case "setIndex" -> Operation.setIndex(n - 2);
            default -> throw new IllegalArgumentException(
                    "unknown dynamic operation: " + name);
        };
    }

    private static String required(String name, String arg) {
        if (arg == null || arg.isEmpty()) {
            throw new IllegalArgumentException(
                    "dynamic operation needs a name or operator: " + name);
        }
        return arg;
    }
}
