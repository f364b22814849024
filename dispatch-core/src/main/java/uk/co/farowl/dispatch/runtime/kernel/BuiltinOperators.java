// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime.kernel;

import static uk.co.farowl.dispatch.support.JavaClassShorthand.B;
import static uk.co.farowl.dispatch.support.JavaClassShorthand.O;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.invoke.MethodType;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import uk.co.farowl.dispatch.runtime.Operator;
import uk.co.farowl.dispatch.support.EngineError;

/**
 * Implementations of the operators on the primitive shapes: Java
 * arithmetic, comparison and logic on the boxed numeric and boolean
 * types (after binary numeric promotion, or promotion of the left
 * operand alone for a shift), string concatenation, and the operators
 * that accept {@code null}.
 * <p>
 * The tables are built once, by reflection on the private static
 * methods of this class, whose names are those of the operators in
 * lower camel case and whose first parameter gives the promoted type.
 */
final class BuiltinOperators {

    private BuiltinOperators() {} // no instances

    private static final Lookup LOOKUP = MethodHandles.lookup();

    /** Binary operators by promoted operand type. */
    private static final Map<Class<?>, Map<Operator, MethodHandle>> BINARY =
            new HashMap<>();

    /** Unary operators by promoted operand type. */
    private static final Map<Class<?>, Map<Operator, MethodHandle>> UNARY =
            new HashMap<>();

    /** {@code (Object, Object)Object}, the same for all builtins. */
    static final MethodType BINARY_TYPE = MethodType.methodType(O, O, O);

    /** {@code (Object)Object}, the same for all builtins. */
    static final MethodType UNARY_TYPE = MethodType.methodType(O, O);

    /** {@code a ?? b}. */
    static final MethodHandle COALESCE;
    /** {@code Objects.equals(a, b)}. */
    static final MethodHandle EQUALS;
    /** {@code !Objects.equals(a, b)}. */
    static final MethodHandle NOT_EQUALS;
    /** String concatenation when either operand is a string. */
    static final MethodHandle CONCAT;
    /** Boolean negation of an {@code Object} result. */
    static final MethodHandle NEGATE_RESULT;

    static {
        Map<String, Operator> byName = new HashMap<>();
        for (Operator op : Operator.values()) {
            byName.put(methodName(op), op);
        }
        try {
            for (Method m : BuiltinOperators.class.getDeclaredMethods()) {
                Operator op = byName.get(m.getName());
                if (op == null || !Modifier.isStatic(m.getModifiers())
                        || !m.getParameterTypes()[0].isPrimitive()) {
                    continue;
                }
                Class<?> type = m.getParameterTypes()[0];
                Map<Class<?>, Map<Operator, MethodHandle>> table =
                        m.getParameterCount() == 2 ? BINARY : UNARY;
                table.computeIfAbsent(type,
                        k -> new EnumMap<>(Operator.class))
                        .put(op, LOOKUP.unreflect(m));
            }
            COALESCE = LOOKUP.findStatic(BuiltinOperators.class, "coalesce",
                    BINARY_TYPE);
            EQUALS = LOOKUP.findStatic(Objects.class, "equals",
                    MethodType.methodType(B, O, O))
                    .asType(BINARY_TYPE);
            NOT_EQUALS = LOOKUP.findStatic(BuiltinOperators.class,
                    "notEquals", BINARY_TYPE);
            CONCAT = LOOKUP.findStatic(BuiltinOperators.class, "concat",
                    BINARY_TYPE);
            NEGATE_RESULT = LOOKUP.findStatic(BuiltinOperators.class,
                    "negateResult", UNARY_TYPE);
        } catch (ReflectiveOperationException e) {
            throw EngineError.staticInitError(e, BuiltinOperators.class);
        }
    }

    /**
     * Find the builtin implementation of a binary operator for the
     * given operand classes, or {@code null} if there isn't one.
     *
     * @param op the operator
     * @param left class of the left operand
     * @param right class of the right operand
     * @return handle of type {@link #BINARY_TYPE} or {@code null}
     */
    static MethodHandle binary(Operator op, Class<?> left, Class<?> right) {
        if (op == Operator.ADD
                && (left == String.class || right == String.class)) {
            return CONCAT;
        }
        Class<?> p = isShift(op) ? promoteShift(left, right)
                : promote(left, right);
        Map<Operator, MethodHandle> ops = p == null ? null : BINARY.get(p);
        MethodHandle mh = ops == null ? null : ops.get(op);
        return mh == null ? null : mh.asType(BINARY_TYPE);
    }

    /**
     * Find the builtin implementation of a unary operator for the given
     * operand class, or {@code null} if there isn't one.
     *
     * @param op the operator
     * @param operand class of the operand
     * @return handle of type {@link #UNARY_TYPE} or {@code null}
     */
    static MethodHandle unary(Operator op, Class<?> operand) {
        Class<?> p = promote(operand);
        Map<Operator, MethodHandle> ops = p == null ? null : UNARY.get(p);
        MethodHandle mh = ops == null ? null : ops.get(op);
        return mh == null ? null : mh.asType(UNARY_TYPE);
    }

    /** Unary numeric promotion of a boxed class (or boolean). */
    private static Class<?> promote(Class<?> c) {
        if (c == Integer.class || c == Short.class || c == Byte.class
                || c == Character.class) {
            return int.class;
        } else if (c == Long.class) {
            return long.class;
        } else if (c == Float.class) {
            return float.class;
        } else if (c == Double.class) {
            return double.class;
        } else if (c == Boolean.class) {
            return boolean.class;
        }
        return null;
    }

    /** Binary numeric promotion of two boxed classes (or booleans). */
    private static Class<?> promote(Class<?> left, Class<?> right) {
        Class<?> a = promote(left), b = promote(right);
        if (a == null || b == null) {
            return null;
        } else if (a == boolean.class || b == boolean.class) {
            return a == b ? a : null;
        } else if (a == double.class || b == double.class) {
            return double.class;
        } else if (a == float.class || b == float.class) {
            return float.class;
        } else if (a == long.class || b == long.class) {
            return long.class;
        }
        return int.class;
    }

    private static boolean isShift(Operator op) {
        return op == Operator.LEFT_SHIFT || op == Operator.RIGHT_SHIFT;
    }

    /**
     * A shift takes the unary promotion of its left operand only. The
     * count must be integral, and is passed as a {@code long}.
     */
    private static Class<?> promoteShift(Class<?> left, Class<?> right) {
        Class<?> a = promote(left), b = promote(right);
        if ((a == int.class || a == long.class)
                && (b == int.class || b == long.class)) {
            return a;
        }
        return null;
    }

    /** {@code LESS_EQUAL} becomes {@code lessEqual}. */
    private static String methodName(Operator op) {
        StringBuilder sb = new StringBuilder();
        boolean upper = false;
        for (char c : op.name().toCharArray()) {
            if (c == '_') {
                upper = true;
            } else {
                sb.append(upper ? c : Character.toLowerCase(c));
                upper = false;
            }
        }
        return sb.toString();
    }

    // Null-tolerant and object operators --------------------------------

    private static Object coalesce(Object a, Object b) {
        return a != null ? a : b;
    }

    private static Object notEquals(Object a, Object b) {
        return !Objects.equals(a, b);
    }

    private static Object concat(Object a, Object b) {
        return String.valueOf(a) + String.valueOf(b);
    }

    private static Object negateResult(Object r) { return !(Boolean)r; }

    // int ---------------------------------------------------------------

    private static int add(int a, int b) { return a + b; }

    private static int subtract(int a, int b) { return a - b; }

    private static int multiply(int a, int b) { return a * b; }

    private static int divide(int a, int b) { return a / b; }

    private static int modulo(int a, int b) { return a % b; }

    private static int and(int a, int b) { return a & b; }

    private static int or(int a, int b) { return a | b; }

    private static int xor(int a, int b) { return a ^ b; }

    private static int leftShift(int a, long b) { return a << b; }

    private static int rightShift(int a, long b) { return a >> b; }

    private static boolean equal(int a, int b) { return a == b; }

    private static boolean notEqual(int a, int b) { return a != b; }

    private static boolean lessThan(int a, int b) { return a < b; }

    private static boolean lessEqual(int a, int b) { return a <= b; }

    private static boolean greaterThan(int a, int b) { return a > b; }

    private static boolean greaterEqual(int a, int b) { return a >= b; }

    private static int negate(int a) { return -a; }

    private static int plus(int a) { return a; }

    private static int complement(int a) { return ~a; }

    // long --------------------------------------------------------------

    private static long add(long a, long b) { return a + b; }

    private static long subtract(long a, long b) { return a - b; }

    private static long multiply(long a, long b) { return a * b; }

    private static long divide(long a, long b) { return a / b; }

    private static long modulo(long a, long b) { return a % b; }

    private static long and(long a, long b) { return a & b; }

    private static long or(long a, long b) { return a | b; }

    private static long xor(long a, long b) { return a ^ b; }

    private static long leftShift(long a, long b) { return a << b; }

    private static long rightShift(long a, long b) { return a >> b; }

    private static boolean equal(long a, long b) { return a == b; }

    private static boolean notEqual(long a, long b) { return a != b; }

    private static boolean lessThan(long a, long b) { return a < b; }

    private static boolean lessEqual(long a, long b) { return a <= b; }

    private static boolean greaterThan(long a, long b) { return a > b; }

    private static boolean greaterEqual(long a, long b) { return a >= b; }

    private static long negate(long a) { return -a; }

    private static long plus(long a) { return a; }

    private static long complement(long a) { return ~a; }

    // float -------------------------------------------------------------

    private static float add(float a, float b) { return a + b; }

    private static float subtract(float a, float b) { return a - b; }

    private static float multiply(float a, float b) { return a * b; }

    private static float divide(float a, float b) { return a / b; }

    private static float modulo(float a, float b) { return a % b; }

    private static boolean equal(float a, float b) { return a == b; }

    private static boolean notEqual(float a, float b) { return a != b; }

    private static boolean lessThan(float a, float b) { return a < b; }

    private static boolean lessEqual(float a, float b) { return a <= b; }

    private static boolean greaterThan(float a, float b) { return a > b; }

    private static boolean greaterEqual(float a, float b) { return a >= b; }

    private static float negate(float a) { return -a; }

    private static float plus(float a) { return a; }

    // double ------------------------------------------------------------

    private static double add(double a, double b) { return a + b; }

    private static double subtract(double a, double b) { return a - b; }

    private static double multiply(double a, double b) { return a * b; }

    private static double divide(double a, double b) { return a / b; }

    private static double modulo(double a, double b) { return a % b; }

    private static boolean equal(double a, double b) { return a == b; }

    private static boolean notEqual(double a, double b) { return a != b; }

    private static boolean lessThan(double a, double b) { return a < b; }

    private static boolean lessEqual(double a, double b) { return a <= b; }

    private static boolean greaterThan(double a, double b) { return a > b; }

    private static boolean greaterEqual(double a, double b) { return a >= b; }

    private static double negate(double a) { return -a; }

    private static double plus(double a) { return a; }

    // boolean -----------------------------------------------------------

    private static boolean and(boolean a, boolean b) { return a & b; }

    private static boolean or(boolean a, boolean b) { return a | b; }

    private static boolean xor(boolean a, boolean b) { return a ^ b; }

    private static boolean equal(boolean a, boolean b) { return a == b; }

    private static boolean notEqual(boolean a, boolean b) { return a != b; }

    private static boolean not(boolean a) { return !a; }
}
