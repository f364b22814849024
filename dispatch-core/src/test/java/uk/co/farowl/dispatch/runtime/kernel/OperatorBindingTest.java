// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime.kernel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static uk.co.farowl.dispatch.runtime.Operator.ADD;
import static uk.co.farowl.dispatch.runtime.Operator.AND;
import static uk.co.farowl.dispatch.runtime.Operator.COALESCE;
import static uk.co.farowl.dispatch.runtime.Operator.COMPLEMENT;
import static uk.co.farowl.dispatch.runtime.Operator.DIVIDE;
import static uk.co.farowl.dispatch.runtime.Operator.EQUAL;
import static uk.co.farowl.dispatch.runtime.Operator.GREATER_EQUAL;
import static uk.co.farowl.dispatch.runtime.Operator.LEFT_SHIFT;
import static uk.co.farowl.dispatch.runtime.Operator.LESS_THAN;
import static uk.co.farowl.dispatch.runtime.Operator.MODULO;
import static uk.co.farowl.dispatch.runtime.Operator.MULTIPLY;
import static uk.co.farowl.dispatch.runtime.Operator.NEGATE;
import static uk.co.farowl.dispatch.runtime.Operator.NOT;
import static uk.co.farowl.dispatch.runtime.Operator.NOT_EQUAL;
import static uk.co.farowl.dispatch.runtime.Operator.RIGHT_SHIFT;
import static uk.co.farowl.dispatch.runtime.Operator.SUBTRACT;
import static uk.co.farowl.dispatch.runtime.Operator.XOR;

import java.util.Objects;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import uk.co.farowl.dispatch.runtime.DispatchEngine;
import uk.co.farowl.dispatch.runtime.DispatchError;
import uk.co.farowl.dispatch.runtime.DispatchError.Kind;
import uk.co.farowl.dispatch.runtime.DispatchOptions;
import uk.co.farowl.dispatch.runtime.DynamicCallSite;
import uk.co.farowl.dispatch.runtime.Exposed.OperatorMethod;
import uk.co.farowl.dispatch.runtime.Operation;

/**
 * Test binding of binary and unary operators: the built-in operators
 * on numbers, booleans and strings, operators declared by classes, and
 * the treatment of {@code null} operands.
 */
@DisplayName("Binding an operator")
class OperatorBindingTest {

    /** Money with operators declared for it. */
    public static class Money {
        final long cents;

        public Money(long cents) { this.cents = cents; }

        @OperatorMethod(ADD)
        public static Money add(Money a, Money b) {
            return new Money(a.cents + b.cents);
        }

        @OperatorMethod(ADD)
        public static Money plus(Integer a, Money b) {
            return new Money(a * 100 + b.cents);
        }

        @OperatorMethod(MULTIPLY)
        public static Money times(Money a, Integer k) {
            return new Money(a.cents * k);
        }

        @OperatorMethod(EQUAL)
        public static boolean same(Money a, Money b) {
            return a.cents == b.cents;
        }

        @OperatorMethod(NEGATE)
        public static Money negate(Money a) { return new Money(-a.cents); }

        @Override
        public String toString() { return cents + "c"; }
    }

    /** Declares subtraction of a {@code Right}. */
    public static class Left {
        @OperatorMethod(SUBTRACT)
        public static String sub(Left a, Right b) { return "Left's"; }
    }

    /** Declares subtraction from a {@code Left} too. */
    public static class Right {
        @OperatorMethod(SUBTRACT)
        public static String sub(Left a, Right b) { return "Right's"; }
    }

    /** Declares no operators but has a value equality. */
    public static class Tag {
        final String label;

        public Tag(String label) { this.label = label; }

        @Override
        public boolean equals(Object other) {
            return other instanceof Tag t && t.label.equals(label);
        }

        @Override
        public int hashCode() { return Objects.hash(label); }
    }

    final DispatchEngine engine =
            new DispatchEngine(new DispatchOptions(4, 8, true));

    @Nested
    @DisplayName("on primitive shapes")
    class Builtin {

        @Test
        @DisplayName("applies binary numeric promotion")
        void arithmetic() throws Throwable {
            assertEquals(5, engine.binaryOp(ADD, 2, 3));
            assertEquals(5L, engine.binaryOp(ADD, 2, 3L));
            assertEquals(3.5, engine.binaryOp(ADD, 1, 2.5));
            assertEquals(3.5f, engine.binaryOp(ADD, 1.5f, 2));
            assertEquals(3, engine.binaryOp(ADD, (byte)1, (short)2));
            assertEquals(98, engine.binaryOp(ADD, 'a', 1));
            assertEquals(3, engine.binaryOp(DIVIDE, 7, 2));
            assertEquals(1, engine.binaryOp(MODULO, 7, 2));
            assertEquals(-1, engine.binaryOp(SUBTRACT, 1, 2));
            assertEquals(8L, engine.binaryOp(LEFT_SHIFT, 1L, 3));
            assertEquals(6, engine.binaryOp(XOR, 5, 3));
        }

        @Test
        @DisplayName("compares numbers")
        void comparison() throws Throwable {
            assertEquals(true, engine.binaryOp(LESS_THAN, 1, 2.0));
            assertEquals(false, engine.binaryOp(GREATER_EQUAL, 1L, 2));
            assertEquals(true, engine.binaryOp(EQUAL, 2, 2L));
            assertEquals(false, engine.binaryOp(NOT_EQUAL, 2.0, 2));
        }

        @Test
        @DisplayName("applies boolean logic")
        void logic() throws Throwable {
            assertEquals(false, engine.binaryOp(AND, true, false));
            assertEquals(true, engine.binaryOp(XOR, true, false));
            assertEquals(false, engine.unaryOp(NOT, true));
        }

        @Test
        @DisplayName("concatenates strings with anything")
        void concatenation() throws Throwable {
            assertEquals("a1", engine.binaryOp(ADD, "a", 1));
            assertEquals("1a", engine.binaryOp(ADD, 1, "a"));
            assertEquals("ab", engine.binaryOp(ADD, "a", "b"));
            assertEquals("100cx", engine.binaryOp(ADD, new Money(100), "x"));
        }

        @Test
        @DisplayName("applies unary operators")
        void unary() throws Throwable {
            assertEquals(-5, engine.unaryOp(NEGATE, 5));
            assertEquals(-2.5, engine.unaryOp(NEGATE, 2.5));
            assertEquals(-1, engine.unaryOp(COMPLEMENT, 0));
            DispatchError e = assertThrows(DispatchError.class,
                    () -> engine.unaryOp(NOT, 1));
            assertEquals(Kind.MEMBER_NOT_FOUND, e.getKind());
        }

        @Test
        @DisplayName("promotes only the left operand of a shift")
        void shift() throws Throwable {
            assertEquals(8, engine.binaryOp(LEFT_SHIFT, 1, 3L));
            assertEquals(8, engine.binaryOp(LEFT_SHIFT, (short)1, (byte)3));
            assertEquals(-2, engine.binaryOp(RIGHT_SHIFT, -8, 2L));
            // The count is taken modulo the width of the left operand
            assertEquals(2, engine.binaryOp(LEFT_SHIFT, 1, 33L));
            assertEquals(1L << 33, engine.binaryOp(LEFT_SHIFT, 1L, 33));
            DispatchError e = assertThrows(DispatchError.class,
                    () -> engine.binaryOp(LEFT_SHIFT, 1, 2.0));
            assertEquals(Kind.MEMBER_NOT_FOUND, e.getKind());
        }

        @Test
        @DisplayName("lets arithmetic exceptions through")
        void divideByZero() {
            assertThrows(ArithmeticException.class,
                    () -> engine.binaryOp(DIVIDE, 1, 0));
        }

        @Test
        @DisplayName("does not mix booleans and numbers")
        void booleanAndNumber() {
            DispatchError e = assertThrows(DispatchError.class,
                    () -> engine.binaryOp(ADD, true, 1));
            assertEquals(Kind.MEMBER_NOT_FOUND, e.getKind());
        }

        @Test
        @DisplayName("gives the same answer at a warm site")
        void warmSite() throws Throwable {
            DynamicCallSite site = engine.site(Operation.binaryOp(ADD));
            for (int i = 0; i < 10; i++) {
                assertEquals(i + 10, site.execute(i, 10));
            }
            assertEquals(9, site.stats().hits());
        }
    }

    @Nested
    @DisplayName("declared by a class")
    class Declared {

        @Test
        @DisplayName("finds the operator on the left operand")
        void leftOperand() throws Throwable {
            Money m = (Money)engine.binaryOp(ADD, new Money(150), new Money(50));
            assertEquals(200, m.cents);
            m = (Money)engine.binaryOp(MULTIPLY, new Money(150), 2);
            assertEquals(300, m.cents);
        }

        @Test
        @DisplayName("finds the operator on the right operand")
        void rightOperand() throws Throwable {
            Money m = (Money)engine.binaryOp(ADD, 2, new Money(50));
            assertEquals(250, m.cents);
        }

        @Test
        @DisplayName("prefers the left operand's declaration")
        void leftFirst() throws Throwable {
            assertEquals("Left's",
                    engine.binaryOp(SUBTRACT, new Left(), new Right()));
        }

        @Test
        @DisplayName("negates a declared equality for not-equal")
        void notEqualFromEqual() throws Throwable {
            Money a = new Money(1), b = new Money(1), c = new Money(2);
            assertEquals(true, engine.binaryOp(EQUAL, a, b));
            assertEquals(false, engine.binaryOp(NOT_EQUAL, a, b));
            assertEquals(true, engine.binaryOp(NOT_EQUAL, a, c));
        }

        @Test
        @DisplayName("falls back to equals() for equality")
        void equalsFallback() throws Throwable {
            assertEquals(true,
                    engine.binaryOp(EQUAL, new Tag("t"), new Tag("t")));
            assertEquals(true,
                    engine.binaryOp(NOT_EQUAL, new Tag("t"), new Tag("u")));
            assertEquals(false, engine.binaryOp(EQUAL, "x", new Tag("x")));
        }

        @Test
        @DisplayName("applies a unary operator")
        void unary() throws Throwable {
            Money m = (Money)engine.unaryOp(NEGATE, new Money(5));
            assertEquals(-5, m.cents);
        }

        @Test
        @DisplayName("fails with argument mismatch for wrong operands")
        void mismatch() {
            DispatchError e = assertThrows(DispatchError.class,
                    () -> engine.binaryOp(MULTIPLY, new Money(1), "x"));
            assertEquals(Kind.ARGUMENT_MISMATCH, e.getKind());
        }

        @Test
        @DisplayName("fails with member not found if undeclared")
        void notFound() {
            DispatchError e = assertThrows(DispatchError.class,
                    () -> engine.binaryOp(DIVIDE, new Money(1), 2));
            assertEquals(Kind.MEMBER_NOT_FOUND, e.getKind());
            assertEquals("/", e.getMemberName());
        }
    }

    @Nested
    @DisplayName("with a null operand")
    class NullOperand {

        @Test
        @DisplayName("succeeds for equality")
        void equality() throws Throwable {
            assertEquals(true, engine.binaryOp(EQUAL, null, null));
            assertEquals(false, engine.binaryOp(EQUAL, null, 1));
            assertEquals(false, engine.binaryOp(EQUAL, new Money(1), null));
            assertEquals(true, engine.binaryOp(NOT_EQUAL, null, "x"));
        }

        @Test
        @DisplayName("succeeds for coalescing")
        void coalesce() throws Throwable {
            assertEquals(5, engine.binaryOp(COALESCE, null, 5));
            assertEquals(3, engine.binaryOp(COALESCE, 3, 5));
            assertEquals(null, engine.binaryOp(COALESCE, null, null));
        }

        @Test
        @DisplayName("fails for arithmetic")
        void arithmetic() {
            DispatchError e = assertThrows(DispatchError.class,
                    () -> engine.binaryOp(ADD, null, 1));
            assertEquals(Kind.NULL_RECEIVER, e.getKind());
            e = assertThrows(DispatchError.class,
                    () -> engine.binaryOp(LESS_THAN, 1, null));
            assertEquals(Kind.NULL_RECEIVER, e.getKind());
            e = assertThrows(DispatchError.class,
                    () -> engine.unaryOp(NEGATE, null));
            assertEquals(Kind.NULL_RECEIVER, e.getKind());
        }

        @Test
        @DisplayName("fails for member access")
        void memberAccess() {
            DispatchError e = assertThrows(DispatchError.class,
                    () -> engine.getMember(null, "x"));
            assertEquals(Kind.NULL_RECEIVER, e.getKind());
            assertEquals("x", e.getMemberName());
            e = assertThrows(DispatchError.class,
                    () -> engine.invokeMember(null, "toString"));
            assertEquals(Kind.NULL_RECEIVER, e.getKind());
        }
    }
}
