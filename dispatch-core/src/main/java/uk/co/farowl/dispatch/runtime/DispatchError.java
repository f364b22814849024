// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The exception raised when a dynamic operation could not be bound to
 * the operands supplied. It carries the specific {@link Kind} of
 * failure, the operation, the member name (if there was one) and the
 * shapes of the operands, from which its message is composed.
 * <p>
 * A {@code DispatchError} means "could not dispatch". An exception
 * thrown by an operation that <i>was</i> successfully bound (a method
 * that throws, for example) reaches the caller unchanged, and so is
 * distinguishable from this.
 */
public class DispatchError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /** The specific reasons an operation could not be bound. */
    public enum Kind {
        /** No member or operator matches by name (and arity). */
        MEMBER_NOT_FOUND("member not found"),
        /** Two or more equally ranked candidates matched. */
        AMBIGUOUS_MATCH("ambiguous match"),
        /** A member was found by name but the arguments do not fit. */
        ARGUMENT_MISMATCH("argument mismatch"),
        /** The operation does not tolerate a null operand. */
        NULL_RECEIVER("null receiver"),
        /** A meta-object reported that it cannot bind the operation. */
        META_OBJECT_ERROR("meta-object error"),
        /** The receiver changed shape while being bound, repeatedly. */
        SHAPE_CHANGED_DURING_BIND("shape changed during bind");

        private final String text;

        Kind(String text) { this.text = text; }

        @Override
        public String toString() { return text; }
    }

    private final Kind kind;
    private final transient Operation operation;
    private final transient List<Shape> shapes;

    /**
     * Create an error reporting the failure of the given operation on
     * operands of the given shapes.
     *
     * @param kind of failure
     * @param operation that could not be bound
     * @param shapes of the operands
     * @param detail additional explanation (or {@code null})
     */
    public DispatchError(Kind kind, Operation operation, List<Shape> shapes,
            String detail) {
        super(message(kind, operation, shapes, detail));
        this.kind = kind;
        this.operation = operation;
        this.shapes = List.copyOf(shapes);
    }

    /** @return the kind of failure */
    public Kind getKind() { return kind; }

    /** @return the operation that could not be bound */
    public Operation getOperation() { return operation; }

    /** @return the member name or operator symbol, or {@code null} */
    public String getMemberName() { return operation.memberName(); }

    /** @return the shapes of the operands, receiver first */
    public List<Shape> getShapes() { return shapes; }

    private static String message(Kind kind, Operation operation,
            List<Shape> shapes, String detail) {
        String s = shapes.stream().map(Shape::toString)
                .collect(Collectors.joining(", "));
        String msg = String.format("%s: cannot bind %s to (%s)", kind,
                operation.describe(), s);
        return detail == null ? msg : msg + ": " + detail;
    }
}
