// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime;

import java.util.Arrays;
import java.util.List;

/**
 * The type of (checked) exception by which the {@link Binder} reports
 * that it could not bind an operation. It carries enough context (kind,
 * operation, operand shapes) to compose a precise message without
 * re-examining the operand types. It is lightweight, having no stack
 * trace, since it is routinely caught at the call site and converted
 * to a {@link DispatchError} by {@link #toError()}.
 * <p>
 * A failure is <i>permanent</i> when the same operation on operands of
 * the same shapes will always fail. A call site may then cache the
 * failure against those shapes.
 */
public class BindingFailure extends Exception {
    private static final long serialVersionUID = 1L;

    private final DispatchError.Kind kind;
    private final transient Operation operation;
    private final transient List<Shape> shapes;
    private final String detail;
    private final boolean permanent;

    /**
     * Create a failure.
     *
     * @param kind of failure
     * @param operation attempted
     * @param shapes of the operands
     * @param detail additional explanation (or {@code null})
     * @param permanent whether the failure is certain to recur for the
     *     same shapes
     */
    public BindingFailure(DispatchError.Kind kind, Operation operation,
            List<Shape> shapes, String detail, boolean permanent) {
        super(detail, null, false, false);
        this.kind = kind;
        this.operation = operation;
        this.shapes = List.copyOf(shapes);
        this.detail = detail;
        this.permanent = permanent;
    }

    /**
     * Create a failure from the envelopes of the operands.
     *
     * @param kind of failure
     * @param operation attempted
     * @param operands envelopes of the operands
     * @param detail format string for additional explanation
     * @param args to insert in the format string
     * @return the failure
     */
    public static BindingFailure of(DispatchError.Kind kind,
            Operation operation, Envelope[] operands, String detail,
            Object... args) {
        return new BindingFailure(kind, operation, shapes(operands),
                String.format(detail, args), true);
    }

    /**
     * Return the shapes of the given envelopes, as a list.
     *
     * @param operands envelopes of the operands
     * @return their shapes
     */
    public static List<Shape> shapes(Envelope[] operands) {
        return Arrays.stream(operands).map(Envelope::shape).toList();
    }

    /** @return the kind of failure. */
    public DispatchError.Kind getKind() { return kind; }

    /** @return the operation attempted. */
    public Operation getOperation() { return operation; }

    /** @return the member name, operator symbol or {@code null}. */
    public String getMemberName() { return operation.memberName(); }

    /** @return the shapes of the operands. */
    public List<Shape> getShapes() { return shapes; }

    /** @return whether the failure will recur for these shapes. */
    public boolean isPermanent() { return permanent; }

    /**
     * Return a copy of this failure that is not permanent.
     *
     * @return transient version of this failure
     */
    public BindingFailure asTransient() {
        return permanent ? new BindingFailure(kind, operation, shapes,
                detail, false) : this;
    }

    /**
     * Convert this failure to the error raised at the call site.
     *
     * @return error to throw
     */
    public DispatchError toError() {
        return new DispatchError(kind, operation, shapes, detail);
    }

    @Override
    public String toString() {
        return String.format("BindingFailure[%s, %s, %s%s]", kind,
                operation.describe(), shapes,
                permanent ? ", permanent" : "");
    }
}
