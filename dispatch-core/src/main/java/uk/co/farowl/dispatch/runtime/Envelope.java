// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime;

/**
 * A {@code Envelope} wraps one operand of a dynamic operation during
 * binding, with its {@link Shape} and, if the value implements
 * {@link MetaObjectProvider}, the {@link MetaObject} it supplies.
 * Envelopes are created afresh for each bind and are never stored.
 * Wrapping a value has no side effects on it.
 */
public final class Envelope {

    private final Object value;
    private final Shape shape;
    private final MetaObject metaObject;

    private Envelope(Object value, Shape shape, MetaObject metaObject) {
        this.value = value;
        this.shape = shape;
        this.metaObject = metaObject;
    }

    /**
     * Wrap a value, computing its shape and discovering its meta-object
     * (if it has one).
     *
     * @param value to wrap (may be {@code null})
     * @return the envelope
     */
    public static Envelope wrap(Object value) {
        if (value == null) {
            return new Envelope(null, Shape.NULL, null);
        } else if (value instanceof MetaObjectProvider p) {
            MetaObject mo = p.metaObject();
            return new Envelope(value, shapeOf(value, mo), mo);
        } else {
            return new Envelope(value, Shape.of(value.getClass()), null);
        }
    }

    /**
     * Wrap each of an array of values.
     *
     * @param values to wrap
     * @return the envelopes in the same order
     */
    public static Envelope[] wrapAll(Object[] values) {
        Envelope[] e = new Envelope[values.length];
        for (int i = 0; i < values.length; i++) { e[i] = wrap(values[i]); }
        return e;
    }

    /**
     * Compute the shape of a value without creating an envelope. This
     * is the same shape {@link #wrap(Object)} would compute.
     *
     * @param value to examine (may be {@code null})
     * @return its shape
     */
    public static Shape shapeOf(Object value) {
        if (value == null) {
            return Shape.NULL;
        } else if (value instanceof MetaObjectProvider p) {
            return shapeOf(value, p.metaObject());
        } else {
            return Shape.of(value.getClass());
        }
    }

    private static Shape shapeOf(Object value, MetaObject mo) {
        Object key = mo == null ? null : mo.shapeKey();
        Class<?> c = value.getClass();
        return key == null ? Shape.of(c) : Shape.custom(c, key);
    }

    /** @return the wrapped value (possibly {@code null}). */
    public Object value() { return value; }

    /** @return the shape of the wrapped value. */
    public Shape shape() { return shape; }

    /** @return the meta-object or {@code null} if it has none. */
    public MetaObject metaObject() { return metaObject; }

    /** @return whether the wrapped value has a meta-object. */
    public boolean hasMetaObject() { return metaObject != null; }

    /** @return whether the wrapped value is {@code null}. */
    public boolean isNull() { return value == null; }

    @Override
    public String toString() {
        return String.format("Envelope[%s: %s]", shape, value);
    }
}
