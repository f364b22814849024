// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime;

import java.util.Objects;
import java.util.Set;

/**
 * A {@code Shape} is the key by which a call site recognises "the same
 * kind of value" from one execution to the next. A binding is valid
 * for exactly the tuple of operand shapes it was produced for.
 * <p>
 * There are four varieties:
 * <ol>
 * <li>{@link #NULL}, the shape of a missing ({@code null}) value,
 * distinct from every type shape,</li>
 * <li>a {@link PrimitiveShape}, for the boxed primitive types and
 * {@code String}, which have built-in operators,</li>
 * <li>a {@link ReflectedShape}, for any other Java class, and</li>
 * <li>a {@link MetaObjectShape}, combining a class with a key supplied
 * by the {@link MetaObject} of the value.</li>
 * </ol>
 * The shape of a class is computed once and cached against the class,
 * so that class shapes are canonical and may be compared by identity.
 */
public abstract sealed class Shape permits Shape.NullShape,
        Shape.PrimitiveShape, Shape.ReflectedShape, Shape.MetaObjectShape {

    /** The shape of {@code null}. */
    public static final Shape NULL = new NullShape();

    /** Classes given a {@link PrimitiveShape}. */
    private static final Set<Class<?>> PRIMITIVES = Set.of(Boolean.class,
            Character.class, Byte.class, Short.class, Integer.class,
            Long.class, Float.class, Double.class, String.class);

    /**
     * Mapping from Java class to the canonical {@code Shape} of that
     * class. {@code ClassValue} gives us lock-free retrieval once the
     * value has been computed. It is possible that threads race to
     * compute the shape of the same class: that is not a problem, since
     * {@code ClassValue} publishes only one of the answers.
     */
    private static final ClassValue<Shape> REGISTRY = new ClassValue<>() {

        @Override
        protected Shape computeValue(Class<?> c) {
            if (PRIMITIVES.contains(c))
                return new PrimitiveShape(c);
            else
                return new ReflectedShape(c);
        }
    };

    private Shape() {}

    /**
     * Return the canonical shape of a class.
     *
     * @param c the class
     * @return shape of instances of {@code c}
     */
    public static Shape of(Class<?> c) {
        return REGISTRY.get(Objects.requireNonNull(c));
    }

    /**
     * Return a shape for instances of a class further distinguished by
     * a custom key. Shapes with equal class and key are equal.
     *
     * @param c the class
     * @param key the custom key (not {@code null})
     * @return the shape
     */
    public static Shape custom(Class<?> c, Object key) {
        return new MetaObjectShape(of(c), Objects.requireNonNull(key));
    }

    /**
     * The Java class of values of this shape, or {@code null} for
     * {@link #NULL}.
     *
     * @return class of values with this shape
     */
    public abstract Class<?> javaClass();

    /** @return {@code true} iff this is the shape of {@code null}. */
    public boolean isNull() { return false; }

    /** @return {@code true} iff this shape has built-in operators. */
    public boolean isPrimitive() { return false; }

    /** The shape of {@code null}. */
    public static final class NullShape extends Shape {

        private NullShape() {}

        @Override
        public Class<?> javaClass() { return null; }

        @Override
        public boolean isNull() { return true; }

        @Override
        public String toString() { return "null"; }
    }

    /** The shape of a boxed primitive or {@code String}. */
    public static final class PrimitiveShape extends Shape {

        private final Class<?> javaClass;

        private PrimitiveShape(Class<?> javaClass) {
            this.javaClass = javaClass;
        }

        @Override
        public Class<?> javaClass() { return javaClass; }

        @Override
        public boolean isPrimitive() { return true; }

        @Override
        public String toString() { return javaClass.getSimpleName(); }
    }

    /** The shape of instances of any other Java class. */
    public static final class ReflectedShape extends Shape {

        private final Class<?> javaClass;

        private ReflectedShape(Class<?> javaClass) {
            this.javaClass = javaClass;
        }

        @Override
        public Class<?> javaClass() { return javaClass; }

        @Override
        public String toString() { return javaClass.getSimpleName(); }
    }

    /**
     * The shape of a value whose meta-object supplies a custom key.
     * Unlike the class shapes, these are created afresh each time and
     * compared by value.
     */
    public static final class MetaObjectShape extends Shape {

        private final Shape classShape;
        private final Object key;

        private MetaObjectShape(Shape classShape, Object key) {
            this.classShape = classShape;
            this.key = key;
        }

        @Override
        public Class<?> javaClass() { return classShape.javaClass(); }

        /** @return the custom key supplied by the meta-object. */
        public Object key() { return key; }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof MetaObjectShape other
                    && other.classShape == classShape
                    && other.key.equals(key);
        }

        @Override
        public int hashCode() {
            return classShape.hashCode() * 31 + key.hashCode();
        }

        @Override
        public String toString() {
            return String.format("%s%s", classShape, key);
        }
    }
}
