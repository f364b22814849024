// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime.kernel;

import static java.lang.invoke.MethodHandles.identity;
import static java.lang.invoke.MethodType.methodType;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodType;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The conversion of an argument of some class to a parameter type, with
 * its {@link Rank} for overload resolution and (where one is needed) a
 * filter that performs it.
 *
 * @param rank the quality of the conversion
 * @param filter of type {@code (Object)P} or {@code null} if
 *     {@code asType} will do the work
 * @param target the parameter type {@code P}
 */
public record Conversion(Rank rank, MethodHandle filter, Class<?> target) {

    /** Ranks of conversion, best first. */
    public enum Rank {
        /** The argument class is the parameter type (or boxes to it). */
        EXACT,
        /** The argument class is a proper subtype of the parameter. */
        SUBTYPE,
        /** Primitive widening, possibly with boxing and unboxing. */
        WIDENING,
        /** A user-declared implicit conversion. */
        IMPLICIT,
        /** The parameter is {@code Object}. */
        CATCH_ALL
    }

    /** Primitive widening conversions (JLS 5.1.2). */
    private static final Map<Class<?>, Set<Class<?>>> WIDENS_TO = Map.of( //
            byte.class,
            Set.of(short.class, int.class, long.class, float.class,
                    double.class),
            short.class,
            Set.of(int.class, long.class, float.class, double.class),
            char.class,
            Set.of(int.class, long.class, float.class, double.class),
            int.class, Set.of(long.class, float.class, double.class),
            long.class, Set.of(float.class, double.class), //
            float.class, Set.of(double.class));

    /**
     * Find the conversion from an argument class to a parameter type, or
     * return {@code null} if the argument is not acceptable.
     *
     * @param from class of the argument ({@code null} for a null
     *     argument)
     * @param to type of the parameter
     * @return the conversion or {@code null}
     */
    public static Conversion find(Class<?> from, Class<?> to) {
        if (from == null) {
            // A null converts to any reference type
            if (to.isPrimitive()) { return null; }
            return new Conversion(to == Object.class ? Rank.CATCH_ALL
                    : Rank.SUBTYPE, null, to);
        }

        if (to == Object.class) {
            Rank r = from == Object.class ? Rank.EXACT : Rank.CATCH_ALL;
            return new Conversion(r, null, to);
        } else if (from == to || unbox(from) == to) {
            return new Conversion(Rank.EXACT, null, to);
        } else if (to.isAssignableFrom(from)) {
            return new Conversion(Rank.SUBTYPE, null, to);
        }

        // Primitive widening, where the target is primitive or a wrapper
        Class<?> f = unbox(from), t = unbox(to);
        if (widens(f, t)) {
            MethodHandle filter = identity(t).asType(methodType(to, Object.class));
            return new Conversion(Rank.WIDENING, filter, to);
        }

        // A conversion declared by the source class, then the target
        Conversion c = implicit(TypeSurface.of(from), from, to);
        if (c == null && !to.isPrimitive()) {
            c = implicit(TypeSurface.of(to), from, to);
        }
        return c;
    }

    /**
     * Whether primitive type {@code p} is a widening of {@code q}, or
     * their wrappers are, so that a parameter of type {@code p} should
     * be preferred to one of type {@code q} for the same argument.
     *
     * @param p parameter type
     * @param q parameter type
     * @return {@code true} if {@code q} is a widening of {@code p}
     */
    static boolean narrowerThan(Class<?> p, Class<?> q) {
        return widens(unbox(p), unbox(q));
    }

    /**
     * The primitive type corresponding to a wrapper, or the argument
     * itself if it is not a wrapper.
     *
     * @param c class to unbox
     * @return primitive type or {@code c}
     */
    static Class<?> unbox(Class<?> c) {
        return MethodType.methodType(c).unwrap().returnType();
    }

    private static boolean widens(Class<?> from, Class<?> to) {
        Set<Class<?>> s = WIDENS_TO.get(from);
        return s != null && s.contains(to);
    }

    /**
     * Search the implicit conversions of a surface for one that accepts
     * {@code from} and produces something assignable to {@code to}.
     * Among several, one declared to accept exactly {@code from} is
     * preferred, otherwise the first in declaration order.
     */
    private static Conversion implicit(TypeSurface surface, Class<?> from,
            Class<?> to) {
        List<Candidate> candidates = surface.implicitConversions();
        Candidate chosen = null;
        for (Candidate c : candidates) {
            MethodType mt = c.handle().type();
            Class<?> p = mt.parameterType(0), r = mt.returnType();
            if (accepts(p, from) && produces(r, to)) {
                if (p == from) {
                    chosen = c;
                    break;
                } else if (chosen == null) {
                    chosen = c;
                }
            }
        }
        if (chosen == null) { return null; }
        MethodHandle filter =
                chosen.handle().asType(methodType(to, Object.class));
        return new Conversion(Rank.IMPLICIT, filter, to);
    }

    private static boolean accepts(Class<?> param, Class<?> from) {
        return param.isAssignableFrom(from) || unbox(from) == param;
    }

    private static boolean produces(Class<?> result, Class<?> to) {
        return to.isAssignableFrom(result) || unbox(result) == unbox(to)
                && (result.isPrimitive() || to.isPrimitive());
    }

    @Override
    public String toString() {
        return rank + " to " + target.getSimpleName();
    }
}
