// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime.kernel;

import java.util.List;

import uk.co.farowl.dispatch.runtime.Operator;

/**
 * The members of a type visible to dynamic dispatch, as
 * {@link Candidate}s grouped the way the binder asks for them. The
 * implementation in this package reflects on the Java class, but the
 * binder depends only on this interface.
 * <p>
 * Member names are matched exactly first, then with the initial letter
 * in the other case, so that a property {@code value} may be reached
 * as {@code Value} and a method {@code add} as {@code Add}.
 */
public interface TypeSurface {

    /**
     * Return the surface of the given class. The surface is computed
     * once per class and shared by all threads.
     *
     * @param c class to describe
     * @return the surface of {@code c}
     */
    static TypeSurface of(Class<?> c) { return ReflectedSurface.forClass(c); }

    /** @return the class described */
    Class<?> javaClass();

    /**
     * Find the accessor for a readable member (property getter, record
     * component or public field), type {@code (R)T}.
     *
     * @param name of the member
     * @return the accessor or {@code null}
     */
    Candidate getter(String name);

    /**
     * Find the candidates for writing a member (setter methods and any
     * writable public field), each of type {@code (R,T)V}.
     *
     * @param name of the member
     * @return the candidates (empty if none)
     */
    List<Candidate> setters(String name);

    /**
     * Find the public instance methods with a given name.
     *
     * @param name of the methods
     * @return the candidates (empty if none)
     */
    List<Candidate> methods(String name);

    /**
     * Find the abstract methods of the functional interfaces (those
     * annotated {@code @FunctionalInterface}) the class implements,
     * through which an instance may itself be invoked.
     *
     * @return the candidates (empty if none)
     */
    List<Candidate> callables();

    /**
     * Find the static methods declaring an implementation of the given
     * operator.
     *
     * @param op the operator
     * @return the candidates (empty if none)
     */
    List<Candidate> operators(Operator op);

    /**
     * Find the static methods declaring implicit conversions, each of
     * type {@code (F)T}.
     *
     * @return the candidates (empty if none)
     */
    List<Candidate> implicitConversions();
}
