// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

/**
 * Annotations that may be placed on elements of a Java class, and that
 * reflection on the class will look for when building the surface the
 * engine binds against. None is required: public fields, bean
 * properties and public methods are visible without annotation.
 */
public interface Exposed {

    /**
     * Identify a public static method as the implementation of an
     * operator. A binary operator method takes two parameters (left and
     * right operand) and a unary operator method one. At least one
     * parameter would normally be the declaring class. When the operands
     * of a binary operation have different classes, the declarations in
     * the class of the left operand are consulted before those in the
     * class of the right operand.
     */
    @Documented
    @Retention(RUNTIME)
    @Target(METHOD)
    @interface OperatorMethod {

        /**
         * The operator implemented.
         *
         * @return the operator
         */
        Operator value();
    }

    /**
     * Identify a public static method of one parameter as a
     * user-defined implicit conversion from the parameter type to the
     * return type. Such a conversion makes an argument applicable to a
     * parameter it would otherwise not fit, and ranks below exact, subtype
     * and numeric widening conversions in overload resolution. It also
     * serves a {@link Operation.Convert}.
     */
    @Documented
    @Retention(RUNTIME)
    @Target(METHOD)
    @interface Implicit {}

    /**
     * Expose a public field or method under the given name, instead of
     * (not as well as) its Java name.
     */
    @Documented
    @Retention(RUNTIME)
    @Target({METHOD, FIELD})
    @interface Member {

        /**
         * Exposed name of the member.
         *
         * @return name of the member
         */
        String value();
    }

    /** Hide a public field or method from dynamic dispatch. */
    @Documented
    @Retention(RUNTIME)
    @Target({METHOD, FIELD})
    @interface Hidden {}
}
