// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.support.internal;

/**
 * Convenient methods for use across the implementation and not needing
 * the engine to be working.
 */
public class Util {

    private Util() {} // no instances

    /**
     * Capitalise the first letter of a member name in the way Java
     * bean property accessors do ({@code value} to {@code Value}).
     *
     * @param name to capitalise (not empty)
     * @return capitalised name
     */
    public static String capitalise(String name) {
        char c = name.charAt(0);
        if (Character.isUpperCase(c)) { return name; }
        return Character.toUpperCase(c) + name.substring(1);
    }

    /**
     * Decapitalise the first letter of a member name ({@code Value}
     * to {@code value}), the inverse of {@link #capitalise(String)}.
     *
     * @param name to decapitalise (not empty)
     * @return decapitalised name
     */
    public static String decapitalise(String name) {
        char c = name.charAt(0);
        if (Character.isLowerCase(c)) { return name; }
        return Character.toLowerCase(c) + name.substring(1);
    }
}
