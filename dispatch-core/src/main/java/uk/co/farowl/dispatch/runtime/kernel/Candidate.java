// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime.kernel;

import java.lang.invoke.MethodHandle;

/**
 * A member of a {@link TypeSurface} that might be chosen to carry out
 * an operation: a method, a field accessor, an operator or a
 * conversion, represented by a method handle. The leading
 * {@code receivers} parameters of the handle (zero or one) take the
 * receiver and do not take part in overload resolution: the remaining
 * parameters are matched against the arguments.
 *
 * @param name exposed name of the member
 * @param handle to invoke the member
 * @param receivers number of leading receiver parameters (0 or 1)
 * @param varargs whether the last parameter is a variable arity array
 * @param description for messages (like a Java signature)
 */
public record Candidate(String name, MethodHandle handle, int receivers,
        boolean varargs, String description) {

    /** @return types of the parameters matched against arguments */
    public Class<?>[] parameterTypes() {
        return handle.type().dropParameterTypes(0, receivers)
                .parameterArray();
    }

    @Override
    public String toString() { return description; }
}
