// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.runtime;

/**
 * A value that implements {@code MetaObjectProvider} opts in to
 * supplying its own resolution of dynamic operations, instead of (or
 * before) reflection on its class. The engine discovers this when it
 * wraps the value in an {@link Envelope}.
 */
public interface MetaObjectProvider {

    /**
     * Return the meta-object that resolves operations on this value.
     * The engine borrows it for the duration of one bind and does not
     * retain it. It may be the same object each time.
     *
     * @return the meta-object (or {@code null} to use reflection)
     */
    MetaObject metaObject();
}
