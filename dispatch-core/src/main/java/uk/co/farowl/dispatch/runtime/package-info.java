/**
 * The {@code runtime} package contains the API of the dispatch engine:
 * the description of dynamic operations, the wrapping of operands, the
 * meta-object protocol through which values customise their own
 * binding, and the call sites that cache bindings.
 * <p>
 * A client usually needs only {@link DispatchEngine} and
 * {@link Operation}, or {@link DispatchRT} if it generates
 * {@code invokedynamic} instructions.
 */
package uk.co.farowl.dispatch.runtime;
