/**
 * The {@code kernel} package contains the implementation of binding by
 * reflection and of the call site caches. Classes {@code public} here
 * are so only to be reachable from the {@code runtime} package and from
 * tests: they are not a stable API.
 */
package uk.co.farowl.dispatch.runtime.kernel;
