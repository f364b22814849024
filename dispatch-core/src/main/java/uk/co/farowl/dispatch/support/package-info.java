/**
 * Support classes for the dispatch engine that need no part of the
 * engine to be working, such as its internal error type.
 */
package uk.co.farowl.dispatch.support;
