// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.dispatch.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Internal error thrown when the dispatch engine itself cannot be
 * relied on to work. A {@code DispatchError} (that a caller might
 * reasonably catch and report) is not then appropriate. An
 * {@code EngineError} is typically thrown during static initialisation
 * (a method handle we look up by name turns out to be missing) or for
 * irrecoverable internal errors.
 */
public class EngineError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * Logger for engine errors. A proportion of these are thrown during
     * the static initialisation of classes, where they are easily
     * swallowed without trace: this gives us a second chance to notice.
     */
    static final Logger logger = LoggerFactory.getLogger(EngineError.class);

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public EngineError(String msg, Object... args) {
        super(String.format(msg, args));
        logger.atInfo().log(getMessage());
    }

    /**
     * Constructor specifying a cause and a message.
     *
     * @param cause a Java exception behind the engine error
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public EngineError(Throwable cause, String msg, Object... args) {
        super(String.format(msg, args), cause);
        logger.atInfo().log(getMessage());
        logger.atInfo().log(String.valueOf(cause.getMessage()));
    }

    /**
     * Create an {@code EngineError} reporting the failed static
     * initialisation of a class, typically because a method handle
     * could not be formed.
     *
     * @param cause the lookup exception
     * @param cls class being initialised
     * @return error to throw
     */
    public static EngineError staticInitError(Throwable cause,
            Class<?> cls) {
        return new EngineError(cause, "failed initialisation of %s",
                cls.getSimpleName());
    }
}
