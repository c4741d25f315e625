// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjbuf.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Internal error thrown when the Python implementation cannot be relied
 * on to work. A Python {@code exception} (that might be caught in
 * Python code) is not then appropriate. In the buffer runtime an
 * {@code InterpreterError} signals a broken contract between Java
 * components: a malformed buffer descriptor, an export released twice,
 * or a write reaching storage that cannot be written.
 */
public class InterpreterError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * Logger for interpreter errors. These are rarely caught, but when
     * they are (by a test, say) the log still records that the
     * contract was broken.
     */
    static final Logger logger =
            LoggerFactory.getLogger(InterpreterError.class);

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public InterpreterError(String msg, Object... args) {
        super(String.format(msg, args));
        logger.atInfo().log(getMessage());
    }

    /**
     * Constructor specifying a cause and a message.
     *
     * @param cause a Java exception behind the interpreter error
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public InterpreterError(Throwable cause, String msg,
            Object... args) {
        super(String.format(msg, args), cause);
        logger.atInfo().log(getMessage());
        logger.atInfo().log(cause.getMessage());
    }
}
