package org.monkey.interpreter.api;

/**
 * An exception that is thrown when source text cannot be turned into a trustworthy AST.
 * <p>
 * It is part of the public API; the core pipeline itself never throws and reports
 * syntax errors as diagnostics instead.
 */
public class InterpretationException extends Exception {

    /**
     * Constructs a new interpretation exception with the specified detail message.
     * @param message The detail message.
     */
    public InterpretationException(String message) {
        super(message, null);
    }

    /**
     * Constructs a new interpretation exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public InterpretationException(String message, Throwable cause) {
        super(message, cause);
    }
}
