package com.eventwatch.core.exception;

/**
 * The closed set of downstream failures that count as security signals.
 */
public enum SecurityExceptionKind {

    /** A security manager or policy violation ({@link SecurityException}). */
    SECURITY_VIOLATION,

    /** Access to a resource was refused: authorization or authentication failures. */
    UNAUTHORIZED_ACCESS,

    /** The application was driven into an invalid state, often by tampered input. */
    INVALID_OPERATION
}
