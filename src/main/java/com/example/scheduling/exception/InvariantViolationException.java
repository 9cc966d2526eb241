package com.example.scheduling.exception;

/**
 * A committed-state invariant would be broken by the current write.
 * Thrown inside the commit transaction so that it rolls back.
 */
public class InvariantViolationException extends RuntimeException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
