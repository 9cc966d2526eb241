package com.example.scheduling.exception;

/**
 * Transient failure: a lock or availability budget ran out, or storage was unreachable.
 * The caller should retry; it must not read this as "slot not available".
 */
public class SchedulingUnavailableException extends RuntimeException {

    public SchedulingUnavailableException(String message) {
        super(message);
    }

    public SchedulingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
