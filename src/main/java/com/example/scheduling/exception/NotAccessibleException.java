package com.example.scheduling.exception;

import com.example.scheduling.dto.Rejection;

/**
 * Read denied or record missing. Both cases carry the same message.
 */
public class NotAccessibleException extends RuntimeException {

    public NotAccessibleException() {
        super(Rejection.NOT_ACCESSIBLE);
    }
}
