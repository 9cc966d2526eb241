package com.example.scheduling.dto;

/** Closed set of rejection reasons a caller has to be able to render. */
public enum ReasonCode {
    PAST_DATE,
    END_BEFORE_START,
    TRAINER_CONFLICT,
    MEMBER_CONFLICT,
    CAPACITY_EXCEEDED,
    LOCATION_REQUIRED,
    UNAUTHORIZED,
    INVALID_STATE_TRANSITION
}
