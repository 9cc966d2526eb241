package com.example.scheduling.security;

/** Kinds of records the guard decides on. Capabilities are granted per kind. */
public enum ResourceKind {
    SESSION,
    BOOKING,
    TRAINER_PROFILE,
    MEMBER_PROFILE,
    PAYMENT
}
