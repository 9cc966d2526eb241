package com.example.scheduling.security;

public enum Role {
    ADMIN,
    TRAINER,
    MEMBER,
    ANONYMOUS
}
