package com.example.scheduling.security;

public enum Operation {
    READ,
    WRITE
}
