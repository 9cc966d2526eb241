package com.example.scheduling.security;

/** What a role may do with one operation on one resource kind. */
public enum Capability {
    /** never allowed */
    NONE,
    /** allowed only when the principal owns the record */
    OWN,
    /** allowed on every record of the kind */
    ANY
}
