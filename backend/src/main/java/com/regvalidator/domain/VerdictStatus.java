package com.regvalidator.domain;

/**
 * Terminal status of one registration.
 */
public enum VerdictStatus {
    VALID,
    INVALID,
    NOT_FOUND
}
