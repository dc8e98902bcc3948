package com.regvalidator.domain;

/**
 * Why a registration is invalid.
 */
public enum ReasonKind {
    /** Unmet, withdrawn or cascaded-invalid prerequisite. */
    PREREQUISITE,
    /** None of the declared alternative prerequisite groups is satisfied. */
    PREREQUISITE_GROUP,
    /** The registration record itself is malformed (missing code, unknown grade, bad credits). */
    DATA_ERROR;

    /** Capitalized display name used in reports ("Prerequisite"). */
    public String displayName() {
        return switch (this) {
            case PREREQUISITE -> "Prerequisite";
            case PREREQUISITE_GROUP -> "Prerequisite group";
            case DATA_ERROR -> "Data error";
        };
    }
}
