package com.regvalidator.domain;

/**
 * How a grade counts toward prerequisite satisfaction.
 */
public enum GradeClass {
    PASSING,
    FAILING,
    /** Withdrawn (W) or not yet graded (N): neither passes nor fails a requirement. */
    NON_CONTRIBUTING
}
