package com.regvalidator.validation.engine;

import com.regvalidator.domain.SemesterType;

/**
 * Credit caps per semester kind, passed into the engine explicitly so validation never reads global state.
 */
public record CreditLimits(int regularSemesterLimit, int summerLimit) {

    public static final int DEFAULT_REGULAR_LIMIT = 22;
    public static final int DEFAULT_SUMMER_LIMIT = 9;

    public CreditLimits {
        if (regularSemesterLimit <= 0 || summerLimit <= 0) {
            throw new IllegalArgumentException("credit limits must be positive");
        }
    }

    public static CreditLimits defaults() {
        return new CreditLimits(DEFAULT_REGULAR_LIMIT, DEFAULT_SUMMER_LIMIT);
    }

    public int limitFor(SemesterType type) {
        return type.isSummer() ? summerLimit : regularSemesterLimit;
    }
}
