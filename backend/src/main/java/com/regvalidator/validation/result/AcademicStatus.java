package com.regvalidator.validation.result;

import java.math.BigDecimal;

/**
 * Standing derived from the latest cumulative GPA on the transcript.
 */
public enum AcademicStatus {
    CRITICAL("CRITICAL (GPA < 1.50)"),
    WARNING("WARNING (GPA < 1.75)"),
    PROBATION("PROBATION (GPA < 2.00)"),
    NORMAL("NORMAL"),
    UNKNOWN("UNKNOWN");

    private static final BigDecimal CRITICAL_BELOW = new BigDecimal("1.50");
    private static final BigDecimal WARNING_BELOW = new BigDecimal("1.75");
    private static final BigDecimal PROBATION_BELOW = new BigDecimal("2.00");

    private final String description;

    AcademicStatus(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    public static AcademicStatus fromGpa(BigDecimal cumulativeGpa) {
        if (cumulativeGpa == null) {
            return UNKNOWN;
        }
        if (cumulativeGpa.compareTo(CRITICAL_BELOW) < 0) {
            return CRITICAL;
        }
        if (cumulativeGpa.compareTo(WARNING_BELOW) < 0) {
            return WARNING;
        }
        if (cumulativeGpa.compareTo(PROBATION_BELOW) < 0) {
            return PROBATION;
        }
        return NORMAL;
    }
}
