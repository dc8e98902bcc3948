package com.regvalidator.domain;

import java.util.List;

/**
 * Explanation of an invalid verdict. {@code cascade} marks invalidity inherited from an invalid prerequisite.
 */
public record VerdictReason(ReasonKind kind, String message, List<String> unmetCourses, boolean cascade) {

    public VerdictReason {
        unmetCourses = unmetCourses == null ? List.of() : List.copyOf(unmetCourses);
    }

    public static VerdictReason dataError(String message) {
        return new VerdictReason(ReasonKind.DATA_ERROR, message, List.of(), false);
    }
}
