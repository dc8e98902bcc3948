package com.regvalidator.domain;

import java.math.BigDecimal;
import java.util.List;

/**
 * One term of a transcript. GPA values are echoed from the source and may be null; total credits are derived.
 */
public record Semester(SemesterType type,
                       String year,
                       BigDecimal semesterGpa,
                       BigDecimal cumulativeGpa,
                       List<CourseRegistration> registrations) {

    public Semester {
        registrations = registrations == null ? List.of() : List.copyOf(registrations);
    }

    /** Display label, e.g. "First 2020". */
    public String label() {
        return type.label() + " " + year;
    }

    public int totalCredits() {
        return registrations.stream().mapToInt(CourseRegistration::creditCount).sum();
    }
}
