package com.regvalidator.validation.result;

import com.regvalidator.domain.SemesterType;
import com.regvalidator.domain.VerdictStatus;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Per-semester section of the result. {@code reportedSemesterGpa}/{@code reportedCumulativeGpa} are echoed from
 * the transcript; the remaining GPA fields are recalculated from grades, overall and over non-invalid registrations.
 */
public record SemesterSummary(int index,
                              String label,
                              SemesterType type,
                              String year,
                              int totalCredits,
                              BigDecimal reportedSemesterGpa,
                              BigDecimal reportedCumulativeGpa,
                              BigDecimal semesterGpa,
                              BigDecimal cumulativeGpa,
                              BigDecimal validSemesterGpa,
                              BigDecimal validCumulativeGpa,
                              CreditWarning creditWarning,
                              List<CourseVerdictRow> courses) {

    public SemesterSummary {
        courses = courses == null ? List.of() : List.copyOf(courses);
    }

    public Optional<CreditWarning> creditWarningIfAny() {
        return Optional.ofNullable(creditWarning);
    }

    public boolean hasInvalidCourses() {
        return courses.stream().anyMatch(c -> c.status() == VerdictStatus.INVALID);
    }
}
