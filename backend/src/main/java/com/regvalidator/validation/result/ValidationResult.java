package com.regvalidator.validation.result;

import com.regvalidator.domain.StudentInfo;
import com.regvalidator.domain.ValidationVerdict;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable outcome of validating one transcript. Carries every field the text report prints; performs no
 * formatting itself.
 */
public record ValidationResult(StudentInfo student,
                               int catalogSize,
                               int semestersAnalyzed,
                               int registrationsChecked,
                               int invalidCount,
                               int notFoundCount,
                               BigDecimal currentGpa,
                               AcademicStatus academicStatus,
                               List<ValidationVerdict> verdicts,
                               List<InvalidRegistration> invalidRegistrations,
                               List<NotFoundCourse> notFoundCourses,
                               List<SemesterSummary> semesterSummaries) {

    public ValidationResult {
        verdicts = List.copyOf(verdicts);
        invalidRegistrations = List.copyOf(invalidRegistrations);
        notFoundCourses = List.copyOf(notFoundCourses);
        semesterSummaries = List.copyOf(semesterSummaries);
    }

    /** Invalid registrations grouped by semester label, in chronological order. */
    public Map<String, List<InvalidRegistration>> invalidBySemester() {
        Map<String, List<InvalidRegistration>> grouped = new LinkedHashMap<>();
        for (InvalidRegistration invalid : invalidRegistrations) {
            grouped.computeIfAbsent(invalid.semester(), s -> new ArrayList<>()).add(invalid);
        }
        grouped.replaceAll((k, v) -> List.copyOf(v));
        return grouped;
    }

    public List<CreditWarning> creditWarnings() {
        return semesterSummaries.stream()
                .map(SemesterSummary::creditWarning)
                .filter(w -> w != null)
                .toList();
    }

    public boolean hasInvalidRegistrations() {
        return invalidCount > 0;
    }
}
