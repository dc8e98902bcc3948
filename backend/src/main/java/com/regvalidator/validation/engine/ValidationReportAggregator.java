package com.regvalidator.validation.engine;

import com.regvalidator.domain.CourseCatalog;
import com.regvalidator.domain.CourseRegistration;
import com.regvalidator.domain.Semester;
import com.regvalidator.domain.Transcript;
import com.regvalidator.domain.ValidationVerdict;
import com.regvalidator.domain.VerdictReason;
import com.regvalidator.validation.result.AcademicStatus;
import com.regvalidator.validation.result.CourseVerdictRow;
import com.regvalidator.validation.result.CreditWarning;
import com.regvalidator.validation.result.InvalidRegistration;
import com.regvalidator.validation.result.NotFoundCourse;
import com.regvalidator.validation.result.SemesterSummary;
import com.regvalidator.validation.result.ValidationResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Folds per-semester verdicts into one {@link ValidationResult}: counts, invalid and not-found listings,
 * semester summaries with credit notices and recalculated GPA. No formatting, no I/O.
 */
@Component
@RequiredArgsConstructor
public class ValidationReportAggregator {

    private final CreditLimitChecker creditLimitChecker;
    private final GpaCalculator gpaCalculator;

    public ValidationResult aggregate(Transcript transcript,
                                      CourseCatalog catalog,
                                      List<List<ValidationVerdict>> verdictsBySemester,
                                      CreditLimits limits) {
        List<Semester> semesters = transcript.semesters();
        if (verdictsBySemester.size() != semesters.size()) {
            throw new IllegalArgumentException("Expected verdicts for " + semesters.size()
                    + " semesters, got " + verdictsBySemester.size());
        }

        List<ValidationVerdict> allVerdicts = new ArrayList<>();
        List<InvalidRegistration> invalid = new ArrayList<>();
        List<NotFoundCourse> notFound = new ArrayList<>();
        List<SemesterSummary> summaries = new ArrayList<>();
        List<CourseRegistration> cumulative = new ArrayList<>();
        List<CourseRegistration> cumulativeValid = new ArrayList<>();

        for (int i = 0; i < semesters.size(); i++) {
            Semester semester = semesters.get(i);
            List<ValidationVerdict> verdicts = verdictsBySemester.get(i);
            List<CourseRegistration> semesterValid = new ArrayList<>();
            List<CourseVerdictRow> rows = new ArrayList<>();

            for (ValidationVerdict verdict : verdicts) {
                CourseRegistration registration = verdict.registration();
                allVerdicts.add(verdict);
                cumulative.add(registration);
                rows.add(toRow(verdict));
                switch (verdict.status()) {
                    case INVALID -> invalid.add(toInvalid(verdict));
                    case NOT_FOUND -> {
                        notFound.add(new NotFoundCourse(registration.code(), registration.name(),
                                verdict.semesterIndex(), verdict.semesterLabel()));
                        semesterValid.add(registration);
                    }
                    case VALID -> semesterValid.add(registration);
                }
            }
            cumulativeValid.addAll(semesterValid);

            CreditWarning warning = creditLimitChecker.check(semester, limits).orElse(null);
            summaries.add(new SemesterSummary(
                    i,
                    semester.label(),
                    semester.type(),
                    semester.year(),
                    semester.totalCredits(),
                    semester.semesterGpa(),
                    semester.cumulativeGpa(),
                    gpaCalculator.gpa(semester.registrations()),
                    gpaCalculator.gpa(cumulative),
                    gpaCalculator.gpa(semesterValid),
                    gpaCalculator.gpa(cumulativeValid),
                    warning,
                    rows));
        }

        BigDecimal currentGpa = latestReportedCumulativeGpa(semesters);
        return new ValidationResult(
                transcript.student(),
                catalog.size(),
                semesters.size(),
                allVerdicts.size(),
                invalid.size(),
                notFound.size(),
                currentGpa,
                AcademicStatus.fromGpa(currentGpa),
                allVerdicts,
                invalid,
                notFound,
                summaries);
    }

    private static CourseVerdictRow toRow(ValidationVerdict verdict) {
        CourseRegistration registration = verdict.registration();
        VerdictReason reason = verdict.reason();
        return new CourseVerdictRow(
                registration.code(),
                registration.name(),
                registration.gradeLabel(),
                registration.credits(),
                verdict.status(),
                reason != null ? reason.kind() : null,
                reason != null ? reason.message() : null);
    }

    private static InvalidRegistration toInvalid(ValidationVerdict verdict) {
        VerdictReason reason = verdict.reason();
        return new InvalidRegistration(
                verdict.semesterIndex(),
                verdict.semesterLabel(),
                verdict.registration().code(),
                verdict.registration().name(),
                reason.kind(),
                reason.message(),
                reason.unmetCourses(),
                reason.cascade());
    }

    /** Cumulative GPA echoed by the most recent semester that reports one. */
    private static BigDecimal latestReportedCumulativeGpa(List<Semester> semesters) {
        for (int i = semesters.size() - 1; i >= 0; i--) {
            BigDecimal gpa = semesters.get(i).cumulativeGpa();
            if (gpa != null) {
                return gpa;
            }
        }
        return null;
    }
}
