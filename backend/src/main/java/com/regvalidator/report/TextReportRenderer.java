package com.regvalidator.report;

import com.regvalidator.domain.StudentInfo;
import com.regvalidator.domain.VerdictStatus;
import com.regvalidator.validation.result.CourseVerdictRow;
import com.regvalidator.validation.result.InvalidRegistration;
import com.regvalidator.validation.result.NotFoundCourse;
import com.regvalidator.validation.result.SemesterSummary;
import com.regvalidator.validation.result.ValidationResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Plain-text validation report. Reads everything from {@link ValidationResult}; performs no validation.
 */
@Component
@RequiredArgsConstructor
public class TextReportRenderer {

    private static final DateTimeFormatter GENERATED_AT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String RULE = "=".repeat(80);
    private static final String LINE = "-".repeat(80);
    private static final int NAME_WIDTH = 38;
    private static final String UNKNOWN = "Unknown";

    private final Clock clock;

    public String render(ValidationResult result) {
        StringBuilder out = new StringBuilder();
        header(out);
        student(out, result);
        summary(out, result);
        semesters(out, result.semesterSummaries());
        invalidDetails(out, result);
        notFound(out, result.notFoundCourses());
        return out.toString();
    }

    private void header(StringBuilder out) {
        line(out, RULE);
        line(out, "COURSE REGISTRATION VALIDATION REPORT");
        line(out, "Generated: " + LocalDateTime.now(clock).format(GENERATED_AT));
        line(out, RULE);
        line(out, "");
    }

    private static void student(StringBuilder out, ValidationResult result) {
        StudentInfo student = result.student();
        line(out, "STUDENT INFORMATION");
        line(out, LINE);
        line(out, "Student ID:       " + orUnknown(student.id()));
        line(out, "Name:             " + orUnknown(student.name()));
        line(out, "Field of Study:   " + orUnknown(student.fieldOfStudy()));
        line(out, "Date of Admission: " + orUnknown(student.admissionDate()));
        if (!result.semesterSummaries().isEmpty()) {
            line(out, "Current GPA:      " + gpa(result.currentGpa()));
            if (result.currentGpa() != null) {
                line(out, "Academic Status:  " + result.academicStatus().description());
            }
        }
        line(out, "");
    }

    private static void summary(StringBuilder out, ValidationResult result) {
        line(out, "VALIDATION SUMMARY");
        line(out, LINE);
        line(out, "Semesters Analyzed:    " + result.semestersAnalyzed());
        line(out, "Registrations Checked: " + result.registrationsChecked());
        line(out, "Invalid Registrations: " + result.invalidCount());
        line(out, "Courses Not Found:     " + result.notFoundCount());
        line(out, "");
    }

    private static void semesters(StringBuilder out, List<SemesterSummary> summaries) {
        line(out, "SEMESTER DETAILS");
        line(out, LINE);
        for (SemesterSummary semester : summaries) {
            line(out, "");
            line(out, semester.label());
            line(out, "-".repeat(semester.label().length()));
            line(out, "Total Credits: " + semester.totalCredits());
            line(out, "Overall - Semester GPA: " + gpa(semester.semesterGpa())
                    + ", Cumulative GPA: " + gpa(semester.cumulativeGpa()));
            if (semester.hasInvalidCourses()) {
                line(out, "Valid only - Semester GPA: " + gpa(semester.validSemesterGpa())
                        + ", Cumulative GPA: " + gpa(semester.validCumulativeGpa()));
            }
            semester.creditWarningIfAny().ifPresent(w -> line(out, w.message()));

            line(out, "");
            line(out, "Courses:");
            line(out, String.format("%-10s %-40s %-7s %-8s %-10s", "Code", "Name", "Grade", "Credits", "Status"));
            line(out, LINE);
            for (CourseVerdictRow row : semester.courses()) {
                line(out, String.format("%-10s %-40s %-7s %-8s %-10s",
                        nullToEmpty(row.code()),
                        shorten(row.name()),
                        nullToEmpty(row.grade()),
                        row.credits() != null ? row.credits() : "",
                        status(row.status())));
                if (row.status() == VerdictStatus.INVALID) {
                    line(out, "  → Issue: " + row.reason());
                }
            }
        }
    }

    private static void invalidDetails(StringBuilder out, ValidationResult result) {
        if (!result.hasInvalidRegistrations()) {
            return;
        }
        line(out, "");
        line(out, "");
        line(out, "INVALID REGISTRATIONS DETAILS");
        line(out, LINE);
        for (Map.Entry<String, List<InvalidRegistration>> semester : result.invalidBySemester().entrySet()) {
            line(out, "");
            line(out, "Semester: " + semester.getKey());
            for (InvalidRegistration invalid : semester.getValue()) {
                line(out, "  • Course: " + orUnknown(invalid.courseCode()) + " - " + orUnknown(invalid.courseName()));
                line(out, "    Type: " + invalid.kind().displayName());
                line(out, "    Reason: " + invalid.reason());
            }
        }
    }

    private static void notFound(StringBuilder out, List<NotFoundCourse> courses) {
        if (courses.isEmpty()) {
            return;
        }
        line(out, "");
        line(out, "");
        line(out, "COURSES NOT IN COURSE DATA");
        line(out, LINE);
        line(out, "The following courses were not found in the course data file and could not be validated.");
        line(out, "Please check prerequisites manually for these courses:");
        line(out, "");
        line(out, String.format("%-10s %-40s %-20s", "Code", "Name", "Semester"));
        line(out, "-".repeat(70));
        for (NotFoundCourse course : courses) {
            line(out, String.format("%-10s %-40s %-20s", course.code(), shorten(course.name()), course.semester()));
        }
    }

    private static String status(VerdictStatus status) {
        return switch (status) {
            case VALID -> "Valid";
            case INVALID -> "INVALID";
            case NOT_FOUND -> "Not Found";
        };
    }

    private static String shorten(String name) {
        String value = orUnknown(name);
        return value.length() > NAME_WIDTH ? value.substring(0, 35) + "..." : value;
    }

    private static String gpa(BigDecimal value) {
        return value != null ? value.toPlainString() : "N/A";
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? UNKNOWN : value;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static void line(StringBuilder out, String text) {
        out.append(text).append('\n');
    }
}
