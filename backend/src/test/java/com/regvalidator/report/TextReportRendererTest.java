package com.regvalidator.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.regvalidator.catalog.CatalogLoader;
import com.regvalidator.domain.CourseCatalog;
import com.regvalidator.domain.Transcript;
import com.regvalidator.transcript.TranscriptMapper;
import com.regvalidator.transcript.TranscriptReader;
import com.regvalidator.validation.engine.CascadeEngine;
import com.regvalidator.validation.engine.ConcurrentRegistrationPolicy;
import com.regvalidator.validation.engine.CreditLimitChecker;
import com.regvalidator.validation.engine.GpaCalculator;
import com.regvalidator.validation.engine.PrerequisiteResolver;
import com.regvalidator.validation.engine.ValidationReportAggregator;
import com.regvalidator.validation.result.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class TextReportRendererTest {

    private static final Clock FIXED = Clock.fixed(
            LocalDateTime.of(2024, 5, 1, 9, 30, 0).toInstant(ZoneOffset.UTC), ZoneOffset.UTC);

    private final TextReportRenderer renderer = new TextReportRenderer(FIXED);

    private ValidationResult result;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        CourseCatalog catalog = new CatalogLoader(objectMapper)
                .load(Path.of("src/test/resources/catalogs/course_data.json"));
        Transcript transcript = new TranscriptReader(objectMapper, new TranscriptMapper())
                .read(Path.of("src/test/resources/transcripts/student_6510500001.json"));
        CascadeEngine engine = new CascadeEngine(
                new PrerequisiteResolver(new ConcurrentRegistrationPolicy()),
                new ValidationReportAggregator(new CreditLimitChecker(), new GpaCalculator()));
        result = engine.validate(transcript, catalog);
    }

    @Test
    @DisplayName("header, student block and summary counts")
    void headerAndSummary() {
        String report = renderer.render(result);

        assertThat(report).startsWith("=".repeat(80) + "\nCOURSE REGISTRATION VALIDATION REPORT\n");
        assertThat(report).contains("Generated: 2024-05-01 09:30:00");
        assertThat(report).contains("Student ID:       6510500001");
        assertThat(report).contains("Current GPA:      2.25");
        assertThat(report).contains("Academic Status:  NORMAL");
        assertThat(report).contains("Semesters Analyzed:    3");
        assertThat(report).contains("Registrations Checked: 7");
        assertThat(report).contains("Invalid Registrations: 0");
    }

    @Test
    @DisplayName("semester table shows every course with its status")
    void semesterTable() {
        String report = renderer.render(result);

        assertThat(report).contains("Second 2020\n-----------\nTotal Credits: 8");
        assertThat(report).contains(String.format("%-10s %-40s %-7s %-8s %-10s",
                "01206321", "Engineering Statistics", "B+", 3, "Valid"));
        assertThat(report).contains(String.format("%-10s %-40s %-7s %-8s %-10s",
                "01999999", "Special Topic Outside Catalog", "A", 2, "Not Found"));
        assertThat(report).doesNotContain("INVALID REGISTRATIONS DETAILS");
    }

    @Test
    @DisplayName("courses missing from the catalog are listed with their semester")
    void notFoundSection() {
        String report = renderer.render(result);

        assertThat(report).contains("COURSES NOT IN COURSE DATA");
        assertThat(report).contains(String.format("%-10s %-40s %-20s",
                "01999999", "Special Topic Outside Catalog", "Second 2020"));
    }

    @Test
    @DisplayName("invalid registrations get an issue line and a details block")
    void invalidDetails() {
        ObjectMapper objectMapper = new ObjectMapper();
        Transcript transcript = new TranscriptReader(objectMapper, new TranscriptMapper()).parse("""
                {"student_info": {"id": "1"},
                 "semesters": [{"semester_type": "First", "year": "2021", "cum_gpa": 1.4,
                   "courses": [{"code": "01206322", "name": "Quality Control", "grade": "A", "credits": 3}]}]}
                """);
        CourseCatalog catalog = new CatalogLoader(objectMapper)
                .load(Path.of("src/test/resources/catalogs/course_data.json"));
        ValidationResult invalid = new CascadeEngine(
                new PrerequisiteResolver(new ConcurrentRegistrationPolicy()),
                new ValidationReportAggregator(new CreditLimitChecker(), new GpaCalculator()))
                .validate(transcript, catalog);

        String report = renderer.render(invalid);

        assertThat(report).contains("Academic Status:  CRITICAL (GPA < 1.50)");
        assertThat(report).contains("  → Issue: Prerequisite 01206321 not satisfied: not passed before First 2021");
        assertThat(report).contains("Valid only - Semester GPA: 0.00, Cumulative GPA: 0.00");
        assertThat(report).contains("INVALID REGISTRATIONS DETAILS");
        assertThat(report).contains("Semester: First 2021");
        assertThat(report).contains("  • Course: 01206322 - Quality Control");
        assertThat(report).contains("    Type: Prerequisite");
        assertThat(report).contains("Name:             Unknown");
    }
}
