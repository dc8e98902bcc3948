package com.regvalidator.transcript;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.util.List;

/**
 * Transcript JSON as exchanged with the extraction and editing tools. Values are kept loose (strings) so that
 * registration-level problems become local data errors in {@link TranscriptMapper} instead of parse failures.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TranscriptDocument(
        @JsonProperty("student_info") StudentInfoDocument studentInfo,
        @JsonProperty("semesters") @NotNull(message = "TRANSCRIPT_INVALID") List<SemesterDocument> semesters
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StudentInfoDocument(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("field_of_study") String fieldOfStudy,
            @JsonProperty("date_admission") String dateAdmission
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SemesterDocument(
            @JsonProperty("semester_type") String semesterType,
            @JsonProperty("year") String year,
            @JsonProperty("semester") String semester,
            @JsonProperty("sem_gpa") BigDecimal semGpa,
            @JsonProperty("cum_gpa") BigDecimal cumGpa,
            @JsonProperty("courses") List<CourseDocument> courses
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CourseDocument(
            @JsonProperty("code") String code,
            @JsonProperty("name") String name,
            @JsonProperty("grade") String grade,
            @JsonProperty("credits") String credits
    ) {}
}
