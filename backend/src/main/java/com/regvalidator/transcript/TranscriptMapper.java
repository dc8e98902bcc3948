package com.regvalidator.transcript;

import com.regvalidator.domain.CourseRegistration;
import com.regvalidator.domain.Grade;
import com.regvalidator.domain.Semester;
import com.regvalidator.domain.SemesterType;
import com.regvalidator.domain.StudentInfo;
import com.regvalidator.domain.Transcript;
import com.regvalidator.transcript.TranscriptDocument.CourseDocument;
import com.regvalidator.transcript.TranscriptDocument.SemesterDocument;
import com.regvalidator.transcript.TranscriptDocument.StudentInfoDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps transcript DTOs to the immutable domain. Semester-level defects abort the transcript; course-level
 * defects are kept on the registration as a data error so the rest of the transcript still validates.
 */
@Component
@Slf4j
public class TranscriptMapper {

    public Transcript toDomain(TranscriptDocument document) {
        if (document == null) {
            throw new TranscriptFormatException(TranscriptFormatException.TRANSCRIPT_INVALID, "Transcript is empty");
        }
        if (document.semesters() == null) {
            throw new TranscriptFormatException(TranscriptFormatException.TRANSCRIPT_INVALID,
                    "Transcript has no 'semesters' array");
        }
        StudentInfo student = toStudent(document.studentInfo());
        List<Semester> semesters = new ArrayList<>();
        for (int i = 0; i < document.semesters().size(); i++) {
            semesters.add(toSemester(document.semesters().get(i), i + 1));
        }
        return new Transcript(student, semesters);
    }

    private static StudentInfo toStudent(StudentInfoDocument info) {
        if (info == null) {
            return StudentInfo.unknown();
        }
        return new StudentInfo(trim(info.id()), trim(info.name()), trim(info.fieldOfStudy()), trim(info.dateAdmission()));
    }

    private Semester toSemester(SemesterDocument document, int position) {
        if (document == null) {
            throw new TranscriptFormatException(TranscriptFormatException.TRANSCRIPT_INVALID,
                    "Semester " + position + " is empty");
        }
        SemesterType type = SemesterType.fromLabel(document.semesterType())
                .orElseThrow(() -> new TranscriptFormatException(TranscriptFormatException.TRANSCRIPT_INVALID,
                        "Semester " + position + " has unknown semester_type '" + document.semesterType() + "'"));
        String year = trim(document.year());
        if (year.isEmpty()) {
            throw new TranscriptFormatException(TranscriptFormatException.TRANSCRIPT_INVALID,
                    "Semester " + position + " has no year");
        }
        String label = type.label() + " " + year;
        List<CourseRegistration> registrations = new ArrayList<>();
        if (document.courses() != null) {
            for (CourseDocument course : document.courses()) {
                registrations.add(toRegistration(course, label));
            }
        }
        return new Semester(type, year, document.semGpa(), document.cumGpa(), registrations);
    }

    private CourseRegistration toRegistration(CourseDocument course, String semesterLabel) {
        if (course == null) {
            log.warn("{}: empty course record", semesterLabel);
            return CourseRegistration.malformed(null, null, null, null, "Empty course record");
        }
        String code = trim(course.code());
        String name = trim(course.name());
        List<String> errors = new ArrayList<>();
        if (code.isEmpty()) {
            errors.add("Missing course code");
        }

        Grade grade = null;
        String gradeLabel = trim(course.grade());
        if (gradeLabel.isEmpty()) {
            errors.add("Missing grade");
        } else {
            Optional<Grade> parsed = Grade.fromLabel(gradeLabel);
            if (parsed.isPresent()) {
                grade = parsed.get();
            } else {
                errors.add("Unknown grade '" + gradeLabel + "'");
            }
        }

        Integer credits = null;
        String creditsText = trim(course.credits());
        if (creditsText.isEmpty()) {
            errors.add("Missing credits");
        } else {
            try {
                credits = Integer.valueOf(creditsText);
                if (credits < 0) {
                    errors.add("Negative credits " + credits);
                    credits = null;
                }
            } catch (NumberFormatException e) {
                errors.add("Invalid credits '" + creditsText + "'");
            }
        }

        if (errors.isEmpty()) {
            return CourseRegistration.of(code, name, grade, credits);
        }
        String error = String.join("; ", errors);
        log.warn("{}: malformed registration {}: {}", semesterLabel, code.isEmpty() ? "<no code>" : code, error);
        return CourseRegistration.malformed(code.isEmpty() ? null : code, name, grade, credits, error);
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}
