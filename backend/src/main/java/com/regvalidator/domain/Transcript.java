package com.regvalidator.domain;

import java.util.List;

/**
 * Student academic history. Semester order is chronological and is not re-sorted by the engine.
 */
public record Transcript(StudentInfo student, List<Semester> semesters) {

    public Transcript {
        student = student == null ? StudentInfo.unknown() : student;
        semesters = semesters == null ? List.of() : List.copyOf(semesters);
    }

    public int registrationCount() {
        return semesters.stream().mapToInt(s -> s.registrations().size()).sum();
    }
}
