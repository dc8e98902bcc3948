package com.regvalidator.validation.result;

import com.regvalidator.domain.ReasonKind;

import java.util.List;

/**
 * Detail record for an invalid registration.
 */
public record InvalidRegistration(int semesterIndex,
                                  String semester,
                                  String courseCode,
                                  String courseName,
                                  ReasonKind kind,
                                  String reason,
                                  List<String> unmetCourses,
                                  boolean cascade) {

    public InvalidRegistration {
        unmetCourses = unmetCourses == null ? List.of() : List.copyOf(unmetCourses);
    }
}
