package com.regvalidator.validation.result;

/**
 * Registered course whose code is absent from the catalog.
 */
public record NotFoundCourse(String code, String name, int semesterIndex, String semester) {
}
