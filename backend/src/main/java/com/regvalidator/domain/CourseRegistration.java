package com.regvalidator.domain;

/**
 * One course attempt inside a semester. {@code grade} is null and {@code dataError} set when the source
 * record could not be read; such a registration is still validated (as a data error) and counted.
 */
public record CourseRegistration(String code, String name, Grade grade, Integer credits, String dataError) {

    public static CourseRegistration of(String code, String name, Grade grade, int credits) {
        return new CourseRegistration(code, name, grade, credits, null);
    }

    public static CourseRegistration malformed(String code, String name, Grade grade, Integer credits, String dataError) {
        return new CourseRegistration(code, name, grade, credits, dataError);
    }

    public boolean isMalformed() {
        return dataError != null;
    }

    /** Declared credits, 0 when absent. */
    public int creditCount() {
        return credits != null ? credits : 0;
    }

    public String gradeLabel() {
        return grade != null ? grade.label() : "";
    }
}
