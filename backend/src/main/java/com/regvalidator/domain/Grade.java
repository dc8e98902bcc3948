package com.regvalidator.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;

/**
 * Transcript letter grade. Classification is fixed: A..D and P pass, F fails, W and N do not count.
 * Grade points are only defined for grades that enter the GPA.
 */
public enum Grade {
    A("A", GradeClass.PASSING, "4.0"),
    B_PLUS("B+", GradeClass.PASSING, "3.5"),
    B("B", GradeClass.PASSING, "3.0"),
    C_PLUS("C+", GradeClass.PASSING, "2.5"),
    C("C", GradeClass.PASSING, "2.0"),
    D_PLUS("D+", GradeClass.PASSING, "1.5"),
    D("D", GradeClass.PASSING, "1.0"),
    F("F", GradeClass.FAILING, "0.0"),
    W("W", GradeClass.NON_CONTRIBUTING, null),
    P("P", GradeClass.PASSING, null),
    N("N", GradeClass.NON_CONTRIBUTING, null);

    private final String label;
    private final GradeClass gradeClass;
    private final BigDecimal gradePoints;

    Grade(String label, GradeClass gradeClass, String gradePoints) {
        this.label = label;
        this.gradeClass = gradeClass;
        this.gradePoints = gradePoints == null ? null : new BigDecimal(gradePoints);
    }

    @JsonValue
    public String label() {
        return label;
    }

    public GradeClass gradeClass() {
        return gradeClass;
    }

    public boolean isPassing() {
        return gradeClass == GradeClass.PASSING;
    }

    public boolean isFailing() {
        return gradeClass == GradeClass.FAILING;
    }

    /** Points per credit for GPA; empty for W, P and N. */
    public Optional<BigDecimal> gradePoints() {
        return Optional.ofNullable(gradePoints);
    }

    /**
     * Parses a transcript grade label ("B+", " a ", "W"). Returns empty for anything outside the grade scale.
     */
    public static Optional<Grade> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalized = label.strip().toUpperCase(Locale.ROOT);
        for (Grade grade : values()) {
            if (grade.label.equals(normalized)) {
                return Optional.of(grade);
            }
        }
        return Optional.empty();
    }
}
