package com.regvalidator.validation.engine;

import com.regvalidator.domain.CourseRegistration;
import com.regvalidator.domain.Grade;
import com.regvalidator.domain.Semester;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Registrations of the semester under validation, indexed by code for concurrent-registration checks.
 * Exposes grades only, never sibling verdicts.
 */
public final class SemesterContext {

    private final int index;
    private final String label;
    private final Map<String, List<CourseRegistration>> byCode = new HashMap<>();

    private SemesterContext(int index, String label) {
        this.index = index;
        this.label = label;
    }

    public static SemesterContext of(int index, Semester semester) {
        SemesterContext context = new SemesterContext(index, semester.label());
        for (CourseRegistration registration : semester.registrations()) {
            if (registration.code() != null && !registration.code().isBlank()) {
                context.byCode.computeIfAbsent(registration.code(), c -> new ArrayList<>()).add(registration);
            }
        }
        return context;
    }

    public int index() {
        return index;
    }

    public String label() {
        return label;
    }

    public boolean isRegistered(String code) {
        return byCode.containsKey(code);
    }

    /** Registered this semester and every such registration was withdrawn. */
    public boolean allWithdrawn(String code) {
        List<CourseRegistration> registrations = byCode.get(code);
        return registrations != null && registrations.stream().allMatch(r -> r.grade() == Grade.W);
    }
}
