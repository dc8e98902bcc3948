package com.regvalidator.domain;

import java.util.Optional;

/**
 * Verdict for one registration in one semester. {@code reason} is present only for {@link VerdictStatus#INVALID}.
 */
public record ValidationVerdict(int semesterIndex,
                                String semesterLabel,
                                CourseRegistration registration,
                                VerdictStatus status,
                                VerdictReason reason) {

    public static ValidationVerdict valid(int semesterIndex, String semesterLabel, CourseRegistration registration) {
        return new ValidationVerdict(semesterIndex, semesterLabel, registration, VerdictStatus.VALID, null);
    }

    public static ValidationVerdict invalid(int semesterIndex, String semesterLabel, CourseRegistration registration,
                                            VerdictReason reason) {
        return new ValidationVerdict(semesterIndex, semesterLabel, registration, VerdictStatus.INVALID, reason);
    }

    public static ValidationVerdict notFound(int semesterIndex, String semesterLabel, CourseRegistration registration) {
        return new ValidationVerdict(semesterIndex, semesterLabel, registration, VerdictStatus.NOT_FOUND, null);
    }

    public boolean isInvalid() {
        return status == VerdictStatus.INVALID;
    }

    public Optional<VerdictReason> reasonIfInvalid() {
        return Optional.ofNullable(reason);
    }

    public String code() {
        return registration.code();
    }
}
