package com.regvalidator.validation.engine;

import com.regvalidator.domain.Grade;
import com.regvalidator.domain.ValidationVerdict;
import com.regvalidator.domain.VerdictStatus;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Running map of course code to its attempts in already-committed semesters, oldest first.
 * Local to one validation pass; a semester is committed only after all of its verdicts are final,
 * so every attempt visible here lies in a strictly earlier semester than the one being validated.
 */
public final class RegistrationHistory {

    private final Map<String, List<Attempt>> attemptsByCode = new HashMap<>();
    private int committedSemesters;

    /**
     * Most recent earlier attempt with a contributing grade (passing or F); a later pass supersedes an earlier
     * fail and vice versa. W, N and ungraded attempts govern only when no contributing attempt exists.
     */
    public Optional<Attempt> governingAttempt(String code) {
        List<Attempt> attempts = attemptsByCode.get(code);
        if (attempts == null || attempts.isEmpty()) {
            return Optional.empty();
        }
        for (int i = attempts.size() - 1; i >= 0; i--) {
            if (attempts.get(i).isContributing()) {
                return Optional.of(attempts.get(i));
            }
        }
        return Optional.of(attempts.get(attempts.size() - 1));
    }

    public List<Attempt> attempts(String code) {
        return List.copyOf(attemptsByCode.getOrDefault(code, List.of()));
    }

    public int committedSemesters() {
        return committedSemesters;
    }

    /**
     * Records one semester's final verdicts. Must be called once per semester, in chronological order.
     */
    void commit(List<ValidationVerdict> semesterVerdicts) {
        for (ValidationVerdict verdict : semesterVerdicts) {
            String code = verdict.code();
            if (code == null || code.isBlank()) {
                continue;
            }
            attemptsByCode.computeIfAbsent(code, c -> new ArrayList<>())
                    .add(new Attempt(verdict.semesterIndex(), verdict.semesterLabel(),
                            verdict.registration().grade(), verdict.status()));
        }
        committedSemesters++;
    }

    /**
     * One committed attempt. {@code grade} is null for malformed records.
     */
    public record Attempt(int semesterIndex, String semesterLabel, Grade grade, VerdictStatus status) {

        public boolean isInvalid() {
            return status == VerdictStatus.INVALID;
        }

        /** Passing grade on a registration that was itself permissible. */
        public boolean satisfies() {
            return grade != null && grade.isPassing() && !isInvalid();
        }

        public boolean isFailed() {
            return grade == Grade.F;
        }

        public boolean isContributing() {
            return grade != null && (grade.isPassing() || grade.isFailing());
        }
    }
}
