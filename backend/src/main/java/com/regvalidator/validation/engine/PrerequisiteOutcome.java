package com.regvalidator.validation.engine;

import com.regvalidator.domain.VerdictReason;
import lombok.Getter;

import java.util.List;
import java.util.Set;

/**
 * Result of prerequisite resolution for one registration: either satisfied through one or more paths, or
 * unsatisfied with a reason. A path is the set of same-semester course codes it relies on; an empty path
 * means the requirement is met by earlier semesters alone.
 */
@Getter
public final class PrerequisiteOutcome {

    private static final PrerequisiteOutcome NO_REQUIREMENT = new PrerequisiteOutcome(List.of(Set.of()), null);

    private final List<Set<String>> satisfyingPaths;
    private final VerdictReason reason;

    private PrerequisiteOutcome(List<Set<String>> satisfyingPaths, VerdictReason reason) {
        this.satisfyingPaths = satisfyingPaths;
        this.reason = reason;
    }

    public static PrerequisiteOutcome noRequirement() {
        return NO_REQUIREMENT;
    }

    public static PrerequisiteOutcome satisfied(List<Set<String>> paths) {
        if (paths == null || paths.isEmpty()) {
            throw new IllegalArgumentException("satisfied outcome needs at least one path");
        }
        return new PrerequisiteOutcome(paths.stream().map(Set::copyOf).toList(), null);
    }

    public static PrerequisiteOutcome unsatisfied(VerdictReason reason) {
        return new PrerequisiteOutcome(List.of(), reason);
    }

    public boolean isSatisfied() {
        return reason == null;
    }

    /** True when some path needs nothing from the current semester. */
    public boolean isSatisfiedByHistory() {
        return satisfyingPaths.stream().anyMatch(Set::isEmpty);
    }
}
