package com.regvalidator.validation.engine;

import com.regvalidator.domain.CourseCatalogEntry;
import com.regvalidator.domain.PrerequisiteGroup;
import com.regvalidator.domain.ReasonKind;
import com.regvalidator.domain.VerdictReason;
import com.regvalidator.validation.engine.ConcurrentRegistrationPolicy.Decision;
import com.regvalidator.validation.engine.RegistrationHistory.Attempt;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides whether a course's prerequisite requirement is satisfied for a registration in a given semester.
 * The requirement is an OR over alternatives (primary list as an implicit group, then declared groups) and an
 * AND inside each alternative. Pure function of (catalog entry, earlier history, current semester grades).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PrerequisiteResolver {

    private final ConcurrentRegistrationPolicy concurrentPolicy;

    public PrerequisiteOutcome resolve(CourseCatalogEntry entry, RegistrationHistory history, SemesterContext semester) {
        List<PrerequisiteGroup> alternatives = entry.alternatives();
        if (alternatives.isEmpty()) {
            return PrerequisiteOutcome.noRequirement();
        }

        List<Set<String>> paths = new ArrayList<>();
        List<GroupCheck> failures = new ArrayList<>();
        for (PrerequisiteGroup group : alternatives) {
            GroupCheck check = checkGroup(group, history, semester);
            if (check.satisfied()) {
                paths.add(check.concurrentCourses());
            } else {
                failures.add(check);
            }
        }
        if (!paths.isEmpty()) {
            log.debug("{} in {} satisfied by {} path(s)", entry.code(), semester.label(), paths.size());
            return PrerequisiteOutcome.satisfied(paths);
        }

        VerdictReason reason = entry.hasDeclaredGroups()
                ? groupReason(failures)
                : new VerdictReason(ReasonKind.PREREQUISITE, failures.get(0).message(),
                        failures.get(0).unmet(), failures.get(0).cascade());
        log.debug("{} in {} unsatisfied: {}", entry.code(), semester.label(), reason.message());
        return PrerequisiteOutcome.unsatisfied(reason);
    }

    /**
     * Every member must be met by an earlier permissible pass or by an allowed concurrent registration.
     * Stops at the first unmet member.
     */
    private GroupCheck checkGroup(PrerequisiteGroup group, RegistrationHistory history, SemesterContext semester) {
        Set<String> concurrent = new LinkedHashSet<>();
        for (String code : group.courses().stream().sorted().toList()) {
            Optional<Attempt> governing = history.governingAttempt(code);
            if (governing.isPresent() && governing.get().satisfies()) {
                continue;
            }
            Decision decision = concurrentPolicy.evaluate(code, group, governing, semester);
            if (decision == Decision.ALLOWED) {
                concurrent.add(code);
                continue;
            }
            return unmet(code, decision, governing, semester);
        }
        return GroupCheck.met(concurrent);
    }

    private GroupCheck unmet(String code, Decision decision, Optional<Attempt> governing, SemesterContext semester) {
        if (decision == Decision.RETAKE_WITHDRAWN) {
            return GroupCheck.unmet(code, "Prerequisite " + code + " was withdrawn (W) in this semester", false);
        }
        if (governing.isPresent() && governing.get().isInvalid()) {
            Attempt attempt = governing.get();
            return GroupCheck.unmet(code, "Prerequisite " + code + " is invalid (registered in "
                    + attempt.semesterLabel() + ")", true);
        }
        if (decision == Decision.NOT_ELIGIBLE) {
            String history = governing.map(a -> "last attempt " + gradeText(a) + " in " + a.semesterLabel())
                    .orElse("no previous attempt");
            return GroupCheck.unmet(code, "Prerequisite " + code + " not satisfied: taken concurrently in "
                    + semester.label() + " but not eligible for concurrent registration (" + history + ")", false);
        }
        String detail = governing
                .map(a -> "last attempt " + gradeText(a) + " in " + a.semesterLabel())
                .orElse("not passed before " + semester.label());
        return GroupCheck.unmet(code, "Prerequisite " + code + " not satisfied: " + detail, false);
    }

    private static String gradeText(Attempt attempt) {
        if (attempt.grade() == null) {
            return "ungraded";
        }
        return switch (attempt.grade()) {
            case F -> "failed (F)";
            case W -> "withdrawn (W)";
            case N -> "not graded (N)";
            default -> "graded " + attempt.grade().label();
        };
    }

    private static VerdictReason groupReason(List<GroupCheck> failures) {
        StringBuilder message = new StringBuilder("No prerequisite group satisfied");
        for (int i = 0; i < failures.size(); i++) {
            message.append(i == 0 ? ": " : "; ")
                    .append("option ").append(i + 1).append(" - ").append(failures.get(i).message());
        }
        List<String> unmet = failures.stream()
                .flatMap(f -> f.unmet().stream())
                .distinct()
                .collect(Collectors.toList());
        boolean cascade = failures.stream().allMatch(GroupCheck::cascade);
        return new VerdictReason(ReasonKind.PREREQUISITE_GROUP, message.toString(), unmet, cascade);
    }

    private record GroupCheck(boolean satisfied, Set<String> concurrentCourses, List<String> unmet,
                              String message, boolean cascade) {

        static GroupCheck met(Set<String> concurrentCourses) {
            return new GroupCheck(true, concurrentCourses, List.of(), null, false);
        }

        static GroupCheck unmet(String code, String message, boolean cascade) {
            return new GroupCheck(false, Set.of(), List.of(code), message, cascade);
        }
    }
}
