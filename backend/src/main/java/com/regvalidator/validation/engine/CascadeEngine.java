package com.regvalidator.validation.engine;

import com.regvalidator.domain.CourseCatalog;
import com.regvalidator.domain.CourseCatalogEntry;
import com.regvalidator.domain.CourseRegistration;
import com.regvalidator.domain.Grade;
import com.regvalidator.domain.ReasonKind;
import com.regvalidator.domain.Semester;
import com.regvalidator.domain.Transcript;
import com.regvalidator.domain.ValidationVerdict;
import com.regvalidator.domain.VerdictReason;
import com.regvalidator.domain.VerdictStatus;
import com.regvalidator.validation.result.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Forward pass over a transcript's semesters in the given (chronological) order.
 * <p>
 * Each semester is resolved against the committed history of strictly earlier semesters, then invalidity is
 * propagated between siblings that were accepted through concurrent registration, and only then is the semester
 * committed. Invalidity therefore flows transitively through any prerequisite chain without a dependency graph.
 * <p>
 * Stateless: all pass state lives in a {@link RegistrationHistory} local to one call, so a single instance may
 * validate many transcripts in parallel against the same catalog.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CascadeEngine {

    private final PrerequisiteResolver prerequisiteResolver;
    private final ValidationReportAggregator reportAggregator;

    public ValidationResult validate(Transcript transcript, CourseCatalog catalog) {
        return validate(transcript, catalog, CreditLimits.defaults());
    }

    public ValidationResult validate(Transcript transcript, CourseCatalog catalog, CreditLimits limits) {
        List<List<ValidationVerdict>> verdicts = evaluate(transcript, catalog);
        return reportAggregator.aggregate(transcript, catalog, verdicts, limits);
    }

    /**
     * Verdicts per semester, in transcript order; each inner list follows the semester's registration order.
     */
    public List<List<ValidationVerdict>> evaluate(Transcript transcript, CourseCatalog catalog) {
        RegistrationHistory history = new RegistrationHistory();
        List<List<ValidationVerdict>> bySemester = new ArrayList<>();
        List<Semester> semesters = transcript.semesters();
        for (int i = 0; i < semesters.size(); i++) {
            List<ValidationVerdict> verdicts = validateSemester(i, semesters.get(i), catalog, history);
            history.commit(verdicts);
            bySemester.add(verdicts);
        }
        log.debug("Evaluated {} semester(s) for student {}", semesters.size(), transcript.student().id());
        return bySemester;
    }

    private List<ValidationVerdict> validateSemester(int index, Semester semester, CourseCatalog catalog,
                                                     RegistrationHistory history) {
        SemesterContext context = SemesterContext.of(index, semester);
        List<Pending> pending = new ArrayList<>();
        for (CourseRegistration registration : semester.registrations()) {
            pending.add(resolve(registration, catalog, history, context));
        }
        propagateSiblingInvalidity(pending, context);
        return pending.stream().map(p -> p.verdict).toList();
    }

    private Pending resolve(CourseRegistration registration, CourseCatalog catalog, RegistrationHistory history,
                            SemesterContext context) {
        if (registration.isMalformed() || registration.code() == null || registration.code().isBlank()) {
            String error = registration.isMalformed() ? registration.dataError() : "Missing course code";
            log.debug("Data error for {} in {}: {}", registration.code(), context.label(), error);
            return new Pending(registration, null, null, ValidationVerdict.invalid(context.index(), context.label(),
                    registration, VerdictReason.dataError(error)));
        }
        Optional<CourseCatalogEntry> entry = catalog.lookup(registration.code());
        if (entry.isEmpty()) {
            return new Pending(registration, null, null,
                    ValidationVerdict.notFound(context.index(), context.label(), registration));
        }
        if (registration.grade() == Grade.W || registration.grade() == Grade.N) {
            // withdrawn or not graded yet: nothing to check, still recorded as an attempt
            return new Pending(registration, entry.get(), PrerequisiteOutcome.noRequirement(),
                    ValidationVerdict.valid(context.index(), context.label(), registration));
        }
        PrerequisiteOutcome outcome = prerequisiteResolver.resolve(entry.get(), history, context);
        ValidationVerdict verdict = outcome.isSatisfied()
                ? ValidationVerdict.valid(context.index(), context.label(), registration)
                : ValidationVerdict.invalid(context.index(), context.label(), registration, outcome.getReason());
        return new Pending(registration, entry.get(), outcome, verdict);
    }

    /**
     * A registration accepted only through concurrent paths stays valid while some path has every course backed by
     * a usable sibling (not invalid, not withdrawn). Iterates until no verdict changes; mutually concurrent
     * registrations that do not depend on an invalid sibling keep their verdicts.
     */
    private void propagateSiblingInvalidity(List<Pending> pending, SemesterContext context) {
        boolean changed = true;
        while (changed) {
            changed = false;
            Set<String> usable = usableCodes(pending);
            for (Pending candidate : pending) {
                if (candidate.verdict.status() != VerdictStatus.VALID || candidate.outcome.isSatisfiedByHistory()) {
                    continue;
                }
                boolean backed = candidate.outcome.getSatisfyingPaths().stream().anyMatch(usable::containsAll);
                if (!backed) {
                    candidate.verdict = ValidationVerdict.invalid(context.index(), context.label(),
                            candidate.registration, siblingCascadeReason(candidate, usable, context));
                    log.debug("{} in {} invalidated by same-semester prerequisite", candidate.registration.code(),
                            context.label());
                    changed = true;
                }
            }
        }
    }

    private static Set<String> usableCodes(List<Pending> pending) {
        Set<String> usable = new HashSet<>();
        for (Pending p : pending) {
            if (p.verdict.status() != VerdictStatus.INVALID && p.registration.grade() != Grade.W) {
                usable.add(p.registration.code());
            }
        }
        return usable;
    }

    private static VerdictReason siblingCascadeReason(Pending candidate, Set<String> usable, SemesterContext context) {
        Set<String> blocked = new LinkedHashSet<>();
        for (Set<String> path : candidate.outcome.getSatisfyingPaths()) {
            path.stream().filter(code -> !usable.contains(code)).sorted().forEach(blocked::add);
        }
        String first = blocked.iterator().next();
        ReasonKind kind = candidate.entry.hasDeclaredGroups() ? ReasonKind.PREREQUISITE_GROUP : ReasonKind.PREREQUISITE;
        String message = "Prerequisite " + first + " is invalid (registered in " + context.label() + ")";
        return new VerdictReason(kind, message, List.copyOf(blocked), true);
    }

    private static final class Pending {
        private final CourseRegistration registration;
        private final CourseCatalogEntry entry;
        private final PrerequisiteOutcome outcome;
        private ValidationVerdict verdict;

        private Pending(CourseRegistration registration, CourseCatalogEntry entry, PrerequisiteOutcome outcome,
                        ValidationVerdict verdict) {
            this.registration = registration;
            this.entry = entry;
            this.outcome = outcome;
            this.verdict = verdict;
        }
    }
}
