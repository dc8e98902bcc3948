package com.regvalidator.validation.engine;

import com.regvalidator.domain.CourseCatalogEntry;
import com.regvalidator.domain.CourseRegistration;
import com.regvalidator.domain.ReasonKind;
import com.regvalidator.domain.Semester;
import com.regvalidator.domain.ValidationVerdict;
import com.regvalidator.domain.VerdictReason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;

import static com.regvalidator.validation.engine.EngineFixtures.course;
import static com.regvalidator.validation.engine.EngineFixtures.courseWithGroups;
import static com.regvalidator.validation.engine.EngineFixtures.first;
import static com.regvalidator.validation.engine.EngineFixtures.group;
import static com.regvalidator.validation.engine.EngineFixtures.reg;
import static com.regvalidator.validation.engine.EngineFixtures.second;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class PrerequisiteResolverTest {

    @Spy
    ConcurrentRegistrationPolicy concurrentPolicy = new ConcurrentRegistrationPolicy();

    @InjectMocks
    PrerequisiteResolver resolver;

    @Test
    @DisplayName("entry without requirements is satisfied trivially and needs nothing from the semester")
    void noRequirement() {
        PrerequisiteOutcome outcome = resolver.resolve(course("A"), new RegistrationHistory(), context(0, first("2020")));

        assertThat(outcome.isSatisfied()).isTrue();
        assertThat(outcome.isSatisfiedByHistory()).isTrue();
    }

    @Test
    @DisplayName("history pass satisfies without consulting the concurrent policy")
    void historyPass_policyNotConsulted() {
        RegistrationHistory history = history(first("2020", reg("A", "C")));

        PrerequisiteOutcome outcome = resolver.resolve(course("B", "A"), history, context(1, second("2020")));

        assertThat(outcome.isSatisfied()).isTrue();
        assertThat(outcome.getSatisfyingPaths()).containsExactly(Set.of());
        verify(concurrentPolicy, never()).evaluate(any(), any(), any(), any());
    }

    @Test
    @DisplayName("concurrent retake path records the same-semester course it relies on")
    void concurrentRetake_recordsPath() {
        RegistrationHistory history = history(first("2020", reg("A", "F")));
        SemesterContext semester = context(1, second("2020", reg("A", "B"), reg("B", "B")));

        PrerequisiteOutcome outcome = resolver.resolve(course("B", "A"), history, semester);

        assertThat(outcome.isSatisfied()).isTrue();
        assertThat(outcome.isSatisfiedByHistory()).isFalse();
        assertThat(outcome.getSatisfyingPaths()).containsExactly(Set.of("A"));
    }

    @Test
    @DisplayName("all primary prerequisites must be met; the first unmet one is reported")
    void primaryList_isConjunction() {
        RegistrationHistory history = history(first("2020", reg("A", "A")));

        PrerequisiteOutcome outcome = resolver.resolve(course("C", "A", "B"), history, context(1, second("2020")));

        assertThat(outcome.isSatisfied()).isFalse();
        VerdictReason reason = outcome.getReason();
        assertThat(reason.kind()).isEqualTo(ReasonKind.PREREQUISITE);
        assertThat(reason.unmetCourses()).containsExactly("B");
        assertThat(reason.message()).isEqualTo("Prerequisite B not satisfied: not passed before Second 2020");
    }

    @Test
    @DisplayName("primary list and declared groups are alternatives")
    void primaryListAndGroups_areAlternatives() {
        CourseCatalogEntry entry = new CourseCatalogEntry("D", "Course D", "3", "general",
                Set.of("A"), Set.of(), List.of(group(false, "B")));
        RegistrationHistory history = history(first("2020", reg("B", "B")));

        PrerequisiteOutcome outcome = resolver.resolve(entry, history, context(1, second("2020")));

        assertThat(outcome.isSatisfied()).isTrue();
    }

    @Test
    @DisplayName("group failure is cascade only when every alternative failed on an invalid prerequisite")
    void groupFailure_cascadeFlag() {
        CourseCatalogEntry entry = courseWithGroups("D", group(false, "A"), group(false, "B"));
        RegistrationHistory history = new RegistrationHistory();
        CourseRegistration a = reg("A", "A");
        CourseRegistration b = reg("B", "A");
        history.commit(List.of(
                ValidationVerdict.invalid(0, "First 2020", a, VerdictReason.dataError("x")),
                ValidationVerdict.valid(0, "First 2020", reg("X", "A"))));

        PrerequisiteOutcome partial = resolver.resolve(entry, history, context(1, second("2020")));
        assertThat(partial.getReason().kind()).isEqualTo(ReasonKind.PREREQUISITE_GROUP);
        assertThat(partial.getReason().cascade()).isFalse();
        assertThat(partial.getReason().unmetCourses()).containsExactly("A", "B");

        history.commit(List.of(ValidationVerdict.invalid(1, "Second 2020", b, VerdictReason.dataError("y"))));
        PrerequisiteOutcome full = resolver.resolve(entry, history, context(2, first("2021")));
        assertThat(full.getReason().cascade()).isTrue();
    }

    private static SemesterContext context(int index, Semester semester) {
        return SemesterContext.of(index, semester);
    }

    private static RegistrationHistory history(Semester... semesters) {
        RegistrationHistory history = new RegistrationHistory();
        for (int i = 0; i < semesters.length; i++) {
            Semester semester = semesters[i];
            int index = i;
            history.commit(semester.registrations().stream()
                    .map(r -> ValidationVerdict.valid(index, semester.label(), r))
                    .toList());
        }
        return history;
    }
}
