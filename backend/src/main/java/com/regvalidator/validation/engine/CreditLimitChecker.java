package com.regvalidator.validation.engine;

import com.regvalidator.domain.Semester;
import com.regvalidator.validation.result.CreditWarning;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Flags semesters whose summed credits exceed the cap. Overload is a warning only: it never changes a verdict.
 * Every registration counts, including courses missing from the catalog and withdrawn ones.
 */
@Component
public class CreditLimitChecker {

    public Optional<CreditWarning> check(Semester semester, CreditLimits limits) {
        int total = semester.totalCredits();
        int limit = limits.limitFor(semester.type());
        if (total <= limit) {
            return Optional.empty();
        }
        String kind = semester.type().isSummer() ? "summer" : "regular semester";
        String message = "NOTICE: Exceeds typical " + limit + " credits for " + kind + " (registered: " + total + ")";
        return Optional.of(new CreditWarning(semester.label(), total, limit, message));
    }
}
