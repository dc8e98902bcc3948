package com.regvalidator.validation.engine;

import com.regvalidator.domain.CourseRegistration;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Credit-weighted GPA over registrations whose grade carries points (W, P, N and malformed records are skipped).
 */
@Component
public class GpaCalculator {

    private static final int SCALE = 2;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    public BigDecimal gpa(Collection<CourseRegistration> registrations) {
        BigDecimal points = BigDecimal.ZERO;
        int credits = 0;
        for (CourseRegistration registration : registrations) {
            if (registration.grade() == null || registration.credits() == null || registration.credits() <= 0) {
                continue;
            }
            var gradePoints = registration.grade().gradePoints();
            if (gradePoints.isEmpty()) {
                continue;
            }
            points = points.add(gradePoints.get().multiply(BigDecimal.valueOf(registration.credits())));
            credits += registration.credits();
        }
        if (credits == 0) {
            return BigDecimal.ZERO.setScale(SCALE, ROUNDING);
        }
        return points.divide(BigDecimal.valueOf(credits), SCALE, ROUNDING);
    }
}
