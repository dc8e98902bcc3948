package com.regvalidator.validation.config;

import com.regvalidator.validation.engine.CreditLimits;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Credit caps applied by the credit-limit check. Read once at startup and handed to the engine as
 * an immutable {@link CreditLimits}.
 */
@ConfigurationProperties(prefix = "regvalidator.validation")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class ValidationProperties {

    /** Credits above which a First or Second semester gets an overload notice. */
    @Positive
    private int regularSemesterCreditLimit = CreditLimits.DEFAULT_REGULAR_LIMIT;

    /** Credits above which a Summer semester gets an overload notice. */
    @Positive
    private int summerCreditLimit = CreditLimits.DEFAULT_SUMMER_LIMIT;

    public CreditLimits toCreditLimits() {
        return new CreditLimits(regularSemesterCreditLimit, summerCreditLimit);
    }
}
