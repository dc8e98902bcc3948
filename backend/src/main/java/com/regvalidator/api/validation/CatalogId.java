package com.regvalidator.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.*;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Catalog id: 1-64 of letters, digits, '.', '_' or '-', no "..".
 * Error code for API: INVALID_CATALOG_ID.
 */
@Target({FIELD, PARAMETER})
@Retention(RUNTIME)
@Documented
@Constraint(validatedBy = CatalogIdConstraintValidator.class)
public @interface CatalogId {

    String message() default "INVALID_CATALOG_ID";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
