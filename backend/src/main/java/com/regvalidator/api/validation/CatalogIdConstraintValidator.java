package com.regvalidator.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import org.springframework.beans.factory.annotation.Autowired;

/**
 * Jakarta Bean Validation adapter for {@link CatalogId}. Delegates to CatalogIdValidator.
 */
public class CatalogIdConstraintValidator implements ConstraintValidator<CatalogId, String> {

    private final CatalogIdValidator catalogIdValidator;

    public CatalogIdConstraintValidator() {
        this(new CatalogIdValidator());
    }

    @Autowired
    public CatalogIdConstraintValidator(CatalogIdValidator catalogIdValidator) {
        this.catalogIdValidator = catalogIdValidator;
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value != null && catalogIdValidator.isValidCatalogId(value);
    }
}
