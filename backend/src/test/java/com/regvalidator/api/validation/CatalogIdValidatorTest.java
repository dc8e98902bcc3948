package com.regvalidator.api.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CatalogIdValidatorTest {

    private final CatalogIdValidator validator = new CatalogIdValidator();

    @Test
    @DisplayName("Plain catalog ids accepted")
    void validCatalogIds() {
        assertThat(validator.isValidCatalogId("course_data")).isTrue();
        assertThat(validator.isValidCatalogId("ie-2023.v2")).isTrue();
        assertThat(validator.isValidCatalogId("a".repeat(64))).isTrue();
    }

    @Test
    @DisplayName("Blank, traversal and separator ids rejected")
    void invalidCatalogIds() {
        assertThat(validator.isValidCatalogId(null)).isFalse();
        assertThat(validator.isValidCatalogId(" ")).isFalse();
        assertThat(validator.isValidCatalogId(".")).isFalse();
        assertThat(validator.isValidCatalogId("..")).isFalse();
        assertThat(validator.isValidCatalogId("../secrets")).isFalse();
        assertThat(validator.isValidCatalogId("catalogs/course_data")).isFalse();
        assertThat(validator.isValidCatalogId("a".repeat(65))).isFalse();
    }

    @Test
    @DisplayName("Constraint adapter rejects null and delegates otherwise")
    void constraintAdapter() {
        CatalogIdConstraintValidator constraint = new CatalogIdConstraintValidator(validator);

        assertThat(constraint.isValid(null, null)).isFalse();
        assertThat(constraint.isValid("course_data", null)).isTrue();
        assertThat(constraint.isValid("..", null)).isFalse();
    }
}
