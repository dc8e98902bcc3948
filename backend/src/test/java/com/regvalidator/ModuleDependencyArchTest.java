package com.regvalidator;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: the engine is a pure function of transcript, catalog and credit limits, and the
 * outer layers (catalog files, transcript JSON, report text, batch, HTTP) depend on it, never the reverse.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.regvalidator");
    }

    @Test
    void domain_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.regvalidator.domain..")
                .should().dependOnClassesThat().resideInAnyPackage("com.regvalidator.validation..", "com.regvalidator.catalog..", "com.regvalidator.transcript..",
                        "com.regvalidator.report..", "com.regvalidator.batch..", "com.regvalidator.api..", "com.regvalidator.config..");
        rule.check(classes);
    }

    @Test
    void engine_must_not_depend_on_io_or_configuration() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage("com.regvalidator.validation.engine..", "com.regvalidator.validation.result..")
                .should().dependOnClassesThat().resideInAnyPackage("com.regvalidator.catalog..", "com.regvalidator.transcript..", "com.regvalidator.report..",
                        "com.regvalidator.batch..", "com.regvalidator.api..", "com.regvalidator.config..", "com.regvalidator.validation.config..");
        rule.check(classes);
    }

    @Test
    void result_must_not_depend_on_engine() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.regvalidator.validation.result..")
                .should().dependOnClassesThat().resideInAPackage("com.regvalidator.validation.engine..");
        rule.check(classes);
    }

    @Test
    void transcript_must_only_depend_on_domain() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.regvalidator.transcript..")
                .should().dependOnClassesThat().resideInAnyPackage("com.regvalidator.catalog..", "com.regvalidator.validation..", "com.regvalidator.report..",
                        "com.regvalidator.batch..", "com.regvalidator.api..");
        rule.check(classes);
    }

    @Test
    void report_must_not_depend_on_batch_api_or_readers() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.regvalidator.report..")
                .should().dependOnClassesThat().resideInAnyPackage("com.regvalidator.batch..", "com.regvalidator.api..", "com.regvalidator.catalog..",
                        "com.regvalidator.transcript..", "com.regvalidator.validation.engine..");
        rule.check(classes);
    }

    @Test
    void only_api_uses_controllers_and_dtos() {
        ArchRule rule = noClasses()
                .that().resideOutsideOfPackage("com.regvalidator.api..")
                .should().dependOnClassesThat().resideInAnyPackage("com.regvalidator.api.controller..", "com.regvalidator.api.dto..");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_inside_validation() {
        ArchRule rule = slices()
                .matching("com.regvalidator.validation.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
