package com.relevx;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package dependency rules. Scheduling and quota stay pure; only the project and api layers orchestrate.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.relevx");
    }

    @Test
    void domain_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..scheduling..", "..quota..", "..billing..",
                        "..project..", "..cache..", "..push..", "..api..", "..config..");
        rule.check(classes);
    }

    @Test
    void scheduling_and_quota_only_depend_on_domain() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage("..scheduling..", "..quota..")
                .should().dependOnClassesThat().resideInAnyPackage("..billing..", "..project..", "..cache..",
                        "..push..", "..api..", "..config..", "org.springframework.data..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..common..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..scheduling..", "..quota..",
                        "..billing..", "..project..", "..cache..", "..push..", "..api..", "..config..");
        rule.check(classes);
    }

    @Test
    void billing_must_not_depend_on_project_cache_push_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..billing..")
                .should().dependOnClassesThat().resideInAnyPackage("..project..", "..cache..", "..push..", "..api..");
        rule.check(classes);
    }

    @Test
    void api_should_not_import_repository_classes() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..api..")
                .should().dependOnClassesThat().haveSimpleNameEndingWith("Repository");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.relevx.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
