package com.lnradar;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Module dependency rules. Ingestion never knows about notification delivery or the HTTP surface; the two are
 * joined only through application events carrying domain types.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.lnradar");
    }

    @Test
    void domain_must_only_depend_on_common() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.lnradar.domain..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.lnradar.ingestion..", "com.lnradar.config..", "com.lnradar.api..",
                        "com.lnradar.notification..", "com.lnradar.donation..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.lnradar.common..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.lnradar.ingestion..", "com.lnradar.config..", "com.lnradar.api..",
                        "com.lnradar.notification..", "com.lnradar.donation..");
        rule.check(classes);
    }

    @Test
    void ingestion_must_not_depend_on_notification_donation_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.lnradar.ingestion..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.lnradar.notification..", "com.lnradar.donation..", "com.lnradar.api..");
        rule.check(classes);
    }

    @Test
    void notification_must_not_depend_on_api_or_stores() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.lnradar.notification..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.lnradar.api..", "com.lnradar.ingestion.store..", "com.lnradar.ingestion.sync..");
        rule.check(classes);
    }

    @Test
    void donation_must_not_depend_on_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.lnradar.donation..")
                .should().dependOnClassesThat().resideInAPackage("com.lnradar.api..");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.lnradar.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }

    @Test
    void ingestion_sync_must_not_depend_on_job_triggers() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.lnradar.ingestion.sync..")
                .should().dependOnClassesThat().resideInAPackage("com.lnradar.ingestion.job..");
        rule.check(classes);
    }

    @Test
    void stores_must_not_depend_on_sync_or_jobs() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.lnradar.ingestion.store..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.lnradar.ingestion.sync..", "com.lnradar.ingestion.job..");
        rule.check(classes);
    }
}
