package com.docbinder.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate the layering of the build pipeline.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>The document tree model depends on nothing else in the project</li>
 *   <li>Only the pipeline driver wires the stages together</li>
 *   <li>Stages do not reach into each other</li>
 *   <li>Configuration values are implemented as immutable records</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.docbinder.core");
    }

    /**
     * The tree model is the shared vocabulary of every stage and must stay free of them.
     */
    @Test
    void tree_shouldNotDependOnStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.tree..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.assembly..", "..core.index..", "..core.xref..", "..core.toc..",
                "..core.translate..", "..core.pipeline..", "..core.source..", "..core.config..");

        rule.check(classes);
    }

    @Test
    void pipeline_shouldOnlyBeUsedFromPipeline() {
        ArchRule rule = noClasses()
            .that().resideOutsideOfPackage("..core.pipeline..")
            .should().dependOnClassesThat().resideInAPackage("..core.pipeline..");

        rule.check(classes);
    }

    /**
     * Stages communicate through the tree only; the driver decides their order.
     */
    @Test
    void stages_shouldNotDependOnEachOther() {
        noClasses()
            .that().resideInAPackage("..core.assembly..")
            .should().dependOnClassesThat().resideInAnyPackage("..core.xref..", "..core.translate..", "..core.toc..")
            .check(classes);

        noClasses()
            .that().resideInAPackage("..core.translate..")
            .should().dependOnClassesThat().resideInAnyPackage("..core.assembly..", "..core.xref..", "..core.index..")
            .check(classes);

        noClasses()
            .that().resideInAPackage("..core.toc..")
            .should().dependOnClassesThat().resideInAnyPackage("..core.assembly..", "..core.xref..", "..core.translate..")
            .check(classes);
    }

    @Test
    void configValues_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..core.config..")
            .and().areTopLevelClasses()
            .and().haveSimpleNameNotEndingWith("Loader")
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void handlers_shouldImplementNodeHandler() {
        ArchRule rule = classes()
            .that().resideInAPackage("..core.translate")
            .and().haveSimpleNameEndingWith("Handler")
            .should().beAssignableTo("com.docbinder.core.translate.NodeHandler");

        rule.check(classes);
    }

    @Test
    void renderers_shouldImplementPageRenderer() {
        ArchRule rule = classes()
            .that().resideInAPackage("..core.renderer..")
            .and().haveSimpleNameEndingWith("Renderer")
            .should().beAssignableTo("com.docbinder.core.renderer.PageRenderer");

        rule.check(classes);
    }
}
