package com.boardsketch.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate architectural rules and design patterns.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>The model stays independent of the stages that work on it</li>
 *   <li>Parsers, layouts and renderers are reached through their SPI</li>
 *   <li>Value types are implemented as immutable records</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.boardsketch.core");
    }

    /**
     * Verifies the model has no dependencies on the stages that produce or consume it.
     */
    @Test
    void models_shouldNotDependOnStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..parser..", "..layout..", "..convert..", "..renderer..", "..pipeline..", "..config..");

        rule.check(classes);
    }

    /**
     * Verifies value types of the model are records. Node, Edge and Diagram carry layout
     * results written after parsing and are the only mutable model classes.
     */
    @Test
    void modelValues_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .and().doNotHaveSimpleName("Node")
            .and().doNotHaveSimpleName("Edge")
            .and().doNotHaveSimpleName("Diagram")
            .should().beRecords();

        rule.check(classes);
    }

    /**
     * Verifies placements are immutable records.
     */
    @Test
    void placements_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..convert..")
            .and().haveSimpleNameEndingWith("Placement")
            .should().beRecords();

        rule.check(classes);
    }

    /**
     * Verifies parser implementations implement the DiagramParser SPI.
     */
    @Test
    void parsers_shouldImplementDiagramParser() {
        ArchRule rule = classes()
            .that().resideInAPackage("..parser.impl..")
            .and().areTopLevelClasses()
            .should().implement("com.boardsketch.core.parser.DiagramParser");

        rule.check(classes);
    }

    /**
     * Verifies layout implementations implement the LayoutEngine SPI.
     */
    @Test
    void layouts_shouldImplementLayoutEngine() {
        ArchRule rule = classes()
            .that().resideInAPackage("..layout.impl..")
            .and().areTopLevelClasses()
            .should().implement("com.boardsketch.core.layout.LayoutEngine");

        rule.check(classes);
    }

    /**
     * Verifies the parsing stage knows nothing about layout or conversion.
     */
    @Test
    void parsers_shouldNotDependOnLaterStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..parser..")
            .should().dependOnClassesThat().resideInAnyPackage("..layout..", "..convert..", "..renderer..");

        rule.check(classes);
    }

    /**
     * Verifies layout engines don't depend on conversion or rendering.
     */
    @Test
    void layouts_shouldNotDependOnLaterStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..layout..")
            .should().dependOnClassesThat().resideInAnyPackage("..parser..", "..convert..", "..renderer..");

        rule.check(classes);
    }

    /**
     * Verifies implementation packages are only reached through service registration.
     */
    @Test
    void implementations_shouldNotBeReferencedOutsideTheirPackage() {
        ArchRule rule = noClasses()
            .that().resideOutsideOfPackages("..parser.impl..", "..layout.impl..", "..renderer.impl..")
            .should().dependOnClassesThat().resideInAnyPackage("..parser.impl..", "..layout.impl..", "..renderer.impl..");

        rule.check(classes);
    }

    /**
     * Verifies utility classes don't depend on the pipeline stages.
     */
    @Test
    void utilClasses_shouldNotDependOnStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage("..parser..", "..layout..", "..convert..", "..renderer..");

        rule.check(classes);
    }
}
