package com.fsmgen.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests for the layering of the compiler pipeline.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are immutable records or enums</li>
 *   <li>The model depends on no other pipeline stage</li>
 *   <li>Stages only depend on earlier stages</li>
 *   <li>Generators and renderers are plugged in through their interfaces</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.fsmgen.core");
    }

    /**
     * Verifies all domain models in the model package are implemented as Java records.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnPipelineStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.parser..", "..core.resolver..", "..core.generator..",
                "..core.compiler..", "..core.renderer..", "..core.config..");

        rule.check(classes);
    }

    /**
     * The parser builds the model only; resolution and generation come later.
     */
    @Test
    void parser_shouldNotDependOnLaterStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.parser..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.resolver..", "..core.generator..", "..core.compiler..", "..core.renderer..");

        rule.check(classes);
    }

    @Test
    void resolver_shouldNotDependOnGenerators() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.resolver..")
            .should().dependOnClassesThat().resideInAnyPackage("..core.generator..", "..core.renderer..");

        rule.check(classes);
    }

    /**
     * Verifies generator implementations implement the CodeGenerator SPI.
     */
    @Test
    void generators_shouldImplementCodeGenerator() {
        ArchRule rule = classes()
            .that().resideInAPackage("..generator.impl..")
            .and().areTopLevelClasses()
            .should().implement("com.fsmgen.core.generator.CodeGenerator");

        rule.check(classes);
    }

    @Test
    void renderers_shouldImplementOutputRenderer() {
        ArchRule rule = classes()
            .that().resideInAPackage("..renderer.impl..")
            .and().areTopLevelClasses()
            .should().implement("com.fsmgen.core.renderer.OutputRenderer");

        rule.check(classes);
    }

    /**
     * Utilities stay free of domain dependencies.
     */
    @Test
    void utilClasses_shouldNotDependOnDomain() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.util..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.model..", "..core.parser..", "..core.resolver..", "..core.generator..");

        rule.check(classes);
    }
}
