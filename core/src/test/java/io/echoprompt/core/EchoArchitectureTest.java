package io.echoprompt.core;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

/**
 * Layering guardrails for the core module: the syntax tree, parser and extension points never see
 * the engine, and the core logs through SLF4J only.
 */
@AnalyzeClasses(
        packages = "io.echoprompt.core",
        importOptions = {ImportOption.DoNotIncludeTests.class})
class EchoArchitectureTest {

    @ArchTest
    static final ArchRule modelIsALeaf = noClasses()
            .that()
            .resideInAPackage("io.echoprompt.core.model..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage(
                    "io.echoprompt.core.parser..",
                    "io.echoprompt.core.engine..",
                    "io.echoprompt.core.spi..",
                    "io.echoprompt.core.context..",
                    "io.echoprompt.core.config..")
            .because("the syntax tree is shared by every stage and must not depend on any of them");

    @ArchTest
    static final ArchRule parserIndependentOfEngine = noClasses()
            .that()
            .resideInAnyPackage("io.echoprompt.core.parser..", "io.echoprompt.core.spi..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.echoprompt.core.engine..", "io.echoprompt.core.config..")
            .because("parsing and the extension points must be usable without an engine");

    @ArchTest
    static final ArchRule noLoggingBackend = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("ch.qos.logback..", "org.apache.logging.log4j..")
            .because("the logging backend is the embedding application's choice");

    @ArchTest
    static final ArchRule reflectionOnlyInEngine = noClasses()
            .that()
            .resideOutsideOfPackage("io.echoprompt.core.engine..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("java.lang.reflect..")
            .because("only plugin loading and path resolution may use reflection");

    @ArchTest
    static final ArchRule engineHasOnlyFinalFields = classes()
            .that()
            .haveSimpleName("EchoEngine")
            .or()
            .haveSimpleName("EchoEvaluator")
            .or()
            .haveSimpleName("EchoRenderer")
            .should()
            .haveOnlyFinalFields()
            .because("engines are shared across concurrent renders");
}
