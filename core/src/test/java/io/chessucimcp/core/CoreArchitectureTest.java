package io.chessucimcp.core;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

/**
 * Architecture guardrails for the engine bridge module.
 *
 * <p>The core speaks UCI and nothing else: no adapter types, no JSON or YAML stack, no logging
 * backend. Leaf packages stay below the bridge that composes them.
 */
@AnalyzeClasses(
        packages = "io.chessucimcp.core",
        importOptions = {ImportOption.DoNotIncludeTests.class})
class CoreArchitectureTest {

    @ArchTest
    static final ArchRule noAdapterDependencies = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.chessucimcp.mcp..")
            .because("the engine bridge must not know which adapter hosts it");

    @ArchTest
    static final ArchRule noSerializationOrLoggingBackend = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("com.fasterxml..", "ch.qos.logback..", "com.networknt..")
            .because("core logs through the SLF4J API only and exchanges plain Java types");

    @ArchTest
    static final ArchRule noReflectionUsage = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("java.lang.reflect..")
            .because("reflection is forbidden by project governance");

    @ArchTest
    static final ArchRule leavesDoNotReachTheBridge = noClasses()
            .that()
            .resideInAnyPackage(
                    "io.chessucimcp.core.channel..",
                    "io.chessucimcp.core.process..",
                    "io.chessucimcp.core.protocol..",
                    "io.chessucimcp.core.analysis..",
                    "io.chessucimcp.core.option..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.chessucimcp.core.engine..")
            .because("the bridge composes the leaf components, never the other way round");

    @ArchTest
    static final ArchRule modelIsImmutable = classes()
            .that()
            .resideInAPackage("io.chessucimcp.core.model")
            .and()
            .areNotNestedClasses()
            .should()
            .haveOnlyFinalFields()
            .because("model values are shared between the bridge and its callers");
}
