package com.ciro.searchselect.standalone;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;
import io.undertow.server.HttpHandler;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.library.GeneralCodingRules.NO_CLASSES_SHOULD_ACCESS_STANDARD_STREAMS;
import static com.tngtech.archunit.library.GeneralCodingRules.NO_CLASSES_SHOULD_USE_JAVA_UTIL_LOGGING;

@AnalyzeClasses(packages = "com.ciro.searchselect", importOptions = ImportOption.DoNotIncludeTests.class)
public class StandaloneRulesTest {

    // 1. Logs por SLF4J, nunca System.out / System.err
    @ArchTest
    static final ArchRule no_standard_streams = NO_CLASSES_SHOULD_ACCESS_STANDARD_STREAMS;

    @ArchTest
    static final ArchRule no_jul = NO_CLASSES_SHOULD_USE_JAVA_UTIL_LOGGING;

    // 2. Endpoints = HttpHandler de Undertow
    @ArchTest
    static final ArchRule endpoints_are_handlers = classes()
            .that().haveSimpleNameEndingWith("Endpoint")
            .should().implement(HttpHandler.class)
            .because("SearchSelectServer los monta directamente en el PathHandler.");

    // 3. Solo los adapters tocan Undertow
    @ArchTest
    static final ArchRule undertow_stays_in_adapters = classes()
            .that().resideInAPackage("com.ciro.searchselect.standalone")
            .and().haveSimpleNameNotEndingWith("Endpoint")
            .and().doNotHaveSimpleName("SearchSelectServer")
            .and().doNotHaveSimpleName("StandaloneSessionManager")
            .and().doNotHaveSimpleName("CookieUtil")
            .and().doNotHaveSimpleName("UndertowAttachments")
            .should().onlyDependOnClassesThat().resideOutsideOfPackage("io.undertow..")
            .because("SelectHttpApi y compañía se prueban sin sockets.");
}
