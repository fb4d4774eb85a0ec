package dev.newsdesk.architecture;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

@AnalyzeClasses(packages = "dev.newsdesk", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

    // Only the REST layer talks to the REST layer
    @ArchTest
    static final ArchRule core_should_not_depend_on_api =
        noClasses().that().resideInAnyPackage(
                "..fetch..", "..source..", "..adapter..", "..crawl..", "..ingestion..",
                "..ledger..", "..run..", "..schedule..", "..config.."
            )
            .should().dependOnClassesThat().resideInAPackage("..api..");

    // The fetcher is the leaf every network call goes through
    @ArchTest
    static final ArchRule fetch_should_not_depend_on_features =
        noClasses().that().resideInAPackage("..fetch..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..source..", "..adapter..", "..crawl..", "..ingestion..", "..ledger..",
                "..run..", "..schedule.."
            );

    // Orchestration stays oblivious to scheduling and to where it is executed
    @ArchTest
    static final ArchRule crawl_should_not_depend_on_scheduling =
        noClasses().that().resideInAnyPackage("..crawl..", "..adapter..", "..ingestion..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..run..", "..schedule..", "..ledger.."
            );

    // The ledger is a leaf: it knows nothing about what is crawled
    @ArchTest
    static final ArchRule ledger_should_be_independent =
        noClasses().that().resideInAPackage("..ledger..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..source..", "..adapter..", "..crawl..", "..ingestion..", "..run..",
                "..schedule.."
            );

    // No cyclic dependencies between top-level packages
    @ArchTest
    static final ArchRule no_package_cycles =
        slices().matching("dev.newsdesk.(*)..").should().beFreeOfCycles();
}
