package dev.dripdirective.architecture;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import dev.dripdirective.architecture.violation.diversify.StoreAwareSelector;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArchitectureTest {

    private static JavaClasses productionClasses;

    @BeforeAll
    static void importProductionClasses() {
        productionClasses = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("dev.dripdirective");
    }

    // Selection and ranking are pure algorithms: no storage, no vector-backend client types.
    static final ArchRule algorithms_should_not_depend_on_storage =
        noClasses().that().resideInAnyPackage("..diversify..", "..ranking..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..store..", "..history..", "dev.langchain4j.store..", "jakarta.persistence.."
            );

    static final ArchRule algorithms_should_not_depend_on_orchestration =
        noClasses().that().resideInAnyPackage("..diversify..", "..ranking..", "..cooldown..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..recommend..", "..ingestion.."
            );

    // Only the pgvector store talks to the LangChain4j embedding store directly
    static final ArchRule embedding_store_only_behind_similarity_store =
        noClasses().that().resideOutsideOfPackages("..store..", "..config..")
            .should().dependOnClassesThat().resideInAPackage("dev.langchain4j.store..");

    static final ArchRule ingestion_should_not_depend_on_recommendation =
        noClasses().that().resideInAPackage("..ingestion..")
            .should().dependOnClassesThat().resideInAnyPackage("..recommend..", "..history..");

    // Config package should not depend on orchestration packages
    static final ArchRule config_should_not_depend_on_features =
        noClasses().that().resideInAPackage("..config..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..recommend..", "..ingestion.."
            );

    // No cyclic dependencies between top-level packages
    static final ArchRule no_package_cycles =
        slices().matching("dev.dripdirective.(*)..").should().beFreeOfCycles();

    @Test
    void selection_and_ranking_stay_free_of_storage() {
        algorithms_should_not_depend_on_storage.check(productionClasses);
    }

    @Test
    void selection_ranking_and_cooldown_stay_free_of_orchestration() {
        algorithms_should_not_depend_on_orchestration.check(productionClasses);
    }

    @Test
    void langchain4j_embedding_store_is_used_only_by_store_and_config() {
        embedding_store_only_behind_similarity_store.check(productionClasses);
    }

    @Test
    void ingestion_stays_free_of_recommendation_and_history() {
        ingestion_should_not_depend_on_recommendation.check(productionClasses);
    }

    @Test
    void config_stays_free_of_feature_packages() {
        config_should_not_depend_on_features.check(productionClasses);
    }

    @Test
    void packages_are_free_of_cycles() {
        no_package_cycles.check(productionClasses);
    }

    @Test
    void storage_rule_rejects_a_selector_that_reads_the_store() {
        JavaClasses leaky = new ClassFileImporter().importClasses(StoreAwareSelector.class);

        assertThatThrownBy(() -> algorithms_should_not_depend_on_storage.check(leaky))
            .isInstanceOf(AssertionError.class)
            .hasMessageContaining("StoreAwareSelector");
    }
}
