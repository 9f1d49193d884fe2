package com.bidscope.storage;

import com.bidscope.error.BackingStoreException;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DatasetSchemaValidator Tests")
class DatasetSchemaValidatorTest {

    private static ContractFixture fixture;

    @BeforeAll
    static void setUp() {
        fixture = ContractFixture.create();
        fixture.getJdbcTemplate().execute(
            "CREATE TABLE contracts_drifted AS SELECT * EXCLUDE (award_date, business_category) FROM contracts");
    }

    @AfterAll
    static void tearDown() throws Exception {
        fixture.close();
    }

    private DatasetCatalog catalogWithPrimary(String relation) {
        DatasetCatalog base = fixture.getCatalog();
        return new DatasetCatalog(relation, base.getExtendedRelation(), base.getSnapshotRelations());
    }

    @Test
    @DisplayName("Should accept relations that expose every required column")
    void shouldAcceptValidDataset() {
        DatasetSchemaValidator validator =
            new DatasetSchemaValidator(fixture.getJdbcTemplate(), fixture.getCatalog(), true);

        assertThatCode(validator::validate).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should name the relation and its missing columns on drift")
    void shouldReportMissingColumns() {
        DatasetSchemaValidator validator =
            new DatasetSchemaValidator(fixture.getJdbcTemplate(), catalogWithPrimary("contracts_drifted"), true);

        assertThatThrownBy(validator::validate)
            .isInstanceOfSatisfying(SchemaMismatchException.class, e -> {
                assertThat(e.getRelation()).isEqualTo("contracts_drifted");
                assertThat(e.getMissingColumns()).containsExactlyInAnyOrder("award_date", "business_category");
            });
    }

    @Test
    @DisplayName("Should raise a store error for a relation that does not exist")
    void shouldRejectMissingRelation() {
        DatasetSchemaValidator validator =
            new DatasetSchemaValidator(fixture.getJdbcTemplate(), catalogWithPrimary("no_such_table"), true);

        assertThatThrownBy(validator::validate)
            .isInstanceOf(BackingStoreException.class)
            .hasMessageContaining("no_such_table");
    }

    @Test
    @DisplayName("Should skip validation when disabled")
    void shouldSkipWhenDisabled() {
        DatasetSchemaValidator validator =
            new DatasetSchemaValidator(fixture.getJdbcTemplate(), catalogWithPrimary("no_such_table"), false);

        assertThatCode(validator::validateIfEnabled).doesNotThrowAnyException();
    }
}
