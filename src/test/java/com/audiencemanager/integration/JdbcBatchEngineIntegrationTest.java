package com.audiencemanager.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.audiencemanager.condition.ConditionCompiler;
import com.audiencemanager.config.WarehouseConfig;
import com.audiencemanager.domain.model.Condition;
import com.audiencemanager.domain.model.SegmentDataset;
import com.audiencemanager.domain.model.SegmentRow;
import com.audiencemanager.exception.BatchEngineException;
import com.audiencemanager.materialization.JdbcBatchEngine;
import java.math.BigDecimal;
import java.sql.Date;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

/**
 * Runs compiled segment queries and output table operations against an in-memory H2
 * warehouse holding both raw transaction sources.
 */
class JdbcBatchEngineIntegrationTest {

    private JdbcTemplate jdbcTemplate;
    private JdbcBatchEngine batchEngine;
    private ConditionCompiler conditionCompiler;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:warehouse_" + UUID.randomUUID().toString().replace("-", "") + ";DB_CLOSE_DELAY=-1", "sa", "");
        jdbcTemplate = new JdbcTemplate(dataSource);
        batchEngine = new JdbcBatchEngine(jdbcTemplate);
        conditionCompiler = new ConditionCompiler(new WarehouseConfig());

        for (String table : List.of("upi_transactions_raw", "credit_card_transactions_raw")) {
            jdbcTemplate.execute("CREATE TABLE " + table + " (user_id BIGINT, amount DECIMAL(19, 2), "
                    + "transaction_date DATE, category VARCHAR(64), city_tier INT)");
        }
        insert("upi_transactions_raw", 1, "1500.00", "2024-01-05", "food", 1);
        insert("upi_transactions_raw", 1, "200.00", "2024-01-06", "travel", 1);
        insert("upi_transactions_raw", 2, "3000.00", "2024-02-10", "food", 2);
        insert("credit_card_transactions_raw", 1, "2500.00", "2024-01-20", "food", 1);
        insert("credit_card_transactions_raw", 3, "5000.00", "2024-03-01", "electronics", 1);
    }

    private void insert(String table, long userId, String amount, String date, String category, int tier) {
        jdbcTemplate.update(
                "INSERT INTO " + table + " VALUES (?, ?, ?, ?, ?)",
                userId, new BigDecimal(amount), Date.valueOf(date), category, tier);
    }

    @Test
    @DisplayName("compiled query aggregates both sources per user")
    void compiledQueryAggregatesPerUser() {
        String sql = conditionCompiler.compile(List.of(
                        Condition.of("amount", ">", 1000), Condition.of("city_tier", "=", 1)))
                .getSql();

        SegmentDataset result = batchEngine.readQuery(sql);

        assertThat(result.userIds()).containsExactlyInAnyOrder(1L, 3L);
        SegmentRow user1 = result.rows().stream().filter(r -> r.getUserId() == 1L).findFirst().orElseThrow();
        assertThat(user1.getTotalTransactions()).isEqualTo(2L);
        assertThat(user1.getTotalSpent()).isEqualByComparingTo("4000");
        assertThat(user1.getTransactionTypes()).contains("UPI").contains("CREDIT_CARD");
    }

    @Test
    @DisplayName("metric and source type conditions filter the aggregated users")
    void havingAndSourceType() {
        String sql = conditionCompiler.compile(List.of(
                        Condition.of("transaction_type", "=", "UPI"),
                        Condition.of("transaction_count", ">=", 2),
                        Condition.between("transaction_date", "2024-01-01", "2024-01-31")))
                .getSql();

        assertThat(batchEngine.readQuery(sql).userIds()).containsExactly(1L);
    }

    @Test
    @DisplayName("query errors surface as BatchEngineException")
    void invalidQuery() {
        assertThatThrownBy(() -> batchEngine.readQuery("SELECT * FROM missing_table"))
                .isInstanceOf(BatchEngineException.class)
                .hasMessageContaining("Segment query failed");
    }

    @Test
    @DisplayName("output tables are written, replaced, sampled and dropped")
    void outputTableLifecycle() {
        assertThat(batchEngine.tableExists("segment_output_1")).isFalse();

        batchEngine.writeTable(SegmentDataset.ofUsers(3, 1, 2), "segment_output_1");
        assertThat(batchEngine.tableExists("segment_output_1")).isTrue();
        assertThat(batchEngine.readTable("segment_output_1").userIds()).containsExactlyInAnyOrder(1L, 2L, 3L);
        assertThat(batchEngine.sampleRows("segment_output_1", 2).userIds()).containsExactly(1L, 2L);

        batchEngine.writeTable(SegmentDataset.ofUsers(9), "segment_output_1");
        assertThat(batchEngine.readTable("segment_output_1").userIds()).containsExactly(9L);

        batchEngine.dropTable("segment_output_1");
        assertThat(batchEngine.tableExists("segment_output_1")).isFalse();
    }

    @Test
    @DisplayName("an empty dataset still creates the output table")
    void emptyOutput() {
        batchEngine.writeTable(SegmentDataset.empty(), "segment_output_2");

        assertThat(batchEngine.tableExists("segment_output_2")).isTrue();
        assertThat(batchEngine.readTable("segment_output_2").isEmpty()).isTrue();
    }

    @Test
    @DisplayName("table names outside the identifier pattern are rejected")
    void invalidTableName() {
        assertThatThrownBy(() -> batchEngine.dropTable("segment_output_1; DROP TABLE upi_transactions_raw"))
                .isInstanceOf(BatchEngineException.class)
                .hasMessageContaining("Invalid table name");
        assertThatThrownBy(() -> batchEngine.readTable(null)).isInstanceOf(BatchEngineException.class);
    }
}
