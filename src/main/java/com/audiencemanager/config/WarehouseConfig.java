package com.audiencemanager.config;

import com.audiencemanager.domain.enums.SqlDialect;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the transaction warehouse under the {@code warehouse} prefix.
 *
 * <ul>
 *   <li>{@code dialect} -- SQL dialect of the warehouse, picks the string aggregation function</li>
 *   <li>{@code sources} -- raw transaction tables merged into the unified transaction view,
 *       each tagged with its source type</li>
 *   <li>{@code outputTablePrefix} -- prefix of segment output tables, followed by the rule id</li>
 *   <li>{@code sampleRowLimit} -- maximum rows returned by segment sample queries</li>
 * </ul>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "warehouse")
public class WarehouseConfig {

    private SqlDialect dialect = SqlDialect.H2;
    private String outputTablePrefix = "segment_output_";
    private int sampleRowLimit = 10;
    private List<TransactionSource> sources = new ArrayList<>(List.of(
            new TransactionSource("upi_transactions_raw", "UPI"),
            new TransactionSource("credit_card_transactions_raw", "CREDIT_CARD")));

    public String outputTableName(Long ruleId) {
        return outputTablePrefix + ruleId;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TransactionSource {
        private String table;
        private String sourceType;
    }
}
