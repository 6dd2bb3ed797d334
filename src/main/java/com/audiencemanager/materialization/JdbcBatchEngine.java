package com.audiencemanager.materialization;

import com.audiencemanager.domain.model.SegmentDataset;
import com.audiencemanager.domain.model.SegmentRow;
import com.audiencemanager.exception.BatchEngineException;
import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

/**
 * {@link BatchEngine} backed by the warehouse database through {@link JdbcTemplate}.
 *
 * <p>Segment queries run as plain read queries; output tables are plain tables with the
 * fixed segment schema, recreated on every write. Set operations run in memory on the
 * loaded datasets. Table names are validated as SQL identifiers before they reach any
 * statement.
 */
@Component
public class JdbcBatchEngine implements BatchEngine {

    private static final Logger log = LoggerFactory.getLogger(JdbcBatchEngine.class);

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,127}");

    private static final String SELECT_COLUMNS = "SELECT " + String.join(", ", SegmentDataset.COLUMNS) + " FROM ";

    private static final String CREATE_TABLE = "CREATE TABLE %s ("
            + "user_id BIGINT, "
            + "total_transactions BIGINT, "
            + "total_spent DECIMAL(19, 2), "
            + "transaction_types VARCHAR(1024))";

    private static final String INSERT_ROW = "INSERT INTO %s ("
            + String.join(", ", SegmentDataset.COLUMNS) + ") VALUES (?, ?, ?, ?)";

    private static final RowMapper<SegmentRow> ROW_MAPPER = JdbcBatchEngine::mapRow;

    private final JdbcTemplate jdbcTemplate;

    public JdbcBatchEngine(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public SegmentDataset readQuery(String sql) {
        try {
            List<SegmentRow> rows = jdbcTemplate.query(sql, ROW_MAPPER);
            log.debug("Segment query returned {} rows", rows.size());
            return SegmentDataset.of(rows);
        } catch (DataAccessException e) {
            throw new BatchEngineException("Segment query failed: " + rootMessage(e), e);
        }
    }

    @Override
    public SegmentDataset readTable(String tableName) {
        String table = checkedName(tableName);
        try {
            return SegmentDataset.of(jdbcTemplate.query(SELECT_COLUMNS + table, ROW_MAPPER));
        } catch (DataAccessException e) {
            throw new BatchEngineException("Failed to read table " + table + ": " + rootMessage(e), e);
        }
    }

    @Override
    public boolean tableExists(String tableName) {
        String table = checkedName(tableName);
        try {
            Boolean exists = jdbcTemplate.execute((ConnectionCallback<Boolean>) connection -> {
                for (String candidate : List.of(table, table.toUpperCase(Locale.ROOT), table.toLowerCase(Locale.ROOT))) {
                    try (ResultSet tables =
                            connection.getMetaData().getTables(null, null, candidate, new String[] {"TABLE"})) {
                        if (tables.next()) {
                            return true;
                        }
                    }
                }
                return false;
            });
            return Boolean.TRUE.equals(exists);
        } catch (DataAccessException e) {
            throw new BatchEngineException("Failed to look up table " + table + ": " + rootMessage(e), e);
        }
    }

    @Override
    public void writeTable(SegmentDataset dataset, String tableName) {
        String table = checkedName(tableName);
        List<SegmentRow> rows = dataset != null ? dataset.rows() : List.of();
        try {
            jdbcTemplate.execute("DROP TABLE IF EXISTS " + table);
            jdbcTemplate.execute(String.format(CREATE_TABLE, table));
            if (!rows.isEmpty()) {
                jdbcTemplate.batchUpdate(String.format(INSERT_ROW, table), rows, 500, (ps, row) -> {
                    ps.setObject(1, row.getUserId());
                    ps.setObject(2, row.getTotalTransactions());
                    ps.setBigDecimal(3, row.getTotalSpent());
                    ps.setString(4, row.getTransactionTypes());
                });
            }
            log.info("Wrote {} rows to {}", rows.size(), table);
        } catch (DataAccessException e) {
            throw new BatchEngineException("Failed to write table " + table + ": " + rootMessage(e), e);
        }
    }

    @Override
    public void dropTable(String tableName) {
        String table = checkedName(tableName);
        try {
            jdbcTemplate.execute("DROP TABLE IF EXISTS " + table);
            log.info("Dropped table {}", table);
        } catch (DataAccessException e) {
            throw new BatchEngineException("Failed to drop table " + table + ": " + rootMessage(e), e);
        }
    }

    @Override
    public SegmentDataset sampleRows(String tableName, int limit) {
        String table = checkedName(tableName);
        try {
            return SegmentDataset.of(
                    jdbcTemplate.query(SELECT_COLUMNS + table + " ORDER BY user_id LIMIT ?", ROW_MAPPER, limit));
        } catch (DataAccessException e) {
            throw new BatchEngineException("Failed to sample table " + table + ": " + rootMessage(e), e);
        }
    }

    private static SegmentRow mapRow(ResultSet rs, int rowNum) throws SQLException {
        long userId = rs.getLong("user_id");
        Long user = rs.wasNull() ? null : userId;
        long count = rs.getLong("total_transactions");
        Long totalTransactions = rs.wasNull() ? null : count;
        BigDecimal totalSpent = rs.getBigDecimal("total_spent");
        return SegmentRow.builder()
                .userId(user)
                .totalTransactions(totalTransactions)
                .totalSpent(totalSpent)
                .transactionTypes(rs.getString("transaction_types"))
                .build();
    }

    private static String checkedName(String tableName) {
        if (tableName == null || !TABLE_NAME.matcher(tableName).matches()) {
            throw new BatchEngineException("Invalid table name: " + tableName);
        }
        return tableName;
    }

    private static String rootMessage(DataAccessException e) {
        Throwable cause = e.getMostSpecificCause();
        return cause.getMessage() != null ? cause.getMessage() : e.getMessage();
    }
}
