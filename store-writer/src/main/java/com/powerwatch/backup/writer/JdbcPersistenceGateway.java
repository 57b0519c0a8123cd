package com.powerwatch.backup.writer;

import com.google.common.collect.ImmutableMap;
import com.powerwatch.backup.data.record.AlarmRecord;
import com.powerwatch.backup.data.record.JoinedRecord;
import com.powerwatch.backup.data.record.OutageRecord;
import com.powerwatch.backup.data.schema.EntityKind;
import com.powerwatch.backup.data.schema.EntityKind.Columns;
import com.powerwatch.backup.data.schema.StoredValues;
import com.powerwatch.backup.exception.PersistenceFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link PersistenceGateway} over a JDBC store (SQLite in production). Each save creates the table if
 * needed, deletes the old rows and batch-inserts the new ones inside a single transaction.
 */
public class JdbcPersistenceGateway implements PersistenceGateway {
    private static final Logger log = LoggerFactory.getLogger(JdbcPersistenceGateway.class);

    private static final String TIMESTAMP_TYPE = "TEXT";
    private static final String TEXT_TYPE = "TEXT NOT NULL";

    private static final Map<String, String> COLUMN_TYPES = ImmutableMap.<String, String>builder()
        .put(Columns.ALARM_OCCURRED_ON, TIMESTAMP_TYPE)
        .put(Columns.ALARM_CLEARED_ON, TIMESTAMP_TYPE)
        .put(Columns.ALARM_SOURCE, TEXT_TYPE)
        .put(Columns.ALARM_NAME, TEXT_TYPE)
        .put(Columns.REGION, TEXT_TYPE)
        .put(Columns.SITE_PARSED_ALARM, TEXT_TYPE)
        .put(Columns.OUTAGE_OCCURRED_ON, TIMESTAMP_TYPE)
        .put(Columns.OUTAGE_CLEARED_ON, TIMESTAMP_TYPE)
        .put(Columns.MO_NAME, TEXT_TYPE)
        .put(Columns.OUTAGE_NAME, TEXT_TYPE)
        .put(Columns.SITE_PARSED_OUTAGE, TEXT_TYPE)
        .put(Columns.BATTERY_BACKUP_TIME, TEXT_TYPE)
        .put(Columns.BACKUP_MINUTES, "REAL NOT NULL")
        .build();

    private final JdbcTemplate template;
    private final TransactionTemplate transactionTemplate;

    public JdbcPersistenceGateway(String databaseUrl) {
        this(new DriverManagerDataSource(databaseUrl));
    }

    public JdbcPersistenceGateway(DataSource dataSource) {
        this.template = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    }

    @Override
    public int save(EntityKind kind, List<?> records) {
        List<Object[]> batch = new ArrayList<>(records.size());
        for (Object record : records) {
            batch.add(StoredValues.valuesOf(kind, record).toArray());
        }
        try {
            transactionTemplate.executeWithoutResult(status -> {
                template.execute(createTableSql(kind));
                int deleted = template.update("DELETE FROM " + kind.getTableName());
                log.debug("Deleted {} previous rows from {}", deleted, kind.getTableName());
                if (!batch.isEmpty()) {
                    template.batchUpdate(insertSql(kind), batch, argTypes(kind));
                }
            });
        } catch (DataAccessException | TransactionException e) {
            log.error("Saving {} rows to {} failed, previous rows kept", batch.size(), kind.getTableName(), e);
            throw new PersistenceFailureException(kind.getTableName(),
                "Could not replace rows of " + kind.getTableName() + ": " + e.getMessage(), e);
        }
        log.info("Saved {} rows to {}", batch.size(), kind.getTableName());
        return batch.size();
    }

    @Override
    public List<AlarmRecord> loadAlarms() {
        return load(EntityKind.ALARMS, JdbcPersistenceGateway::mapAlarm);
    }

    @Override
    public List<OutageRecord> loadOutages() {
        return load(EntityKind.OUTAGES, JdbcPersistenceGateway::mapOutage);
    }

    @Override
    public List<JoinedRecord> loadJoined() {
        return load(EntityKind.JOINED, (rs, rowNum) -> new JoinedRecord(
            mapAlarm(rs, rowNum),
            mapOutage(rs, rowNum),
            StoredValues.parseDuration(rs.getString(Columns.BATTERY_BACKUP_TIME)),
            rs.getDouble(Columns.BACKUP_MINUTES)
        ));
    }

    @Override
    public int count(EntityKind kind) {
        template.execute(createTableSql(kind));
        Integer count = template.queryForObject("SELECT COUNT(*) FROM " + kind.getTableName(), Integer.class);
        return count == null ? 0 : count;
    }

    private <T> List<T> load(EntityKind kind, RowMapper<T> mapper) {
        template.execute(createTableSql(kind));
        String sql = "SELECT " + String.join(", ", kind.getColumns()) + " FROM " + kind.getTableName() + " ORDER BY rowid";
        List<T> rows = template.query(sql, mapper);
        log.debug("Loaded {} rows from {}", rows.size(), kind.getTableName());
        return rows;
    }

    private static AlarmRecord mapAlarm(ResultSet rs, int rowNum) throws SQLException {
        return new AlarmRecord(
            StoredValues.parseTimestamp(rs.getString(Columns.ALARM_OCCURRED_ON)),
            StoredValues.parseTimestamp(rs.getString(Columns.ALARM_CLEARED_ON)),
            rs.getString(Columns.ALARM_SOURCE),
            rs.getString(Columns.ALARM_NAME),
            rs.getString(Columns.REGION),
            rs.getString(Columns.SITE_PARSED_ALARM)
        );
    }

    private static OutageRecord mapOutage(ResultSet rs, int rowNum) throws SQLException {
        return new OutageRecord(
            StoredValues.parseTimestamp(rs.getString(Columns.OUTAGE_OCCURRED_ON)),
            StoredValues.parseTimestamp(rs.getString(Columns.OUTAGE_CLEARED_ON)),
            rs.getString(Columns.MO_NAME),
            rs.getString(Columns.OUTAGE_NAME),
            rs.getString(Columns.SITE_PARSED_OUTAGE)
        );
    }

    static String createTableSql(EntityKind kind) {
        return kind.getColumns().stream()
            .map(column -> column + " " + COLUMN_TYPES.get(column))
            .collect(Collectors.joining(", ", "CREATE TABLE IF NOT EXISTS " + kind.getTableName() + " (", ")"));
    }

    static String insertSql(EntityKind kind) {
        List<String> columns = kind.getColumns();
        return "INSERT INTO " + kind.getTableName() + " (" + String.join(", ", columns) + ") VALUES ("
            + String.join(", ", Collections.nCopies(columns.size(), "?")) + ")";
    }

    private static int[] argTypes(EntityKind kind) {
        return kind.getColumns().stream()
            .mapToInt(column -> Columns.BACKUP_MINUTES.equals(column) ? Types.DOUBLE : Types.VARCHAR)
            .toArray();
    }
}
