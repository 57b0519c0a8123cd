package com.powerwatch.backup.writer;

import com.powerwatch.backup.data.record.AlarmRecord;
import com.powerwatch.backup.data.record.JoinedRecord;
import com.powerwatch.backup.data.record.OutageRecord;
import com.powerwatch.backup.data.schema.EntityKind;
import com.powerwatch.backup.exception.PersistenceFailureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcPersistenceGatewayTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2025, 1, 3, 10, 0);

    @TempDir
    Path dir;

    private String url;
    private JdbcPersistenceGateway gateway;

    @BeforeEach
    void setUp() {
        url = "jdbc:sqlite:" + dir.resolve("etl_alarms.db");
        gateway = new JdbcPersistenceGateway(url);
    }

    private static AlarmRecord alarm(String site, String name) {
        return new AlarmRecord(T0, T0.plusHours(1), "SRC " + site, name, "NORTE", site);
    }

    @Test
    void shouldRoundTripEveryKind() {
        AlarmRecord alarm = alarm("S1", "MINOR RECT FAILURE");
        AlarmRecord undated = new AlarmRecord(null, null, "", "", "SUR", "");
        OutageRecord outage = new OutageRecord(T0.plusMinutes(90).plusSeconds(30), null, "MO S1", "NODEB UNAVAILABLE", "S1");
        JoinedRecord joined = JoinedRecord.of(alarm, outage);

        assertEquals(2, gateway.saveAlarms(List.of(alarm, undated)));
        assertEquals(1, gateway.saveOutages(List.of(outage)));
        assertEquals(1, gateway.saveJoined(List.of(joined)));

        assertEquals(List.of(alarm, undated), gateway.loadAlarms());
        assertEquals(List.of(outage), gateway.loadOutages());
        List<JoinedRecord> stored = gateway.loadJoined();
        assertEquals(List.of(joined), stored);
        assertEquals(90.5, stored.get(0).backupMinutes(), 1e-9);
    }

    @Test
    void shouldReplacePreviousRows() {
        gateway.saveAlarms(List.of(alarm("S1", "A"), alarm("S2", "B"), alarm("S3", "C")));
        gateway.saveAlarms(List.of(alarm("S9", "Z")));

        assertEquals(1, gateway.count(EntityKind.ALARMS));
        assertEquals("S9", gateway.loadAlarms().get(0).resolvedSiteId());
    }

    @Test
    void shouldClearTableWhenSavingEmptySet() {
        gateway.saveAlarms(List.of(alarm("S1", "A")));

        assertEquals(0, gateway.saveAlarms(List.of()));
        assertEquals(0, gateway.count(EntityKind.ALARMS));
        assertEquals(0, gateway.count(EntityKind.JOINED), "count of a never written kind is zero");
    }

    @Test
    void shouldKeepPreviousRowsWhenInsertFails() {
        JdbcTemplate template = new JdbcTemplate(new DriverManagerDataSource(url));
        template.execute(JdbcPersistenceGateway.createTableSql(EntityKind.ALARMS)
            .replace(")", ", CHECK (alarm_name <> 'REJECTED'))"));
        gateway.saveAlarms(List.of(alarm("S1", "A"), alarm("S2", "B")));

        PersistenceFailureException e = assertThrows(PersistenceFailureException.class,
            () -> gateway.saveAlarms(List.of(alarm("S3", "C"), alarm("S4", "REJECTED"))));

        assertEquals("alarms", e.getTable());
        assertEquals(List.of(alarm("S1", "A"), alarm("S2", "B")), gateway.loadAlarms());
    }

    @Test
    void shouldCreateSchemaWithNullableTimestampsOnly() {
        assertEquals("CREATE TABLE IF NOT EXISTS outages (outage_occurred_on TEXT, outage_cleared_on TEXT, "
                + "mo_name TEXT NOT NULL, outage_name TEXT NOT NULL, site_parsed_outage TEXT NOT NULL)",
            JdbcPersistenceGateway.createTableSql(EntityKind.OUTAGES));
        assertEquals("INSERT INTO outages (outage_occurred_on, outage_cleared_on, mo_name, outage_name, site_parsed_outage) "
            + "VALUES (?, ?, ?, ?, ?)", JdbcPersistenceGateway.insertSql(EntityKind.OUTAGES));
    }
}
