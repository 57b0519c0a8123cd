package com.powerwatch.backup.data.schema;

import java.util.List;

/**
 * The three record sets a run persists, with the fixed column layout of each.
 * Column order here is the insert order and the export order.
 */
public enum EntityKind {
    ALARMS("alarms", List.of(
        Columns.ALARM_OCCURRED_ON, Columns.ALARM_CLEARED_ON, Columns.ALARM_SOURCE,
        Columns.ALARM_NAME, Columns.REGION, Columns.SITE_PARSED_ALARM
    )),
    OUTAGES("outages", List.of(
        Columns.OUTAGE_OCCURRED_ON, Columns.OUTAGE_CLEARED_ON, Columns.MO_NAME,
        Columns.OUTAGE_NAME, Columns.SITE_PARSED_OUTAGE
    )),
    JOINED("alarms_outages_joined", List.of(
        Columns.ALARM_OCCURRED_ON, Columns.ALARM_CLEARED_ON, Columns.ALARM_SOURCE,
        Columns.ALARM_NAME, Columns.REGION, Columns.SITE_PARSED_ALARM,
        Columns.OUTAGE_OCCURRED_ON, Columns.OUTAGE_CLEARED_ON, Columns.MO_NAME,
        Columns.OUTAGE_NAME, Columns.SITE_PARSED_OUTAGE,
        Columns.BATTERY_BACKUP_TIME, Columns.BACKUP_MINUTES
    ));

    private final String tableName;
    private final List<String> columns;

    EntityKind(String tableName, List<String> columns) {
        this.tableName = tableName;
        this.columns = columns;
    }

    public String getTableName() {
        return tableName;
    }

    public List<String> getColumns() {
        return columns;
    }

    public static final class Columns {
        public static final String ALARM_OCCURRED_ON = "alarm_occurred_on";
        public static final String ALARM_CLEARED_ON = "alarm_cleared_on";
        public static final String ALARM_SOURCE = "alarm_source";
        public static final String ALARM_NAME = "alarm_name";
        public static final String REGION = "region";
        public static final String SITE_PARSED_ALARM = "site_parsed_alarm";
        public static final String OUTAGE_OCCURRED_ON = "outage_occurred_on";
        public static final String OUTAGE_CLEARED_ON = "outage_cleared_on";
        public static final String MO_NAME = "mo_name";
        public static final String OUTAGE_NAME = "outage_name";
        public static final String SITE_PARSED_OUTAGE = "site_parsed_outage";
        public static final String BATTERY_BACKUP_TIME = "battery_backup_time";
        public static final String BACKUP_MINUTES = "backup_minutes";

        private Columns() {
        }
    }
}
