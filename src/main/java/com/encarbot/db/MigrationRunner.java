package com.encarbot.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Idempotent schema migration for SQLite and PostgreSQL. Tables are created when missing;
 * columns introduced after the first release are added in place so older database files
 * keep working.
 */
public final class MigrationRunner {
    private static final Logger LOG = LogManager.getLogger(MigrationRunner.class);
    static final int TARGET_VERSION = 2;

    private static final Map<String, String> ADDED_LISTING_COLUMNS = buildAddedColumns();

    public void run(Database database) throws SQLException {
        Database.Dialect dialect = database.dialect();
        try (Connection conn = database.connect(); Statement st = conn.createStatement()) {
            if (dialect == Database.Dialect.POSTGRES) {
                st.execute("CREATE SCHEMA IF NOT EXISTS " + database.schema());
                st.execute("SET search_path TO " + database.schema() + ", public");
            }
            st.execute("CREATE TABLE IF NOT EXISTS system_state (" +
                    "state_key TEXT PRIMARY KEY," +
                    "state_value TEXT NOT NULL," +
                    "updated_at TEXT NOT NULL" +
                    ")");

            int currentVersion = readSchemaVersion(conn);
            String lastSql = "";
            try {
                for (String sql : buildStatements(dialect)) {
                    lastSql = sql;
                    st.execute(sql);
                }
                lastSql = "ALTER TABLE listings ADD COLUMN ...";
                int added = addMissingColumns(conn, database, "listings");
                if (added > 0) {
                    LOG.info("listings: added {} missing column(s)", added);
                }
                writeSchemaVersion(conn, TARGET_VERSION);
            } catch (SQLException e) {
                String detail = "migration_failed: schema_version=" + currentVersion
                        + ", target_version=" + TARGET_VERSION
                        + ", failed_sql=" + summarizeSql(lastSql)
                        + ", cause=" + safe(e.getMessage());
                LOG.error(detail);
                throw new SQLException(detail, e.getSQLState(), e.getErrorCode(), e);
            }
            if (currentVersion != TARGET_VERSION) {
                LOG.info("schema migrated from version {} to {}", currentVersion, TARGET_VERSION);
            }
        }
    }

    private List<String> buildStatements(Database.Dialect dialect) {
        String serialKey = dialect == Database.Dialect.POSTGRES
                ? "id BIGSERIAL PRIMARY KEY"
                : "id INTEGER PRIMARY KEY AUTOINCREMENT";
        List<String> sqls = new ArrayList<>();

        sqls.add("CREATE TABLE IF NOT EXISTS listings (" +
                "car_id TEXT PRIMARY KEY," +
                "title TEXT NULL," +
                "model TEXT NULL," +
                "year INTEGER NULL," +
                "mileage INTEGER NULL," +
                "price DOUBLE PRECISION NOT NULL DEFAULT 0," +
                "true_price DOUBLE PRECISION NOT NULL DEFAULT 0," +
                "is_lease INTEGER NOT NULL DEFAULT 0," +
                "lease_deposit DOUBLE PRECISION NULL," +
                "lease_monthly_payment DOUBLE PRECISION NULL," +
                "lease_term_months INTEGER NULL," +
                "lease_total_monthly_cost DOUBLE PRECISION NULL," +
                "views INTEGER NOT NULL DEFAULT 0," +
                "registration_date TEXT NULL," +
                "days_since_registration INTEGER NULL," +
                "listing_url TEXT NULL," +
                "is_coupe INTEGER NOT NULL DEFAULT 0," +
                "is_truly_new INTEGER NOT NULL DEFAULT 0," +
                "first_seen TEXT NOT NULL," +
                "last_updated TEXT NOT NULL" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS monitoring_log (" +
                serialKey + "," +
                "logged_at TEXT NOT NULL," +
                "action TEXT NOT NULL," +
                "details TEXT NULL," +
                "new_listings_found INTEGER NOT NULL DEFAULT 0," +
                "total_listings_scanned INTEGER NOT NULL DEFAULT 0" +
                ")");

        sqls.add("CREATE INDEX IF NOT EXISTS idx_listings_first_seen ON listings(first_seen)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_listings_last_updated ON listings(last_updated)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_monitoring_log_logged_at ON monitoring_log(logged_at)");
        return sqls;
    }

    private int addMissingColumns(Connection conn, Database database, String table) throws SQLException {
        Set<String> existing = existingColumns(conn, database, table);
        int added = 0;
        try (Statement st = conn.createStatement()) {
            for (Map.Entry<String, String> column : ADDED_LISTING_COLUMNS.entrySet()) {
                if (existing.contains(column.getKey())) {
                    continue;
                }
                st.execute("ALTER TABLE " + table + " ADD COLUMN " + column.getKey() + " " + column.getValue());
                added++;
            }
            st.execute("CREATE INDEX IF NOT EXISTS idx_listings_closed ON listings(is_closed)");
        }
        return added;
    }

    private Set<String> existingColumns(Connection conn, Database database, String table) throws SQLException {
        Set<String> out = new HashSet<>();
        DatabaseMetaData meta = conn.getMetaData();
        String schemaPattern = database.dialect() == Database.Dialect.POSTGRES ? database.schema() : null;
        try (ResultSet rs = meta.getColumns(null, schemaPattern, table, null)) {
            while (rs.next()) {
                out.add(rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT));
            }
        }
        return out;
    }

    private int readSchemaVersion(Connection conn) {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT state_value FROM system_state WHERE state_key='schema_version'")) {
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    String value = rs.getString(1);
                    if (value != null && !value.trim().isEmpty()) {
                        return Integer.parseInt(value.trim());
                    }
                }
            }
        } catch (SQLException | NumberFormatException e) {
            LOG.warn("schema_version unreadable, assuming 0: {}", e.getMessage());
            return 0;
        }
        return 0;
    }

    private void writeSchemaVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO system_state(state_key, state_value, updated_at) VALUES('schema_version', ?, ?) " +
                        "ON CONFLICT(state_key) DO UPDATE SET state_value=excluded.state_value, updated_at=excluded.updated_at"
        )) {
            ps.setString(1, Integer.toString(version));
            ps.setString(2, Timestamps.format(Instant.now()));
            ps.executeUpdate();
        }
    }

    private static Map<String, String> buildAddedColumns() {
        Map<String, String> columns = new LinkedHashMap<>();
        columns.put("badge", "TEXT NULL");
        columns.put("lease_final_payment", "DOUBLE PRECISION NULL");
        columns.put("lease_vehicle_price", "DOUBLE PRECISION NULL");
        columns.put("is_closed", "INTEGER NOT NULL DEFAULT 0");
        columns.put("closure_detected_at", "TEXT NULL");
        columns.put("closure_type", "TEXT NULL");
        return columns;
    }

    private String summarizeSql(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            return "-";
        }
        String oneLine = sql.replaceAll("\\s+", " ").trim();
        if (oneLine.length() <= 180) {
            return oneLine;
        }
        return oneLine.substring(0, 177) + "...";
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }
}
