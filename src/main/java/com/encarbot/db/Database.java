package com.encarbot.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.postgresql.ds.PGSimpleDataSource;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;

/**
 * Connection manager for the listing database. SQLite is the embedded default; a
 * {@code jdbc:postgresql:} URL switches to PostgreSQL with a dedicated schema.
 */
public final class Database {
    private static final Logger LOG = LogManager.getLogger(Database.class);
    private static final Logger SQL_LOG = LogManager.getLogger("SQL");
    private static final String SQLITE_PREFIX = "jdbc:sqlite:";
    private static final String POSTGRES_PREFIX = "jdbc:postgresql:";

    public enum Dialect {
        SQLITE,
        POSTGRES
    }

    private final DataSource dataSource;
    private final Dialect dialect;
    private final String jdbcUrl;
    private final String schema;
    private final boolean sqlLogEnabled;

    public Database(String jdbcUrl, String user, String pass, String schema, boolean sqlLogEnabled) {
        if (isBlank(jdbcUrl)) {
            throw new IllegalArgumentException("db.url must not be empty");
        }
        this.jdbcUrl = jdbcUrl.trim();
        this.sqlLogEnabled = sqlLogEnabled;
        String lower = this.jdbcUrl.toLowerCase(Locale.ROOT);
        if (lower.startsWith(SQLITE_PREFIX)) {
            this.dialect = Dialect.SQLITE;
            this.schema = "";
            ensureSqliteParent(this.jdbcUrl.substring(SQLITE_PREFIX.length()));
            SQLiteDataSource sqlite = new SQLiteDataSource();
            sqlite.setUrl(this.jdbcUrl);
            this.dataSource = sqlite;
        } else if (lower.startsWith(POSTGRES_PREFIX)) {
            this.dialect = Dialect.POSTGRES;
            this.schema = normalizeSchema(schema);
            PGSimpleDataSource pg = new PGSimpleDataSource();
            pg.setUrl(this.jdbcUrl);
            if (!isBlank(user)) {
                pg.setUser(user.trim());
            }
            if (pass != null) {
                pg.setPassword(pass);
            }
            pg.setCurrentSchema(this.schema);
            pg.setApplicationName("encarbot");
            this.dataSource = pg;
        } else {
            throw new IllegalArgumentException("db.url must be jdbc:sqlite:<file> or jdbc:postgresql://...");
        }
    }

    public static Database sqliteFile(Path file) {
        return new Database(SQLITE_PREFIX + file.toAbsolutePath(), null, null, null, false);
    }

    public Connection connect() throws SQLException {
        try {
            Connection raw = dataSource.getConnection();
            try (Statement st = raw.createStatement()) {
                if (dialect == Dialect.SQLITE) {
                    st.execute("PRAGMA busy_timeout=5000");
                } else {
                    st.execute("SET search_path TO " + schema + ", public");
                }
            }
            return sqlLogEnabled ? SqlLogProxy.wrapConnection(raw, SQL_LOG) : raw;
        } catch (SQLException e) {
            String cwd = Paths.get(".").toAbsolutePath().normalize().toString();
            String details = "DB connect failed: jdbc_url=" + maskedJdbcUrl()
                    + ", dialect=" + dialect
                    + ", cwd=" + cwd
                    + ", hint=" + classifyConnectFailure(e)
                    + ", cause=" + safe(e.getMessage());
            LOG.error(details);
            throw new SQLException(details, e.getSQLState(), e.getErrorCode(), e);
        }
    }

    public Dialect dialect() {
        return dialect;
    }

    public String schema() {
        return schema;
    }

    public String maskedJdbcUrl() {
        String out = jdbcUrl;
        out = out.replaceAll("(?i)(password=)[^&]+", "$1***");
        out = out.replaceAll("(://[^:/@]+:)[^@]+(@)", "$1***$2");
        return out;
    }

    private static void ensureSqliteParent(String location) {
        String path = location;
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        if (path.isEmpty() || path.startsWith(":memory:") || path.startsWith("file:")) {
            return;
        }
        Path parent = Paths.get(path).toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create database directory " + parent, e);
        }
    }

    private String normalizeSchema(String raw) {
        String value = isBlank(raw) ? "encarbot" : raw.trim();
        if (!value.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException("invalid db.schema, allowed pattern: [A-Za-z_][A-Za-z0-9_]*");
        }
        return value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private String classifyConnectFailure(SQLException e) {
        String msg = safe(e == null ? null : e.getMessage()).toLowerCase(Locale.ROOT);
        if (msg.contains("permission denied") || msg.contains("access is denied")) {
            return "permission";
        }
        if (msg.contains("locked") || msg.contains("busy")) {
            return "locked";
        }
        if (msg.contains("no such file") || msg.contains("cannot open") || msg.contains("does not exist")) {
            return "missing_dir";
        }
        if (msg.contains("authentication")) {
            return "auth";
        }
        return "connection_error";
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
