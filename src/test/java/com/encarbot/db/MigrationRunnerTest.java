package com.encarbot.db;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MigrationRunnerTest {

    @TempDir
    Path tempDir;

    @Test
    void runShouldBeIdempotentAndRecordVersion() throws Exception {
        Database database = Database.sqliteFile(tempDir.resolve("m.db"));

        new MigrationRunner().run(database);
        new MigrationRunner().run(database);

        assertEquals(String.valueOf(MigrationRunner.TARGET_VERSION),
                new SystemStateDao(database).get("schema_version").orElseThrow());
    }

    @Test
    void runShouldAddColumnsMissingFromOlderFiles() throws Exception {
        Database database = Database.sqliteFile(tempDir.resolve("old.db"));
        try (Connection conn = database.connect(); Statement st = conn.createStatement()) {
            st.execute("CREATE TABLE listings (car_id TEXT PRIMARY KEY, title TEXT, price DOUBLE PRECISION, "
                    + "first_seen TEXT, last_updated TEXT)");
            st.execute("INSERT INTO listings(car_id, title, price, first_seen, last_updated) "
                    + "VALUES('1', 'old', 5000, '2023-01-01 00:00:00', '2023-01-01 00:00:00')");
        }

        new MigrationRunner().run(database);

        Set<String> columns = new HashSet<>();
        try (Connection conn = database.connect();
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(listings)")) {
            while (rs.next()) {
                columns.add(rs.getString("name"));
            }
        }
        assertTrue(columns.contains("is_closed"));
        assertTrue(columns.contains("closure_type"));
        assertTrue(columns.contains("lease_final_payment"));
        assertTrue(columns.contains("badge"));
    }
}
