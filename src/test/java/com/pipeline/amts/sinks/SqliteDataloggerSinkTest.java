package com.pipeline.amts.sinks;

import com.pipeline.amts.SliceFixtures;
import com.pipeline.amts.model.DeltaRecord;
import com.pipeline.amts.model.ProcessingMode;
import com.pipeline.amts.model.SliceDefinition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqliteDataloggerSinkTest {

    @TempDir
    Path dir;

    private String dbPath;
    private SqliteDataloggerSink sink;

    @BeforeEach
    void setUp() {
        dbPath = dir.resolve("db").resolve("datalogger.db").toString();
        sink = new SqliteDataloggerSink(dbPath);
    }

    @AfterEach
    void tearDown() {
        sink.close();
    }

    @Test
    void shouldDeriveTableName() {
        assertEquals("dl_S1_003AP01", SqliteDataloggerSink.tableName("S1:P01"));
        assertEquals("dl_S1__P01", SqliteDataloggerSink.tableName("S1_P01"));
        assertEquals("dl_site_002Da_0020P_002E1", SqliteDataloggerSink.tableName("site-a P.1"));
    }

    @Test
    void shouldAppendIncrementallyAndReplaceOnFullRebuild() throws SQLException {
        SliceDefinition definition = SliceFixtures.reflective(dir).sqlExport(true).build();

        sink.accept(definition, List.of(record(0, 1.0), record(1, 2.0)), ProcessingMode.INCREMENTAL);
        assertEquals(2, count("dl_S1_003AP01"));

        sink.accept(definition, List.of(record(1, 2.5)), ProcessingMode.INCREMENTAL);
        assertEquals(2, count("dl_S1_003AP01"));

        sink.accept(definition, List.of(record(5, 9.0)), ProcessingMode.FULL);
        assertEquals(1, count("dl_S1_003AP01"));
    }

    @Test
    void shouldStoreNullComponentsForReflectlessPoint() throws SQLException {
        SliceDefinition definition = SliceFixtures.reflectless(dir).sqlExport(true).build();

        sink.accept(definition,
                List.of(new DeltaRecord(SliceFixtures.hourInstant(0), "201", "Q01", null, null, 3.0, false)),
                ProcessingMode.FULL);

        try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT delta_h_mm, delta_n_mm, delta_e_mm FROM dl_S1_003AQ01")) {
            assertTrue(rs.next());
            assertEquals(3.0, rs.getDouble(1), 1e-9);
            rs.getDouble(2);
            assertTrue(rs.wasNull());
            rs.getDouble(3);
            assertTrue(rs.wasNull());
        }
    }

    @Test
    void shouldIgnoreSlicesWithoutSqlExport() throws SQLException {
        SliceDefinition definition = SliceFixtures.reflective(dir).sqlExport(false).build();

        sink.accept(definition, List.of(record(0, 1.0)), ProcessingMode.FULL);

        try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(
                     "SELECT name FROM sqlite_master WHERE type='table' AND name='dl_S1_003AP01'")) {
            assertFalse(rs.next());
        }
    }

    private static DeltaRecord record(int hour, double height) {
        return new DeltaRecord(SliceFixtures.hourInstant(hour), "101", "P01", 1.0, 2.0, height, false);
    }

    private int count(String table) throws SQLException {
        try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getInt(1);
        }
    }
}
