package com.pipeline.amts.sinks;

import com.pipeline.amts.core.OutputSink;
import com.pipeline.amts.model.DeltaRecord;
import com.pipeline.amts.model.ProcessingMode;
import com.pipeline.amts.model.SliceDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.List;

/**
 * 基于SQLite的数据记录库输出。
 *
 * 核心设计：
 * - 只处理 SQLImport=true 的切片
 * - 一个切片一张表，表名 dl_{切片存储名}
 * - 时间戳（毫秒）为主键，重复写入覆盖
 * - 全量重建时先清空该切片的表
 */
public class SqliteDataloggerSink implements OutputSink {

    private static final Logger log = LoggerFactory.getLogger(SqliteDataloggerSink.class);

    private final String dbPath;
    private final Connection connection;

    public SqliteDataloggerSink(String dbPath) {
        this.dbPath = dbPath;

        // 确保数据库目录存在
        File parent = new File(dbPath).getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            throw new IllegalStateException("Failed to create datalogger directory: " + parent);
        }

        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            connection.setAutoCommit(true);
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("PRAGMA synchronous=NORMAL");
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to open datalogger database " + dbPath, e);
        }
        log.info("SqliteDataloggerSink initialized at: {}", dbPath);
    }

    @Override
    public String name() {
        return "sqlite-datalogger";
    }

    @Override
    public synchronized void accept(SliceDefinition definition, List<DeltaRecord> records,
                                    ProcessingMode mode) throws SQLException {
        if (!definition.isSqlExport()) {
            return;
        }
        String table = tableName(definition.getSliceId());

        connection.setAutoCommit(false);
        try {
            ensureTableExists(table);
            if (mode == ProcessingMode.FULL) {
                try (Statement stmt = connection.createStatement()) {
                    stmt.executeUpdate("DELETE FROM " + table);
                }
            }

            String sql = "INSERT OR REPLACE INTO " + table
                    + " (timestamp, sensor_id, delta_h_mm, delta_n_mm, delta_e_mm) VALUES (?, ?, ?, ?, ?)";
            try (PreparedStatement stmt = connection.prepareStatement(sql)) {
                for (DeltaRecord r : records) {
                    stmt.setLong(1, r.getTimestamp().toEpochMilli());
                    stmt.setString(2, r.getSensorId());
                    stmt.setDouble(3, r.getDeltaHeightMm());
                    setNullable(stmt, 4, r.getDeltaNorthMm());
                    setNullable(stmt, 5, r.getDeltaEastMm());
                    stmt.addBatch();
                }
                stmt.executeBatch();
            }
            connection.commit();
            log.debug("Datalogger table '{}': {} row(s) written ({}).", table, records.size(), mode);
        } catch (SQLException e) {
            connection.rollback();
            throw e;
        } finally {
            connection.setAutoCommit(true);
        }
    }

    private void ensureTableExists(String table) throws SQLException {
        String sql = "CREATE TABLE IF NOT EXISTS " + table + " ("
                + "timestamp INTEGER NOT NULL, "
                + "sensor_id TEXT, "
                + "delta_h_mm REAL, "
                + "delta_n_mm REAL, "
                + "delta_e_mm REAL, "
                + "PRIMARY KEY (timestamp))";
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(sql);
        }
    }

    private static void setNullable(PreparedStatement stmt, int index, Double value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.REAL);
        } else {
            stmt.setDouble(index, value);
        }
    }

    /** 将切片标识转为合法的SQLite表名 */
    static String tableName(String sliceId) {
        return "dl_" + SliceDefinition.storageName(sliceId);
    }

    @Override
    public synchronized void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close datalogger database {}: {}", dbPath, e.getMessage());
        }
        log.info("SqliteDataloggerSink shut down.");
    }
}
