package com.chessvision.db;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class SqliteInitializer {

    public static void initialize(String dbPath) throws SQLException {
        String url = "jdbc:sqlite:" + dbPath;
        try (Connection conn = DriverManager.getConnection(url)) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA journal_mode = WAL;");

                stmt.execute("CREATE TABLE IF NOT EXISTS class_prototype (" +
                        "label TEXT PRIMARY KEY, " +
                        "descriptor_blob BLOB NOT NULL, " +
                        "sample_count INTEGER NOT NULL, " +
                        "updated_ts INTEGER NOT NULL" +
                        ");");
            }
        }
    }
}
