package com.chessvision.db;

import com.chessvision.util.DescriptorCodec;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class PrototypeDao {

    private final String dbPath;

    public PrototypeDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    public void upsert(PrototypeRow row) throws SQLException {
        String sql = "INSERT INTO class_prototype (label, descriptor_blob, sample_count, updated_ts) " +
                "VALUES (?, ?, ?, ?) " +
                "ON CONFLICT(label) DO UPDATE SET " +
                "descriptor_blob = excluded.descriptor_blob, sample_count = excluded.sample_count, " +
                "updated_ts = excluded.updated_ts";

        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, row.getLabel());
            ps.setBytes(2, DescriptorCodec.encode(row.getDescriptor()));
            ps.setInt(3, row.getSampleCount());
            ps.setLong(4, row.getUpdatedTs());
            ps.executeUpdate();
        }
    }

    public Optional<PrototypeRow> findByLabel(String label) throws SQLException {
        String sql = "SELECT label, descriptor_blob, sample_count, updated_ts FROM class_prototype WHERE label = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, label);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(read(rs));
                }
            }
        }
        return Optional.empty();
    }

    public List<PrototypeRow> loadAll() throws SQLException {
        List<PrototypeRow> rows = new ArrayList<>();
        String sql = "SELECT label, descriptor_blob, sample_count, updated_ts FROM class_prototype ORDER BY label";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                rows.add(read(rs));
            }
        }
        return rows;
    }

    public void deleteAll() throws SQLException {
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement("DELETE FROM class_prototype")) {
            ps.executeUpdate();
        }
    }

    private static PrototypeRow read(ResultSet rs) throws SQLException {
        return new PrototypeRow(
                rs.getString("label"),
                DescriptorCodec.decode(rs.getBytes("descriptor_blob")),
                rs.getInt("sample_count"),
                rs.getLong("updated_ts"));
    }
}
