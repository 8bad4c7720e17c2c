package de.bsommerfeld.sqlcontents.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Id-addressed content access shared by the file and checkpoint stores.
 */
final class RowContent {

    private RowContent() {
    }

    static List<Long> selectIds(Connection conn, String statement, String userId) throws SQLException {
        List<Long> ids = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(statement))) {
            ps.setString(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    ids.add(rs.getLong("id"));
            }
        }
        return ids;
    }

    static byte[] read(Connection conn, String statement, long id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(statement))) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next())
                    throw new SQLException("Row " + id + " vanished during " + statement);
                return rs.getBytes("content");
            }
        }
    }

    static void write(Connection conn, String statement, long id, byte[] content) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(statement))) {
            ps.setBytes(1, content);
            ps.setLong(2, id);
            ps.executeUpdate();
        }
    }
}
