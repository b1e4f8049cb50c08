package br.edu.ifba.meetingrag.storage.impl;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;

/**
 * Null-aware JDBC helpers for the epoch-millisecond and nullable integer columns.
 */
final class SqlColumns {

    private SqlColumns() {
        throw new UnsupportedOperationException("Utility class");
    }

    static void setInstant(final PreparedStatement stmt, final int index, final Instant value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.INTEGER);
        } else {
            stmt.setLong(index, value.toEpochMilli());
        }
    }

    static void setInteger(final PreparedStatement stmt, final int index, final Integer value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.INTEGER);
        } else {
            stmt.setInt(index, value.intValue());
        }
    }

    static Instant getInstant(final ResultSet rs, final String column) throws SQLException {
        final long millis = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
    }

    static Integer getInteger(final ResultSet rs, final String column) throws SQLException {
        final int value = rs.getInt(column);
        return rs.wasNull() ? null : Integer.valueOf(value);
    }
}
