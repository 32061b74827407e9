package com.flightphotos.scraper.store;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;

/** Null-safe conversions between java.time and JDBC types */
final class JdbcSupport {

    private JdbcSupport() {}

    static Timestamp ts(Instant val) {
        return val == null ? null : Timestamp.from(val);
    }

    static Timestamp ts(LocalDateTime val) {
        return val == null ? null : Timestamp.valueOf(val);
    }

    static Date date(LocalDate val) {
        return val == null ? null : Date.valueOf(val);
    }

    static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp t = rs.getTimestamp(column);
        return t == null ? null : t.toInstant();
    }

    static LocalDateTime localDateTime(ResultSet rs, String column) throws SQLException {
        Timestamp t = rs.getTimestamp(column);
        return t == null ? null : t.toLocalDateTime();
    }

    static LocalDate localDate(ResultSet rs, String column) throws SQLException {
        Date d = rs.getDate(column);
        return d == null ? null : d.toLocalDate();
    }

    static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long val = rs.getLong(column);
        return rs.wasNull() ? null : val;
    }
}
