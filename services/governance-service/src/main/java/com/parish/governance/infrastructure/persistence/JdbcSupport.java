package com.parish.governance.infrastructure.persistence;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Locale;

/**
 * Column conversions shared by the JDBC repositories.
 */
final class JdbcSupport {

    private JdbcSupport() {
        // utility class
    }

    static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp value = rs.getTimestamp(column);
        return value == null ? null : value.toInstant();
    }

    /** Lower-cased key backing the case-insensitive unique constraints. */
    static String nameKey(String name) {
        return name.strip().toLowerCase(Locale.ROOT);
    }

    /** {@code %term%} for a {@code LOWER(column) LIKE} match, or null for a blank term. */
    static String likePattern(String term) {
        if (term == null || term.isBlank()) {
            return null;
        }
        String escaped = term.strip().toLowerCase(Locale.ROOT)
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
        return "%" + escaped + "%";
    }
}
