package com.swipeengine.repository.jpa;

import com.swipeengine.repository.IdSource;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Id source listing the primary keys of an application table, e.g. users or moments.
 */
public class JdbcIdSource implements IdSource {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private final JdbcTemplate jdbcTemplate;
    private final String sql;

    public JdbcIdSource(JdbcTemplate jdbcTemplate, String table, String column) {
        this.jdbcTemplate = jdbcTemplate;
        // Identifiers cannot be bound as parameters
        this.sql = "SELECT " + requireIdentifier(column) + " FROM " + requireIdentifier(table)
                + " ORDER BY " + column + " LIMIT ? OFFSET ?";
    }

    @Override
    public List<String> findAllIds(int limit, int offset) {
        return jdbcTemplate.queryForList(sql, String.class, limit, offset);
    }

    String getSql() {
        return sql;
    }

    private static String requireIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid SQL identifier: " + name);
        }
        return name;
    }
}
