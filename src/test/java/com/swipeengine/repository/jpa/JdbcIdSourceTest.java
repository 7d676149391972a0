package com.swipeengine.repository.jpa;

import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for JdbcIdSource.
 */
class JdbcIdSourceTest {

    @Test
    void testQueriesConfiguredTableInIdOrder() {
        JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);
        JdbcIdSource source = new JdbcIdSource(jdbcTemplate, "moments", "id");
        String expectedSql = "SELECT id FROM moments ORDER BY id LIMIT ? OFFSET ?";
        when(jdbcTemplate.queryForList(expectedSql, String.class, 50, 100)).thenReturn(List.of("m1", "m2"));

        assertEquals(expectedSql, source.getSql());
        assertEquals(List.of("m1", "m2"), source.findAllIds(50, 100));
    }

    @Test
    void testRejectsUnsafeIdentifiers() {
        JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);

        assertThrows(IllegalArgumentException.class, () -> new JdbcIdSource(jdbcTemplate, "users; DROP TABLE users", "id"));
        assertThrows(IllegalArgumentException.class, () -> new JdbcIdSource(jdbcTemplate, "users", null));
        assertDoesNotThrow(() -> new JdbcIdSource(jdbcTemplate, "public.users", "user_id"));
    }
}
