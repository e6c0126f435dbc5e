package com.moddock.api.report;

import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Existence checks straight against the platform tables.
 */
@Component
public class JdbcEntityExistenceOracle implements EntityExistenceOracle {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcEntityExistenceOracle(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean projectExists(long projectId) {
        return exists("SELECT EXISTS(SELECT 1 FROM projects WHERE id = :id)", projectId);
    }

    @Override
    public boolean versionExists(long versionId) {
        return exists("SELECT EXISTS(SELECT 1 FROM versions WHERE id = :id)", versionId);
    }

    @Override
    public boolean userExists(long userId) {
        return exists("SELECT EXISTS(SELECT 1 FROM users WHERE id = :id)", userId);
    }

    private boolean exists(String sql, long id) {
        Boolean result = jdbcTemplate.queryForObject(sql, new MapSqlParameterSource("id", id), Boolean.class);
        return Boolean.TRUE.equals(result);
    }
}
