package com.flagship.pledge_compliance.election;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads recipient states from the politicians table, which the same ingestion
 * job that publishes election dates keeps current.
 */
@Component
@Slf4j
public class JdbcPoliticianDirectory implements PoliticianDirectory {

    private static final String SELECT_STATE =
        "SELECT state FROM politicians WHERE politician_id = ?";

    private static final String SELECT_PLEDGEABLE_BY_STATE =
        "SELECT politician_id FROM politicians WHERE state = ? AND has_stakes = TRUE ORDER BY politician_id";

    private final JdbcTemplate jdbcTemplate;

    public JdbcPoliticianDirectory(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<String> findState(String politicianId) {
        if (politicianId == null || politicianId.isBlank()) {
            return Optional.empty();
        }
        List<String> rows = jdbcTemplate.queryForList(SELECT_STATE, String.class, politicianId.trim());
        log.debug("State lookup for politician {} returned {} row(s)", politicianId, rows.size());
        return rows.stream().findFirst();
    }

    @Override
    public List<String> findPledgeableIdsByState(String state) {
        if (state == null || state.isBlank()) {
            return List.of();
        }
        return jdbcTemplate.queryForList(
            SELECT_PLEDGEABLE_BY_STATE, String.class, state.trim().toUpperCase(Locale.ROOT));
    }
}
