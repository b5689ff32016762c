package com.flagship.pledge_compliance.election;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads election dates from the election_dates table.
 *
 * The table is refreshed by an external ingestion job, or by an administrator
 * through {@link #saveElectionDates}. Plain JDBC keeps the lookup a single
 * indexed query with no entity state.
 */
@Component
@Slf4j
public class JdbcElectionDateProvider implements ElectionDateProvider {

    private static final String SELECT_BY_STATE =
        "SELECT state, primary_date, general_date, runoff_date, special_date " +
        "FROM election_dates WHERE state = ?";

    private static final String UPSERT =
        "INSERT INTO election_dates (state, primary_date, general_date, runoff_date, special_date, updated_at) " +
        "VALUES (?, ?, ?, ?, ?, NOW()) " +
        "ON CONFLICT (state) DO UPDATE SET primary_date = EXCLUDED.primary_date, " +
        "general_date = EXCLUDED.general_date, runoff_date = EXCLUDED.runoff_date, " +
        "special_date = EXCLUDED.special_date, updated_at = NOW()";

    private final JdbcTemplate jdbcTemplate;

    public JdbcElectionDateProvider(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<ElectionDates> getElectionDates(String state) {
        if (state == null || state.isBlank()) {
            return Optional.empty();
        }
        List<ElectionDates> rows = jdbcTemplate.query(
            SELECT_BY_STATE,
            ELECTION_DATES_MAPPER,
            state.trim().toUpperCase(Locale.ROOT)
        );
        log.debug("Election date lookup for state {} returned {} row(s)", state, rows.size());
        return rows.stream().findFirst();
    }

    @Override
    public void saveElectionDates(ElectionDates dates) {
        String state = dates.getState().trim().toUpperCase(Locale.ROOT);
        jdbcTemplate.update(UPSERT,
            state,
            toSqlDate(dates.getPrimary()),
            toSqlDate(dates.getGeneral()),
            toSqlDate(dates.getRunoff()),
            toSqlDate(dates.getSpecial()));
        log.info("Saved election dates for state {}: primary={}, general={}, runoff={}, special={}",
            state, dates.getPrimary(), dates.getGeneral(), dates.getRunoff(), dates.getSpecial());
    }

    private static final RowMapper<ElectionDates> ELECTION_DATES_MAPPER = (ResultSet rs, int rowNum) ->
        ElectionDates.authoritative(
            rs.getString("state"),
            toLocalDate(rs, "primary_date"),
            toLocalDate(rs, "general_date"),
            toLocalDate(rs, "runoff_date"),
            toLocalDate(rs, "special_date")
        );

    private static Date toSqlDate(LocalDate date) {
        return date != null ? Date.valueOf(date) : null;
    }

    private static LocalDate toLocalDate(ResultSet rs, String column) throws SQLException {
        Date date = rs.getDate(column);
        return date != null ? date.toLocalDate() : null;
    }
}
