package com.macrointel.ingest.output;

import com.macrointel.ingest.exception.PersistenceException;
import com.macrointel.ingest.model.Observation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.Types;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
@Slf4j
@RequiredArgsConstructor
public class JdbcObservationRepository implements ObservationRepository {

    private static final int BATCH_SIZE = 1000;

    private static final String UPSERT_SQL = """
        INSERT INTO observations (series_id, observation_date, value, load_timestamp)
        VALUES (?, ?, ?, CURRENT_TIMESTAMP)
        ON CONFLICT (series_id, observation_date)
        DO UPDATE SET value = EXCLUDED.value, load_timestamp = CURRENT_TIMESTAMP
        """;

    private final JdbcTemplate jdbcTemplate;

    @Override
    public int upsert(List<Observation> observations) {
        if (observations.isEmpty()) return 0;

        int total = observations.size();
        try {
            for (int i = 0; i < total; i += BATCH_SIZE) {
                List<Observation> batch = observations.subList(i, Math.min(i + BATCH_SIZE, total));
                jdbcTemplate.batchUpdate(UPSERT_SQL, batch, batch.size(), (ps, o) -> {
                    ps.setString(1, o.seriesId());
                    ps.setDate(2, Date.valueOf(o.observationDate()));
                    if (o.value() == null) {
                        ps.setNull(3, Types.DOUBLE);
                    } else {
                        ps.setDouble(3, o.value());
                    }
                });
                log.debug("Upserted batch {}/{}", Math.min(i + BATCH_SIZE, total), total);
            }
        } catch (DataAccessException e) {
            throw new PersistenceException("Upsert of " + total + " observations failed: " + e.getMessage(), e);
        }
        return total;
    }

    @Override
    public List<DuplicateKey> queryDuplicates() {
        try {
            return jdbcTemplate.query("""
                SELECT series_id, observation_date, COUNT(*) AS duplicate_count
                FROM observations
                GROUP BY series_id, observation_date
                HAVING COUNT(*) > 1
                ORDER BY series_id, observation_date
                """,
                    (rs, i) -> new DuplicateKey(
                            rs.getString("series_id"),
                            rs.getDate("observation_date").toLocalDate(),
                            rs.getInt("duplicate_count")));
        } catch (DataAccessException e) {
            throw new PersistenceException("Duplicate query failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<LatestPair> latestTwo(String seriesId) {
        try {
            List<Observation> rows = jdbcTemplate.query("""
                SELECT series_id, observation_date, value
                FROM observations
                WHERE series_id = ?
                ORDER BY observation_date DESC
                LIMIT 2
                """,
                    (rs, i) -> new Observation(
                            rs.getString("series_id"),
                            rs.getDate("observation_date").toLocalDate(),
                            rs.getObject("value") == null ? null : rs.getDouble("value")),
                    seriesId);
            if (rows.isEmpty()) return Optional.empty();
            return Optional.of(new LatestPair(rows.get(0), rows.size() > 1 ? rows.get(1) : null));
        } catch (DataAccessException e) {
            throw new PersistenceException("Latest-two query failed for " + seriesId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<LocalDate> latestObservationDate(String seriesId) {
        try {
            Date max = jdbcTemplate.queryForObject(
                    "SELECT MAX(observation_date) FROM observations WHERE series_id = ?",
                    Date.class, seriesId);
            return Optional.ofNullable(max).map(Date::toLocalDate);
        } catch (DataAccessException e) {
            throw new PersistenceException("Latest-date query failed for " + seriesId + ": " + e.getMessage(), e);
        }
    }
}
