package com.harvest.jobcrawler.crawl.throttle;

import com.harvest.jobcrawler.crawl.model.ThrottleState;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * Throttle state kept in {@code throttle_state}, one row per key. Each mutation runs in its own transaction
 * holding the row lock, so processes sharing the database observe one consistent bucket per key.
 */
public class JdbcThrottleStateStore implements ThrottleStateStore {
    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;

    public JdbcThrottleStateStore(NamedParameterJdbcTemplate jdbc, TransactionTemplate transactionTemplate) {
        this.jdbc = jdbc;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public TokenGrant tryAcquire(String bucketKey, double rate, double capacity, Instant now) {
        ensureRow(bucketKey);
        return transactionTemplate.execute(status -> {
            ThrottleState state = lockRow(bucketKey);
            TokenGrant grant = TokenBucket.tryConsume(
                state.lastRefillAt() == null ? null : state.availableTokens(),
                state.lastRefillAt(),
                rate,
                capacity,
                now
            );
            jdbc.update(
                """
                    UPDATE throttle_state
                    SET available_tokens = :tokens,
                        last_refill_at = :refilledAt
                    WHERE throttle_key = :key
                    """,
                new MapSqlParameterSource()
                    .addValue("key", bucketKey)
                    .addValue("tokens", grant.remainingTokens())
                    .addValue("refilledAt", Timestamp.from(grant.refilledAt()))
            );
            return grant;
        });
    }

    @Override
    public boolean isCoolingDown(String scopeKey, Instant now) {
        List<Timestamp> rows = jdbc.query(
            """
                SELECT cooldown_until
                FROM throttle_state
                WHERE throttle_key = :key
                """,
            new MapSqlParameterSource("key", scopeKey),
            (rs, rowNum) -> rs.getTimestamp("cooldown_until")
        );
        if (rows.isEmpty() || rows.get(0) == null) {
            return false;
        }
        return rows.get(0).toInstant().isAfter(now);
    }

    @Override
    public void startCooldown(String scopeKey, Instant until) {
        ensureRow(scopeKey);
        jdbc.update(
            """
                UPDATE throttle_state
                SET cooldown_until = :until
                WHERE throttle_key = :key
                """,
            new MapSqlParameterSource()
                .addValue("key", scopeKey)
                .addValue("until", Timestamp.from(until))
        );
    }

    @Override
    public double adaptiveRate(String rateKey, double baseRate) {
        List<Double> rows = jdbc.query(
            """
                SELECT adaptive_rate
                FROM throttle_state
                WHERE throttle_key = :key
                """,
            new MapSqlParameterSource("key", rateKey),
            (rs, rowNum) -> nullableDouble(rs, "adaptive_rate")
        );
        if (rows.isEmpty() || rows.get(0) == null) {
            return baseRate;
        }
        return rows.get(0);
    }

    @Override
    public double recordSuccess(String rateKey, double baseRate, AdaptivePolicy policy) {
        ensureRow(rateKey);
        Double updated = transactionTemplate.execute(status -> {
            ThrottleState state = lockRow(rateKey);
            double rate = state.adaptiveRate() == null ? baseRate : state.adaptiveRate();
            int streak = state.successStreak() + 1;
            if (streak >= policy.successStreakThreshold()) {
                streak = 0;
                rate = policy.boost(rate, baseRate);
            }
            writeAdaptive(rateKey, rate, streak);
            return rate;
        });
        return updated == null ? baseRate : updated;
    }

    @Override
    public double recordRateLimited(String rateKey, double baseRate, AdaptivePolicy policy) {
        ensureRow(rateKey);
        Double updated = transactionTemplate.execute(status -> {
            ThrottleState state = lockRow(rateKey);
            double rate = state.adaptiveRate() == null ? baseRate : state.adaptiveRate();
            double cut = policy.cut(rate, baseRate);
            writeAdaptive(rateKey, cut, 0);
            return cut;
        });
        return updated == null ? baseRate : updated;
    }

    private void writeAdaptive(String key, double rate, int streak) {
        jdbc.update(
            """
                UPDATE throttle_state
                SET adaptive_rate = :rate,
                    success_streak = :streak
                WHERE throttle_key = :key
                """,
            new MapSqlParameterSource()
                .addValue("key", key)
                .addValue("rate", rate)
                .addValue("streak", streak)
        );
    }

    private ThrottleState lockRow(String key) {
        List<ThrottleState> rows = jdbc.query(
            """
                SELECT throttle_key, available_tokens, last_refill_at, adaptive_rate, success_streak, cooldown_until
                FROM throttle_state
                WHERE throttle_key = :key
                FOR UPDATE
                """,
            new MapSqlParameterSource("key", key),
            (rs, rowNum) -> mapState(rs)
        );
        if (rows.isEmpty()) {
            throw new IllegalStateException("throttle_state row missing for key " + key);
        }
        return rows.get(0);
    }

    // Runs outside the mutation transaction so a concurrent insert cannot abort it.
    private void ensureRow(String key) {
        Integer existing = jdbc.queryForObject(
            "SELECT COUNT(*) FROM throttle_state WHERE throttle_key = :key",
            new MapSqlParameterSource("key", key),
            Integer.class
        );
        if (existing == null || existing == 0) {
            try {
                jdbc.update(
                    """
                        INSERT INTO throttle_state (throttle_key, available_tokens, success_streak)
                        VALUES (:key, 0, 0)
                        """,
                    new MapSqlParameterSource("key", key)
                );
            } catch (DuplicateKeyException ignored) {
                // another worker created the row first
            }
        }
    }

    private ThrottleState mapState(ResultSet rs) throws SQLException {
        Timestamp refilled = rs.getTimestamp("last_refill_at");
        Timestamp cooldown = rs.getTimestamp("cooldown_until");
        return new ThrottleState(
            rs.getString("throttle_key"),
            rs.getDouble("available_tokens"),
            refilled == null ? null : refilled.toInstant(),
            nullableDouble(rs, "adaptive_rate"),
            rs.getInt("success_streak"),
            cooldown == null ? null : cooldown.toInstant()
        );
    }

    private Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }
}
