package com.chartgate.database.jdbc;

import com.chartgate.metering.BillingPeriod;
import com.chartgate.metering.QuotaReservation;
import com.chartgate.metering.ReservationOutcome;
import com.chartgate.metering.UsageRecord;
import com.chartgate.metering.UsageStore;
import com.chartgate.security.StorageUnavailableException;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link UsageStore} on the usage store database.
 *
 * <p>Every decision for a (tenant, period) counter runs in one transaction that first takes the
 * counter row with {@code SELECT ... FOR UPDATE}, so concurrent reservations for the same counter
 * are serialized by the database and different counters never block each other. The row is created
 * beforehand in its own statement; a concurrent creator losing the insert race is not an error.
 */
public class JdbcUsageStore implements UsageStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcUsageStore.class);

    private final JdbcClient jdbc;
    private final TransactionTemplate tx;

    public JdbcUsageStore(JdbcClient jdbc, TransactionTemplate tx) {
        this.jdbc = jdbc;
        this.tx = tx;
    }

    @Override
    public ReservationOutcome reserve(QuotaReservation reservation, long quota, Instant now) {
        String tenantId = reservation.tenantId();
        Date periodStart = periodStart(reservation.period());
        return access("reserve", () -> {
            ensureRecord(tenantId, periodStart);
            return tx.execute(status -> {
                long committed = lockCounter(tenantId, periodStart);
                int purged = jdbc.sql(
                                """
                                DELETE FROM quota_reservations
                                WHERE tenant_id = :tenantId AND period_start = :periodStart
                                  AND expires_at <= :now
                                """)
                        .param("tenantId", tenantId)
                        .param("periodStart", periodStart)
                        .param("now", Timestamp.from(now))
                        .update();
                if (purged > 0) {
                    log.warn("Purged {} expired quota reservation(s) for tenant {} in {}",
                            purged, tenantId, reservation.period().id());
                }
                long inFlight = jdbc.sql(
                                """
                                SELECT COUNT(*) FROM quota_reservations
                                WHERE tenant_id = :tenantId AND period_start = :periodStart
                                """)
                        .param("tenantId", tenantId)
                        .param("periodStart", periodStart)
                        .query(Long.class)
                        .single();
                if (committed + inFlight >= quota) {
                    return new ReservationOutcome(false, committed, inFlight);
                }
                jdbc.sql(
                                """
                                INSERT INTO quota_reservations
                                    (reservation_id, tenant_id, period_start, created_at, expires_at)
                                VALUES (:id, :tenantId, :periodStart, :createdAt, :expiresAt)
                                """)
                        .param("id", reservation.reservationId())
                        .param("tenantId", tenantId)
                        .param("periodStart", periodStart)
                        .param("createdAt", Timestamp.from(reservation.createdAt()))
                        .param("expiresAt", Timestamp.from(reservation.expiresAt()))
                        .update();
                return new ReservationOutcome(true, committed, inFlight + 1);
            });
        });
    }

    @Override
    public boolean commit(QuotaReservation reservation, Instant now) {
        String tenantId = reservation.tenantId();
        Date periodStart = periodStart(reservation.period());
        return access("commit", () -> {
            ensureRecord(tenantId, periodStart);
            return tx.execute(status -> {
                long committed = lockCounter(tenantId, periodStart);
                boolean held = deleteReservation(reservation.reservationId()) > 0;
                if (reservation.leased() && !held) {
                    long live = jdbc.sql(
                                    """
                                    SELECT COUNT(*) FROM quota_reservations
                                    WHERE tenant_id = :tenantId AND period_start = :periodStart
                                      AND expires_at > :now
                                    """)
                            .param("tenantId", tenantId)
                            .param("periodStart", periodStart)
                            .param("now", Timestamp.from(now))
                            .query(Long.class)
                            .single();
                    if (committed + live >= reservation.quota()) {
                        return false;
                    }
                }
                jdbc.sql(
                                """
                                UPDATE usage_records SET request_count = request_count + 1
                                WHERE tenant_id = :tenantId AND period_start = :periodStart
                                """)
                        .param("tenantId", tenantId)
                        .param("periodStart", periodStart)
                        .update();
                return true;
            });
        });
    }

    @Override
    public void release(QuotaReservation reservation) {
        access("release", () -> deleteReservation(reservation.reservationId()));
    }

    @Override
    public Optional<UsageRecord> find(String tenantId, BillingPeriod period) {
        return access("find usage", () -> jdbc.sql(
                        """
                        SELECT request_count FROM usage_records
                        WHERE tenant_id = :tenantId AND period_start = :periodStart
                        """)
                .param("tenantId", tenantId)
                .param("periodStart", periodStart(period))
                .query(Long.class)
                .optional()
                .map(count -> new UsageRecord(tenantId, period, count)));
    }

    @Override
    public List<UsageRecord> history(String tenantId, int limit) {
        return access("usage history", () -> jdbc.sql(
                        """
                        SELECT period_start, request_count FROM usage_records
                        WHERE tenant_id = :tenantId
                        ORDER BY period_start DESC
                        LIMIT :limit
                        """)
                .param("tenantId", tenantId)
                .param("limit", limit)
                .query((rs, row) -> new UsageRecord(
                        tenantId,
                        new BillingPeriod(YearMonth.from(rs.getDate("period_start").toLocalDate())),
                        rs.getLong("request_count")))
                .list());
    }

    private void ensureRecord(String tenantId, Date periodStart) {
        boolean exists = jdbc.sql(
                        """
                        SELECT COUNT(*) FROM usage_records
                        WHERE tenant_id = :tenantId AND period_start = :periodStart
                        """)
                .param("tenantId", tenantId)
                .param("periodStart", periodStart)
                .query(Long.class)
                .single() > 0;
        if (exists) {
            return;
        }
        try {
            jdbc.sql(
                            """
                            INSERT INTO usage_records (tenant_id, period_start, request_count)
                            VALUES (:tenantId, :periodStart, 0)
                            """)
                    .param("tenantId", tenantId)
                    .param("periodStart", periodStart)
                    .update();
        } catch (DuplicateKeyException e) {
            log.debug("Usage record for tenant {} at {} created concurrently", tenantId, periodStart);
        }
    }

    private long lockCounter(String tenantId, Date periodStart) {
        return jdbc.sql(
                        """
                        SELECT request_count FROM usage_records
                        WHERE tenant_id = :tenantId AND period_start = :periodStart
                        FOR UPDATE
                        """)
                .param("tenantId", tenantId)
                .param("periodStart", periodStart)
                .query(Long.class)
                .single();
    }

    private int deleteReservation(String reservationId) {
        return jdbc.sql("DELETE FROM quota_reservations WHERE reservation_id = :id")
                .param("id", reservationId)
                .update();
    }

    private static Date periodStart(BillingPeriod period) {
        LocalDate first = period.month().atDay(1);
        return Date.valueOf(first);
    }

    private static <T> T access(String operation, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessException | TransactionException e) {
            log.error("Usage store failed to {}: {}", operation, e.getMessage());
            throw new StorageUnavailableException("Usage store unavailable (" + operation + ")", e);
        }
    }
}
