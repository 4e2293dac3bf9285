package com.baykanat.signoff.infrastructure.persistence;

import com.baykanat.signoff.domain.model.SignoffEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;

/** signoff_events tablosu: append-only batch insert ve snapshot için tam okuma. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class SignoffEventJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String INSERT_SQL = """
            INSERT INTO signoff_events (booking_contract, dc_user_id, create_dtm, signoff_method_id,
                                        sign_off_identity_id, defer_signoff_reason_id, dc_engagement_id,
                                        signoff_event_id, notes, is_deleted, idempotency_key)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (idempotency_key)
                DO UPDATE SET is_deleted = signoff_events.is_deleted OR EXCLUDED.is_deleted
            """;

    private static final String SELECT_ALL_SQL = """
            SELECT id, booking_contract, dc_user_id, create_dtm, signoff_method_id, sign_off_identity_id,
                   defer_signoff_reason_id, dc_engagement_id, signoff_event_id, notes, is_deleted,
                   idempotency_key, created_at
            FROM signoff_events
            ORDER BY id
            """;

    private static final RowMapper<SignoffEvent> ROW_MAPPER = (rs, rowNum) -> SignoffEvent.builder()
            .id(rs.getLong("id"))
            .bookingContract(rs.getString("booking_contract"))
            .dcUserId(rs.getObject("dc_user_id", Long.class))
            .createDtm(rs.getTimestamp("create_dtm").toLocalDateTime())
            .signoffMethodId(rs.getObject("signoff_method_id", Integer.class))
            .signOffIdentityId(rs.getObject("sign_off_identity_id", Integer.class))
            .deferSignoffReasonId(rs.getObject("defer_signoff_reason_id", Integer.class))
            .dcEngagementId(rs.getObject("dc_engagement_id", Long.class))
            .signoffEventId(rs.getObject("signoff_event_id", Integer.class))
            .notes(rs.getString("notes"))
            .deleted(rs.getBoolean("is_deleted"))
            .idempotencyKey(rs.getString("idempotency_key"))
            .createdAt(toInstant(rs, "created_at"))
            .build();

    /**
     * Event listesini batch insert eder. Aynı idempotency key'e sahip satır tekrar eklenmez; yalnızca
     * is_deleted bayrağı true'ya çekilebilir, geri alınamaz. Diğer kolonlar ilk yazıldığı gibi kalır.
     */
    public int[][] batchInsert(List<SignoffEvent> events) {
        return jdbcTemplate.batchUpdate(INSERT_SQL, events, events.size(),
                (ps, event) -> {
                    ps.setString(1, event.getBookingContract());
                    ps.setLong(2, event.getDcUserId());
                    ps.setTimestamp(3, Timestamp.valueOf(event.getCreateDtm()));
                    ps.setInt(4, event.getSignoffMethodId());
                    ps.setInt(5, event.getSignOffIdentityId());
                    setNullable(ps, 6, event.getDeferSignoffReasonId(), Types.INTEGER);
                    setNullable(ps, 7, event.getDcEngagementId(), Types.BIGINT);
                    setNullable(ps, 8, event.getSignoffEventId(), Types.INTEGER);
                    setNullable(ps, 9, event.getNotes(), Types.VARCHAR);
                    ps.setBoolean(10, event.isDeleted());
                    ps.setString(11, event.getIdempotencyKey());
                });
    }

    /** Silinmiş olanlar dahil tüm event'ler; silinmemiş filtresi engine'de uygulanır. */
    public List<SignoffEvent> findAll() {
        return jdbcTemplate.query(SELECT_ALL_SQL, ROW_MAPPER);
    }

    static void setNullable(PreparedStatement ps, int index, Object value, int sqlType) throws SQLException {
        if (value != null) {
            ps.setObject(index, value, sqlType);
        } else {
            ps.setNull(index, sqlType);
        }
    }

    private static Instant toInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }
}
