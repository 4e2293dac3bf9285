package com.baykanat.signoff.infrastructure.persistence;

import com.baykanat.signoff.domain.engine.ComplianceReport;
import com.baykanat.signoff.domain.model.NeverSignoffRow;
import com.baykanat.signoff.domain.model.OrgAttribution;
import com.baykanat.signoff.domain.model.QualifiedSignoffRow;
import com.baykanat.signoff.domain.model.ReportType;
import com.baykanat.signoff.domain.model.RiskSignoffRow;
import com.baykanat.signoff.domain.model.SignoffHistoryRow;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.baykanat.signoff.infrastructure.persistence.SignoffEventJdbcRepository.setNullable;

/**
 * Dört rapor tablosu: koşu sonucunu run_id ile yazar, sayfalı okur. row_seq engine'in ürettiği sırayı korur,
 * böylece aynı koşunun sayfaları her sorguda aynı sırada gelir.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class ReportResultJdbcRepository {

    private static final int BATCH_SIZE = 1000;

    private static final String ATTRIBUTION_COLUMNS =
            "level6_worker_name, level7_worker_name, level8_worker_name, level9_worker_name, "
                    + "emp_cco_id_masked, mgr_name, theater";

    private static final String INSERT_HISTORY_SQL = """
            INSERT INTO signoff_history_results (run_id, row_seq, sold_as_service_name, booking_country,
                buying_program_name, pricing_model_name, booked_theater, reference_booking_contract, notes,
                sign_off_identity, signoff_method, defer_signoff_reason, engagement_name, dc_engagement_id,
                booking_contract, user_title, fiscal_qtr_sorted_name, fiscal_mth_sorted_name,
                cal_week_sorted_short_name, create_dtm, signoff_days_ago, dc_user_id, signoff_create_dtm,
                is_last_signoff, %s, account_name, sold_as_sw_allocation, sold_as_hw_allocation)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?,
                    ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(ATTRIBUTION_COLUMNS);

    private static final String INSERT_QUALIFIED_SQL = """
            INSERT INTO qualified_signoff_results (run_id, row_seq, booking_contract, ibv_method, ibv_identity,
                ibv_event, notes, qualified_ibv, days_since_last_signoff_event, last_signoff_date)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String INSERT_NEVER_SQL = """
            INSERT INTO never_signoff_results (run_id, row_seq, booking_contract, sold_as_service_name,
                booking_country, buying_program_name, pricing_model_name, booked_theater, %s,
                account_name, sold_as_sw_allocation, sold_as_hw_allocation)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(ATTRIBUTION_COLUMNS);

    private static final String INSERT_RISK_SQL = """
            INSERT INTO risk_signoff_results (run_id, row_seq, booking_contract, sold_as_service_name,
                booking_country, buying_program_name, pricing_model_name, booked_theater, %s,
                account_name, sold_as_sw_allocation, sold_as_hw_allocation, signoff_days_ago, signoff_risk)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(ATTRIBUTION_COLUMNS);

    private final JdbcTemplate jdbcTemplate;

    /** Koşunun dört sonuç kümesini batch olarak yazar. */
    public void saveAll(long runId, ComplianceReport report) {
        saveHistory(runId, report.getHistory().getRows());
        saveQualified(runId, report.getQualified().getRows());
        saveNeverSignoff(runId, report.getNeverSignoff().getRows());
        saveRisk(runId, report.getRisk().getRows());
        log.debug("Persisted report rows for run {}", runId);
    }

    /** Filtreye uyan satır sayısı; sayfalama için. */
    public long count(ReportType type, long runId, String bookingContract, LocalDate from, LocalDate to) {
        List<Object> params = new ArrayList<>();
        String where = whereClause(type, runId, bookingContract, from, to, params);
        Long total = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + type.getTable() + where, Long.class, params.toArray());
        return total != null ? total : 0L;
    }

    /** Filtreye uyan satırlardan page. sayfayı row_seq sırasıyla döner. */
    public List<?> findPage(ReportType type, long runId, String bookingContract, LocalDate from, LocalDate to,
                            int page, int size) {
        List<Object> params = new ArrayList<>();
        String where = whereClause(type, runId, bookingContract, from, to, params);
        params.add(size);
        params.add((long) page * size);
        String sql = "SELECT * FROM " + type.getTable() + where + " ORDER BY row_seq LIMIT ? OFFSET ?";
        return jdbcTemplate.query(sql, ROW_MAPPERS.get(type), params.toArray());
    }

    private static String whereClause(ReportType type, long runId, String bookingContract,
                                      LocalDate from, LocalDate to, List<Object> params) {
        StringBuilder where = new StringBuilder(" WHERE run_id = ?");
        params.add(runId);

        if (bookingContract != null && !bookingContract.isBlank()) {
            // history'de event'siz satırlarda booking_contract null olur; kontrat kimliği reference kolonundadır
            String contractColumn = type == ReportType.SIGNOFF_HISTORY ? "reference_booking_contract" : "booking_contract";
            where.append(" AND ").append(contractColumn).append(" = ?");
            params.add(bookingContract);
        }
        if (type.supportsDateRange()) {
            if (from != null) {
                where.append(" AND ").append(type.getDateColumn()).append(" >= ?");
                params.add(Timestamp.valueOf(from.atStartOfDay()));
            }
            if (to != null) {
                where.append(" AND ").append(type.getDateColumn()).append(" < ?");
                params.add(Timestamp.valueOf(to.plusDays(1).atStartOfDay()));
            }
        }
        return where.toString();
    }

    private void saveHistory(long runId, List<SignoffHistoryRow> rows) {
        jdbcTemplate.batchUpdate(INSERT_HISTORY_SQL, indexed(rows), BATCH_SIZE, (ps, indexed) -> {
            SignoffHistoryRow row = indexed.getRow();
            ps.setLong(1, runId);
            ps.setInt(2, indexed.getSeq());
            ps.setString(3, row.getSoldAsServiceName());
            ps.setString(4, row.getBookingCountry());
            ps.setString(5, row.getBuyingProgramName());
            ps.setString(6, row.getPricingModelName());
            ps.setString(7, row.getBookedTheater());
            ps.setString(8, row.getReferenceBookingContract());
            ps.setString(9, row.getNotes());
            ps.setString(10, row.getSignOffIdentity());
            ps.setString(11, row.getSignoffMethod());
            ps.setString(12, row.getDeferSignoffReason());
            ps.setString(13, row.getEngagementName());
            setNullable(ps, 14, row.getDcEngagementId(), Types.BIGINT);
            ps.setString(15, row.getBookingContract());
            ps.setString(16, row.getUserTitle());
            ps.setString(17, row.getFiscalQtrSortedName());
            ps.setString(18, row.getFiscalMthSortedName());
            ps.setString(19, row.getCalWeekSortedShortName());
            ps.setTimestamp(20, toTimestamp(row.getCreateDtm()));
            setNullable(ps, 21, row.getSignoffDaysAgo(), Types.BIGINT);
            setNullable(ps, 22, row.getDcUserId(), Types.BIGINT);
            ps.setTimestamp(23, toTimestamp(row.getSignoffCreateDtm()));
            ps.setBoolean(24, row.isLastSignoff());
            setAttribution(ps, 25, row.getAttribution());
            ps.setString(32, row.getAccountName());
            ps.setBigDecimal(33, row.getSoldAsSwAllocation());
            ps.setBigDecimal(34, row.getSoldAsHwAllocation());
        });
    }

    private void saveQualified(long runId, List<QualifiedSignoffRow> rows) {
        jdbcTemplate.batchUpdate(INSERT_QUALIFIED_SQL, indexed(rows), BATCH_SIZE, (ps, indexed) -> {
            QualifiedSignoffRow row = indexed.getRow();
            ps.setLong(1, runId);
            ps.setInt(2, indexed.getSeq());
            ps.setString(3, row.getBookingContract());
            ps.setString(4, row.getIbvMethod());
            ps.setString(5, row.getIbvIdentity());
            ps.setString(6, row.getIbvEvent());
            ps.setString(7, row.getNotes());
            ps.setString(8, row.getQualifiedIbv());
            ps.setLong(9, row.getDaysSinceLastSignoffEvent());
            ps.setTimestamp(10, toTimestamp(row.getLastSignoffDate()));
        });
    }

    private void saveNeverSignoff(long runId, List<NeverSignoffRow> rows) {
        jdbcTemplate.batchUpdate(INSERT_NEVER_SQL, indexed(rows), BATCH_SIZE, (ps, indexed) -> {
            NeverSignoffRow row = indexed.getRow();
            ps.setLong(1, runId);
            ps.setInt(2, indexed.getSeq());
            ps.setString(3, row.getBookingContract());
            ps.setString(4, row.getSoldAsServiceName());
            ps.setString(5, row.getBookingCountry());
            ps.setString(6, row.getBuyingProgramName());
            ps.setString(7, row.getPricingModelName());
            ps.setString(8, row.getBookedTheater());
            setAttribution(ps, 9, row.getAttribution());
            ps.setString(16, row.getAccountName());
            ps.setBigDecimal(17, row.getSoldAsSwAllocation());
            ps.setBigDecimal(18, row.getSoldAsHwAllocation());
        });
    }

    private void saveRisk(long runId, List<RiskSignoffRow> rows) {
        jdbcTemplate.batchUpdate(INSERT_RISK_SQL, indexed(rows), BATCH_SIZE, (ps, indexed) -> {
            RiskSignoffRow row = indexed.getRow();
            ps.setLong(1, runId);
            ps.setInt(2, indexed.getSeq());
            ps.setString(3, row.getBookingContract());
            ps.setString(4, row.getSoldAsServiceName());
            ps.setString(5, row.getBookingCountry());
            ps.setString(6, row.getBuyingProgramName());
            ps.setString(7, row.getPricingModelName());
            ps.setString(8, row.getBookedTheater());
            setAttribution(ps, 9, row.getAttribution());
            ps.setString(16, row.getAccountName());
            ps.setBigDecimal(17, row.getSoldAsSwAllocation());
            ps.setBigDecimal(18, row.getSoldAsHwAllocation());
            ps.setLong(19, row.getSignoffDaysAgo());
            ps.setString(20, row.getSignoffRisk());
        });
    }

    private static final RowMapper<SignoffHistoryRow> HISTORY_MAPPER = (rs, rowNum) -> SignoffHistoryRow.builder()
            .soldAsServiceName(rs.getString("sold_as_service_name"))
            .bookingCountry(rs.getString("booking_country"))
            .buyingProgramName(rs.getString("buying_program_name"))
            .pricingModelName(rs.getString("pricing_model_name"))
            .bookedTheater(rs.getString("booked_theater"))
            .referenceBookingContract(rs.getString("reference_booking_contract"))
            .notes(rs.getString("notes"))
            .signOffIdentity(rs.getString("sign_off_identity"))
            .signoffMethod(rs.getString("signoff_method"))
            .deferSignoffReason(rs.getString("defer_signoff_reason"))
            .engagementName(rs.getString("engagement_name"))
            .dcEngagementId(rs.getObject("dc_engagement_id", Long.class))
            .bookingContract(rs.getString("booking_contract"))
            .userTitle(rs.getString("user_title"))
            .fiscalQtrSortedName(rs.getString("fiscal_qtr_sorted_name"))
            .fiscalMthSortedName(rs.getString("fiscal_mth_sorted_name"))
            .calWeekSortedShortName(rs.getString("cal_week_sorted_short_name"))
            .createDtm(toLocalDateTime(rs, "create_dtm"))
            .signoffDaysAgo(rs.getObject("signoff_days_ago", Long.class))
            .dcUserId(rs.getObject("dc_user_id", Long.class))
            .signoffCreateDtm(toLocalDateTime(rs, "signoff_create_dtm"))
            .lastSignoff(rs.getBoolean("is_last_signoff"))
            .attribution(attribution(rs))
            .accountName(rs.getString("account_name"))
            .soldAsSwAllocation(rs.getBigDecimal("sold_as_sw_allocation"))
            .soldAsHwAllocation(rs.getBigDecimal("sold_as_hw_allocation"))
            .build();

    private static final RowMapper<QualifiedSignoffRow> QUALIFIED_MAPPER = (rs, rowNum) -> QualifiedSignoffRow.builder()
            .bookingContract(rs.getString("booking_contract"))
            .ibvMethod(rs.getString("ibv_method"))
            .ibvIdentity(rs.getString("ibv_identity"))
            .ibvEvent(rs.getString("ibv_event"))
            .notes(rs.getString("notes"))
            .qualifiedIbv(rs.getString("qualified_ibv"))
            .daysSinceLastSignoffEvent(rs.getLong("days_since_last_signoff_event"))
            .lastSignoffDate(toLocalDateTime(rs, "last_signoff_date"))
            .build();

    private static final RowMapper<NeverSignoffRow> NEVER_MAPPER = (rs, rowNum) -> NeverSignoffRow.builder()
            .bookingContract(rs.getString("booking_contract"))
            .soldAsServiceName(rs.getString("sold_as_service_name"))
            .bookingCountry(rs.getString("booking_country"))
            .buyingProgramName(rs.getString("buying_program_name"))
            .pricingModelName(rs.getString("pricing_model_name"))
            .bookedTheater(rs.getString("booked_theater"))
            .attribution(attribution(rs))
            .accountName(rs.getString("account_name"))
            .soldAsSwAllocation(rs.getBigDecimal("sold_as_sw_allocation"))
            .soldAsHwAllocation(rs.getBigDecimal("sold_as_hw_allocation"))
            .build();

    private static final RowMapper<RiskSignoffRow> RISK_MAPPER = (rs, rowNum) -> RiskSignoffRow.builder()
            .bookingContract(rs.getString("booking_contract"))
            .soldAsServiceName(rs.getString("sold_as_service_name"))
            .bookingCountry(rs.getString("booking_country"))
            .buyingProgramName(rs.getString("buying_program_name"))
            .pricingModelName(rs.getString("pricing_model_name"))
            .bookedTheater(rs.getString("booked_theater"))
            .attribution(attribution(rs))
            .accountName(rs.getString("account_name"))
            .soldAsSwAllocation(rs.getBigDecimal("sold_as_sw_allocation"))
            .soldAsHwAllocation(rs.getBigDecimal("sold_as_hw_allocation"))
            .signoffDaysAgo(rs.getLong("signoff_days_ago"))
            .signoffRisk(rs.getString("signoff_risk"))
            .build();

    private static final Map<ReportType, RowMapper<?>> ROW_MAPPERS = new EnumMap<>(ReportType.class);

    static {
        ROW_MAPPERS.put(ReportType.SIGNOFF_HISTORY, HISTORY_MAPPER);
        ROW_MAPPERS.put(ReportType.QUALIFIED_SIGNOFF, QUALIFIED_MAPPER);
        ROW_MAPPERS.put(ReportType.NEVER_SIGNOFF, NEVER_MAPPER);
        ROW_MAPPERS.put(ReportType.RISK_SIGNOFF, RISK_MAPPER);
    }

    private static void setAttribution(PreparedStatement ps, int startIndex, OrgAttribution attribution)
            throws SQLException {
        OrgAttribution value = attribution != null ? attribution : OrgAttribution.NOT_ASSIGNED_ATTRIBUTION;
        ps.setString(startIndex, value.getLevel6WorkerName());
        ps.setString(startIndex + 1, value.getLevel7WorkerName());
        ps.setString(startIndex + 2, value.getLevel8WorkerName());
        ps.setString(startIndex + 3, value.getLevel9WorkerName());
        ps.setString(startIndex + 4, value.getEmpCcoIdMasked());
        ps.setString(startIndex + 5, value.getMgrName());
        ps.setString(startIndex + 6, value.getTheater());
    }

    private static OrgAttribution attribution(ResultSet rs) throws SQLException {
        return OrgAttribution.builder()
                .level6WorkerName(rs.getString("level6_worker_name"))
                .level7WorkerName(rs.getString("level7_worker_name"))
                .level8WorkerName(rs.getString("level8_worker_name"))
                .level9WorkerName(rs.getString("level9_worker_name"))
                .empCcoIdMasked(rs.getString("emp_cco_id_masked"))
                .mgrName(rs.getString("mgr_name"))
                .theater(rs.getString("theater"))
                .build();
    }

    private static Timestamp toTimestamp(LocalDateTime value) {
        return value != null ? Timestamp.valueOf(value) : null;
    }

    private static LocalDateTime toLocalDateTime(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toLocalDateTime() : null;
    }

    private static <T> List<IndexedRow<T>> indexed(List<T> rows) {
        List<IndexedRow<T>> result = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            result.add(new IndexedRow<>(i, rows.get(i)));
        }
        return result;
    }

    @Value
    private static class IndexedRow<T> {
        int seq;
        T row;
    }
}
