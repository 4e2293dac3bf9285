package com.baykanat.signoff.infrastructure.persistence;

import com.baykanat.signoff.domain.model.BookingContract;
import com.baykanat.signoff.domain.model.DcUser;
import com.baykanat.signoff.domain.model.FiscalPeriod;
import com.baykanat.signoff.domain.model.OrgHierarchyEntry;
import com.baykanat.signoff.domain.model.ReferenceData;
import com.baykanat.signoff.domain.model.ResponsibleUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hesaplama girdisi olan kontrat, sorumlu kullanıcı, kullanıcı, hiyerarşi ve dimension tablolarını okur.
 * Tutarlı bir snapshot için çağıran taraf bu metotları tek bir read-only transaction içinde çağırır.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class SnapshotJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    public List<BookingContract> findContracts() {
        String sql = """
                SELECT booking_contract, agreement_start_date, agreement_end_date, is_deleted, account_name,
                       booking_country, booked_theater_id, sold_as_service_type_id, buying_program_type_id,
                       sold_as_pricing_type_id, sold_as_sw_allocation, sold_as_hw_allocation
                FROM booking_contracts
                ORDER BY booking_contract
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> BookingContract.builder()
                .bookingContract(rs.getString("booking_contract"))
                .agreementStartDate(toLocalDate(rs.getDate("agreement_start_date")))
                .agreementEndDate(toLocalDate(rs.getDate("agreement_end_date")))
                .deleted(rs.getBoolean("is_deleted"))
                .accountName(rs.getString("account_name"))
                .bookingCountry(rs.getString("booking_country"))
                .bookedTheaterId(rs.getObject("booked_theater_id", Integer.class))
                .soldAsServiceTypeId(rs.getObject("sold_as_service_type_id", Integer.class))
                .buyingProgramTypeId(rs.getObject("buying_program_type_id", Integer.class))
                .soldAsPricingTypeId(rs.getObject("sold_as_pricing_type_id", Integer.class))
                .soldAsSwAllocation(rs.getBigDecimal("sold_as_sw_allocation"))
                .soldAsHwAllocation(rs.getBigDecimal("sold_as_hw_allocation"))
                .build());
    }

    public List<ResponsibleUser> findResponsibleUsers() {
        String sql = "SELECT booking_contract, dc_user_id, is_deleted FROM contract_responsible_users ORDER BY booking_contract, dc_user_id";
        return jdbcTemplate.query(sql, (rs, rowNum) -> ResponsibleUser.builder()
                .bookingContract(rs.getString("booking_contract"))
                .dcUserId(rs.getLong("dc_user_id"))
                .deleted(rs.getBoolean("is_deleted"))
                .build());
    }

    public List<DcUser> findUsers() {
        String sql = "SELECT user_id, user_title, cco_id, is_deleted FROM dc_users ORDER BY user_id";
        return jdbcTemplate.query(sql, (rs, rowNum) -> DcUser.builder()
                .userId(rs.getLong("user_id"))
                .userTitle(rs.getString("user_title"))
                .ccoId(rs.getString("cco_id"))
                .deleted(rs.getBoolean("is_deleted"))
                .build());
    }

    public List<OrgHierarchyEntry> findHierarchy() {
        String sql = """
                SELECT emp_cco_id, emp_cco_id_masked, emp_name, level6_worker_name, level7_worker_name,
                       level8_worker_name, level9_worker_name, mgr_name, theater, is_deleted
                FROM organizational_hierarchy
                ORDER BY emp_cco_id
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> OrgHierarchyEntry.builder()
                .empCcoId(rs.getString("emp_cco_id"))
                .empCcoIdMasked(rs.getString("emp_cco_id_masked"))
                .empName(rs.getString("emp_name"))
                .level6WorkerName(rs.getString("level6_worker_name"))
                .level7WorkerName(rs.getString("level7_worker_name"))
                .level8WorkerName(rs.getString("level8_worker_name"))
                .level9WorkerName(rs.getString("level9_worker_name"))
                .mgrName(rs.getString("mgr_name"))
                .theater(rs.getString("theater"))
                .deleted(rs.getBoolean("is_deleted"))
                .build());
    }

    /** Tüm dimension tablolarını ve fiscal takvimi tek bir ReferenceData'da toplar. */
    public ReferenceData loadReferenceData() {
        ReferenceData.ReferenceDataBuilder builder = ReferenceData.builder()
                .serviceTypes(intLookup("sold_as_service_types", "service_type_id", "sold_as_service_name"))
                .buyingPrograms(intLookup("buying_programs", "buying_program_type_id", "buying_program_name"))
                .theaters(intLookup("theaters", "theater_id", "theater_name"))
                .pricingModels(intLookup("pricing_models", "pricing_type_id", "pricing_model_name"))
                .signoffMethods(intLookup("signoff_methods", "signoff_method_id", "signoff_method"))
                .signoffIdentities(intLookup("signoff_identities", "sign_off_identity_id", "sign_off_identity"))
                .deferReasons(intLookup("defer_signoff_reasons", "defer_signoff_reason_id", "defer_signoff_reason"))
                .signoffEventTypes(intLookup("signoff_event_types", "signoff_event_id", "signoff_event"))
                .engagements(engagementLookup());

        String sql = """
                SELECT calendar_date, fiscal_qtr_sorted_name, fiscal_mth_sorted_name, cal_week_sorted_short_name
                FROM fiscal_calendar
                """;
        jdbcTemplate.query(sql, rs -> {
            LocalDate date = rs.getDate("calendar_date").toLocalDate();
            builder.fiscalPeriod(date, FiscalPeriod.builder()
                    .calendarDate(date)
                    .fiscalQtrSortedName(rs.getString("fiscal_qtr_sorted_name"))
                    .fiscalMthSortedName(rs.getString("fiscal_mth_sorted_name"))
                    .calWeekSortedShortName(rs.getString("cal_week_sorted_short_name"))
                    .build());
        });
        return builder.build();
    }

    private Map<Integer, String> intLookup(String table, String idColumn, String nameColumn) {
        Map<Integer, String> result = new LinkedHashMap<>();
        String sql = "SELECT " + idColumn + ", " + nameColumn + " FROM " + table;
        jdbcTemplate.query(sql, rs -> {
            result.put(rs.getInt(idColumn), rs.getString(nameColumn));
        });
        return result;
    }

    private Map<Long, String> engagementLookup() {
        Map<Long, String> result = new LinkedHashMap<>();
        jdbcTemplate.query("SELECT dc_engagement_id, engagement_name FROM engagement_headers", rs -> {
            result.put(rs.getLong("dc_engagement_id"), rs.getString("engagement_name"));
        });
        return result;
    }

    private static LocalDate toLocalDate(Date date) {
        return date != null ? date.toLocalDate() : null;
    }
}
