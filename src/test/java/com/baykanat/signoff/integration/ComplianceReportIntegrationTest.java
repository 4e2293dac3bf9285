package com.baykanat.signoff.integration;

import com.baykanat.signoff.api.dto.ReportPageResponse;
import com.baykanat.signoff.api.dto.ReportQueryParams;
import com.baykanat.signoff.api.dto.SignoffEventRequest;
import com.baykanat.signoff.domain.model.NeverSignoffRow;
import com.baykanat.signoff.domain.model.ReportRun;
import com.baykanat.signoff.domain.model.ReportType;
import com.baykanat.signoff.domain.model.RiskSignoffRow;
import com.baykanat.signoff.domain.model.SignoffHistoryRow;
import com.baykanat.signoff.domain.service.ComplianceReportQueryService;
import com.baykanat.signoff.domain.service.ComplianceRunService;
import com.baykanat.signoff.domain.service.SignoffIngestionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.kafka.test.context.EmbeddedKafka;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Gerçek PostgreSQL (Testcontainers) üzerinde ingestion → rapor koşusu → sorgu akışı.
 *
 * <p>Doğrulananlar:
 * <ul>
 *   <li>Signoff event'leri inbox ile tekilleşip event deposuna yazılır</li>
 *   <li>Koşu snapshot'ı okur, dört raporu run_id altında saklar</li>
 *   <li>Sorgu servisi son başarılı koşudan sayfalı okur</li>
 * </ul>
 *
 * <p>Docker yoksa test atlanır. Kafka testte embedded çalışır.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@EmbeddedKafka(partitions = 1, topics = {"signoff-events", "signoff-events.DLT"})
@ActiveProfiles("test")
class ComplianceReportIntegrationTest {

    private static final LocalDateTime AS_OF = LocalDateTime.of(2024, 7, 29, 10, 0);

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("signoff_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private SignoffIngestionService ingestionService;

    @Autowired
    private ComplianceRunService complianceRunService;

    @Autowired
    private ComplianceReportQueryService queryService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void seedReferenceData() {
        jdbcTemplate.execute("TRUNCATE booking_contracts, contract_responsible_users, dc_users, organizational_hierarchy, "
                + "sold_as_service_types, buying_programs, theaters, pricing_models, signoff_methods, signoff_identities, "
                + "defer_signoff_reasons, signoff_event_types, engagement_headers, fiscal_calendar, signoff_events, inbox, "
                + "report_runs CASCADE");

        jdbcTemplate.update("INSERT INTO sold_as_service_types VALUES (1, 'Managed Services')");
        jdbcTemplate.update("INSERT INTO buying_programs VALUES (1, 'Enterprise Agreement')");
        jdbcTemplate.update("INSERT INTO theaters VALUES (1, 'Americas')");
        jdbcTemplate.update("INSERT INTO pricing_models VALUES (1, 'Subscription')");
        jdbcTemplate.update("INSERT INTO signoff_methods VALUES (1, 'Portal'), (7, 'Deferred')");
        jdbcTemplate.update("INSERT INTO signoff_identities VALUES (1, 'Customer Admin')");
        jdbcTemplate.update("INSERT INTO defer_signoff_reasons VALUES (0, 'Not Deferred'), (1, 'Customer unavailable')");
        jdbcTemplate.update("INSERT INTO signoff_event_types VALUES (1, 'Inventory Validation')");
        jdbcTemplate.update("INSERT INTO engagement_headers VALUES (9001, 'Quarterly Review')");
        jdbcTemplate.update("INSERT INTO fiscal_calendar VALUES ('2024-05-29', 'FY2024 Q4', 'FY2024 M10', 'W22')");

        jdbcTemplate.update("INSERT INTO dc_users (user_id, user_title, cco_id) VALUES (10, 'Customer Success Manager', 'jdoe@cisco.com')");
        jdbcTemplate.update("INSERT INTO organizational_hierarchy (emp_cco_id, emp_cco_id_masked, emp_name, level6_worker_name, "
                + "level7_worker_name, level8_worker_name, level9_worker_name, mgr_name, theater) "
                + "VALUES ('jdoe', 'M-0010', 'John Doe', 'L6 Lead', 'L7 Lead', 'L8 Lead', NULL, 'Alice Manager', 'Americas')");

        insertContract("BC-IT-1");
        insertContract("BC-IT-2");
        jdbcTemplate.update("INSERT INTO contract_responsible_users (booking_contract, dc_user_id) VALUES ('BC-IT-2', 10)");
    }

    @Test
    @DisplayName("Should deduplicate identical signoffs through the inbox")
    void shouldDeduplicateIdenticalSignoffs() {
        SignoffEventRequest signoff = signoff("BC-IT-1", LocalDateTime.of(2024, 5, 29, 9, 0));

        int firstInsert = ingestionService.processBatch(List.of(signoff));
        int secondInsert = ingestionService.processBatch(List.of(signoff));

        assertThat(firstInsert).isEqualTo(1);
        assertThat(secondInsert).isZero();

        Integer eventCount = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM signoff_events WHERE booking_contract = 'BC-IT-1'", Integer.class);
        assertThat(eventCount).isEqualTo(1);
    }

    @Test
    @DisplayName("A re-sent deletion soft-deletes the stored signoff instead of being dropped")
    void resentDeletionSoftDeletesSignoff() {
        SignoffEventRequest live = signoff("BC-IT-1", LocalDateTime.of(2024, 5, 29, 9, 0));
        SignoffEventRequest deleted = signoff("BC-IT-1", LocalDateTime.of(2024, 5, 29, 9, 0));
        deleted.setDeleted(true);

        assertThat(ingestionService.processBatch(List.of(live))).isEqualTo(1);
        assertThat(ingestionService.processBatch(List.of(deleted))).isEqualTo(1);
        assertThat(ingestionService.processBatch(List.of(live))).isZero();

        Boolean isDeleted = jdbcTemplate.queryForObject(
                "SELECT is_deleted FROM signoff_events WHERE booking_contract = 'BC-IT-1'", Boolean.class);
        assertThat(isDeleted).isTrue();

        ReportRun run = complianceRunService.runAt(AS_OF);
        assertThat(run.getRiskRows()).isZero();
        // silinmiş event kontratı "dokunulmuş" sayar, never-signoff'ta yalnızca BC-IT-2 kalır
        assertThat(run.getNeverSignoffRows()).isEqualTo(1);
    }

    @Test
    @DisplayName("Run computes and stores all four reports which are then readable page by page")
    void runStoresReportsForQuery() {
        ingestionService.processBatch(List.of(signoff("BC-IT-1", LocalDateTime.of(2024, 5, 29, 9, 0))));

        ReportRun run = complianceRunService.runAt(AS_OF);

        assertThat(run.getStatus()).isEqualTo(ReportRun.Status.SUCCEEDED);
        assertThat(run.getAsOf()).isEqualTo(AS_OF);
        assertThat(run.getRiskRows()).isEqualTo(1);
        assertThat(run.getNeverSignoffRows()).isEqualTo(1);

        ReportPageResponse<Object> risk = queryService.query(query(ReportType.RISK_SIGNOFF).build());
        assertThat(risk.getRunId()).isEqualTo(run.getId());
        assertThat(risk.getRows()).singleElement()
                .isInstanceOfSatisfying(RiskSignoffRow.class, row -> {
                    assertThat(row.getBookingContract()).isEqualTo("BC-IT-1");
                    assertThat(row.getSignoffDaysAgo()).isEqualTo(61L);
                    assertThat(row.getSignoffRisk()).isEqualTo("b_med_risk");
                });

        ReportPageResponse<Object> never = queryService.query(query(ReportType.NEVER_SIGNOFF).build());
        assertThat(never.getRows()).singleElement()
                .isInstanceOfSatisfying(NeverSignoffRow.class, row -> {
                    assertThat(row.getBookingContract()).isEqualTo("BC-IT-2");
                    assertThat(row.getAttribution().getEmpCcoIdMasked()).isEqualTo("M-0010");
                    assertThat(row.getAttribution().getLevel9WorkerName()).isEqualTo("Not Assigned");
                });

        ReportPageResponse<Object> history = queryService.query(query(ReportType.SIGNOFF_HISTORY)
                .bookingContract("BC-IT-1").build());
        assertThat(history.getRows()).singleElement()
                .isInstanceOfSatisfying(SignoffHistoryRow.class, row -> {
                    assertThat(row.isLastSignoff()).isTrue();
                    assertThat(row.getSignoffMethod()).isEqualTo("Portal");
                    assertThat(row.getFiscalQtrSortedName()).isEqualTo("FY2024 Q4");
                    assertThat(row.getAttribution().getMgrName()).isEqualTo("Alice Manager");
                });
    }

    @Test
    @DisplayName("Pages are stable and cover the whole result")
    void historyPagesAreStable() {
        ReportRun run = complianceRunService.runAt(AS_OF);

        ReportPageResponse<Object> first = queryService.query(query(ReportType.SIGNOFF_HISTORY).runId(run.getId()).size(1).build());
        ReportPageResponse<Object> second = queryService.query(query(ReportType.SIGNOFF_HISTORY).runId(run.getId()).size(1).page(1).build());

        assertThat(first.getTotalElements()).isEqualTo(2);
        assertThat(first.getTotalPages()).isEqualTo(2);
        assertThat(List.of(first.getRows().get(0), second.getRows().get(0)))
                .extracting(row -> ((SignoffHistoryRow) row).getReferenceBookingContract())
                .containsExactly("BC-IT-1", "BC-IT-2");
    }

    private void insertContract(String bookingContract) {
        jdbcTemplate.update("INSERT INTO booking_contracts (booking_contract, agreement_start_date, agreement_end_date, "
                        + "account_name, booking_country, booked_theater_id, sold_as_service_type_id, buying_program_type_id, "
                        + "sold_as_pricing_type_id, sold_as_sw_allocation, sold_as_hw_allocation) "
                        + "VALUES (?, DATE '2024-01-01', DATE '2024-12-31', ?, 'US', 1, 1, 1, 1, 1000.00, 250.00)",
                bookingContract, "Account " + bookingContract);
    }

    private static SignoffEventRequest signoff(String bookingContract, LocalDateTime createDtm) {
        return SignoffEventRequest.builder()
                .bookingContract(bookingContract)
                .dcUserId(10L)
                .createDtm(createDtm)
                .signoffMethodId(1)
                .signOffIdentityId(1)
                .deferSignoffReasonId(0)
                .dcEngagementId(9001L)
                .signoffEventId(1)
                .notes("Quarterly review with customer")
                .build();
    }

    private static ReportQueryParams.ReportQueryParamsBuilder query(ReportType type) {
        return ReportQueryParams.builder().type(type).page(0).size(50);
    }
}
