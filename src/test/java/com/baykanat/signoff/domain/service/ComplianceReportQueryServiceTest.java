package com.baykanat.signoff.domain.service;

import com.baykanat.signoff.api.dto.ReportPageResponse;
import com.baykanat.signoff.api.dto.ReportQueryParams;
import com.baykanat.signoff.config.AppProperties;
import com.baykanat.signoff.domain.exception.InvalidReportQueryException;
import com.baykanat.signoff.domain.exception.NoSucceededRunException;
import com.baykanat.signoff.domain.exception.ReportRunNotFoundException;
import com.baykanat.signoff.domain.model.ReportRun;
import com.baykanat.signoff.domain.model.ReportType;
import com.baykanat.signoff.domain.model.RiskSignoffRow;
import com.baykanat.signoff.infrastructure.persistence.ReportResultJdbcRepository;
import com.baykanat.signoff.infrastructure.persistence.ReportRunJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/** ComplianceReportQueryService unit testleri: parametre doğrulama, koşu çözümleme ve sayfalama. */
@ExtendWith(MockitoExtension.class)
class ComplianceReportQueryServiceTest {

    private static final LocalDateTime AS_OF = LocalDateTime.of(2024, 7, 29, 10, 0);

    @Mock
    private ReportRunJdbcRepository reportRunRepository;

    @Mock
    private ReportResultJdbcRepository reportResultRepository;

    private ComplianceReportQueryService service;

    @BeforeEach
    void setUp() {
        AppProperties appProperties = new AppProperties();
        appProperties.getQuery().setMaxPageSize(100);
        service = new ComplianceReportQueryService(reportRunRepository, reportResultRepository, appProperties);
    }

    @Test
    @DisplayName("Without run_id the latest succeeded run is read and pages are computed")
    void queryUsesLatestSucceededRun() {
        RiskSignoffRow row = RiskSignoffRow.builder().bookingContract("BC-R1").signoffDaysAgo(61).signoffRisk("b_med_risk").build();
        when(reportRunRepository.findLatestSucceeded()).thenReturn(Optional.of(run(3L, ReportRun.Status.SUCCEEDED)));
        when(reportResultRepository.count(ReportType.RISK_SIGNOFF, 3L, null, null, null)).thenReturn(21L);
        doReturn(List.of(row)).when(reportResultRepository)
                .findPage(ReportType.RISK_SIGNOFF, 3L, null, null, null, 2, 10);

        ReportPageResponse<Object> page = service.query(params(ReportType.RISK_SIGNOFF).page(2).size(10).build());

        assertThat(page.getRunId()).isEqualTo(3L);
        assertThat(page.getAsOf()).isEqualTo(AS_OF);
        assertThat(page.getReport()).isEqualTo("risk-signoff");
        assertThat(page.getTotalElements()).isEqualTo(21L);
        assertThat(page.getTotalPages()).isEqualTo(3);
        assertThat(page.getRows()).containsExactly(row);
    }

    @Test
    @DisplayName("Empty result skips the page query")
    void emptyResultSkipsPageQuery() {
        LocalDate from = LocalDate.of(2024, 1, 1);
        LocalDate to = LocalDate.of(2024, 3, 31);
        when(reportRunRepository.findById(7L)).thenReturn(Optional.of(run(7L, ReportRun.Status.SUCCEEDED)));
        when(reportResultRepository.count(ReportType.SIGNOFF_HISTORY, 7L, "BC-9", from, to)).thenReturn(0L);

        ReportPageResponse<Object> page = service.query(params(ReportType.SIGNOFF_HISTORY)
                .runId(7L).bookingContract("BC-9").from(from).to(to).build());

        assertThat(page.getRows()).isEmpty();
        assertThat(page.getTotalPages()).isZero();
        verify(reportResultRepository, never()).findPage(any(), anyLong(), any(), any(), any(), anyInt(), anyInt());
    }

    @Test
    @DisplayName("Date range on a report without a signoff date is rejected")
    void dateRangeRejectedForNeverSignoff() {
        ReportQueryParams query = params(ReportType.NEVER_SIGNOFF).from(LocalDate.of(2024, 1, 1)).build();

        assertThatThrownBy(() -> service.query(query))
                .isInstanceOf(InvalidReportQueryException.class)
                .hasMessageContaining("never-signoff");
        verifyNoInteractions(reportRunRepository, reportResultRepository);
    }

    @Test
    @DisplayName("from after to is rejected")
    void invertedRangeRejected() {
        ReportQueryParams query = params(ReportType.QUALIFIED_SIGNOFF)
                .from(LocalDate.of(2024, 4, 1)).to(LocalDate.of(2024, 3, 1)).build();

        assertThatThrownBy(() -> service.query(query)).isInstanceOf(InvalidReportQueryException.class);
    }

    @Test
    @DisplayName("Page size above the configured maximum is rejected")
    void oversizedPageRejected() {
        assertThatThrownBy(() -> service.query(params(ReportType.RISK_SIGNOFF).size(101).build()))
                .isInstanceOf(InvalidReportQueryException.class)
                .hasMessageContaining("100");
    }

    @Test
    @DisplayName("No succeeded run yet raises NoSucceededRunException")
    void noSucceededRun() {
        when(reportRunRepository.findLatestSucceeded()).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.query(params(ReportType.RISK_SIGNOFF).build()))
                .isInstanceOf(NoSucceededRunException.class);
    }

    @Test
    @DisplayName("A run that has not succeeded cannot be read")
    void runningRunCannotBeRead() {
        when(reportRunRepository.findById(8L)).thenReturn(Optional.of(run(8L, ReportRun.Status.RUNNING)));

        assertThatThrownBy(() -> service.query(params(ReportType.RISK_SIGNOFF).runId(8L).build()))
                .isInstanceOf(NoSucceededRunException.class)
                .hasMessageContaining("RUNNING");
    }

    @Test
    @DisplayName("Unknown run id raises ReportRunNotFoundException")
    void unknownRun() {
        when(reportRunRepository.findById(404L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.query(params(ReportType.RISK_SIGNOFF).runId(404L).build()))
                .isInstanceOf(ReportRunNotFoundException.class);
    }

    private static ReportQueryParams.ReportQueryParamsBuilder params(ReportType type) {
        return ReportQueryParams.builder().type(type).page(0).size(50);
    }

    private static ReportRun run(long id, ReportRun.Status status) {
        return ReportRun.builder().id(id).asOf(AS_OF).status(status).build();
    }
}
