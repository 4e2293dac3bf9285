package com.baykanat.signoff.api.controller;

import com.baykanat.signoff.api.dto.ReportPageResponse;
import com.baykanat.signoff.api.dto.ReportQueryParams;
import com.baykanat.signoff.config.AppProperties;
import com.baykanat.signoff.domain.exception.InvalidReportQueryException;
import com.baykanat.signoff.domain.exception.NoSucceededRunException;
import com.baykanat.signoff.domain.model.OrgAttribution;
import com.baykanat.signoff.domain.model.ReportType;
import com.baykanat.signoff.domain.model.RiskSignoffRow;
import com.baykanat.signoff.domain.service.ComplianceReportQueryService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/** ComplianceReportController web katmanı testleri: parametre eşleme, satır JSON'u ve hata kodları. */
@WebMvcTest(ComplianceReportController.class)
@Import(AppProperties.class)
class ComplianceReportControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ComplianceReportQueryService queryService;

    @Test
    @DisplayName("GET /reports/risk-signoff - rows use snake_case columns with flattened attribution")
    void riskReportRows() throws Exception {
        RiskSignoffRow row = RiskSignoffRow.builder()
                .bookingContract("BC-R1")
                .attribution(OrgAttribution.NOT_ASSIGNED_ATTRIBUTION)
                .signoffDaysAgo(61)
                .signoffRisk("b_med_risk")
                .build();
        when(queryService.query(any())).thenReturn(ReportPageResponse.<Object>builder()
                .report("risk-signoff")
                .runId(4L)
                .asOf(LocalDateTime.of(2024, 7, 29, 10, 0, 15))
                .page(0)
                .size(50)
                .totalElements(1)
                .totalPages(1)
                .rows(List.of(row))
                .build());

        mockMvc.perform(get("/reports/risk-signoff"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.run_id").value(4))
                .andExpect(jsonPath("$.total_elements").value(1))
                .andExpect(jsonPath("$.rows[0].booking_contract").value("BC-R1"))
                .andExpect(jsonPath("$.rows[0].signoff_days_ago").value(61))
                .andExpect(jsonPath("$.rows[0].signoff_risk").value("b_med_risk"))
                .andExpect(jsonPath("$.rows[0].mgr_name").value("Not Assigned"));
    }

    @Test
    @DisplayName("GET /reports/signoff-history - query parameters are mapped and default page size applied")
    void historyQueryParametersAreMapped() throws Exception {
        when(queryService.query(any())).thenReturn(ReportPageResponse.<Object>builder()
                .report("signoff-history").runId(5L).rows(List.of()).build());

        mockMvc.perform(get("/reports/signoff-history")
                        .param("booking_contract", "BC-9")
                        .param("from", "2024-01-01")
                        .param("to", "2024-03-31")
                        .param("run_id", "5")
                        .param("page", "1"))
                .andExpect(status().isOk());

        ArgumentCaptor<ReportQueryParams> captor = ArgumentCaptor.forClass(ReportQueryParams.class);
        verify(queryService).query(captor.capture());
        ReportQueryParams params = captor.getValue();
        assertThat(params.getType()).isEqualTo(ReportType.SIGNOFF_HISTORY);
        assertThat(params.getBookingContract()).isEqualTo("BC-9");
        assertThat(params.getFrom()).isEqualTo(LocalDate.of(2024, 1, 1));
        assertThat(params.getTo()).isEqualTo(LocalDate.of(2024, 3, 31));
        assertThat(params.getRunId()).isEqualTo(5L);
        assertThat(params.getPage()).isEqualTo(1);
        assertThat(params.getSize()).isEqualTo(50);
    }

    @Test
    @DisplayName("GET /reports/{unknown} - unknown report should return 404")
    void unknownReportReturns404() throws Exception {
        mockMvc.perform(get("/reports/contract-summary"))
                .andExpect(status().isNotFound());
        verifyNoInteractions(queryService);
    }

    @Test
    @DisplayName("GET /reports/never-signoff - date range should return 400")
    void dateRangeOnNeverSignoffReturns400() throws Exception {
        when(queryService.query(any())).thenThrow(new InvalidReportQueryException(
                "Report never-signoff has no signoff date; from/to are not supported"));

        mockMvc.perform(get("/reports/never-signoff").param("from", "2024-01-01"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Report never-signoff has no signoff date; from/to are not supported"));
    }

    @Test
    @DisplayName("GET /reports/qualified-signoff - malformed date should return 400")
    void malformedDateReturns400() throws Exception {
        mockMvc.perform(get("/reports/qualified-signoff").param("to", "March"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(queryService);
    }

    @Test
    @DisplayName("GET /reports/risk-signoff - before the first successful run should return 409")
    void noSucceededRunReturns409() throws Exception {
        when(queryService.query(any())).thenThrow(
                new NoSucceededRunException("No succeeded compliance report run exists yet"));

        mockMvc.perform(get("/reports/risk-signoff"))
                .andExpect(status().isConflict());
    }
}
