package com.baykanat.signoff.api.controller;

import com.baykanat.signoff.domain.exception.ComplianceRunRejectedException;
import com.baykanat.signoff.domain.exception.ReportRunNotFoundException;
import com.baykanat.signoff.domain.model.ReportRun;
import com.baykanat.signoff.domain.service.ComplianceRunService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/** ComplianceRunController web katmanı testleri; koşu servisi mock'lanır. */
@WebMvcTest(ComplianceRunController.class)
class ComplianceRunControllerTest {

    private static final LocalDateTime AS_OF = LocalDateTime.of(2024, 7, 29, 10, 0, 15);

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ComplianceRunService complianceRunService;

    @Test
    @DisplayName("POST /compliance/runs - explicit as_of is passed through and 202 is returned with Location")
    void startRunWithAsOf() throws Exception {
        when(complianceRunService.start(AS_OF)).thenReturn(run(12L, ReportRun.Status.RUNNING));

        mockMvc.perform(post("/compliance/runs").param("as_of", "2024-07-29T10:00:15"))
                .andExpect(status().isAccepted())
                .andExpect(header().string("Location", "/compliance/runs/12"))
                .andExpect(jsonPath("$.run_id").value(12))
                .andExpect(jsonPath("$.status").value("RUNNING"));

        verify(complianceRunService).start(AS_OF);
    }

    @Test
    @DisplayName("POST /compliance/runs - without as_of the service pins now")
    void startRunWithoutAsOf() throws Exception {
        when(complianceRunService.start(null)).thenReturn(run(13L, ReportRun.Status.RUNNING));

        mockMvc.perform(post("/compliance/runs"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.run_id").value(13));
    }

    @Test
    @DisplayName("POST /compliance/runs - unparsable as_of should return 400")
    void invalidAsOfReturns400() throws Exception {
        mockMvc.perform(post("/compliance/runs").param("as_of", "29/07/2024"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid value for parameter: as_of"));
        verifyNoInteractions(complianceRunService);
    }

    @Test
    @DisplayName("POST /compliance/runs - full run queue should return 503 with Retry-After")
    void fullQueueReturns503() throws Exception {
        when(complianceRunService.start(any())).thenThrow(
                new ComplianceRunRejectedException("Too many compliance runs queued, try again later", 60, null));

        mockMvc.perform(post("/compliance/runs"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string("Retry-After", "60"));
    }

    @Test
    @DisplayName("GET /compliance/runs/{id} - finished run returns its counters")
    void getRunReturnsCounters() throws Exception {
        ReportRun run = run(7L, ReportRun.Status.SUCCEEDED);
        run.setRiskRows(3);
        run.setDroppedRows(2);
        when(complianceRunService.getRun(7L)).thenReturn(run);

        mockMvc.perform(get("/compliance/runs/7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SUCCEEDED"))
                .andExpect(jsonPath("$.risk_rows").value(3))
                .andExpect(jsonPath("$.dropped_rows").value(2));
    }

    @Test
    @DisplayName("GET /compliance/runs/{id} - unknown run should return 404")
    void unknownRunReturns404() throws Exception {
        when(complianceRunService.getRun(99L)).thenThrow(new ReportRunNotFoundException(99L));

        mockMvc.perform(get("/compliance/runs/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    @DisplayName("GET /compliance/runs - lists recent runs")
    void listRuns() throws Exception {
        when(complianceRunService.listRuns(2)).thenReturn(List.of(
                run(9L, ReportRun.Status.SUCCEEDED), run(8L, ReportRun.Status.FAILED)));

        mockMvc.perform(get("/compliance/runs").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].run_id").value(9))
                .andExpect(jsonPath("$[1].status").value("FAILED"));
    }

    @Test
    @DisplayName("GET /compliance/runs - limit out of range should return 400")
    void limitOutOfRangeReturns400() throws Exception {
        mockMvc.perform(get("/compliance/runs").param("limit", "0"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(complianceRunService);
    }

    private static ReportRun run(long id, ReportRun.Status status) {
        return ReportRun.builder().id(id).asOf(AS_OF).status(status).build();
    }
}
