package com.scanpilot.orchestrator.api;

import com.scanpilot.orchestrator.report.ReportFormat;
import com.scanpilot.orchestrator.report.ReportStore;
import com.scanpilot.orchestrator.report.StoredReport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ReportController.class)
class ReportControllerTest {

    static final String JOB_ID    = "7b0e6a3e-3c1f-4b2a-9d55-0c3f1a2b4c5d";
    static final String REPORT_ID = "report_" + JOB_ID;

    @Autowired MockMvc       mockMvc;
    @MockitoBean ReportStore store;

    @Test
    void list_returnsStoredReports() throws Exception {
        when(store.list()).thenReturn(List.of(report()));

        mockMvc.perform(get("/api/reports"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.reports[0].reportId").value(REPORT_ID))
                .andExpect(jsonPath("$.reports[0].fileName").value(REPORT_ID + ".html"))
                .andExpect(jsonPath("$.reports[0].sizeBytes").value(512));
    }

    @Test
    void get_knownReport_returnsMetadata() throws Exception {
        when(store.find(REPORT_ID)).thenReturn(Optional.of(report()));

        mockMvc.perform(get("/api/reports/" + REPORT_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.report.jobId").value(JOB_ID));
    }

    @Test
    void get_unknownReport_is404() throws Exception {
        when(store.find(REPORT_ID)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/reports/" + REPORT_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"));
    }

    @Test
    void get_malformedId_is400() throws Exception {
        when(store.find("report_nope")).thenThrow(new IllegalArgumentException("Not a report id: report_nope"));

        mockMvc.perform(get("/api/reports/report_nope"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_request"));
    }

    @Test
    void delete_reportsWhetherAnythingWasRemoved() throws Exception {
        when(store.delete(REPORT_ID)).thenReturn(true);

        mockMvc.perform(delete("/api/reports/" + REPORT_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Report deleted"));

        when(store.delete(REPORT_ID)).thenReturn(false);

        mockMvc.perform(delete("/api/reports/" + REPORT_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Report not found"));
    }

    private static StoredReport report() {
        return new StoredReport(REPORT_ID, JOB_ID, REPORT_ID + ".html", ReportFormat.HTML, 512L, 1_700_000_000_000L);
    }
}
