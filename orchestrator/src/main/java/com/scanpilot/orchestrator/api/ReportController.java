package com.scanpilot.orchestrator.api;

import com.scanpilot.orchestrator.api.dto.ControlResponse;
import com.scanpilot.orchestrator.report.ReportNotFoundException;
import com.scanpilot.orchestrator.report.ReportStore;
import com.scanpilot.orchestrator.report.StoredReport;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Report archive: the files written when jobs complete or a report is
 * requested.
 *
 * GET    /api/reports
 * GET    /api/reports/{reportId}   metadata of the newest file for that id
 * DELETE /api/reports/{reportId}   every format stored for that id
 */
@RestController
@RequestMapping("/api/reports")
public class ReportController {

    private final ReportStore store;

    public ReportController(ReportStore store) {
        this.store = store;
    }

    @GetMapping
    public Map<String, Object> list() {
        List<StoredReport> reports = store.list();
        return Map.of("success", true, "reports", reports);
    }

    @GetMapping("/{reportId}")
    public Map<String, Object> get(@PathVariable String reportId) {
        StoredReport report = store.find(reportId)
                .orElseThrow(() -> new ReportNotFoundException(reportId));
        return Map.of("success", true, "report", report);
    }

    @DeleteMapping("/{reportId}")
    public ControlResponse delete(@PathVariable String reportId) {
        return ControlResponse.of(store.delete(reportId), "Report deleted", "Report not found");
    }
}
