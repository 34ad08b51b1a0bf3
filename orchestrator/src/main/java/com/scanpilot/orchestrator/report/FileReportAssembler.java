package com.scanpilot.orchestrator.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scanpilot.orchestrator.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;

import static org.springframework.web.util.HtmlUtils.htmlEscape;

/**
 * Writes reports to {@code scanpilot.reports.directory} as
 * {@code report_<jobId>.<ext>}. Regenerating a report overwrites the file.
 */
@Component
public class FileReportAssembler implements ReportAssembler {

    private static final Logger log = LoggerFactory.getLogger(FileReportAssembler.class);

    private final ObjectMapper     mapper;
    private final ReportProperties props;

    public FileReportAssembler(ObjectMapper mapper, ReportProperties props) {
        this.mapper = mapper;
        this.props  = props;
    }

    @Override
    public ReportArtifact assemble(ReportDocument document, ReportFormat format) {
        String content = switch (format) {
            case JSON -> json(document);
            case HTML -> html(document);
            case PDF  -> throw new UnsupportedReportFormatException(format);
        };

        String reportId = "report_" + document.taskInfo().jobId();
        Path dir  = Paths.get(props.getDirectory()).toAbsolutePath().normalize();
        Path file = dir.resolve(reportId + "." + format.extension());
        try {
            Files.createDirectories(dir);
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ReportAssemblyException("Cannot write report " + file, e);
        }
        log.info("Wrote {} report {} ({} findings)", format.extension(), file, document.findings().size());
        return new ReportArtifact(reportId, format, file.toString(), System.currentTimeMillis());
    }

    // ------------------------------------------------------------------
    // Renderers
    // ------------------------------------------------------------------

    private String json(ReportDocument document) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new ReportAssemblyException("Cannot serialise report for job " + document.taskInfo().jobId(), e);
        }
    }

    static String html(ReportDocument document) {
        ReportDocument.TaskInfo task = document.taskInfo();
        ReportDocument.Summary  sum  = document.summary();

        StringBuilder sb = new StringBuilder();
        sb.append("<!DOCTYPE html>\n<html lang=\"en\">\n<head>\n<meta charset=\"UTF-8\">\n")
          .append("<title>Security assessment: ").append(htmlEscape(nullToEmpty(task.name()))).append("</title>\n")
          .append("</head>\n<body>\n")
          .append("<h1>").append(htmlEscape(nullToEmpty(task.name()))).append("</h1>\n")
          .append("<p>Target: ").append(htmlEscape(nullToEmpty(task.target())))
          .append(" | Status: ").append(htmlEscape(nullToEmpty(task.status())))
          .append(" | Generated: ").append(Instant.ofEpochMilli(document.metadata().generatedAt()))
          .append("</p>\n")
          .append("<table class=\"summary\">\n<tr><th>Total</th><th>Critical</th><th>High</th>")
          .append("<th>Medium</th><th>Low</th><th>Info</th><th>Verified</th></tr>\n<tr>")
          .append(td(sum.total())).append(td(sum.critical())).append(td(sum.high()))
          .append(td(sum.medium())).append(td(sum.low())).append(td(sum.info())).append(td(sum.verified()))
          .append("</tr>\n</table>\n");

        sb.append("<h2>Findings</h2>\n");
        if (document.findings().isEmpty()) {
            sb.append("<p>No findings.</p>\n");
        }
        for (Finding f : document.findings()) {
            sb.append("<div class=\"finding ").append(f.severity().name().toLowerCase()).append("\">\n")
              .append("<h3>").append(htmlEscape(nullToEmpty(f.title()))).append("</h3>\n")
              .append("<p>Severity: ").append(f.severity())
              .append(" | Component: ").append(htmlEscape(nullToEmpty(f.component())))
              .append(" | Verified: ").append(f.verified() ? "yes" : "no").append("</p>\n")
              .append("<p>").append(htmlEscape(nullToEmpty(f.description()))).append("</p>\n")
              .append("</div>\n");
        }
        sb.append("</body>\n</html>\n");
        return sb.toString();
    }

    private static String td(int n) {
        return "<td>" + n + "</td>";
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
