package com.scanpilot.orchestrator.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Lists, looks up and deletes the report files {@link FileReportAssembler}
 * writes. Files in the directory that do not follow the
 * {@code report_<jobId>.<ext>} naming are ignored.
 */
@Component
public class ReportStore {

    private static final Logger log = LoggerFactory.getLogger(ReportStore.class);

    private static final String  UUID_RE   = "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}";
    private static final Pattern REPORT_ID = Pattern.compile("report_(" + UUID_RE + ")");
    private static final Pattern FILE_NAME = Pattern.compile("report_(" + UUID_RE + ")\\.([a-z]+)");

    private final ReportProperties props;

    public ReportStore(ReportProperties props) {
        this.props = props;
    }

    /** Every stored report file, newest first. */
    public List<StoredReport> list() {
        Path dir = directory();
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<StoredReport> reports = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(Files::isRegularFile).forEach(f -> describe(f).ifPresent(reports::add));
        } catch (IOException e) {
            throw new ReportAssemblyException("Cannot list reports in " + dir, e);
        }
        reports.sort(Comparator.comparingLong(StoredReport::createdAt).reversed());
        return reports;
    }

    /**
     * The newest file stored under {@code reportId}, in any format.
     *
     * @throws IllegalArgumentException if {@code reportId} is not a report id
     */
    public Optional<StoredReport> find(String reportId) {
        requireReportId(reportId);
        return list().stream().filter(r -> r.reportId().equals(reportId)).findFirst();
    }

    /**
     * Delete every format stored under {@code reportId}.
     *
     * @return false if there was nothing to delete
     * @throws IllegalArgumentException if {@code reportId} is not a report id
     */
    public boolean delete(String reportId) {
        requireReportId(reportId);
        int removed = 0;
        for (StoredReport r : list()) {
            if (!r.reportId().equals(reportId)) {
                continue;
            }
            try {
                if (Files.deleteIfExists(directory().resolve(r.fileName()))) {
                    removed++;
                }
            } catch (IOException e) {
                throw new ReportAssemblyException("Cannot delete report " + r.fileName(), e);
            }
        }
        if (removed > 0) {
            log.info("Deleted report {} ({} file(s))", reportId, removed);
        }
        return removed > 0;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Path directory() {
        return Paths.get(props.getDirectory()).toAbsolutePath().normalize();
    }

    private static void requireReportId(String reportId) {
        if (reportId == null || !REPORT_ID.matcher(reportId).matches()) {
            throw new IllegalArgumentException("Not a report id: " + reportId);
        }
    }

    private static Optional<StoredReport> describe(Path file) {
        String name = file.getFileName().toString();
        Matcher m = FILE_NAME.matcher(name);
        if (!m.matches()) {
            return Optional.empty();
        }
        ReportFormat format;
        try {
            format = ReportFormat.valueOf(m.group(2).toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        try {
            return Optional.of(new StoredReport("report_" + m.group(1), m.group(1), name, format,
                    Files.size(file), Files.getLastModifiedTime(file).toMillis()));
        } catch (IOException e) {
            // Deleted between listing and stat.
            log.debug("Skipping report file {}: {}", name, e.getMessage());
            return Optional.empty();
        }
    }
}
