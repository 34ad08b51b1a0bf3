package com.scanpilot.orchestrator.tool.parser;

import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects the paths dirb discovered.
 *
 * <pre>
 * + http://host/admin.php (CODE:200|SIZE:1234)
 * ==> DIRECTORY: http://host/images/
 * </pre>
 */
@Component
public class DirbOutputParser implements ToolOutputParser<DirbOutputParser.DirbReport> {

    private static final Pattern HIT = Pattern.compile(
            "^\\+\\s+(https?://\\S+)\\s+\\((.+?)\\)\\s*$", Pattern.MULTILINE);
    private static final Pattern DIRECTORY = Pattern.compile(
            "^==> DIRECTORY:\\s+(https?://\\S+)\\s*$", Pattern.MULTILINE);

    public record Entry(String path, String status) {}

    public record DirbReport(List<Entry> directories, List<Entry> files) {

        public int totalFound() {
            return directories.size() + files.size();
        }
    }

    @Override
    public String toolName() {
        return "dirb";
    }

    @Override
    public DirbReport parse(String output) {
        List<Entry> directories = new ArrayList<>();
        List<Entry> files       = new ArrayList<>();

        Matcher hit = HIT.matcher(output);
        while (hit.find()) {
            Entry e = new Entry(pathOf(hit.group(1)), hit.group(2));
            (e.path().endsWith("/") ? directories : files).add(e);
        }
        Matcher dir = DIRECTORY.matcher(output);
        while (dir.find()) {
            directories.add(new Entry(pathOf(dir.group(1)), "DIRECTORY"));
        }
        return new DirbReport(List.copyOf(directories), List.copyOf(files));
    }

    private static String pathOf(String url) {
        String path = URI.create(url).getRawPath();
        return path == null || path.isEmpty() ? "/" : path;
    }
}
