package com.scanpilot.orchestrator.tool.parser;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the server banner and the reported items from nikto's text output.
 * Scan metadata lines (target, times, counters) are not items.
 */
@Component
public class NiktoOutputParser implements ToolOutputParser<NiktoOutputParser.NiktoReport> {

    private static final Pattern SERVER = Pattern.compile("^\\+ Server:\\s+(.+)$", Pattern.MULTILINE);
    private static final Pattern ITEM   = Pattern.compile("^\\+\\s+(.+?):\\s+(.+)$", Pattern.MULTILINE);

    private static final Set<String> METADATA_KEYS = Set.of(
            "Server", "Target IP", "Target Hostname", "Target Port",
            "Start Time", "End Time", "SSL Info");

    public record Item(String category, String description) {}

    public record NiktoReport(String server, List<Item> items) {}

    @Override
    public String toolName() {
        return "nikto";
    }

    @Override
    public NiktoReport parse(String output) {
        Matcher server = SERVER.matcher(output);
        String banner = server.find() ? server.group(1).trim() : null;

        List<Item> items = new ArrayList<>();
        Matcher m = ITEM.matcher(output);
        while (m.find()) {
            String category = m.group(1).trim();
            if (!METADATA_KEYS.contains(category)) {
                items.add(new Item(category, m.group(2).trim()));
            }
        }
        return new NiktoReport(banner, List.copyOf(items));
    }
}
