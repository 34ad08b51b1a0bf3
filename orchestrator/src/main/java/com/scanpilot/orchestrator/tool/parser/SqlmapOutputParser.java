package com.scanpilot.orchestrator.tool.parser;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts injectable parameters and enumerated databases from sqlmap output.
 *
 * Parameters are only reported when sqlmap also printed "is vulnerable"
 * somewhere; the "Parameter:" heading alone appears in negative runs too.
 */
@Component
public class SqlmapOutputParser implements ToolOutputParser<SqlmapOutputParser.SqlmapReport> {

    private static final Pattern PARAMETER = Pattern.compile("Parameter:\\s+(\\S+)\\s+\\(([^)]+)\\)");
    private static final Pattern DATABASE  = Pattern.compile("^\\[\\*\\]\\s+(\\S+)\\s*$");

    public record InjectableParameter(String parameter, String place) {}

    public record SqlmapReport(List<InjectableParameter> parameters, List<String> databases) {

        public boolean vulnerable() {
            return !parameters.isEmpty();
        }
    }

    @Override
    public String toolName() {
        return "sqlmap";
    }

    @Override
    public SqlmapReport parse(String output) {
        List<InjectableParameter> params = new ArrayList<>();
        if (output.contains("Parameter:") && output.contains("is vulnerable")) {
            Matcher m = PARAMETER.matcher(output);
            while (m.find()) {
                InjectableParameter p = new InjectableParameter(m.group(1), m.group(2));
                if (!params.contains(p)) {
                    params.add(p);
                }
            }
        }
        return new SqlmapReport(List.copyOf(params), databases(output));
    }

    // "available databases [2]:" followed by "[*] name" lines up to the next blank line.
    private static List<String> databases(String output) {
        List<String> dbs = new ArrayList<>();
        boolean inList = false;
        for (String line : output.split("\\R")) {
            if (line.startsWith("available databases")) {
                inList = true;
                continue;
            }
            if (inList) {
                Matcher m = DATABASE.matcher(line.trim());
                if (m.matches()) {
                    dbs.add(m.group(1));
                } else if (line.isBlank()) {
                    inList = false;
                }
            }
        }
        return List.copyOf(dbs);
    }
}
