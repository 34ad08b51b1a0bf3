package com.scanpilot.orchestrator.tool.parser;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the port table and the "OS details" line from nmap's normal output.
 *
 * <pre>
 * 22/tcp   open  ssh     OpenSSH 8.9p1 Ubuntu
 * 80/tcp   open  http    nginx 1.18.0
 * OS details: Linux 5.0 - 5.14
 * </pre>
 */
@Component
public class NmapOutputParser implements ToolOutputParser<NmapOutputParser.NmapReport> {

    private static final Pattern PORT_LINE = Pattern.compile(
            "^(\\d+)/(tcp|udp)\\s+(open|closed|filtered)\\s+(\\S+)(?:\\s+(.+?))?\\s*$",
            Pattern.MULTILINE);

    private static final Pattern OS_LINE = Pattern.compile("^OS details:\\s+(.+)$", Pattern.MULTILINE);

    public record Port(int port, String protocol, String state, String service, String version) {}

    public record NmapReport(List<Port> ports, String os) {

        public List<Port> openPorts() {
            return ports.stream().filter(p -> "open".equals(p.state())).toList();
        }
    }

    @Override
    public String toolName() {
        return "nmap";
    }

    @Override
    public NmapReport parse(String output) {
        List<Port> ports = new ArrayList<>();
        Matcher m = PORT_LINE.matcher(output);
        while (m.find()) {
            ports.add(new Port(Integer.parseInt(m.group(1)), m.group(2), m.group(3), m.group(4), m.group(5)));
        }
        Matcher os = OS_LINE.matcher(output);
        return new NmapReport(List.copyOf(ports), os.find() ? os.group(1).trim() : null);
    }
}
