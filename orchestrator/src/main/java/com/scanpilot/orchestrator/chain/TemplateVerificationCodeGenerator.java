package com.scanpilot.orchestrator.chain;

import com.scanpilot.orchestrator.model.Finding;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Fixed python checks for the finding types that can be probed over plain
 * HTTP. Scripts take the target as argv[1] and one finding-specific value as
 * argv[2], and print a {@code [+]} line only on a positive result.
 */
@Component
public class TemplateVerificationCodeGenerator implements VerificationCodeGenerator {

    static final String SQL_INJECTION_CHECK = """
            import sys
            import urllib.error
            import urllib.parse
            import urllib.request

            SIGNATURES = ["sql syntax", "mysql_fetch", "ora-", "sqlite error",
                          "postgresql error", "microsoft ole db provider"]
            PAYLOADS = ["'", "' OR '1'='1", "' OR 1=1--"]

            def fetch(url):
                try:
                    with urllib.request.urlopen(url, timeout=10) as resp:
                        return resp.read().decode("utf-8", "replace")
                except urllib.error.HTTPError as e:
                    return e.read().decode("utf-8", "replace")

            target, param = sys.argv[1], sys.argv[2]
            sep = "&" if "?" in target else "?"
            for payload in PAYLOADS:
                url = target + sep + urllib.parse.urlencode({param: payload})
                print("[*] probing " + param + " with " + payload)
                try:
                    body = fetch(url).lower()
                except Exception as e:
                    print("[-] request failed: " + str(e))
                    continue
                for sig in SIGNATURES:
                    if sig in body:
                        print("[+] database error signature '" + sig + "' returned for " + param)
                        sys.exit(0)
            print("[-] no database error signature observed")
            """;

    static final String EXPOSED_PATH_CHECK = """
            import sys
            import urllib.error
            import urllib.parse
            import urllib.request

            target, path = sys.argv[1], sys.argv[2]
            url = urllib.parse.urljoin(target if target.endswith("/") else target + "/", path.lstrip("/"))
            print("[*] requesting " + url)
            try:
                with urllib.request.urlopen(url, timeout=10) as resp:
                    if resp.status == 200:
                        print("[+] " + url + " is publicly readable")
                    else:
                        print("[-] status " + str(resp.status))
            except urllib.error.HTTPError as e:
                print("[-] status " + str(e.code))
            except Exception as e:
                print("[-] request failed: " + str(e))
            """;

    @Override
    public Optional<GeneratedCode> generate(Finding finding, String target) {
        if (finding.type() == null || finding.component() == null) {
            return Optional.empty();
        }
        return switch (finding.type()) {
            case "sql_injection" -> Optional.of(new GeneratedCode(SQL_INJECTION_CHECK, "python",
                    "Error-based SQL injection probe for " + finding.component(),
                    Map.of("parameter", finding.component())));
            case "exposed_path" -> Optional.of(new GeneratedCode(EXPOSED_PATH_CHECK, "python",
                    "Anonymous read check for " + finding.component(),
                    Map.of("path", finding.component())));
            default -> Optional.empty();
        };
    }
}
