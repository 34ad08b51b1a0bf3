package com.scanpilot.orchestrator.sandbox;

import java.util.List;
import java.util.Locale;

/**
 * Languages the sandbox can run, with the file extension, the runtime key
 * looked up in {@code scanpilot.sandbox.runtimes} and the stdout tokens that
 * count as a positive verification.
 */
public enum SandboxLanguage {

    PYTHON("python", "py", true,
            List.of("漏洞可能存在", "vulnerable", "VULNERABILITY", "检测到", "发现", "[+]")),
    JAVASCRIPT("javascript", "js", true,
            List.of("vulnerability", "VULNERABILITY", "漏洞", "检测到", "发现", "[!]")),
    SHELL("shell", "sh", false,
            List.of("VULNERABLE", "vulnerable", "漏洞", "成功", "detected"));

    private final String       runtimeKey;
    private final String       extension;
    private final boolean      positionalArgs;
    private final List<String> indicators;

    SandboxLanguage(String runtimeKey, String extension, boolean positionalArgs, List<String> indicators) {
        this.runtimeKey     = runtimeKey;
        this.extension      = extension;
        this.positionalArgs = positionalArgs;
        this.indicators     = indicators;
    }

    public String       runtimeKey()     { return runtimeKey; }
    public String       extension()      { return extension; }
    /** True if target and parameters are passed on the command line; shell gets TARGET_URL instead. */
    public boolean      positionalArgs() { return positionalArgs; }
    public List<String> indicators()     { return indicators; }

    /**
     * @throws UnsupportedLanguageException for anything but python, javascript, bash or shell
     */
    public static SandboxLanguage fromWire(String language) {
        if (language == null) {
            throw new UnsupportedLanguageException(null);
        }
        return switch (language.trim().toLowerCase(Locale.ROOT)) {
            case "python"        -> PYTHON;
            case "javascript"    -> JAVASCRIPT;
            case "bash", "shell" -> SHELL;
            default -> throw new UnsupportedLanguageException(language);
        };
    }
}
