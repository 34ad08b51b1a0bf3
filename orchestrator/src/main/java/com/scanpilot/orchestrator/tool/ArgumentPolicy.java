package com.scanpilot.orchestrator.tool;

import java.util.List;
import java.util.regex.Pattern;

/**
 * The argument safety rules applied before any tool is started.
 *
 * <ol>
 *   <li>No argument, and not the target, may contain {@code ; & | ` $}.</li>
 *   <li>An argument starting with {@code -} must start with one of the tool's
 *       allow-listed prefixes.</li>
 *   <li>The target itself must not start with {@code -}, or the tool would
 *       parse it as an option.</li>
 * </ol>
 */
public final class ArgumentPolicy {

    private static final Pattern METACHARACTERS = Pattern.compile("[;&|`$]");

    private ArgumentPolicy() {}

    /** True if {@code target} could be handed to a tool as its final argument. */
    public static boolean isSafeTarget(String target) {
        return target != null && !METACHARACTERS.matcher(target).find() && !target.startsWith("-");
    }

    static void check(ToolInvocationSpec spec, List<String> args, String target) {
        for (String arg : args) {
            if (arg == null) {
                throw new UnsafeArgumentException(spec.name(), "null", "null argument");
            }
            if (METACHARACTERS.matcher(arg).find()) {
                throw new UnsafeArgumentException(spec.name(), arg, "contains a shell metacharacter");
            }
            if (arg.startsWith("-")) {
                String flag = arg.split(" ", 2)[0];
                boolean allowed = spec.allowedArgPrefixes().stream().anyMatch(flag::startsWith);
                if (!allowed) {
                    throw new DisallowedArgumentException(spec.name(), arg);
                }
            }
        }
        if (target != null) {
            if (METACHARACTERS.matcher(target).find()) {
                throw new UnsafeArgumentException(spec.name(), target, "target contains a shell metacharacter");
            }
            if (target.startsWith("-")) {
                throw new UnsafeArgumentException(spec.name(), target, "target looks like an option");
            }
        }
    }
}
