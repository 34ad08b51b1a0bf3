package com.scanpilot.orchestrator.tool.parser;

/**
 * Turns a tool's raw stdout into a typed result.
 *
 * Implementations are Spring beans and are picked up automatically by
 * {@link com.scanpilot.orchestrator.tool.ToolInvocationService}.
 * A parser may throw on malformed output; the caller then keeps the raw
 * text only.
 *
 * @param <T> the structured result type
 */
public interface ToolOutputParser<T> {

    /** Registry name of the tool whose output this parser understands. */
    String toolName();

    T parse(String output);
}
