package me.golemcore.agent.domain.engine;

/**
 * Result of the single tool invocation a turn may perform, already rendered as
 * the system message injected before phase 2.
 */
public record ToolOutcome(String toolName, boolean success, String contextMessage, String detail) {

    static ToolOutcome success(String toolName, String output) {
        return new ToolOutcome(toolName, true, String.format("Tool (%s) output: %s", toolName, output), output);
    }

    static ToolOutcome failure(String toolName, String error) {
        return new ToolOutcome(toolName, false, String.format("Tool %s failed: %s", toolName, error), error);
    }
}
