package me.golemcore.agent.domain.toolcall;

import me.golemcore.agent.domain.model.ToolInvocation;

import java.util.Optional;

/**
 * Detects a tool call in raw model output.
 */
public interface ToolCallExtractor {

    /**
     * @param modelOutput
     *            raw phase-1 output, may be null
     * @return the first structurally valid call, or empty when the output does
     *         not invoke a tool
     */
    Optional<ToolInvocation> extract(String modelOutput);
}
