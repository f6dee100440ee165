package me.golemcore.agent.domain.toolcall;

import me.golemcore.agent.domain.model.ToolCallFormat;
import me.golemcore.agent.domain.model.ToolInvocation;

import java.util.Optional;

/**
 * Parser for one textual tool-call format.
 */
public interface ToolCallParser {

    ToolCallFormat getFormat();

    Optional<ToolInvocation> parse(String modelOutput);
}
