package me.golemcore.agent.domain.toolcall;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.ToolInvocation;

import java.util.List;
import java.util.Optional;

/**
 * Tries each format parser in priority order; the first match wins.
 */
@Slf4j
public class DefaultToolCallExtractor implements ToolCallExtractor {

    private final List<ToolCallParser> parsers;

    public DefaultToolCallExtractor(List<ToolCallParser> parsers) {
        this.parsers = List.copyOf(parsers);
    }

    @Override
    public Optional<ToolInvocation> extract(String modelOutput) {
        if (modelOutput == null || modelOutput.isBlank()) {
            return Optional.empty();
        }
        for (ToolCallParser parser : parsers) {
            Optional<ToolInvocation> invocation = parser.parse(modelOutput);
            if (invocation.isPresent()) {
                log.debug("[ToolCall] Detected {} call to '{}'", parser.getFormat(), invocation.get().getToolName());
                return invocation;
            }
        }
        return Optional.empty();
    }
}
