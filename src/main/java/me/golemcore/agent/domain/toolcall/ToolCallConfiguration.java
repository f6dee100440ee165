package me.golemcore.agent.domain.toolcall;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/** Spring wiring for tool-call extraction (priority: structured, fenced, legacy marker). */
@Configuration
public class ToolCallConfiguration {

    @Bean
    public ToolParameterParser toolParameterParser(ObjectMapper objectMapper) {
        return new ToolParameterParser(objectMapper);
    }

    @Bean
    public ToolCallExtractor toolCallExtractor(ToolParameterParser parameterParser, AgentProperties properties) {
        return new DefaultToolCallExtractor(List.of(
                new StructuredToolCallParser(parameterParser),
                new FencedToolCallParser(parameterParser),
                new LegacyMarkerToolCallParser(properties.getToolCall().getLegacyMarker(), parameterParser)));
    }
}
