package me.golemcore.agent.domain.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.domain.service.CapabilityRegistry;
import me.golemcore.agent.domain.service.PromptBuilder;
import me.golemcore.agent.domain.toolcall.ToolCallExtractor;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.ConversationMemoryPort;
import me.golemcore.agent.port.outbound.LlmPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class EngineConfiguration {

    @Bean
    public AgentEngine agentEngine(ConversationMemoryPort memory, ToolCallExtractor toolCallExtractor,
            PromptBuilder promptBuilder, ObjectMapper objectMapper, Clock clock, AgentProperties properties,
            LlmPort llmPort, CapabilityRegistry capabilityRegistry) {
        DefaultAgentEngine engine = new DefaultAgentEngine(memory, toolCallExtractor, promptBuilder, objectMapper,
                clock, properties);
        engine.initialize(llmPort, capabilityRegistry);
        return engine;
    }
}
