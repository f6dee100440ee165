package me.golemcore.agent.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of the {@code meta} SSE frame.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetaEventPayload {
    @JsonProperty("conversation_id")
    private String conversationId;
    @JsonProperty("agent_conversation_id")
    private String agentConversationId;
}
