package me.golemcore.agent.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {
    @JsonProperty("conversation_id")
    private String conversationId;
    @JsonProperty("agent_conversation_id")
    private String agentConversationId;
    private MessageDto message;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MessageDto {
        private String role;
        private String content;
    }
}
