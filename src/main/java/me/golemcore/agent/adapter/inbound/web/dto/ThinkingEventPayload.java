package me.golemcore.agent.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of a {@code thinking} SSE frame.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThinkingEventPayload {
    private String type;
    private String message;
}
