package me.golemcore.agent.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationSummaryDto {
    private String id;
    private String title;
    private String createdAt;
    private String updatedAt;
    private int messageCount;
}
