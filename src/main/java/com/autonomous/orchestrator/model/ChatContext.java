package com.autonomous.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatContext {
    private String platform;    // slack | telegram | discord
    private String channelId;
    private String threadTs;
    private String userId;
}
