package com.autonomous.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunRequest {
    private String target;
    private String unit;
    private String branch;          // optional
    private String triggeredBy;
    private ChatContext chatContext;
}
