package com.inboxflow.dto;

import lombok.*;

import java.util.Map;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class FlowExecutionStatsResponse {
    private long total;
    private Map<String, Long> byStatus;
}
