package com.ekkalavya.artraining.dto;

import com.ekkalavya.artraining.domain.SyncPlatform;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SyncStatusResponse {
    private TrainingSessionResponse session;
    private SyncPlatform lastReportingPlatform;
    private RoomConstraintsResponse roomConstraints;
    private List<SafetyIncidentResponse> safetyIncidents;
    private List<PerformanceMetricResponse> performanceMetrics;
}
