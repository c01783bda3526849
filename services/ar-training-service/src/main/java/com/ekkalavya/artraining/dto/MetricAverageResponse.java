package com.ekkalavya.artraining.dto;

import com.ekkalavya.artraining.domain.MetricType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MetricAverageResponse {
    private UUID userId;
    private String sport;
    private MetricType metricType;
    private double average; // 0.0 when nothing has been recorded
}
