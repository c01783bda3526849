package com.ekkalavya.artraining.dto;

import com.ekkalavya.artraining.domain.Difficulty;
import com.ekkalavya.artraining.domain.MetricType;
import com.ekkalavya.artraining.domain.PerformanceMetric;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PerformanceMetricResponse {

    private UUID sessionId;
    private String sport;
    private MetricType metricType;
    private String periodType;
    private double value;
    private Difficulty difficulty;
    private LocalDateTime calculatedAt;

    public static PerformanceMetricResponse from(PerformanceMetric metric) {
        return PerformanceMetricResponse.builder()
                .sessionId(metric.getSessionId())
                .sport(metric.getSport())
                .metricType(metric.getMetricType())
                .periodType(metric.getPeriodType())
                .value(metric.getValue())
                .difficulty(metric.getDifficulty())
                .calculatedAt(metric.getCalculatedAt())
                .build();
    }
}
