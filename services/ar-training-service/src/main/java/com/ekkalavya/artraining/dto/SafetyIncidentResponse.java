package com.ekkalavya.artraining.dto;

import com.ekkalavya.artraining.domain.SafetyIncident;
import com.ekkalavya.artraining.model.Point3;
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
public class SafetyIncidentResponse {

    private UUID incidentId;
    private UUID sessionId;
    private SafetyIncident.IncidentType incidentType;
    private SafetyIncident.Severity severity;
    private String message;
    private String landmark;
    private Point3 userPosition;
    private String drillPattern;
    private String automaticResponse;
    private boolean sessionPaused;
    private LocalDateTime occurredAt;

    public static SafetyIncidentResponse from(SafetyIncident incident) {
        return SafetyIncidentResponse.builder()
                .incidentId(incident.getId())
                .sessionId(incident.getSessionId())
                .incidentType(incident.getIncidentType())
                .severity(incident.getSeverity())
                .message(incident.getMessage())
                .landmark(incident.getLandmark())
                .userPosition(incident.getUserPosition())
                .drillPattern(incident.getDrillPattern())
                .automaticResponse(incident.getAutomaticResponse())
                .sessionPaused(incident.isSessionPaused())
                .occurredAt(incident.getOccurredAt())
                .build();
    }
}
