package com.ekkalavya.artraining.dto;

import com.ekkalavya.artraining.domain.SafetyIncident;
import com.ekkalavya.artraining.model.Point3;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Incident detected on the client and reported for the session's safety log.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SafetyIncidentRequest {

    @NotNull(message = "Incident type is required")
    private SafetyIncident.IncidentType incidentType;

    @NotNull(message = "Severity is required")
    private SafetyIncident.Severity severity;

    @Size(max = 500)
    private String message;

    private Point3 userPosition;

    private String automaticResponse;
}
