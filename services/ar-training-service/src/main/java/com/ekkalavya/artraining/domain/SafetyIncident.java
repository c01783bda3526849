package com.ekkalavya.artraining.domain;

import com.ekkalavya.artraining.model.Point3;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "ar_safety_incidents", indexes = {
        @Index(name = "idx_safety_incidents_session", columnList = "session_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class SafetyIncident {

    @Id
    @GeneratedValue
    private UUID id;

    @Column(name = "session_id", nullable = false)
    private UUID sessionId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "incident_type", nullable = false, length = 30)
    @Enumerated(EnumType.STRING)
    private IncidentType incidentType;

    @Column(name = "severity", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private Severity severity;

    @Column(name = "message", length = 500)
    private String message;

    @Column(name = "landmark", length = 40)
    private String landmark;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "user_position", columnDefinition = "jsonb")
    private Point3 userPosition;

    @Column(name = "drill_pattern", length = 60)
    private String drillPattern;

    @Column(name = "automatic_response", length = 30)
    private String automaticResponse; // pause, warning, none

    @Column(name = "session_paused", nullable = false)
    private boolean sessionPaused;

    @Column(name = "occurred_at", nullable = false)
    private LocalDateTime occurredAt;

    public enum IncidentType implements WireNamed {
        BOUNDARY_VIOLATION("boundary_violation"),
        COLLISION_RISK("collision_risk"),
        POSE_UNSAFE("pose_unsafe"),
        TRACKING_LOST("tracking_lost");

        private final String wireName;

        IncidentType(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        @Override
        public String getWireName() {
            return wireName;
        }

        @JsonCreator
        public static IncidentType fromWireName(String value) {
            return WireNamed.fromWireName(IncidentType.class, value);
        }
    }

    public enum Severity implements WireNamed {
        INFO("info"),
        WARNING("warning"),
        CRITICAL("critical");

        private final String wireName;

        Severity(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        @Override
        public String getWireName() {
            return wireName;
        }

        @JsonCreator
        public static Severity fromWireName(String value) {
            return WireNamed.fromWireName(Severity.class, value);
        }
    }

    public boolean isCritical() {
        return severity == Severity.CRITICAL;
    }
}
