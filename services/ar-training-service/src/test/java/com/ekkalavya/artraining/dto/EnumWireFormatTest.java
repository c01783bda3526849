package com.ekkalavya.artraining.dto;

import com.ekkalavya.artraining.domain.DevicePlatform;
import com.ekkalavya.artraining.domain.Difficulty;
import com.ekkalavya.artraining.domain.LightingCondition;
import com.ekkalavya.artraining.domain.MetricType;
import com.ekkalavya.artraining.domain.SafetyIncident;
import com.ekkalavya.artraining.domain.SessionStatus;
import com.ekkalavya.artraining.domain.SessionTrigger;
import com.ekkalavya.artraining.exception.TrainingValidationException;
import com.ekkalavya.artraining.model.PlaneScan;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Enum wire format Tests")
class EnumWireFormatTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Nested
    @DisplayName("Reading request bodies")
    class Reading {

        @Test
        void shouldReadLowerCaseSessionRequest() throws Exception {
            CreateSessionRequest request = objectMapper.readValue("""
                    {"userId": "6f1c1c1e-8f8a-4a55-9d57-0d7a4b0f5a10", "sport": "tennis",
                     "drillPatternId": "tennis_baseline", "difficulty": "expert", "platform": "web"}
                    """, CreateSessionRequest.class);

            assertThat(request.getDifficulty()).isEqualTo(Difficulty.EXPERT);
            assertThat(request.getPlatform()).isEqualTo(DevicePlatform.WEB);
        }

        @Test
        void shouldReadLowerCaseIncidentRequest() throws Exception {
            SafetyIncidentRequest request = objectMapper.readValue("""
                    {"incidentType": "boundary_violation", "severity": "critical", "message": "left wall"}
                    """, SafetyIncidentRequest.class);

            assertThat(request.getIncidentType()).isEqualTo(SafetyIncident.IncidentType.BOUNDARY_VIOLATION);
            assertThat(request.getSeverity()).isEqualTo(SafetyIncident.Severity.CRITICAL);
        }

        @Test
        void shouldReadSafetyPauseTrigger() throws Exception {
            TransitionRequest request = objectMapper.readValue(
                    "{\"trigger\": \"safety_pause\", \"cause\": \"collision risk\"}", TransitionRequest.class);

            assertThat(request.getTrigger()).isEqualTo(SessionTrigger.SAFETY_PAUSE);
        }

        @Test
        void shouldReadLowerCaseLighting() throws Exception {
            PlaneScan scan = objectMapper.readValue(
                    "{\"width\": 3.0, \"height\": 4.0, \"lighting\": \"moderate\"}", PlaneScan.class);

            assertThat(scan.getLighting()).isEqualTo(LightingCondition.MODERATE);
        }

        @Test
        @DisplayName("Upper-case constant names are still accepted")
        void shouldAcceptConstantNames() throws Exception {
            TransitionRequest request = objectMapper.readValue("{\"trigger\": \"END\"}", TransitionRequest.class);

            assertThat(request.getTrigger()).isEqualTo(SessionTrigger.END);
        }

        @Test
        @DisplayName("Unknown enum values are rejected")
        void shouldRejectUnknownValue() {
            assertThatThrownBy(() -> objectMapper.readValue(
                    "{\"incidentType\": \"meteor_strike\", \"severity\": \"info\"}", SafetyIncidentRequest.class))
                    .isInstanceOf(JsonMappingException.class)
                    .hasRootCauseInstanceOf(TrainingValidationException.class);
        }
    }

    @Nested
    @DisplayName("Writing responses")
    class Writing {

        @Test
        void shouldWriteLowerCaseValues() throws Exception {
            CreateSessionRequest request = CreateSessionRequest.builder()
                    .userId(UUID.randomUUID())
                    .sport("tennis")
                    .drillPatternId("tennis_baseline")
                    .difficulty(Difficulty.HARD)
                    .platform(DevicePlatform.IOS)
                    .build();

            String json = objectMapper.writeValueAsString(request);

            assertThat(json).contains("\"difficulty\":\"hard\"").contains("\"platform\":\"ios\"");
        }

        @Test
        void shouldWriteStatusAndMetricTypeInLowerCase() throws Exception {
            assertThat(objectMapper.writeValueAsString(SessionStatus.COMPLETED)).isEqualTo("\"completed\"");
            assertThat(objectMapper.writeValueAsString(MetricType.ACCURACY)).isEqualTo("\"accuracy\"");
            assertThat(objectMapper.writeValueAsString(SafetyIncident.IncidentType.POSE_UNSAFE))
                    .isEqualTo("\"pose_unsafe\"");
        }
    }
}
