package com.ekkalavya.artraining.dto;

import com.ekkalavya.artraining.domain.DevicePlatform;
import com.ekkalavya.artraining.domain.Difficulty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreateSessionRequest {

    @NotNull(message = "User ID is required")
    private UUID userId;

    @NotBlank(message = "Sport is required")
    private String sport;

    @NotBlank(message = "Drill pattern is required")
    private String drillPatternId;

    private Difficulty difficulty; // defaults to MEDIUM

    @NotNull(message = "Device platform is required")
    private DevicePlatform platform;
}
