package com.ekkalavya.artraining.dto;

import com.ekkalavya.artraining.domain.Difficulty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MarkerRequest {

    @NotBlank(message = "Pattern ID is required")
    private String patternId;

    @NotNull(message = "Usable width is required")
    @Positive
    private Double width;

    @NotNull(message = "Usable height is required")
    @Positive
    private Double height;

    @NotBlank(message = "Sport is required")
    private String sport;

    private Difficulty difficulty;

    // canvas size is only used for the optional pixel mapping
    @Positive
    private Integer canvasWidth;

    @Positive
    private Integer canvasHeight;
}
