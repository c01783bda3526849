package com.ekkalavya.artraining.dto;

import com.ekkalavya.artraining.domain.SessionTrigger;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TransitionRequest {

    @NotNull(message = "Trigger is required")
    private SessionTrigger trigger;

    @Size(max = 500)
    private String cause;
}
