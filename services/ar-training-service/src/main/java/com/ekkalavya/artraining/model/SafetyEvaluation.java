package com.ekkalavya.artraining.model;

import com.ekkalavya.artraining.domain.SafetyIncident;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SafetyEvaluation {
    private boolean safe;
    @Builder.Default
    private List<String> warnings = new ArrayList<>();
    @Builder.Default
    private List<SafetyIncident> incidents = new ArrayList<>();
    private boolean pauseRequired;
}
