package com.ekkalavya.artraining.config;

import com.ekkalavya.artraining.domain.MetricType;
import com.ekkalavya.artraining.domain.SafetyIncident;
import com.ekkalavya.artraining.exception.TrainingValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.convert.ConversionFailedException;
import org.springframework.format.support.DefaultFormattingConversionService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Web MVC parameter binding Tests")
class WebMvcConfigTest {

    private DefaultFormattingConversionService conversionService;

    @BeforeEach
    void setUp() {
        conversionService = new DefaultFormattingConversionService();
        new WebMvcConfig().addFormatters(conversionService);
    }

    @Test
    @DisplayName("Query parameters bind by lower-case wire name")
    void shouldConvertWireName() {
        assertThat(conversionService.convert("accuracy", MetricType.class)).isEqualTo(MetricType.ACCURACY);
        assertThat(conversionService.convert("tracking_lost", SafetyIncident.IncidentType.class))
                .isEqualTo(SafetyIncident.IncidentType.TRACKING_LOST);
    }

    @Test
    void shouldStillConvertConstantName() {
        assertThat(conversionService.convert("PACE", MetricType.class)).isEqualTo(MetricType.PACE);
    }

    @Test
    void shouldRejectUnknownValue() {
        assertThatThrownBy(() -> conversionService.convert("speed", MetricType.class))
                .isInstanceOf(ConversionFailedException.class)
                .hasCauseInstanceOf(TrainingValidationException.class);
    }
}
