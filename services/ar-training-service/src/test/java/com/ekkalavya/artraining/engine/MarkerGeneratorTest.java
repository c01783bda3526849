package com.ekkalavya.artraining.engine;

import com.ekkalavya.artraining.domain.DrillPattern;
import com.ekkalavya.artraining.exception.TrainingValidationException;
import com.ekkalavya.artraining.model.MarkerSet;
import com.ekkalavya.artraining.model.TargetMarker;
import com.ekkalavya.artraining.model.UsableArea;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static com.ekkalavya.artraining.TrainingFixtures.properties;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("MarkerGenerator Tests")
class MarkerGeneratorTest {

    private static final double MARGIN = 0.3;

    private final MarkerGenerator generator = new MarkerGenerator(properties());

    private static List<UsableArea> areasFor(DrillPattern pattern) {
        double side = Math.sqrt(pattern.getMinArea()) + 0.001;
        return List.of(
                new UsableArea(side, side),
                new UsableArea(pattern.getMinArea() / 0.7 + 0.01, 0.7),
                new UsableArea(0.7, pattern.getMinArea() / 0.7 + 0.01),
                new UsableArea(10.0, 8.0));
    }

    @Nested
    @DisplayName("Containment")
    class ContainmentTests {

        @ParameterizedTest
        @EnumSource(DrillPattern.class)
        @DisplayName("Every marker stays strictly inside the safety margin")
        void shouldKeepMarkersInsideMargin(DrillPattern pattern) {
            for (UsableArea area : areasFor(pattern)) {
                MarkerSet set = generator.generate(pattern, area, 200.0, null, null);

                assertThat(set.getMarkers()).isNotEmpty();
                assertThat(set.getMarkers()).allSatisfy(marker -> {
                    assertThat(marker.getX()).isGreaterThan(MARGIN).isLessThan(area.getWidth() - MARGIN);
                    assertThat(marker.getY()).isGreaterThan(MARGIN).isLessThan(area.getHeight() - MARGIN);
                    assertThat(marker.getNormalizedX()).isBetween(0.0, 1.0);
                    assertThat(marker.getNormalizedY()).isBetween(0.0, 1.0);
                });
            }
        }

        @ParameterizedTest
        @EnumSource(DrillPattern.class)
        @DisplayName("Layouts are deterministic")
        void shouldBeDeterministic(DrillPattern pattern) {
            UsableArea area = new UsableArea(5.0, 4.0);

            MarkerSet first = generator.generate(pattern, area, 100.0, 800, 600);
            MarkerSet second = generator.generate(pattern, area, 100.0, 800, 600);

            assertThat(second).isEqualTo(first);
        }
    }

    @Nested
    @DisplayName("Layouts")
    class LayoutTests {

        @Test
        @DisplayName("Dribble box places corners, edge midpoints and centre")
        void shouldLayOutDribbleBox() {
            MarkerSet set = generator.generate(DrillPattern.DRIBBLE_BOX, new UsableArea(3.0, 2.0), 200.0, null, null);

            List<TargetMarker> markers = set.getMarkers();
            assertThat(markers).hasSize(9);
            assertThat(markers.get(0).getX()).isCloseTo(0.3 + 0.1 * 2.4, within(1e-9));
            assertThat(markers.get(0).getY()).isCloseTo(0.3 + 0.1 * 1.4, within(1e-9));
            assertThat(markers.get(8).getX()).isCloseTo(1.5, within(1e-9));
            assertThat(markers.get(8).getY()).isCloseTo(1.0, within(1e-9));
            assertThat(markers).extracting(TargetMarker::getId).startsWith("dribble_box_0");
            assertThat(markers).allSatisfy(m -> assertThat(m.getToleranceRadiusMm()).isEqualTo(200.0));
        }

        @Test
        @DisplayName("Ladder runs along the longer axis")
        void shouldOrientLadderAlongLongAxis() {
            MarkerSet wide = generator.generate(DrillPattern.MICRO_LADDER, new UsableArea(4.0, 1.5), 200.0, null, null);
            MarkerSet tall = generator.generate(DrillPattern.MICRO_LADDER, new UsableArea(1.5, 4.0), 200.0, null, null);

            assertThat(wide.getMarkers()).hasSize(12);
            double wideSpreadX = wide.getMarkers().get(11).getX() - wide.getMarkers().get(0).getX();
            double tallSpreadY = tall.getMarkers().get(11).getY() - tall.getMarkers().get(0).getY();
            assertThat(wideSpreadX).isGreaterThan(2.0);
            assertThat(tallSpreadY).isGreaterThan(2.0);
        }

        @Test
        @DisplayName("Pixel coordinates follow the canvas when given")
        void shouldMapToCanvas() {
            MarkerSet set = generator.generate(DrillPattern.DRIBBLE_BOX, new UsableArea(3.0, 2.0), 200.0, 600, 400);

            TargetMarker centre = set.getMarkers().get(8);
            assertThat(centre.getPixelX()).isCloseTo(300.0, within(1e-9));
            assertThat(centre.getPixelY()).isCloseTo(200.0, within(1e-9));
        }

        @Test
        void shouldOmitPixelsWithoutCanvas() {
            MarkerSet set = generator.generate(DrillPattern.GRID, new UsableArea(4.0, 3.0), 200.0, null, null);

            assertThat(set.getMarkers()).hasSize(12);
            assertThat(set.getMarkers()).allSatisfy(m -> assertThat(m.getPixelX()).isNull());
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Area below the pattern minimum is rejected")
        void shouldRejectUndersizedArea() {
            assertThatThrownBy(() -> generator.generate(DrillPattern.DRIBBLE_BOX, new UsableArea(2.0, 1.5), 200.0, null, null))
                    .isInstanceOf(TrainingValidationException.class)
                    .hasMessageContaining("dribble_box");
        }

        @Test
        @DisplayName("A side no wider than twice the margin is rejected")
        void shouldRejectAreaInsideMargin() {
            assertThatThrownBy(() -> generator.generate(DrillPattern.SEATED_CONTROL, new UsableArea(10.0, 0.6), 200.0, null, null))
                    .isInstanceOf(TrainingValidationException.class)
                    .hasMessageContaining("safety margin");
        }

        @Test
        void shouldRejectHalfCanvas() {
            assertThatThrownBy(() -> generator.generate(DrillPattern.GRID, new UsableArea(4.0, 3.0), 200.0, 800, null))
                    .isInstanceOf(TrainingValidationException.class);
        }
    }
}
