package org.geoloader.crs;

import org.geoloader.dto.geojson.Bounds;
import org.geoloader.dto.geojson.GeoJsonFeature;
import org.geoloader.dto.geojson.PointGeometry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CoordinateSystemDetectorTest {

    @Test
    void detect_lv95Range() {
        assertThat(CoordinateSystemDetector.detect(List.of(
                new CoordinatePoint(2_600_000, 1_200_000),
                new CoordinatePoint(2_683_000, 1_248_000))))
                .contains(CoordinateSystems.LV95);
    }

    @Test
    void detect_lv03Range() {
        assertThat(CoordinateSystemDetector.detect(List.of(new CoordinatePoint(600_000, 200_000))))
                .contains(CoordinateSystems.LV03);
    }

    @Test
    void detect_geographicRange() {
        assertThat(CoordinateSystemDetector.detect(List.of(new CoordinatePoint(8.54, 47.37))))
                .contains(CoordinateSystems.WGS84);
    }

    @Test
    void detect_mixedRangesMatchNothing() {
        assertThat(CoordinateSystemDetector.detect(List.of(
                new CoordinatePoint(2_600_000, 1_200_000),
                new CoordinatePoint(600_000, 200_000))))
                .isEmpty();
    }

    @Test
    void detect_ignoresNonFiniteSamples() {
        assertThat(CoordinateSystemDetector.detect(Arrays.asList(
                null,
                new CoordinatePoint(Double.NaN, 0),
                new CoordinatePoint(600_000, 200_000))))
                .contains(CoordinateSystems.LV03);
        assertThat(CoordinateSystemDetector.detect(List.of(new CoordinatePoint(Double.NaN, Double.NaN)))).isEmpty();
    }

    @Test
    void detect_onlyLooksAtFirstSamples() {
        List<CoordinatePoint> points = new ArrayList<>();
        for (int i = 0; i < CoordinateSystemDetector.MAX_SAMPLES; i++) {
            points.add(new CoordinatePoint(600_000 + i, 200_000));
        }
        points.add(new CoordinatePoint(5_000_000, 0));

        assertThat(CoordinateSystemDetector.detect(points)).contains(CoordinateSystems.LV03);
    }

    @Test
    void detect_fromBoundsAndFeatures() {
        assertThat(CoordinateSystemDetector.detect((Bounds) null)).isEmpty();
        assertThat(CoordinateSystemDetector.detect(new Bounds(2_500_000, 1_100_000, 2_700_000, 1_250_000)))
                .contains(CoordinateSystems.LV95);

        List<GeoJsonFeature> features = List.of(
                new GeoJsonFeature(PointGeometry.of(2_600_000, 1_200_000), Map.of()),
                new GeoJsonFeature(PointGeometry.of(2_610_000, 1_210_000), Map.of()));
        assertThat(CoordinateSystemDetector.detectFromFeatures(features)).contains(CoordinateSystems.LV95);
    }
}
