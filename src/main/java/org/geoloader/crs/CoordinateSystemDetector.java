package org.geoloader.crs;

import org.geoloader.dto.geojson.Bounds;
import org.geoloader.dto.geojson.GeoJsonFeature;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 按坐标取值范围推断坐标系（LV95 -> LV03 -> WGS84 依次匹配）。
 * <p>
 * 所有有限样本点都落在同一范围内才算命中；都不命中时返回空，不做默认猜测。
 * 注意：小数值的局部 CAD 坐标也会落入 WGS84 的经纬度范围，结果仅作提示。
 */
public final class CoordinateSystemDetector {

    private CoordinateSystemDetector() {
    }

    /**
     * 参与判断的最大样本点数。
     */
    public static final int MAX_SAMPLES = 1_000;

    private record Range(String system, double minX, double maxX, double minY, double maxY) {
        boolean contains(CoordinatePoint p) {
            return p.x() >= minX && p.x() <= maxX && p.y() >= minY && p.y() <= maxY;
        }
    }

    private static final List<Range> RANGES = List.of(
            new Range(CoordinateSystems.LV95, 2_000_000, 3_000_000, 1_000_000, 1_400_000),
            new Range(CoordinateSystems.LV03, 400_000, 900_000, 50_000, 400_000),
            new Range(CoordinateSystems.WGS84, -180, 180, -90, 90)
    );

    public static Optional<String> detect(Collection<CoordinatePoint> points) {
        List<CoordinatePoint> samples = new ArrayList<>();
        for (CoordinatePoint p : points) {
            if (p != null && p.isFinite()) {
                samples.add(p);
                if (samples.size() >= MAX_SAMPLES) {
                    break;
                }
            }
        }
        if (samples.isEmpty()) {
            return Optional.empty();
        }
        for (Range range : RANGES) {
            if (samples.stream().allMatch(range::contains)) {
                return Optional.of(range.system());
            }
        }
        return Optional.empty();
    }

    public static Optional<String> detect(Bounds bounds) {
        if (bounds == null) {
            return Optional.empty();
        }
        return detect(List.of(
                new CoordinatePoint(bounds.minX(), bounds.minY()),
                new CoordinatePoint(bounds.maxX(), bounds.maxY())));
    }

    public static Optional<String> detectFromFeatures(Collection<GeoJsonFeature> features) {
        return detect(Bounds.of(features));
    }
}
