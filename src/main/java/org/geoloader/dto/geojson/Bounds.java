package org.geoloader.dto.geojson;

import java.util.Collection;

/**
 * 轴对齐外包框。
 */
public record Bounds(double minX, double minY, double maxX, double maxY) {

    public boolean contains(double x, double y) {
        return x >= minX && x <= maxX && y >= minY && y <= maxY;
    }

    /**
     * 计算要素集合的外包框；没有任何有限坐标时返回 null。
     */
    public static Bounds of(Collection<GeoJsonFeature> features) {
        double[] box = {Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY};
        for (GeoJsonFeature feature : features) {
            if (feature.geometry() == null) {
                continue;
            }
            feature.geometry().forEachPosition(p -> {
                if (Double.isFinite(p[0]) && Double.isFinite(p[1])) {
                    box[0] = Math.min(box[0], p[0]);
                    box[1] = Math.min(box[1], p[1]);
                    box[2] = Math.max(box[2], p[0]);
                    box[3] = Math.max(box[3], p[1]);
                }
            });
        }
        if (box[0] > box[2]) {
            return null;
        }
        return new Bounds(box[0], box[1], box[2], box[3]);
    }
}
