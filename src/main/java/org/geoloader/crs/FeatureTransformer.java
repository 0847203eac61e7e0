package org.geoloader.crs;

import org.geoloader.dto.geojson.GeoJsonFeature;
import org.geoloader.dto.geojson.GeoJsonGeometry;

/**
 * 把要素的全部坐标从一个坐标系转换到另一个坐标系。任一点失败即整个要素失败（抛出异常，由调用方决定丢弃）。
 */
public class FeatureTransformer {

    private final CoordinateSystemManager manager;

    public FeatureTransformer(CoordinateSystemManager manager) {
        this.manager = manager;
    }

    public GeoJsonFeature transform(GeoJsonFeature feature, String from, String to) {
        if (from.equals(to)) {
            return feature;
        }
        GeoJsonGeometry geometry = feature.geometry().mapPositions(p -> {
            CoordinatePoint result = manager.transform(new CoordinatePoint(p[0], p[1]), from, to);
            return new double[]{result.x(), result.y()};
        });
        return feature.withGeometry(geometry);
    }
}
