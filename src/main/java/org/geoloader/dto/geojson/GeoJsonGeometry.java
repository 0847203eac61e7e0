package org.geoloader.dto.geojson;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * GeoJSON 几何（只覆盖本项目会产出的四种类型）。坐标位置统一为 {@code [x, y]}。
 */
public sealed interface GeoJsonGeometry permits PointGeometry, LineStringGeometry, PolygonGeometry, MultiPolygonGeometry {

    @JsonProperty("type")
    String type();

    /**
     * 按顺序访问所有坐标位置。
     */
    void forEachPosition(Consumer<double[]> action);

    /**
     * 逐个位置映射出新几何（坐标转换使用）；映射函数不得返回 null。
     */
    GeoJsonGeometry mapPositions(UnaryOperator<double[]> mapper);
}
