package org.geoloader.dto.geojson;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * GeoJSON Feature。
 *
 * @param geometry   几何
 * @param properties 属性（至少包含 id/type/layer 以及样式字段；值可能为 null）
 */
public record GeoJsonFeature(GeoJsonGeometry geometry, Map<String, Object> properties) {

    public GeoJsonFeature {
        properties = (properties == null)
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    @JsonProperty("type")
    public String type() {
        return "Feature";
    }

    public GeoJsonFeature withGeometry(GeoJsonGeometry newGeometry) {
        return new GeoJsonFeature(newGeometry, properties);
    }

    public Object property(String key) {
        return properties.get(key);
    }
}
