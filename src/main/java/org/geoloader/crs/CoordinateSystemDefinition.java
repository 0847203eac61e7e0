package org.geoloader.crs;

import org.geoloader.dto.geojson.Bounds;

/**
 * 坐标系定义。
 *
 * @param code        坐标系代码（例如 {@code EPSG:2056}），区分大小写，注册表的键
 * @param proj4       proj4 参数串
 * @param bounds      有效范围（可为空，表示不限制）
 * @param units       单位（meters/degrees）
 * @param description 说明（可为空）
 */
public record CoordinateSystemDefinition(
        String code,
        String proj4,
        Bounds bounds,
        String units,
        String description
) {

    public CoordinateSystemDefinition {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("坐标系代码不能为空");
        }
        if (proj4 == null || proj4.isBlank()) {
            throw new IllegalArgumentException("proj4 定义不能为空: " + code);
        }
        code = code.trim();
        proj4 = proj4.trim();
    }
}
