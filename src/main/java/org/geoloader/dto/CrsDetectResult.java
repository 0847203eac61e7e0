package org.geoloader.dto;

import org.geoloader.dto.geojson.Bounds;

/**
 * {@code crs_detect_system} 的返回结果。
 *
 * @param detectedCrs 推断出的坐标系；不匹配任何已知范围时为 null
 * @param sampleCount 参与判断的有效点数
 * @param bounds      样本点外包框
 */
public record CrsDetectResult(String detectedCrs, int sampleCount, Bounds bounds) {
}
