package org.geoloader.dxf.model;

import org.geoloader.geometry.Vector3;

/**
 * 多段线顶点。
 *
 * @param point 顶点坐标
 * @param bulge 凸度（42）：到下一顶点的圆弧段 {@code tan(θ/4)}，0 表示直线段
 */
public record PolylineVertex(Vector3 point, double bulge) {

    public static PolylineVertex of(Vector3 point) {
        return new PolylineVertex(point, 0);
    }
}
