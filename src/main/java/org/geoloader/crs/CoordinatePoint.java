package org.geoloader.crs;

/**
 * 二维坐标点（投影坐标为米，地理坐标为经度/纬度，单位度）。
 */
public record CoordinatePoint(double x, double y) {

    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y);
    }
}
