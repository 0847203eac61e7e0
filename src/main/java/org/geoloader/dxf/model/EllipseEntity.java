package org.geoloader.dxf.model;

import org.geoloader.geometry.Vector3;

/**
 * ELLIPSE。
 *
 * @param center         中心
 * @param majorAxis      长轴端点（相对中心的向量，11/21/31）
 * @param minorAxisRatio 短轴/长轴比（40）
 * @param startAngle     起始参数（41，弧度）
 * @param endAngle       终止参数（42，弧度）
 */
public record EllipseEntity(
        EntityAttributes attributes,
        Vector3 center,
        Vector3 majorAxis,
        double minorAxisRatio,
        double startAngle,
        double endAngle
) implements DxfEntity {

    @Override
    public EntityType type() {
        return EntityType.ELLIPSE;
    }

    @Override
    public String dxfType() {
        return "ELLIPSE";
    }

    /**
     * 参数跨度是否覆盖整圈（按 {@code end <= start} 补一整圈后计算）。
     */
    public boolean isFull() {
        double span = endAngle - startAngle;
        if (span <= 0) {
            span += Math.PI * 2;
        }
        return span >= Math.PI * 2 - 1e-9;
    }
}
