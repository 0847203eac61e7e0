package org.geoloader.dxf.model;

import org.geoloader.geometry.Vector3;

/**
 * ARC：角度为角度制，逆时针从 startAngle 扫到 endAngle。
 */
public record ArcEntity(
        EntityAttributes attributes,
        Vector3 center,
        double radius,
        double startAngle,
        double endAngle
) implements DxfEntity {

    @Override
    public EntityType type() {
        return EntityType.ARC;
    }

    @Override
    public String dxfType() {
        return "ARC";
    }
}
