package org.geoloader.dxf.model;

import org.geoloader.geometry.Vector3;

public record PointEntity(EntityAttributes attributes, Vector3 position) implements DxfEntity {

    @Override
    public EntityType type() {
        return EntityType.POINT;
    }

    @Override
    public String dxfType() {
        return "POINT";
    }
}
