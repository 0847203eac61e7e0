package org.geoloader.dxf.model;

import org.geoloader.geometry.Vector3;

public record CircleEntity(EntityAttributes attributes, Vector3 center, double radius) implements DxfEntity {

    @Override
    public EntityType type() {
        return EntityType.CIRCLE;
    }

    @Override
    public String dxfType() {
        return "CIRCLE";
    }
}
