package org.geoloader.dxf.model;

import org.geoloader.geometry.Vector3;

public record LineEntity(EntityAttributes attributes, Vector3 start, Vector3 end) implements DxfEntity {

    @Override
    public EntityType type() {
        return EntityType.LINE;
    }

    @Override
    public String dxfType() {
        return "LINE";
    }
}
