package org.geoloader.dxf.model;

import org.geoloader.geometry.Vector3;

import java.util.List;

/**
 * LEADER / MLEADER 引线顶点。
 */
public record LeaderEntity(
        EntityAttributes attributes,
        String dxfType,
        List<Vector3> vertices
) implements DxfEntity {

    public LeaderEntity {
        vertices = List.copyOf(vertices);
    }

    @Override
    public EntityType type() {
        return EntityType.LEADER;
    }
}
