package org.geoloader.dxf.model;

import org.geoloader.geometry.Vector3;

import java.util.List;

/**
 * 3DFACE / SOLID：3~4 个顶点，已按多边形环顺序排列（SOLID 的 1-2-4-3 顺序在解码时已调整）。
 */
public record FaceEntity(
        EntityAttributes attributes,
        String dxfType,
        List<Vector3> vertices
) implements DxfEntity {

    public FaceEntity {
        vertices = List.copyOf(vertices);
    }

    @Override
    public EntityType type() {
        return EntityType.FACE;
    }
}
