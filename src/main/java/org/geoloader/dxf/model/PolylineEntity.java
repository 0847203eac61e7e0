package org.geoloader.dxf.model;

import java.util.List;

/**
 * POLYLINE / LWPOLYLINE。
 *
 * @param dxfType  原始类型名
 * @param vertices 顶点（至少 2 个）
 * @param closed   70 号组码 bit1
 */
public record PolylineEntity(
        EntityAttributes attributes,
        String dxfType,
        List<PolylineVertex> vertices,
        boolean closed
) implements DxfEntity {

    public PolylineEntity {
        vertices = List.copyOf(vertices);
    }

    @Override
    public EntityType type() {
        return EntityType.POLYLINE;
    }
}
