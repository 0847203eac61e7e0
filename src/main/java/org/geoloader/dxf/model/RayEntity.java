package org.geoloader.dxf.model;

import org.geoloader.geometry.Vector3;

/**
 * RAY（单向无限）/ XLINE（双向无限）。
 *
 * @param basePoint 基点（10/20/30）
 * @param direction 方向向量（11/21/31，非零）
 */
public record RayEntity(
        EntityAttributes attributes,
        String dxfType,
        Vector3 basePoint,
        Vector3 direction
) implements DxfEntity {

    @Override
    public EntityType type() {
        return EntityType.RAY;
    }

    public boolean bidirectional() {
        return "XLINE".equals(dxfType);
    }
}
