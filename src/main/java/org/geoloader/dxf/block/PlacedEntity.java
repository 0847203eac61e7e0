package org.geoloader.dxf.block;

import org.geoloader.dxf.model.DxfEntity;

import java.util.List;

/**
 * 展开后的实体（已处于绝对坐标）。
 *
 * @param entity    实体
 * @param blockPath 从顶层到该实体所经过的图块名（顶层实体为空列表）
 */
public record PlacedEntity(DxfEntity entity, List<String> blockPath) {

    public PlacedEntity {
        blockPath = List.copyOf(blockPath);
    }

    public static PlacedEntity topLevel(DxfEntity entity) {
        return new PlacedEntity(entity, List.of());
    }
}
