package org.geoloader.dxf.model;

import org.geoloader.geometry.Vector3;

import java.util.List;

/**
 * BLOCKS 段中的图块定义。
 *
 * @param name             图块名（区分大小写）
 * @param layer            定义所在图层
 * @param basePoint        基点（10/20/30），插入时先减去
 * @param entities         已解码的子实体（可能包含嵌套 INSERT）
 * @param rejectedEntities 解码失败而未进入 {@code entities} 的子实体数（每插入一次都计为失败）
 */
public record DxfBlock(String name, String layer, Vector3 basePoint, List<DxfEntity> entities, int rejectedEntities) {

    public DxfBlock {
        basePoint = (basePoint == null) ? Vector3.ZERO : basePoint;
        entities = List.copyOf(entities);
        rejectedEntities = Math.max(0, rejectedEntities);
    }

    public DxfBlock(String name, String layer, Vector3 basePoint, List<DxfEntity> entities) {
        this(name, layer, basePoint, entities, 0);
    }
}
