package org.geoloader.dxf.model;

import org.geoloader.geometry.Vector3;

import java.util.List;

/**
 * HATCH：边界路径已展开为闭合前的顶点环（每环至少 3 点）。
 */
public record HatchEntity(
        EntityAttributes attributes,
        String patternName,
        boolean solid,
        List<List<Vector3>> rings
) implements DxfEntity {

    public HatchEntity {
        rings = rings.stream().map(List::copyOf).toList();
    }

    @Override
    public EntityType type() {
        return EntityType.HATCH;
    }

    @Override
    public String dxfType() {
        return "HATCH";
    }
}
