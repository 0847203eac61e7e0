package org.geoloader.dxf.model;

import org.geoloader.geometry.Vector3;

/**
 * DIMENSION：只保留定位点与标注信息，转换为点要素。
 *
 * @param definitionPoint 定义点（10/20/30）
 * @param textPosition    文字中点（11/21/31；可为空）
 * @param blockName       匿名标注图块名（2；可为空）
 * @param dimensionType   标注类型（70 低 3 位）
 * @param measurement     实测值（42；可为空）
 * @param text            覆盖文字（1；可为空）
 */
public record DimensionEntity(
        EntityAttributes attributes,
        Vector3 definitionPoint,
        Vector3 textPosition,
        String blockName,
        int dimensionType,
        Double measurement,
        String text
) implements DxfEntity {

    @Override
    public EntityType type() {
        return EntityType.DIMENSION;
    }

    @Override
    public String dxfType() {
        return "DIMENSION";
    }

    /**
     * 要素定位点：优先文字中点，其次定义点。
     */
    public Vector3 insertionPoint() {
        return textPosition != null ? textPosition : definitionPoint;
    }
}
