package org.geoloader.dxf.model;

import org.geoloader.geometry.Vector3;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * INSERT（图块引用）。
 *
 * @param blockName       引用的图块名（2）
 * @param position        插入点（10/20/30）
 * @param scale           缩放（41/42/43，缺省 1）
 * @param rotation        旋转角（50，角度制）
 * @param columnCount     阵列列数（70，缺省 1）
 * @param rowCount        阵列行数（71，缺省 1）
 * @param columnSpacing   列间距（44）
 * @param rowSpacing      行间距（45）
 * @param attributeValues 随附的 ATTRIB 标签 -> 值（保持文件中的顺序）
 */
public record InsertEntity(
        EntityAttributes attributes,
        String blockName,
        Vector3 position,
        Vector3 scale,
        double rotation,
        int columnCount,
        int rowCount,
        double columnSpacing,
        double rowSpacing,
        Map<String, String> attributeValues
) implements DxfEntity {

    public InsertEntity {
        scale = (scale == null) ? new Vector3(1, 1, 1) : scale;
        columnCount = Math.max(1, columnCount);
        rowCount = Math.max(1, rowCount);
        attributeValues = (attributeValues == null || attributeValues.isEmpty())
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributeValues));
    }

    @Override
    public EntityType type() {
        return EntityType.INSERT;
    }

    @Override
    public String dxfType() {
        return "INSERT";
    }
}
