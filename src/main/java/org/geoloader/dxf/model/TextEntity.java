package org.geoloader.dxf.model;

import org.geoloader.geometry.Vector3;

/**
 * TEXT / MTEXT。MTEXT 的格式控制符在解码时已清理为纯文本。
 *
 * @param width TEXT 为宽度因子（41），MTEXT 为参考矩形宽度（41）；可为空
 */
public record TextEntity(
        EntityAttributes attributes,
        String dxfType,
        Vector3 position,
        String text,
        double height,
        double rotation,
        Double width,
        String style
) implements DxfEntity {

    @Override
    public EntityType type() {
        return EntityType.TEXT;
    }
}
