package org.geoloader.dxf.model;

import org.geoloader.geometry.Vector3;

/**
 * 所有实体共享的通用属性（组码 5/8/6/62/370/38/39/60/210-230）。
 *
 * @param layer              图层名（缺省 "0"）
 * @param handle             实体句柄（不透明标识，跨文件不保证唯一；可为空）
 * @param color              ACI 颜色号（62；可为空）
 * @param lineType           线型名（6；可为空表示 BYLAYER）
 * @param lineWeight         线宽（370，单位 1/100 mm；可为空）
 * @param elevation          标高（38）
 * @param thickness          厚度（39）
 * @param visible            是否可见（60=1 表示不可见）
 * @param extrusionDirection 拉伸方向（210/220/230；缺省 0,0,1）
 */
public record EntityAttributes(
        String layer,
        String handle,
        Integer color,
        String lineType,
        Integer lineWeight,
        double elevation,
        double thickness,
        boolean visible,
        Vector3 extrusionDirection
) {

    public static final String DEFAULT_LAYER = "0";
    public static final Vector3 DEFAULT_EXTRUSION = new Vector3(0, 0, 1);

    public EntityAttributes {
        layer = (layer == null || layer.isBlank()) ? DEFAULT_LAYER : layer;
        extrusionDirection = (extrusionDirection == null) ? DEFAULT_EXTRUSION : extrusionDirection;
    }

    public static EntityAttributes defaults() {
        return new EntityAttributes(DEFAULT_LAYER, null, null, null, null, 0, 0, true, DEFAULT_EXTRUSION);
    }

    /**
     * 图块内实体的图层为 "0" 时按 DXF 约定继承插入点（INSERT）的图层。
     */
    public EntityAttributes inheritLayer(String insertLayer) {
        if (!DEFAULT_LAYER.equals(layer) || insertLayer == null) {
            return this;
        }
        return new EntityAttributes(insertLayer, handle, color, lineType, lineWeight, elevation, thickness, visible, extrusionDirection);
    }
}
