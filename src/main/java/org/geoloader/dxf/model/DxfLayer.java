package org.geoloader.dxf.model;

/**
 * 图层表（TABLES/LAYER）中的一条记录。
 *
 * @param name       图层名
 * @param color      ACI 颜色号（取绝对值；负数表示关闭）
 * @param lineType   线型名（可为空）
 * @param lineWeight 线宽（370；可为空）
 * @param visible    62 号组码为负数时为 false
 * @param frozen     70 号组码 bit1
 * @param locked     70 号组码 bit4
 */
public record DxfLayer(
        String name,
        int color,
        String lineType,
        Integer lineWeight,
        boolean visible,
        boolean frozen,
        boolean locked
) {

    public static DxfLayer defaultLayer() {
        return new DxfLayer(EntityAttributes.DEFAULT_LAYER, 7, "CONTINUOUS", null, true, false, false);
    }

    /**
     * 关闭或冻结的图层都不显示。
     */
    public boolean hidden() {
        return !visible || frozen;
    }
}
