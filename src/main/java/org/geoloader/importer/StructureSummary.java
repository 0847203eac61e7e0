package org.geoloader.importer;

import org.geoloader.diagnostics.Diagnostic;
import org.geoloader.dxf.model.DxfLayer;

import java.util.List;
import java.util.Map;

/**
 * DXF 结构概览（不做几何转换）。
 *
 * @param version       $ACADVER
 * @param units         $INSUNITS 的可读名称
 * @param extMin        $EXTMIN（[x, y, z]，可为空）
 * @param extMax        $EXTMAX（[x, y, z]，可为空）
 * @param detectedCrs   按 $EXTMIN/$EXTMAX 推断的坐标系（可为空）
 * @param sections      出现过的段名
 * @param layers        图层表
 * @param blocks        图块概览
 * @param entityCounts  ENTITIES 段按类型名统计
 * @param totalEntities ENTITIES 段实体总数
 * @param diagnostics   解析期诊断
 */
public record StructureSummary(
        String version,
        String units,
        double[] extMin,
        double[] extMax,
        String detectedCrs,
        List<String> sections,
        List<DxfLayer> layers,
        List<BlockSummary> blocks,
        Map<String, Integer> entityCounts,
        int totalEntities,
        List<Diagnostic> diagnostics
) {

    /**
     * @param name        图块名
     * @param layer       定义所在图层
     * @param entityCount 已解码的子实体数
     * @param basePoint   基点 [x, y, z]
     */
    public record BlockSummary(String name, String layer, int entityCount, double[] basePoint) {
    }
}
