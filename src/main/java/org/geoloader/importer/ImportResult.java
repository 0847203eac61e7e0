package org.geoloader.importer;

import org.geoloader.diagnostics.Diagnostic;
import org.geoloader.dto.geojson.Bounds;
import org.geoloader.dto.geojson.GeoJsonFeature;

import java.util.List;
import java.util.Map;

/**
 * 一次导入的结果（部分成功时也会返回，失败明细在 diagnostics 中）。
 *
 * @param features              要素（已按需完成坐标转换）
 * @param bounds                要素外包框（无要素时为 null）
 * @param detectedCrs           按坐标范围推断出的坐标系（推断不出时为 null）
 * @param sourceCrs             实际使用的源坐标系（为 null 表示未知）
 * @param targetCrs             实际转换到的坐标系（未转换时为 null）
 * @param totalEntities         展开后的实体总数（= convertedCount + failedCount + skippedCount）
 * @param convertedCount        成功输出的要素数
 * @param failedCount           被丢弃的实体数（解码、图块展开、几何转换、坐标转换失败）
 * @param skippedCount          被图层过滤（隐藏图层或不在所选图层中）排除的实体数，不计为失败
 * @param layerFeatureCounts    图层 -> 要素数
 * @param diagnostics           诊断记录
 * @param suppressedDiagnostics 超出保留上限而未返回的诊断条数
 */
public record ImportResult(
        List<GeoJsonFeature> features,
        Bounds bounds,
        String detectedCrs,
        String sourceCrs,
        String targetCrs,
        int totalEntities,
        int convertedCount,
        int failedCount,
        int skippedCount,
        Map<String, Integer> layerFeatureCounts,
        List<Diagnostic> diagnostics,
        int suppressedDiagnostics
) {

    public ImportResult {
        features = List.copyOf(features);
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * 例如 "12 of 14 entities converted"。
     */
    public String summary() {
        return convertedCount + " of " + (convertedCount + failedCount) + " entities converted";
    }
}
