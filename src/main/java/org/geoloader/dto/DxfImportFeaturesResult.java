package org.geoloader.dto;

import org.geoloader.diagnostics.Diagnostic;
import org.geoloader.dto.geojson.Bounds;
import org.geoloader.dto.geojson.GeoJsonFeature;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * {@code dxf_import_features} 的返回结果。
 * <p>
 * 要素只返回前 {@code previewFeatures.size()} 条，其余通过 {@code dxf_read_features} 按 token 分页读取。
 *
 * @param rootId                根目录标识
 * @param path                  相对 root 的路径
 * @param token                 导入令牌
 * @param expiresAt             令牌过期时间
 * @param summary               例如 "12 of 14 entities converted"
 * @param detectedCrs           推断的坐标系
 * @param sourceCrs             实际使用的源坐标系
 * @param targetCrs             实际转换到的坐标系（未转换为 null）
 * @param totalEntities         展开后的实体总数
 * @param convertedCount        输出的要素数
 * @param failedCount           丢弃的实体/要素数
 * @param skippedCount          被图层过滤排除的实体数
 * @param bounds                外包框
 * @param layerFeatureCounts    图层 -> 要素数
 * @param diagnostics           诊断记录
 * @param suppressedDiagnostics 超出保留上限的诊断条数
 * @param warnings              读取阶段的告警
 * @param previewFeatures       要素预览
 * @param hasMore               是否还有未返回的要素
 */
public record DxfImportFeaturesResult(
        String rootId,
        String path,
        String token,
        Instant expiresAt,
        String summary,
        String detectedCrs,
        String sourceCrs,
        String targetCrs,
        int totalEntities,
        int convertedCount,
        int failedCount,
        int skippedCount,
        Bounds bounds,
        Map<String, Integer> layerFeatureCounts,
        List<Diagnostic> diagnostics,
        int suppressedDiagnostics,
        List<String> warnings,
        List<GeoJsonFeature> previewFeatures,
        boolean hasMore
) {
}
