package org.geoloader.importer;

import org.geoloader.dto.geojson.Bounds;
import org.geoloader.dto.geojson.GeoJsonFeature;

import java.time.Instant;
import java.util.List;

/**
 * 导入结果的持久化接口：接收要素与推断的坐标系/外包框，返回导入/失败计数。
 */
public interface FeatureStore {

    StoredImport store(String source, ImportResult result);

    /**
     * @return 分页结果；token 不存在或已过期时返回 null
     */
    FeaturePage page(String token, int offset, int limit);

    boolean remove(String token);

    /**
     * @param token       导入令牌
     * @param source      来源（文件路径等）
     * @param imported    已保存的要素数
     * @param failed      失败数
     * @param detectedCrs 推断的坐标系
     * @param crs         要素当前所在的坐标系
     * @param bounds      外包框
     * @param createdAt   创建时间
     * @param expiresAt   过期时间
     */
    record StoredImport(
            String token,
            String source,
            int imported,
            int failed,
            String detectedCrs,
            String crs,
            Bounds bounds,
            Instant createdAt,
            Instant expiresAt
    ) {
    }

    record FeaturePage(
            String token,
            int offset,
            int limit,
            int total,
            boolean hasMore,
            List<GeoJsonFeature> features
    ) {
    }
}
