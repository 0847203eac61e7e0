package org.geoloader.importer;

import org.geoloader.dto.geojson.GeoJsonFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 导入结果存储（内存版）。
 * <p>
 * 工作流：
 * <ol>
 *   <li>{@code dxf_import_features}：导入完成后生成 token，把要素暂存在内存，只返回计数与前几条要素。</li>
 *   <li>{@code dxf_read_features}：按 token 分页读取完整要素。</li>
 * </ol>
 * <p>
 * 约束：
 * <ul>
 *   <li>每个 token 有 TTL，超时自动失效。</li>
 *   <li>同时保留的导入数有上限，超出时淘汰最早创建的导入。</li>
 *   <li>仅用于单进程场景；多实例共享请替换为数据库等外部存储。</li>
 * </ul>
 */
public class InMemoryFeatureStore implements FeatureStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryFeatureStore.class);

    private final Duration ttl;
    private final int maxImports;
    private final ConcurrentHashMap<String, Entry> store = new ConcurrentHashMap<>();

    private record Entry(StoredImport meta, List<GeoJsonFeature> features) {
        boolean isExpired() {
            return Instant.now().isAfter(meta.expiresAt());
        }
    }

    public InMemoryFeatureStore(Duration ttl, int maxImports) {
        this.ttl = ttl;
        this.maxImports = Math.max(1, maxImports);
    }

    @Override
    public StoredImport store(String source, ImportResult result) {
        cleanupExpired();
        while (store.size() >= maxImports) {
            store.values().stream()
                    .min(Comparator.comparing(e -> e.meta().createdAt()))
                    .ifPresent(oldest -> {
                        store.remove(oldest.meta().token());
                        log.debug("导入数量达到上限，淘汰最早的导入: {}", oldest.meta().token());
                    });
        }
        String token = UUID.randomUUID().toString();
        Instant now = Instant.now();
        String crs = result.targetCrs() != null ? result.targetCrs() : result.sourceCrs();
        StoredImport meta = new StoredImport(
                token,
                source,
                result.features().size(),
                result.failedCount(),
                result.detectedCrs(),
                crs,
                result.bounds(),
                now,
                now.plus(ttl)
        );
        store.put(token, new Entry(meta, result.features()));
        return meta;
    }

    @Override
    public FeaturePage page(String token, int offset, int limit) {
        Entry entry = get(token);
        if (entry == null) {
            return null;
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset 不能为负数");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit 必须大于 0");
        }
        List<GeoJsonFeature> all = entry.features();
        int from = Math.min(offset, all.size());
        int to = (int) Math.min((long) from + limit, all.size());
        return new FeaturePage(token, offset, limit, all.size(), to < all.size(), all.subList(from, to));
    }

    @Override
    public boolean remove(String token) {
        if (token == null) {
            return false;
        }
        Entry entry = store.remove(token);
        return entry != null && !entry.isExpired();
    }

    public int size() {
        cleanupExpired();
        return store.size();
    }

    private Entry get(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        Entry entry = store.get(token);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired()) {
            store.remove(token);
            return null;
        }
        return entry;
    }

    private void cleanupExpired() {
        Instant now = Instant.now();
        for (Map.Entry<String, Entry> e : store.entrySet()) {
            if (e.getValue().meta().expiresAt().isBefore(now)) {
                store.remove(e.getKey());
            }
        }
    }
}
