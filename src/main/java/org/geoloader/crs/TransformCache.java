package org.geoloader.crs;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 坐标转换结果缓存：键为 (from, to, x, y)。
 * <p>
 * 淘汰策略：容量满时按插入顺序一次性淘汰最旧的一半，再写入新条目（不是严格 LRU，读取不改变顺序）。
 * 缓存值只取决于键，并发写入同一键时“后写覆盖”不会产生错误结果。
 */
final class TransformCache {

    record Key(String from, String to, double x, double y) {
    }

    private final int maxEntries;
    private final Object lock = new Object();

    // accessOrder=false：保持插入顺序，便于按“最旧”批量淘汰
    private final LinkedHashMap<Key, CoordinatePoint> map = new LinkedHashMap<>(256, 0.75f, false);

    TransformCache(int maxEntries) {
        this.maxEntries = Math.max(2, maxEntries);
    }

    CoordinatePoint get(Key key) {
        synchronized (lock) {
            return map.get(key);
        }
    }

    void put(Key key, CoordinatePoint value) {
        synchronized (lock) {
            if (!map.containsKey(key) && map.size() >= maxEntries) {
                evictOldestHalf();
            }
            map.put(key, value);
        }
    }

    int size() {
        synchronized (lock) {
            return map.size();
        }
    }

    int maxEntries() {
        return maxEntries;
    }

    void clear() {
        synchronized (lock) {
            map.clear();
        }
    }

    private void evictOldestHalf() {
        int toRemove = Math.max(1, map.size() / 2);
        Iterator<Map.Entry<Key, CoordinatePoint>> it = map.entrySet().iterator();
        while (toRemove-- > 0 && it.hasNext()) {
            it.next();
            it.remove();
        }
    }
}
