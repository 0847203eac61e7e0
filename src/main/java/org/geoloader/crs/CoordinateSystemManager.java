package org.geoloader.crs;

import org.geoloader.dto.geojson.Bounds;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.Proj4jException;
import org.locationtech.proj4j.ProjCoordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 坐标系管理：注册表 + 惰性构建的转换器 + 结果缓存 + 启动自检。
 * <p>
 * 生命周期：
 * <ul>
 *   <li>由容器创建并在启动时调用 {@link #initialize()}；自检失败抛 {@link CoordinateSystemException}，应用无法启动。</li>
 *   <li>{@link #initialize()} 幂等，并发首次调用只会执行一次。</li>
 *   <li>{@link #reset()} 清空全部状态，供测试隔离使用。</li>
 * </ul>
 * <p>
 * 线程安全：初始化后以读为主；注册表/转换器为并发 Map，缓存内部加锁。
 * proj4j 的 {@code CoordinateTransform} 实例不是线程安全的，调用时对实例加锁。
 */
public class CoordinateSystemManager {

    private static final Logger log = LoggerFactory.getLogger(CoordinateSystemManager.class);

    public static final int DEFAULT_CACHE_MAX_ENTRIES = 10_000;

    /**
     * 自检容差（度）。
     */
    static final double VERIFICATION_TOLERANCE_DEGREES = 0.5;

    private record VerificationPoint(String system, CoordinatePoint source, CoordinatePoint expectedWgs84) {
    }

    private static final List<VerificationPoint> VERIFICATION_POINTS = List.of(
            new VerificationPoint(CoordinateSystems.LV95, new CoordinatePoint(2_645_021, 1_249_991), new CoordinatePoint(8.0, 47.4)),
            new VerificationPoint(CoordinateSystems.LV03, new CoordinatePoint(645_021, 249_991), new CoordinatePoint(8.0, 47.4))
    );

    private final CRSFactory crsFactory = new CRSFactory();
    private final CoordinateTransformFactory transformFactory = new CoordinateTransformFactory();

    private final Map<String, CoordinateSystemDefinition> systems = new ConcurrentHashMap<>();
    private final Map<String, CoordinateReferenceSystem> referenceSystems = new ConcurrentHashMap<>();
    private final Map<String, CoordinateTransform> converters = new ConcurrentHashMap<>();
    private final TransformCache cache;
    private final List<CoordinateSystemDefinition> additionalSystems;

    private volatile boolean initialized = false;

    public CoordinateSystemManager() {
        this(DEFAULT_CACHE_MAX_ENTRIES, List.of());
    }

    public CoordinateSystemManager(int cacheMaxEntries, List<CoordinateSystemDefinition> additionalSystems) {
        this.cache = new TransformCache(cacheMaxEntries);
        this.additionalSystems = additionalSystems == null ? List.of() : List.copyOf(additionalSystems);
    }

    /**
     * 注册内置坐标系与配置的附加坐标系，清空转换器与缓存，然后自检。
     *
     * @throws CoordinateSystemException 定义无法解析或自检结果偏离预期
     */
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        systems.clear();
        referenceSystems.clear();
        converters.clear();
        cache.clear();
        try {
            for (CoordinateSystemDefinition definition : CoordinateSystems.builtIns()) {
                putDefinition(definition);
            }
            for (CoordinateSystemDefinition definition : additionalSystems) {
                putDefinition(definition);
            }
            verify();
        } catch (RuntimeException e) {
            systems.clear();
            referenceSystems.clear();
            converters.clear();
            cache.clear();
            log.error("坐标系初始化失败: {}", e.getMessage());
            if (e instanceof CoordinateSystemException cse) {
                throw cse;
            }
            throw new CoordinateSystemException("坐标系初始化失败: " + e.getMessage(), e);
        }
        initialized = true;
        log.info("坐标系管理器已初始化：systems={}, cacheMaxEntries={}", systems.keySet(), cache.maxEntries());
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * 清空注册表/转换器/缓存并回到未初始化状态。
     */
    public synchronized void reset() {
        systems.clear();
        referenceSystems.clear();
        converters.clear();
        cache.clear();
        initialized = false;
    }

    /**
     * 注册（或覆盖）一个坐标系；会使涉及该代码的转换器失效并清空结果缓存。
     *
     * @throws CoordinateSystemException proj4 定义无法解析
     */
    public void registerSystem(CoordinateSystemDefinition definition) {
        ensureInitialized();
        putDefinition(definition);
        converters.keySet().removeIf(key -> key.startsWith(definition.code() + "->") || key.endsWith("->" + definition.code()));
        cache.clear();
        log.info("已注册坐标系: {}", definition.code());
    }

    public CoordinateSystemDefinition getSystemDefinition(String code) {
        ensureInitialized();
        return code == null ? null : systems.get(code);
    }

    public List<CoordinateSystemDefinition> getSupportedSystems() {
        ensureInitialized();
        List<CoordinateSystemDefinition> list = new ArrayList<>(systems.values());
        list.sort((a, b) -> a.code().compareTo(b.code()));
        return list;
    }

    public String getSystemUnits(String code) {
        CoordinateSystemDefinition definition = getSystemDefinition(code);
        return definition == null ? null : definition.units();
    }

    /**
     * 点是否位于坐标系的有效范围内；坐标系未声明范围时恒为 true，未注册的坐标系为 false。
     */
    public boolean validateBounds(CoordinatePoint point, String code) {
        CoordinateSystemDefinition definition = getSystemDefinition(code);
        if (definition == null || point == null || !point.isFinite()) {
            return false;
        }
        Bounds bounds = definition.bounds();
        return bounds == null || bounds.contains(point.x(), point.y());
    }

    /**
     * 单点转换。源/目标相同时直接返回拷贝；结果按 (from, to, x, y) 缓存。
     *
     * @throws CoordinateTransformationException 输入非有限值、坐标系未注册、投影失败或结果非有限值
     */
    public CoordinatePoint transform(CoordinatePoint point, String from, String to) {
        ensureInitialized();
        if (point == null || !point.isFinite()) {
            throw new CoordinateTransformationException("输入坐标非有限值", point, from, to);
        }
        if (from == null || !systems.containsKey(from)) {
            throw new CoordinateTransformationException("源坐标系未注册", point, from, to);
        }
        if (to == null || !systems.containsKey(to)) {
            throw new CoordinateTransformationException("目标坐标系未注册", point, from, to);
        }
        if (from.equals(to)) {
            return new CoordinatePoint(point.x(), point.y());
        }

        TransformCache.Key key = new TransformCache.Key(from, to, point.x(), point.y());
        CoordinatePoint cached = cache.get(key);
        if (cached != null) {
            return cached;
        }

        CoordinatePoint result;
        try {
            CoordinateTransform converter = converter(from, to);
            ProjCoordinate out = new ProjCoordinate();
            synchronized (converter) {
                converter.transform(new ProjCoordinate(point.x(), point.y()), out);
            }
            result = new CoordinatePoint(out.x, out.y);
        } catch (Proj4jException | IllegalStateException e) {
            throw new CoordinateTransformationException("坐标转换失败: " + e.getMessage(), point, from, to, e);
        }
        if (!result.isFinite()) {
            throw new CoordinateTransformationException("转换结果非有限值", point, from, to);
        }
        cache.put(key, result);
        return result;
    }

    public int cacheSize() {
        return cache.size();
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    private void putDefinition(CoordinateSystemDefinition definition) {
        CoordinateReferenceSystem crs;
        try {
            crs = crsFactory.createFromParameters(definition.code(), definition.proj4());
        } catch (RuntimeException e) {
            // proj4j 对未知投影/参数既可能抛 Proj4jException，也可能抛其他运行时异常
            throw new CoordinateSystemException("无法解析坐标系定义 " + definition.code() + ": " + e.getMessage(), e);
        }
        systems.put(definition.code(), definition);
        referenceSystems.put(definition.code(), crs);
    }

    private CoordinateTransform converter(String from, String to) {
        return converters.computeIfAbsent(from + "->" + to, k -> {
            CoordinateReferenceSystem source = referenceSystems.get(from);
            CoordinateReferenceSystem target = referenceSystems.get(to);
            if (source == null || target == null) {
                throw new IllegalStateException("坐标系未注册: " + k);
            }
            log.debug("构建坐标转换器: {}", k);
            return transformFactory.createTransform(source, target);
        });
    }

    private void verify() {
        for (VerificationPoint vp : VERIFICATION_POINTS) {
            if (!systems.containsKey(vp.system())) {
                continue;
            }
            CoordinatePoint actual;
            try {
                CoordinateTransform converter = converter(vp.system(), CoordinateSystems.WGS84);
                ProjCoordinate out = new ProjCoordinate();
                synchronized (converter) {
                    converter.transform(new ProjCoordinate(vp.source().x(), vp.source().y()), out);
                }
                actual = new CoordinatePoint(out.x, out.y);
            } catch (Proj4jException e) {
                throw new CoordinateSystemException("坐标系自检失败（" + vp.system() + "）: " + e.getMessage(), e);
            }
            if (!actual.isFinite()
                    || Math.abs(actual.x() - vp.expectedWgs84().x()) > VERIFICATION_TOLERANCE_DEGREES
                    || Math.abs(actual.y() - vp.expectedWgs84().y()) > VERIFICATION_TOLERANCE_DEGREES) {
                throw new CoordinateSystemException("坐标系自检失败（" + vp.system() + "）：期望 " + vp.expectedWgs84()
                        + "，实际 " + actual);
            }
            log.debug("坐标系自检通过: {} {} -> {}", vp.system(), vp.source(), actual);
        }
    }
}
