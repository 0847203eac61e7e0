package org.geoloader.filesystem;

import org.geoloader.crs.CoordinateSystemDefinition;
import org.geoloader.crs.CoordinateSystemManager;
import org.geoloader.dto.geojson.Bounds;
import org.geoloader.importer.DxfImportService;
import org.geoloader.importer.FeatureStore;
import org.geoloader.importer.InMemoryFeatureStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * DXF 导入服务的 Bean 装配。
 * <p>
 * 说明：
 * <ul>
 *   <li>{@link CoordinateSystemManager#initialize()} 作为初始化方法执行，坐标系自检失败时应用直接启动失败。</li>
 *   <li>导入结果只保存在内存中（{@link InMemoryFeatureStore}），不引入数据库依赖。</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
public class GeoImportConfiguration {

    @Bean
    public SecurePathResolver securePathResolver(GeoImportProperties properties) {
        return new SecurePathResolver(properties);
    }

    @Bean
    public DxfFileLoader dxfFileLoader(SecurePathResolver resolver, GeoImportProperties properties) {
        return new DxfFileLoader(resolver, properties.getReadMaxBytes().toBytes());
    }

    @Bean(initMethod = "initialize")
    public CoordinateSystemManager coordinateSystemManager(GeoImportProperties properties) {
        return new CoordinateSystemManager(properties.getTransformCacheMaxEntries(), extraSystems(properties));
    }

    @Bean
    public DxfImportService dxfImportService(CoordinateSystemManager manager, GeoImportProperties properties) {
        return new DxfImportService(manager, properties.getDiagnosticsMaxRecords(),
                properties.getMaxExpandedEntities());
    }

    @Bean
    public FeatureStore featureStore(GeoImportProperties properties) {
        return new InMemoryFeatureStore(properties.getFeatureStoreTtl(), properties.getFeatureStoreMaxImports());
    }

    static List<CoordinateSystemDefinition> extraSystems(GeoImportProperties properties) {
        List<CoordinateSystemDefinition> result = new ArrayList<>();
        for (GeoImportProperties.ExtraSystem s : properties.getCrs().getExtraSystems()) {
            Bounds bounds = null;
            List<Double> b = s.getBounds();
            if (b != null && !b.isEmpty()) {
                if (b.size() != 4) {
                    throw new IllegalArgumentException("app.geo.crs.extra-systems[" + s.getCode() + "].bounds 需要 4 个值");
                }
                bounds = new Bounds(b.get(0), b.get(1), b.get(2), b.get(3));
            }
            result.add(new CoordinateSystemDefinition(s.getCode(), s.getProj4(), bounds, s.getUnits(), s.getDescription()));
        }
        return result;
    }
}
