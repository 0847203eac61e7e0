package org.geoloader.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.geoloader.crs.CoordinatePoint;
import org.geoloader.crs.CoordinateSystemDetector;
import org.geoloader.crs.CoordinateSystemManager;
import org.geoloader.crs.CoordinateTransformationException;
import org.geoloader.dto.AllowedRootsResult;
import org.geoloader.dto.CrsDetectResult;
import org.geoloader.dto.CrsSystemsResult;
import org.geoloader.dto.CrsTransformResult;
import org.geoloader.dto.DxfImportFeaturesResult;
import org.geoloader.dto.DxfStructureResult;
import org.geoloader.dto.geojson.Bounds;
import org.geoloader.filesystem.DxfFileLoader;
import org.geoloader.filesystem.GeoImportProperties;
import org.geoloader.filesystem.SecurePathResolver;
import org.geoloader.importer.DxfImportService;
import org.geoloader.importer.FeatureStore;
import org.geoloader.importer.ImportOptions;
import org.geoloader.importer.ImportResult;
import org.geoloader.importer.StructureSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * DXF 导入 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>列出根目录白名单（{@code geo_list_roots}）。</li>
 *   <li>读取 DXF 结构概览（{@code dxf_read_structure}）。</li>
 *   <li>导入为 GeoJSON 要素（{@code dxf_import_features} -> {@code dxf_read_features} 按 token 分页）。</li>
 *   <li>坐标系列表/批量转换/范围推断（{@code crs_list_systems}、{@code crs_transform_points}、{@code crs_detect_system}）。</li>
 * </ul>
 * <p>
 * 错误约定：参数错误抛 {@link IllegalArgumentException}；批量转换中单点失败只体现在该点的 {@code error} 字段。
 */
@Component
public class DxfMcpTools {

    private static final Logger log = LoggerFactory.getLogger(DxfMcpTools.class);

    /**
     * 单次批量转换/推断允许的最大点数。
     */
    static final int MAX_POINTS = 10_000;

    /**
     * points 参数解析用的 JSON 解析器。
     */
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final GeoImportProperties properties;
    private final SecurePathResolver pathResolver;
    private final DxfFileLoader fileLoader;
    private final DxfImportService importService;
    private final FeatureStore featureStore;
    private final CoordinateSystemManager coordinateSystemManager;

    public DxfMcpTools(GeoImportProperties properties,
                       SecurePathResolver pathResolver,
                       DxfFileLoader fileLoader,
                       DxfImportService importService,
                       FeatureStore featureStore,
                       CoordinateSystemManager coordinateSystemManager) {
        this.properties = properties;
        this.pathResolver = pathResolver;
        this.fileLoader = fileLoader;
        this.importService = importService;
        this.featureStore = featureStore;
        this.coordinateSystemManager = coordinateSystemManager;
    }

    @Tool(
            name = "geo_list_roots",
            description = "列出允许读取 DXF 的根目录（rootId + path）。"
    )
    public AllowedRootsResult listRoots() {
        return new AllowedRootsResult(pathResolver.listRoots());
    }

    @Tool(
            name = "dxf_read_structure",
            description = "读取 DXF 的结构概览：版本、单位、范围、图层表、图块、实体类型统计与解析诊断；不做几何与坐标转换。"
    )
    public DxfStructureResult readStructure(
            @ToolParam(required = false, description = "rootId（可从 geo_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(description = "DXF 文件路径（相对 rootId 或绝对路径）") String path
    ) {
        DxfFileLoader.LoadedDxf loaded = fileLoader.load(rootId, path);
        StructureSummary structure = importService.readStructure(loaded.content());
        return new DxfStructureResult(loaded.rootId(), loaded.path(), loaded.sizeBytes(), loaded.charset(),
                loaded.warnings(), structure);
    }

    @Tool(
            name = "dxf_import_features",
            description = "把 DXF 导入为 GeoJSON 要素：展开图块、转换几何，可选坐标转换。返回计数/外包框/诊断与前若干条要素，完整要素用 token 调 dxf_read_features 分页读取。"
    )
    public DxfImportFeaturesResult importFeatures(
            @ToolParam(required = false, description = "rootId（为空默认 root0）") String rootId,
            @ToolParam(description = "DXF 文件路径（相对 rootId 或绝对路径）") String path,
            @ToolParam(required = false, description = "源坐标系，例如 EPSG:2056；为空按坐标范围推断") String sourceCrs,
            @ToolParam(required = false, description = "目标坐标系，例如 EPSG:4326；为空不做坐标转换") String targetCrs,
            @ToolParam(required = false, description = "是否展开图块引用（默认 true）") Boolean expandBlocks,
            @ToolParam(required = false, description = "是否导入关闭/冻结图层上的实体（默认 app.geo.include-hidden-layers）") Boolean includeHiddenLayers,
            @ToolParam(required = false, description = "只导入这些图层，逗号分隔；为空表示全部") String layers,
            @ToolParam(required = false, description = "随结果直接返回的要素数（默认 app.geo.import-preview-features）") Integer previewLimit
    ) {
        DxfFileLoader.LoadedDxf loaded = fileLoader.load(rootId, path);
        ImportOptions options = ImportOptions.defaults()
                .withSourceCrs(sourceCrs)
                .withTargetCrs(targetCrs)
                .withExpandBlocks(expandBlocks == null || expandBlocks)
                .withIncludeHiddenLayers(includeHiddenLayers == null ? properties.isIncludeHiddenLayers() : includeHiddenLayers)
                .withLayers(parseLayers(layers));

        ImportResult result = importService.importContent(loaded.content(), options);
        FeatureStore.StoredImport stored = featureStore.store(loaded.path(), result);

        int preview = previewLimit == null ? properties.getImportPreviewFeatures() : previewLimit;
        if (preview < 0) {
            throw new IllegalArgumentException("previewLimit 不能为负数");
        }
        preview = Math.min(preview, properties.getFeaturesPageMaxLimit());
        int shown = Math.min(preview, result.features().size());
        log.info("导入 {}：{}，token={}", loaded.path(), result.summary(), stored.token());
        return new DxfImportFeaturesResult(
                loaded.rootId(),
                loaded.path(),
                stored.token(),
                stored.expiresAt(),
                result.summary(),
                result.detectedCrs(),
                result.sourceCrs(),
                result.targetCrs(),
                result.totalEntities(),
                result.convertedCount(),
                result.failedCount(),
                result.skippedCount(),
                result.bounds(),
                result.layerFeatureCounts(),
                result.diagnostics(),
                result.suppressedDiagnostics(),
                loaded.warnings(),
                new ArrayList<>(result.features().subList(0, shown)),
                shown < result.features().size()
        );
    }

    @Tool(
            name = "dxf_read_features",
            description = "按 token 分页读取 dxf_import_features 的完整要素（limit/offset）。"
    )
    public FeatureStore.FeaturePage readFeatures(
            @ToolParam(description = "dxf_import_features 返回的 token") String token,
            @ToolParam(required = false, description = "偏移量，从 0 开始") Integer offset,
            @ToolParam(required = false, description = "分页大小（默认 app.geo.features-page-default-limit，上限 app.geo.features-page-max-limit）") Integer limit
    ) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("token 不能为空");
        }
        int safeOffset = offset == null ? 0 : offset;
        int safeLimit = limit == null ? properties.getFeaturesPageDefaultLimit() : limit;
        safeLimit = Math.min(safeLimit, properties.getFeaturesPageMaxLimit());
        FeatureStore.FeaturePage page = featureStore.page(token.trim(), safeOffset, safeLimit);
        if (page == null) {
            throw new IllegalArgumentException("token 不存在或已过期：" + token);
        }
        return page;
    }

    @Tool(
            name = "crs_list_systems",
            description = "列出已注册的坐标系（代码、proj4 定义、有效范围、单位）。"
    )
    public CrsSystemsResult listSystems() {
        return new CrsSystemsResult(coordinateSystemManager.getSupportedSystems());
    }

    @Tool(
            name = "crs_transform_points",
            description = "批量转换坐标点。points 为 JSON 数组，元素为 [x, y] 或 {\"x\":..,\"y\":..}；单点失败只在该点返回 error，不影响其余点。"
    )
    public CrsTransformResult transformPoints(
            @ToolParam(description = "源坐标系，例如 EPSG:2056") String from,
            @ToolParam(description = "目标坐标系，例如 EPSG:4326") String to,
            @ToolParam(description = "点列表 JSON，例如 [[2600000,1200000],[2601000,1201000]]") String points
    ) {
        String fromCode = requireSystem(from, "from");
        String toCode = requireSystem(to, "to");
        JsonNode array = parsePointsArray(points);

        List<CrsTransformResult.PointResult> results = new ArrayList<>(array.size());
        int success = 0;
        for (int i = 0; i < array.size(); i++) {
            CoordinatePoint input = toPoint(array.get(i));
            if (input == null) {
                results.add(new CrsTransformResult.PointResult(i, null, null, null, null, null,
                        "无法解析的点：需要 [x, y] 或 {\"x\":..,\"y\":..}"));
                continue;
            }
            Boolean inBounds = coordinateSystemManager.validateBounds(input, fromCode);
            try {
                CoordinatePoint out = coordinateSystemManager.transform(input, fromCode, toCode);
                results.add(new CrsTransformResult.PointResult(i, input.x(), input.y(), out.x(), out.y(), inBounds, null));
                success++;
            } catch (CoordinateTransformationException e) {
                results.add(new CrsTransformResult.PointResult(i, input.x(), input.y(), null, null, inBounds, e.getMessage()));
            }
        }
        return new CrsTransformResult(fromCode, toCode, success, results.size() - success, results);
    }

    @Tool(
            name = "crs_detect_system",
            description = "按坐标取值范围推断坐标系（LV95 -> LV03 -> WGS84）；都不匹配时 detectedCrs 为 null。"
    )
    public CrsDetectResult detectSystem(
            @ToolParam(description = "点列表 JSON，例如 [[2600000,1200000]]") String points
    ) {
        JsonNode array = parsePointsArray(points);
        List<CoordinatePoint> samples = new ArrayList<>(array.size());
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (JsonNode node : array) {
            CoordinatePoint p = toPoint(node);
            if (p == null || !p.isFinite()) {
                continue;
            }
            samples.add(p);
            minX = Math.min(minX, p.x());
            minY = Math.min(minY, p.y());
            maxX = Math.max(maxX, p.x());
            maxY = Math.max(maxY, p.y());
        }
        String detected = CoordinateSystemDetector.detect(samples).orElse(null);
        Bounds bounds = samples.isEmpty() ? null : new Bounds(minX, minY, maxX, maxY);
        return new CrsDetectResult(detected, Math.min(samples.size(), CoordinateSystemDetector.MAX_SAMPLES), bounds);
    }

    private String requireSystem(String code, String name) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException(name + " 不能为空");
        }
        String trimmed = code.trim();
        if (coordinateSystemManager.getSystemDefinition(trimmed) == null) {
            throw new IllegalArgumentException("未注册的坐标系：" + trimmed + "（可用 crs_list_systems 查看）");
        }
        return trimmed;
    }

    private static JsonNode parsePointsArray(String points) {
        if (points == null || points.isBlank()) {
            throw new IllegalArgumentException("points 不能为空");
        }
        JsonNode array;
        try {
            array = OBJECT_MAPPER.readTree(points);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("points 不是合法的 JSON：" + e.getOriginalMessage(), e);
        }
        if (array == null || !array.isArray()) {
            throw new IllegalArgumentException("points 必须是 JSON 数组");
        }
        if (array.size() > MAX_POINTS) {
            throw new IllegalArgumentException("点数过多：" + array.size() + "（上限 " + MAX_POINTS + "）");
        }
        return array;
    }

    /**
     * @return 点；格式不对时返回 null
     */
    private static CoordinatePoint toPoint(JsonNode node) {
        if (node == null) {
            return null;
        }
        JsonNode x;
        JsonNode y;
        if (node.isArray()) {
            if (node.size() < 2) {
                return null;
            }
            x = node.get(0);
            y = node.get(1);
        } else if (node.isObject()) {
            x = node.get("x");
            y = node.get("y");
        } else {
            return null;
        }
        if (x == null || y == null || !x.isNumber() || !y.isNumber()) {
            return null;
        }
        return new CoordinatePoint(x.asDouble(), y.asDouble());
    }

    private static Set<String> parseLayers(String layers) {
        if (layers == null || layers.isBlank()) {
            return Set.of();
        }
        Set<String> result = new LinkedHashSet<>();
        for (String part : layers.split(",")) {
            String name = part.trim();
            if (!name.isEmpty()) {
                result.add(name);
            }
        }
        return result;
    }
}
