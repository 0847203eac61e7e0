package org.geoloader.importer;

import org.geoloader.crs.CoordinateSystemDetector;
import org.geoloader.crs.CoordinateSystemManager;
import org.geoloader.crs.CoordinateTransformationException;
import org.geoloader.crs.FeatureTransformer;
import org.geoloader.diagnostics.DiagnosticCode;
import org.geoloader.diagnostics.DiagnosticsReporter;
import org.geoloader.dto.geojson.Bounds;
import org.geoloader.dto.geojson.GeoJsonFeature;
import org.geoloader.dxf.DxfStructureParser;
import org.geoloader.dxf.block.BlockReferenceExpander;
import org.geoloader.dxf.block.ExpansionResult;
import org.geoloader.dxf.block.PlacedEntity;
import org.geoloader.dxf.model.DxfBlock;
import org.geoloader.dxf.model.DxfDocument;
import org.geoloader.dxf.model.DxfEntity;
import org.geoloader.dxf.model.DxfHeader;
import org.geoloader.dxf.model.DxfLayer;
import org.geoloader.dxf.model.EntityAttributes;
import org.geoloader.geojson.GeometryConverter;
import org.geoloader.geometry.Vector3;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * DXF 导入流水线：扫描/解码 -> 图块展开 -> 图层过滤 -> GeoJSON 转换 -> 坐标系推断/转换 -> 外包框。
 * <p>
 * 失败策略：
 * <ul>
 *   <li>空内容、无有效组码、缺少段标记：抛 {@link org.geoloader.dxf.DxfParseException}，不返回任何要素。</li>
 *   <li>实体/引用/几何级问题：只丢弃对应单元，记入诊断与 failedCount。</li>
 *   <li>坐标转换：任一点失败则整个要素丢弃（{@code TRANSFORM_ERROR}），不会输出未转换的坐标混在结果中。</li>
 * </ul>
 * <p>
 * 计数单位统一为“展开后的实体”：顶层非 INSERT 实体计 1，INSERT 按其展开出的子实体计数
 * （缺失图块、循环引用、超出展开上限而未展开的 INSERT 各计 1）。
 * 因此 {@code totalEntities = convertedCount + failedCount + skippedCount}。
 */
public class DxfImportService {

    private static final Logger log = LoggerFactory.getLogger(DxfImportService.class);

    private final CoordinateSystemManager coordinateSystemManager;
    private final FeatureTransformer featureTransformer;
    private final int maxDiagnostics;
    private final int maxExpandedEntities;

    public DxfImportService(CoordinateSystemManager coordinateSystemManager) {
        this(coordinateSystemManager, DiagnosticsReporter.DEFAULT_MAX_RECORDS);
    }

    public DxfImportService(CoordinateSystemManager coordinateSystemManager, int maxDiagnostics) {
        this(coordinateSystemManager, maxDiagnostics, BlockReferenceExpander.DEFAULT_MAX_EXPANDED_ENTITIES);
    }

    public DxfImportService(CoordinateSystemManager coordinateSystemManager, int maxDiagnostics, int maxExpandedEntities) {
        this.coordinateSystemManager = coordinateSystemManager;
        this.featureTransformer = new FeatureTransformer(coordinateSystemManager);
        this.maxDiagnostics = maxDiagnostics;
        this.maxExpandedEntities = maxExpandedEntities;
    }

    public ImportResult importContent(String content, ImportOptions options) {
        ImportOptions opts = options == null ? ImportOptions.defaults() : options;
        requireKnownSystem(opts.sourceCrs());
        requireKnownSystem(opts.targetCrs());

        DiagnosticsReporter reporter = new DiagnosticsReporter(maxDiagnostics);
        DxfDocument document = DxfStructureParser.parse(content, reporter);
        int decodeFailures = document.rawEntityCount() - document.entities().size();

        List<PlacedEntity> placed;
        int expansionFailures = 0;
        if (opts.expandBlocks()) {
            ExpansionResult expansion = new BlockReferenceExpander(reporter, maxExpandedEntities).expand(document);
            placed = expansion.entities();
            expansionFailures = expansion.droppedCount();
        } else {
            placed = document.entities().stream().map(PlacedEntity::topLevel).toList();
        }
        int expandedTotal = decodeFailures + expansionFailures + placed.size();
        List<PlacedEntity> kept = filterLayers(placed, document, opts, reporter);
        int skipped = placed.size() - kept.size();
        placed = kept;

        GeometryConverter converter = new GeometryConverter(reporter);
        List<GeoJsonFeature> features = converter.convertAll(placed);
        int conversionFailures = placed.size() - features.size();

        String detected = CoordinateSystemDetector.detectFromFeatures(features).orElse(null);
        if (detected != null) {
            reporter.info(DiagnosticCode.CRS_DETECTION, "按坐标范围推断坐标系", DiagnosticsReporter.context("crs", detected));
        }
        String source = opts.sourceCrs() != null ? opts.sourceCrs() : detected;
        String target = null;
        int transformFailures = 0;

        if (opts.targetCrs() != null) {
            if (source == null) {
                reporter.warning(DiagnosticCode.CRS_DETECTION, "无法确定源坐标系，要素保持原始坐标未转换",
                        DiagnosticsReporter.context("targetCrs", opts.targetCrs()));
            } else {
                target = opts.targetCrs();
                List<GeoJsonFeature> transformed = new ArrayList<>(features.size());
                for (GeoJsonFeature feature : features) {
                    try {
                        transformed.add(featureTransformer.transform(feature, source, target));
                    } catch (CoordinateTransformationException e) {
                        transformFailures++;
                        reporter.error(DiagnosticCode.TRANSFORM_ERROR, "坐标转换失败，已丢弃该要素",
                                DiagnosticsReporter.context("id", feature.property("id"), "type", feature.property("type"),
                                        "from", e.getFromSystem(), "to", e.getToSystem(), "point", e.getPoint()));
                    }
                }
                features = transformed;
            }
        }

        Map<String, Integer> layerCounts = new LinkedHashMap<>();
        for (GeoJsonFeature feature : features) {
            layerCounts.merge(String.valueOf(feature.property("layer")), 1, Integer::sum);
        }

        int failed = decodeFailures + expansionFailures + conversionFailures + transformFailures;
        ImportResult result = new ImportResult(
                features,
                Bounds.of(features),
                detected,
                source,
                target,
                expandedTotal,
                features.size(),
                failed,
                skipped,
                layerCounts,
                reporter.list(),
                reporter.suppressedCount()
        );
        log.info("DXF 导入完成：{}，source={}, target={}, diagnostics={}",
                result.summary(), source, target, reporter.list().size() + reporter.suppressedCount());
        return result;
    }

    /**
     * 只解析结构（头变量/图层/图块/实体统计），不做几何与坐标转换。
     */
    public StructureSummary readStructure(String content) {
        DiagnosticsReporter reporter = new DiagnosticsReporter(maxDiagnostics);
        DxfDocument document = DxfStructureParser.parse(content, reporter);
        DxfHeader header = document.header();

        String detected = null;
        if (header.extMin() != null && header.extMax() != null) {
            detected = CoordinateSystemDetector.detect(new Bounds(
                    header.extMin().x(), header.extMin().y(), header.extMax().x(), header.extMax().y())).orElse(null);
        }

        List<StructureSummary.BlockSummary> blocks = new ArrayList<>(document.blocks().size());
        for (DxfBlock block : document.blocks()) {
            blocks.add(new StructureSummary.BlockSummary(block.name(), block.layer(), block.entities().size(),
                    toArray(block.basePoint())));
        }
        return new StructureSummary(
                header.version(),
                header.unitsName(),
                toArray(header.extMin()),
                toArray(header.extMax()),
                detected,
                document.sectionNames(),
                new ArrayList<>(document.layers().values()),
                blocks,
                document.entityCounts(),
                document.rawEntityCount(),
                reporter.list()
        );
    }

    private List<PlacedEntity> filterLayers(List<PlacedEntity> placed, DxfDocument document, ImportOptions opts,
                                            DiagnosticsReporter reporter) {
        if (opts.includeHiddenLayers() && opts.layers().isEmpty()) {
            return placed;
        }
        Set<String> reportedHidden = new LinkedHashSet<>();
        List<PlacedEntity> kept = new ArrayList<>(placed.size());
        for (PlacedEntity p : placed) {
            DxfEntity entity = p.entity();
            String layerName = entity.attributes().layer() == null ? EntityAttributes.DEFAULT_LAYER : entity.attributes().layer();
            if (!opts.layers().isEmpty() && !opts.layers().contains(layerName)) {
                continue;
            }
            DxfLayer layer = document.layer(layerName);
            if (!opts.includeHiddenLayers() && layer != null && layer.hidden()) {
                if (reportedHidden.add(layerName)) {
                    reporter.info(DiagnosticCode.LAYER_HIDDEN, "图层已关闭或冻结，其实体未导入",
                            DiagnosticsReporter.context("layer", layerName, "frozen", layer.frozen(), "visible", layer.visible()));
                }
                continue;
            }
            kept.add(p);
        }
        return kept;
    }

    private void requireKnownSystem(String code) {
        if (code != null && coordinateSystemManager.getSystemDefinition(code) == null) {
            throw new IllegalArgumentException("未注册的坐标系: " + code);
        }
    }

    private static double[] toArray(Vector3 v) {
        return v == null ? null : new double[]{v.x(), v.y(), v.z()};
    }
}
