package org.geoloader.dxf;

import org.geoloader.diagnostics.DiagnosticCode;
import org.geoloader.diagnostics.DiagnosticsReporter;
import org.geoloader.dxf.model.DxfBlock;
import org.geoloader.dxf.model.DxfDocument;
import org.geoloader.dxf.model.DxfEntity;
import org.geoloader.dxf.model.DxfHeader;
import org.geoloader.dxf.model.DxfLayer;
import org.geoloader.dxf.model.EntityAttributes;
import org.geoloader.geometry.Vector3;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * DXF 文档结构解析：段 -> 头变量/图层表/图块定义/顶层实体。
 * <p>
 * 致命错误（空内容、无有效组码、无段标记）以 {@link DxfParseException} 抛出；其余问题只记录诊断。
 * <p>
 * 实体分组规则：
 * <ul>
 *   <li>每个 {@code (0,TYPE)} 开始一个新实体，直到下一个 {@code (0,...)}。</li>
 *   <li>POLYLINE 之后的 VERTEX 归属该 POLYLINE，直到 SEQEND。</li>
 *   <li>INSERT 之后紧跟的 ATTRIB 归属该 INSERT，直到 SEQEND。</li>
 * </ul>
 */
public final class DxfStructureParser {

    private static final Logger log = LoggerFactory.getLogger(DxfStructureParser.class);

    private DxfStructureParser() {
    }

    public static DxfDocument parse(String content, DiagnosticsReporter reporter) {
        List<GroupCode> pairs = DxfGroupCodeScanner.tokenize(content, reporter);
        List<DxfSection> sections = DxfGroupCodeScanner.sections(pairs, reporter);

        DxfHeader header = DxfHeader.empty();
        Map<String, DxfLayer> layers = new LinkedHashMap<>();
        List<DxfBlock> blocks = new ArrayList<>();
        List<DxfEntity> entities = new ArrayList<>();
        List<String> sectionNames = new ArrayList<>();
        Map<String, Integer> entityCounts = new LinkedHashMap<>();
        int rawEntityCount = 0;

        for (DxfSection section : sections) {
            sectionNames.add(section.name());
            switch (section.name()) {
                case "HEADER" -> header = parseHeader(section.codes());
                case "TABLES" -> layers.putAll(parseLayers(section.codes()));
                case "BLOCKS" -> blocks.addAll(parseBlocks(section.codes(), reporter));
                case "ENTITIES" -> {
                    List<RawEntity> raws = groupEntities(section.codes());
                    rawEntityCount += raws.size();
                    for (RawEntity raw : raws) {
                        entityCounts.merge(raw.type(), 1, Integer::sum);
                        DxfEntity entity = DxfEntityDecoder.decode(raw, reporter);
                        if (entity != null) {
                            entities.add(entity);
                        }
                    }
                }
                default -> {
                    // CLASSES/OBJECTS/THUMBNAILIMAGE 等与几何无关，忽略
                }
            }
        }

        if (!layers.containsKey(EntityAttributes.DEFAULT_LAYER)) {
            Map<String, DxfLayer> withDefault = new LinkedHashMap<>();
            withDefault.put(EntityAttributes.DEFAULT_LAYER, DxfLayer.defaultLayer());
            withDefault.putAll(layers);
            layers = withDefault;
        }

        log.debug("DXF 解析完成：sections={}, layers={}, blocks={}, entities={}/{}",
                sectionNames, layers.size(), blocks.size(), entities.size(), rawEntityCount);
        return new DxfDocument(header, layers, blocks, entities, sectionNames, rawEntityCount, entityCounts);
    }

    static DxfHeader parseHeader(List<GroupCode> codes) {
        Map<String, List<GroupCode>> variables = new LinkedHashMap<>();
        List<GroupCode> current = null;
        for (GroupCode gc : codes) {
            if (gc.code() == 9) {
                current = new ArrayList<>();
                variables.put(gc.value().trim(), current);
            } else if (current != null) {
                current.add(gc);
            }
        }

        Map<String, String> plain = new LinkedHashMap<>();
        variables.forEach((name, values) -> {
            if (!values.isEmpty()) {
                plain.put(name, values.get(0).value());
            }
        });
        String version = firstValue(variables.get("$ACADVER"));
        String units = firstValue(variables.get("$INSUNITS"));
        Integer insUnits = null;
        if (units != null) {
            try {
                insUnits = Integer.parseInt(units.trim());
            } catch (NumberFormatException e) {
                log.debug("忽略无法解析的 $INSUNITS：{}", units);
            }
        }
        return new DxfHeader(version, insUnits,
                headerPoint(variables.get("$EXTMIN")),
                headerPoint(variables.get("$EXTMAX")),
                plain);
    }

    private static String firstValue(List<GroupCode> values) {
        return (values == null || values.isEmpty()) ? null : values.get(0).value().trim();
    }

    private static Vector3 headerPoint(List<GroupCode> values) {
        if (values == null) {
            return null;
        }
        RawEntity holder = new RawEntity("HEADER", values, List.of(), 0);
        Vector3 p = holder.point(10);
        return (p != null && p.isFinite()) ? p : null;
    }

    /**
     * 只读取 LAYER 表：62 颜色（负数表示关闭）、6 线型、370 线宽、70 标志（bit1 冻结，bit4 锁定）。
     */
    static Map<String, DxfLayer> parseLayers(List<GroupCode> codes) {
        Map<String, DxfLayer> layers = new LinkedHashMap<>();
        for (RawEntity entry : groupRuns(codes)) {
            if (!"LAYER".equals(entry.type())) {
                continue;
            }
            String name = entry.string(2);
            if (name == null || name.isBlank()) {
                continue;
            }
            int color = entry.integer(62, 7);
            int flags = entry.integer(70, 0);
            layers.put(name, new DxfLayer(
                    name,
                    Math.abs(color),
                    entry.string(6),
                    entry.optionalInteger(370),
                    color >= 0,
                    (flags & 1) != 0,
                    (flags & 4) != 0
            ));
        }
        return layers;
    }

    static List<DxfBlock> parseBlocks(List<GroupCode> codes, DiagnosticsReporter reporter) {
        List<DxfBlock> blocks = new ArrayList<>();
        List<RawEntity> runs = groupEntities(codes);
        int i = 0;
        while (i < runs.size()) {
            RawEntity run = runs.get(i);
            if (!"BLOCK".equals(run.type())) {
                i++;
                continue;
            }
            String name = run.string(2);
            Vector3 base = run.point(10);
            List<DxfEntity> entities = new ArrayList<>();
            int rejected = 0;
            int j = i + 1;
            while (j < runs.size() && !"ENDBLK".equals(runs.get(j).type()) && !"BLOCK".equals(runs.get(j).type())) {
                DxfEntity entity = DxfEntityDecoder.decode(runs.get(j), reporter);
                if (entity != null) {
                    entities.add(entity);
                } else {
                    rejected++;
                }
                j++;
            }
            if (name == null || name.isBlank()) {
                reporter.warning(DiagnosticCode.MALFORMED_DXF, "BLOCK 缺少名称，已忽略",
                        DiagnosticsReporter.context("line", run.line()));
            } else {
                blocks.add(new DxfBlock(name, run.string(8), (base != null && base.isFinite()) ? base : Vector3.ZERO,
                        entities, rejected));
            }
            i = (j < runs.size() && "ENDBLK".equals(runs.get(j).type())) ? j + 1 : j;
        }
        return blocks;
    }

    /**
     * 按 0 号组码切分，并把 VERTEX/ATTRIB 子实体归并到 POLYLINE/INSERT 下。
     */
    static List<RawEntity> groupEntities(List<GroupCode> codes) {
        List<RawEntity> runs = groupRuns(codes);
        List<RawEntity> result = new ArrayList<>(runs.size());
        int i = 0;
        while (i < runs.size()) {
            RawEntity run = runs.get(i);
            i++;
            String childType = switch (run.type()) {
                case "POLYLINE" -> "VERTEX";
                case "INSERT" -> "ATTRIB";
                default -> null;
            };
            if (childType == null) {
                if (!"SEQEND".equals(run.type())) {
                    result.add(run);
                }
                continue;
            }
            List<RawEntity> children = new ArrayList<>();
            while (i < runs.size() && childType.equals(runs.get(i).type())) {
                children.add(runs.get(i));
                i++;
            }
            if (!children.isEmpty() && i < runs.size() && "SEQEND".equals(runs.get(i).type())) {
                i++;
            }
            result.add(new RawEntity(run.type(), run.codes(), children, run.line()));
        }
        return result;
    }

    private static List<RawEntity> groupRuns(List<GroupCode> codes) {
        List<RawEntity> runs = new ArrayList<>();
        String type = null;
        int line = 0;
        List<GroupCode> current = new ArrayList<>();
        for (GroupCode gc : codes) {
            if (gc.code() == 0) {
                if (type != null) {
                    runs.add(new RawEntity(type, current, List.of(), line));
                }
                type = gc.value().trim().toUpperCase(Locale.ROOT);
                line = gc.line();
                current = new ArrayList<>();
            } else if (type != null) {
                current.add(gc);
            }
        }
        if (type != null) {
            runs.add(new RawEntity(type, current, List.of(), line));
        }
        return runs;
    }
}
