package org.geoloader.dxf.block;

import org.geoloader.diagnostics.DiagnosticCode;
import org.geoloader.diagnostics.DiagnosticsReporter;
import org.geoloader.dxf.model.DxfBlock;
import org.geoloader.dxf.model.DxfDocument;
import org.geoloader.dxf.model.DxfEntity;
import org.geoloader.dxf.model.EntityAttributes;
import org.geoloader.dxf.model.EntityType;
import org.geoloader.dxf.model.InsertEntity;
import org.geoloader.geometry.Matrix4;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 图块引用展开：把嵌套的 INSERT 解析为绝对坐标下的扁平实体列表。
 * <p>
 * 每个 INSERT 的局部变换（从右往左生效）：
 * <pre>
 * T = Translate(position) ∘ RotateZ(rotation) ∘ Translate(col·colSpacing, row·rowSpacing) ∘ Scale(scale) ∘ Translate(-basePoint)
 * </pre>
 * 子实体在 {@code parent × T} 下递归展开。
 * <p>
 * 循环引用检测：每条分支携带自己的“正在展开”图块名路径（不可变拷贝，不共享全局状态）。
 * 图块名再次出现在路径上时记录 {@code CIRCULAR_REFERENCE}（附完整路径），只停止这一条分支，兄弟分支照常展开；
 * 因此任意长度的环都能终止，不需要额外的深度计数。
 * <p>
 * 图块中图层为 "0" 的实体继承插入点（INSERT）的图层。
 * <p>
 * 展开输出总数有上限（{@code app.geo.max-expanded-entities}），防止少量嵌套 INSERT 指数级放大；
 * 超出后停止展开，记录一条 {@code INVALID_INSERT} 错误，未展开的部分计入 {@link ExpansionResult#droppedCount()}。
 */
public class BlockReferenceExpander {

    private static final Logger log = LoggerFactory.getLogger(BlockReferenceExpander.class);

    /**
     * 单个 INSERT 的阵列单元上限（行 × 列），超出部分截断并告警。
     */
    public static final int MAX_ARRAY_CELLS = 10_000;

    /**
     * 一次展开允许输出的实体总数缺省上限。
     */
    public static final int DEFAULT_MAX_EXPANDED_ENTITIES = 1_000_000;

    private final DiagnosticsReporter reporter;
    private final int maxExpandedEntities;

    public BlockReferenceExpander(DiagnosticsReporter reporter) {
        this(reporter, DEFAULT_MAX_EXPANDED_ENTITIES);
    }

    public BlockReferenceExpander(DiagnosticsReporter reporter, int maxExpandedEntities) {
        this.reporter = reporter;
        this.maxExpandedEntities = Math.max(1, maxExpandedEntities);
    }

    public ExpansionResult expand(DxfDocument document) {
        BlockRegistry registry = BlockRegistry.of(document.blocks(), reporter);
        return expand(document.entities(), registry);
    }

    public ExpansionResult expand(List<DxfEntity> entities, BlockRegistry registry) {
        Expansion state = new Expansion();
        for (DxfEntity entity : entities) {
            if (entity.type() == EntityType.INSERT) {
                expandInsert((InsertEntity) entity, entity.attributes(), Matrix4.identity(), List.of(), registry, state);
            } else {
                state.out.add(PlacedEntity.topLevel(entity));
            }
        }
        log.debug("图块展开完成：输入 {} 个实体，输出 {} 个实体，丢弃 {} 个，截断={}",
                entities.size(), state.out.size(), state.dropped, state.truncated);
        return new ExpansionResult(state.out, state.dropped, state.truncated);
    }

    private void expandInsert(InsertEntity insert,
                              EntityAttributes insertAttributes,
                              Matrix4 parent,
                              List<String> path,
                              BlockRegistry registry,
                              Expansion state) {
        if (state.truncated) {
            state.dropped++;
            return;
        }
        String name = insert.blockName();
        DxfBlock block = registry.get(name);
        if (block == null) {
            state.dropped++;
            reporter.warning(DiagnosticCode.MISSING_BLOCK, "引用的图块不存在，已跳过该分支",
                    DiagnosticsReporter.context("block", name, "handle", insert.attributes().handle(), "path", path));
            return;
        }
        if (path.contains(name)) {
            state.dropped++;
            List<String> cycle = append(path, name);
            reporter.warning(DiagnosticCode.CIRCULAR_REFERENCE, "检测到图块循环引用，已停止该分支：" + String.join(" -> ", cycle),
                    DiagnosticsReporter.context("block", name, "path", cycle));
            return;
        }
        List<String> branchPath = append(path, name);

        int columns = insert.columnCount();
        int rows = insert.rowCount();
        if ((long) columns * rows > MAX_ARRAY_CELLS) {
            reporter.warning(DiagnosticCode.INVALID_INSERT, "INSERT 阵列过大，已截断",
                    DiagnosticsReporter.context("block", name, "rows", rows, "columns", columns, "maxCells", MAX_ARRAY_CELLS));
            rows = Math.max(1, Math.min(rows, MAX_ARRAY_CELLS / Math.max(1, Math.min(columns, MAX_ARRAY_CELLS))));
            columns = Math.min(columns, MAX_ARRAY_CELLS);
        }

        Matrix4 placement = Matrix4.translate(insert.position())
                .multiply(Matrix4.rotateZ(insert.rotation()));
        Matrix4 local = Matrix4.scale(insert.scale().x(), insert.scale().y(), insert.scale().z())
                .multiply(Matrix4.translate(block.basePoint().multiply(-1)));
        List<DxfEntity> children = block.entities();
        int cells = rows * columns;

        for (int cellIndex = 0; cellIndex < cells; cellIndex++) {
            int row = cellIndex / columns;
            int col = cellIndex % columns;
            state.dropped += block.rejectedEntities();
            Matrix4 cell = Matrix4.translate(col * insert.columnSpacing(), row * insert.rowSpacing(), 0);
            Matrix4 transform = parent.multiply(placement).multiply(cell).multiply(local);
            for (int childIndex = 0; childIndex < children.size(); childIndex++) {
                DxfEntity child = children.get(childIndex);
                EntityAttributes attributes = child.attributes().inheritLayer(insertAttributes.layer());
                if (child.type() == EntityType.INSERT) {
                    expandInsert((InsertEntity) child, attributes, transform, branchPath, registry, state);
                    if (state.truncated) {
                        state.dropped += remainingUnits(children.size(), childIndex + 1, cells, cellIndex, block);
                        return;
                    }
                    continue;
                }
                if (state.out.size() >= maxExpandedEntities) {
                    truncate(state, name, branchPath);
                    state.dropped += remainingUnits(children.size(), childIndex, cells, cellIndex, block);
                    return;
                }
                DxfEntity placed = EntityTransformer.transform(child, transform, attributes);
                if (placed == null) {
                    state.dropped++;
                    reporter.warning(DiagnosticCode.TRANSFORM_POINT_FAILED, "图块内实体变换后出现非有限坐标，已丢弃",
                            DiagnosticsReporter.context("block", name, "entityType", child.dxfType(),
                                    "handle", child.attributes().handle(), "path", branchPath));
                    continue;
                }
                state.out.add(new PlacedEntity(placed, branchPath));
            }
        }
    }

    private void truncate(Expansion state, String block, List<String> path) {
        state.truncated = true;
        reporter.error(DiagnosticCode.INVALID_INSERT, "图块展开结果超过上限，已停止展开，其余部分计为失败",
                DiagnosticsReporter.context("block", block, "path", path, "maxExpandedEntities", maxExpandedEntities));
    }

    /**
     * 当前单元从 {@code fromChild} 起剩余的子实体，加上其后所有单元的子实体（含解码失败的部分）；嵌套 INSERT 各按 1 计。
     */
    private static long remainingUnits(int childCount, int fromChild, int cells, int cellIndex, DxfBlock block) {
        long laterCells = cells - cellIndex - 1L;
        return (childCount - fromChild) + laterCells * (childCount + block.rejectedEntities());
    }

    /**
     * 单次展开的可变状态；每次 {@link #expand} 调用独占一份。
     */
    private static final class Expansion {
        private final List<PlacedEntity> out = new ArrayList<>();
        private int dropped;
        private boolean truncated;
    }

    private static List<String> append(List<String> path, String name) {
        List<String> next = new ArrayList<>(path.size() + 1);
        next.addAll(path);
        next.add(name);
        return List.copyOf(next);
    }
}
