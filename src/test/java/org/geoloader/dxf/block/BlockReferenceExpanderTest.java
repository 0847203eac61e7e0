package org.geoloader.dxf.block;

import org.geoloader.diagnostics.Diagnostic;
import org.geoloader.diagnostics.DiagnosticCode;
import org.geoloader.diagnostics.DiagnosticsReporter;
import org.geoloader.dxf.model.ArcEntity;
import org.geoloader.dxf.model.DxfBlock;
import org.geoloader.dxf.model.DxfEntity;
import org.geoloader.dxf.model.EntityAttributes;
import org.geoloader.dxf.model.InsertEntity;
import org.geoloader.dxf.model.LineEntity;
import org.geoloader.dxf.model.PointEntity;
import org.geoloader.dxf.model.PolylineEntity;
import org.geoloader.dxf.model.PolylineVertex;
import org.geoloader.geometry.Vector3;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BlockReferenceExpanderTest {

    private static final double EPS = 1e-9;

    private final DiagnosticsReporter reporter = new DiagnosticsReporter();
    private final BlockReferenceExpander expander = new BlockReferenceExpander(reporter);

    private static EntityAttributes onLayer(String layer) {
        return new EntityAttributes(layer, null, null, null, null, 0, 0, true, null);
    }

    private static PointEntity point(double x, double y) {
        return new PointEntity(EntityAttributes.defaults(), Vector3.of(x, y));
    }

    private static InsertEntity insert(String block, double x, double y) {
        return new InsertEntity(EntityAttributes.defaults(), block, Vector3.of(x, y), null, 0, 1, 1, 0, 0, Map.of());
    }

    private static DxfBlock block(String name, Vector3 base, DxfEntity... entities) {
        return new DxfBlock(name, "0", base, List.of(entities));
    }

    private ExpansionResult expandResult(List<DxfEntity> entities, DxfBlock... blocks) {
        return expander.expand(entities, BlockRegistry.of(List.of(blocks), reporter));
    }

    private List<PlacedEntity> expand(List<DxfEntity> entities, DxfBlock... blocks) {
        return expandResult(entities, blocks).entities();
    }

    private static Vector3 position(PlacedEntity placed) {
        return ((PointEntity) placed.entity()).position();
    }

    @Test
    void topLevelEntitiesPassThroughUntouched() {
        PointEntity p = point(1, 2);

        List<PlacedEntity> out = expand(List.of(p));

        assertThat(out).hasSize(1);
        assertThat(out.get(0).entity()).isSameAs(p);
        assertThat(out.get(0).blockPath()).isEmpty();
    }

    @Test
    void insert_subtractsBasePointThenTranslates() {
        List<PlacedEntity> out = expand(List.of(insert("B", 10, 10)),
                block("B", Vector3.of(1, 1), point(2, 1)));

        assertThat(out).hasSize(1);
        assertThat(position(out.get(0))).isEqualTo(Vector3.of(11, 10));
        assertThat(out.get(0).blockPath()).containsExactly("B");
    }

    @Test
    void insert_appliesScaleThenRotation() {
        InsertEntity insert = new InsertEntity(EntityAttributes.defaults(), "L", Vector3.of(5, 5),
                new Vector3(2, 2, 1), 90, 1, 1, 0, 0, Map.of());
        DxfBlock block = block("L", Vector3.ZERO,
                new LineEntity(EntityAttributes.defaults(), Vector3.of(0, 0), Vector3.of(1, 0)));

        LineEntity line = (LineEntity) expand(List.of(insert), block).get(0).entity();

        assertThat(line.start().x()).isCloseTo(5, within(EPS));
        assertThat(line.start().y()).isCloseTo(5, within(EPS));
        assertThat(line.end().x()).isCloseTo(5, within(EPS));
        assertThat(line.end().y()).isCloseTo(7, within(EPS));
    }

    @Test
    void nestedInserts_composeTransformsAndRecordPath() {
        List<PlacedEntity> out = expand(List.of(insert("A", 10, 0)),
                block("A", Vector3.ZERO, insert("B", 1, 0)),
                block("B", Vector3.ZERO, point(0, 0)));

        assertThat(out).hasSize(1);
        assertThat(position(out.get(0))).isEqualTo(Vector3.of(11, 0));
        assertThat(out.get(0).blockPath()).containsExactly("A", "B");
    }

    @Test
    @Timeout(5)
    void mutualReference_terminatesWithCircularReferenceDiagnostic() {
        ExpansionResult result = expandResult(List.of(insert("A", 0, 0)),
                block("A", Vector3.ZERO, point(1, 0), insert("B", 0, 0)),
                block("B", Vector3.ZERO, point(2, 0), insert("A", 0, 0)));

        assertThat(result.entities()).hasSize(2);
        assertThat(result.droppedCount()).isEqualTo(1);
        assertThat(reporter.contains(DiagnosticCode.CIRCULAR_REFERENCE)).isTrue();
        Diagnostic cycle = reporter.list().stream()
                .filter(d -> d.code() == DiagnosticCode.CIRCULAR_REFERENCE)
                .findFirst()
                .orElseThrow();
        assertThat(cycle.message()).contains("A -> B -> A");
        assertThat(cycle.context().get("path")).isEqualTo(List.of("A", "B", "A"));
    }

    @Test
    @Timeout(5)
    void selfReference_isDetected() {
        List<PlacedEntity> out = expand(List.of(insert("SELF", 0, 0)),
                block("SELF", Vector3.ZERO, point(0, 0), insert("SELF", 1, 1)));

        assertThat(out).hasSize(1);
        assertThat(reporter.contains(DiagnosticCode.CIRCULAR_REFERENCE)).isTrue();
    }

    @Test
    @Timeout(5)
    void longCycles_terminate() {
        for (int length = 3; length <= 12; length++) {
            DiagnosticsReporter local = new DiagnosticsReporter();
            List<DxfBlock> blocks = new ArrayList<>();
            for (int i = 0; i < length; i++) {
                String next = "C" + ((i + 1) % length);
                blocks.add(block("C" + i, Vector3.ZERO, point(i, 0), insert(next, 0, 0)));
            }

            List<PlacedEntity> out = new BlockReferenceExpander(local)
                    .expand(List.of(insert("C0", 0, 0)), BlockRegistry.of(blocks, local))
                    .entities();

            assertThat(out).hasSize(length);
            assertThat(local.contains(DiagnosticCode.CIRCULAR_REFERENCE)).isTrue();
        }
    }

    @Test
    void sameBlockInSiblingBranches_isNotACycle() {
        List<PlacedEntity> out = expand(List.of(insert("ROW", 0, 0)),
                block("ROW", Vector3.ZERO, insert("SEAT", 0, 0), insert("SEAT", 5, 0)),
                block("SEAT", Vector3.ZERO, point(0, 0)));

        assertThat(out).extracting(BlockReferenceExpanderTest::position)
                .containsExactly(Vector3.of(0, 0), Vector3.of(5, 0));
        assertThat(reporter.contains(DiagnosticCode.CIRCULAR_REFERENCE)).isFalse();
    }

    @Test
    void missingBlock_skipsOnlyThatBranch() {
        ExpansionResult result = expandResult(List.of(insert("NOPE", 0, 0), point(3, 3)));

        assertThat(result.entities()).hasSize(1);
        assertThat(result.droppedCount()).isEqualTo(1);
        assertThat(result.truncated()).isFalse();
        assertThat(reporter.contains(DiagnosticCode.MISSING_BLOCK)).isTrue();
    }

    @Test
    void blockDecodeRejects_countOncePerInsertedCell() {
        InsertEntity array = new InsertEntity(EntityAttributes.defaults(), "R", Vector3.ZERO,
                null, 0, 3, 1, 10, 0, Map.of());
        DxfBlock withRejects = new DxfBlock("R", "0", Vector3.ZERO, List.of(point(0, 0)), 2);

        ExpansionResult result = expandResult(List.of(array), withRejects);

        assertThat(result.entities()).hasSize(3);
        assertThat(result.droppedCount()).isEqualTo(6);
    }

    @Test
    void nonFiniteTransformResult_isDroppedAndCounted() {
        InsertEntity huge = new InsertEntity(EntityAttributes.defaults(), "H", Vector3.ZERO,
                new Vector3(1e308, 1e308, 1), 0, 1, 1, 0, 0, Map.of());

        ExpansionResult result = expandResult(List.of(huge), block("H", Vector3.ZERO, point(10, 10), point(0, 0)));

        assertThat(result.entities()).hasSize(1);
        assertThat(result.droppedCount()).isEqualTo(1);
        assertThat(reporter.contains(DiagnosticCode.TRANSFORM_POINT_FAILED)).isTrue();
    }

    @Test
    void expansionLimit_stopsAndCountsRemainderAsDropped() {
        BlockReferenceExpander limited = new BlockReferenceExpander(reporter, 5);
        InsertEntity array = new InsertEntity(EntityAttributes.defaults(), "T", Vector3.ZERO,
                null, 0, 4, 1, 10, 0, Map.of());
        DxfBlock block = block("T", Vector3.ZERO, point(0, 0), point(1, 0), point(2, 0));

        ExpansionResult result = limited.expand(List.of(array), BlockRegistry.of(List.of(block), reporter));

        assertThat(result.entities()).hasSize(5);
        assertThat(result.droppedCount()).isEqualTo(7);
        assertThat(result.truncated()).isTrue();
        Diagnostic limit = reporter.list().stream()
                .filter(d -> d.code() == DiagnosticCode.INVALID_INSERT)
                .findFirst()
                .orElseThrow();
        assertThat(limit.context()).containsEntry("maxExpandedEntities", 5);
    }

    @Test
    @Timeout(5)
    void doublingChain_isCutOffByExpansionLimit() {
        // D0 -> 2 x D1 -> ... -> 2 x D30，完整展开为 2^30 个点
        List<DxfBlock> blocks = new ArrayList<>();
        int depth = 30;
        for (int i = 0; i < depth; i++) {
            String next = "D" + (i + 1);
            blocks.add(block("D" + i, Vector3.ZERO, insert(next, 0, 0), insert(next, 1, 0)));
        }
        blocks.add(block("D" + depth, Vector3.ZERO, point(0, 0)));
        BlockReferenceExpander limited = new BlockReferenceExpander(reporter, 1_000);

        ExpansionResult result = limited.expand(List.of(insert("D0", 0, 0), point(5, 5)),
                BlockRegistry.of(blocks, reporter));

        assertThat(result.truncated()).isTrue();
        // 顶层非 INSERT 实体不受展开上限影响
        assertThat(result.entities()).hasSize(1_001);
        assertThat(position(result.entities().get(1_000))).isEqualTo(Vector3.of(5, 5));
        assertThat(result.droppedCount()).isPositive();
        assertThat(reporter.list()).filteredOn(d -> d.code() == DiagnosticCode.INVALID_INSERT).hasSize(1);
    }

    @Test
    void arrayInsert_placesEveryCell() {
        InsertEntity array = new InsertEntity(EntityAttributes.defaults(), "P", Vector3.of(100, 0),
                null, 0, 2, 3, 10, 20, Map.of());

        List<PlacedEntity> out = expand(List.of(array), block("P", Vector3.ZERO, point(0, 0)));

        assertThat(out).extracting(BlockReferenceExpanderTest::position).containsExactlyInAnyOrder(
                Vector3.of(100, 0), Vector3.of(110, 0),
                Vector3.of(100, 20), Vector3.of(110, 20),
                Vector3.of(100, 40), Vector3.of(110, 40));
    }

    @Test
    void oversizedArray_isClamped() {
        InsertEntity array = new InsertEntity(EntityAttributes.defaults(), "P", Vector3.ZERO,
                null, 0, 500, 500, 1, 1, Map.of());

        List<PlacedEntity> out = expand(List.of(array), block("P", Vector3.ZERO, point(0, 0)));

        assertThat(out).hasSizeLessThanOrEqualTo(BlockReferenceExpander.MAX_ARRAY_CELLS);
        assertThat(reporter.contains(DiagnosticCode.INVALID_INSERT)).isTrue();
    }

    @Test
    void layerZeroEntitiesInheritInsertLayer() {
        InsertEntity insert = new InsertEntity(onLayer("Doors"), "D", Vector3.ZERO, null, 0, 1, 1, 0, 0, Map.of());
        DxfBlock block = block("D", Vector3.ZERO,
                new PointEntity(onLayer("0"), Vector3.of(0, 0)),
                new PointEntity(onLayer("Fixed"), Vector3.of(1, 0)));

        List<PlacedEntity> out = expand(List.of(insert), block);

        assertThat(out).extracting(p -> p.entity().attributes().layer()).containsExactly("Doors", "Fixed");
    }

    @Test
    void mirroredInsert_reversesArcsAndBulges() {
        InsertEntity mirror = new InsertEntity(EntityAttributes.defaults(), "M", Vector3.ZERO,
                new Vector3(-1, 1, 1), 0, 1, 1, 0, 0, Map.of());
        ArcEntity arc = new ArcEntity(EntityAttributes.defaults(), Vector3.ZERO, 1, 0, 90);
        PolylineEntity pl = new PolylineEntity(EntityAttributes.defaults(), "LWPOLYLINE",
                List.of(new PolylineVertex(Vector3.of(0, 0), 0.5), new PolylineVertex(Vector3.of(1, 0), 0)), false);

        List<PlacedEntity> out = expand(List.of(mirror), block("M", Vector3.ZERO, arc, pl));

        ArcEntity mirroredArc = (ArcEntity) out.get(0).entity();
        assertThat(mirroredArc.startAngle()).isCloseTo(90, within(EPS));
        assertThat(mirroredArc.endAngle()).isCloseTo(180, within(EPS));
        PolylineEntity mirroredPl = (PolylineEntity) out.get(1).entity();
        assertThat(mirroredPl.vertices().get(0).bulge()).isEqualTo(-0.5);
        assertThat(mirroredPl.vertices().get(1).point().x()).isCloseTo(-1, within(EPS));
    }

    @Test
    void duplicateBlockNames_keepFirstDefinition() {
        BlockRegistry registry = BlockRegistry.of(List.of(
                block("X", Vector3.ZERO, point(1, 1)),
                block("X", Vector3.ZERO, point(2, 2))), reporter);

        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.get("X").entities()).extracting(e -> ((PointEntity) e).position()).containsExactly(Vector3.of(1, 1));
        assertThat(reporter.contains(DiagnosticCode.MALFORMED_DXF)).isTrue();
    }
}
