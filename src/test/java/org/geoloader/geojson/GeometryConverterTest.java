package org.geoloader.geojson;

import org.geoloader.diagnostics.DiagnosticCode;
import org.geoloader.diagnostics.DiagnosticsReporter;
import org.geoloader.dto.geojson.Bounds;
import org.geoloader.dto.geojson.GeoJsonFeature;
import org.geoloader.dto.geojson.LineStringGeometry;
import org.geoloader.dto.geojson.MultiPolygonGeometry;
import org.geoloader.dto.geojson.PointGeometry;
import org.geoloader.dto.geojson.PolygonGeometry;
import org.geoloader.dxf.block.PlacedEntity;
import org.geoloader.dxf.model.ArcEntity;
import org.geoloader.dxf.model.CircleEntity;
import org.geoloader.dxf.model.EllipseEntity;
import org.geoloader.dxf.model.EntityAttributes;
import org.geoloader.dxf.model.HatchEntity;
import org.geoloader.dxf.model.InsertEntity;
import org.geoloader.dxf.model.PointEntity;
import org.geoloader.dxf.model.PolylineEntity;
import org.geoloader.dxf.model.PolylineVertex;
import org.geoloader.dxf.model.RayEntity;
import org.geoloader.dxf.model.SplineEntity;
import org.geoloader.dxf.model.TextEntity;
import org.geoloader.geometry.Vector3;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GeometryConverterTest {

    private static final double EPS = 1e-9;

    private final DiagnosticsReporter reporter = new DiagnosticsReporter();
    private final GeometryConverter converter = new GeometryConverter(reporter);

    private static final EntityAttributes ATTRS =
            new EntityAttributes("Survey", "A1", 5, "CONTINUOUS", 13, 0, 0, true, null);

    private static PolylineEntity polyline(boolean closed, double... xy) {
        List<PolylineVertex> vertices = new ArrayList<>();
        for (int i = 0; i < xy.length; i += 2) {
            vertices.add(new PolylineVertex(Vector3.of(xy[i], xy[i + 1]), 0));
        }
        return new PolylineEntity(ATTRS, "LWPOLYLINE", vertices, closed);
    }

    @Test
    void point_becomesPointWithBaseProperties() {
        GeoJsonFeature feature = converter.convert(new PointEntity(EntityAttributes.defaults(), new Vector3(1, 2, 0)));

        assertThat(feature.type()).isEqualTo("Feature");
        assertThat(feature.geometry()).isInstanceOf(PointGeometry.class);
        assertThat(((PointGeometry) feature.geometry()).coordinates()).containsExactly(1.0, 2.0);
        assertThat(feature.property("type")).isEqualTo("POINT");
        assertThat(feature.property("layer")).isEqualTo("0");
        assertThat(feature.properties()).doesNotContainKeys("elevation", "thickness", "visible", "blockPath");
    }

    @Test
    void styleAttributesAreCopiedToProperties() {
        GeoJsonFeature feature = converter.convert(polyline(false, 0, 0, 1, 1));

        assertThat(feature.properties())
                .containsEntry("id", "A1")
                .containsEntry("layer", "Survey")
                .containsEntry("color", 5)
                .containsEntry("lineType", "CONTINUOUS")
                .containsEntry("lineWeight", 13)
                .containsEntry("closed", false)
                .containsEntry("vertexCount", 2);
    }

    @Test
    void closedPolyline_becomesExplicitlyClosedPolygon() {
        GeoJsonFeature feature = converter.convert(polyline(true, 1, 2, 3, 4, 5, 6));

        List<double[]> ring = ((PolygonGeometry) feature.geometry()).coordinates().get(0);
        assertThat(ring).hasSize(4);
        assertThat(ring.get(0)).containsExactly(1.0, 2.0);
        assertThat(ring.get(3)).containsExactly(1.0, 2.0);
    }

    @Test
    void closedPolylineWithTwoDistinctPoints_staysLineString() {
        GeoJsonFeature feature = converter.convert(polyline(true, 0, 0, 1, 0));

        assertThat(feature.geometry()).isInstanceOf(LineStringGeometry.class);
    }

    @Test
    void circle_becomesThirtyThreePointRing() {
        GeoJsonFeature feature = converter.convert(new CircleEntity(ATTRS, Vector3.ZERO, 1));

        List<double[]> ring = ((PolygonGeometry) feature.geometry()).coordinates().get(0);
        assertThat(ring).hasSize(33);
        assertThat(ring.get(32)).containsExactly(ring.get(0));
        assertThat(feature.property("radius")).isEqualTo(1.0);
    }

    @Test
    void arc_quarterRunsFromRadiusOnXToRadiusOnY() {
        GeoJsonFeature feature = converter.convert(new ArcEntity(ATTRS, Vector3.ZERO, 3, 0, 90));

        List<double[]> line = ((LineStringGeometry) feature.geometry()).coordinates();
        assertThat(line).hasSize(33);
        assertThat(line.get(0)[0]).isCloseTo(3, within(EPS));
        assertThat(line.get(0)[1]).isCloseTo(0, within(EPS));
        assertThat(line.get(32)[0]).isCloseTo(0, within(EPS));
        assertThat(line.get(32)[1]).isCloseTo(3, within(EPS));
    }

    @Test
    void ellipse_fullIsPolygonPartialIsLineString() {
        GeoJsonFeature full = converter.convert(
                new EllipseEntity(ATTRS, Vector3.ZERO, Vector3.of(2, 0), 0.5, 0, Math.PI * 2));
        GeoJsonFeature half = converter.convert(
                new EllipseEntity(ATTRS, Vector3.ZERO, Vector3.of(2, 0), 0.5, 0, Math.PI));

        List<double[]> ring = ((PolygonGeometry) full.geometry()).coordinates().get(0);
        assertThat(ring.get(ring.size() - 1)).containsExactly(ring.get(0));
        assertThat(half.geometry()).isInstanceOf(LineStringGeometry.class);
    }

    @Test
    void closedSpline_appendsFirstControlPoint() {
        GeoJsonFeature feature = converter.convert(new SplineEntity(ATTRS,
                List.of(Vector3.of(0, 0), Vector3.of(1, 1), Vector3.of(2, 0)), List.of(), 3, true));

        List<double[]> line = ((LineStringGeometry) feature.geometry()).coordinates();
        assertThat(line).hasSize(4);
        assertThat(line.get(3)).containsExactly(0.0, 0.0);
        assertThat(feature.property("degree")).isEqualTo(3);
    }

    @Test
    void unexpandedInsert_isMarkerPointWithAttributes() {
        InsertEntity insert = new InsertEntity(ATTRS, "DOOR", Vector3.of(5, 6), null, 30, 1, 1, 0, 0,
                Map.of("TAG", "D-01"));

        GeoJsonFeature feature = converter.convert(insert);

        assertThat(feature.geometry()).isInstanceOf(PointGeometry.class);
        assertThat(feature.properties()).containsEntry("blockName", "DOOR").containsEntry("rotation", 30.0);
        assertThat(feature.property("attributes")).isEqualTo(Map.of("TAG", "D-01"));
    }

    @Test
    void text_carriesTextProperties() {
        GeoJsonFeature feature = converter.convert(
                new TextEntity(ATTRS, "TEXT", Vector3.of(1, 1), "Hello", 2.5, 45, null, "Standard"));

        assertThat(feature.properties())
                .containsEntry("text", "Hello")
                .containsEntry("height", 2.5)
                .containsEntry("rotation", 45.0)
                .containsEntry("style", "Standard")
                .doesNotContainKey("width");
    }

    @Test
    void hatchWithSeveralRings_becomesMultiPolygon() {
        HatchEntity hatch = new HatchEntity(ATTRS, "SOLID", true, List.of(
                List.of(Vector3.of(0, 0), Vector3.of(1, 0), Vector3.of(1, 1)),
                List.of(Vector3.of(5, 5), Vector3.of(6, 5), Vector3.of(6, 6))));

        GeoJsonFeature feature = converter.convert(hatch);

        MultiPolygonGeometry multi = (MultiPolygonGeometry) feature.geometry();
        assertThat(multi.coordinates()).hasSize(2);
        assertThat(multi.coordinates().get(0).get(0)).hasSize(4);
        assertThat(feature.property("ringCount")).isEqualTo(2);
    }

    @Test
    void xline_isFiniteSegmentInBothDirections() {
        GeoJsonFeature feature = converter.convert(
                new RayEntity(ATTRS, "XLINE", Vector3.ZERO, Vector3.of(2, 0)));

        List<double[]> line = ((LineStringGeometry) feature.geometry()).coordinates();
        assertThat(line.get(0)[0]).isCloseTo(-GeometryConverter.INFINITE_LINE_LENGTH, within(EPS));
        assertThat(line.get(1)[0]).isCloseTo(GeometryConverter.INFINITE_LINE_LENGTH, within(EPS));
        assertThat(feature.property("infinite")).isEqualTo(true);
    }

    @Test
    void blockPath_isRecordedForExpandedEntities() {
        GeoJsonFeature feature = converter.convert(
                new PlacedEntity(new PointEntity(ATTRS, Vector3.of(1, 1)), List.of("A", "B")));

        assertThat(feature.property("blockPath")).isEqualTo("A/B");
    }

    @Test
    void nonFiniteGeometry_isDroppedWithConversionError() {
        GeoJsonFeature feature = converter.convert(new CircleEntity(ATTRS, Vector3.ZERO, Double.POSITIVE_INFINITY));

        assertThat(feature).isNull();
        assertThat(reporter.contains(DiagnosticCode.CONVERSION_ERROR)).isTrue();
        assertThat(reporter.hasErrors()).isTrue();
    }

    @Test
    void bounds_containEveryCoordinate() {
        List<GeoJsonFeature> features = converter.convertAll(List.of(
                PlacedEntity.topLevel(new CircleEntity(ATTRS, Vector3.of(10, 10), 2)),
                PlacedEntity.topLevel(polyline(false, -3, 4, 7, -1))));

        Bounds bounds = Bounds.of(features);

        assertThat(bounds.minX()).isCloseTo(-3, within(EPS));
        assertThat(bounds.minY()).isCloseTo(-1, within(EPS));
        assertThat(bounds.maxX()).isCloseTo(12, within(EPS));
        assertThat(bounds.maxY()).isCloseTo(12, within(EPS));
        for (GeoJsonFeature f : features) {
            f.geometry().forEachPosition(p -> assertThat(bounds.contains(p[0], p[1])).isTrue());
        }
    }

    @Test
    void bounds_ofNothingIsNull() {
        assertThat(Bounds.of(List.of())).isNull();
    }
}
