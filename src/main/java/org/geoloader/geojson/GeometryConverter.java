package org.geoloader.geojson;

import org.geoloader.diagnostics.DiagnosticCode;
import org.geoloader.diagnostics.DiagnosticsReporter;
import org.geoloader.dto.geojson.GeoJsonFeature;
import org.geoloader.dto.geojson.GeoJsonGeometry;
import org.geoloader.dto.geojson.LineStringGeometry;
import org.geoloader.dto.geojson.MultiPolygonGeometry;
import org.geoloader.dto.geojson.PointGeometry;
import org.geoloader.dto.geojson.PolygonGeometry;
import org.geoloader.dxf.block.PlacedEntity;
import org.geoloader.dxf.model.ArcEntity;
import org.geoloader.dxf.model.CircleEntity;
import org.geoloader.dxf.model.DimensionEntity;
import org.geoloader.dxf.model.DxfEntity;
import org.geoloader.dxf.model.EllipseEntity;
import org.geoloader.dxf.model.EntityAttributes;
import org.geoloader.dxf.model.FaceEntity;
import org.geoloader.dxf.model.HatchEntity;
import org.geoloader.dxf.model.InsertEntity;
import org.geoloader.dxf.model.LeaderEntity;
import org.geoloader.dxf.model.LineEntity;
import org.geoloader.dxf.model.PointEntity;
import org.geoloader.dxf.model.PolylineEntity;
import org.geoloader.dxf.model.PolylineVertex;
import org.geoloader.dxf.model.RayEntity;
import org.geoloader.dxf.model.SplineEntity;
import org.geoloader.dxf.model.TextEntity;
import org.geoloader.geometry.Tessellation;
import org.geoloader.geometry.Vector3;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 实体 -> GeoJSON 要素。输入实体应已完成图块展开（处于绝对坐标）。
 * <p>
 * 映射规则：
 * <ul>
 *   <li>Point：POINT、TEXT/MTEXT、INSERT（未展开时作为插入点标记）、DIMENSION（定位点）</li>
 *   <li>LineString：LINE、开放多段线、ARC、开放 ELLIPSE、SPLINE、LEADER/MLEADER、RAY/XLINE</li>
 *   <li>Polygon：闭合多段线、CIRCLE、整椭圆、3DFACE/SOLID、单环 HATCH；多环 HATCH 为 MultiPolygon</li>
 * </ul>
 * 所有环都显式闭合（首点复制到末尾）。任一坐标非有限值时整个要素作废（{@code CONVERSION_ERROR}），不做截断修正。
 */
public class GeometryConverter {

    /**
     * RAY/XLINE 的有限化长度（图形单位）。
     */
    public static final double INFINITE_LINE_LENGTH = 1_000;

    private final DiagnosticsReporter reporter;

    public GeometryConverter(DiagnosticsReporter reporter) {
        this.reporter = reporter;
    }

    public List<GeoJsonFeature> convertAll(List<PlacedEntity> entities) {
        List<GeoJsonFeature> features = new ArrayList<>(entities.size());
        for (PlacedEntity placed : entities) {
            GeoJsonFeature feature = convert(placed);
            if (feature != null) {
                features.add(feature);
            }
        }
        return features;
    }

    public GeoJsonFeature convert(DxfEntity entity) {
        return convert(PlacedEntity.topLevel(entity));
    }

    /**
     * @return 要素；几何非法时返回 null 并记录 {@code CONVERSION_ERROR}
     */
    public GeoJsonFeature convert(PlacedEntity placed) {
        DxfEntity entity = placed.entity();
        Map<String, Object> properties = baseProperties(entity);
        if (!placed.blockPath().isEmpty()) {
            properties.put("blockPath", String.join("/", placed.blockPath()));
        }
        GeoJsonGeometry geometry = toGeometry(entity, properties);
        if (geometry == null || !isFinite(geometry)) {
            reporter.error(DiagnosticCode.CONVERSION_ERROR, "几何转换失败或包含非有限坐标，已丢弃该要素",
                    DiagnosticsReporter.context("entityType", entity.dxfType(), "handle", entity.attributes().handle(),
                            "layer", entity.attributes().layer()));
            return null;
        }
        return new GeoJsonFeature(geometry, properties);
    }

    private GeoJsonGeometry toGeometry(DxfEntity entity, Map<String, Object> properties) {
        switch (entity.type()) {
            case POINT -> {
                return point(((PointEntity) entity).position());
            }
            case LINE -> {
                LineEntity line = (LineEntity) entity;
                return lineString(List.of(line.start(), line.end()));
            }
            case POLYLINE -> {
                PolylineEntity pl = (PolylineEntity) entity;
                properties.put("closed", pl.closed());
                properties.put("vertexCount", pl.vertices().size());
                List<Vector3> vertices = new ArrayList<>(pl.vertices().size());
                List<Double> bulges = new ArrayList<>(pl.vertices().size());
                for (PolylineVertex v : pl.vertices()) {
                    vertices.add(v.point());
                    bulges.add(v.bulge());
                }
                List<Vector3> path = Tessellation.bulgedPath(vertices, bulges, pl.closed());
                if (pl.closed() && distinctCount(path) >= 3) {
                    return polygon(path);
                }
                return lineString(path);
            }
            case CIRCLE -> {
                CircleEntity c = (CircleEntity) entity;
                properties.put("radius", c.radius());
                return polygon(Tessellation.circle(c.center(), c.radius()));
            }
            case ARC -> {
                ArcEntity a = (ArcEntity) entity;
                properties.put("radius", a.radius());
                properties.put("startAngle", a.startAngle());
                properties.put("endAngle", a.endAngle());
                return lineString(Tessellation.arc(a.center(), a.radius(), a.startAngle(), a.endAngle()));
            }
            case ELLIPSE -> {
                EllipseEntity e = (EllipseEntity) entity;
                properties.put("minorAxisRatio", e.minorAxisRatio());
                List<Vector3> points = Tessellation.ellipse(e.center(), e.majorAxis(), e.minorAxisRatio(),
                        e.startAngle(), e.endAngle());
                if (!e.isFull()) {
                    return lineString(points);
                }
                points.set(points.size() - 1, points.get(0));
                return polygon(points);
            }
            case SPLINE -> {
                SplineEntity s = (SplineEntity) entity;
                properties.put("degree", s.degree());
                List<Vector3> points = new ArrayList<>(s.controlPoints().size() >= 2 ? s.controlPoints() : s.fitPoints());
                properties.put("pointCount", points.size());
                if (s.closed() && !points.get(0).equals(points.get(points.size() - 1))) {
                    points.add(points.get(0));
                }
                return lineString(points);
            }
            case INSERT -> {
                InsertEntity insert = (InsertEntity) entity;
                properties.put("blockName", insert.blockName());
                properties.put("rotation", insert.rotation());
                properties.put("scale", List.of(insert.scale().x(), insert.scale().y(), insert.scale().z()));
                if (!insert.attributeValues().isEmpty()) {
                    properties.put("attributes", insert.attributeValues());
                }
                return point(insert.position());
            }
            case TEXT -> {
                TextEntity t = (TextEntity) entity;
                properties.put("text", t.text());
                properties.put("height", t.height());
                properties.put("rotation", t.rotation());
                if (t.style() != null) {
                    properties.put("style", t.style());
                }
                if (t.width() != null) {
                    properties.put("width", t.width());
                }
                return point(t.position());
            }
            case HATCH -> {
                HatchEntity h = (HatchEntity) entity;
                properties.put("patternName", h.patternName());
                properties.put("solid", h.solid());
                properties.put("ringCount", h.rings().size());
                if (h.rings().size() == 1) {
                    return polygon(h.rings().get(0));
                }
                List<List<List<double[]>>> polygons = new ArrayList<>(h.rings().size());
                for (List<Vector3> ring : h.rings()) {
                    polygons.add(List.of(closedRing(ring)));
                }
                return new MultiPolygonGeometry(polygons);
            }
            case FACE -> {
                return polygon(((FaceEntity) entity).vertices());
            }
            case DIMENSION -> {
                DimensionEntity d = (DimensionEntity) entity;
                properties.put("dimensionType", d.dimensionType());
                if (d.measurement() != null) {
                    properties.put("measurement", d.measurement());
                }
                if (d.text() != null) {
                    properties.put("text", d.text());
                }
                if (d.blockName() != null) {
                    properties.put("blockName", d.blockName());
                }
                return point(d.insertionPoint());
            }
            case LEADER -> {
                LeaderEntity l = (LeaderEntity) entity;
                properties.put("vertexCount", l.vertices().size());
                return lineString(l.vertices());
            }
            case RAY -> {
                RayEntity r = (RayEntity) entity;
                properties.put("infinite", true);
                Vector3 unit = r.direction().multiply(1 / r.direction().length());
                Vector3 far = r.basePoint().add(unit.multiply(INFINITE_LINE_LENGTH));
                Vector3 near = r.bidirectional() ? r.basePoint().subtract(unit.multiply(INFINITE_LINE_LENGTH)) : r.basePoint();
                return lineString(List.of(near, far));
            }
            default -> {
                return null;
            }
        }
    }

    private static Map<String, Object> baseProperties(DxfEntity entity) {
        EntityAttributes a = entity.attributes();
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("id", a.handle());
        properties.put("type", entity.dxfType());
        properties.put("layer", a.layer() == null ? EntityAttributes.DEFAULT_LAYER : a.layer());
        properties.put("color", a.color());
        properties.put("lineType", a.lineType());
        properties.put("lineWeight", a.lineWeight());
        if (a.elevation() != 0) {
            properties.put("elevation", a.elevation());
        }
        if (a.thickness() != 0) {
            properties.put("thickness", a.thickness());
        }
        if (!a.visible()) {
            properties.put("visible", false);
        }
        return properties;
    }

    private static PointGeometry point(Vector3 v) {
        return v == null ? null : PointGeometry.of(v.x(), v.y());
    }

    private static LineStringGeometry lineString(List<Vector3> points) {
        if (points.size() < 2) {
            return null;
        }
        return new LineStringGeometry(positions(points));
    }

    private static PolygonGeometry polygon(List<Vector3> ring) {
        if (distinctCount(ring) < 3) {
            return null;
        }
        return new PolygonGeometry(List.of(closedRing(ring)));
    }

    /**
     * 首尾不相同时复制首点到末尾；已相同（例如整圆）时保持原样。
     */
    static List<double[]> closedRing(List<Vector3> ring) {
        List<double[]> positions = positions(ring);
        double[] first = positions.get(0);
        double[] last = positions.get(positions.size() - 1);
        if (first[0] != last[0] || first[1] != last[1]) {
            positions.add(first.clone());
        }
        return positions;
    }

    private static List<double[]> positions(List<Vector3> points) {
        List<double[]> positions = new ArrayList<>(points.size() + 1);
        for (Vector3 p : points) {
            positions.add(new double[]{p.x(), p.y()});
        }
        return positions;
    }

    private static int distinctCount(List<Vector3> points) {
        List<Vector3> seen = new ArrayList<>();
        for (Vector3 p : points) {
            Vector3 flat = Vector3.of(p.x(), p.y());
            if (!seen.contains(flat)) {
                seen.add(flat);
                if (seen.size() >= 3) {
                    return 3;
                }
            }
        }
        return seen.size();
    }

    private static boolean isFinite(GeoJsonGeometry geometry) {
        boolean[] ok = {true};
        geometry.forEachPosition(p -> {
            if (!Double.isFinite(p[0]) || !Double.isFinite(p[1])) {
                ok[0] = false;
            }
        });
        return ok[0];
    }
}
