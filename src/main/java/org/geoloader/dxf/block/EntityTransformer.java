package org.geoloader.dxf.block;

import org.geoloader.dxf.model.ArcEntity;
import org.geoloader.dxf.model.CircleEntity;
import org.geoloader.dxf.model.DimensionEntity;
import org.geoloader.dxf.model.DxfEntity;
import org.geoloader.dxf.model.EllipseEntity;
import org.geoloader.dxf.model.EntityAttributes;
import org.geoloader.dxf.model.FaceEntity;
import org.geoloader.dxf.model.HatchEntity;
import org.geoloader.dxf.model.LeaderEntity;
import org.geoloader.dxf.model.LineEntity;
import org.geoloader.dxf.model.PointEntity;
import org.geoloader.dxf.model.PolylineEntity;
import org.geoloader.dxf.model.PolylineVertex;
import org.geoloader.dxf.model.RayEntity;
import org.geoloader.dxf.model.SplineEntity;
import org.geoloader.dxf.model.TextEntity;
import org.geoloader.geometry.Matrix4;
import org.geoloader.geometry.Vector3;

import java.util.ArrayList;
import java.util.List;

/**
 * 把实体整体映射到新的坐标系（图块展开时使用）。
 * <p>
 * 规则：
 * <ul>
 *   <li>点走 {@link Matrix4#transformPoint}，方向向量走 {@link Matrix4#transformVector}。</li>
 *   <li>半径、文字高度乘以 {@link Matrix4#getScaleFactor()}（非等比缩放下为近似值）。</li>
 *   <li>角度走 {@link Matrix4#transformAngle}；镜像变换下圆弧方向反转，起止角互换，凸度取反。</li>
 * </ul>
 * 任一点变换失败（非有限值）时返回 null，由调用方记录诊断并丢弃该实体。
 */
final class EntityTransformer {

    private EntityTransformer() {
    }

    static DxfEntity transform(DxfEntity entity, Matrix4 m, EntityAttributes attributes) {
        boolean mirror = m.isMirroring();
        double scale = m.getScaleFactor();
        switch (entity.type()) {
            case POINT -> {
                Vector3 p = m.transformPoint(((PointEntity) entity).position());
                return p == null ? null : new PointEntity(attributes, p);
            }
            case LINE -> {
                LineEntity line = (LineEntity) entity;
                Vector3 a = m.transformPoint(line.start());
                Vector3 b = m.transformPoint(line.end());
                return (a == null || b == null) ? null : new LineEntity(attributes, a, b);
            }
            case POLYLINE -> {
                PolylineEntity pl = (PolylineEntity) entity;
                List<PolylineVertex> vertices = new ArrayList<>(pl.vertices().size());
                for (PolylineVertex v : pl.vertices()) {
                    Vector3 p = m.transformPoint(v.point());
                    if (p == null) {
                        return null;
                    }
                    vertices.add(new PolylineVertex(p, mirror ? -v.bulge() : v.bulge()));
                }
                return new PolylineEntity(attributes, pl.dxfType(), vertices, pl.closed());
            }
            case CIRCLE -> {
                CircleEntity c = (CircleEntity) entity;
                Vector3 center = m.transformPoint(c.center());
                return center == null ? null : new CircleEntity(attributes, center, c.radius() * scale);
            }
            case ARC -> {
                return transformArc((ArcEntity) entity, m, attributes, scale, mirror);
            }
            case ELLIPSE -> {
                EllipseEntity e = (EllipseEntity) entity;
                Vector3 center = m.transformPoint(e.center());
                Vector3 major = m.transformVector(e.majorAxis());
                if (center == null || major == null || major.length() == 0) {
                    return null;
                }
                // 镜像后参数方向反转：t -> -t
                double start = mirror ? -e.endAngle() : e.startAngle();
                double end = mirror ? -e.startAngle() : e.endAngle();
                return new EllipseEntity(attributes, center, major, e.minorAxisRatio(), start, end);
            }
            case SPLINE -> {
                SplineEntity s = (SplineEntity) entity;
                List<Vector3> control = transformAll(s.controlPoints(), m);
                List<Vector3> fit = transformAll(s.fitPoints(), m);
                return (control == null || fit == null) ? null
                        : new SplineEntity(attributes, control, fit, s.degree(), s.closed());
            }
            case TEXT -> {
                TextEntity t = (TextEntity) entity;
                Vector3 position = m.transformPoint(t.position());
                return position == null ? null : new TextEntity(attributes, t.dxfType(), position, t.text(),
                        t.height() * scale, m.transformAngle(t.rotation()), t.width(), t.style());
            }
            case HATCH -> {
                HatchEntity h = (HatchEntity) entity;
                List<List<Vector3>> rings = new ArrayList<>(h.rings().size());
                for (List<Vector3> ring : h.rings()) {
                    List<Vector3> transformed = transformAll(ring, m);
                    if (transformed == null) {
                        return null;
                    }
                    rings.add(transformed);
                }
                return new HatchEntity(attributes, h.patternName(), h.solid(), rings);
            }
            case FACE -> {
                FaceEntity f = (FaceEntity) entity;
                List<Vector3> vertices = transformAll(f.vertices(), m);
                return vertices == null ? null : new FaceEntity(attributes, f.dxfType(), vertices);
            }
            case DIMENSION -> {
                DimensionEntity d = (DimensionEntity) entity;
                Vector3 def = d.definitionPoint() == null ? null : m.transformPoint(d.definitionPoint());
                Vector3 text = d.textPosition() == null ? null : m.transformPoint(d.textPosition());
                if ((d.definitionPoint() != null && def == null) || (d.textPosition() != null && text == null)) {
                    return null;
                }
                return new DimensionEntity(attributes, def, text, d.blockName(), d.dimensionType(), d.measurement(), d.text());
            }
            case LEADER -> {
                LeaderEntity l = (LeaderEntity) entity;
                List<Vector3> vertices = transformAll(l.vertices(), m);
                return vertices == null ? null : new LeaderEntity(attributes, l.dxfType(), vertices);
            }
            case RAY -> {
                RayEntity r = (RayEntity) entity;
                Vector3 base = m.transformPoint(r.basePoint());
                Vector3 direction = m.transformVector(r.direction());
                return (base == null || direction == null || direction.length() == 0) ? null
                        : new RayEntity(attributes, r.dxfType(), base, direction);
            }
            default -> throw new IllegalStateException("未处理的实体类型: " + entity.type());
        }
    }

    private static DxfEntity transformArc(ArcEntity arc, Matrix4 m, EntityAttributes attributes, double scale, boolean mirror) {
        Vector3 center = m.transformPoint(arc.center());
        if (center == null) {
            return null;
        }
        if (!mirror) {
            return new ArcEntity(attributes, center, arc.radius() * scale,
                    m.transformAngle(arc.startAngle()), m.transformAngle(arc.endAngle()));
        }
        // 镜像：用端点的实际落点求角度，逆时针方向上起止互换
        Vector3 start = m.transformPoint(pointOnCircle(arc.center(), arc.radius(), arc.startAngle()));
        Vector3 end = m.transformPoint(pointOnCircle(arc.center(), arc.radius(), arc.endAngle()));
        if (start == null || end == null) {
            return null;
        }
        return new ArcEntity(attributes, center, arc.radius() * scale, angleOf(center, end), angleOf(center, start));
    }

    private static Vector3 pointOnCircle(Vector3 center, double radius, double degrees) {
        double rad = Math.toRadians(degrees);
        return new Vector3(center.x() + radius * Math.cos(rad), center.y() + radius * Math.sin(rad), center.z());
    }

    private static double angleOf(Vector3 center, Vector3 p) {
        double deg = Math.toDegrees(Math.atan2(p.y() - center.y(), p.x() - center.x()));
        return deg < 0 ? deg + 360 : deg;
    }

    private static List<Vector3> transformAll(List<Vector3> points, Matrix4 m) {
        List<Vector3> result = new ArrayList<>(points.size());
        for (Vector3 p : points) {
            Vector3 t = m.transformPoint(p);
            if (t == null) {
                return null;
            }
            result.add(t);
        }
        return result;
    }
}
