package org.geoloader.dxf;

import org.geoloader.diagnostics.DiagnosticCode;
import org.geoloader.diagnostics.DiagnosticsReporter;
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
 * 实体解码器：原始组码段 -> 已校验的 {@link DxfEntity}。
 * <p>
 * 约定：解码本身从不抛异常。字段缺失或不合法时记录一条具体的诊断（例如 {@code INVALID_POSITION}）并返回 null，
 * 调用方只丢弃这一个实体，继续处理文件的其余部分。
 * <p>
 * 组码参考（只列出本解码器读取的部分）：
 * <ul>
 *   <li>通用：5 句柄、8 图层、6 线型、62 颜色、370 线宽、38 标高、39 厚度、60 可见性、210/220/230 拉伸方向</li>
 *   <li>LWPOLYLINE：70 标志（bit1 闭合）、10/20 顶点、42 凸度</li>
 *   <li>ARC：50/51 起止角（角度制）；ELLIPSE：11/21/31 长轴、40 比例、41/42 起止参数（弧度）</li>
 *   <li>INSERT：2 图块名、41/42/43 缩放、50 旋转、70/71 列/行数、44/45 列/行间距</li>
 *   <li>HATCH：2 图案名、70 实心填充、91 边界路径数、92 路径标志（bit2 多段线路径）</li>
 * </ul>
 */
public final class DxfEntityDecoder {

    private DxfEntityDecoder() {
    }

    private static final int HATCH_PATH_POLYLINE = 2;

    public static DxfEntity decode(RawEntity raw, DiagnosticsReporter reporter) {
        EntityAttributes attributes = attributes(raw);
        return switch (raw.type()) {
            case "POINT" -> decodePoint(raw, attributes, reporter);
            case "LINE" -> decodeLine(raw, attributes, reporter);
            case "LWPOLYLINE" -> decodeLwPolyline(raw, attributes, reporter);
            case "POLYLINE" -> decodePolyline(raw, attributes, reporter);
            case "CIRCLE" -> decodeCircle(raw, attributes, reporter);
            case "ARC" -> decodeArc(raw, attributes, reporter);
            case "ELLIPSE" -> decodeEllipse(raw, attributes, reporter);
            case "SPLINE" -> decodeSpline(raw, attributes, reporter);
            case "INSERT" -> decodeInsert(raw, attributes, reporter);
            case "TEXT", "MTEXT" -> decodeText(raw, attributes, reporter);
            case "HATCH" -> decodeHatch(raw, attributes, reporter);
            case "3DFACE", "SOLID" -> decodeFace(raw, attributes, reporter);
            case "DIMENSION" -> decodeDimension(raw, attributes, reporter);
            case "LEADER", "MLEADER", "MULTILEADER" -> decodeLeader(raw, attributes, reporter);
            case "RAY", "XLINE" -> decodeRay(raw, attributes, reporter);
            default -> {
                reporter.warning(DiagnosticCode.UNSUPPORTED_ENTITY, "不支持的实体类型，已跳过", context(raw));
                yield null;
            }
        };
    }

    static EntityAttributes attributes(RawEntity raw) {
        Vector3 extrusion = raw.point(210);
        return new EntityAttributes(
                raw.string(8),
                raw.string(5),
                raw.optionalInteger(62),
                raw.string(6),
                raw.optionalInteger(370),
                finiteOr(raw.number(38, 0), 0),
                finiteOr(raw.number(39, 0), 0),
                raw.integer(60, 0) != 1,
                (extrusion != null && extrusion.isFinite()) ? extrusion : null
        );
    }

    private static DxfEntity decodePoint(RawEntity raw, EntityAttributes attributes, DiagnosticsReporter reporter) {
        Vector3 position = raw.point(10);
        if (!valid(position)) {
            return reject(reporter, DiagnosticCode.INVALID_POSITION, "POINT 坐标缺失或非有限值", raw);
        }
        return new PointEntity(attributes, position);
    }

    private static DxfEntity decodeLine(RawEntity raw, EntityAttributes attributes, DiagnosticsReporter reporter) {
        Vector3 start = raw.point(10);
        Vector3 end = raw.point(11);
        if (!valid(start) || !valid(end)) {
            return reject(reporter, DiagnosticCode.INVALID_POSITION, "LINE 起点/终点缺失或非有限值", raw);
        }
        return new LineEntity(attributes, start, end);
    }

    private static DxfEntity decodeLwPolyline(RawEntity raw, EntityAttributes attributes, DiagnosticsReporter reporter) {
        double elevation = attributes.elevation();
        List<PolylineVertex> vertices = new ArrayList<>();
        double x = Double.NaN;
        double y = Double.NaN;
        double bulge = 0;
        boolean open = false;
        for (GroupCode gc : raw.codes()) {
            switch (gc.code()) {
                case 10 -> {
                    if (open) {
                        vertices.add(new PolylineVertex(new Vector3(x, y, elevation), bulge));
                    }
                    x = gc.asDouble();
                    y = Double.NaN;
                    bulge = 0;
                    open = true;
                }
                case 20 -> y = gc.asDouble();
                case 42 -> bulge = gc.asDouble();
                default -> {
                }
            }
        }
        if (open) {
            vertices.add(new PolylineVertex(new Vector3(x, y, elevation), bulge));
        }
        boolean closed = (raw.integer(70, 0) & 1) != 0;
        return polyline(raw, attributes, vertices, closed, reporter);
    }

    private static DxfEntity decodePolyline(RawEntity raw, EntityAttributes attributes, DiagnosticsReporter reporter) {
        List<PolylineVertex> vertices = new ArrayList<>();
        for (RawEntity child : raw.children()) {
            if (!"VERTEX".equals(child.type())) {
                continue;
            }
            // bit16：样条拟合的框架控制点，不属于实际折线
            if ((child.integer(70, 0) & 16) != 0) {
                continue;
            }
            Vector3 p = child.point(10);
            vertices.add(new PolylineVertex(p == null ? new Vector3(Double.NaN, Double.NaN, 0) : p, child.number(42, 0)));
        }
        boolean closed = (raw.integer(70, 0) & 1) != 0;
        return polyline(raw, attributes, vertices, closed, reporter);
    }

    private static DxfEntity polyline(RawEntity raw, EntityAttributes attributes, List<PolylineVertex> vertices,
                                      boolean closed, DiagnosticsReporter reporter) {
        if (vertices.size() < 2) {
            return reject(reporter, DiagnosticCode.INVALID_VERTICES, raw.type() + " 顶点少于 2 个", raw);
        }
        for (PolylineVertex v : vertices) {
            if (!v.point().isFinite() || !Double.isFinite(v.bulge())) {
                return reject(reporter, DiagnosticCode.INVALID_VERTICES, raw.type() + " 存在非有限顶点", raw);
            }
        }
        return new PolylineEntity(attributes, raw.type(), vertices, closed);
    }

    private static DxfEntity decodeCircle(RawEntity raw, EntityAttributes attributes, DiagnosticsReporter reporter) {
        Vector3 center = raw.point(10);
        if (!valid(center)) {
            return reject(reporter, DiagnosticCode.INVALID_POSITION, "CIRCLE 圆心缺失或非有限值", raw);
        }
        double radius = raw.number(40, Double.NaN);
        if (!(Double.isFinite(radius) && radius > 0)) {
            return reject(reporter, DiagnosticCode.INVALID_RADIUS, "CIRCLE 半径必须大于 0", raw);
        }
        return new CircleEntity(attributes, center, radius);
    }

    private static DxfEntity decodeArc(RawEntity raw, EntityAttributes attributes, DiagnosticsReporter reporter) {
        Vector3 center = raw.point(10);
        if (!valid(center)) {
            return reject(reporter, DiagnosticCode.INVALID_POSITION, "ARC 圆心缺失或非有限值", raw);
        }
        double radius = raw.number(40, Double.NaN);
        if (!(Double.isFinite(radius) && radius > 0)) {
            return reject(reporter, DiagnosticCode.INVALID_RADIUS, "ARC 半径必须大于 0", raw);
        }
        double start = raw.number(50, Double.NaN);
        double end = raw.number(51, Double.NaN);
        if (!Double.isFinite(start) || !Double.isFinite(end)) {
            return reject(reporter, DiagnosticCode.INVALID_ANGLES, "ARC 起止角缺失或非有限值", raw);
        }
        return new ArcEntity(attributes, center, radius, start, end);
    }

    private static DxfEntity decodeEllipse(RawEntity raw, EntityAttributes attributes, DiagnosticsReporter reporter) {
        Vector3 center = raw.point(10);
        Vector3 major = raw.point(11);
        double ratio = raw.number(40, Double.NaN);
        double start = raw.number(41, 0);
        double end = raw.number(42, Math.PI * 2);
        if (!valid(center) || !valid(major) || major.length() == 0) {
            return reject(reporter, DiagnosticCode.INVALID_ELLIPSE, "ELLIPSE 中心或长轴缺失/为零", raw);
        }
        if (!(Double.isFinite(ratio) && ratio > 0 && ratio <= 1)) {
            return reject(reporter, DiagnosticCode.INVALID_ELLIPSE, "ELLIPSE 轴比必须在 (0, 1] 内", raw);
        }
        if (!Double.isFinite(start) || !Double.isFinite(end)) {
            return reject(reporter, DiagnosticCode.INVALID_ELLIPSE, "ELLIPSE 起止参数非有限值", raw);
        }
        return new EllipseEntity(attributes, center, major, ratio, start, end);
    }

    private static DxfEntity decodeSpline(RawEntity raw, EntityAttributes attributes, DiagnosticsReporter reporter) {
        List<Vector3> control = raw.points(10);
        List<Vector3> fit = raw.points(11);
        if (control.size() < 2 && fit.size() < 2) {
            return reject(reporter, DiagnosticCode.INVALID_VERTICES, "SPLINE 控制点/拟合点少于 2 个", raw);
        }
        if (!allFinite(control) || !allFinite(fit)) {
            return reject(reporter, DiagnosticCode.INVALID_VERTICES, "SPLINE 存在非有限点", raw);
        }
        int degree = raw.integer(71, 3);
        boolean closed = (raw.integer(70, 0) & 1) != 0;
        return new SplineEntity(attributes, control, fit, degree, closed);
    }

    private static DxfEntity decodeInsert(RawEntity raw, EntityAttributes attributes, DiagnosticsReporter reporter) {
        String name = raw.string(2);
        Vector3 position = raw.point(10);
        if (name == null || name.isBlank()) {
            return reject(reporter, DiagnosticCode.INVALID_INSERT, "INSERT 缺少图块名", raw);
        }
        if (!valid(position)) {
            return reject(reporter, DiagnosticCode.INVALID_INSERT, "INSERT 插入点缺失或非有限值", raw);
        }
        Vector3 scale = new Vector3(raw.number(41, 1), raw.number(42, 1), raw.number(43, 1));
        double rotation = raw.number(50, 0);
        if (!scale.isFinite() || !Double.isFinite(rotation)) {
            return reject(reporter, DiagnosticCode.INVALID_INSERT, "INSERT 缩放/旋转非有限值", raw);
        }
        Map<String, String> attribs = new LinkedHashMap<>();
        for (RawEntity child : raw.children()) {
            if ("ATTRIB".equals(child.type()) && child.string(2) != null) {
                String value = child.string(1);
                attribs.put(child.string(2), value == null ? "" : DxfTextFormatting.expandSpecialCharacters(value));
            }
        }
        return new InsertEntity(
                attributes,
                name,
                position,
                scale,
                rotation,
                raw.integer(70, 1),
                raw.integer(71, 1),
                finiteOr(raw.number(44, 0), 0),
                finiteOr(raw.number(45, 0), 0),
                attribs
        );
    }

    private static DxfEntity decodeText(RawEntity raw, EntityAttributes attributes, DiagnosticsReporter reporter) {
        Vector3 position = raw.point(10);
        if (!valid(position)) {
            return reject(reporter, DiagnosticCode.INVALID_POSITION, raw.type() + " 插入点缺失或非有限值", raw);
        }
        boolean mtext = "MTEXT".equals(raw.type());
        String text;
        double rotation;
        if (mtext) {
            // 长文本按 250 字符切块：前面的块在 3 号组码里，最后一块在 1 号组码里
            StringBuilder sb = new StringBuilder();
            for (GroupCode gc : raw.codes()) {
                if (gc.code() == 3) {
                    sb.append(gc.value());
                }
            }
            String tail = raw.string(1);
            if (tail != null) {
                sb.append(tail);
            }
            text = (tail == null && sb.length() == 0) ? null : DxfTextFormatting.cleanMText(sb.toString());
            Vector3 direction = raw.point(11);
            rotation = (raw.has(50) || !valid(direction))
                    ? raw.number(50, 0)
                    : Math.toDegrees(Math.atan2(direction.y(), direction.x()));
        } else {
            text = DxfTextFormatting.expandSpecialCharacters(raw.string(1));
            rotation = raw.number(50, 0);
        }
        if (text == null || text.isBlank()) {
            return reject(reporter, DiagnosticCode.INVALID_TEXT, raw.type() + " 缺少文字内容", raw);
        }
        return new TextEntity(
                attributes,
                raw.type(),
                position,
                text,
                finiteOr(raw.number(40, 0), 0),
                finiteOr(rotation, 0),
                raw.optionalNumber(41),
                raw.string(7)
        );
    }

    private static DxfEntity decodeFace(RawEntity raw, EntityAttributes attributes, DiagnosticsReporter reporter) {
        Vector3 p1 = raw.point(10);
        Vector3 p2 = raw.point(11);
        Vector3 p3 = raw.point(12);
        Vector3 p4 = raw.point(13);
        List<Vector3> vertices = new ArrayList<>(4);
        if ("SOLID".equals(raw.type())) {
            // SOLID 的第 3/4 点是“交叉”顺序，按 1-2-4-3 才是多边形环
            addIfPresent(vertices, p1);
            addIfPresent(vertices, p2);
            addIfPresent(vertices, p4);
            addIfPresent(vertices, p3);
        } else {
            addIfPresent(vertices, p1);
            addIfPresent(vertices, p2);
            addIfPresent(vertices, p3);
            addIfPresent(vertices, p4);
        }
        // 三角形常以重复第 4 点的方式存储
        if (vertices.size() == 4 && vertices.get(3).equals(vertices.get(2))) {
            vertices.remove(3);
        } else if (vertices.size() == 4 && vertices.get(3).equals(vertices.get(0))) {
            vertices.remove(3);
        }
        if (vertices.size() < 3 || !allFinite(vertices)) {
            return reject(reporter, DiagnosticCode.INVALID_VERTICES, raw.type() + " 需要 3~4 个有限顶点", raw);
        }
        return new FaceEntity(attributes, raw.type(), vertices);
    }

    private static DxfEntity decodeDimension(RawEntity raw, EntityAttributes attributes, DiagnosticsReporter reporter) {
        Vector3 definition = raw.point(10);
        Vector3 textPosition = raw.point(11);
        if (!valid(definition)) {
            definition = null;
        }
        if (!valid(textPosition)) {
            textPosition = null;
        }
        if (definition == null && textPosition == null) {
            return reject(reporter, DiagnosticCode.INVALID_POSITION, "DIMENSION 缺少定义点/文字位置", raw);
        }
        Double measurement = raw.optionalNumber(42);
        if (measurement != null && !Double.isFinite(measurement)) {
            measurement = null;
        }
        return new DimensionEntity(
                attributes,
                definition,
                textPosition,
                raw.string(2),
                raw.integer(70, 0) & 7,
                measurement,
                raw.string(1)
        );
    }

    private static DxfEntity decodeLeader(RawEntity raw, EntityAttributes attributes, DiagnosticsReporter reporter) {
        List<Vector3> vertices;
        String type = "LEADER".equals(raw.type()) ? "LEADER" : "MLEADER";
        if ("LEADER".equals(type)) {
            vertices = raw.points(10);
        } else {
            vertices = leaderLineVertices(raw);
            if (vertices.size() < 2) {
                vertices = raw.points(10);
            }
        }
        if (vertices.size() < 2 || !allFinite(vertices)) {
            return reject(reporter, DiagnosticCode.INVALID_VERTICES, type + " 顶点少于 2 个或非有限", raw);
        }
        return new LeaderEntity(attributes, type, vertices);
    }

    /**
     * MLEADER 的引线顶点位于 {@code 304 LEADER_LINE{ ... 305 }} 子块内。
     */
    private static List<Vector3> leaderLineVertices(RawEntity raw) {
        List<Vector3> vertices = new ArrayList<>();
        boolean inside = false;
        double x = Double.NaN;
        boolean pendingX = false;
        for (GroupCode gc : raw.codes()) {
            if (gc.code() == 304 && gc.value().trim().startsWith("LEADER_LINE")) {
                inside = true;
                continue;
            }
            if (inside && gc.code() == 305) {
                inside = false;
                pendingX = false;
                continue;
            }
            if (!inside) {
                continue;
            }
            if (gc.code() == 10) {
                x = gc.asDouble();
                pendingX = true;
            } else if (gc.code() == 20 && pendingX) {
                vertices.add(new Vector3(x, gc.asDouble(), 0));
                pendingX = false;
            } else if (gc.code() == 30 && !vertices.isEmpty() && !pendingX) {
                Vector3 last = vertices.remove(vertices.size() - 1);
                vertices.add(new Vector3(last.x(), last.y(), gc.asDouble()));
            }
        }
        return vertices;
    }

    private static DxfEntity decodeRay(RawEntity raw, EntityAttributes attributes, DiagnosticsReporter reporter) {
        Vector3 base = raw.point(10);
        Vector3 direction = raw.point(11);
        if (!valid(base) || !valid(direction) || direction.length() == 0) {
            return reject(reporter, DiagnosticCode.INVALID_POSITION, raw.type() + " 基点或方向缺失/为零", raw);
        }
        return new RayEntity(attributes, raw.type(), base, direction);
    }

    // ---------------- HATCH ----------------

    private static DxfEntity decodeHatch(RawEntity raw, EntityAttributes attributes, DiagnosticsReporter reporter) {
        String pattern = raw.string(2);
        if (pattern == null || pattern.isBlank()) {
            return reject(reporter, DiagnosticCode.INVALID_HATCH, "HATCH 缺少图案名", raw);
        }
        boolean solid = raw.integer(70, 0) == 1;

        Cursor cursor = new Cursor(raw.codes());
        GroupCode pathCountCode = cursor.find(91);
        int pathCount = pathCountCode == null ? 0 : pathCountCode.asInt(0);

        List<List<Vector3>> rings = new ArrayList<>();
        for (int p = 0; p < pathCount; p++) {
            GroupCode flagsCode = cursor.find(92);
            if (flagsCode == null) {
                break;
            }
            int flags = flagsCode.asInt(0);
            List<Vector3> ring = (flags & HATCH_PATH_POLYLINE) != 0
                    ? readPolylinePath(cursor)
                    : readEdgePath(cursor);
            ring = normalizeRing(ring);
            if (ring.size() < 3 || !allFinite(ring)) {
                reporter.warning(DiagnosticCode.INVALID_HATCH, "HATCH 边界路径不足 3 个有效点，已忽略该路径",
                        context(raw, "pathIndex", p));
                continue;
            }
            rings.add(ring);
        }
        if (rings.isEmpty()) {
            return reject(reporter, DiagnosticCode.INVALID_HATCH, "HATCH 没有可用的边界路径", raw);
        }
        return new HatchEntity(attributes, pattern.trim(), solid, rings);
    }

    private static List<Vector3> readPolylinePath(Cursor cursor) {
        boolean hasBulge = cursor.optionalInt(72, 0) != 0;
        cursor.optionalInt(73, 1);
        int count = cursor.optionalInt(93, 0);
        List<Vector3> vertices = new ArrayList<>(count);
        List<Double> bulges = new ArrayList<>(count);
        for (int k = 0; k < count; k++) {
            GroupCode x = cursor.find(10);
            GroupCode y = cursor.find(20);
            if (x == null || y == null) {
                break;
            }
            vertices.add(Vector3.of(x.asDouble(), y.asDouble()));
            GroupCode bulge = hasBulge ? cursor.optional(42) : null;
            bulges.add(bulge == null ? 0.0 : bulge.asDouble());
        }
        return Tessellation.bulgedPath(vertices, bulges, true);
    }

    private static List<Vector3> readEdgePath(Cursor cursor) {
        GroupCode countCode = cursor.find(93);
        int edgeCount = countCode == null ? 0 : countCode.asInt(0);
        List<Vector3> ring = new ArrayList<>();
        for (int e = 0; e < edgeCount; e++) {
            GroupCode typeCode = cursor.find(72);
            if (typeCode == null) {
                break;
            }
            switch (typeCode.asInt(0)) {
                case 1 -> {
                    appendDistinct(ring, cursor.point(10));
                    appendDistinct(ring, cursor.point(11));
                }
                case 2 -> {
                    Vector3 center = cursor.point(10);
                    double radius = cursor.number(40);
                    double start = cursor.number(50);
                    double end = cursor.number(51);
                    boolean ccw = cursor.optionalInt(73, 1) != 0;
                    if (center != null) {
                        for (Vector3 v : Tessellation.arc(Vector3.ZERO, radius, start, end)) {
                            // 顺时针边存储的是镜像后的角度
                            appendDistinct(ring, new Vector3(center.x() + v.x(), center.y() + (ccw ? v.y() : -v.y()), 0));
                        }
                    }
                }
                case 3 -> {
                    Vector3 center = cursor.point(10);
                    Vector3 major = cursor.point(11);
                    double ratio = cursor.number(40);
                    double start = cursor.number(50);
                    double end = cursor.number(51);
                    boolean ccw = cursor.optionalInt(73, 1) != 0;
                    if (center != null && major != null) {
                        ring.addAll(distinctTail(ring, Tessellation.ellipse(center, major, ccw ? ratio : -ratio,
                                Math.toRadians(start), Math.toRadians(end))));
                    }
                }
                case 4 -> ring.addAll(distinctTail(ring, readSplineEdge(cursor)));
                default -> {
                    // 未知边类型：跳过
                }
            }
        }
        return ring;
    }

    private static List<Vector3> readSplineEdge(Cursor cursor) {
        cursor.optionalInt(94, 3);
        boolean rational = cursor.optionalInt(73, 0) != 0;
        cursor.optionalInt(74, 0);
        int knots = cursor.optionalInt(95, 0);
        int controls = cursor.optionalInt(96, 0);
        for (int k = 0; k < knots; k++) {
            cursor.optional(40);
        }
        List<Vector3> control = new ArrayList<>(controls);
        for (int k = 0; k < controls; k++) {
            Vector3 p = cursor.point(10);
            if (p == null) {
                break;
            }
            control.add(p);
            if (rational) {
                cursor.optional(42);
            }
        }
        int fits = cursor.optionalInt(97, 0);
        List<Vector3> fit = new ArrayList<>(fits);
        for (int k = 0; k < fits; k++) {
            Vector3 p = cursor.point(11);
            if (p == null) {
                break;
            }
            fit.add(p);
        }
        return fit.size() >= 2 ? fit : control;
    }

    private static List<Vector3> normalizeRing(List<Vector3> ring) {
        List<Vector3> result = new ArrayList<>(ring.size());
        for (Vector3 v : ring) {
            appendDistinct(result, v);
        }
        if (result.size() > 1 && result.get(0).equals(result.get(result.size() - 1))) {
            result.remove(result.size() - 1);
        }
        return result;
    }

    private static void appendDistinct(List<Vector3> ring, Vector3 v) {
        if (v == null) {
            return;
        }
        if (ring.isEmpty() || !ring.get(ring.size() - 1).equals(v)) {
            ring.add(v);
        }
    }

    private static List<Vector3> distinctTail(List<Vector3> ring, List<Vector3> points) {
        if (!ring.isEmpty() && !points.isEmpty() && ring.get(ring.size() - 1).equals(points.get(0))) {
            return points.subList(1, points.size());
        }
        return points;
    }

    /**
     * 顺序读取 HATCH 组码的游标：{@link #find(int)} 向前搜索，{@link #optional(int)} 只看下一个组码。
     */
    private static final class Cursor {
        private final List<GroupCode> codes;
        private int pos;

        Cursor(List<GroupCode> codes) {
            this.codes = codes;
        }

        GroupCode find(int code) {
            for (int i = pos; i < codes.size(); i++) {
                if (codes.get(i).code() == code) {
                    pos = i + 1;
                    return codes.get(i);
                }
            }
            pos = codes.size();
            return null;
        }

        GroupCode optional(int code) {
            if (pos < codes.size() && codes.get(pos).code() == code) {
                return codes.get(pos++);
            }
            return null;
        }

        int optionalInt(int code, int fallback) {
            GroupCode gc = optional(code);
            return gc == null ? fallback : gc.asInt(fallback);
        }

        double number(int code) {
            GroupCode gc = find(code);
            return gc == null ? Double.NaN : gc.asDouble();
        }

        Vector3 point(int xCode) {
            GroupCode x = find(xCode);
            GroupCode y = find(xCode + 10);
            if (x == null || y == null) {
                return null;
            }
            return Vector3.of(x.asDouble(), y.asDouble());
        }
    }

    // ---------------- helpers ----------------

    private static DxfEntity reject(DiagnosticsReporter reporter, DiagnosticCode code, String message, RawEntity raw) {
        reporter.warning(code, message, context(raw));
        return null;
    }

    static Map<String, Object> context(RawEntity raw, Object... extra) {
        Map<String, Object> ctx = DiagnosticsReporter.context("entityType", raw.type(), "handle", raw.string(5), "line", raw.line());
        ctx.putAll(DiagnosticsReporter.context(extra));
        return ctx;
    }

    private static boolean valid(Vector3 v) {
        return v != null && v.isFinite();
    }

    private static boolean allFinite(List<Vector3> points) {
        for (Vector3 p : points) {
            if (p == null || !p.isFinite()) {
                return false;
            }
        }
        return true;
    }

    private static void addIfPresent(List<Vector3> list, Vector3 v) {
        if (v != null) {
            list.add(v);
        }
    }

    private static double finiteOr(double value, double fallback) {
        return Double.isFinite(value) ? value : fallback;
    }
}
