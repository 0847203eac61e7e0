package org.geoloader.geometry;

import java.util.ArrayList;
import java.util.List;

/**
 * 曲线离散化：圆/圆弧/椭圆固定 32 段（含端点 33 个点），凸度圆弧段按扫角比例分段。
 */
public final class Tessellation {

    private Tessellation() {
    }

    public static final int SEGMENTS = 32;

    private static final double FULL_TURN_DEG = 360.0;
    private static final double FULL_TURN_RAD = Math.PI * 2;

    /**
     * 整圆：33 个点，最后一个点是第一个点的拷贝（sin(2π) 不严格等于 0，不能依赖三角函数闭合）。
     */
    public static List<Vector3> circle(Vector3 center, double radius) {
        List<Vector3> points = arc(center, radius, 0, FULL_TURN_DEG);
        points.set(points.size() - 1, points.get(0));
        return points;
    }

    /**
     * 逆时针圆弧（角度制）；{@code end <= start} 时补一整圈。
     */
    public static List<Vector3> arc(Vector3 center, double radius, double startDeg, double endDeg) {
        double sweep = endDeg - startDeg;
        if (sweep <= 0) {
            sweep += FULL_TURN_DEG;
        }
        List<Vector3> points = new ArrayList<>(SEGMENTS + 1);
        for (int i = 0; i <= SEGMENTS; i++) {
            double angle = Math.toRadians(startDeg + sweep * i / SEGMENTS);
            points.add(new Vector3(
                    center.x() + radius * Math.cos(angle),
                    center.y() + radius * Math.sin(angle),
                    center.z()));
        }
        return points;
    }

    /**
     * 椭圆（参数为弧度）；短轴 = 长轴逆时针旋转 90° 再乘以 ratio。
     */
    public static List<Vector3> ellipse(Vector3 center, Vector3 majorAxis, double ratio, double startParam, double endParam) {
        double span = endParam - startParam;
        if (span <= 0) {
            span += FULL_TURN_RAD;
        }
        double minorX = -majorAxis.y() * ratio;
        double minorY = majorAxis.x() * ratio;
        List<Vector3> points = new ArrayList<>(SEGMENTS + 1);
        for (int i = 0; i <= SEGMENTS; i++) {
            double t = startParam + span * i / SEGMENTS;
            double cos = Math.cos(t);
            double sin = Math.sin(t);
            points.add(new Vector3(
                    center.x() + majorAxis.x() * cos + minorX * sin,
                    center.y() + majorAxis.y() * cos + minorY * sin,
                    center.z()));
        }
        return points;
    }

    /**
     * 凸度圆弧段的中间点（不含两个端点）。
     * <p>
     * bulge = tan(θ/4)，正值逆时针；分段数 {@code ceil(|θ| / 2π × 32)}，至少 1 段。
     */
    public static List<Vector3> bulgeSegment(Vector3 from, Vector3 to, double bulge) {
        List<Vector3> points = new ArrayList<>();
        double dx = to.x() - from.x();
        double dy = to.y() - from.y();
        double chord = Math.hypot(dx, dy);
        if (bulge == 0 || chord == 0 || !Double.isFinite(bulge)) {
            return points;
        }
        double theta = 4 * Math.atan(bulge);
        // 圆心位于弦的左法线方向（bulge<0 时自然落到右侧）
        double offset = (chord / 2) * (1 - bulge * bulge) / (2 * bulge);
        double cx = (from.x() + to.x()) / 2 - dy / chord * offset;
        double cy = (from.y() + to.y()) / 2 + dx / chord * offset;
        double radius = Math.hypot(from.x() - cx, from.y() - cy);
        double startAngle = Math.atan2(from.y() - cy, from.x() - cx);

        int segments = Math.max(1, (int) Math.ceil(Math.abs(theta) / FULL_TURN_RAD * SEGMENTS));
        for (int i = 1; i < segments; i++) {
            double f = (double) i / segments;
            double angle = startAngle + theta * f;
            points.add(new Vector3(
                    cx + radius * Math.cos(angle),
                    cy + radius * Math.sin(angle),
                    from.z() + (to.z() - from.z()) * f));
        }
        return points;
    }

    /**
     * 带凸度的顶点序列展开为折线；closed 时最后一个顶点到第一个顶点的段也参与展开（不重复首点）。
     */
    public static List<Vector3> bulgedPath(List<Vector3> vertices, List<Double> bulges, boolean closed) {
        List<Vector3> points = new ArrayList<>();
        int n = vertices.size();
        for (int i = 0; i < n; i++) {
            Vector3 current = vertices.get(i);
            points.add(current);
            boolean hasNext = i + 1 < n || closed;
            if (!hasNext) {
                break;
            }
            double bulge = i < bulges.size() ? bulges.get(i) : 0;
            if (bulge != 0) {
                points.addAll(bulgeSegment(current, vertices.get((i + 1) % n), bulge));
            }
        }
        return points;
    }
}
