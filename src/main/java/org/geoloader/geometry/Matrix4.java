package org.geoloader.geometry;

import java.util.Arrays;

/**
 * 4×4 仿射变换矩阵（行主序，不可变）。
 * <p>
 * 组合约定：{@code a.multiply(b)} 表示 {@code a∘b}，作用于点时从右往左生效；
 * 因此 {@code translate(..).multiply(rotateZ(..)).multiply(scale(..))} 先缩放、再旋转、最后平移。
 * <p>
 * 本类构造出的矩阵最后一行恒为 {@code [0,0,0,1]}。
 * <p>
 * 建模假设：{@link #getScaleFactor()} 与 {@link #transformAngle(double)} 只考虑绕 Z 轴旋转且无剪切的情况，
 * 对 CAD 图块放置足够；非等比缩放的图块会让推导出的半径产生形变（近似值）。
 */
public final class Matrix4 {

    private static final Matrix4 IDENTITY = new Matrix4(new double[]{
            1, 0, 0, 0,
            0, 1, 0, 0,
            0, 0, 1, 0,
            0, 0, 0, 1
    });

    private final double[] m;

    private Matrix4(double[] values) {
        this.m = values;
    }

    public static Matrix4 identity() {
        return IDENTITY;
    }

    public static Matrix4 translate(double x, double y, double z) {
        return new Matrix4(new double[]{
                1, 0, 0, x,
                0, 1, 0, y,
                0, 0, 1, z,
                0, 0, 0, 1
        });
    }

    public static Matrix4 translate(Vector3 offset) {
        return translate(offset.x(), offset.y(), offset.z());
    }

    /**
     * 绕 Z 轴旋转（角度制，逆时针为正）。
     */
    public static Matrix4 rotateZ(double degrees) {
        double rad = Math.toRadians(degrees);
        double cos = Math.cos(rad);
        double sin = Math.sin(rad);
        return new Matrix4(new double[]{
                cos, -sin, 0, 0,
                sin, cos, 0, 0,
                0, 0, 1, 0,
                0, 0, 0, 1
        });
    }

    public static Matrix4 scale(double x, double y, double z) {
        return new Matrix4(new double[]{
                x, 0, 0, 0,
                0, y, 0, 0,
                0, 0, z, 0,
                0, 0, 0, 1
        });
    }

    public double get(int row, int col) {
        return m[row * 4 + col];
    }

    /**
     * 矩阵乘法 {@code this × other}。
     */
    public Matrix4 multiply(Matrix4 other) {
        double[] r = new double[16];
        for (int i = 0; i < 4; i++) {
            for (int j = 0; j < 4; j++) {
                double sum = 0;
                for (int k = 0; k < 4; k++) {
                    sum += m[i * 4 + k] * other.m[k * 4 + j];
                }
                r[i * 4 + j] = sum;
            }
        }
        return new Matrix4(r);
    }

    /**
     * 以齐次坐标变换点并做透视除法。
     *
     * @return 变换结果；输入或结果非有限值时返回 null（由调用方决定丢弃该点/实体）
     */
    public Vector3 transformPoint(Vector3 point) {
        if (point == null || !point.isFinite()) {
            return null;
        }
        double x = point.x();
        double y = point.y();
        double z = point.z();
        double rx = m[0] * x + m[1] * y + m[2] * z + m[3];
        double ry = m[4] * x + m[5] * y + m[6] * z + m[7];
        double rz = m[8] * x + m[9] * y + m[10] * z + m[11];
        double rw = m[12] * x + m[13] * y + m[14] * z + m[15];
        if (rw != 0 && rw != 1) {
            rx /= rw;
            ry /= rw;
            rz /= rw;
        }
        if (!Double.isFinite(rx) || !Double.isFinite(ry) || !Double.isFinite(rz)) {
            return null;
        }
        return new Vector3(rx, ry, rz);
    }

    /**
     * 只应用线性部分（不含平移），用于方向向量（椭圆长轴、射线方向等）。
     */
    public Vector3 transformVector(Vector3 vector) {
        if (vector == null || !vector.isFinite()) {
            return null;
        }
        double x = vector.x();
        double y = vector.y();
        double z = vector.z();
        Vector3 result = new Vector3(
                m[0] * x + m[1] * y + m[2] * z,
                m[4] * x + m[5] * y + m[6] * z,
                m[8] * x + m[9] * y + m[10] * z
        );
        return result.isFinite() ? result : null;
    }

    /**
     * 近似的统一缩放系数：局部 X/Y 基向量变换后长度的平均值。
     */
    public double getScaleFactor() {
        double scaleX = Math.sqrt(m[0] * m[0] + m[4] * m[4] + m[8] * m[8]);
        double scaleY = Math.sqrt(m[1] * m[1] + m[5] * m[5] + m[9] * m[9]);
        return (scaleX + scaleY) / 2;
    }

    /**
     * 把矩阵的净 Z 轴旋转 {@code atan2(m10, m00)} 叠加到角度上（角度制，结果归一化到 [0, 360)）。
     */
    public double transformAngle(double degrees) {
        double rotation = Math.toDegrees(Math.atan2(m[4], m[0]));
        double result = (degrees + rotation) % 360;
        return result < 0 ? result + 360 : result;
    }

    /**
     * XY 平面线性部分的行列式；小于 0 表示镜像（圆弧方向会反转）。
     */
    public double determinantXY() {
        return m[0] * m[5] - m[1] * m[4];
    }

    public boolean isMirroring() {
        return determinantXY() < 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Matrix4 other)) {
            return false;
        }
        return Arrays.equals(m, other.m);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(m);
    }

    @Override
    public String toString() {
        return "Matrix4" + Arrays.toString(m);
    }
}
