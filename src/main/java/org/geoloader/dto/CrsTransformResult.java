package org.geoloader.dto;

import java.util.List;

/**
 * {@code crs_transform_points} 的返回结果。
 *
 * @param from         源坐标系
 * @param to           目标坐标系
 * @param successCount 成功的点数
 * @param failedCount  失败的点数
 * @param points       逐点结果（与输入顺序一致）
 */
public record CrsTransformResult(
        String from,
        String to,
        int successCount,
        int failedCount,
        List<PointResult> points
) {

    /**
     * 单点结果：成功时 {@code error} 为 null；失败时 {@code x/y} 为 null，不会原样回传输入坐标。
     *
     * @param index    输入中的序号
     * @param sourceX  输入 x（无法解析时为 null）
     * @param sourceY  输入 y（无法解析时为 null）
     * @param x        转换后的 x
     * @param y        转换后的 y
     * @param inBounds 输入点是否位于源坐标系有效范围内
     * @param error    错误信息
     */
    public record PointResult(
            int index,
            Double sourceX,
            Double sourceY,
            Double x,
            Double y,
            Boolean inBounds,
            String error
    ) {
    }
}
