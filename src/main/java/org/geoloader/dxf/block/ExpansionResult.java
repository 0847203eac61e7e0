package org.geoloader.dxf.block;

import java.util.List;

/**
 * 图块展开结果。
 *
 * @param entities     展开后的实体（绝对坐标）
 * @param droppedCount 展开过程中丢弃的实体数：缺失图块/循环引用的 INSERT 各计 1，
 *                     图块内解码失败或变换失败的子实体每个实例计 1，超出展开上限后未展开的部分按单元计数
 * @param truncated    是否因超出展开上限而提前停止
 */
public record ExpansionResult(List<PlacedEntity> entities, int droppedCount, boolean truncated) {

    public ExpansionResult {
        entities = List.copyOf(entities);
    }
}
