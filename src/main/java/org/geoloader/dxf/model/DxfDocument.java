package org.geoloader.dxf.model;

import java.util.List;
import java.util.Map;

/**
 * 解析后的 DXF 文档。
 *
 * @param header         头变量
 * @param layers         图层名 -> 图层（保留文件中的顺序，至少包含 "0"）
 * @param blocks         图块定义（保留文件中的顺序）
 * @param entities       ENTITIES 段中已解码的实体
 * @param sectionNames   出现过的段名
 * @param rawEntityCount ENTITIES 段中出现的实体条数（含解码失败/不支持的）
 * @param entityCounts   按 DXF 类型名统计的出现次数（含解码失败/不支持的）
 */
public record DxfDocument(
        DxfHeader header,
        Map<String, DxfLayer> layers,
        List<DxfBlock> blocks,
        List<DxfEntity> entities,
        List<String> sectionNames,
        int rawEntityCount,
        Map<String, Integer> entityCounts
) {

    public DxfDocument {
        entities = List.copyOf(entities);
        blocks = List.copyOf(blocks);
        sectionNames = List.copyOf(sectionNames);
    }

    public DxfLayer layer(String name) {
        return layers.get(name);
    }
}
