package org.geoloader.dxf;

import java.util.List;

/**
 * 一个命名段（HEADER/TABLES/BLOCKS/ENTITIES/...）。
 *
 * @param name       段名（大写）
 * @param codes      段内的组码对，不含 SECTION/段名/ENDSEC 标记本身
 * @param terminated 是否以 ENDSEC 正常结束
 */
public record DxfSection(String name, List<GroupCode> codes, boolean terminated) {

    public DxfSection {
        codes = List.copyOf(codes);
    }
}
