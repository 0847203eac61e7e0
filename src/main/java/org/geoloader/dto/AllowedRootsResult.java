package org.geoloader.dto;

import java.util.List;

/**
 * {@code geo_list_roots} 的返回结果。
 *
 * @param roots 允许读取 DXF 的根目录白名单
 */
public record AllowedRootsResult(List<AllowedRoot> roots) {
}
