package org.geoloader.dto;

import org.geoloader.crs.CoordinateSystemDefinition;

import java.util.List;

/**
 * {@code crs_list_systems} 的返回结果（按代码排序）。
 */
public record CrsSystemsResult(List<CoordinateSystemDefinition> systems) {
}
