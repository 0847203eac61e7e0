package org.geoloader.dto;

import org.geoloader.importer.StructureSummary;

import java.util.List;

/**
 * {@code dxf_read_structure} 的返回结果。
 *
 * @param rootId    根目录标识
 * @param path      相对 root 的路径
 * @param sizeBytes 文件字节数
 * @param charset   解码使用的字符集
 * @param warnings  读取阶段的告警（例如字符集回退）
 * @param structure 结构摘要
 */
public record DxfStructureResult(
        String rootId,
        String path,
        long sizeBytes,
        String charset,
        List<String> warnings,
        StructureSummary structure
) {
}
