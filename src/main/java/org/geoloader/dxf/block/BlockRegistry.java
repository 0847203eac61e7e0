package org.geoloader.dxf.block;

import org.geoloader.diagnostics.DiagnosticCode;
import org.geoloader.diagnostics.DiagnosticsReporter;
import org.geoloader.dxf.model.DxfBlock;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 图块名 -> 图块定义。名称区分大小写；重名时保留第一个定义并记录警告。
 */
public final class BlockRegistry {

    private final Map<String, DxfBlock> blocks;

    private BlockRegistry(Map<String, DxfBlock> blocks) {
        this.blocks = Collections.unmodifiableMap(blocks);
    }

    public static BlockRegistry of(List<DxfBlock> definitions, DiagnosticsReporter reporter) {
        Map<String, DxfBlock> map = new LinkedHashMap<>();
        for (DxfBlock block : definitions) {
            if (map.putIfAbsent(block.name(), block) != null) {
                reporter.warning(DiagnosticCode.MALFORMED_DXF, "图块重名，仅保留第一个定义",
                        DiagnosticsReporter.context("block", block.name()));
            }
        }
        return new BlockRegistry(map);
    }

    public DxfBlock get(String name) {
        return name == null ? null : blocks.get(name);
    }

    public int size() {
        return blocks.size();
    }
}
