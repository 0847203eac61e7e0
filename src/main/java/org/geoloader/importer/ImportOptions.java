package org.geoloader.importer;

import java.util.Set;

/**
 * 导入选项。
 *
 * @param sourceCrs           源坐标系代码；为空时使用按坐标范围推断的结果
 * @param targetCrs           目标坐标系代码；为空时不做坐标转换
 * @param expandBlocks        是否展开图块引用；为 false 时 INSERT 作为插入点标记输出
 * @param includeHiddenLayers 是否保留关闭/冻结图层上的实体
 * @param layers              只导入这些图层（为空表示全部）
 */
public record ImportOptions(
        String sourceCrs,
        String targetCrs,
        boolean expandBlocks,
        boolean includeHiddenLayers,
        Set<String> layers
) {

    public ImportOptions {
        sourceCrs = blankToNull(sourceCrs);
        targetCrs = blankToNull(targetCrs);
        layers = (layers == null) ? Set.of() : Set.copyOf(layers);
    }

    public static ImportOptions defaults() {
        return new ImportOptions(null, null, true, true, Set.of());
    }

    public ImportOptions withSourceCrs(String crs) {
        return new ImportOptions(crs, targetCrs, expandBlocks, includeHiddenLayers, layers);
    }

    public ImportOptions withTargetCrs(String crs) {
        return new ImportOptions(sourceCrs, crs, expandBlocks, includeHiddenLayers, layers);
    }

    public ImportOptions withExpandBlocks(boolean expand) {
        return new ImportOptions(sourceCrs, targetCrs, expand, includeHiddenLayers, layers);
    }

    public ImportOptions withIncludeHiddenLayers(boolean include) {
        return new ImportOptions(sourceCrs, targetCrs, expandBlocks, include, layers);
    }

    public ImportOptions withLayers(Set<String> selected) {
        return new ImportOptions(sourceCrs, targetCrs, expandBlocks, includeHiddenLayers, selected);
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
