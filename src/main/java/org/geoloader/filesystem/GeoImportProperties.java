package org.geoloader.filesystem;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * DXF 导入 MCP Server 的业务配置（{@code app.geo.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>通过 {@link #roots} 指定允许读取 DXF 的根目录白名单。</li>
 *   <li>通过 readMaxBytes/分页上限控制内存占用与返回体积。</li>
 *   <li>通过 {@link Crs#extraSystems} 注册内置之外的坐标系（启动时与内置坐标系一起校验）。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.geo")
public class GeoImportProperties {

    /**
     * 允许访问的根目录白名单（每个 root 自动分配 rootId：root0、root1...）。
     */
    @NotNull
    private List<String> roots = List.of(".");

    /**
     * 是否允许通过符号链接/junction 访问（默认不允许，防止路径逃逸）。
     */
    private boolean allowSymlink = false;

    /**
     * 单个 DXF 文件允许读取的最大字节数（超过直接拒绝，不做截断，截断的 DXF 没有意义）。
     */
    @NotNull
    private DataSize readMaxBytes = DataSize.ofMegabytes(64);

    /**
     * 坐标转换结果缓存的最大条目数（满时淘汰最旧的一半）。
     */
    @Min(2)
    @Max(10_000_000)
    private int transformCacheMaxEntries = 10_000;

    /**
     * 单次导入最多保留的诊断记录数（超出部分只计数）。
     */
    @Min(1)
    @Max(1_000_000)
    private int diagnosticsMaxRecords = 1_000;

    /**
     * 单次导入图块展开允许输出的实体总数上限（防止嵌套 INSERT 指数级放大，超出部分计为失败）。
     */
    @Min(1)
    @Max(100_000_000)
    private int maxExpandedEntities = 1_000_000;

    /**
     * 导入结果在内存中保留的时长。
     */
    @NotNull
    private Duration featureStoreTtl = Duration.ofMinutes(30);

    /**
     * 同时保留的导入结果数上限。
     */
    @Min(1)
    @Max(10_000)
    private int featureStoreMaxImports = 20;

    /**
     * {@code dxf_read_features} 默认分页大小。
     */
    @Min(1)
    @Max(100_000)
    private int featuresPageDefaultLimit = 200;

    /**
     * {@code dxf_read_features} 允许的最大分页大小（上限保护）。
     */
    @Min(1)
    @Max(100_000)
    private int featuresPageMaxLimit = 5_000;

    /**
     * {@code dxf_import_features} 直接随结果返回的要素数（其余通过 token 分页读取）。
     */
    @Min(0)
    @Max(100_000)
    private int importPreviewFeatures = 50;

    /**
     * 默认是否导入关闭/冻结图层上的实体。
     */
    private boolean includeHiddenLayers = true;

    @Valid
    @NotNull
    private Crs crs = new Crs();

    public static class Crs {

        /**
         * 附加坐标系定义。
         */
        @Valid
        @NotNull
        private List<ExtraSystem> extraSystems = new ArrayList<>();

        public List<ExtraSystem> getExtraSystems() {
            return extraSystems;
        }

        public void setExtraSystems(List<ExtraSystem> extraSystems) {
            this.extraSystems = extraSystems;
        }
    }

    public static class ExtraSystem {

        @NotBlank
        private String code;

        @NotBlank
        private String proj4;

        /**
         * 有效范围 [minX, minY, maxX, maxY]，可不配置。
         */
        private List<Double> bounds;

        private String units = "meters";

        private String description;

        public String getCode() {
            return code;
        }

        public void setCode(String code) {
            this.code = code;
        }

        public String getProj4() {
            return proj4;
        }

        public void setProj4(String proj4) {
            this.proj4 = proj4;
        }

        public List<Double> getBounds() {
            return bounds;
        }

        public void setBounds(List<Double> bounds) {
            this.bounds = bounds;
        }

        public String getUnits() {
            return units;
        }

        public void setUnits(String units) {
            this.units = units;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }
    }

    public List<String> getRoots() {
        return roots;
    }

    public void setRoots(List<String> roots) {
        this.roots = roots;
    }

    public boolean isAllowSymlink() {
        return allowSymlink;
    }

    public void setAllowSymlink(boolean allowSymlink) {
        this.allowSymlink = allowSymlink;
    }

    public DataSize getReadMaxBytes() {
        return readMaxBytes;
    }

    public void setReadMaxBytes(DataSize readMaxBytes) {
        this.readMaxBytes = readMaxBytes;
    }

    public int getTransformCacheMaxEntries() {
        return transformCacheMaxEntries;
    }

    public void setTransformCacheMaxEntries(int transformCacheMaxEntries) {
        this.transformCacheMaxEntries = transformCacheMaxEntries;
    }

    public int getDiagnosticsMaxRecords() {
        return diagnosticsMaxRecords;
    }

    public void setDiagnosticsMaxRecords(int diagnosticsMaxRecords) {
        this.diagnosticsMaxRecords = diagnosticsMaxRecords;
    }

    public int getMaxExpandedEntities() {
        return maxExpandedEntities;
    }

    public void setMaxExpandedEntities(int maxExpandedEntities) {
        this.maxExpandedEntities = maxExpandedEntities;
    }

    public Duration getFeatureStoreTtl() {
        return featureStoreTtl;
    }

    public void setFeatureStoreTtl(Duration featureStoreTtl) {
        this.featureStoreTtl = featureStoreTtl;
    }

    public int getFeatureStoreMaxImports() {
        return featureStoreMaxImports;
    }

    public void setFeatureStoreMaxImports(int featureStoreMaxImports) {
        this.featureStoreMaxImports = featureStoreMaxImports;
    }

    public int getFeaturesPageDefaultLimit() {
        return featuresPageDefaultLimit;
    }

    public void setFeaturesPageDefaultLimit(int featuresPageDefaultLimit) {
        this.featuresPageDefaultLimit = featuresPageDefaultLimit;
    }

    public int getFeaturesPageMaxLimit() {
        return featuresPageMaxLimit;
    }

    public void setFeaturesPageMaxLimit(int featuresPageMaxLimit) {
        this.featuresPageMaxLimit = featuresPageMaxLimit;
    }

    public int getImportPreviewFeatures() {
        return importPreviewFeatures;
    }

    public void setImportPreviewFeatures(int importPreviewFeatures) {
        this.importPreviewFeatures = importPreviewFeatures;
    }

    public boolean isIncludeHiddenLayers() {
        return includeHiddenLayers;
    }

    public void setIncludeHiddenLayers(boolean includeHiddenLayers) {
        this.includeHiddenLayers = includeHiddenLayers;
    }

    public Crs getCrs() {
        return crs;
    }

    public void setCrs(Crs crs) {
        this.crs = crs;
    }
}
