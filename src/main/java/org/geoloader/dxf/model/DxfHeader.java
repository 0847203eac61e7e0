package org.geoloader.dxf.model;

import org.geoloader.geometry.Vector3;

import java.util.Map;

/**
 * HEADER 段中本项目关心的变量。
 *
 * @param version   $ACADVER（例如 AC1027；可为空）
 * @param insUnits  $INSUNITS（可为空）
 * @param extMin    $EXTMIN（可为空）
 * @param extMax    $EXTMAX（可为空）
 * @param variables 其余变量名 -> 首个值的原始文本
 */
public record DxfHeader(
        String version,
        Integer insUnits,
        Vector3 extMin,
        Vector3 extMax,
        Map<String, String> variables
) {

    public DxfHeader {
        variables = (variables == null) ? Map.of() : Map.copyOf(variables);
    }

    public static DxfHeader empty() {
        return new DxfHeader(null, null, null, null, Map.of());
    }

    /**
     * $INSUNITS 的可读名称（只覆盖常见值）。
     */
    public String unitsName() {
        if (insUnits == null) {
            return null;
        }
        return switch (insUnits) {
            case 0 -> "unitless";
            case 1 -> "inches";
            case 2 -> "feet";
            case 4 -> "millimeters";
            case 5 -> "centimeters";
            case 6 -> "meters";
            case 7 -> "kilometers";
            default -> "code-" + insUnits;
        };
    }
}
