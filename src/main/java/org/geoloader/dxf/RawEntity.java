package org.geoloader.dxf;

import org.geoloader.geometry.Vector3;

import java.util.ArrayList;
import java.util.List;

/**
 * 一个实体的原始组码段：从 {@code (0,TYPE)} 到下一个 {@code (0,...)}（不含）。
 * <p>
 * POLYLINE 的 VERTEX、INSERT 的 ATTRIB 作为子段挂在 {@link #children()} 上（SEQEND 不保留）。
 *
 * @param type     DXF 类型名（大写）
 * @param codes    实体自身的组码（不含类型标记本身）
 * @param children 子实体
 * @param line     类型标记所在行号
 */
public record RawEntity(String type, List<GroupCode> codes, List<RawEntity> children, int line) {

    public RawEntity {
        codes = List.copyOf(codes);
        children = List.copyOf(children);
    }

    public boolean has(int code) {
        for (GroupCode gc : codes) {
            if (gc.code() == code) {
                return true;
            }
        }
        return false;
    }

    /**
     * 第一个匹配组码的值；没有时返回 null。
     */
    public String string(int code) {
        for (GroupCode gc : codes) {
            if (gc.code() == code) {
                return gc.value();
            }
        }
        return null;
    }

    /**
     * 第一个匹配组码的浮点值；缺失返回 fallback，存在但无法解析返回 NaN。
     */
    public double number(int code, double fallback) {
        for (GroupCode gc : codes) {
            if (gc.code() == code) {
                return gc.asDouble();
            }
        }
        return fallback;
    }

    public Double optionalNumber(int code) {
        for (GroupCode gc : codes) {
            if (gc.code() == code) {
                return gc.asDouble();
            }
        }
        return null;
    }

    public int integer(int code, int fallback) {
        for (GroupCode gc : codes) {
            if (gc.code() == code) {
                return gc.asInt(fallback);
            }
        }
        return fallback;
    }

    public Integer optionalInteger(int code) {
        for (GroupCode gc : codes) {
            if (gc.code() == code) {
                return gc.asInt(0);
            }
        }
        return null;
    }

    /**
     * 读取以 xCode 开头的坐标（x=xCode, y=xCode+10, z=xCode+20）；x 或 y 缺失返回 null，z 缺省 0。
     */
    public Vector3 point(int xCode) {
        if (!has(xCode) || !has(xCode + 10)) {
            return null;
        }
        return new Vector3(number(xCode, Double.NaN), number(xCode + 10, Double.NaN), number(xCode + 20, 0));
    }

    /**
     * 按出现顺序收集重复的坐标三元组（遇到 xCode 开始新点，随后的 y/z 归属该点）。
     */
    public List<Vector3> points(int xCode) {
        List<Vector3> result = new ArrayList<>();
        double x = Double.NaN;
        double y = Double.NaN;
        double z = 0;
        boolean open = false;
        for (GroupCode gc : codes) {
            if (gc.code() == xCode) {
                if (open) {
                    result.add(new Vector3(x, y, z));
                }
                x = gc.asDouble();
                y = Double.NaN;
                z = 0;
                open = true;
            } else if (open && gc.code() == xCode + 10) {
                y = gc.asDouble();
            } else if (open && gc.code() == xCode + 20) {
                z = gc.asDouble();
            }
        }
        if (open) {
            result.add(new Vector3(x, y, z));
        }
        return result;
    }
}
