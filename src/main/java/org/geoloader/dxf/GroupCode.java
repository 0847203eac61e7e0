package org.geoloader.dxf;

/**
 * 一个 (组码, 值) 对。
 *
 * @param code  组码
 * @param value 值（已去掉行尾空白；文本类组码 1/3 保留前导空格）
 * @param line  组码所在的行号（从 1 开始，用于诊断）
 */
public record GroupCode(int code, String value, int line) {

    public boolean is(int expectedCode, String expectedValue) {
        return code == expectedCode && expectedValue.equalsIgnoreCase(value.trim());
    }

    /**
     * 按浮点数解析；无法解析时返回 NaN，由调用方的有限值校验统一拦截。
     */
    public double asDouble() {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    /**
     * 按整数解析；无法解析时返回 fallback。部分导出器会把整数写成 "1.0"，这里一并兼容。
     */
    public int asInt(int fallback) {
        String s = value.trim();
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            double d = asDouble();
            return Double.isFinite(d) ? (int) d : fallback;
        }
    }
}
