package org.geoloader.dxf;

/**
 * TEXT/MTEXT 文本清理：去掉 MTEXT 内联格式控制符，展开 %% 特殊字符。
 * <p>
 * 处理范围：
 * <ul>
 *   <li>{@code \P} 段落换行 -> 换行符；{@code \~} 不间断空格 -> 空格</li>
 *   <li>{@code \f..;}/{@code \H..;}/{@code \W..;}/{@code \C..;}/{@code \Q..;}/{@code \T..;}/{@code \A..;}/{@code \p..;} 直接删除</li>
 *   <li>{@code \S上^下;} 堆叠分数 -> {@code 上/下}</li>
 *   <li>{@code \L \l \O \o \K \k} 下划线/上划线/删除线开关删除；分组花括号删除</li>
 *   <li>{@code \U+XXXX} -> 对应 Unicode 字符；{@code \\ \{ \}} 反转义</li>
 *   <li>{@code %%c %%d %%p %%%} -> ⌀ ° ± %</li>
 * </ul>
 */
public final class DxfTextFormatting {

    private DxfTextFormatting() {
    }

    public static String cleanMText(String raw) {
        if (raw == null) {
            return null;
        }
        String s = raw;
        int n = s.length();
        StringBuilder out = new StringBuilder(n);
        int i = 0;
        while (i < n) {
            char c = s.charAt(i);
            if (c == '\\' && i + 1 < n) {
                char d = s.charAt(i + 1);
                switch (d) {
                    case 'P' -> {
                        out.append('\n');
                        i += 2;
                    }
                    case '~' -> {
                        out.append(' ');
                        i += 2;
                    }
                    case '\\', '{', '}' -> {
                        out.append(d);
                        i += 2;
                    }
                    case 'S' -> {
                        int end = s.indexOf(';', i + 2);
                        String stacked = end < 0 ? s.substring(i + 2) : s.substring(i + 2, end);
                        out.append(stacked.replace('^', '/').replace('#', '/'));
                        i = end < 0 ? n : end + 1;
                    }
                    case 'U' -> {
                        if (i + 7 <= n && s.charAt(i + 2) == '+' && isHex(s, i + 3, i + 7)) {
                            out.append((char) Integer.parseInt(s.substring(i + 3, i + 7), 16));
                            i += 7;
                        } else {
                            i += 2;
                        }
                    }
                    case 'f', 'F', 'H', 'W', 'Q', 'T', 'A', 'C', 'c', 'p' -> {
                        int end = s.indexOf(';', i + 2);
                        i = end < 0 ? n : end + 1;
                    }
                    case 'L', 'l', 'O', 'o', 'K', 'k', 'N', 'X' -> i += 2;
                    default -> {
                        out.append(c);
                        i++;
                    }
                }
            } else if (c == '{' || c == '}') {
                i++;
            } else {
                out.append(c);
                i++;
            }
        }
        return expandSpecialCharacters(out.toString());
    }

    /**
     * 展开 TEXT/MTEXT 共用的 %% 控制码（大小写不敏感）。
     */
    public static String expandSpecialCharacters(String text) {
        if (text == null || !text.contains("%%")) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            if (text.startsWith("%%", i) && i + 2 < text.length()) {
                char code = Character.toLowerCase(text.charAt(i + 2));
                String replacement = switch (code) {
                    case 'c' -> "⌀";
                    case 'd' -> "°";
                    case 'p' -> "±";
                    case '%' -> "%";
                    default -> null;
                };
                if (replacement != null) {
                    out.append(replacement);
                    i += 3;
                    continue;
                }
            }
            out.append(text.charAt(i));
            i++;
        }
        return out.toString();
    }

    private static boolean isHex(String s, int from, int to) {
        for (int k = from; k < to; k++) {
            if (Character.digit(s.charAt(k), 16) < 0) {
                return false;
            }
        }
        return true;
    }
}
