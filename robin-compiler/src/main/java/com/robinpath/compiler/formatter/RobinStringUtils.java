package com.robinpath.compiler.formatter;

import java.math.BigDecimal;

/**
 * 源码字符串转义与数字格式化工具
 */
public final class RobinStringUtils {

    private RobinStringUtils() {}

    /**
     * 反转义：给定反斜杠后面的字符，返回实际字符
     *
     * @return 反转义后的字符，未识别的转义返回 -1
     */
    public static int unescapeChar(char c) {
        switch (c) {
            case 'n':  return '\n';
            case 'r':  return '\r';
            case 't':  return '\t';
            case '0':  return '\0';
            case '\\': return '\\';
            case '\'': return '\'';
            case '"':  return '"';
            case '`':  return '`';
            default:   return -1;
        }
    }

    /** 转义字符串内容（用于双引号包裹的字符串） */
    public static String escapeString(String s) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    public static String quote(String s) {
        return "\"" + escapeString(s) + "\"";
    }

    /**
     * 按脚本语言的数字显示规则格式化：整数不带小数点，其余取最短表示
     */
    public static String formatNumber(double value) {
        if (Double.isNaN(value)) return "NaN";
        if (Double.isInfinite(value)) return value > 0 ? "Infinity" : "-Infinity";
        if (value == Math.rint(value) && Math.abs(value) < 1e21) {
            return BigDecimal.valueOf(value).toBigInteger().toString();
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /** 去掉行尾空白 */
    public static String trimTrailing(String s) {
        int end = s.length();
        while (end > 0 && Character.isWhitespace(s.charAt(end - 1))) {
            end--;
        }
        return s.substring(0, end);
    }
}
