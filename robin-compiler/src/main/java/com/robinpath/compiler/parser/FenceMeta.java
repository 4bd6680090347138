package com.robinpath.compiler.parser;

import com.robinpath.compiler.formatter.RobinStringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * 围栏行元数据：空白分隔的 {@code key:value} 项，值可用双引号包裹，引号内支持反斜杠转义。
 * 没有冒号的项（如单元格类型）值为 null。
 */
final class FenceMeta {

    private FenceMeta() {}

    static List<String[]> parse(String text) {
        List<String[]> pairs = new ArrayList<String[]>();
        for (String word : split(text)) {
            int colon = word.indexOf(':');
            if (colon < 0) {
                pairs.add(new String[]{word, null});
            } else {
                pairs.add(new String[]{word.substring(0, colon), unquote(word.substring(colon + 1))});
            }
        }
        return pairs;
    }

    /** 按空白切分，引号内的空白不切分 */
    private static List<String> split(String text) {
        List<String> words = new ArrayList<String>();
        StringBuilder word = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' && quoted && i + 1 < text.length()) {
                word.append(c).append(text.charAt(++i));
            } else if (c == '"') {
                quoted = !quoted;
                word.append(c);
            } else if (Character.isWhitespace(c) && !quoted) {
                if (word.length() > 0) {
                    words.add(word.toString());
                    word.setLength(0);
                }
            } else {
                word.append(c);
            }
        }
        if (word.length() > 0) {
            words.add(word.toString());
        }
        return words;
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return unescape(value.substring(1, value.length() - 1));
        }
        return value;
    }

    private static String unescape(String s) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' && i + 1 < s.length()) {
                int unescaped = RobinStringUtils.unescapeChar(s.charAt(i + 1));
                if (unescaped >= 0) {
                    sb.append((char) unescaped);
                    i++;
                    continue;
                }
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
