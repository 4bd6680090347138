package com.robinpath.compiler.formatter;

import com.google.gson.JsonSyntaxException;
import com.robinpath.compiler.ast.LiteralType;
import com.robinpath.compiler.serialization.JsonValues;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 字面量类型转换矩阵（赋值语句的 literalValueType 强制转换）
 *
 * <p>值的 Java 表示：null、String、Double、Boolean、List、Map。转换失败时返回
 * {@link Result#failed()}，由调用方决定保留原类型。</p>
 */
public final class ValueConversion {

    private static final Pattern LEADING_FLOAT =
            Pattern.compile("^[+-]?(Infinity|(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?)");

    private ValueConversion() {}

    /** 转换结果；成功时 value 可能为 null（目标类型为 null） */
    public static final class Result {
        private static final Result FAILED = new Result(false, null);

        private final boolean success;
        private final Object value;

        private Result(boolean success, Object value) {
            this.success = success;
            this.value = value;
        }

        public static Result ok(Object value) {
            return new Result(true, value);
        }

        public static Result failed() {
            return FAILED;
        }

        public boolean isSuccess() {
            return success;
        }

        public Object getValue() {
            return value;
        }
    }

    public static Result convert(Object value, LiteralType target) {
        LiteralType current = LiteralType.of(value);
        if (current == target) {
            return Result.ok(value);
        }
        switch (target) {
            case STRING:
                return Result.ok(toStringValue(value));
            case NUMBER:
                return toNumber(value);
            case BOOLEAN:
                return toBoolean(value);
            case NULL:
                return Result.ok(null);
            case ARRAY:
                return Result.ok(toArray(value));
            case OBJECT:
                return Result.ok(toObject(value));
            default:
                return Result.failed();
        }
    }

    static String toStringValue(Object value) {
        if (value == null) return "null";
        if (value instanceof List || value instanceof Map) return JsonValues.stringify(value);
        if (value instanceof Number) return RobinStringUtils.formatNumber(((Number) value).doubleValue());
        return String.valueOf(value);
    }

    private static Result toNumber(Object value) {
        if (value instanceof Boolean) {
            return Result.ok((Boolean) value ? 1.0 : 0.0);
        }
        if (value instanceof String) {
            Double parsed = parseLeadingFloat((String) value);
            return parsed != null ? Result.ok(parsed) : Result.failed();
        }
        if (value instanceof Number) {
            return Result.ok(((Number) value).doubleValue());
        }
        return Result.failed();
    }

    /** 解析字符串开头的浮点数，忽略其后的内容；无法解析时返回 null */
    static Double parseLeadingFloat(String s) {
        Matcher m = LEADING_FLOAT.matcher(s.trim());
        if (!m.find()) {
            return null;
        }
        String text = m.group();
        if (text.endsWith("Infinity")) {
            return text.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        return Double.parseDouble(text);
    }

    private static Result toBoolean(Object value) {
        if (value == null) {
            return Result.ok(false);
        }
        if (value instanceof String) {
            String lower = ((String) value).toLowerCase(Locale.ROOT).trim();
            if (lower.equals("true") || lower.equals("1") || lower.equals("yes")) return Result.ok(true);
            if (lower.equals("false") || lower.equals("0") || lower.equals("no") || lower.isEmpty()) {
                return Result.ok(false);
            }
            return Result.failed();
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return Result.ok(d != 0 && !Double.isNaN(d));
        }
        if (value instanceof List) {
            return Result.ok(!((List<?>) value).isEmpty());
        }
        if (value instanceof Map) {
            return Result.ok(!((Map<?, ?>) value).isEmpty());
        }
        return Result.ok(false);
    }

    private static List<Object> toArray(Object value) {
        if (value == null) {
            return new ArrayList<Object>();
        }
        if (value instanceof String) {
            String s = (String) value;
            try {
                Object parsed = JsonValues.parse(s);
                if (parsed instanceof List) {
                    return asList(parsed);
                }
            } catch (JsonSyntaxException e) {
                List<Object> chars = new ArrayList<Object>();
                for (int i = 0; i < s.length(); i++) {
                    chars.add(String.valueOf(s.charAt(i)));
                }
                return chars;
            }
        }
        if (value instanceof Map) {
            return new ArrayList<Object>(((Map<?, ?>) value).values());
        }
        List<Object> single = new ArrayList<Object>();
        single.add(value);
        return single;
    }

    private static Map<String, Object> toObject(Object value) {
        Map<String, Object> result = new LinkedHashMap<String, Object>();
        if (value == null) {
            return result;
        }
        if (value instanceof String) {
            try {
                Object parsed = JsonValues.parse((String) value);
                if (parsed instanceof Map) {
                    for (Map.Entry<?, ?> e : ((Map<?, ?>) parsed).entrySet()) {
                        result.put(String.valueOf(e.getKey()), e.getValue());
                    }
                    return result;
                }
            } catch (JsonSyntaxException e) {
                result.put("value", value);
                return result;
            }
        }
        if (value instanceof List) {
            List<Object> list = asList(value);
            for (int i = 0; i < list.size(); i++) {
                result.put(String.valueOf(i), list.get(i));
            }
            return result;
        }
        result.put("value", value);
        return result;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> asList(Object value) {
        return (List<Object>) value;
    }
}
