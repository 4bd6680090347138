package com.robinpath.compiler.formatter;

import com.robinpath.compiler.ast.LiteralType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ValueConversion 字面量类型转换")
class ValueConversionTest {

    private static Object converted(Object value, LiteralType type) {
        ValueConversion.Result result = ValueConversion.convert(value, type);
        assertThat(result.isSuccess()).as("convert %s to %s", value, type).isTrue();
        return result.getValue();
    }

    @Nested
    @DisplayName("转为数字")
    class ToNumber {

        @Test
        @DisplayName("布尔值转为 1 / 0")
        void fromBoolean() {
            assertThat(converted(true, LiteralType.NUMBER)).isEqualTo(1.0);
            assertThat(converted(false, LiteralType.NUMBER)).isEqualTo(0.0);
        }

        @Test
        @DisplayName("字符串取开头的数字")
        void fromString() {
            assertThat(converted("42", LiteralType.NUMBER)).isEqualTo(42.0);
            assertThat(converted(" 3.5kg", LiteralType.NUMBER)).isEqualTo(3.5);
            assertThat(converted("-Infinity", LiteralType.NUMBER)).isEqualTo(Double.NEGATIVE_INFINITY);
        }

        @Test
        @DisplayName("不是数字的字符串转换失败")
        void failure() {
            assertThat(ValueConversion.convert("hello", LiteralType.NUMBER).isSuccess()).isFalse();
            assertThat(ValueConversion.convert(Collections.emptyList(), LiteralType.NUMBER).isSuccess()).isFalse();
        }
    }

    @Nested
    @DisplayName("转为布尔值")
    class ToBoolean {

        @Test
        @DisplayName("数字非零为 true")
        void fromNumber() {
            assertThat(converted(1.0, LiteralType.BOOLEAN)).isEqualTo(true);
            assertThat(converted(0.0, LiteralType.BOOLEAN)).isEqualTo(false);
            assertThat(converted(Double.NaN, LiteralType.BOOLEAN)).isEqualTo(false);
        }

        @Test
        @DisplayName("字符串按约定的真假词转换")
        void fromString() {
            assertThat(converted("Yes", LiteralType.BOOLEAN)).isEqualTo(true);
            assertThat(converted("0", LiteralType.BOOLEAN)).isEqualTo(false);
            assertThat(converted("", LiteralType.BOOLEAN)).isEqualTo(false);
            assertThat(ValueConversion.convert("maybe", LiteralType.BOOLEAN).isSuccess()).isFalse();
        }

        @Test
        @DisplayName("null 与集合")
        void fromOthers() {
            assertThat(converted(null, LiteralType.BOOLEAN)).isEqualTo(false);
            assertThat(converted(Arrays.asList(1.0), LiteralType.BOOLEAN)).isEqualTo(true);
            assertThat(converted(Collections.emptyMap(), LiteralType.BOOLEAN)).isEqualTo(false);
        }
    }

    @Nested
    @DisplayName("转为字符串、数组、对象")
    class ToStructured {

        @Test
        @DisplayName("字符串形式")
        void toStringValue() {
            assertThat(converted(5.0, LiteralType.STRING)).isEqualTo("5");
            assertThat(converted(null, LiteralType.STRING)).isEqualTo("null");
            assertThat(converted(Arrays.asList(1.0, "a"), LiteralType.STRING)).isEqualTo("[1,\"a\"]");
        }

        @Test
        @DisplayName("JSON 字符串解析为数组，非法 JSON 拆成字符")
        void toArray() {
            assertThat(converted("[1, 2]", LiteralType.ARRAY)).isEqualTo(Arrays.asList(1.0, 2.0));
            assertThat(converted("ab", LiteralType.ARRAY)).isEqualTo(Arrays.asList("a", "b"));
            assertThat(converted(null, LiteralType.ARRAY)).isEqualTo(Collections.emptyList());
            assertThat(converted(7.0, LiteralType.ARRAY)).isEqualTo(Collections.singletonList(7.0));
        }

        @Test
        @DisplayName("JSON 字符串解析为对象，非法 JSON 包成 value")
        void toObject() {
            Map<String, Object> parsed = new LinkedHashMap<String, Object>();
            parsed.put("a", 1.0);
            assertThat(converted("{\"a\": 1}", LiteralType.OBJECT)).isEqualTo(parsed);

            Map<String, Object> wrapped = new LinkedHashMap<String, Object>();
            wrapped.put("value", "oops");
            assertThat(converted("oops", LiteralType.OBJECT)).isEqualTo(wrapped);

            @SuppressWarnings("unchecked")
            Map<String, Object> indexed = (Map<String, Object>) converted(Arrays.asList("x", "y"), LiteralType.OBJECT);
            assertThat(indexed).containsEntry("0", "x").containsEntry("1", "y");
        }

        @Test
        @DisplayName("任意值都可以转为 null")
        void toNull() {
            ValueConversion.Result result = ValueConversion.convert("x", LiteralType.NULL);
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getValue()).isNull();
        }

        @Test
        @DisplayName("类型相同时原样返回")
        void sameType() {
            List<Object> list = Arrays.<Object>asList(1.0);
            assertThat(converted(list, LiteralType.ARRAY)).isSameAs(list);
        }
    }
}
