package com.robinpath.compiler.serialization;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSyntaxException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 脚本值（null / String / Double / Boolean / List / Map）与 JSON 之间的转换
 *
 * <p>整数值的 Double 输出为不带小数点的整数，与脚本语言的显示一致。</p>
 */
public final class JsonValues {

    private static final Gson GSON = new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .create();

    private JsonValues() {}

    /** 序列化为紧凑 JSON */
    public static String stringify(Object value) {
        return GSON.toJson(toElement(value));
    }

    /**
     * 严格解析 JSON 文本
     *
     * @throws JsonSyntaxException 文本不是完整合法的 JSON
     */
    public static Object parse(String json) {
        JsonReader reader = new JsonReader(new StringReader(json));
        reader.setLenient(false);
        try {
            TypeAdapter<JsonElement> adapter = GSON.getAdapter(JsonElement.class);
            JsonElement element = adapter.read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw new JsonSyntaxException("Trailing content after JSON value");
            }
            return fromElement(element);
        } catch (IOException e) {
            throw new JsonSyntaxException(e);
        } catch (IllegalStateException e) {
            throw new JsonSyntaxException(e);
        }
    }

    @SuppressWarnings("unchecked")
    public static JsonElement toElement(Object value) {
        if (value == null) {
            return JsonNull.INSTANCE;
        }
        if (value instanceof String) {
            return new JsonPrimitive((String) value);
        }
        if (value instanceof Boolean) {
            return new JsonPrimitive((Boolean) value);
        }
        if (value instanceof Number) {
            return numberElement(((Number) value).doubleValue());
        }
        if (value instanceof List) {
            JsonArray array = new JsonArray();
            for (Object item : (List<Object>) value) {
                array.add(toElement(item));
            }
            return array;
        }
        if (value instanceof Map) {
            JsonObject object = new JsonObject();
            for (Map.Entry<Object, Object> e : ((Map<Object, Object>) value).entrySet()) {
                object.add(String.valueOf(e.getKey()), toElement(e.getValue()));
            }
            return object;
        }
        return new JsonPrimitive(String.valueOf(value));
    }

    public static Object fromElement(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (element.isJsonArray()) {
            List<Object> list = new ArrayList<Object>();
            for (JsonElement item : element.getAsJsonArray()) {
                list.add(fromElement(item));
            }
            return list;
        }
        if (element.isJsonObject()) {
            Map<String, Object> map = new LinkedHashMap<String, Object>();
            for (Map.Entry<String, JsonElement> e : element.getAsJsonObject().entrySet()) {
                map.put(e.getKey(), fromElement(e.getValue()));
            }
            return map;
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isBoolean()) {
            return primitive.getAsBoolean();
        }
        if (primitive.isNumber()) {
            return primitive.getAsDouble();
        }
        return primitive.getAsString();
    }

    /** 整数输出为 long，避免出现 1.0 */
    public static JsonPrimitive numberElement(double d) {
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 9.007199254740992E15) {
            return new JsonPrimitive((long) d);
        }
        return new JsonPrimitive(d);
    }
}
