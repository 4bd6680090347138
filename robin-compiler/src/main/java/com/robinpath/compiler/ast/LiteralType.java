package com.robinpath.compiler.ast;

import java.util.List;
import java.util.Map;

/**
 * 赋值字面量的声明类型
 */
public enum LiteralType {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    NULL("null"),
    OBJECT("object"),
    ARRAY("array");

    private final String label;

    LiteralType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static LiteralType fromLabel(String label) {
        for (LiteralType t : values()) {
            if (t.label.equals(label)) return t;
        }
        throw new IllegalArgumentException("Unknown literal type: " + label);
    }

    /** 值的自然类型 */
    public static LiteralType of(Object value) {
        if (value == null) return NULL;
        if (value instanceof String) return STRING;
        if (value instanceof Number) return NUMBER;
        if (value instanceof Boolean) return BOOLEAN;
        if (value instanceof List) return ARRAY;
        if (value instanceof Map) return OBJECT;
        return STRING;
    }
}
