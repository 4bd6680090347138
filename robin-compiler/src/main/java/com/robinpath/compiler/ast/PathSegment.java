package com.robinpath.compiler.ast;

/**
 * 变量访问路径段：属性 .name 或下标 [index]
 */
public final class PathSegment {

    public enum Kind {
        PROPERTY,
        INDEX
    }

    private final Kind kind;
    private final String value;

    private PathSegment(Kind kind, String value) {
        this.kind = kind;
        this.value = value;
    }

    public static PathSegment property(String name) {
        return new PathSegment(Kind.PROPERTY, name);
    }

    public static PathSegment index(String index) {
        return new PathSegment(Kind.INDEX, index);
    }

    public Kind getKind() {
        return kind;
    }

    public String getValue() {
        return value;
    }

    public boolean isProperty() {
        return kind == Kind.PROPERTY;
    }

    public String toSource() {
        return kind == Kind.PROPERTY ? "." + value : "[" + value + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PathSegment)) return false;
        PathSegment that = (PathSegment) o;
        return kind == that.kind && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + value.hashCode();
    }

    @Override
    public String toString() {
        return toSource();
    }
}
