package com.robinpath.compiler.formatter;

import com.robinpath.compiler.ast.CodePosition;

/**
 * 打印 / 再生成过程中的非致命问题
 */
public final class PrintDiagnostic {

    public enum Kind {
        /** 没有对应打印器的节点，输出为空 */
        UNKNOWN_NODE_KIND,
        /** 字面量无法转换为声明类型，保留原类型 */
        TYPE_CONVERSION_FAILURE,
        /** 节点位置与原始源码不符，改为重新打印 */
        POSITION_OUT_OF_RANGE,
        /** 嵌套过深，停止递归 */
        NESTING_TOO_DEEP
    }

    private final Kind kind;
    private final String message;
    private final CodePosition position;

    public PrintDiagnostic(Kind kind, String message, CodePosition position) {
        this.kind = kind;
        this.message = message;
        this.position = position;
    }

    public Kind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    public CodePosition getPosition() {
        return position;
    }

    @Override
    public String toString() {
        return kind + ": " + message + (position != null ? " at " + position : "");
    }
}
