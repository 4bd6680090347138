package com.robinpath.compiler.formatter;

/**
 * 带缩进的输出缓冲区
 *
 * <p>basePrefix 加在每一行缩进之前，用于在原文件的缩进风格（Tab、4 空格等）下重新打印。</p>
 */
public class CodeWriter {
    private final StringBuilder output = new StringBuilder();
    private final String indentUnit;
    private final String basePrefix;
    private int depth = 0;

    public CodeWriter(FormatConfig config, String basePrefix) {
        this.indentUnit = config.getIndentString();
        this.basePrefix = basePrefix != null ? basePrefix : "";
    }

    public CodeWriter(FormatConfig config) {
        this(config, "");
    }

    public CodeWriter() {
        this(new FormatConfig());
    }

    /** 设置缩进层级 */
    public void indent(int depth) {
        this.depth = Math.max(0, depth);
    }

    public int getDepth() {
        return depth;
    }

    public void push(String text) {
        if (text != null) {
            output.append(text);
        }
    }

    public void pushIndented(String text) {
        output.append(indentString());
        push(text);
    }

    public void pushLine(String text) {
        pushIndented(text);
        newline();
    }

    public void pushBlankLine() {
        if (output.length() > 0 && output.charAt(output.length() - 1) != '\n') {
            newline();
        }
        newline();
    }

    public void newline() {
        output.append('\n');
    }

    /** 当前层级的完整缩进前缀 */
    public String indentString() {
        StringBuilder sb = new StringBuilder(basePrefix);
        for (int i = 0; i < depth; i++) {
            sb.append(indentUnit);
        }
        return sb.toString();
    }

    public boolean isEmpty() {
        return output.length() == 0;
    }

    @Override
    public String toString() {
        return output.toString();
    }
}
