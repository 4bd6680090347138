package com.robinpath.compiler.formatter;

/**
 * 打印配置
 */
public class FormatConfig {
    private int indentSize = 2;
    private boolean useSpaces = true;
    private int maxDepth = 200;

    public FormatConfig() {
    }

    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        this.indentSize = indentSize;
    }

    public boolean isUseSpaces() {
        return useSpaces;
    }

    public void setUseSpaces(boolean useSpaces) {
        this.useSpaces = useSpaces;
    }

    /** 最大嵌套深度，超出后不再递归打印 */
    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /**
     * 获取单层缩进字符串
     */
    public String getIndentString() {
        if (useSpaces) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < indentSize; i++) {
                sb.append(' ');
            }
            return sb.toString();
        } else {
            return "\t";
        }
    }
}
