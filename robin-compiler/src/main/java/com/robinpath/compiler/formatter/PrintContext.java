package com.robinpath.compiler.formatter;

import com.robinpath.compiler.ast.CodePosition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 打印上下文：缩进层级、配置、打印模式和共享的诊断列表。
 *
 * <p>上下文不可变，派生出的上下文共享同一个诊断列表。</p>
 */
public final class PrintContext {
    private final FormatConfig config;
    private final List<PrintDiagnostic> diagnostics;
    private final String basePrefix;
    private final int indentLevel;
    private final int nesting;
    private final boolean withComments;
    private final boolean headerOnly;

    private PrintContext(FormatConfig config, List<PrintDiagnostic> diagnostics, String basePrefix,
                         int indentLevel, int nesting, boolean withComments, boolean headerOnly) {
        this.config = config;
        this.diagnostics = diagnostics;
        this.basePrefix = basePrefix;
        this.indentLevel = indentLevel;
        this.nesting = nesting;
        this.withComments = withComments;
        this.headerOnly = headerOnly;
    }

    public static PrintContext create(FormatConfig config) {
        return new PrintContext(config, new ArrayList<PrintDiagnostic>(), "", 0, 0, true, false);
    }

    public static PrintContext create() {
        return create(new FormatConfig());
    }

    /** 以给定前缀作为第 0 层缩进 */
    public PrintContext withBasePrefix(String prefix) {
        return new PrintContext(config, diagnostics, prefix != null ? prefix : "", 0, nesting,
                withComments, headerOnly);
    }

    public PrintContext withIndent(int level) {
        return new PrintContext(config, diagnostics, basePrefix, level, nesting, withComments, headerOnly);
    }

    /** 进入下一层语句体：缩进加一，恢复完整打印模式 */
    public PrintContext nested() {
        return new PrintContext(config, diagnostics, basePrefix, indentLevel + 1, nesting + 1, true, false);
    }

    /** 同一缩进层级的完整打印（用于表达式内部的语句） */
    public PrintContext full() {
        return new PrintContext(config, diagnostics, basePrefix, indentLevel, nesting + 1, true, false);
    }

    /** 不输出任何注释 */
    public PrintContext withoutComments() {
        return new PrintContext(config, diagnostics, basePrefix, indentLevel, nesting, false, headerOnly);
    }

    /** 只输出头部：无注释、无语句体、无结束关键字 */
    public PrintContext headerOnly() {
        return new PrintContext(config, diagnostics, basePrefix, indentLevel, nesting, false, true);
    }

    public boolean isWithComments() {
        return withComments;
    }

    public boolean isHeaderOnly() {
        return headerOnly;
    }

    public boolean isTooDeep() {
        return nesting > config.getMaxDepth();
    }

    public FormatConfig getConfig() {
        return config;
    }

    public String getBasePrefix() {
        return basePrefix;
    }

    public int getIndentLevel() {
        return indentLevel;
    }

    public String indentString() {
        StringBuilder sb = new StringBuilder(basePrefix);
        String unit = config.getIndentString();
        for (int i = 0; i < indentLevel; i++) {
            sb.append(unit);
        }
        return sb.toString();
    }

    public CodeWriter newWriter() {
        CodeWriter writer = new CodeWriter(config, basePrefix);
        writer.indent(indentLevel);
        return writer;
    }

    public void report(PrintDiagnostic.Kind kind, String message, CodePosition position) {
        diagnostics.add(new PrintDiagnostic(kind, message, position));
    }

    public List<PrintDiagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
