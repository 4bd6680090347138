package com.robinpath.compiler.regen;

import com.robinpath.compiler.formatter.PrintDiagnostic;

import java.util.Collections;
import java.util.List;

/**
 * 再生成结果：新源码和过程中产生的非致命诊断
 */
public final class RegenerationResult {
    private final String source;
    private final List<PrintDiagnostic> diagnostics;

    public RegenerationResult(String source, List<PrintDiagnostic> diagnostics) {
        this.source = source;
        this.diagnostics = diagnostics != null ? diagnostics : Collections.<PrintDiagnostic>emptyList();
    }

    public String getSource() {
        return source;
    }

    public List<PrintDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    @Override
    public String toString() {
        return source;
    }
}
