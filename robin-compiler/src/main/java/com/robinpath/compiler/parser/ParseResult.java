package com.robinpath.compiler.parser;

import com.robinpath.compiler.ast.stmt.Statement;

import java.util.List;

/**
 * 容错解析的结果：已解析的顶层语句和收集到的错误列表
 */
public final class ParseResult {
    private final List<Statement> statements;
    private final List<ParseError> errors;

    public ParseResult(List<Statement> statements, List<ParseError> errors) {
        this.statements = statements;
        this.errors = errors;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public List<ParseError> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
