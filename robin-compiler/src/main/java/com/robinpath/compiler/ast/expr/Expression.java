package com.robinpath.compiler.ast.expr;

import com.robinpath.compiler.ast.AstNode;
import com.robinpath.compiler.ast.CodePosition;

/**
 * 表达式基类。大多数表达式不携带位置。
 */
public abstract class Expression extends AstNode {

    protected Expression() {
        super(null);
    }

    protected Expression(CodePosition position) {
        super(position);
    }
}
