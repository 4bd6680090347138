package com.robinpath.compiler.ast.expr;

import com.robinpath.compiler.ast.AstVisitor;

/**
 * 上一个命令的结果：{@code $}
 */
public class LastValueExpr extends Expression {

    @Override
    public String getKind() {
        return "lastValue";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLastValue(this, context);
    }
}
