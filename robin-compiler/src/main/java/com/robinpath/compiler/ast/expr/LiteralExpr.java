package com.robinpath.compiler.ast.expr;

import com.robinpath.compiler.ast.AstVisitor;

/**
 * 关键字字面量：true / false / null
 */
public class LiteralExpr extends Expression {
    private Object value;

    public LiteralExpr(Object value) {
        this.value = value;
    }

    public Object getValue() {
        return value;
    }

    public void setValue(Object value) {
        this.value = value;
    }

    @Override
    public String getKind() {
        return "literal";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }
}
