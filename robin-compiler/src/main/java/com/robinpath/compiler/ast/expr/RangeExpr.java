package com.robinpath.compiler.ast.expr;

import com.robinpath.compiler.ast.AstVisitor;

/**
 * for 循环区间：{@code range from to}
 */
public class RangeExpr extends Expression {
    private Expression from;
    private Expression to;

    public RangeExpr(Expression from, Expression to) {
        this.from = from;
        this.to = to;
    }

    public Expression getFrom() {
        return from;
    }

    public void setFrom(Expression from) {
        this.from = from;
    }

    public Expression getTo() {
        return to;
    }

    public void setTo(Expression to) {
        this.to = to;
    }

    @Override
    public String getKind() {
        return "range";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRange(this, context);
    }
}
