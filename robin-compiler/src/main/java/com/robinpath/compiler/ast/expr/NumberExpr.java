package com.robinpath.compiler.ast.expr;

import com.robinpath.compiler.ast.AstVisitor;

/**
 * 数字字面量
 */
public class NumberExpr extends Expression {
    private double value;

    public NumberExpr(double value) {
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    public void setValue(double value) {
        this.value = value;
    }

    @Override
    public String getKind() {
        return "number";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNumber(this, context);
    }
}
