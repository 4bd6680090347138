package com.robinpath.compiler.ast.expr;

import com.robinpath.compiler.ast.AstVisitor;

/**
 * 一元表达式（{@code not $x}、{@code - $n}）
 */
public class UnaryExpr extends Expression {
    private String operator;
    private Expression argument;

    public UnaryExpr(String operator, Expression argument) {
        this.operator = operator;
        this.argument = argument;
    }

    public String getOperator() {
        return operator;
    }

    public void setOperator(String operator) {
        this.operator = operator;
    }

    public Expression getArgument() {
        return argument;
    }

    public void setArgument(Expression argument) {
        this.argument = argument;
    }

    @Override
    public String getKind() {
        return "unary";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnary(this, context);
    }
}
