package com.robinpath.compiler.ast.expr;

import com.robinpath.compiler.ast.AstVisitor;

/**
 * 二元表达式
 *
 * <p>{@code operator} 是规范化后的运算符（如 {@code and}），
 * {@code operatorText} 保存源码中的原始写法（如 {@code &&}），打印时优先使用。</p>
 */
public class BinaryExpr extends Expression {
    private Expression left;
    private String operator;
    private String operatorText;
    private Expression right;
    private boolean parenthesized;

    public BinaryExpr(Expression left, String operator, String operatorText, Expression right,
                      boolean parenthesized) {
        this.left = left;
        this.operator = operator;
        this.operatorText = operatorText;
        this.right = right;
        this.parenthesized = parenthesized;
    }

    public BinaryExpr(Expression left, String operator, Expression right) {
        this(left, operator, null, right, false);
    }

    public Expression getLeft() {
        return left;
    }

    public void setLeft(Expression left) {
        this.left = left;
    }

    public String getOperator() {
        return operator;
    }

    public void setOperator(String operator) {
        this.operator = operator;
    }

    public String getOperatorText() {
        return operatorText;
    }

    public void setOperatorText(String operatorText) {
        this.operatorText = operatorText;
    }

    /** 打印用的运算符：原始写法优先 */
    public String getDisplayOperator() {
        return operatorText != null && !operatorText.isEmpty() ? operatorText : operator;
    }

    public Expression getRight() {
        return right;
    }

    public void setRight(Expression right) {
        this.right = right;
    }

    public boolean isParenthesized() {
        return parenthesized;
    }

    public void setParenthesized(boolean parenthesized) {
        this.parenthesized = parenthesized;
    }

    @Override
    public String getKind() {
        return "binary";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinary(this, context);
    }
}
