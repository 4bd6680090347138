package com.robinpath.compiler.ast.expr;

import com.robinpath.compiler.ast.AstVisitor;

/**
 * 数组字面量（旧格式，保存方括号内的原始代码）
 */
public class ArrayCodeExpr extends Expression {
    private String code;

    public ArrayCodeExpr(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    @Override
    public String getKind() {
        return "array";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArrayCode(this, context);
    }
}
