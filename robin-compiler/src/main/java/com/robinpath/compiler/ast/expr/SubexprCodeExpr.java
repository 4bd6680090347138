package com.robinpath.compiler.ast.expr;

import com.robinpath.compiler.ast.AstVisitor;

/**
 * 子表达式（旧格式，保存原始代码）
 */
public class SubexprCodeExpr extends Expression {
    private String code;

    public SubexprCodeExpr(String code) {
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
        return "subexpr";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSubexprCode(this, context);
    }
}
