package com.robinpath.compiler.ast.expr;

import com.robinpath.compiler.ast.AstVisitor;

/**
 * 对象字面量（旧格式，保存花括号内的原始代码）
 */
public class ObjectCodeExpr extends Expression {
    private String code;

    public ObjectCodeExpr(String code) {
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
        return "object";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitObjectCode(this, context);
    }
}
