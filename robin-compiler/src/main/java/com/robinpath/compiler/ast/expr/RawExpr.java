package com.robinpath.compiler.ast.expr;

import com.robinpath.compiler.ast.AstVisitor;

/**
 * 未解析的原始文本（条件或迭代对象），原样输出
 */
public class RawExpr extends Expression {
    private String code;

    public RawExpr(String code) {
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
        return "raw";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRaw(this, context);
    }
}
