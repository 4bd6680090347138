package com.robinpath.compiler.ast.expr;

import com.robinpath.compiler.ast.AstVisitor;
import com.robinpath.compiler.ast.CodePosition;
import com.robinpath.compiler.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.List;

/**
 * 子表达式 {@code $( ... )}，body 为完整语句列表。
 * position 覆盖从 {@code $(} 到 {@code )} 的范围（可选）。
 */
public class SubexpressionExpr extends Expression {
    private List<Statement> body;

    public SubexpressionExpr(CodePosition position, List<Statement> body) {
        super(position);
        this.body = body != null ? body : new ArrayList<Statement>();
    }

    public SubexpressionExpr(List<Statement> body) {
        this(null, body);
    }

    public List<Statement> getBody() {
        return body;
    }

    public void setBody(List<Statement> body) {
        this.body = body;
    }

    @Override
    public String getKind() {
        return "subexpression";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSubexpression(this, context);
    }
}
