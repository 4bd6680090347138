package com.robinpath.compiler.ast.stmt;

import com.robinpath.compiler.ast.AstVisitor;
import com.robinpath.compiler.ast.CodePosition;
import com.robinpath.compiler.ast.expr.Expression;
import com.robinpath.compiler.ast.expr.RangeExpr;

import java.util.ArrayList;
import java.util.List;

/**
 * for 循环：{@code for $v in range a b} 或 {@code for $v in <iterable>}
 */
public class ForLoopStmt extends BlockStatement {
    private String varName;
    private RangeExpr range;
    private Expression iterable;
    private List<Statement> body;

    public ForLoopStmt(CodePosition position, String varName, RangeExpr range, Expression iterable,
                       List<Statement> body) {
        super(position);
        this.varName = varName;
        this.range = range;
        this.iterable = iterable;
        this.body = body != null ? body : new ArrayList<Statement>();
    }

    public String getVarName() {
        return varName;
    }

    public void setVarName(String varName) {
        this.varName = varName;
    }

    public RangeExpr getRange() {
        return range;
    }

    public void setRange(RangeExpr range) {
        this.range = range;
    }

    public Expression getIterable() {
        return iterable;
    }

    public void setIterable(Expression iterable) {
        this.iterable = iterable;
    }

    public List<Statement> getBody() {
        return body;
    }

    public void setBody(List<Statement> body) {
        this.body = body;
    }

    @Override
    public String getKind() {
        return "forLoop";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForLoop(this, context);
    }
}
