package com.robinpath.compiler.ast.stmt;

import com.robinpath.compiler.ast.CodePosition;
import com.robinpath.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.List;

/**
 * elseif 分支。position 只覆盖 {@code elseif <cond>} 这一行。
 */
public class ElseIfBranch {
    private Expression conditionExpr;
    private List<Statement> body;
    private CodePosition position;

    public ElseIfBranch(Expression conditionExpr, List<Statement> body, CodePosition position) {
        this.conditionExpr = conditionExpr;
        this.body = body != null ? body : new ArrayList<Statement>();
        this.position = position;
    }

    public Expression getConditionExpr() {
        return conditionExpr;
    }

    public void setConditionExpr(Expression conditionExpr) {
        this.conditionExpr = conditionExpr;
    }

    public List<Statement> getBody() {
        return body;
    }

    public void setBody(List<Statement> body) {
        this.body = body;
    }

    public CodePosition getPosition() {
        return position;
    }

    public void setPosition(CodePosition position) {
        this.position = position;
    }
}
