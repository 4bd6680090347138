package com.robinpath.compiler.ast.stmt;

import com.robinpath.compiler.ast.AstVisitor;
import com.robinpath.compiler.ast.CodePosition;
import com.robinpath.compiler.ast.expr.Expression;

/**
 * 单行 if：{@code if <cond> <command>}
 */
public class InlineIfStmt extends Statement {
    private Expression conditionExpr;
    private Statement command;

    public InlineIfStmt(CodePosition position, Expression conditionExpr, Statement command) {
        super(position);
        this.conditionExpr = conditionExpr;
        this.command = command;
    }

    public Expression getConditionExpr() {
        return conditionExpr;
    }

    public void setConditionExpr(Expression conditionExpr) {
        this.conditionExpr = conditionExpr;
    }

    public Statement getCommand() {
        return command;
    }

    public void setCommand(Statement command) {
        this.command = command;
    }

    @Override
    public String getKind() {
        return "inlineIf";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitInlineIf(this, context);
    }
}
