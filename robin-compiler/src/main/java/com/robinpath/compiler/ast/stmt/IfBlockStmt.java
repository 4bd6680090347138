package com.robinpath.compiler.ast.stmt;

import com.robinpath.compiler.ast.AstVisitor;
import com.robinpath.compiler.ast.CodePosition;
import com.robinpath.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.List;

/**
 * if 块：{@code if / elseif / else / endif}
 */
public class IfBlockStmt extends BlockStatement {
    private Expression conditionExpr;
    private boolean hasThen;
    private List<Statement> thenBranch;
    private List<ElseIfBranch> elseifBranches;
    private List<Statement> elseBranch;  // 可选
    private CodePosition elsePosition;

    public IfBlockStmt(CodePosition position, Expression conditionExpr, boolean hasThen,
                       List<Statement> thenBranch, List<ElseIfBranch> elseifBranches,
                       List<Statement> elseBranch) {
        super(position);
        this.conditionExpr = conditionExpr;
        this.hasThen = hasThen;
        this.thenBranch = thenBranch != null ? thenBranch : new ArrayList<Statement>();
        this.elseifBranches = elseifBranches != null ? elseifBranches : new ArrayList<ElseIfBranch>();
        this.elseBranch = elseBranch;
    }

    public Expression getConditionExpr() {
        return conditionExpr;
    }

    public void setConditionExpr(Expression conditionExpr) {
        this.conditionExpr = conditionExpr;
    }

    public boolean isHasThen() {
        return hasThen;
    }

    public void setHasThen(boolean hasThen) {
        this.hasThen = hasThen;
    }

    public List<Statement> getThenBranch() {
        return thenBranch;
    }

    public void setThenBranch(List<Statement> thenBranch) {
        this.thenBranch = thenBranch;
    }

    public List<ElseIfBranch> getElseifBranches() {
        return elseifBranches;
    }

    public void setElseifBranches(List<ElseIfBranch> elseifBranches) {
        this.elseifBranches = elseifBranches;
    }

    public List<Statement> getElseBranch() {
        return elseBranch;
    }

    public void setElseBranch(List<Statement> elseBranch) {
        this.elseBranch = elseBranch;
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    /** {@code else} 所在行的位置 */
    public CodePosition getElsePosition() {
        return elsePosition;
    }

    public void setElsePosition(CodePosition elsePosition) {
        this.elsePosition = elsePosition;
    }

    @Override
    public String getKind() {
        return "ifBlock";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfBlock(this, context);
    }
}
