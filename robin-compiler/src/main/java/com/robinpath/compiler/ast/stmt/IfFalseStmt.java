package com.robinpath.compiler.ast.stmt;

import com.robinpath.compiler.ast.AstVisitor;
import com.robinpath.compiler.ast.CodePosition;

/**
 * {@code iffalse <command>}
 */
public class IfFalseStmt extends Statement {
    private Statement command;

    public IfFalseStmt(CodePosition position, Statement command) {
        super(position);
        this.command = command;
    }

    public Statement getCommand() {
        return command;
    }

    public void setCommand(Statement command) {
        this.command = command;
    }

    @Override
    public String getKind() {
        return "ifFalse";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfFalse(this, context);
    }
}
