package com.robinpath.compiler.ast.stmt;

import com.robinpath.compiler.ast.AstVisitor;
import com.robinpath.compiler.ast.CodePosition;

/**
 * {@code iftrue <command>}
 */
public class IfTrueStmt extends Statement {
    private Statement command;

    public IfTrueStmt(CodePosition position, Statement command) {
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
        return "ifTrue";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfTrue(this, context);
    }
}
