package com.robinpath.compiler.ast.stmt;

import com.robinpath.compiler.ast.AstVisitor;
import com.robinpath.compiler.ast.CodePosition;

import java.util.ArrayList;
import java.util.List;

/**
 * together 块，blocks 中是 do 节点（也可能夹带独立注释）
 */
public class TogetherStmt extends BlockStatement {
    private List<Statement> blocks;

    public TogetherStmt(CodePosition position, List<Statement> blocks) {
        super(position);
        this.blocks = blocks != null ? blocks : new ArrayList<Statement>();
    }

    public List<Statement> getBlocks() {
        return blocks;
    }

    public void setBlocks(List<Statement> blocks) {
        this.blocks = blocks;
    }

    @Override
    public String getKind() {
        return "together";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTogether(this, context);
    }
}
