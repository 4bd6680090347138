package com.robinpath.compiler.ast.stmt;

import com.robinpath.compiler.ast.AstVisitor;
import com.robinpath.compiler.ast.CodePosition;
import com.robinpath.compiler.ast.Comment;

import java.util.List;

/**
 * 独立注释组（与下一条语句之间隔着空行，或位于语句体末尾）
 */
public class CommentStmt extends Statement {

    public CommentStmt(CodePosition position, List<Comment> comments) {
        super(position);
        setComments(comments);
    }

    /** 所有注释都已清空时视为删除 */
    public boolean isEmpty() {
        for (Comment c : comments) {
            if (!c.isDeleted()) return false;
        }
        return true;
    }

    @Override
    public String getKind() {
        return "comment";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitComment(this, context);
    }
}
