package com.robinpath.compiler.ast.stmt;

import com.robinpath.compiler.ast.AstNode;
import com.robinpath.compiler.ast.CodePosition;
import com.robinpath.compiler.ast.Comment;

import java.util.ArrayList;
import java.util.List;

/**
 * 语句基类
 *
 * <p>comments 的顺序约定：先是前导注释（至多一组），最后是行尾注释（至多一条）。</p>
 */
public abstract class Statement extends AstNode {
    protected List<Comment> comments = new ArrayList<Comment>();

    protected Statement(CodePosition position) {
        super(position);
    }

    public List<Comment> getComments() {
        return comments;
    }

    public void setComments(List<Comment> comments) {
        this.comments = comments != null ? comments : new ArrayList<Comment>();
    }

    public List<Comment> getLeadingComments() {
        List<Comment> result = new ArrayList<Comment>();
        for (Comment c : comments) {
            if (!c.isInline()) result.add(c);
        }
        return result;
    }

    public Comment getInlineComment() {
        for (Comment c : comments) {
            if (c.isInline()) return c;
        }
        return null;
    }

    /** 设置（或在 comment 为 null 时移除）行尾注释，保持其位于列表末尾 */
    public void setInlineComment(Comment comment) {
        List<Comment> updated = getLeadingComments();
        if (comment != null) {
            comment.setInline(true);
            updated.add(comment);
        }
        this.comments = updated;
    }

    /**
     * 头部最后一行的行号。行尾注释挂在这一行上；
     * 单行语句即 endRow，块语句即开头关键字所在行。
     */
    public int getHeaderEndRow() {
        return position.getEndRow();
    }

    /**
     * 语句在源码中所占区域的起始行：前导注释、装饰器和语句本身三者中最靠前的一行
     */
    public int getExtentStartRow() {
        int row = position.getStartRow();
        for (Comment c : comments) {
            if (!c.isInline() && c.getPosition() != null) {
                row = Math.min(row, c.getPosition().getStartRow());
            }
        }
        return row;
    }

    /** 是否有缩进的语句体（块语句） */
    public boolean isBlock() {
        return false;
    }
}
