package com.robinpath.compiler.comment;

import com.robinpath.compiler.ast.CodePosition;
import com.robinpath.compiler.ast.Comment;
import com.robinpath.compiler.ast.stmt.CommentStmt;
import com.robinpath.compiler.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * 注释归类：把一个语句体中收集到的注释分配为行尾注释、前导注释或独立注释组。
 *
 * <ol>
 *   <li>与语句头部最后一行同行、且位于语句内容之后的注释是行尾注释</li>
 *   <li>其余注释按连续行合并成组</li>
 *   <li>组与下一条语句之间没有空行时成为该语句的前导注释，否则成为独立的 comment 语句</li>
 * </ol>
 *
 * 输入顺序无要求，先按行列排序再分组，从不抛出异常。
 */
public final class CommentClassifier {

    private static final Comparator<Comment> BY_POSITION = new Comparator<Comment>() {
        @Override
        public int compare(Comment a, Comment b) {
            int byRow = Integer.compare(a.getPosition().getStartRow(), b.getPosition().getStartRow());
            return byRow != 0 ? byRow : Integer.compare(a.getPosition().getStartCol(), b.getPosition().getStartCol());
        }
    };

    private static final Comparator<Statement> BY_START_ROW = new Comparator<Statement>() {
        @Override
        public int compare(Statement a, Statement b) {
            return Integer.compare(startRow(a), startRow(b));
        }
    };

    private CommentClassifier() {}

    /**
     * 归类注释并返回新的语句列表（原语句加上独立注释组，按行排序）。
     * 语句的 comments 会被改写为：前导注释在前，行尾注释在后。
     */
    public static List<Statement> classify(List<Statement> statements, List<Comment> comments) {
        List<Comment> sorted = new ArrayList<Comment>();
        for (Comment c : comments) {
            if (c != null && c.getPosition() != null) sorted.add(c);
        }
        Collections.sort(sorted, BY_POSITION);

        // 行尾注释
        List<Comment> fullLine = new ArrayList<Comment>();
        for (Comment c : sorted) {
            Statement owner = inlineOwner(statements, c);
            if (owner != null && owner.getInlineComment() == null) {
                owner.setInlineComment(new Comment(c.getText(), c.getPosition(), true));
            } else {
                fullLine.add(c);
            }
        }

        // 合并连续行并分配
        List<Statement> result = new ArrayList<Statement>(statements);
        for (List<Comment> group : groupConsecutive(fullLine)) {
            Comment merged = merge(group);
            int lastRow = merged.getPosition().getEndRow();
            Statement next = nextStatementAfter(statements, lastRow);
            if (next != null && next.getExtentStartRow() - lastRow <= 1) {
                attachLeading(next, merged);
            } else {
                List<Comment> content = new ArrayList<Comment>();
                content.add(merged);
                result.add(new CommentStmt(merged.getPosition(), content));
            }
        }
        Collections.sort(result, BY_START_ROW);
        return result;
    }

    /** 注释位于某条语句头部最后一行、且在语句内容之后时返回该语句 */
    private static Statement inlineOwner(List<Statement> statements, Comment comment) {
        int row = comment.getPosition().getStartRow();
        int col = comment.getPosition().getStartCol();
        for (Statement s : statements) {
            CodePosition pos = s.getPosition();
            if (pos == null || s instanceof CommentStmt || s.getHeaderEndRow() != row) {
                continue;
            }
            boolean headerIsLastRow = s.getHeaderEndRow() == pos.getEndRow();
            if (headerIsLastRow ? col > pos.getEndCol() : col > pos.getStartCol()) {
                return s;
            }
        }
        return null;
    }

    static List<List<Comment>> groupConsecutive(List<Comment> comments) {
        List<List<Comment>> groups = new ArrayList<List<Comment>>();
        List<Comment> currentGroup = null;
        int lastRow = Integer.MIN_VALUE;
        for (Comment c : comments) {
            int row = c.getPosition().getStartRow();
            if (currentGroup == null || row - lastRow > 1) {
                currentGroup = new ArrayList<Comment>();
                groups.add(currentGroup);
            }
            currentGroup.add(c);
            lastRow = c.getPosition().getEndRow();
        }
        return groups;
    }

    /** 合并为一条注释：文本以换行连接，位置覆盖整组 */
    static Comment merge(List<Comment> group) {
        Comment first = group.get(0);
        if (group.size() == 1) {
            return new Comment(first.getText(), first.getPosition(), false);
        }
        Comment last = group.get(group.size() - 1);
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < group.size(); i++) {
            if (i > 0) text.append('\n');
            text.append(group.get(i).getText());
        }
        CodePosition pos = first.getPosition().spanTo(last.getPosition());
        return new Comment(text.toString(), pos, false);
    }

    private static Statement nextStatementAfter(List<Statement> statements, int row) {
        Statement best = null;
        for (Statement s : statements) {
            if (s.getPosition() == null || s instanceof CommentStmt || s.getPosition().getStartRow() <= row) {
                continue;
            }
            if (best == null || s.getPosition().getStartRow() < best.getPosition().getStartRow()) {
                best = s;
            }
        }
        return best;
    }

    private static void attachLeading(Statement stmt, Comment leading) {
        List<Comment> updated = stmt.getLeadingComments();
        updated.add(leading);
        Comment inline = stmt.getInlineComment();
        if (inline != null) {
            updated.add(inline);
        }
        stmt.setComments(updated);
    }

    private static int startRow(Statement s) {
        return s.getPosition() != null ? s.getExtentStartRow() : Integer.MAX_VALUE;
    }
}
