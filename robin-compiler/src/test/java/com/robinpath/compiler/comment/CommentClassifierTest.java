package com.robinpath.compiler.comment;

import com.robinpath.compiler.ast.CodePosition;
import com.robinpath.compiler.ast.Comment;
import com.robinpath.compiler.ast.expr.Expression;
import com.robinpath.compiler.ast.expr.NumberExpr;
import com.robinpath.compiler.ast.stmt.CommandStmt;
import com.robinpath.compiler.ast.stmt.CommentStmt;
import com.robinpath.compiler.ast.stmt.Statement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CommentClassifier 注释归类")
class CommentClassifierTest {

    /** 单行命令 log 1，占据 row 行 [0, 4] 列 */
    private static CommandStmt command(int row) {
        List<Expression> args = new ArrayList<Expression>();
        args.add(new NumberExpr(1));
        return new CommandStmt(new CodePosition(row, 0, row, 4), "log", args);
    }

    private static Comment comment(String text, int row, int col) {
        return new Comment(text, new CodePosition(row, col, row, col + text.length() + 1), false);
    }

    @Nested
    @DisplayName("分组")
    class GroupTests {

        @Test
        @DisplayName("连续行合并为一组，空行断开")
        void testGroupConsecutive() {
            List<List<Comment>> groups = CommentClassifier.groupConsecutive(Arrays.asList(
                    comment("a", 0, 0), comment("b", 1, 0), comment("c", 3, 0)));
            assertThat(groups).hasSize(2);
            assertThat(groups.get(0)).hasSize(2);
            assertThat(groups.get(1)).hasSize(1);
        }

        @Test
        @DisplayName("合并后的文本以换行连接，位置覆盖整组")
        void testMerge() {
            Comment merged = CommentClassifier.merge(Arrays.asList(comment("a", 2, 0), comment("bc", 3, 0)));
            assertThat(merged.getText()).isEqualTo("a\nbc");
            assertThat(merged.getPosition()).isEqualTo(new CodePosition(2, 0, 3, 3));
            assertThat(merged.isInline()).isFalse();
        }
    }

    @Nested
    @DisplayName("归类")
    class ClassifyTests {

        @Test
        @DisplayName("同行内容之后的注释成为行尾注释")
        void testInline() {
            CommandStmt cmd = command(0);
            List<Statement> result = CommentClassifier.classify(
                    new ArrayList<Statement>(Collections.singletonList(cmd)),
                    Collections.singletonList(comment("note", 0, 7)));
            assertThat(result).containsExactly(cmd);
            assertThat(cmd.getInlineComment()).isNotNull();
            assertThat(cmd.getInlineComment().getText()).isEqualTo("note");
        }

        @Test
        @DisplayName("紧贴语句的注释组成为前导注释，行尾注释保持在末尾")
        void testLeadingKeepsInlineLast() {
            CommandStmt cmd = command(2);
            List<Statement> result = CommentClassifier.classify(
                    new ArrayList<Statement>(Collections.singletonList(cmd)),
                    Arrays.asList(comment("inline", 2, 7), comment("first", 0, 0), comment("second", 1, 0)));
            assertThat(result).containsExactly(cmd);
            assertThat(cmd.getComments()).hasSize(2);
            assertThat(cmd.getComments().get(0).getText()).isEqualTo("first\nsecond");
            assertThat(cmd.getComments().get(1).isInline()).isTrue();
            assertThat(cmd.getExtentStartRow()).isZero();
        }

        @Test
        @DisplayName("与语句之间隔空行的注释组成为独立语句，按行排序")
        void testStandalone() {
            CommandStmt cmd = command(3);
            List<Statement> result = CommentClassifier.classify(
                    new ArrayList<Statement>(Collections.singletonList(cmd)),
                    Collections.singletonList(comment("header", 0, 0)));
            assertThat(result).hasSize(2);
            assertThat(result.get(0)).isInstanceOf(CommentStmt.class);
            assertThat(result.get(1)).isSameAs(cmd);
            assertThat(cmd.getComments()).isEmpty();
        }

        @Test
        @DisplayName("末尾的注释组成为独立语句")
        void testTrailing() {
            CommandStmt cmd = command(0);
            List<Statement> result = CommentClassifier.classify(
                    new ArrayList<Statement>(Collections.singletonList(cmd)),
                    Collections.singletonList(comment("end", 1, 0)));
            assertThat(result).hasSize(2);
            assertThat(result.get(1)).isInstanceOf(CommentStmt.class);
        }

        @Test
        @DisplayName("没有位置的注释被忽略")
        void testNoPosition() {
            CommandStmt cmd = command(0);
            List<Statement> result = CommentClassifier.classify(
                    new ArrayList<Statement>(Collections.singletonList(cmd)),
                    Collections.singletonList(new Comment("lost", null, false)));
            assertThat(result).containsExactly(cmd);
            assertThat(cmd.getComments()).isEmpty();
        }
    }
}
