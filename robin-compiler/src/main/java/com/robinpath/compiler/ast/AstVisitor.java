package com.robinpath.compiler.ast;

import com.robinpath.compiler.ast.expr.*;
import com.robinpath.compiler.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>每种已知节点都有对应方法，默认转发到 {@link #visitNode}。
 * 外部扩展的节点类型调用 {@code visitNode}，由实现类决定降级策略。</p>
 */
public interface AstVisitor<R, C> {

    /** 兜底：未知节点类型 */
    default R visitNode(AstNode node, C ctx) { return null; }

    // ============ 语句 ============

    default R visitCommand(CommandStmt node, C ctx) { return visitNode(node, ctx); }

    default R visitAssignment(AssignmentStmt node, C ctx) { return visitNode(node, ctx); }

    default R visitShorthand(ShorthandStmt node, C ctx) { return visitNode(node, ctx); }

    default R visitInlineIf(InlineIfStmt node, C ctx) { return visitNode(node, ctx); }

    default R visitIfTrue(IfTrueStmt node, C ctx) { return visitNode(node, ctx); }

    default R visitIfFalse(IfFalseStmt node, C ctx) { return visitNode(node, ctx); }

    default R visitIfBlock(IfBlockStmt node, C ctx) { return visitNode(node, ctx); }

    default R visitDefine(DefineStmt node, C ctx) { return visitNode(node, ctx); }

    default R visitDo(DoStmt node, C ctx) { return visitNode(node, ctx); }

    default R visitTogether(TogetherStmt node, C ctx) { return visitNode(node, ctx); }

    default R visitForLoop(ForLoopStmt node, C ctx) { return visitNode(node, ctx); }

    default R visitOnBlock(OnBlockStmt node, C ctx) { return visitNode(node, ctx); }

    default R visitReturn(ReturnStmt node, C ctx) { return visitNode(node, ctx); }

    default R visitBreak(BreakStmt node, C ctx) { return visitNode(node, ctx); }

    default R visitContinue(ContinueStmt node, C ctx) { return visitNode(node, ctx); }

    default R visitComment(CommentStmt node, C ctx) { return visitNode(node, ctx); }

    default R visitChunkMarker(ChunkMarkerStmt node, C ctx) { return visitNode(node, ctx); }

    default R visitCell(CellStmt node, C ctx) { return visitNode(node, ctx); }

    default R visitPromptBlock(PromptBlockStmt node, C ctx) { return visitNode(node, ctx); }

    // ============ 表达式 ============

    default R visitVar(VarExpr node, C ctx) { return visitNode(node, ctx); }

    default R visitString(StringExpr node, C ctx) { return visitNode(node, ctx); }

    default R visitNumber(NumberExpr node, C ctx) { return visitNode(node, ctx); }

    default R visitLiteral(LiteralExpr node, C ctx) { return visitNode(node, ctx); }

    default R visitLastValue(LastValueExpr node, C ctx) { return visitNode(node, ctx); }

    default R visitSubexprCode(SubexprCodeExpr node, C ctx) { return visitNode(node, ctx); }

    default R visitSubexpression(SubexpressionExpr node, C ctx) { return visitNode(node, ctx); }

    default R visitObjectCode(ObjectCodeExpr node, C ctx) { return visitNode(node, ctx); }

    default R visitArrayCode(ArrayCodeExpr node, C ctx) { return visitNode(node, ctx); }

    default R visitObjectLiteral(ObjectLiteralExpr node, C ctx) { return visitNode(node, ctx); }

    default R visitArrayLiteral(ArrayLiteralExpr node, C ctx) { return visitNode(node, ctx); }

    default R visitBinary(BinaryExpr node, C ctx) { return visitNode(node, ctx); }

    default R visitUnary(UnaryExpr node, C ctx) { return visitNode(node, ctx); }

    default R visitCall(CallExpr node, C ctx) { return visitNode(node, ctx); }

    default R visitNamedArgs(NamedArgsExpr node, C ctx) { return visitNode(node, ctx); }

    default R visitRaw(RawExpr node, C ctx) { return visitNode(node, ctx); }

    default R visitRange(RangeExpr node, C ctx) { return visitNode(node, ctx); }
}
