package com.robinpath.compiler.ast;

/**
 * AST 节点基类
 *
 * <p>节点是可变的：外部工具在两次再生成之间直接修改字段。</p>
 */
public abstract class AstNode {
    protected CodePosition position;

    protected AstNode(CodePosition position) {
        this.position = position;
    }

    public CodePosition getPosition() {
        return position;
    }

    public void setPosition(CodePosition position) {
        this.position = position;
    }

    public boolean hasPosition() {
        return position != null;
    }

    /** JSON 中的节点类型标签 */
    public abstract String getKind();

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
