package com.robinpath.compiler.ast.stmt;

import com.robinpath.compiler.ast.AstVisitor;
import com.robinpath.compiler.ast.CodePosition;

/**
 * 提示词块：两行 {@code ---} 之间的原始文本
 */
public class PromptBlockStmt extends Statement {
    private String rawText;
    private CodePosition bodyPos;

    public PromptBlockStmt(CodePosition position, String rawText, CodePosition bodyPos) {
        super(position);
        this.rawText = rawText;
        this.bodyPos = bodyPos;
    }

    public String getRawText() {
        return rawText;
    }

    public void setRawText(String rawText) {
        this.rawText = rawText;
    }

    public CodePosition getBodyPos() {
        return bodyPos;
    }

    public void setBodyPos(CodePosition bodyPos) {
        this.bodyPos = bodyPos;
    }

    @Override
    public int getHeaderEndRow() {
        return position.getStartRow();
    }

    @Override
    public String getKind() {
        return "prompt_block";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPromptBlock(this, context);
    }
}
