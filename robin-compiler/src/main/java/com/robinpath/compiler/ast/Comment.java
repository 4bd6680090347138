package com.robinpath.compiler.ast;

/**
 * 注释记录。多行连续注释合并后 text 内含换行；text 为空表示删除该注释。
 */
public class Comment {
    private String text;
    private CodePosition position;
    private boolean inline;

    public Comment(String text, CodePosition position, boolean inline) {
        this.text = text;
        this.position = position;
        this.inline = inline;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public CodePosition getPosition() {
        return position;
    }

    public void setPosition(CodePosition position) {
        this.position = position;
    }

    public boolean isInline() {
        return inline;
    }

    public void setInline(boolean inline) {
        this.inline = inline;
    }

    public boolean isDeleted() {
        return text == null || text.isEmpty();
    }

    @Override
    public String toString() {
        return (inline ? "inline " : "") + "#" + text;
    }
}
