package com.robinpath.compiler.lexer;

/**
 * 词法单元。line 和 column 从 1 开始。
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object literal;
    private final int line;
    private final int column;
    private final int offset;

    public Token(TokenType type, String lexeme, Object literal, int line, int column, int offset) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    public Object getLiteral() {
        return literal;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    /** 紧跟在 token 之后的字符偏移 */
    public int getEndOffset() {
        return offset + lexeme.length();
    }

    /** 最后一个字符所在行（多行字符串、围栏块会跨行） */
    public int getEndLine() {
        int count = 0;
        for (int i = 0; i < lexeme.length(); i++) {
            if (lexeme.charAt(i) == '\n') count++;
        }
        return line + count;
    }

    /** 最后一个字符所在列 */
    public int getEndColumn() {
        int lastNewline = lexeme.lastIndexOf('\n');
        if (lastNewline < 0) {
            return column + Math.max(lexeme.length(), 1) - 1;
        }
        return Math.max(lexeme.length() - lastNewline - 1, 1);
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    public boolean isOneOf(TokenType... types) {
        for (TokenType t : types) {
            if (this.type == t) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        if (literal != null) {
            return String.format("%s(%s, %s) at %d:%d",
                    type, lexeme, literal, line, column);
        }
        return String.format("%s(%s) at %d:%d",
                type, lexeme, line, column);
    }
}
