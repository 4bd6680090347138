package com.robinpath.compiler.lexer;

import com.robinpath.compiler.formatter.RobinStringUtils;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * RobinPath 词法分析器
 *
 * <p>按行工作：以 {@code ---} 开头的行是围栏块（chunk 标记、单元格、提示块），
 * 其余行按普通 token 切分。注释保留为 COMMENT token，交给解析器归类。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private boolean atLineStart = true;
    private boolean inCodeCell = false;

    private final PrintStream errStream;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 块
        map.put("if", TokenType.KW_IF);
        map.put("then", TokenType.KW_THEN);
        map.put("elseif", TokenType.KW_ELSEIF);
        map.put("else", TokenType.KW_ELSE);
        map.put("endif", TokenType.KW_ENDIF);
        map.put("iftrue", TokenType.KW_IFTRUE);
        map.put("iffalse", TokenType.KW_IFFALSE);
        map.put("def", TokenType.KW_DEF);
        map.put("enddef", TokenType.KW_ENDDEF);
        map.put("do", TokenType.KW_DO);
        map.put("enddo", TokenType.KW_ENDDO);
        map.put("with", TokenType.KW_WITH);
        map.put("endwith", TokenType.KW_ENDWITH);
        map.put("for", TokenType.KW_FOR);
        map.put("in", TokenType.KW_IN);
        map.put("endfor", TokenType.KW_ENDFOR);
        map.put("on", TokenType.KW_ON);
        map.put("endon", TokenType.KW_ENDON);
        map.put("together", TokenType.KW_TOGETHER);
        map.put("endtogether", TokenType.KW_ENDTOGETHER);

        // 语句
        map.put("return", TokenType.KW_RETURN);
        map.put("break", TokenType.KW_BREAK);
        map.put("continue", TokenType.KW_CONTINUE);
        map.put("into", TokenType.KW_INTO);
        map.put("set", TokenType.KW_SET);
        map.put("as", TokenType.KW_AS);

        // 值与逻辑
        map.put("true", TokenType.KW_TRUE);
        map.put("false", TokenType.KW_FALSE);
        map.put("null", TokenType.KW_NULL);
        map.put("and", TokenType.KW_AND);
        map.put("or", TokenType.KW_OR);
        map.put("not", TokenType.KW_NOT);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词集合 */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source, String fileName) {
        this(source, fileName, System.err);
    }

    public Lexer(String source, String fileName, PrintStream errStream) {
        this.source = source;
        this.fileName = fileName;
        this.errStream = errStream;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getSource() {
        return source;
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 执行词法分析，返回 Token 列表（以 EOF 结尾）
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            skipWhitespace();
            if (isAtEnd()) break;
            start = current;
            if (atLineStart && lookingAt("---")) {
                fence();
            } else {
                scanToken();
            }
        }
        tokens.add(new Token(TokenType.EOF, "", null, line, column, current));
        return tokens;
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\r' || c == '\t') {
                advance();
            } else if (c == '\\' && isLineContinuation()) {
                // 续行：反斜杠到换行整体视为空白
                while (peek() != '\n') advance();
                advance();
                newLine();
                atLineStart = false;
            } else {
                break;
            }
        }
    }

    private void scanToken() {
        char c = advance();
        atLineStart = false;
        switch (c) {
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;

            case '+': addToken(TokenType.PLUS); break;
            case '*': addToken(TokenType.MUL); break;
            case '/': addToken(TokenType.DIV); break;
            case '%': addToken(TokenType.MOD); break;

            case '-':
                if (isDigit(peek()) && startsOperand()) {
                    number();
                } else {
                    addToken(TokenType.MINUS);
                }
                break;

            case '=':
                addToken(match('=') ? TokenType.EQ : TokenType.ASSIGN);
                break;

            case '!':
                addToken(match('=') ? TokenType.NE : TokenType.NOT);
                break;

            case '<':
                addToken(match('=') ? TokenType.LE : TokenType.LT);
                break;

            case '>':
                addToken(match('=') ? TokenType.GE : TokenType.GT);
                break;

            case '&':
                if (match('&')) {
                    addToken(TokenType.AND);
                } else {
                    error("Unexpected character '&'. Did you mean '&&'?");
                }
                break;

            case '|':
                if (match('|')) {
                    addToken(TokenType.OR);
                } else {
                    error("Unexpected character '|'. Did you mean '||'?");
                }
                break;

            case '#':
                comment();
                break;

            case '@':
                decorator();
                break;

            case '$':
                dollar();
                break;

            case '\n':
                addToken(TokenType.NEWLINE);
                newLine();
                break;

            case '"':
            case '\'':
            case '`':
                string(c);
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private boolean lookingAt(String text) {
        return source.startsWith(text, current);
    }

    private void newLine() {
        line++;
        column = 1;
        atLineStart = true;
    }

    private boolean isLineContinuation() {
        int i = current + 1;
        while (i < source.length() && (source.charAt(i) == ' ' || source.charAt(i) == '\t' || source.charAt(i) == '\r')) {
            i++;
        }
        return i < source.length() && source.charAt(i) == '\n';
    }

    /** 负号前是空白、开括号、逗号或行首时，视为负数字面量 */
    private boolean startsOperand() {
        if (start == 0) return true;
        char prev = source.charAt(start - 1);
        return prev == ' ' || prev == '\t' || prev == '\n' || prev == '('
                || prev == '[' || prev == ',' || prev == '=' || prev == ':';
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_' ||
               Character.isLetter(c);
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        tokens.add(new Token(type, lexeme, literal, startLine(lexeme), startColumn(lexeme), start));
    }

    /** 跨行 token 的起始行 */
    private int startLine(String lexeme) {
        int count = 0;
        for (int i = 0; i < lexeme.length(); i++) {
            if (lexeme.charAt(i) == '\n') count++;
        }
        return lexeme.equals("\n") ? line : line - count;
    }

    private int startColumn(String lexeme) {
        int lineStartOffset = source.lastIndexOf('\n', start - 1) + 1;
        return start - lineStartOffset + 1;
    }

    // === 复杂 Token 扫描 ===

    /** 注释文本：去掉 #、一个前导空格和行尾空白 */
    private void comment() {
        while (peek() != '\n' && !isAtEnd()) advance();
        String raw = source.substring(start + 1, current);
        if (raw.startsWith(" ")) {
            raw = raw.substring(1);
        }
        addToken(TokenType.COMMENT, RobinStringUtils.trimTrailing(raw));
    }

    private void decorator() {
        while (isAlphaNumeric(peek())) advance();
        if (current - start == 1) {
            error("Expected decorator name after '@'");
            return;
        }
        addToken(TokenType.DECORATOR, source.substring(start + 1, current));
    }

    /**
     * $ 开头：$( 子表达式、$name 变量（可带 .prop 和 [index] 路径）或单独的 $
     */
    private void dollar() {
        if (match('(')) {
            addToken(TokenType.SUBEXPR_OPEN);
            return;
        }
        if (!isAlphaNumeric(peek())) {
            addToken(TokenType.LAST_VALUE);
            return;
        }
        while (isAlphaNumeric(peek())) advance();
        while (true) {
            if (peek() == '.' && isAlphaNumeric(peekNext())) {
                advance();
                while (isAlphaNumeric(peek())) advance();
            } else if (peek() == '[') {
                int close = source.indexOf(']', current);
                int eol = source.indexOf('\n', current);
                if (close < 0 || (eol >= 0 && eol < close)) {
                    error("Unterminated index in variable path");
                    return;
                }
                while (current <= close) advance();
            } else {
                break;
            }
        }
        addToken(TokenType.VARIABLE, source.substring(start + 1, current));
    }

    private void string(char quote) {
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c == '\\' && !isAtEnd()) {
                char escaped = advance();
                int unescaped = RobinStringUtils.unescapeChar(escaped);
                if (unescaped >= 0) {
                    value.append((char) unescaped);
                } else {
                    value.append('\\').append(escaped);
                }
            } else {
                value.append(c);
                if (c == '\n') {
                    line++;
                    column = 1;
                }
            }
        }
        if (isAtEnd()) {
            error("Unterminated string");
            return;
        }
        advance(); // 闭合引号
        addToken(TokenType.STRING, value.toString());
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }
        String text = source.substring(start, current);
        try {
            addToken(TokenType.NUMBER, Double.parseDouble(text));
        } catch (NumberFormatException e) {
            error("Invalid number literal: " + text);
        }
    }

    /** 标识符，允许模块前缀：math.add */
    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        boolean dotted = false;
        while (peek() == '.' && isAlpha(peekNext())) {
            dotted = true;
            advance();
            while (isAlphaNumeric(peek())) advance();
        }
        String text = source.substring(start, current);
        TokenType type = dotted ? null : KEYWORDS.get(text);
        addToken(type != null ? type : TokenType.IDENTIFIER);
    }

    // === 围栏块 ===

    private void fence() {
        atLineStart = false;
        int eol = source.indexOf('\n', current);
        String lineText = RobinStringUtils.trimTrailing(source.substring(current, eol < 0 ? source.length() : eol));

        if (inCodeCell && lineText.equals("---end---")) {
            consume(lineText.length());
            inCodeCell = false;
            addToken(TokenType.CELL_END);
        } else if (lineText.startsWith("---cell")) {
            cell(lineText);
        } else if (lineText.startsWith("--- chunk:") || lineText.startsWith("---chunk:")) {
            consume(lineText.length());
            addToken(TokenType.CHUNK);
        } else if (lineText.equals("---")) {
            promptBlock();
        } else {
            consume(lineText.length());
            error("Unrecognized fence line: " + lineText);
        }
    }

    private void cell(String header) {
        String[] words = header.substring("---cell".length()).replace("---", " ").trim().split("\\s+");
        boolean code = words.length > 0 && words[0].equals("code");
        if (code) {
            consume(header.length());
            inCodeCell = true;
            addToken(TokenType.CELL_START);
            return;
        }
        int endLine = findFenceLine("---end---");
        if (endLine < 0) {
            consume(header.length());
            error("Unterminated cell block, expected ---end---");
            return;
        }
        consumeTo(endLine);
        addToken(TokenType.CELL);
    }

    private void promptBlock() {
        int close = findFenceLine("---");
        if (close < 0) {
            consume(3);
            error("Unterminated prompt block, expected closing ---");
            return;
        }
        consumeTo(close);
        addToken(TokenType.PROMPT_BLOCK);
    }

    /**
     * 从当前行的下一行开始，查找去掉首尾空白后等于 fenceText 的行，
     * 返回该行最后一个非空白字符之后的偏移；找不到返回 -1
     */
    private int findFenceLine(String fenceText) {
        int lineEnd = source.indexOf('\n', current);
        while (lineEnd >= 0) {
            int next = lineEnd + 1;
            int end = source.indexOf('\n', next);
            String text = source.substring(next, end < 0 ? source.length() : end);
            if (text.trim().equals(fenceText)) {
                return next + RobinStringUtils.trimTrailing(text).length();
            }
            lineEnd = end;
        }
        return -1;
    }

    private void consume(int count) {
        for (int i = 0; i < count; i++) advance();
    }

    /** 消费到指定偏移，途经的换行计入行号 */
    private void consumeTo(int offset) {
        while (current < offset) {
            char c = advance();
            if (c == '\n') {
                line++;
                column = 1;
            }
        }
    }

    private void error(String message) {
        String errorMsg = String.format("[%s:%d:%d] Lexer error: %s",
                fileName, line, column, message);
        errStream.println(errorMsg);
        addToken(TokenType.ERROR, message);
    }
}
