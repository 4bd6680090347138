package com.robinpath.compiler.lexer;

/**
 * RobinPath 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    STRING,                 // "..." '...' `...`
    NUMBER,

    // === 标识符与变量 ===
    IDENTIFIER,             // 命令名，可带模块前缀：array.create
    VARIABLE,               // $name / $obj.prop / $arr[0]
    LAST_VALUE,             // 单独的 $
    SUBEXPR_OPEN,           // $(
    DECORATOR,              // @name

    // === 关键词 - 块 ===
    KW_IF, KW_THEN, KW_ELSEIF, KW_ELSE, KW_ENDIF,
    KW_IFTRUE, KW_IFFALSE,
    KW_DEF, KW_ENDDEF,
    KW_DO, KW_ENDDO,
    KW_WITH, KW_ENDWITH,
    KW_FOR, KW_IN, KW_ENDFOR,
    KW_ON, KW_ENDON,
    KW_TOGETHER, KW_ENDTOGETHER,

    // === 关键词 - 语句 ===
    KW_RETURN, KW_BREAK, KW_CONTINUE,
    KW_INTO, KW_SET, KW_AS,

    // === 关键词 - 值与逻辑 ===
    KW_TRUE, KW_FALSE, KW_NULL,
    KW_AND, KW_OR, KW_NOT,

    // === 运算符 ===
    ASSIGN,                 // =
    EQ, NE,                 // == !=
    LT, GT, LE, GE,         // < > <= >=
    AND, OR, NOT,           // && || !
    PLUS, MINUS, MUL, DIV, MOD,

    // === 分隔符 ===
    LPAREN, RPAREN,
    LBRACE, RBRACE,
    LBRACKET, RBRACKET,
    COMMA, COLON,

    // === 围栏块 ===
    CHUNK,                  // --- chunk:id k:v ---
    CELL,                   // 非代码单元格，整体一个 token：---cell type ...--- ... ---end---
    CELL_START,             // 代码单元格头部行
    CELL_END,               // 代码单元格的 ---end---
    PROMPT_BLOCK,           // --- ... ---

    // === 特殊 ===
    COMMENT,
    NEWLINE,
    EOF,
    ERROR
}
