package com.kilnlang.compiler.lexer;

/**
 * 词法单元类型
 */
public enum TokenType {
    // 关键词
    KW_IMPORT,
    KW_VAL,
    KW_TRUE,
    KW_FALSE,

    // 字面量与标识符
    IDENTIFIER,
    STRING_LITERAL,
    INT_LITERAL,

    // 符号
    COLON,
    SEMICOLON,
    ASSIGN,

    EOF
}
