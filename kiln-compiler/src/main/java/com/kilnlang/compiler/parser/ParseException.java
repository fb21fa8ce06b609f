package com.kilnlang.compiler.parser;

import com.kilnlang.compiler.lexer.Token;

/**
 * 语法错误，仅用于解析器内部的错误恢复
 */
public class ParseException extends RuntimeException {
    private final Token token;

    public ParseException(String message, Token token) {
        super(message);
        this.token = token;
    }

    public Token getToken() {
        return token;
    }
}
