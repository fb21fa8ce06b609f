package com.kilnlang.compiler.lexer;

import com.kilnlang.compiler.ast.SourceLocation;
import com.kilnlang.compiler.diagnostic.Diagnostic;
import com.kilnlang.compiler.diagnostic.DiagnosticCode;
import com.kilnlang.compiler.diagnostic.DiagnosticHandler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Kiln 词法分析器
 *
 * <p>非法字符和未闭合字符串通过 {@link DiagnosticHandler} 报告后跳过，不中断扫描。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;
    private final DiagnosticHandler handler;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("import", TokenType.KW_IMPORT);
        map.put("val", TokenType.KW_VAL);
        map.put("true", TokenType.KW_TRUE);
        map.put("false", TokenType.KW_FALSE);
        KEYWORDS = Collections.unmodifiableMap(map);
    }

    public Lexer(String source, String fileName, DiagnosticHandler handler) {
        this.source = source;
        this.fileName = fileName;
        this.handler = handler;
    }

    /**
     * 执行词法分析，返回 Token 列表（以 EOF 结尾）
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, line, column));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ' ':
            case '\r':
            case '\t':
            case '\n':
                break;
            case ':': addToken(TokenType.COLON, null); break;
            case ';': addToken(TokenType.SEMICOLON, null); break;
            case '=': addToken(TokenType.ASSIGN, null); break;
            case '"': string(); break;
            case '/':
                if (match('/')) {
                    // 单行注释
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else {
                    error("Unexpected character '/'");
                }
                break;
            case '-':
                if (isDigit(peek())) {
                    number();
                } else {
                    error("Unexpected character '-'");
                }
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character '" + c + "'");
                }
        }
    }

    private void string() {
        StringBuilder value = new StringBuilder();
        while (peek() != '"' && peek() != '\n' && !isAtEnd()) {
            char c = advance();
            if (c == '\\' && !isAtEnd()) {
                char escaped = advance();
                switch (escaped) {
                    case 'n': value.append('\n'); break;
                    case 't': value.append('\t'); break;
                    case '"': value.append('"'); break;
                    case '\\': value.append('\\'); break;
                    default:
                        error("Unknown escape sequence '\\" + escaped + "'");
                }
            } else {
                value.append(c);
            }
        }
        if (peek() != '"') {
            error("Unterminated string literal");
            return;
        }
        advance(); // 闭合引号
        addToken(TokenType.STRING_LITERAL, value.toString());
    }

    private void number() {
        while (isDigit(peek())) advance();
        String text = source.substring(start, current);
        try {
            addToken(TokenType.INT_LITERAL, Integer.parseInt(text));
        } catch (NumberFormatException e) {
            error("Integer literal out of range: " + text);
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        addToken(type != null ? type : TokenType.IDENTIFIER, null);
    }

    private void addToken(TokenType type, Object literal) {
        tokens.add(new Token(type, source.substring(start, current), literal, startLine, startColumn));
    }

    private void error(String message) {
        handler.onDiagnostic(Diagnostic.error(DiagnosticCode.COMPILE_DIAGNOSTIC, message,
                new SourceLocation(fileName, startLine, startColumn)));
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(current);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
