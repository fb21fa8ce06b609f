package com.kilnlang.compiler.parser;

import com.kilnlang.compiler.ast.Expression;
import com.kilnlang.compiler.ast.ImportDirective;
import com.kilnlang.compiler.ast.Literal;
import com.kilnlang.compiler.ast.NameRef;
import com.kilnlang.compiler.ast.SourceLocation;
import com.kilnlang.compiler.ast.SourceUnit;
import com.kilnlang.compiler.ast.ValDecl;
import com.kilnlang.compiler.diagnostic.Diagnostic;
import com.kilnlang.compiler.diagnostic.DiagnosticCode;
import com.kilnlang.compiler.diagnostic.DiagnosticHandler;
import com.kilnlang.compiler.lexer.Lexer;
import com.kilnlang.compiler.lexer.Token;
import com.kilnlang.compiler.lexer.TokenType;
import com.kilnlang.ir.graph.ValueType;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Kiln 容错语法分析器
 *
 * <p>语法：</p>
 * <pre>
 * unit   := (import | val)* EOF
 * import := 'import' STRING ';'
 * val    := 'val' IDENT ':' IDENT '=' expr ';'
 * expr   := INT | STRING | 'true' | 'false' | IDENT
 * </pre>
 *
 * <p>每个语法错误报告一次，然后同步到下一个 {@code ;} 或顶层关键词继续解析，
 * 保证一次编译能看到全部语法错误。</p>
 */
public class Parser {
    private final URI uri;
    private final String fileName;
    private final DiagnosticHandler handler;
    private final List<Token> tokens;
    private int current = 0;

    public Parser(URI uri, String source, DiagnosticHandler handler) {
        this.uri = uri;
        this.fileName = uri.toString();
        this.handler = handler;
        this.tokens = new Lexer(source, fileName, handler).scanTokens();
    }

    public SourceUnit parse() {
        List<ImportDirective> imports = new ArrayList<>();
        List<ValDecl> declarations = new ArrayList<>();

        while (!check(TokenType.EOF)) {
            try {
                if (check(TokenType.KW_IMPORT)) {
                    Token keyword = advance();
                    if (!declarations.isEmpty()) {
                        report("Import directives must come before declarations", keyword);
                    }
                    imports.add(parseImport(keyword));
                } else if (check(TokenType.KW_VAL)) {
                    declarations.add(parseVal(advance()));
                } else {
                    throw new ParseException("Expected a declaration, but got '" + peek().getLexeme() + "'", peek());
                }
            } catch (ParseException e) {
                report(e.getMessage(), e.getToken());
                synchronize();
            }
        }
        return new SourceUnit(uri, imports, declarations);
    }

    private ImportDirective parseImport(Token keyword) {
        Token target = consume(TokenType.STRING_LITERAL, "Expected a URI string after 'import'");
        consume(TokenType.SEMICOLON, "Expected ';' after import");
        return new ImportDirective((String) target.getLiteral(), location(keyword));
    }

    private ValDecl parseVal(Token keyword) {
        Token name = consume(TokenType.IDENTIFIER, "Expected a name after 'val'");
        consume(TokenType.COLON, "Expected ':' after '" + name.getLexeme() + "'");
        Token type = consume(TokenType.IDENTIFIER, "Expected a type name");
        consume(TokenType.ASSIGN, "Expected '=' after type");
        Expression initializer = parseExpression();
        consume(TokenType.SEMICOLON, "Expected ';' after declaration");
        return new ValDecl(name.getLexeme(), type.getLexeme(), initializer, location(name));
    }

    private Expression parseExpression() {
        Token token = peek();
        switch (token.getType()) {
            case INT_LITERAL:
                advance();
                return new Literal(token.getLiteral(), ValueType.INT, location(token));
            case STRING_LITERAL:
                advance();
                return new Literal(token.getLiteral(), ValueType.STRING, location(token));
            case KW_TRUE:
            case KW_FALSE:
                advance();
                return new Literal(token.is(TokenType.KW_TRUE), ValueType.BOOL, location(token));
            case IDENTIFIER:
                advance();
                return new NameRef(token.getLexeme(), location(token));
            default:
                throw new ParseException("Expected an expression, but got '" + token.getLexeme() + "'", token);
        }
    }

    /** 跳到下一个 ';' 之后，或停在下一个顶层关键词前 */
    private void synchronize() {
        while (!check(TokenType.EOF)) {
            if (advance().is(TokenType.SEMICOLON)) {
                return;
            }
            if (check(TokenType.KW_IMPORT) || check(TokenType.KW_VAL)) {
                return;
            }
        }
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, peek());
    }

    private boolean check(TokenType type) {
        return peek().is(type);
    }

    private Token advance() {
        Token token = peek();
        if (!token.is(TokenType.EOF)) {
            current++;
        }
        return token;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private SourceLocation location(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getColumn());
    }

    private void report(String message, Token token) {
        handler.onDiagnostic(Diagnostic.error(DiagnosticCode.COMPILE_DIAGNOSTIC, message, location(token)));
    }
}
