package com.cellblock.remote.script;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for cell code.
 *
 * <pre>
 * program    := statement ((NEWLINE | ';') statement)*
 * statement  := IDENTIFIER '=' expression | expression
 * expression := comparison
 * comparison := term (('==' | '!=' | '&lt;' | '&gt;') term)*
 * term       := factor (('+' | '-') factor)*
 * factor     := unary (('*' | '/') unary)*
 * unary      := '-' unary | postfix
 * postfix    := primary ('[' expression ']')*
 * primary    := NUMBER | STRING | true | false | nil | call | IDENTIFIER | '(' expression ')' | list | map
 * </pre>
 */
public class Parser {

    private final List<Token> tokens;
    private int current = 0;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static List<Stmt> parse(String source) {
        return new Parser(new Lexer(source).tokenize()).parse();
    }

    public List<Stmt> parse() {
        var statements = new ArrayList<Stmt>();
        skipSeparators();
        while (!isAtEnd()) {
            statements.add(statement());
            if (!isAtEnd() && !check(TokenType.NEWLINE) && !check(TokenType.SEMICOLON)) {
                throw error(peek(), "expected end of statement");
            }
            skipSeparators();
        }
        return statements;
    }

    private Stmt statement() {
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.EQUAL)) {
            Token name = advance();
            advance();
            return new Stmt.Assign(name, expression());
        }
        return new Stmt.Expression(expression());
    }

    private Expr expression() {
        return comparison();
    }

    private Expr comparison() {
        Expr expr = term();
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL, TokenType.LESS, TokenType.GREATER)) {
            Token operator = previous();
            expr = new Expr.Binary(expr, operator, term());
        }
        return expr;
    }

    private Expr term() {
        Expr expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token operator = previous();
            expr = new Expr.Binary(expr, operator, factor());
        }
        return expr;
    }

    private Expr factor() {
        Expr expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH)) {
            Token operator = previous();
            expr = new Expr.Binary(expr, operator, unary());
        }
        return expr;
    }

    private Expr unary() {
        if (match(TokenType.MINUS)) {
            Token operator = previous();
            return new Expr.Unary(operator, unary());
        }
        return postfix();
    }

    private Expr postfix() {
        Expr expr = primary();
        while (match(TokenType.LEFT_BRACKET)) {
            Token bracket = previous();
            Expr index = expression();
            consume(TokenType.RIGHT_BRACKET, "expected ']' after index");
            expr = new Expr.Index(expr, bracket, index);
        }
        return expr;
    }

    private Expr primary() {
        if (match(TokenType.NUMBER, TokenType.STRING)) return new Expr.Literal(previous().literal());
        if (match(TokenType.TRUE)) return new Expr.Literal(true);
        if (match(TokenType.FALSE)) return new Expr.Literal(false);
        if (match(TokenType.NIL)) return new Expr.Literal(null);
        if (match(TokenType.IDENTIFIER)) {
            Token name = previous();
            if (match(TokenType.LEFT_PAREN)) {
                return new Expr.Call(name, arguments(TokenType.RIGHT_PAREN, "expected ')' after arguments"));
            }
            return new Expr.Variable(name);
        }
        if (match(TokenType.LEFT_PAREN)) {
            Expr expr = expression();
            consume(TokenType.RIGHT_PAREN, "expected ')' after expression");
            return new Expr.Grouping(expr);
        }
        if (match(TokenType.LEFT_BRACKET)) {
            return new Expr.ListLiteral(arguments(TokenType.RIGHT_BRACKET, "expected ']' after list elements"));
        }
        if (match(TokenType.LEFT_BRACE)) {
            return mapLiteral();
        }
        throw error(peek(), "expected expression");
    }

    private List<Expr> arguments(TokenType closing, String message) {
        var items = new ArrayList<Expr>();
        if (!check(closing)) {
            do {
                items.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(closing, message);
        return items;
    }

    private Expr mapLiteral() {
        var keys = new ArrayList<Expr>();
        var values = new ArrayList<Expr>();
        if (!check(TokenType.RIGHT_BRACE)) {
            do {
                keys.add(expression());
                consume(TokenType.COLON, "expected ':' after map key");
                values.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_BRACE, "expected '}' after map entries");
        return new Expr.MapLiteral(keys, values);
    }

    private void skipSeparators() {
        while (match(TokenType.NEWLINE, TokenType.SEMICOLON)) {
            // skip
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkNext(TokenType type) {
        return current + 1 < tokens.size() && tokens.get(current + 1).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private ScriptException error(Token token, String message) {
        String where = token.type() == TokenType.EOF ? "at end" : "at '" + token.lexeme() + "'";
        return new ScriptException(message + " " + where, token.line());
    }
}
