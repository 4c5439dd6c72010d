package com.cellblock.remote.script;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "true", TokenType.TRUE,
            "false", TokenType.FALSE,
            "nil", TokenType.NIL);

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    // newlines inside brackets do not end a statement
    private int nesting = 0;

    public Lexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, line));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(' -> open(TokenType.LEFT_PAREN);
            case ')' -> close(TokenType.RIGHT_PAREN);
            case '[' -> open(TokenType.LEFT_BRACKET);
            case ']' -> close(TokenType.RIGHT_BRACKET);
            case '{' -> open(TokenType.LEFT_BRACE);
            case '}' -> close(TokenType.RIGHT_BRACE);
            case ',' -> addToken(TokenType.COMMA);
            case ':' -> addToken(TokenType.COLON);
            case ';' -> addToken(TokenType.SEMICOLON);
            case '+' -> addToken(TokenType.PLUS);
            case '-' -> addToken(TokenType.MINUS);
            case '*' -> addToken(TokenType.STAR);
            case '/' -> addToken(TokenType.SLASH);
            case '<' -> addToken(TokenType.LESS);
            case '>' -> addToken(TokenType.GREATER);
            case '=' -> addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL);
            case '!' -> {
                if (!match('=')) {
                    throw new ScriptException("unexpected character '!'", line);
                }
                addToken(TokenType.BANG_EQUAL);
            }
            case '#' -> {
                while (!isAtEnd() && peek() != '\n') advance();
            }
            case ' ', '\r', '\t' -> {
            }
            case '\n' -> {
                if (nesting == 0) {
                    addToken(TokenType.NEWLINE);
                }
                line++;
            }
            case '"' -> string();
            default -> {
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    throw new ScriptException("unexpected character '" + c + "'", line);
                }
            }
        }
    }

    private void open(TokenType type) {
        nesting++;
        addToken(type);
    }

    private void close(TokenType type) {
        if (nesting > 0) {
            nesting--;
        }
        addToken(type);
    }

    private void string() {
        var value = new StringBuilder();
        int startLine = line;
        while (!isAtEnd() && peek() != '"') {
            char c = advance();
            if (c == '\n') {
                line++;
                value.append(c);
            } else if (c == '\\') {
                if (isAtEnd()) break;
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case '"' -> value.append('"');
                    case '\\' -> value.append('\\');
                    default -> throw new ScriptException("unknown escape \\" + escaped, line);
                }
            } else {
                value.append(c);
            }
        }
        if (isAtEnd()) {
            throw new ScriptException("unterminated string", startLine);
        }
        advance();
        addToken(TokenType.STRING, value.toString());
    }

    private void number() {
        while (isDigit(peek())) advance();
        String text = source.substring(start, current);
        try {
            addToken(TokenType.NUMBER, Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw new ScriptException("number out of range: " + text, line);
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        addToken(KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER));
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(current);
    }

    private char advance() {
        return source.charAt(current++);
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

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        tokens.add(new Token(type, source.substring(start, current), literal, line));
    }
}
