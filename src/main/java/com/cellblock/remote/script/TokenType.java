package com.cellblock.remote.script;

public enum TokenType {
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACKET, RIGHT_BRACKET, LEFT_BRACE, RIGHT_BRACE,
    COMMA, COLON, SEMICOLON, NEWLINE,
    PLUS, MINUS, STAR, SLASH,
    EQUAL, EQUAL_EQUAL, BANG_EQUAL, LESS, GREATER,
    IDENTIFIER, STRING, NUMBER,
    TRUE, FALSE, NIL,
    EOF
}
