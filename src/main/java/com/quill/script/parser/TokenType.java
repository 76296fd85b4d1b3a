package com.quill.script.parser;

public enum TokenType {
    // Words and literals
    IDENTIFIER, NUMBER, BOOLEAN, STRING,

    // Punctuation
    LEFT_PAREN, RIGHT_PAREN,
    LEFT_BRACE, RIGHT_BRACE,
    LEFT_BRACKET, RIGHT_BRACKET,
    SEMICOLON, COMMA,

    // Operators
    EQUAL, BANG_EQUAL, BANG,
    PLUS, MINUS, STAR, SLASH, CARET,
    GREATER, LESS,

    EOF
}
