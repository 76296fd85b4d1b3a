package com.quill.script.parser;

public class Token {
    public final TokenType type;
    public final String lexeme;
    /** Double for NUMBER, Boolean for BOOLEAN, String for STRING, otherwise null. */
    public final Object literal;
    public final int line;
    public final int column;

    public Token(TokenType type, String lexeme, Object literal, int line, int column) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
    }

    public TokenType getType() { return type; }

    @Override
    public String toString() {
        if (type == TokenType.EOF) return "end of input";
        if (type == TokenType.STRING) return "string '" + literal + "'";
        return "'" + lexeme + "'";
    }
}
