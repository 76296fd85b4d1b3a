package com.quill.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.quill.debug.Debug;
import com.quill.script.errors.LexError;

public class Lexer {
    private static final String TAG = "Lexer";

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int startLine = 1;
    private int startColumn = 1;

    public Lexer(String source) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        this.source = source;
    }

    public List<Token> tokenize() {
        skipWhitespace();
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column();
            scanToken();
            skipWhitespace();
        }
        tokens.add(new Token(TokenType.EOF, "", null, line, column()));
        Debug.get().d(TAG, "tokenized " + (tokens.size() - 1) + " tokens");
        return tokens;
    }

    private void scanToken() {
        char c = peek();

        if (CharClass.isLetter(c)) { identifier(); return; }
        if (CharClass.isDigit(c)) { number(); return; }
        if (CharClass.isDecimalPoint(c) && CharClass.isDigit(peekNext())) { number(); return; }
        if (CharClass.isQuote(c)) { string(); return; }
        if (!CharClass.isSymbol(c)) throw error("Unexpected character: '" + c + "'");

        advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case ',': addToken(TokenType.COMMA); break;
            case '=': addToken(TokenType.EQUAL); break;
            case '!': addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.STAR); break;
            case '/': addToken(TokenType.SLASH); break;
            case '^': addToken(TokenType.CARET); break;
            case '>': addToken(TokenType.GREATER); break;
            case '<': addToken(TokenType.LESS); break;
            default:
                throw error("Unexpected character: '" + c + "'");
        }
    }

    private void identifier() {
        while (CharClass.isLetter(peek())) advance();
        String text = source.substring(start, current);
        if ("true".equals(text)) addToken(TokenType.BOOLEAN, Boolean.TRUE);
        else if ("false".equals(text)) addToken(TokenType.BOOLEAN, Boolean.FALSE);
        else addToken(TokenType.IDENTIFIER);
    }

    private void number() {
        boolean seenPoint = false;
        while (CharClass.isDigit(peek()) || CharClass.isDecimalPoint(peek())) {
            if (CharClass.isDecimalPoint(peek())) {
                if (seenPoint) {
                    throw error("Malformed number: more than one decimal point in '"
                            + source.substring(start, current + 1) + "'");
                }
                seenPoint = true;
            }
            advance();
        }
        double value = Double.parseDouble(source.substring(start, current));
        addToken(TokenType.NUMBER, value);
    }

    private void string() {
        char quote = advance();
        while (!isAtEnd() && peek() != quote) advance();
        if (isAtEnd()) throw error("Unterminated string");
        advance();
        String value = source.substring(start + 1, current - 1);
        addToken(TokenType.STRING, value);
    }

    private void skipWhitespace() {
        while (!isAtEnd() && CharClass.isWhitespace(peek())) advance();
    }

    private boolean isAtEnd() { return current >= source.length(); }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            lineStart = current;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    private int column() { return current - lineStart + 1; }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, startLine, startColumn));
    }

    private LexError error(String msg) {
        return new LexError(msg, startLine, startColumn);
    }
}
