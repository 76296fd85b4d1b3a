package com.quill.script.parser;

/** Character-class predicates used by the {@link Lexer}. */
public final class CharClass {

    private CharClass() {}

    public static boolean isWhitespace(char c) {
        return Character.isWhitespace(c);
    }

    /** ASCII letters only; identifiers carry no digits or underscores. */
    public static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    public static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    public static boolean isDecimalPoint(char c) {
        return c == '.';
    }

    public static boolean isQuote(char c) {
        return c == '\'' || c == '"';
    }

    /** Single-character operator and punctuation symbols, including the '!' of "!=". */
    public static boolean isSymbol(char c) {
        switch (c) {
            case '(': case ')':
            case '{': case '}':
            case '[': case ']':
            case ';': case ',':
            case '=': case '!':
            case '+': case '-': case '*': case '/': case '^':
            case '>': case '<':
                return true;
            default:
                return false;
        }
    }
}
