package com.quill.script.errors;

/** Classification of every failure a script run can end with. */
public enum ErrorKind {
    LEX,
    PARSE,
    NAME,
    ARITY,
    TYPE,
    ARITHMETIC,
    NATIVE
}
