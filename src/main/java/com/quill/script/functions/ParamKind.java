package com.quill.script.functions;

import com.quill.script.parser.Value;

/** Expected kind of a native-function parameter. */
public enum ParamKind {
    NUMBER,
    STRING,
    BOOL,
    ANY,
    NULL;

    public boolean accepts(Value v) {
        switch (this) {
            case ANY:    return true;
            case NUMBER: return v.getType() == Value.Type.NUMBER;
            case STRING: return v.getType() == Value.Type.STRING;
            case BOOL:   return v.getType() == Value.Type.BOOL;
            case NULL:   return v.getType() == Value.Type.NULL;
            default:     return false;
        }
    }

    public String displayName() {
        return name().charAt(0) + name().substring(1).toLowerCase();
    }
}
