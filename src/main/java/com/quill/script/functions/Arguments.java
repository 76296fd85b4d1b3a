package com.quill.script.functions;

import java.util.Collections;
import java.util.List;

import com.quill.script.errors.ArityError;
import com.quill.script.errors.TypeError;
import com.quill.script.parser.Value;

/** Read-only, position-indexed view of the arguments passed to a native function. */
public final class Arguments {
    private final String functionName;
    private final List<Value> values;

    public Arguments(String functionName, List<Value> values) {
        this.functionName = functionName;
        this.values = Collections.unmodifiableList(values);
    }

    public int size() { return values.size(); }

    public boolean has(int index) {
        return index >= 0 && index < values.size();
    }

    public List<Value> all() { return values; }

    public Value asAny(int index) {
        if (!has(index)) {
            throw new ArityError(functionName + "(): missing argument at position " + index);
        }
        return values.get(index);
    }

    public double asNumber(int index) {
        return expect(index, Value.Type.NUMBER).asNumber();
    }

    public String asString(int index) {
        return expect(index, Value.Type.STRING).asString();
    }

    public boolean asBool(int index) {
        return expect(index, Value.Type.BOOL).asBool();
    }

    private Value expect(int index, Value.Type type) {
        Value v = asAny(index);
        if (v.getType() != type) {
            throw new TypeError(functionName + "(): argument " + index + " must be "
                    + type.name().toLowerCase() + ", got " + v.describe());
        }
        return v;
    }
}
