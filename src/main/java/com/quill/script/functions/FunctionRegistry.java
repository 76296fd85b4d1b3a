package com.quill.script.functions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.quill.debug.Debug;
import com.quill.script.errors.ArityError;
import com.quill.script.errors.NameError;
import com.quill.script.errors.NativeError;
import com.quill.script.errors.QuillError;
import com.quill.script.errors.TypeError;
import com.quill.script.parser.Value;

/**
 * Name-keyed table of native functions.
 *
 * A call goes through four checks in order: the name must be registered
 * ({@link NameError}), the argument count must fit the arity ({@link ArityError}), each
 * argument must match the kind declared for its position ({@link TypeError}), and only
 * then is the implementation invoked. Entries are never removed or replaced.
 */
public class FunctionRegistry {
    private static final String TAG = "Registry";

    private final Map<String, NativeFunction> functions = new LinkedHashMap<>();

    public void register(NativeFunction fn) {
        if (fn == null) throw new IllegalArgumentException("function must not be null");
        if (functions.containsKey(fn.name())) {
            throw new IllegalArgumentException("Function already registered: " + fn.name());
        }
        functions.put(fn.name(), fn);
        Debug.get().t(TAG, "registered " + fn.name() + " (" + fn.arity() + ")");
    }

    public void register(String name, Arity arity, List<ParamKind> kinds, BuiltinFunction impl) {
        register(NativeFunction.of(name, arity, kinds, impl));
    }

    public boolean has(String name) {
        return functions.containsKey(name);
    }

    public NativeFunction get(String name) {
        NativeFunction fn = functions.get(name);
        if (fn == null) throw new NameError("Unknown function: " + name);
        return fn;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(functions.keySet());
    }

    public Value call(String name, List<Value> args) {
        NativeFunction fn = get(name);

        if (!fn.arity().accepts(args.size())) {
            throw new ArityError(name + "() expects " + fn.arity() + ", got " + args.size());
        }

        for (int i = 0; i < args.size(); i++) {
            ParamKind kind = fn.kindAt(i);
            Value arg = args.get(i);
            if (kind == null || !kind.accepts(arg)) {
                throw new TypeError(name + "() argument " + i + " expects "
                        + (kind == null ? "nothing" : kind.displayName()) + ", got " + arg.describe());
            }
        }

        Debug.get().t(TAG, "call " + name + args);
        Value out;
        try {
            out = fn.invoke(new Arguments(name, args));
        } catch (QuillError e) {
            throw e;
        } catch (RuntimeException e) {
            throw new NativeError(name + "() failed: " + e.getMessage(), e);
        }

        if (out == null) {
            throw new NativeError(name + "() returned no value");
        }
        return out;
    }
}
