package com.quill.script.functions;

import java.util.Collections;
import java.util.List;

import com.quill.script.parser.Value;

/**
 * A host function callable from scripts: a name, an arity, the expected kind of each
 * declared parameter, and the implementation.
 *
 * For variadic functions every argument past the declared kinds is checked against the
 * last declared kind (or accepted as-is when no kind is declared).
 */
public interface NativeFunction {

    String name();

    Arity arity();

    List<ParamKind> paramKinds();

    Value invoke(Arguments args);

    /** Kind expected at a position, or null when the position is never valid. */
    default ParamKind kindAt(int index) {
        List<ParamKind> kinds = paramKinds();
        if (index < kinds.size()) return kinds.get(index);
        if (!arity().isVariadic()) return null;
        return kinds.isEmpty() ? ParamKind.ANY : kinds.get(kinds.size() - 1);
    }

    static NativeFunction of(String name, Arity arity, List<ParamKind> kinds, BuiltinFunction impl) {
        return new Simple(name, arity, kinds, impl);
    }

    final class Simple implements NativeFunction {
        private final String name;
        private final Arity arity;
        private final List<ParamKind> kinds;
        private final BuiltinFunction impl;

        Simple(String name, Arity arity, List<ParamKind> kinds, BuiltinFunction impl) {
            if (name == null || name.isEmpty()) throw new IllegalArgumentException("function name must not be empty");
            if (arity == null) throw new IllegalArgumentException("arity must not be null: " + name);
            if (impl == null) throw new IllegalArgumentException("implementation must not be null: " + name);
            this.name = name;
            this.arity = arity;
            this.kinds = (kinds == null) ? Collections.emptyList() : List.copyOf(kinds);
            this.impl = impl;
            if (!arity.isVariadic() && this.kinds.size() != arity.count()) {
                throw new IllegalArgumentException(
                        name + ": " + this.kinds.size() + " parameter kinds declared for " + arity);
            }
        }

        @Override public String name() { return name; }
        @Override public Arity arity() { return arity; }
        @Override public List<ParamKind> paramKinds() { return kinds; }
        @Override public Value invoke(Arguments args) { return impl.call(args); }

        @Override
        public String toString() {
            return name + kinds;
        }
    }
}
