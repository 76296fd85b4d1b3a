package com.quill.script.functions;

/** How many arguments a native function takes: exactly n, or at least n. */
public final class Arity {
    private final int count;
    private final boolean variadic;

    private Arity(int count, boolean variadic) {
        if (count < 0) throw new IllegalArgumentException("arity must not be negative: " + count);
        this.count = count;
        this.variadic = variadic;
    }

    public static Arity exact(int count) { return new Arity(count, false); }

    public static Arity atLeast(int min) { return new Arity(min, true); }

    public int count() { return count; }

    public boolean isVariadic() { return variadic; }

    public boolean accepts(int argc) {
        return variadic ? argc >= count : argc == count;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Arity)) return false;
        Arity other = (Arity) o;
        return count == other.count && variadic == other.variadic;
    }

    @Override
    public int hashCode() {
        return 31 * count + (variadic ? 1 : 0);
    }

    @Override
    public String toString() {
        String noun = (count == 1) ? " argument" : " arguments";
        return variadic ? "at least " + count + noun : count + noun;
    }
}
