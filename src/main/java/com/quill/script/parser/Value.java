package com.quill.script.parser;

import java.math.BigDecimal;
import java.util.Objects;

import com.quill.script.errors.TypeError;

/**
 * Runtime value: a number, a string, a boolean or null.
 *
 * Values are immutable. Equality is structural and never crosses variants, so
 * {@code number(1)} and {@code string("1")} are different values.
 */
public final class Value {
    public enum Type { NUMBER, STRING, BOOL, NULL }

    private static final Value NIL = new Value(Type.NULL, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    // Integral values below this print without a fractional part.
    private static final double PLAIN_INTEGER_LIMIT = 1e15;

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    /** Negative zero is stored as zero, so both compare and hash alike. */
    public static Value number(double d) { return new Value(Type.NUMBER, d == 0.0 ? 0.0 : d); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value nil() { return NIL; }

    public static Value string(String s) {
        if (s == null) throw new IllegalArgumentException("string value must not be null");
        return new Value(Type.STRING, s);
    }

    public Type getType() { return type; }

    public boolean isNull() { return type == Type.NULL; }

    public double asNumber() {
        if (type != Type.NUMBER) throw new TypeError("Expected number, got " + describe());
        return (Double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new TypeError("Expected bool, got " + describe());
        return (Boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new TypeError("Expected string, got " + describe());
        return (String) value;
    }

    /** Text used by print and string concatenation. */
    public String stringify() {
        switch (type) {
            case NUMBER: return formatNumber(asNumber());
            case STRING: return asString();
            case BOOL:   return Boolean.toString(asBool());
            default:     return "null";
        }
    }

    /** Type name plus a short rendering, for error messages. */
    public String describe() {
        switch (type) {
            case NUMBER: return "number " + formatNumber(asNumber());
            case STRING: return "string " + this;
            case BOOL:   return "bool " + asBool();
            default:     return "null";
        }
    }

    /**
     * Canonical number text: integral values print without a fractional part, others in
     * plain decimal with the shortest digits that round-trip.
     */
    public static String formatNumber(double d) {
        if (Double.isNaN(d)) return "NaN";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == Math.rint(d) && Math.abs(d) < PLAIN_INTEGER_LIMIT) {
            return Long.toString((long) d);
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        return type == other.type && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        switch (type) {
            case NUMBER:
                return formatNumber(asNumber());
            case BOOL:
                return Boolean.toString(asBool());
            case STRING:
                return '"' + asString() + '"';
            default:
                return "null";
        }
    }
}
