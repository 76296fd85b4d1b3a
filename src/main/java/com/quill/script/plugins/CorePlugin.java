package com.quill.script.plugins;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Random;

import com.quill.script.errors.NativeError;
import com.quill.script.functions.Arity;
import com.quill.script.functions.FunctionRegistry;
import com.quill.script.functions.ParamKind;
import com.quill.script.parser.Value;

/**
 * Number and string built-ins: random, toNumber, toString, substring.
 *
 * substring indexes UTF-8 bytes, start and end both inclusive:
 *   substring("hello", 1, 3)  ->  "ell"
 */
public final class CorePlugin {

    private CorePlugin() {}

    public static void register(FunctionRegistry registry, Random random) {

        registry.register("random", Arity.exact(0), List.of(),
                args -> Value.number(random.nextDouble()));

        registry.register("toNumber", Arity.exact(1), List.of(ParamKind.STRING),
                args -> parseNumber(args.asString(0)));

        registry.register("toString", Arity.exact(1), List.of(ParamKind.NUMBER),
                args -> Value.string(Value.formatNumber(args.asNumber(0))));

        registry.register("substring", Arity.exact(3),
                List.of(ParamKind.STRING, ParamKind.NUMBER, ParamKind.NUMBER),
                args -> Value.string(substring(args.asString(0), args.asNumber(1), args.asNumber(2))));
    }

    static Value parseNumber(String text) {
        String s = text.trim();
        if (s.isEmpty()) return Value.nil();
        // Only plain decimals; Double.parseDouble alone would also take "NaN", "1e3" or "0x1p3".
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            boolean ok = (c >= '0' && c <= '9') || c == '.' || (i == 0 && (c == '-' || c == '+'));
            if (!ok) return Value.nil();
        }
        try {
            return Value.number(Double.parseDouble(s));
        } catch (NumberFormatException e) {
            return Value.nil();
        }
    }

    static String substring(String s, double start, double end) {
        byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        int from = index("start", start);
        int to = index("end", end);
        if (from > to + 1 || to >= bytes.length) {
            throw new NativeError("substring(): range " + from + ".." + to
                    + " is out of bounds for " + bytes.length + " bytes");
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes, from, to - from + 1))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new NativeError("substring(): range " + from + ".." + to
                    + " does not fall on character boundaries", e);
        }
    }

    private static int index(String what, double d) {
        if (d != Math.rint(d) || d < 0 || d > Integer.MAX_VALUE) {
            throw new NativeError("substring(): " + what + " index must be a non-negative integer, got "
                    + Value.formatNumber(d));
        }
        return (int) d;
    }
}
