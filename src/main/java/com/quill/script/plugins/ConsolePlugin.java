package com.quill.script.plugins;

import java.io.IOException;
import java.util.List;

import com.quill.script.ScriptConsole;
import com.quill.script.errors.NativeError;
import com.quill.script.functions.Arity;
import com.quill.script.functions.FunctionRegistry;
import com.quill.script.functions.ParamKind;
import com.quill.script.parser.Value;

/**
 * Console built-ins.
 *
 * Scripts:
 *   print("total: " + n);
 *   let name = read();
 */
public final class ConsolePlugin {

    private ConsolePlugin() {}

    public static void register(FunctionRegistry registry, ScriptConsole console) {

        registry.register("print", Arity.exact(1), List.of(ParamKind.ANY), args -> {
            console.out().println(args.asAny(0).stringify());
            console.out().flush();
            return Value.nil();
        });

        registry.register("read", Arity.exact(0), List.of(), args -> {
            try {
                String line = console.in().readLine(); // blocks
                return Value.string(line == null ? "" : line);
            } catch (IOException ioe) {
                throw new NativeError("read() failed: " + ioe.getMessage(), ioe);
            }
        });
    }
}
