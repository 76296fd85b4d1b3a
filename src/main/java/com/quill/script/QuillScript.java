package com.quill.script;

import java.util.List;
import java.util.Map;
import java.util.Random;

import com.quill.debug.Debug;
import com.quill.script.errors.QuillError;
import com.quill.script.functions.Arity;
import com.quill.script.functions.BuiltinFunction;
import com.quill.script.functions.FunctionRegistry;
import com.quill.script.functions.NativeFunction;
import com.quill.script.functions.ParamKind;
import com.quill.script.parser.Environment;
import com.quill.script.parser.Interpreter;
import com.quill.script.parser.Value;
import com.quill.script.plugins.ConsolePlugin;
import com.quill.script.plugins.CorePlugin;
import com.quill.script.plugins.FilePlugin;

/**
 * Quill Script engine.
 *
 * - Expression-oriented syntax: let / if / = / + - * / ^ / &gt; &lt;
 * - Types: number (double), string, bool, null
 * - Built-ins: print, read, random, toNumber, toString, substring,
 *              writeFile, readFile, deleteFile, exists
 * - Host functions via registerFunction(...) before running scripts that use them
 *
 * One engine is one interpreter session: variables declared by a run stay visible to the
 * next run on the same engine.
 */
public class QuillScript {
    private static final String TAG = "QuillScript";

    private final QuillConfig config;
    private final FunctionRegistry functions = new FunctionRegistry();
    private final Environment env;
    private final Interpreter interpreter;

    /*
     * ERROR HANDLING CONTRACT:
     *
     * - If NO error handler is set:
     *     -> script errors THROW to the host as QuillError subclasses.
     *
     * - If an error handler IS set:
     *     -> script errors are passed to the handler
     *     -> run(...) returns null-valued Value and does not throw
     *
     * tryRun(...) never throws script errors regardless of the handler.
     */
    private ScriptErrorHandler errorHandler = null;

    public QuillScript() {
        this(QuillConfig.defaults());
    }

    public QuillScript(QuillConfig config) {
        this(config, ScriptConsole.system());
    }

    public QuillScript(QuillConfig config, ScriptConsole console) {
        if (config == null) throw new IllegalArgumentException("config must not be null");
        if (console == null) throw new IllegalArgumentException("console must not be null");
        this.config = config;

        Random random = (config.randomSeed() == null) ? new Random() : new Random(config.randomSeed());
        ConsolePlugin.register(functions, console);
        CorePlugin.register(functions, random);
        FilePlugin.register(functions, config.fileRoot());

        this.env = new Environment(config.globals());
        this.interpreter = new Interpreter(functions, env, config.maxStringLength());
        Debug.get().d(TAG, "engine ready with " + functions.names().size() + " functions");
    }

    public QuillConfig config() { return config; }

    public FunctionRegistry registry() { return functions; }

    public Environment environment() { return env; }

    public void setErrorHandler(ScriptErrorHandler handler) {
        this.errorHandler = handler;
    }

    public void registerFunction(String name, Arity arity, List<ParamKind> kinds, BuiltinFunction fn) {
        functions.register(name, arity, kinds, fn);
    }

    public void registerFunction(NativeFunction fn) {
        functions.register(fn);
    }

    public Value run(String source) {
        try {
            return interpreter.run(source);
        } catch (QuillError e) {
            if (errorHandler == null) {
                Debug.get().d(TAG, "run failed, " + e.kind() + ": " + e.getMessage());
                throw e;
            }
            Debug.get().e(TAG, e.kind() + ": " + e.getMessage());
            errorHandler.onError(e);
            return Value.nil();
        }
    }

    public RunResult tryRun(String source) {
        try {
            Value out = interpreter.run(source);
            return RunResult.ok(out, env.snapshot());
        } catch (QuillError e) {
            Debug.get().d(TAG, "run failed, " + e.kind() + ": " + e.getMessage());
            return RunResult.failed(e, env.snapshot());
        }
    }

    /** Top-level variables as they stand now. */
    public Map<String, Value> globals() {
        return env.snapshot();
    }
}
