package com.quill.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import com.quill.debug.Debug;
import com.quill.debug.DebugLevel;
import com.quill.debug.StreamDebugSink;
import com.quill.script.errors.QuillError;
import com.quill.script.json.ValueJson;
import com.quill.script.parser.Value;

/**
 * Command-line runner.
 *
 * <pre>
 *   QuillCli --script=app.qs [--config=quill.json] [--json] [--log=debug]
 *   QuillCli --eval="print(2 ^ 10);"
 *   QuillCli                      (interactive REPL)
 * </pre>
 */
public final class QuillCli {
    private static final String TAG = "QuillCli";

    static final int EXIT_OK = 0;
    static final int EXIT_SCRIPT_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_UNREADABLE = 3;

    public static void main(String[] args) {
        BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        int code = run(args, stdin, System.out, System.err);
        if (code != EXIT_OK) System.exit(code);
    }

    static int run(String[] args, BufferedReader in, PrintStream out, PrintStream err) {
        Map<String, String> flags = parseArgs(args);
        if (flags.containsKey("help")) {
            printUsage(out);
            return EXIT_OK;
        }

        QuillConfig config;
        try {
            config = flags.containsKey("config")
                    ? QuillConfig.load(Path.of(flags.get("config")))
                    : QuillConfig.defaults();
        } catch (IOException e) {
            err.println("Failed to read config file: " + flags.get("config") + " (" + e.getMessage() + ")");
            return EXIT_UNREADABLE;
        } catch (IllegalArgumentException e) {
            err.println("Invalid config: " + e.getMessage());
            return EXIT_USAGE;
        }

        DebugLevel level = config.logLevel();
        if (flags.containsKey("log")) {
            try {
                level = DebugLevel.parse(flags.get("log"));
            } catch (IllegalArgumentException e) {
                err.println(e.getMessage());
                return EXIT_USAGE;
            }
        }
        Debug.get().setSink(new StreamDebugSink(err, level));

        boolean json = flags.containsKey("json");
        QuillScript engine = new QuillScript(config, new ScriptConsole(out, in));

        String source;
        if (flags.containsKey("eval")) {
            source = flags.get("eval");
        } else if (flags.containsKey("script")) {
            Path scriptPath = Path.of(flags.get("script"));
            try {
                source = Files.readString(scriptPath, StandardCharsets.UTF_8);
            } catch (IOException e) {
                err.println("Failed to read script file: " + scriptPath + " (" + e.getMessage() + ")");
                return EXIT_UNREADABLE;
            }
        } else {
            return repl(engine, in, out, err);
        }

        try {
            Value result = engine.run(source);
            if (json) {
                out.println(ValueJson.pretty(ValueJson.toJson(result)));
            } else if (!result.isNull()) {
                out.println(result);
            }
            return EXIT_OK;
        } catch (QuillError e) {
            err.println(e.kind() + " error: " + e.getMessage());
            return EXIT_SCRIPT_ERROR;
        }
    }

    // -----------------------------
    // REPL Loop
    // -----------------------------
    private static int repl(QuillScript engine, BufferedReader in, PrintStream out, PrintStream err) {
        out.println("Quill Script REPL. Type ':help' for commands.");
        while (true) {
            out.print("> ");
            out.flush();
            String line;
            try {
                line = in.readLine();
            } catch (IOException e) {
                err.println("Failed to read input: " + e.getMessage());
                return EXIT_UNREADABLE;
            }
            if (line == null) break; // EOF
            line = line.trim();
            if (line.isEmpty()) continue;

            if (":quit".equals(line) || ":exit".equals(line)) break;
            if (":help".equals(line)) {
                out.println("  <statements>;   run against the current session");
                out.println("  :vars           show session variables as JSON");
                out.println("  :quit | :exit   leave");
                continue;
            }
            if (":vars".equals(line)) {
                out.println(ValueJson.pretty(ValueJson.toJson(engine.globals())));
                continue;
            }

            RunResult rr = engine.tryRun(line);
            if (rr.isOk()) {
                if (!rr.value().isNull()) out.println(rr.value());
            } else {
                err.println(rr.error().kind() + " error: " + rr.error().getMessage());
            }
        }
        Debug.get().d(TAG, "REPL finished");
        return EXIT_OK;
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: QuillCli [--script=<file> | --eval=<source>] [--config=<file.json>] [--json] [--log=<level>]");
        out.println("Without --script or --eval an interactive session starts.");
    }

    /**
     * Minimal arg parser:
     *   --script=/path/app.qs --config=/path/quill.json
     *   --json --log=debug
     */
    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (String a : args) {
            if (a.startsWith("--") && a.contains("=")) {
                int i = a.indexOf('=');
                out.put(a.substring(2, i), a.substring(i + 1));
            } else if (a.startsWith("--")) {
                out.put(a.substring(2), "true");
            } else if (!out.containsKey("script")) {
                out.put("script", a);
            }
        }
        return out;
    }

    private QuillCli() {}
}
