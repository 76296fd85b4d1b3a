package com.quill.script;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/** Output and input streams behind the print and read built-ins. */
public final class ScriptConsole {
    private final PrintStream out;
    private final BufferedReader in;

    public ScriptConsole(PrintStream out, BufferedReader in) {
        if (out == null) throw new IllegalArgumentException("out must not be null");
        if (in == null) throw new IllegalArgumentException("in must not be null");
        this.out = out;
        this.in = in;
    }

    /** Console bound to the process stdout and stdin. */
    public static ScriptConsole system() {
        return new ScriptConsole(System.out,
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
    }

    public PrintStream out() { return out; }

    public BufferedReader in() { return in; }
}
