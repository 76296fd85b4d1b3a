package com.quill.script.plugins;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import com.quill.debug.Debug;
import com.quill.script.functions.Arity;
import com.quill.script.functions.FunctionRegistry;
import com.quill.script.functions.ParamKind;
import com.quill.script.parser.Value;

/**
 * File-system built-ins. Relative paths resolve against the configured root.
 *
 * Failures never abort the script; they show up in the result:
 *   writeFile(path, text) -> bool
 *   readFile(path)        -> string | null
 *   deleteFile(path)      -> bool
 *   exists(path)          -> bool
 */
public final class FilePlugin {
    private static final String TAG = "Files";

    private FilePlugin() {}

    public static void register(FunctionRegistry registry, Path root) {

        registry.register("writeFile", Arity.exact(2), List.of(ParamKind.STRING, ParamKind.STRING), args -> {
            String name = args.asString(0);
            try {
                Files.writeString(root.resolve(name), args.asString(1), StandardCharsets.UTF_8);
                return Value.bool(true);
            } catch (IOException | InvalidPathException e) {
                Debug.get().w(TAG, "writeFile(" + name + ") failed: " + e);
                return Value.bool(false);
            }
        });

        registry.register("readFile", Arity.exact(1), List.of(ParamKind.STRING), args -> {
            String name = args.asString(0);
            try {
                return Value.string(Files.readString(root.resolve(name), StandardCharsets.UTF_8));
            } catch (NoSuchFileException e) {
                Debug.get().d(TAG, "readFile(" + name + "): no such file");
                return Value.nil();
            } catch (IOException | InvalidPathException e) {
                Debug.get().w(TAG, "readFile(" + name + ") failed: " + e);
                return Value.nil();
            }
        });

        registry.register("deleteFile", Arity.exact(1), List.of(ParamKind.STRING), args -> {
            String name = args.asString(0);
            try {
                return Value.bool(Files.deleteIfExists(root.resolve(name)));
            } catch (IOException | InvalidPathException e) {
                Debug.get().w(TAG, "deleteFile(" + name + ") failed: " + e);
                return Value.bool(false);
            }
        });

        registry.register("exists", Arity.exact(1), List.of(ParamKind.STRING), args -> {
            String name = args.asString(0);
            try {
                return Value.bool(Files.exists(root.resolve(name)));
            } catch (InvalidPathException e) {
                Debug.get().w(TAG, "exists(" + name + "): invalid path: " + e.getMessage());
                return Value.bool(false);
            }
        });
    }
}
