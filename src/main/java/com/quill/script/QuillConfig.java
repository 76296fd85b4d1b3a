package com.quill.script;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.quill.debug.Debug;
import com.quill.debug.DebugLevel;
import com.quill.script.json.ValueJson;
import com.quill.script.parser.Value;

/**
 * Engine settings.
 *
 * JSON form (every key optional):
 * <pre>
 * {
 *   "maxStringLength": 1048576,
 *   "randomSeed": 42,
 *   "fileRoot": "./data",
 *   "logLevel": "debug",
 *   "globals": { "limit": 10, "greeting": "hi" }
 * }
 * </pre>
 */
public final class QuillConfig {
    private static final String TAG = "Config";

    public static final int DEFAULT_MAX_STRING_LENGTH = 1 << 20;

    private static final Set<String> KEYS =
            Set.of("maxStringLength", "randomSeed", "fileRoot", "logLevel", "globals");

    private final int maxStringLength;
    private final Long randomSeed;
    private final Path fileRoot;
    private final DebugLevel logLevel;
    private final Map<String, Value> globals;

    private QuillConfig(Builder b) {
        this.maxStringLength = b.maxStringLength;
        this.randomSeed = b.randomSeed;
        this.fileRoot = b.fileRoot;
        this.logLevel = b.logLevel;
        this.globals = Collections.unmodifiableMap(new LinkedHashMap<>(b.globals));
    }

    public static QuillConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Longest string a repeat may produce. */
    public int maxStringLength() { return maxStringLength; }

    /** Seed for random(), or null for an unseeded generator. */
    public Long randomSeed() { return randomSeed; }

    /** Directory relative paths of the file built-ins resolve against. */
    public Path fileRoot() { return fileRoot; }

    public DebugLevel logLevel() { return logLevel; }

    /** Bindings declared in the root scope before the first run. */
    public Map<String, Value> globals() { return globals; }

    public Builder toBuilder() {
        Builder b = new Builder()
                .maxStringLength(maxStringLength)
                .randomSeed(randomSeed)
                .fileRoot(fileRoot)
                .logLevel(logLevel);
        b.globals.putAll(globals);
        return b;
    }

    // -------------------------
    // JSON loading
    // -------------------------

    public static QuillConfig load(Path path) throws IOException {
        String json = Files.readString(path, StandardCharsets.UTF_8);
        Debug.get().d(TAG, "loading " + path.toAbsolutePath());
        return fromJson(json);
    }

    public static QuillConfig fromJson(String json) {
        JsonNode root;
        try {
            root = ValueJson.mapper().readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid config JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Config must be a JSON object");
        }

        Builder b = builder();
        for (Iterator<String> it = root.fieldNames(); it.hasNext();) {
            String key = it.next();
            if (!KEYS.contains(key)) Debug.get().w(TAG, "ignoring unknown config key: " + key);
        }

        JsonNode n = root.get("maxStringLength");
        if (n != null) {
            if (!n.canConvertToInt() || !n.isIntegralNumber()) throw badKey("maxStringLength", "an integer", n);
            b.maxStringLength(n.intValue());
        }

        n = root.get("randomSeed");
        if (n != null && !n.isNull()) {
            if (!n.isIntegralNumber() || !n.canConvertToLong()) throw badKey("randomSeed", "an integer", n);
            b.randomSeed(n.longValue());
        }

        n = root.get("fileRoot");
        if (n != null) {
            if (!n.isTextual()) throw badKey("fileRoot", "a string", n);
            b.fileRoot(Path.of(n.asText()));
        }

        n = root.get("logLevel");
        if (n != null) {
            if (!n.isTextual()) throw badKey("logLevel", "a string", n);
            b.logLevel(DebugLevel.parse(n.asText()));
        }

        n = root.get("globals");
        if (n != null) {
            if (!n.isObject()) throw badKey("globals", "an object", n);
            try {
                b.globals(ValueJson.fromJsonObject(n));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Config key 'globals': " + e.getMessage(), e);
            }
        }

        return b.build();
    }

    private static IllegalArgumentException badKey(String key, String expected, JsonNode got) {
        return new IllegalArgumentException(
                "Config key '" + key + "' must be " + expected + ", got " + got.getNodeType() + " " + got);
    }

    public static final class Builder {
        private int maxStringLength = DEFAULT_MAX_STRING_LENGTH;
        private Long randomSeed = null;
        private Path fileRoot = Path.of("");
        private DebugLevel logLevel = DebugLevel.WARN;
        private final Map<String, Value> globals = new LinkedHashMap<>();

        private Builder() {}

        public Builder maxStringLength(int max) {
            if (max <= 0) throw new IllegalArgumentException("maxStringLength must be positive: " + max);
            this.maxStringLength = max;
            return this;
        }

        public Builder randomSeed(Long seed) {
            this.randomSeed = seed;
            return this;
        }

        public Builder fileRoot(Path root) {
            if (root == null) throw new IllegalArgumentException("fileRoot must not be null");
            this.fileRoot = root;
            return this;
        }

        public Builder logLevel(DebugLevel level) {
            if (level == null) throw new IllegalArgumentException("logLevel must not be null");
            this.logLevel = level;
            return this;
        }

        public Builder global(String name, Value value) {
            if (name == null || value == null) throw new IllegalArgumentException("global name and value are required");
            globals.put(name, value);
            return this;
        }

        public Builder globals(Map<String, Value> values) {
            for (Map.Entry<String, Value> e : values.entrySet()) global(e.getKey(), e.getValue());
            return this;
        }

        public QuillConfig build() {
            return new QuillConfig(this);
        }
    }
}
