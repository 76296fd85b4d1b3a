package com.quill.script.functions;

import com.quill.script.parser.Value;

/** Implementation callback of a native function. Arguments are already checked. */
@FunctionalInterface
public interface BuiltinFunction {
    Value call(Arguments args);
}
