package com.quill.script;

import com.quill.script.errors.QuillError;

/** Receives script errors when a host prefers routing over exceptions. */
@FunctionalInterface
public interface ScriptErrorHandler {
    void onError(QuillError error);
}
