package com.oxlang.script.parser;

import java.util.List;

/**
 * Host function bound into the global scope. Returning {@code null} yields nil.
 * Argument checking is up to the implementation; throw {@link com.oxlang.script.OxError}
 * to report a script-level failure.
 */
@FunctionalInterface
public interface NativeFunction {
    Value call(List<Value> args);
}
