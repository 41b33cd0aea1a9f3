package com.lunar.script;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import com.lunar.script.parser.Environment;
import com.lunar.script.parser.Interpreter;
import com.lunar.script.parser.NativeFunction;
import com.lunar.script.parser.Value;
import com.lunar.script.plugins.LunarBasePlugin;

/**
 * Core LunarScript engine.
 *
 * - Lua-flavoured, line-oriented syntax (local function / if-then-else-end / return a, b)
 * - Types: nil, boolean, number (double), string, function
 * - Multiple return values and multi-target assignment
 * - Lexically scoped closures
 * - Built-ins registered by the host (registerFunction); print/sqrt/tostring/tonumber/type by default
 * - Per-line fault isolation: a failing top-level statement is reported and skipped
 */
public class LunarScript {

    /** Functional interface for built-in functions. May return a single value or a multi-value. */
    public interface BuiltinFunction {
        Value call(List<Value> args);
    }

    /** Host hook for per-line failures. */
    public interface LineErrorListener {
        void onLineError(LineError error);
    }

    private final Map<String, BuiltinFunction> functions = new LinkedHashMap<>();
    private int maxCallDepth = Interpreter.DEFAULT_MAX_CALL_DEPTH;
    private Consumer<String> output = System.out::println;
    private LineErrorListener errorListener = null;

    public LunarScript() {
        LunarBasePlugin.register(this);
    }

    public void registerFunction(String name, BuiltinFunction fn) { functions.put(name, fn); }

    public Map<String, BuiltinFunction> functions() { return Collections.unmodifiableMap(functions); }

    public void setMaxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("max call depth must be positive: " + depth);
        this.maxCallDepth = depth;
    }

    public int getMaxCallDepth() { return maxCallDepth; }

    /** Where {@code print} writes; one call per printed line. */
    public void setOutput(Consumer<String> output) {
        this.output = (output == null) ? s -> { } : output;
    }

    public void emit(String line) { output.accept(line); }

    public void setErrorListener(LineErrorListener listener) { this.errorListener = listener; }

    /** A fresh root scope holding the registered built-ins. */
    public Environment newGlobalEnvironment() {
        Map<String, Value> initial = new LinkedHashMap<>();
        for (Map.Entry<String, BuiltinFunction> e : functions.entrySet()) {
            initial.put(e.getKey(), Value.func(new NativeFunction(e.getKey(), e.getValue())));
        }
        return new Environment(initial);
    }

    /**
     * A runner over its own root scope. Scripts run through the same runner share
     * globals; use one runner per script that must run concurrently.
     */
    public ScriptRunner newRunner() {
        Interpreter interpreter = new Interpreter(newGlobalEnvironment(), maxCallDepth);
        return new ScriptRunner(interpreter, errorListener);
    }

    /** Runs a whole source text synchronously in a fresh root scope. */
    public RunReport run(String source) {
        try (ScriptRunner runner = newRunner()) {
            return runner.runLines(splitLines(source), () -> false);
        }
    }

    public static List<String> splitLines(String source) {
        if (source == null || source.isEmpty()) return Collections.emptyList();
        String[] parts = source.split("\n", -1);
        List<String> out = new ArrayList<>(parts.length);
        for (String p : parts) {
            out.add(p.endsWith("\r") ? p.substring(0, p.length() - 1) : p);
        }
        return out;
    }
}
