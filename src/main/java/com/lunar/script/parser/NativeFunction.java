package com.lunar.script.parser;

import java.util.List;

import com.lunar.script.LunarScript.BuiltinFunction;

/** Adapts a host {@link BuiltinFunction} to the script calling convention. */
public final class NativeFunction implements Callable {
    private final String name;
    private final BuiltinFunction fn;

    public NativeFunction(String name, BuiltinFunction fn) {
        this.name = name;
        this.fn = fn;
    }

    @Override
    public String name() { return name; }

    @Override
    public Value call(Interpreter interpreter, List<Value> args) {
        Value out;
        try {
            out = fn.call(args);
        } catch (ScriptError e) {
            throw e;
        } catch (RuntimeException e) {
            String msg = (e.getMessage() == null) ? e.toString() : e.getMessage();
            throw new ScriptError(ScriptError.Kind.BUILTIN, name + "(): " + msg, e);
        }
        return out == null ? Value.nil() : out;
    }
}
