package com.lunar.script.plugins;

import java.util.List;

import com.lunar.script.LunarScript;
import com.lunar.script.parser.ScriptError;
import com.lunar.script.parser.Value;

/**
 * LunarBasePlugin
 *
 * The default built-in set, registered by every {@link LunarScript} instance.
 * Hosts may replace any of these with registerFunction.
 *
 * In scripts:
 *   print("a =", a, "b =", b)
 *   r = sqrt(16)
 *   s = tostring(12) .. "px"
 *   n = tonumber("42")
 *   t = type(f)
 */
public final class LunarBasePlugin {

    private LunarBasePlugin() {}

    public static void register(LunarScript engine) {

        engine.registerFunction("print", args -> {
            StringBuilder line = new StringBuilder();
            for (Value arg : args) {
                if (line.length() > 0) line.append(' ');
                line.append(arg);
            }
            engine.emit(line.toString());
            return Value.nil();
        });

        engine.registerFunction("sqrt", args -> {
            requireArgs("sqrt", args, 1);
            return Value.number(Math.sqrt(args.get(0).toNumber()));
        });

        engine.registerFunction("tostring", args -> {
            requireArgs("tostring", args, 1);
            return Value.string(args.get(0).toString());
        });

        engine.registerFunction("tonumber", args -> {
            requireArgs("tonumber", args, 1);
            Double d = args.get(0).tryNumber();
            return d == null ? Value.nil() : Value.number(d);
        });

        engine.registerFunction("type", args -> {
            requireArgs("type", args, 1);
            return Value.string(args.get(0).typeName());
        });
    }

    private static void requireArgs(String name, List<Value> args, int expected) {
        if (args.size() != expected) {
            throw ScriptError.arity(name + "() expects " + expected + " argument" + (expected == 1 ? "" : "s")
                    + ", got " + args.size());
        }
    }
}
