package com.lunar.script.parser;

import java.util.List;

/** Anything a Call expression can invoke: user functions and host built-ins alike. */
public interface Callable {
    String name();

    Value call(Interpreter interpreter, List<Value> args);
}
