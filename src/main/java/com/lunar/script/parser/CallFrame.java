package com.lunar.script.parser;

public class CallFrame {
    final String functionName;

    CallFrame(String functionName) {
        this.functionName = functionName;
    }
}
