package com.lunar.script.parser;

import java.util.List;

import com.lunar.script.parser.Statement.Stmt;

/** A script-defined function: parameters, body and the Environment it was declared in. */
public class UserFunction implements Callable {
    final String name;
    final List<Token> params;
    final List<Stmt> body;
    final Environment closure;

    UserFunction(String name, List<Token> params, List<Stmt> body, Environment closure) {
        this.name = name;
        this.params = params;
        this.body = body;
        this.closure = closure;
    }

    @Override
    public String name() { return name; }

    @Override
    public Value call(Interpreter interpreter, List<Value> args) {
        if (args.size() != params.size()) {
            throw ScriptError.arity(name + "() expects " + params.size() + " arguments, got " + args.size());
        }

        // New call frame is a child of the closure (lexical scoping), never of the caller's scope.
        Environment local = closure.childScope();
        for (int i = 0; i < params.size(); i++) {
            local.define(params.get(i).lexeme, args.get(i));
        }

        Completion completion = interpreter.executeBlock(body, local);
        if (completion.isReturn()) return completion.value();
        return Value.multi(Value.nil());
    }
}
