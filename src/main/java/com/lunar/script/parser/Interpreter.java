package com.lunar.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.lunar.script.parser.Expr.Binary;
import com.lunar.script.parser.Expr.Call;
import com.lunar.script.parser.Expr.ExprVisitor;
import com.lunar.script.parser.Expr.Literal;
import com.lunar.script.parser.Expr.Logical;
import com.lunar.script.parser.Expr.Unary;
import com.lunar.script.parser.Expr.Variable;
import com.lunar.script.parser.Statement.Assignment;
import com.lunar.script.parser.Statement.ExprStmt;
import com.lunar.script.parser.Statement.FunctionStmt;
import com.lunar.script.parser.Statement.If;
import com.lunar.script.parser.Statement.ReturnStmt;
import com.lunar.script.parser.Statement.Stmt;
import com.lunar.script.parser.Statement.StmtVisitor;

/**
 * Tree-walking evaluator. The scope every node runs in is passed explicitly;
 * the only state kept here is the root scope and the active call stack.
 */
public class Interpreter implements ExprVisitor<Value>, StmtVisitor<Completion> {
    public static final int DEFAULT_MAX_CALL_DEPTH = 200;

    private final Environment globals;
    private final Deque<CallFrame> callStack = new ArrayDeque<>();
    private final int maxDepth;

    public Interpreter(Environment globals) {
        this(globals, DEFAULT_MAX_CALL_DEPTH);
    }

    public Interpreter(Environment globals, int maxDepth) {
        this.globals = globals;
        this.maxDepth = maxDepth;
    }

    public Environment globals() { return globals; }

    public String currentFunctionName() {
        return callStack.isEmpty() ? null : callStack.peek().functionName;
    }

    public int callDepth() {
        return callStack.size();
    }

    /** Runs one top-level statement against the root scope. */
    public Completion execute(Stmt stmt) {
        return execute(stmt, globals);
    }

    public Completion execute(Stmt stmt, Environment env) {
        return stmt.accept(this, env);
    }

    /** Runs statements in order; stops at the first one that is unwinding a return. */
    Completion executeBlock(List<Stmt> statements, Environment env) {
        for (Stmt s : statements) {
            Completion c = s.accept(this, env);
            if (c.isReturn()) return c;
        }
        return Completion.NORMAL;
    }

    public Value evaluate(Expr.ExprInterface expr, Environment env) {
        return expr.accept(this, env);
    }

    /** Calls a function bound in the root scope by name, as host code. */
    public Value invoke(String name, List<Value> args) {
        Value callee = globals.get(name);
        if (callee.getType() != Value.Type.FUNC) {
            throw new ScriptError(ScriptError.Kind.NOT_CALLABLE, "'" + name + "' is not a function");
        }
        return collapseSingle(call(callee.asFunc(), args));
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public Completion visitExprStmt(ExprStmt stmt, Environment env) {
        evaluate(stmt.expression, env);
        return Completion.NORMAL;
    }

    @Override
    public Completion visitAssignmentStmt(Assignment stmt, Environment env) {
        Value value = evaluate(stmt.value, env);
        List<Value> values;
        if (value.getType() == Value.Type.MULTI) {
            values = value.asMulti();
        } else {
            values = List.of(value);
        }
        for (int i = 0; i < stmt.targets.size(); i++) {
            Value v = i < values.size() ? values.get(i) : Value.nil();
            // declares in the current scope; an outer binding of the same name is shadowed, not mutated
            env.define(stmt.targets.get(i).lexeme, v);
        }
        return Completion.NORMAL;
    }

    @Override
    public Completion visitReturnStmt(ReturnStmt stmt, Environment env) {
        List<Value> values = new ArrayList<>(stmt.values.size());
        int last = stmt.values.size() - 1;
        for (int i = 0; i <= last; i++) {
            Value v = evaluate(stmt.values.get(i), env);
            // only the last expression may contribute more than one value
            values.add(i == last ? v : v.first());
        }
        return Completion.returning(Value.multi(values));
    }

    @Override
    public Completion visitFunctionStmt(FunctionStmt stmt, Environment env) {
        String name = stmt.name.lexeme;
        UserFunction fn = new UserFunction(name, stmt.params, stmt.body, env);
        env.define(name, Value.func(fn));
        return Completion.NORMAL;
    }

    @Override
    public Completion visitIfStmt(If stmt, Environment env) {
        Value cond = evaluate(stmt.condition, env).first();
        if (cond.isTruthy()) {
            return executeBlock(stmt.thenBranch, env);
        }
        if (stmt.elseBranch != null) {
            return executeBlock(stmt.elseBranch, env);
        }
        return Completion.NORMAL;
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Value visitLiteralExpr(Literal expr, Environment env) {
        return expr.value;
    }

    @Override
    public Value visitVariableExpr(Variable expr, Environment env) {
        return env.get(expr.name.lexeme);
    }

    @Override
    public Value visitBinaryExpr(Binary expr, Environment env) {
        Value left = evaluate(expr.left, env);
        Value right = evaluate(expr.right, env);
        TokenType op = expr.operator.type;

        switch (op) {
            case PLUS:
                return Value.number(left.toNumber() + right.toNumber());
            case MINUS:
                return Value.number(left.toNumber() - right.toNumber());
            case STAR:
                return Value.number(left.toNumber() * right.toNumber());
            case SLASH:
                return Value.number(left.toNumber() / right.toNumber());

            case DOT_DOT:
                return Value.string(left.toText() + right.toText());

            case EQUAL_EQUAL:
                return Value.bool(left.equals(right));
            case TILDE_EQUAL:
                return Value.bool(!left.equals(right));

            case LESS:
                return Value.bool(left.toNumber() < right.toNumber());
            case LESS_EQUAL:
                return Value.bool(left.toNumber() <= right.toNumber());
            case GREATER:
                return Value.bool(left.toNumber() > right.toNumber());
            case GREATER_EQUAL:
                return Value.bool(left.toNumber() >= right.toNumber());

            default:
                throw unknown("binary operator", expr.operator);
        }
    }

    @Override
    public Value visitLogicalExpr(Logical expr, Environment env) {
        Value left = evaluate(expr.left, env).first();
        switch (expr.operator.type) {
            case OR:
                if (left.isTruthy()) return left;
                break;
            case AND:
                if (!left.isTruthy()) return left;
                break;
            default:
                throw unknown("logical operator", expr.operator);
        }
        return evaluate(expr.right, env).first();
    }

    @Override
    public Value visitUnaryExpr(Unary expr, Environment env) {
        Value right = evaluate(expr.right, env).first();
        switch (expr.operator.type) {
            case NOT:
                return Value.bool(!right.isTruthy());
            case MINUS:
                return Value.number(-right.toNumber());
            default:
                throw unknown("unary operator", expr.operator);
        }
    }

    @Override
    public Value visitCallExpr(Call expr, Environment env) {
        Value callee = evaluate(expr.callee, env).first();
        if (callee.getType() != Value.Type.FUNC) {
            String what = (expr.callee instanceof Variable) ? "'" + ((Variable) expr.callee).name.lexeme + "'" : "expression";
            throw new ScriptError(ScriptError.Kind.NOT_CALLABLE,
                    "Attempt to call " + what + " (a " + callee.typeName() + " value)");
        }

        List<Value> args = new ArrayList<>(expr.arguments.size());
        for (Expr.ExprInterface a : expr.arguments) {
            args.add(evaluate(a, env).first());
        }

        return collapseSingle(call(callee.asFunc(), args));
    }

    private Value call(Callable fn, List<Value> args) {
        if (callStack.size() >= maxDepth) {
            throw new ScriptError(ScriptError.Kind.CALL_DEPTH,
                    "Call depth exceeded (" + maxDepth + ") calling " + fn.name() + "()");
        }
        callStack.push(new CallFrame(fn.name()));
        try {
            return fn.call(this, args);
        } finally {
            callStack.pop();
        }
    }

    /** A one-element multi-value becomes that element; anything else passes through. */
    private static Value collapseSingle(Value result) {
        if (result.getType() == Value.Type.MULTI) {
            List<Value> values = result.asMulti();
            if (values.size() == 1) return values.get(0);
        }
        return result;
    }

    private static ScriptError unknown(String what, Token token) {
        return new ScriptError(ScriptError.Kind.UNKNOWN_CONSTRUCT, "Unknown " + what + ": " + token.lexeme);
    }
}
