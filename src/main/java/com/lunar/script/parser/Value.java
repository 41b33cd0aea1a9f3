package com.lunar.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Runtime value: a closed tagged union over nil, boolean, number, string,
 * function and multi-value.
 *
 * MULTI only ever comes out of calls and return statements. It never nests and
 * single-value consumers collapse it with {@link #first()}.
 */
public final class Value {
    public enum Type { NIL, BOOL, NUMBER, STRING, FUNC, MULTI }

    private static final Value NIL = new Value(Type.NIL, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    private static final Pattern NUMERIC = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value nil() { return NIL; }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value string(String s) { return new Value(Type.STRING, Objects.requireNonNull(s, "string")); }
    public static Value func(Callable fn) { return new Value(Type.FUNC, Objects.requireNonNull(fn, "fn")); }

    /** Builds a multi-value, splicing in the elements of any nested multi-value. */
    public static Value multi(List<Value> values) {
        List<Value> flat = new ArrayList<>(values.size());
        for (Value v : values) {
            if (v == null) flat.add(NIL);
            else if (v.type == Type.MULTI) flat.addAll(v.asMulti());
            else flat.add(v);
        }
        return new Value(Type.MULTI, Collections.unmodifiableList(flat));
    }

    public static Value multi(Value... values) {
        List<Value> list = new ArrayList<>(values.length);
        Collections.addAll(list, values);
        return multi(list);
    }

    public Type getType() { return type; }

    public boolean isNil() { return type == Type.NIL; }

    public double asNumber() {
        if (type != Type.NUMBER) throw ScriptError.typeCoercion("Expected number, got " + typeName());
        return (double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw ScriptError.typeCoercion("Expected boolean, got " + typeName());
        return (boolean) value;
    }


    public Callable asFunc() {
        if (type != Type.FUNC) throw ScriptError.typeCoercion("Expected function, got " + typeName());
        return (Callable) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asMulti() {
        if (type != Type.MULTI) throw ScriptError.typeCoercion("Expected multi-value, got " + typeName());
        return (List<Value>) value;
    }

    /** Collapses a multi-value to its first element (nil when empty); other values are returned as is. */
    public Value first() {
        if (type != Type.MULTI) return this;
        List<Value> values = asMulti();
        return values.isEmpty() ? NIL : values.get(0);
    }

    /** Only nil and false are falsy. */
    public boolean isTruthy() {
        switch (type) {
            case NIL: return false;
            case BOOL: return (boolean) value;
            default: return true;
        }
    }

    /** Numeric coercion for arithmetic and ordering: numbers and numeric strings. */
    public double toNumber() {
        if (type == Type.NUMBER) return (double) value;
        if (type == Type.STRING) {
            String s = ((String) value).trim();
            if (NUMERIC.matcher(s).matches()) return Double.parseDouble(s);
            throw ScriptError.typeCoercion("Cannot convert string \"" + value + "\" to a number");
        }
        throw ScriptError.typeCoercion("Attempt to perform arithmetic on a " + typeName() + " value");
    }

    /** Numeric coercion that yields null instead of failing. */
    public Double tryNumber() {
        if (type == Type.NUMBER) return (Double) value;
        if (type == Type.STRING) {
            String s = ((String) value).trim();
            if (NUMERIC.matcher(s).matches()) return Double.parseDouble(s);
        }
        return null;
    }

    /** Textual coercion for concatenation: strings, numbers and booleans. */
    public String toText() {
        switch (type) {
            case STRING: return (String) value;
            case NUMBER: return formatNumber((double) value);
            case BOOL: return Boolean.toString((boolean) value);
            default:
                throw ScriptError.typeCoercion("Attempt to concatenate a " + typeName() + " value");
        }
    }

    /** Lua-style type name. */
    public String typeName() {
        switch (type) {
            case NIL: return "nil";
            case BOOL: return "boolean";
            case NUMBER: return "number";
            case STRING: return "string";
            case FUNC: return "function";
            default: return "multi";
        }
    }

    public static String formatNumber(double d) {
        if (Double.isNaN(d)) return "nan";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == Math.rint(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        // numeric comparison even for the same instance: nan is never equal to itself
        switch (type) {
            case NIL: return true;
            case NUMBER: return (double) value == (double) other.value;
            case FUNC: return value == other.value;
            default: return value.equals(other.value);
        }
    }

    @Override
    public int hashCode() {
        switch (type) {
            case NIL: return 0;
            case NUMBER: {
                double d = (double) value;
                return Double.hashCode(d == 0.0 ? 0.0 : d);
            }
            case FUNC: return System.identityHashCode(value);
            default: return Objects.hash(type, value);
        }
    }

    /** Display form used by print and tostring; never fails. */
    @Override
    public String toString() {
        switch (type) {
            case NIL: return "nil";
            case FUNC: return "function: " + asFunc().name();
            case MULTI: {
                StringBuilder sb = new StringBuilder();
                for (Value v : asMulti()) {
                    if (sb.length() > 0) sb.append(", ");
                    sb.append(v);
                }
                return sb.toString();
            }
            default: return toText();
        }
    }
}
