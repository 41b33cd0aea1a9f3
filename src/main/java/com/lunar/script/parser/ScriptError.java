package com.lunar.script.parser;

/**
 * Fatal error raised while lexing, parsing or evaluating one logical line.
 *
 * The script runner catches these per line, records them and moves on; nothing
 * inside the engine recovers from them.
 */
public class ScriptError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public enum Kind {
        LEXICAL("lexical"),
        PARSE("parse"),
        UNDEFINED_MUTATION("undefined_mutation"),
        ARITY_MISMATCH("arity_mismatch"),
        TYPE_COERCION("type_coercion"),
        UNKNOWN_CONSTRUCT("unknown_construct"),
        NOT_CALLABLE("not_callable"),
        CALL_DEPTH("call_depth"),
        STACK_OVERFLOW("stack_overflow"),
        BUILTIN("builtin");

        private final String code;

        Kind(String code) { this.code = code; }

        /** Stable identifier used in reports and JSON output. */
        public String code() { return code; }
    }

    private final Kind kind;

    public ScriptError(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ScriptError(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() { return kind; }

    public static ScriptError lexical(String message) { return new ScriptError(Kind.LEXICAL, message); }
    public static ScriptError parse(String message) { return new ScriptError(Kind.PARSE, message); }
    public static ScriptError typeCoercion(String message) { return new ScriptError(Kind.TYPE_COERCION, message); }
    public static ScriptError arity(String message) { return new ScriptError(Kind.ARITY_MISMATCH, message); }
}
