package com.lunar.script;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.lunar.script.parser.ScriptError;

/** One failed logical line: where, what kind, and the message. */
@JsonPropertyOrder({ "index", "kind", "message", "source" })
public final class LineError {
    /** Kind code for failures that did not come from the engine's own error taxonomy. */
    public static final String EXCEPTION = "exception";

    private final int index;
    private final String source;
    private final String kind;
    private final String message;

    public LineError(int index, String source, String kind, String message) {
        this.index = index;
        this.source = source;
        this.kind = kind;
        this.message = message;
    }

    static LineError of(int index, String source, RuntimeException e) {
        String kind = (e instanceof ScriptError) ? ((ScriptError) e).kind().code() : EXCEPTION;
        String message = (e.getMessage() == null) ? e.toString() : e.getMessage();
        return new LineError(index, source, kind, message);
    }

    /** Zero-based position among the logical lines of the run. */
    @JsonProperty("index")
    public int index() { return index; }

    @JsonProperty("source")
    public String source() { return source; }

    @JsonProperty("kind")
    public String kind() { return kind; }

    @JsonProperty("message")
    public String message() { return message; }

    @Override
    public String toString() {
        return "[" + index + "] " + kind + ": " + message + " in '" + source + "'";
    }
}
