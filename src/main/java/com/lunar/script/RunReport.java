package com.lunar.script;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.lunar.script.parser.NativeFunction;
import com.lunar.script.parser.Value;

/**
 * Outcome of one script run. Serializes with Jackson as
 * {@code {"executed":N,"cancelled":false,"errors":[...],"globals":{...}}}.
 */
@JsonPropertyOrder({ "executed", "cancelled", "errors", "globals" })
public final class RunReport {
    private final int executed;
    private final boolean cancelled;
    private final List<LineError> errors;
    private final Map<String, Value> globals;

    public RunReport(int executed, boolean cancelled, List<LineError> errors, Map<String, Value> globals) {
        this.executed = executed;
        this.cancelled = cancelled;
        this.errors = Collections.unmodifiableList(errors);
        this.globals = globals;
    }

    /** Logical lines that were attempted, failed ones included. */
    @JsonProperty("executed")
    public int executed() { return executed; }

    @JsonProperty("cancelled")
    public boolean cancelled() { return cancelled; }

    @JsonProperty("errors")
    public List<LineError> errors() { return errors; }

    public boolean ok() { return errors.isEmpty() && !cancelled; }

    /** Root-scope bindings at the end of the run, built-ins included. */
    public Map<String, Value> globals() { return globals; }

    public Value get(String name) {
        Value v = globals.get(name);
        return v == null ? Value.nil() : v;
    }

    /** Script-defined globals rendered as text; host built-ins are left out. */
    @JsonProperty("globals")
    public Map<String, String> globalsAsText() {
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, Value> e : globals.entrySet()) {
            Value v = e.getValue();
            if (v.getType() == Value.Type.FUNC && v.asFunc() instanceof NativeFunction) continue;
            out.put(e.getKey(), v.toString());
        }
        return out;
    }
}
