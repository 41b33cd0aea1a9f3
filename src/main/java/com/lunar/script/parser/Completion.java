package com.lunar.script.parser;

/**
 * Outcome of executing one statement: either it completed normally or a
 * {@code return} is unwinding towards the nearest call boundary.
 */
public final class Completion {
    public static final Completion NORMAL = new Completion(null);

    private final Value returned;

    private Completion(Value returned) {
        this.returned = returned;
    }

    static Completion returning(Value values) {
        return new Completion(values);
    }

    public boolean isReturn() { return returned != null; }

    /** The MULTI value carried by a return; only valid when {@link #isReturn()}. */
    public Value value() {
        if (returned == null) throw new IllegalStateException("Normal completion carries no value");
        return returned;
    }
}
