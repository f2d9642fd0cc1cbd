package com.lucas.script.parser;

/**
 * Outcome of executing one statement. Anything other than {@link #NONE}
 * unwinds enclosing blocks until a loop or function boundary absorbs it.
 */
public final class ControlSignal {

    public enum Kind { NONE, RETURN, BREAK, CONTINUE }

    public static final ControlSignal NONE = new ControlSignal(Kind.NONE, null);
    public static final ControlSignal BREAK = new ControlSignal(Kind.BREAK, null);
    public static final ControlSignal CONTINUE = new ControlSignal(Kind.CONTINUE, null);

    private final Kind kind;
    private final Value value;

    private ControlSignal(Kind kind, Value value) {
        this.kind = kind;
        this.value = value;
    }

    public static ControlSignal returning(Value value) {
        return new ControlSignal(Kind.RETURN, value == null ? Value.nil() : value);
    }

    public Kind kind() { return kind; }

    /** Returned value; only meaningful for {@link Kind#RETURN}. */
    public Value value() { return value; }

    public boolean isNone() { return kind == Kind.NONE; }

    @Override
    public String toString() {
        return kind == Kind.RETURN ? "RETURN(" + value + ")" : kind.name();
    }
}
