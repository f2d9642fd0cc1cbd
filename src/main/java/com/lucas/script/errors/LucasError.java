package com.lucas.script.errors;

/**
 * Error raised by the scanner, the parser or the interpreter.
 *
 * The message is the bare human-readable text; position and suggestion are kept
 * apart so that {@link DiagnosticRenderer} can lay them out.
 */
public class LucasError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final SourceLocation location; // may be null
    private final String suggestion;       // may be null

    public LucasError(ErrorKind kind, String message, SourceLocation location, String suggestion) {
        this(kind, message, location, suggestion, null);
    }

    public LucasError(ErrorKind kind, String message, SourceLocation location, String suggestion, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.location = location;
        this.suggestion = suggestion;
    }

    public static LucasError lexical(String message, SourceLocation at) {
        return new LucasError(ErrorKind.LEXICAL, message, at, null);
    }

    public static LucasError syntax(String message, SourceLocation at) {
        return new LucasError(ErrorKind.SYNTAX, message, at, null);
    }

    public static LucasError runtime(String message) {
        return new LucasError(ErrorKind.RUNTIME, message, null, null);
    }

    public static LucasError runtime(String message, SourceLocation at) {
        return new LucasError(ErrorKind.RUNTIME, message, at, null);
    }

    public ErrorKind kind() { return kind; }

    /** Position of the offending token, or null when unknown. */
    public SourceLocation location() { return location; }

    /** "Você quis dizer ...?" text, or null. */
    public String suggestion() { return suggestion; }

    public LucasError withSuggestion(String suggestion) {
        return new LucasError(kind, getMessage(), location, suggestion, getCause());
    }

    /** Fills in a position if this error has none yet; keeps the innermost one otherwise. */
    public LucasError withLocationIfAbsent(SourceLocation at) {
        if (location != null || at == null) return this;
        LucasError located = new LucasError(kind, getMessage(), at, suggestion, getCause());
        located.setStackTrace(getStackTrace());
        return located;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.title());
        if (location != null) sb.append(" [").append(location).append(']');
        sb.append(": ").append(getMessage());
        if (suggestion != null) sb.append(" (").append(suggestion).append(')');
        return sb.toString();
    }
}
