package com.lucas.debug;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Global debug hub for the Lucas engine, CLI and REPL.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...), no-op until one is installed
 * - Records below the configured level never reach the sink
 */
public final class Debug {

    // must be initialized before INSTANCE, the constructor reads it
    private static final DebugSink NOOP = (level, tag, message, error) -> {
        // nothing installed
    };

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);
    private volatile DebugLevel threshold = DebugLevel.TRACE;

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    public void setLevel(DebugLevel level) {
        this.threshold = (level == null) ? DebugLevel.TRACE : level;
    }

    public DebugLevel getLevel() {
        return threshold;
    }

    public boolean isEnabled(DebugLevel level) {
        return sinkRef.get() != NOOP && level.atLeast(threshold);
    }

    // Convenience methods
    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (!level.atLeast(threshold)) return;
        sinkRef.get().log(level, tag, message, error);
    }

    /** Line-per-record sink: "[LEVEL] tag: message". */
    public static DebugSink printTo(PrintStream stream) {
        return (level, tag, message, error) -> {
            stream.println("[" + level + "] " + tag + ": " + message);
            if (error != null) error.printStackTrace(stream);
        };
    }
}
