package com.lucas.script;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;

import com.lucas.debug.Debug;
import com.lucas.script.errors.LucasError;
import com.lucas.script.parser.ControlSignal;
import com.lucas.script.parser.Interpreter;
import com.lucas.script.parser.Statement.Stmt;
import com.lucas.script.parser.Value;

/**
 * Interpreter whose global scope survives between chunks of source, as in the REPL.
 * A failed chunk leaves every binding made before the failure in place.
 */
public final class LucasSession {
    private static final String TAG = "lucas.engine";

    private final LucasScript engine;
    private final Interpreter interpreter;

    LucasSession(LucasScript engine, Interpreter interpreter) {
        this.engine = engine;
        this.interpreter = interpreter;
    }

    /** Executes one already-parsed statement against the persistent globals. */
    public ControlSignal execute(Stmt stmt) {
        return interpreter.execute(stmt);
    }

    /** Scans, parses and executes {@code source} against the persistent globals. */
    public void run(String source) {
        List<Stmt> program = engine.parse(source);
        Debug.get().t(TAG, "session chunk: " + program.size() + " statement(s)");
        try {
            interpreter.execute(program);
        } catch (LucasError e) {
            Debug.get().i(TAG, "session chunk failed: " + e);
            throw e;
        }
    }

    /** Read-only view of the global bindings, sorted by name. */
    public SortedMap<String, Value> globals() {
        return Collections.unmodifiableSortedMap(interpreter.globals().snapshot());
    }
}
