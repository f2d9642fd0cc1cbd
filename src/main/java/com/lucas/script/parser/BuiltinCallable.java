package com.lucas.script.parser;

import java.util.List;

import com.lucas.script.LucasScript.BuiltinFunction;
import com.lucas.script.errors.ErrorKind;
import com.lucas.script.errors.LucasError;

/** Adapts a host-registered {@link BuiltinFunction} to a script-callable value. */
public final class BuiltinCallable implements LucasCallable {
    private final String name;
    private final BuiltinFunction fn;

    public BuiltinCallable(String name, BuiltinFunction fn) {
        this.name = name;
        this.fn = fn;
    }

    @Override
    public String name() { return name; }

    @Override
    public int arity() { return -1; }

    @Override
    public Value call(Interpreter interpreter, List<Value> arguments) {
        try {
            Value result = fn.call(arguments);
            return result == null ? Value.nil() : result;
        } catch (LucasError e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LucasError(ErrorKind.RUNTIME, name + "(): " + e.getMessage(), null, null, e);
        }
    }
}
