package com.lucas.script.parser;

import java.util.List;

/** Anything a call expression can invoke. */
public interface LucasCallable {
    String name();

    /** Expected argument count, or -1 when the callable checks its own arguments. */
    int arity();

    Value call(Interpreter interpreter, List<Value> arguments);
}
