package com.lucas.script.parser;

import java.util.List;

import com.lucas.script.errors.LucasError;
import com.lucas.script.parser.Statement.Stmt;

/** A function declared in script code, closed over its defining scope. */
public class UserFunction implements LucasCallable {
    final String name;
    final List<Token> params;
    final List<Stmt> body;
    final Environment closure;

    UserFunction(String name, List<Token> params, List<Stmt> body, Environment closure) {
        this.name = name;
        this.params = params;
        this.body = body;
        this.closure = closure;
    }

    @Override
    public String name() { return name; }

    @Override
    public int arity() { return params.size(); }

    @Override
    public Value call(Interpreter interpreter, List<Value> args) {
        if (args.size() != params.size()) {
            throw LucasError.runtime("Esperado " + params.size() + " argumentos mas recebeu " + args.size());
        }

        // the frame is a child of the closure, not of the caller
        Environment frame = closure.childScope();
        for (int i = 0; i < params.size(); i++) {
            frame.define(params.get(i).lexeme, args.get(i));
        }

        ControlSignal signal = interpreter.executeBlock(body, frame);
        switch (signal.kind()) {
            case RETURN:
                return signal.value();
            case BREAK:
            case CONTINUE:
                String word = signal.kind() == ControlSignal.Kind.BREAK ? "quebrar" : "continuar";
                throw LucasError.runtime("'" + word + "' escapou da função " + name + "()");
            default:
                return Value.nil();
        }
    }

    @Override
    public String toString() {
        return "<fn " + name + ">";
    }
}
