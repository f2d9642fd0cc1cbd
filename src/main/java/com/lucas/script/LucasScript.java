package com.lucas.script;

import java.io.PrintStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.lucas.debug.Debug;
import com.lucas.script.errors.LucasError;
import com.lucas.script.parser.Environment;
import com.lucas.script.parser.Interpreter;
import com.lucas.script.parser.Lexer;
import com.lucas.script.parser.Parser;
import com.lucas.script.parser.Statement.Stmt;
import com.lucas.script.parser.Token;
import com.lucas.script.parser.Value;

/**
 * Core LucasLang engine.
 *
 * - Portuguese keywords (variavel / se / senao / enquanto / para / funcao / retornar / imprimir)
 * - Types: numero (double), texto, booleano, nulo, array, funcao
 * - Built-ins registered via registerFunction; user bindings shadow them
 * - Control flow: retornar, quebrar, continuar
 * - Mode:
 *     - STRICT (default): malformed input is a lexical or syntax error
 *     - LENIENT: bad characters are skipped, broken literals degrade, and an
 *                unparseable operand becomes nulo
 */
public class LucasScript {
    private static final String TAG = "lucas.engine";

    public static final int DEFAULT_MAX_CALL_DEPTH = 256;

    /** Scanner/parser error policy. Default STRICT. */
    public enum Mode {
        STRICT,
        LENIENT
    }

    /** Functional interface for built-in functions. */
    public interface BuiltinFunction {
        Value call(List<Value> args);
    }

    private final Map<String, BuiltinFunction> functions = new HashMap<String, BuiltinFunction>();
    private int maxCallDepth = DEFAULT_MAX_CALL_DEPTH;
    private Mode mode = Mode.STRICT;
    private PrintStream out = System.out;

    public LucasScript() {
        registerCoreBuiltins();
    }

    public void setMaxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("max call depth must be >= 1, got " + depth);
        this.maxCallDepth = depth;
    }

    public int getMaxCallDepth() { return maxCallDepth; }

    public void setMode(Mode mode) { this.mode = (mode == null) ? Mode.STRICT : mode; }

    public Mode getMode() { return mode; }

    /** Destination of {@code imprimir}. Defaults to System.out. */
    public void setOutput(PrintStream out) { this.out = (out == null) ? System.out : out; }

    public PrintStream getOutput() { return out; }

    public void registerFunction(String name, BuiltinFunction fn) { functions.put(name, fn); }

    /** Names of all registered built-ins, sorted. */
    public Set<String> builtinNames() {
        return Collections.unmodifiableSet(new TreeSet<>(functions.keySet()));
    }

    /** Scans and parses without executing. */
    public List<Stmt> parse(String source) {
        List<Token> tokens = new Lexer(source, mode).tokenize();
        return new Parser(tokens, mode).parse();
    }

    /**
     * Runs a complete program in a fresh global scope.
     *
     * @return the global bindings after execution, sorted by name
     * @throws LucasError on the first lexical, syntax or runtime error
     */
    public Map<String, Value> run(String source) {
        Debug.get().d(TAG, "run: " + source.length() + " chars, mode=" + mode);
        Environment globals = new Environment();
        try {
            List<Stmt> program = parse(source);
            newInterpreter(globals).execute(program);
        } catch (LucasError e) {
            Debug.get().i(TAG, "run failed: " + e);
            throw e;
        }
        return globals.snapshot();
    }

    /** A session whose globals persist across {@link LucasSession#run(String)} calls. */
    public LucasSession newSession() {
        return new LucasSession(this, newInterpreter(new Environment()));
    }

    Interpreter newInterpreter(Environment globals) {
        return new Interpreter(globals, functions, maxCallDepth, out);
    }

    private void registerCoreBuiltins() {
        registerFunction("comprimento", args -> {
            requireArgCount("comprimento", args, 1);
            Value v = args.get(0);
            switch (v.getType()) {
                case TEXT: {
                    String s = v.asText();
                    return Value.number(s.codePointCount(0, s.length()));
                }
                case ARRAY: return Value.number(v.asArray().size());
                default: throw LucasError.runtime("comprimento() espera texto ou array");
            }
        });

        registerFunction("maiuscula", args -> {
            requireArgCount("maiuscula", args, 1);
            return Value.text(requireText("maiuscula", args.get(0)).toUpperCase(Locale.ROOT));
        });

        registerFunction("minuscula", args -> {
            requireArgCount("minuscula", args, 1);
            return Value.text(requireText("minuscula", args.get(0)).toLowerCase(Locale.ROOT));
        });

        registerFunction("tipo", args -> {
            requireArgCount("tipo", args, 1);
            return Value.text(args.get(0).getType().displayName());
        });

        registerFunction("texto", args -> {
            requireArgCount("texto", args, 1);
            return Value.text(args.get(0).stringify());
        });

        registerFunction("adicionar", args -> {
            requireArgCount("adicionar", args, 2);
            Value arr = args.get(0);
            if (arr.getType() != Value.Type.ARRAY) {
                throw LucasError.runtime("adicionar() espera um array como primeiro argumento");
            }
            arr.asArray().add(args.get(1));
            return arr;
        });
    }

    private static String requireText(String name, Value v) {
        if (v.getType() != Value.Type.TEXT) throw LucasError.runtime(name + "() espera texto");
        return v.asText();
    }

    private static void requireArgCount(String name, List<Value> args, int expected) {
        if (args.size() != expected) {
            String noun = expected == 1 ? " argumento" : " argumentos";
            throw LucasError.runtime(name + "() espera " + expected + noun + ", recebeu " + args.size());
        }
    }
}
