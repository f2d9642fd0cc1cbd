package com.lucas.script.parser;

import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.lucas.debug.Debug;
import com.lucas.debug.DebugLevel;
import com.lucas.script.LucasScript.BuiltinFunction;
import com.lucas.script.errors.LucasError;
import com.lucas.script.errors.Suggestions;
import com.lucas.script.parser.Expr.ArrayLiteral;
import com.lucas.script.parser.Expr.Assign;
import com.lucas.script.parser.Expr.Binary;
import com.lucas.script.parser.Expr.Call;
import com.lucas.script.parser.Expr.ExprVisitor;
import com.lucas.script.parser.Expr.Index;
import com.lucas.script.parser.Expr.Literal;
import com.lucas.script.parser.Expr.Logical;
import com.lucas.script.parser.Expr.SetIndex;
import com.lucas.script.parser.Expr.Unary;
import com.lucas.script.parser.Expr.Variable;
import com.lucas.script.parser.Statement.Block;
import com.lucas.script.parser.Statement.BreakStmt;
import com.lucas.script.parser.Statement.ContinueStmt;
import com.lucas.script.parser.Statement.ExprStmt;
import com.lucas.script.parser.Statement.FunctionStmt;
import com.lucas.script.parser.Statement.If;
import com.lucas.script.parser.Statement.PrintStmt;
import com.lucas.script.parser.Statement.ReturnStmt;
import com.lucas.script.parser.Statement.Stmt;
import com.lucas.script.parser.Statement.StmtVisitor;
import com.lucas.script.parser.Statement.VarStmt;
import com.lucas.script.parser.Statement.While;

public class Interpreter implements ExprVisitor<Value>, StmtVisitor {
    private static final String TAG = "lucas.interpreter";

    Environment env;
    private final Environment globals;
    private final Map<String, BuiltinFunction> functions;
    private final Map<String, Value> builtinValues = new HashMap<>();
    private final Deque<CallFrame> callStack = new ArrayDeque<CallFrame>();
    private final int maxDepth;
    private final PrintStream out;

    public Interpreter(Environment env, Map<String, BuiltinFunction> functions, int maxDepth, PrintStream out) {
        this.env = env;
        this.globals = env.root();
        this.functions = functions;
        this.maxDepth = maxDepth;
        this.out = out;
    }

    public Environment globals() {
        return globals;
    }

    /** Runs a whole program; a control signal reaching the top level is an error. */
    public void execute(List<Stmt> program) {
        try {
            for (Stmt stmt : program) {
                ControlSignal signal = execute(stmt);
                if (!signal.isNone()) {
                    throw LucasError.runtime("Sinal de controle " + signal.kind() + " fora de contexto");
                }
            }
        } catch (LucasError e) {
            Debug.get().d(TAG, "runtime error: " + e);
            throw e;
        }
    }

    public ControlSignal execute(Stmt stmt) {
        return stmt.accept(this);
    }

    public Value evaluate(Expr.ExprInterface expr) {
        return expr.accept(this);
    }

    /** Executes {@code statements} in {@code scope}, restoring the current scope afterwards. */
    public ControlSignal executeBlock(List<Stmt> statements, Environment scope) {
        Environment previous = this.env;
        this.env = scope;
        try {
            for (Stmt s : statements) {
                ControlSignal signal = s.accept(this);
                if (!signal.isNone()) return signal;
            }
            return ControlSignal.NONE;
        } finally {
            this.env = previous;
        }
    }

    // ===================== STATEMENTS =====================

    @Override
    public ControlSignal visitExprStmt(ExprStmt stmt) {
        evaluate(stmt.expression);
        return ControlSignal.NONE;
    }

    @Override
    public ControlSignal visitPrintStmt(PrintStmt stmt) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < stmt.expressions.size(); i++) {
            if (i > 0) line.append(' ');
            line.append(evaluate(stmt.expressions.get(i)).stringify());
        }
        out.println(line);
        return ControlSignal.NONE;
    }

    @Override
    public ControlSignal visitVarStmt(VarStmt stmt) {
        Value value = evaluate(stmt.initializer);
        env.define(stmt.name.lexeme, value);
        return ControlSignal.NONE;
    }

    @Override
    public ControlSignal visitBlockStmt(Block stmt) {
        return executeBlock(stmt.statements, env.childScope());
    }

    @Override
    public ControlSignal visitIfStmt(If stmt) {
        if (evaluate(stmt.condition).isTruthy()) {
            return execute(stmt.thenBranch);
        } else if (stmt.elseBranch != null) {
            return execute(stmt.elseBranch);
        }
        return ControlSignal.NONE;
    }

    @Override
    public ControlSignal visitWhileStmt(While stmt) {
        while (evaluate(stmt.condition).isTruthy()) {
            ControlSignal signal = execute(stmt.body);
            switch (signal.kind()) {
                case BREAK:
                    return ControlSignal.NONE;
                case RETURN:
                    return signal;
                default:
                    // NONE or CONTINUE
                    if (stmt.increment != null) evaluate(stmt.increment);
            }
        }
        return ControlSignal.NONE;
    }

    @Override
    public ControlSignal visitFunctionStmt(FunctionStmt stmt) {
        UserFunction fn = new UserFunction(stmt.name.lexeme, stmt.params, stmt.body, env);
        env.define(stmt.name.lexeme, Value.function(fn));
        return ControlSignal.NONE;
    }

    @Override
    public ControlSignal visitReturnStmt(ReturnStmt stmt) {
        Value value = (stmt.value == null) ? Value.nil() : evaluate(stmt.value);
        return ControlSignal.returning(value);
    }

    @Override
    public ControlSignal visitBreakStmt(BreakStmt stmt) {
        return ControlSignal.BREAK;
    }

    @Override
    public ControlSignal visitContinueStmt(ContinueStmt stmt) {
        return ControlSignal.CONTINUE;
    }

    // ===================== EXPRESSIONS =====================

    @Override
    public Value visitLiteralExpr(Literal expr) {
        return Value.fromLiteral(expr.value);
    }

    @Override
    public Value visitArrayLiteralExpr(ArrayLiteral expr) {
        List<Value> items = new ArrayList<>(expr.elements.size());
        for (Expr.ExprInterface e : expr.elements) items.add(evaluate(e));
        return Value.array(items);
    }

    @Override
    public Value visitVariableExpr(Variable expr) {
        String name = expr.name.lexeme;
        if (env.exists(name)) return env.get(name);

        BuiltinFunction fn = functions.get(name);
        if (fn != null) {
            return builtinValues.computeIfAbsent(name, n -> Value.function(new BuiltinCallable(n, fn)));
        }
        throw undefinedVariable(expr.name);
    }

    @Override
    public Value visitAssignExpr(Assign expr) {
        Value value = evaluate(expr.value);
        if (!env.exists(expr.name.lexeme)) throw undefinedVariable(expr.name);
        env.assign(expr.name.lexeme, value);
        return value;
    }

    @Override
    public Value visitLogicalExpr(Logical expr) {
        // both sides are always evaluated
        boolean left = evaluate(expr.left).isTruthy();
        boolean right = evaluate(expr.right).isTruthy();
        if (expr.operator.type == TokenType.OR) return Value.bool(left || right);
        return Value.bool(left && right);
    }

    @Override
    public Value visitUnaryExpr(Unary expr) {
        Value right = evaluate(expr.right);
        switch (expr.operator.type) {
            case MINUS:
                if (right.type != Value.Type.NUMBER) {
                    throw error(expr.operator, "Operador unário '-' espera número");
                }
                return Value.number(-right.asNumber());
            case BANG:
            case NOT:
                return Value.bool(!right.isTruthy());
            default:
                throw error(expr.operator, "Operador unário desconhecido: " + expr.operator.lexeme);
        }
    }

    @Override
    public Value visitBinaryExpr(Binary expr) {
        Value l = evaluate(expr.left);
        Value r = evaluate(expr.right);
        Token op = expr.operator;
        boolean numbers = l.type == Value.Type.NUMBER && r.type == Value.Type.NUMBER;

        switch (op.type) {
            case PLUS:
                if (numbers) return Value.number(l.asNumber() + r.asNumber());
                if (l.type == Value.Type.TEXT || r.type == Value.Type.TEXT) {
                    return Value.text(l.stringify() + r.stringify());
                }
                throw error(op, "Operador '+' inválido para " + l.type.displayName() + " e " + r.type.displayName());
            case MINUS:
                requireNumbers(op, numbers);
                return Value.number(l.asNumber() - r.asNumber());
            case STAR:
                requireNumbers(op, numbers);
                return Value.number(l.asNumber() * r.asNumber());
            case SLASH:
                requireNumbers(op, numbers);
                if (r.asNumber() == 0.0) throw error(op, "Divisão por zero");
                return Value.number(l.asNumber() / r.asNumber());
            case EQUAL_EQUAL:
                return Value.bool(Value.isEqual(l, r));
            case BANG_EQUAL:
                return Value.bool(!Value.isEqual(l, r));
            case LESS:
                requireNumbers(op, numbers);
                return Value.bool(l.asNumber() < r.asNumber());
            case LESS_EQUAL:
                requireNumbers(op, numbers);
                return Value.bool(l.asNumber() <= r.asNumber());
            case GREATER:
                requireNumbers(op, numbers);
                return Value.bool(l.asNumber() > r.asNumber());
            case GREATER_EQUAL:
                requireNumbers(op, numbers);
                return Value.bool(l.asNumber() >= r.asNumber());
            default:
                throw error(op, "Operador desconhecido: " + op.lexeme);
        }
    }

    private void requireNumbers(Token op, boolean numbers) {
        if (!numbers) throw error(op, "'" + op.lexeme + "' espera números");
    }

    @Override
    public Value visitCallExpr(Call expr) {
        Value callee = evaluate(expr.callee);

        List<Value> args = new ArrayList<>(expr.arguments.size());
        for (Expr.ExprInterface a : expr.arguments) args.add(evaluate(a));

        if (callee.type != Value.Type.FUNCTION) {
            throw error(expr.paren, "Tentativa de chamar algo que não é função");
        }
        LucasCallable fn = callee.asFunction();
        if (fn.arity() >= 0 && fn.arity() != args.size()) {
            throw error(expr.paren, "Esperado " + fn.arity() + " argumentos mas recebeu " + args.size());
        }
        if (callStack.size() >= maxDepth) {
            throw error(expr.paren, "Profundidade máxima de chamadas excedida (" + maxDepth + ")");
        }

        if (Debug.get().isEnabled(DebugLevel.TRACE)) {
            Debug.get().t(TAG, "call " + fn.name() + "/" + args.size() + " at line " + expr.paren.line);
        }
        callStack.push(new CallFrame(fn.name(), expr.paren.line));
        try {
            return fn.call(this, args);
        } catch (LucasError e) {
            CallFrame frame = callStack.peek();
            Debug.get().t(TAG, "  at " + frame.functionName + " (line " + frame.line + ")");
            throw e.withLocationIfAbsent(expr.paren.location());
        } finally {
            callStack.pop();
        }
    }

    @Override
    public Value visitIndexExpr(Index expr) {
        Value target = evaluate(expr.target);
        Value index = evaluate(expr.index);

        if (index.type != Value.Type.NUMBER
                || (target.type != Value.Type.ARRAY && target.type != Value.Type.TEXT)) {
            throw error(expr.bracket, "Indexação requer array/texto e índice numérico");
        }

        if (target.type == Value.Type.ARRAY) {
            List<Value> items = target.asArray();
            int i = checkIndex(expr.bracket, index.asNumber(), items.size());
            return items.get(i);
        }

        String s = target.asText();
        int length = s.codePointCount(0, s.length());
        int i = checkIndex(expr.bracket, index.asNumber(), length);
        int at = s.offsetByCodePoints(0, i);
        return Value.text(new String(Character.toChars(s.codePointAt(at))));
    }

    @Override
    public Value visitSetIndexExpr(SetIndex expr) {
        Value target = evaluate(expr.target);
        Value index = evaluate(expr.index);
        Value value = evaluate(expr.value);

        if (target.type != Value.Type.ARRAY || index.type != Value.Type.NUMBER) {
            throw error(expr.bracket, "Atribuição de índice requer array e índice numérico");
        }
        List<Value> items = target.asArray();
        int i = checkIndex(expr.bracket, index.asNumber(), items.size());
        items.set(i, value);
        return value;
    }

    private int checkIndex(Token at, double raw, int size) {
        if (Double.isNaN(raw)) throw error(at, "Índice inválido: NaN");
        long i = (long) raw; // truncates toward zero
        if (i < 0 || i >= size) {
            throw error(at, "Índice " + i + " fora dos limites (tamanho: " + size + ")");
        }
        return (int) i;
    }

    // ===================== ERRORS =====================

    private LucasError error(Token at, String message) {
        return LucasError.runtime(message, at.location());
    }

    LucasError undefinedVariable(Token name) {
        Set<String> candidates = new TreeSet<>(env.visibleNames());
        candidates.addAll(functions.keySet());
        candidates.addAll(Lexer.keywords().keySet());
        candidates.remove(name.lexeme);

        LucasError err = error(name, Environment.undefinedMessage(name.lexeme));
        String best = Suggestions.closest(name.lexeme, candidates);
        return best == null ? err : err.withSuggestion(Suggestions.didYouMean(best));
    }
}
