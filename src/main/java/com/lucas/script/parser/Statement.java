package com.lucas.script.parser;

import java.util.List;

public class Statement {

    public interface Stmt {
        ControlSignal accept(StmtVisitor visitor);
    }

    public interface StmtVisitor {
        ControlSignal visitExprStmt(ExprStmt stmt);
        ControlSignal visitPrintStmt(PrintStmt stmt);
        ControlSignal visitVarStmt(VarStmt stmt);
        ControlSignal visitBlockStmt(Block stmt);
        ControlSignal visitIfStmt(If stmt);
        ControlSignal visitWhileStmt(While stmt);
        ControlSignal visitFunctionStmt(FunctionStmt stmt);
        ControlSignal visitReturnStmt(ReturnStmt stmt);
        ControlSignal visitBreakStmt(BreakStmt stmt);
        ControlSignal visitContinueStmt(ContinueStmt stmt);
    }

    public static final class ExprStmt implements Stmt {
        public final Expr.ExprInterface expression;
        ExprStmt(Expr.ExprInterface expression) { this.expression = expression; }
        public ControlSignal accept(StmtVisitor visitor) { return visitor.visitExprStmt(this); }
    }

    public static final class PrintStmt implements Stmt {
        public final Token keyword;
        public final List<Expr.ExprInterface> expressions;
        PrintStmt(Token keyword, List<Expr.ExprInterface> expressions) {
            this.keyword = keyword;
            this.expressions = expressions;
        }
        public ControlSignal accept(StmtVisitor visitor) { return visitor.visitPrintStmt(this); }
    }

    public static final class VarStmt implements Stmt {
        public final Token name;
        public final Expr.ExprInterface initializer;
        VarStmt(Token name, Expr.ExprInterface initializer) { this.name = name; this.initializer = initializer; }
        public ControlSignal accept(StmtVisitor visitor) { return visitor.visitVarStmt(this); }
    }

    public static final class Block implements Stmt {
        public final List<Stmt> statements;
        Block(List<Stmt> statements) { this.statements = statements; }
        public ControlSignal accept(StmtVisitor visitor) { return visitor.visitBlockStmt(this); }
    }

    public static final class If implements Stmt {
        public final Expr.ExprInterface condition;
        public final Stmt thenBranch;
        public final Stmt elseBranch;
        If(Expr.ExprInterface condition, Stmt thenBranch, Stmt elseBranch) {
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }
        public ControlSignal accept(StmtVisitor visitor) { return visitor.visitIfStmt(this); }
    }

    /** {@code increment} is non-null only for loops desugared from {@code para}. */
    public static final class While implements Stmt {
        public final Expr.ExprInterface condition;
        public final Stmt body;
        public final Expr.ExprInterface increment;
        While(Expr.ExprInterface condition, Stmt body, Expr.ExprInterface increment) {
            this.condition = condition;
            this.body = body;
            this.increment = increment;
        }
        public ControlSignal accept(StmtVisitor visitor) { return visitor.visitWhileStmt(this); }
    }

    public static final class FunctionStmt implements Stmt {
        public final Token name;
        public final List<Token> params;
        public final List<Stmt> body;
        FunctionStmt(Token name, List<Token> params, List<Stmt> body) {
            this.name = name;
            this.params = params;
            this.body = body;
        }
        public ControlSignal accept(StmtVisitor visitor) { return visitor.visitFunctionStmt(this); }
    }

    public static final class ReturnStmt implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface value;
        ReturnStmt(Token keyword, Expr.ExprInterface value) { this.keyword = keyword; this.value = value; }
        public ControlSignal accept(StmtVisitor visitor) { return visitor.visitReturnStmt(this); }
    }

    public static final class BreakStmt implements Stmt {
        public final Token keyword;
        BreakStmt(Token keyword) { this.keyword = keyword; }
        public ControlSignal accept(StmtVisitor visitor) { return visitor.visitBreakStmt(this); }
    }

    public static final class ContinueStmt implements Stmt {
        public final Token keyword;
        ContinueStmt(Token keyword) { this.keyword = keyword; }
        public ControlSignal accept(StmtVisitor visitor) { return visitor.visitContinueStmt(this); }
    }
}
