package com.lucas.script.parser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.lucas.script.LucasScript.Mode;
import com.lucas.script.errors.LucasError;
import com.lucas.script.parser.Expr.ArrayLiteral;
import com.lucas.script.parser.Expr.Assign;
import com.lucas.script.parser.Expr.Binary;
import com.lucas.script.parser.Expr.Call;
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
import com.lucas.script.parser.Statement.VarStmt;
import com.lucas.script.parser.Statement.While;

public class Parser {
    static final int MAX_ARGUMENTS = 255;
    static final int MAX_NESTING = 256;

    private final List<Token> tokens;
    private final Mode mode;
    private int current = 0;
    private int loopDepth = 0;
    private int functionDepth = 0;
    private int nesting = 0;

    public Parser(List<Token> tokens) {
        this(tokens, Mode.STRICT);
    }

    public Parser(List<Token> tokens, Mode mode) {
        this.tokens = tokens;
        this.mode = mode;
    }

    public List<Stmt> parse() {
        List<Stmt> statements = new ArrayList<Stmt>();
        while (!isAtEnd()) {
            statements.add(declaration());
        }
        return statements;
    }

    private Stmt declaration() {
        if (match(TokenType.FUNCTION)) return functionDeclaration();
        if (match(TokenType.VAR)) return varDeclaration();
        return statement();
    }

    private Stmt functionDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "Esperado nome da função.");
        consume(TokenType.LEFT_PAREN, "Esperado '(' após o nome da função.");

        List<Token> params = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (params.size() >= MAX_ARGUMENTS) {
                    throw error(peek(), "Parâmetros demais (máximo " + MAX_ARGUMENTS + ").");
                }
                Token param = consume(TokenType.IDENTIFIER, "Esperado nome de parâmetro.");
                if (!seen.add(param.lexeme)) {
                    throw error(param, "Parâmetro '" + param.lexeme + "' repetido.");
                }
                params.add(param);
            } while (match(TokenType.COMMA));
        }

        consume(TokenType.RIGHT_PAREN, "Esperado ')' após os parâmetros.");
        consume(TokenType.LEFT_BRACE, "Esperado '{' antes do corpo da função.");

        // loops of the enclosing code do not extend into the body
        int enclosingLoops = loopDepth;
        enterNesting();
        loopDepth = 0;
        functionDepth++;
        try {
            List<Stmt> body = block();
            return new FunctionStmt(name, params, body);
        } finally {
            functionDepth--;
            loopDepth = enclosingLoops;
            nesting--;
        }
    }

    private Stmt varDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "Esperado nome da variável.");
        consume(TokenType.EQUAL, "Esperado '=' após o nome da variável.");
        Expr.ExprInterface initializer = expression();
        match(TokenType.SEMICOLON);
        return new VarStmt(name, initializer);
    }

    private Stmt statement() {
        enterNesting();
        try {
            return nestedStatement();
        } finally {
            nesting--;
        }
    }

    private Stmt nestedStatement() {
        if (match(TokenType.PRINT)) return printStatement();
        if (match(TokenType.LEFT_BRACE)) return new Block(block());
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.WHILE)) return whileStatement();
        if (match(TokenType.FOR)) return forStatement();
        if (match(TokenType.RETURN)) return returnStatement();
        if (match(TokenType.BREAK)) {
            Token keyword = previous();
            if (loopDepth == 0) throw error(keyword, "'quebrar' fora de um laço.");
            match(TokenType.SEMICOLON);
            return new BreakStmt(keyword);
        }
        if (match(TokenType.CONTINUE)) {
            Token keyword = previous();
            if (loopDepth == 0) throw error(keyword, "'continuar' fora de um laço.");
            match(TokenType.SEMICOLON);
            return new ContinueStmt(keyword);
        }
        return expressionStatement();
    }

    private Stmt printStatement() {
        Token keyword = previous();
        List<Expr.ExprInterface> values = new ArrayList<>();
        if (check(TokenType.LEFT_PAREN) && (checkNext(TokenType.RIGHT_PAREN) || groupHasTopLevelComma())) {
            advance();
            if (!check(TokenType.RIGHT_PAREN)) {
                do {
                    values.add(expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_PAREN, "Esperado ')' após os argumentos de 'imprimir'.");
        } else {
            values.add(expression());
        }
        match(TokenType.SEMICOLON);
        return new PrintStmt(keyword, values);
    }

    /** Looks ahead from the current '(' for a comma at nesting depth one. */
    private boolean groupHasTopLevelComma() {
        int depth = 0;
        for (int i = current; i < tokens.size(); i++) {
            TokenType type = tokens.get(i).type;
            switch (type) {
                case LEFT_PAREN: case LEFT_BRACKET: case LEFT_BRACE:
                    depth++;
                    break;
                case RIGHT_PAREN: case RIGHT_BRACKET: case RIGHT_BRACE:
                    depth--;
                    if (depth == 0) return false;
                    break;
                case COMMA:
                    if (depth == 1) return true;
                    break;
                case EOF:
                    return false;
                default:
                    break;
            }
        }
        return false;
    }

    private Stmt ifStatement() {
        consume(TokenType.LEFT_PAREN, "Esperado '(' após 'se'.");
        Expr.ExprInterface condition = expression();
        consume(TokenType.RIGHT_PAREN, "Esperado ')' após a condição.");

        Stmt thenBranch = statement();
        Stmt elseBranch = null;
        if (match(TokenType.ELSE)) {
            elseBranch = statement();
        }
        return new If(condition, thenBranch, elseBranch);
    }

    private Stmt whileStatement() {
        consume(TokenType.LEFT_PAREN, "Esperado '(' após 'enquanto'.");
        Expr.ExprInterface condition = expression();
        consume(TokenType.RIGHT_PAREN, "Esperado ')' após a condição.");
        return new While(condition, loopBody(), null);
    }

    private Stmt forStatement() {
        consume(TokenType.LEFT_PAREN, "Esperado '(' após 'para'.");

        Stmt initializer;
        if (match(TokenType.SEMICOLON)) {
            initializer = null;
        } else if (match(TokenType.VAR)) {
            Token name = consume(TokenType.IDENTIFIER, "Esperado nome da variável.");
            consume(TokenType.EQUAL, "Esperado '=' após o nome da variável.");
            initializer = new VarStmt(name, expression());
            consume(TokenType.SEMICOLON, "Esperado ';' após a inicialização do 'para'.");
        } else {
            initializer = new ExprStmt(expression());
            consume(TokenType.SEMICOLON, "Esperado ';' após a inicialização do 'para'.");
        }

        Expr.ExprInterface condition = null;
        if (!check(TokenType.SEMICOLON)) {
            condition = expression();
        }
        consume(TokenType.SEMICOLON, "Esperado ';' após a condição do 'para'.");

        Expr.ExprInterface increment = null;
        if (!check(TokenType.RIGHT_PAREN)) {
            increment = expression();
        }
        consume(TokenType.RIGHT_PAREN, "Esperado ')' após as cláusulas do 'para'.");

        Stmt body = loopBody();
        if (condition == null) condition = new Literal(Boolean.TRUE);

        List<Stmt> desugared = new ArrayList<>();
        if (initializer != null) desugared.add(initializer);
        desugared.add(new While(condition, body, increment));
        return new Block(desugared);
    }

    private Stmt loopBody() {
        loopDepth++;
        try {
            return statement();
        } finally {
            loopDepth--;
        }
    }

    private Stmt returnStatement() {
        Token keyword = previous();
        if (functionDepth == 0) throw error(keyword, "'retornar' fora de uma função.");
        Expr.ExprInterface value = null;
        if (!check(TokenType.SEMICOLON) && !check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            value = expression();
        }
        match(TokenType.SEMICOLON);
        return new ReturnStmt(keyword, value);
    }

    private List<Stmt> block() {
        List<Stmt> statements = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            statements.add(declaration());
        }
        consume(TokenType.RIGHT_BRACE, "Esperado '}' após o bloco.");
        return statements;
    }

    private Stmt expressionStatement() {
        Expr.ExprInterface expr = expression();
        match(TokenType.SEMICOLON);
        return new ExprStmt(expr);
    }

    private Expr.ExprInterface expression() {
        return assignment();
    }

    private Expr.ExprInterface assignment() {
        enterNesting();
        try {
            return nestedAssignment();
        } finally {
            nesting--;
        }
    }

    private Expr.ExprInterface nestedAssignment() {
        Expr.ExprInterface expr = or();

        if (match(TokenType.EQUAL)) {
            Token equals = previous();
            Expr.ExprInterface value = assignment();

            if (expr instanceof Variable) {
                return new Assign(((Variable) expr).name, value);
            }
            if (expr instanceof Index) {
                Index idx = (Index) expr;
                return new SetIndex(idx.target, idx.bracket, idx.index, value);
            }
            throw error(equals, "Alvo de atribuição inválido.");
        }
        return expr;
    }

    private Expr.ExprInterface or() {
        Expr.ExprInterface expr = and();
        while (match(TokenType.OR)) {
            Token operator = previous();
            Expr.ExprInterface right = and();
            expr = new Logical(expr, operator, right);
        }
        return expr;
    }

    private Expr.ExprInterface and() {
        Expr.ExprInterface expr = equality();
        while (match(TokenType.AND)) {
            Token operator = previous();
            Expr.ExprInterface right = equality();
            expr = new Logical(expr, operator, right);
        }
        return expr;
    }

    private Expr.ExprInterface equality() {
        Expr.ExprInterface expr = comparison();
        while (match(TokenType.BANG_EQUAL, TokenType.EQUAL_EQUAL)) {
            Token operator = previous();
            Expr.ExprInterface right = comparison();
            expr = new Binary(expr, operator, right);
        }
        return expr;
    }

    private Expr.ExprInterface comparison() {
        Expr.ExprInterface expr = term();
        while (match(TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL)) {
            Token operator = previous();
            Expr.ExprInterface right = term();
            expr = new Binary(expr, operator, right);
        }
        return expr;
    }

    private Expr.ExprInterface term() {
        Expr.ExprInterface expr = factor();
        while (match(TokenType.MINUS, TokenType.PLUS)) {
            Token operator = previous();
            Expr.ExprInterface right = factor();
            expr = new Binary(expr, operator, right);
        }
        return expr;
    }

    private Expr.ExprInterface factor() {
        Expr.ExprInterface expr = unary();
        while (match(TokenType.SLASH, TokenType.STAR)) {
            Token operator = previous();
            Expr.ExprInterface right = unary();
            expr = new Binary(expr, operator, right);
        }
        return expr;
    }

    private Expr.ExprInterface unary() {
        if (match(TokenType.BANG, TokenType.NOT, TokenType.MINUS)) {
            Token operator = previous();
            enterNesting();
            try {
                Expr.ExprInterface right = unary();
                return new Unary(operator, right);
            } finally {
                nesting--;
            }
        }
        return call();
    }

    // Bounds parser and evaluator recursion on source like ((((...)))) or {{{{...}}}}.
    private void enterNesting() {
        if (nesting >= MAX_NESTING) {
            throw error(peek(), "Aninhamento profundo demais (máximo " + MAX_NESTING + " níveis).");
        }
        nesting++;
    }

    private Expr.ExprInterface call() {
        Expr.ExprInterface expr = primary();
        while (true) {
            if (match(TokenType.LEFT_PAREN)) {
                expr = finishCall(expr);
            } else if (match(TokenType.LEFT_BRACKET)) {
                Token bracket = previous();
                Expr.ExprInterface index = expression();
                consume(TokenType.RIGHT_BRACKET, "Esperado ']' após o índice.");
                expr = new Index(expr, bracket, index);
            } else {
                break;
            }
        }
        return expr;
    }

    private Expr.ExprInterface finishCall(Expr.ExprInterface callee) {
        Token paren = previous();
        List<Expr.ExprInterface> arguments = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (arguments.size() >= MAX_ARGUMENTS) {
                    throw error(peek(), "Argumentos demais (máximo " + MAX_ARGUMENTS + ").");
                }
                arguments.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Esperado ')' após os argumentos.");
        return new Call(callee, paren, arguments);
    }

    private Expr.ExprInterface primary() {
        if (match(TokenType.FALSE)) return new Literal(Boolean.FALSE);
        if (match(TokenType.TRUE)) return new Literal(Boolean.TRUE);
        if (match(TokenType.NIL)) return new Literal(null);
        if (match(TokenType.NUMBER)) return new Literal(previous().literal);
        if (match(TokenType.STRING)) return new Literal(previous().literal);
        if (match(TokenType.IDENTIFIER)) return new Variable(previous());

        if (match(TokenType.LEFT_PAREN)) {
            Expr.ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "Esperado ')' após a expressão.");
            return expr;
        }

        if (match(TokenType.LEFT_BRACKET)) {
            Token bracket = previous();
            List<Expr.ExprInterface> items = new ArrayList<Expr.ExprInterface>();
            if (!check(TokenType.RIGHT_BRACKET)) {
                do {
                    items.add(expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_BRACKET, "Esperado ']' após os elementos do array.");
            return new ArrayLiteral(bracket, items);
        }

        if (mode == Mode.LENIENT) {
            // recovery placeholder: drop the token and carry on with nulo
            if (!isAtEnd()) advance();
            return new Literal(null);
        }
        throw error(peek(), "Esperada uma expressão.");
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private boolean checkNext(TokenType type) {
        if (current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private LucasError error(Token token, String message) {
        String where = token.type == TokenType.EOF ? " (fim do arquivo)" : "";
        return LucasError.syntax(message + where, token.location());
    }

}
