package com.lucas.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.lucas.script.LucasScript.Mode;
import com.lucas.script.errors.LucasError;
import com.lucas.script.errors.SourceLocation;

public class Lexer {
    private final String source;
    private final Mode mode;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("variavel", TokenType.VAR);
        map.put("se", TokenType.IF);
        map.put("senao", TokenType.ELSE);
        map.put("enquanto", TokenType.WHILE);
        map.put("para", TokenType.FOR);
        map.put("funcao", TokenType.FUNCTION);
        map.put("retornar", TokenType.RETURN);
        map.put("verdadeiro", TokenType.TRUE);
        map.put("falso", TokenType.FALSE);
        map.put("imprimir", TokenType.PRINT);
        map.put("e", TokenType.AND);
        map.put("ou", TokenType.OR);
        map.put("nao", TokenType.NOT);
        map.put("nulo", TokenType.NIL);
        map.put("quebrar", TokenType.BREAK);
        map.put("continuar", TokenType.CONTINUE);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String source) {
        this(source, Mode.STRICT);
    }

    public Lexer(String source, Mode mode) {
        this.source = source;
        this.mode = mode;
    }

    /** Reserved words of the language; used by the REPL and the suggestion engine. */
    public static Map<String, TokenType> keywords() {
        return keywords;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, line, column));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.STAR); break;
            case '/':
                if (match('/')) {
                    while (!isAtEnd() && peek() != '\n') advance();
                } else {
                    addToken(TokenType.SLASH);
                }
                break;
            case '!': addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG); break;
            case '=': addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL); break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case ' ': case '\r': case '\t': case '\n':
                break;
            case '"':
                string();
                break;
            default:
                if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                else if (mode == Mode.STRICT) throw error("Caractere inesperado '" + c + "'");
                // lenient: skipped
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        addToken(type, type == TokenType.IDENTIFIER ? text : null);
    }

    private void number() {
        int dots = 0;
        while (isDigit(peek()) || peek() == '.') {
            if (advance() == '.') dots++;
        }
        String text = source.substring(start, current);
        double value;
        if (dots > 1) {
            if (mode == Mode.STRICT) throw error("Número malformado '" + text + "'");
            value = 0.0;
        } else {
            value = Double.parseDouble(text);
        }
        addToken(TokenType.NUMBER, value);
    }

    private void string() {
        while (!isAtEnd() && peek() != '"') advance();
        if (isAtEnd()) {
            if (mode == Mode.STRICT) throw error("Texto não terminado");
            addToken(TokenType.STRING, source.substring(start + 1, current));
            return;
        }
        advance();
        String value = source.substring(start + 1, current - 1);
        addToken(TokenType.STRING, value);
    }

    private boolean isAtEnd() { return current >= source.length(); }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) {
        return Character.isLetter(c) || c == '_';
    }
    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || Character.isDigit(c);
    }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, startLine, startColumn));
    }

    private LucasError error(String msg) {
        return LucasError.lexical(msg, new SourceLocation(startLine, startColumn));
    }
}
