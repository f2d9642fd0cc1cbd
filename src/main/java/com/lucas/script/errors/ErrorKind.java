package com.lucas.script.errors;

/** The three stages that can stop a program. */
public enum ErrorKind {
    LEXICAL("Erro Léxico"),
    SYNTAX("Erro Sintático"),
    RUNTIME("Erro de Execução");

    private final String title;

    ErrorKind(String title) {
        this.title = title;
    }

    /** Heading shown to the user. */
    public String title() {
        return title;
    }
}
