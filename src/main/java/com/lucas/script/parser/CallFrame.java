package com.lucas.script.parser;

final class CallFrame {
    final String functionName;
    final int line;

    CallFrame(String functionName, int line) {
        this.functionName = functionName;
        this.line = line;
    }
}
