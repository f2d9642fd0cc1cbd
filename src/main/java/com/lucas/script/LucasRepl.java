package com.lucas.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.lucas.debug.Debug;
import com.lucas.script.errors.DiagnosticRenderer;
import com.lucas.script.errors.LucasError;
import com.lucas.script.parser.Value;

/**
 * Line-oriented interactive shell over a {@link LucasSession}.
 *
 * A line that neither ends in ';' nor opens with a statement keyword is treated as
 * an expression and echoed: {@code 2 + 2} runs as {@code imprimir(2 + 2);}.
 */
public final class LucasRepl {
    private static final String TAG = "lucas.repl";
    static final String PROMPT = ">>> ";

    private static final Set<String> STATEMENT_WORDS = new HashSet<>(Arrays.asList(
            "variavel", "funcao", "imprimir", "se", "senao", "enquanto", "para",
            "retornar", "quebrar", "continuar"));

    private final LucasSession session;
    private final BufferedReader in;
    private final PrintStream out;
    private final PrintStream err;
    private final List<String> history = new ArrayList<>();

    public LucasRepl(LucasScript engine, InputStream in, PrintStream out, PrintStream err) {
        engine.setOutput(out);
        this.session = engine.newSession();
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
        this.err = err;
    }

    public void loop() throws IOException {
        printWelcome();

        while (true) {
            out.print(PROMPT);
            out.flush();
            String line = in.readLine();
            if (line == null) break; // EOF
            line = line.trim();
            if (line.isEmpty()) continue;

            String cmd = line.toLowerCase(Locale.ROOT);
            if ("sair".equals(cmd) || "exit".equals(cmd) || "quit".equals(cmd)) {
                out.println("Volte logo!! Obrigado por usar Lucas Language!");
                return;
            } else if ("ajuda".equals(cmd) || "help".equals(cmd)) {
                printHelp();
            } else if ("limpar".equals(cmd) || "clear".equals(cmd)) {
                out.print("\u001B[2J\u001B[1;1H");
                out.flush();
            } else if ("historico".equals(cmd) || "history".equals(cmd)) {
                printHistory();
            } else if ("variaveis".equals(cmd) || "vars".equals(cmd)) {
                printVariables();
            } else if ("json".equals(cmd)) {
                out.println(GlobalsJson.toJson(session.globals()));
            } else {
                history.add(line);
                execute(line);
            }
        }
    }

    /** Runs one input line; errors are rendered and the session carries on. */
    void execute(String line) {
        String code = wrapExpression(line);
        try {
            session.run(code);
        } catch (LucasError e) {
            Debug.get().d(TAG, "line failed: " + e);
            err.print(DiagnosticRenderer.render(e, code));
            err.flush();
        }
    }

    static String wrapExpression(String line) {
        if (line.endsWith(";") || line.startsWith("{")) return line;
        int end = 0;
        while (end < line.length() && (Character.isLetterOrDigit(line.charAt(end)) || line.charAt(end) == '_')) end++;
        if (STATEMENT_WORDS.contains(line.substring(0, end))) return line;
        return "imprimir(" + line + ");";
    }

    private void printWelcome() {
        out.println("Lucas Language REPL");
        out.println("Digite 'ajuda' para ver comandos disponíveis");
        out.println("Digite 'sair' para encerrar");
    }

    private void printHelp() {
        String nl = System.lineSeparator();
        out.println(
                "Comandos Disponíveis:" + nl +
                "  ajuda, help        - Mostra esta mensagem" + nl +
                "  sair, exit, quit   - Sai do REPL" + nl +
                "  limpar, clear      - Limpa a tela" + nl +
                "  historico, history - Mostra histórico de comandos" + nl +
                "  variaveis, vars    - Mostra variáveis definidas" + nl +
                "  json               - Mostra as variáveis globais em JSON" + nl +
                nl +
                "Exemplos:" + nl +
                "  >>> 2 + 2" + nl +
                "  >>> variavel x = 10" + nl +
                "  >>> imprimir(x * 2)" + nl +
                "  >>> funcao somar(a, b) { retornar a + b; }");
    }

    private void printHistory() {
        if (history.isEmpty()) {
            out.println("Histórico vazio");
            return;
        }
        out.println("Histórico de Comandos:");
        for (int i = 0; i < history.size(); i++) {
            out.println("  [" + (i + 1) + "] " + history.get(i));
        }
    }

    private void printVariables() {
        out.println("Variáveis Globais:");
        Map<String, Value> vars = session.globals();
        if (vars.isEmpty()) {
            out.println("  (nenhuma variável definida)");
            return;
        }
        for (Map.Entry<String, Value> e : vars.entrySet()) {
            out.println("  " + e.getKey() + " = " + e.getValue().stringify());
        }
    }
}
