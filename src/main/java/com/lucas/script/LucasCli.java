package com.lucas.script;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.lucas.debug.Debug;
import com.lucas.script.errors.DiagnosticRenderer;
import com.lucas.script.errors.LucasError;
import com.lucas.script.parser.Value;

/**
 * Usage: lucas [arquivo.lucas] [--mode=strict|lenient] [--max-depth=N] [--debug] [--dump-globals]
 *
 * Without a file the interactive shell starts.
 */
public final class LucasCli {

    static final int EXIT_OK = 0;
    static final int EXIT_SCRIPT_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_UNREADABLE = 3;

    private static final String USAGE =
            "Uso: lucas [arquivo.lucas] [--mode=strict|lenient] [--max-depth=N] [--debug] [--dump-globals]";

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    public static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        Map<String, String> flags = parseArgs(args);
        List<String> positional = positional(args);

        if (positional.size() > 1) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        final LucasScript engine = new LucasScript();
        engine.setOutput(out);
        try {
            configure(engine, flags);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        if (flags.containsKey("debug")) {
            Debug.get().setSink(Debug.printTo(err));
        }

        if (positional.isEmpty()) {
            try {
                new LucasRepl(engine, in, out, err).loop();
                return EXIT_OK;
            } catch (IOException e) {
                err.println("Erro ao ler entrada: " + e.getMessage());
                return EXIT_UNREADABLE;
            }
        }

        final Path scriptPath = Path.of(positional.get(0));
        final String script;
        try {
            script = Files.readString(scriptPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Falha ao ler o arquivo: " + scriptPath);
            Debug.get().e("lucas.cli", "unreadable script " + scriptPath, e);
            return EXIT_UNREADABLE;
        }

        try {
            Map<String, Value> globals = engine.run(script);
            if (flags.containsKey("dump-globals")) {
                out.println(GlobalsJson.toJson(globals));
            }
            return EXIT_OK;
        } catch (LucasError e) {
            err.print(DiagnosticRenderer.render(e, script));
            return EXIT_SCRIPT_ERROR;
        }
    }

    private static void configure(LucasScript engine, Map<String, String> flags) {
        String mode = flags.get("mode");
        if (mode != null) {
            switch (mode.toLowerCase(Locale.ROOT)) {
                case "strict": engine.setMode(LucasScript.Mode.STRICT); break;
                case "lenient": engine.setMode(LucasScript.Mode.LENIENT); break;
                default: throw new IllegalArgumentException("Modo desconhecido: " + mode);
            }
        }
        String depth = flags.get("max-depth");
        if (depth != null) {
            try {
                engine.setMaxCallDepth(Integer.parseInt(depth));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--max-depth espera um inteiro: " + depth, e);
            }
        }
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (String a : args) {
            if (a.startsWith("--") && a.contains("=")) {
                int i = a.indexOf('=');
                out.put(a.substring(2, i), a.substring(i + 1));
            } else if (a.startsWith("--")) {
                out.put(a.substring(2), "true");
            }
        }
        return out;
    }

    private static List<String> positional(String[] args) {
        List<String> out = new ArrayList<>();
        for (String a : args) {
            if (!a.startsWith("--")) out.add(a);
        }
        return out;
    }

    private LucasCli() {}
}
