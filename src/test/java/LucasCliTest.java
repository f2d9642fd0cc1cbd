import com.lucas.debug.Debug;
import com.lucas.script.LucasCli;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class LucasCliTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @AfterEach
    void resetDebug() {
        Debug.get().setSink(null);
    }

    private int cli(String stdin, String... args) {
        return LucasCli.run(args,
            new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private Path script(String name, String body) throws Exception {
        Path p = dir.resolve(name);
        Files.writeString(p, body, StandardCharsets.UTF_8);
        return p;
    }

    @Test
    void runs_a_script_file() throws Exception {
        Path p = Path.of(LucasCliTest.class.getResource("/scripts/fatorial.lucas").toURI());
        int code = cli("", p.toString());
        assertEquals(0, code);
        assertEquals("fatorial(5) = 120\n[0, 1, 3, 4, 5]\n", out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void script_error_exits_with_one_and_renders_diagnostic() throws Exception {
        Path p = script("erro.lucas", "imprimir 1\nimprimir 1 / 0\n");
        int code = cli("", p.toString());
        assertEquals(1, code);
        assertEquals("1\n", out.toString(StandardCharsets.UTF_8));
        String e = err.toString(StandardCharsets.UTF_8);
        assertTrue(e.startsWith("X Erro de Execução na linha 2, coluna 12:"), e);
        assertTrue(e.contains("^ Divisão por zero"));
    }

    @Test
    void missing_file_exits_with_three() {
        int code = cli("", dir.resolve("nao-existe.lucas").toString());
        assertEquals(3, code);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Falha ao ler o arquivo"));
    }

    @Test
    void bad_flags_exit_with_two() throws Exception {
        Path p = script("ok.lucas", "imprimir 1");
        assertEquals(2, cli("", p.toString(), "--mode=solto"));
        assertEquals(2, cli("", p.toString(), "--max-depth=abc"));
        assertEquals(2, cli("", p.toString(), "--max-depth=0"));
        assertEquals(2, cli("", "a.lucas", "b.lucas"));
        assertEquals("", out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void lenient_mode_flag() throws Exception {
        Path p = script("solto.lucas", "imprimir 1 @ + 1");
        assertEquals(1, cli("", p.toString()));
        assertEquals(0, cli("", p.toString(), "--mode=lenient"));
        assertEquals("2\n", out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void max_depth_flag_limits_recursion() throws Exception {
        Path p = script("fundo.lucas", "funcao f(n) { se (n == 0) retornar 0; retornar f(n - 1); }\nf(20)");
        assertEquals(0, cli("", p.toString()));
        assertEquals(1, cli("", p.toString(), "--max-depth=10"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Profundidade máxima de chamadas excedida (10)"));
    }

    @Test
    void dump_globals_prints_json() throws Exception {
        Path p = script("g.lucas", "variavel x = 1\nvariavel nome = \"Lu\"");
        assertEquals(0, cli("", p.toString(), "--dump-globals"));
        String s = out.toString(StandardCharsets.UTF_8);
        assertTrue(s.contains("\"x\" : 1"));
        assertTrue(s.contains("\"nome\" : \"Lu\""));
    }

    @Test
    void debug_flag_logs_to_stderr() throws Exception {
        Path p = script("d.lucas", "funcao f() { retornar 1; }\nf()");
        assertEquals(0, cli("", p.toString(), "--debug"));
        String e = err.toString(StandardCharsets.UTF_8);
        assertTrue(e.contains("[DEBUG] lucas.engine: run:"), e);
        assertTrue(e.contains("[TRACE] lucas.interpreter: call f/0 at line 2"), e);
    }

    @Test
    void no_file_starts_the_repl() {
        assertEquals(0, cli("1 + 1\nsair\n"));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains(">>> 2\n"));
    }
}
