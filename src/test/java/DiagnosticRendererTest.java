import com.lucas.script.LucasScript;
import com.lucas.script.errors.DiagnosticRenderer;
import com.lucas.script.errors.LucasError;
import com.lucas.script.errors.SourceLocation;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DiagnosticRendererTest {

    @Test
    void renders_excerpt_caret_and_hint() {
        String src = String.join("\n",
            "variavel nome = \"Ana\"",
            "imprimir nomee",
            "imprimir 1"
        );
        LucasError err = assertThrows(LucasError.class, () -> new LucasScript().run(src));
        String out = DiagnosticRenderer.render(err, src);

        String expected = String.join("\n",
            "X Erro de Execução na linha 2, coluna 10:",
            "",
            "   1 | variavel nome = \"Ana\"",
            "   2 | imprimir nomee",
            "                ^ Variável 'nomee' não definida",
            "   3 | imprimir 1",
            "",
            "Dica: Você quis dizer 'nome'?",
            ""
        );
        assertEquals(expected, out);
    }

    @Test
    void first_line_has_no_previous_context() {
        LucasError err = LucasError.syntax("Esperado ')'", new SourceLocation(1, 5));
        String out = DiagnosticRenderer.render(err, "se (x");
        assertTrue(out.startsWith("X Erro Sintático na linha 1, coluna 5:"));
        assertTrue(out.contains("   1 | se (x\n"));
        assertFalse(out.contains("Dica:"));
    }

    @Test
    void error_without_location_prints_message_only() {
        LucasError err = LucasError.runtime("algo falhou");
        assertEquals("X Erro de Execução\n  algo falhou\n", DiagnosticRenderer.render(err, "x"));
    }
}
