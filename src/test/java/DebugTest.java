import com.lucas.debug.Debug;
import com.lucas.debug.DebugLevel;
import com.lucas.script.LucasScript;
import com.lucas.script.errors.LucasError;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DebugTest {

    private final List<String> records = new ArrayList<>();

    @AfterEach
    void reset() {
        Debug.get().setSink(null);
        Debug.get().setLevel(DebugLevel.TRACE);
    }

    private void capture() {
        Debug.get().setSink((level, tag, message, error) -> records.add(level + "|" + tag + "|" + message));
    }

    @Test
    void cleared_sink_falls_back_to_noop() {
        capture();
        Debug.get().setSink(null);
        assertNotNull(Debug.get().getSink());
        assertFalse(Debug.get().isEnabled(DebugLevel.ERROR));
        Debug.get().e("x", "ignorado");
        assertTrue(records.isEmpty());
    }

    @Test
    void threshold_filters_records() {
        capture();
        Debug.get().setLevel(DebugLevel.INFO);
        Debug.get().d("t", "fora");
        Debug.get().w("t", "dentro");
        assertEquals(List.of("WARN|t|dentro"), records);
        assertFalse(Debug.get().isEnabled(DebugLevel.DEBUG));
        assertTrue(Debug.get().isEnabled(DebugLevel.ERROR));
    }

    @Test
    void interpreter_traces_calls_and_reports_errors() {
        capture();
        assertThrows(LucasError.class, () -> new LucasScript().run("funcao f(x) { retornar x / 0; }\nf(1)"));
        assertTrue(records.contains("TRACE|lucas.interpreter|call f/1 at line 2"), records.toString());
        assertTrue(records.stream().anyMatch(r -> r.startsWith("DEBUG|lucas.interpreter|runtime error:")));
        assertTrue(records.stream().anyMatch(r -> r.startsWith("INFO|lucas.engine|run failed:")));
    }
}
