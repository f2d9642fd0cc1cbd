import com.lucas.script.errors.LucasError;
import com.lucas.script.parser.Environment;
import com.lucas.script.parser.Value;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EnvironmentTest {

    @Test
    void lookup_walks_outward() {
        Environment global = new Environment();
        global.define("x", Value.number(1));
        Environment inner = global.childScope().childScope();

        assertEquals(1.0, inner.get("x").asNumber(), 0.0);
        assertTrue(inner.exists("x"));
        assertFalse(inner.existsInCurrentScope("x"));
        assertSame(global, inner.root());
    }

    @Test
    void assign_mutates_the_defining_scope_only() {
        Environment global = new Environment();
        global.define("x", Value.number(1));
        Environment inner = global.childScope();

        inner.assign("x", Value.number(2));
        assertEquals(2.0, global.get("x").asNumber(), 0.0);
        assertFalse(inner.existsInCurrentScope("x"));
    }

    @Test
    void assign_never_creates_a_binding() {
        Environment global = new Environment();
        LucasError err = assertThrows(LucasError.class, () -> global.assign("nada", Value.nil()));
        assertEquals("Variável 'nada' não definida", err.getMessage());
        assertFalse(global.exists("nada"));
    }

    @Test
    void get_of_missing_name_fails() {
        assertThrows(LucasError.class, () -> new Environment().get("z"));
    }

    @Test
    void define_shadows_in_child_and_overwrites_in_same_scope() {
        Environment global = new Environment();
        global.define("x", Value.number(1));
        Environment inner = global.childScope();
        inner.define("x", Value.text("sombra"));
        assertEquals("sombra", inner.get("x").asText());
        assertEquals(1.0, global.get("x").asNumber(), 0.0);

        global.define("x", Value.bool(true));
        assertTrue(global.get("x").asBool());
    }

    @Test
    void visible_names_and_sorted_snapshot() {
        Environment global = new Environment();
        global.define("b", Value.number(1));
        global.define("a", Value.number(2));
        Environment inner = global.childScope();
        inner.define("c", Value.nil());

        assertTrue(inner.visibleNames().containsAll(List.of("a", "b", "c")));
        assertEquals(List.of("a", "b"), List.copyOf(global.snapshot().keySet()));
        assertEquals(List.of("c"), List.copyOf(inner.snapshot().keySet()));
    }
}
