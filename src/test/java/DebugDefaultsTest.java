import com.lucas.debug.Debug;
import com.lucas.debug.DebugLevel;
import com.lucas.script.LucasScript;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Checks the hub as it is before any sink was ever installed. The classes are
 * reloaded in an isolated loader so static initialization runs again here,
 * whatever other test classes did to the shared singleton.
 */
public class DebugDefaultsTest {

    private static URLClassLoader isolatedLoader() {
        URL classes = Debug.class.getProtectionDomain().getCodeSource().getLocation();
        return new URLClassLoader(new URL[] { classes }, ClassLoader.getPlatformClassLoader());
    }

    @Test
    void fresh_hub_has_a_noop_sink() throws Exception {
        try (URLClassLoader loader = isolatedLoader()) {
            Class<?> debug = Class.forName("com.lucas.debug.Debug", true, loader);
            assertNotSame(Debug.class, debug);
            Class<?> level = Class.forName("com.lucas.debug.DebugLevel", true, loader);

            Object hub = debug.getMethod("get").invoke(null);
            assertNotNull(debug.getMethod("getSink").invoke(hub));
            assertEquals(false, debug.getMethod("isEnabled", level).invoke(hub, level.getField("ERROR").get(null)));
            debug.getMethod("e", String.class, String.class).invoke(hub, "x", "ignorado");
        }
    }

    @Test
    void fresh_engine_runs_without_a_sink() throws Exception {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (URLClassLoader loader = isolatedLoader()) {
            Class<?> engineClass = Class.forName("com.lucas.script.LucasScript", true, loader);
            assertNotSame(LucasScript.class, engineClass);
            Object engine = engineClass.getConstructor().newInstance();
            engineClass.getMethod("setOutput", PrintStream.class)
                .invoke(engine, new PrintStream(buffer, true, StandardCharsets.UTF_8));

            Object globals = engineClass.getMethod("run", String.class)
                .invoke(engine, "variavel x = 1; imprimir verdadeiro;");
            assertTrue(((Map<?, ?>) globals).containsKey("x"));
        }
        assertEquals("verdadeiro\n", buffer.toString(StandardCharsets.UTF_8).replace("\r\n", "\n"));
    }

    @Test
    void shared_hub_is_quiet_when_no_sink_is_installed() {
        Debug hub = Debug.get();
        assertNotNull(hub.getSink());
        assertFalse(hub.isEnabled(DebugLevel.ERROR));

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        LucasScript es = new LucasScript();
        es.setOutput(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        assertDoesNotThrow(() -> es.run("imprimir falso;"));
        assertEquals("falso\n", buffer.toString(StandardCharsets.UTF_8).replace("\r\n", "\n"));
    }
}
