import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lucas.script.GlobalsJson;
import com.lucas.script.LucasScript;
import com.lucas.script.parser.Value;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class GlobalsJsonTest {

    private static final ObjectMapper om = new ObjectMapper();

    @Test
    void exports_every_kind() throws Exception {
        Map<String, Value> env = new LucasScript().run(String.join("\n",
            "variavel inteiro = 3;",
            "variavel real = 2.5;",
            "variavel nome = \"Ana\";",
            "variavel ok = verdadeiro;",
            "variavel vazio = nulo;",
            "variavel lista = [1, \"dois\", [falso]];",
            "funcao f() {}"
        ));

        JsonNode root = om.readTree(GlobalsJson.toJson(env));
        assertTrue(root.get("inteiro").isIntegralNumber());
        assertEquals(3, root.get("inteiro").asInt());
        assertEquals(2.5, root.get("real").asDouble(), 0.0);
        assertEquals("Ana", root.get("nome").asText());
        assertTrue(root.get("ok").asBoolean());
        assertTrue(root.get("vazio").isNull());
        assertEquals(3, root.get("lista").size());
        assertFalse(root.get("lista").get(2).get(0).asBoolean());
        assertEquals("<fn f>", root.get("f").asText());
    }

    @Test
    void keeps_snapshot_order() {
        Map<String, Value> env = new LucasScript().run("variavel b = 1; variavel a = 2;");
        String json = GlobalsJson.toJson(env);
        assertTrue(json.indexOf("\"a\"") < json.indexOf("\"b\""));
    }

    @Test
    void cyclic_array_is_cut() throws Exception {
        Map<String, Value> env = new LucasScript().run("variavel a = [1]; adicionar(a, a);");
        JsonNode root = om.readTree(GlobalsJson.toJson(env));
        assertEquals("[...]", root.get("a").get(1).asText());
    }
}
