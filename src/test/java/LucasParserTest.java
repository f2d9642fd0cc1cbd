import com.lucas.script.LucasScript;
import com.lucas.script.errors.ErrorKind;
import com.lucas.script.errors.LucasError;
import com.lucas.script.parser.Expr;
import com.lucas.script.parser.Lexer;
import com.lucas.script.parser.Parser;
import com.lucas.script.parser.Statement;
import com.lucas.script.parser.Statement.Stmt;
import com.lucas.script.parser.Value;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class LucasParserTest {

    private static List<Stmt> parse(String src) {
        return new Parser(new Lexer(src).tokenize()).parse();
    }

    private static LucasError syntaxError(String src) {
        LucasError err = assertThrows(LucasError.class, () -> parse(src));
        assertEquals(ErrorKind.SYNTAX, err.kind());
        return err;
    }

    @Test
    void semicolons_are_optional() {
        List<Stmt> stmts = parse("variavel a = 1\nvariavel b = 2\nimprimir a + b");
        assertEquals(3, stmts.size());
        assertTrue(stmts.get(2) instanceof Statement.PrintStmt);
    }

    @Test
    void for_loop_desugars_into_block_with_while() {
        List<Stmt> stmts = parse("para (variavel i = 0; i < 3; i = i + 1) imprimir i;");
        assertEquals(1, stmts.size());
        Statement.Block block = (Statement.Block) stmts.get(0);
        assertEquals(2, block.statements.size());
        assertTrue(block.statements.get(0) instanceof Statement.VarStmt);
        Statement.While loop = (Statement.While) block.statements.get(1);
        assertNotNull(loop.increment);
        assertTrue(loop.condition instanceof Expr.Binary);
    }

    @Test
    void for_loop_requires_semicolons_between_clauses() {
        syntaxError("para (variavel i = 0 i < 3; i = i + 1) {}");
    }

    @Test
    void assignment_is_right_associative() {
        Map<String, Value> env = new LucasScript().run("variavel a = 0; variavel b = 0; a = b = 5;");
        assertEquals(5.0, env.get("a").asNumber(), 0.0);
        assertEquals(5.0, env.get("b").asNumber(), 0.0);
    }

    @Test
    void invalid_assignment_target() {
        LucasError err = syntaxError("1 + 2 = 3;");
        assertEquals("Alvo de atribuição inválido.", err.getMessage());
    }

    @Test
    void index_assignment_becomes_set_index() {
        List<Stmt> stmts = parse("xs[0] = 1;");
        Statement.ExprStmt stmt = (Statement.ExprStmt) stmts.get(0);
        assertTrue(stmt.expression instanceof Expr.SetIndex);
    }

    @Test
    void unclosed_block_is_an_error() {
        LucasError err = syntaxError("{ variavel x = 1;");
        assertTrue(err.getMessage().startsWith("Esperado '}'"));
    }

    @Test
    void break_outside_loop_is_an_error() {
        syntaxError("quebrar;");
        syntaxError("continuar;");
        // a function body does not inherit the enclosing loop
        syntaxError("enquanto (verdadeiro) { funcao f() { quebrar; } }");
    }

    @Test
    void return_outside_function_is_an_error() {
        LucasError err = syntaxError("retornar 1;");
        assertEquals("'retornar' fora de uma função.", err.getMessage());
    }

    @Test
    void duplicate_parameters_are_rejected() {
        LucasError err = syntaxError("funcao f(a, a) {}");
        assertEquals("Parâmetro 'a' repetido.", err.getMessage());
        assertEquals(13, err.location().column);
    }

    @Test
    void print_chooses_form_by_top_level_comma() {
        Statement.PrintStmt list = (Statement.PrintStmt) parse("imprimir(1, [2, 3][0])").get(0);
        assertEquals(2, list.expressions.size());

        Statement.PrintStmt single = (Statement.PrintStmt) parse("imprimir(f(1, 2))").get(0);
        assertEquals(1, single.expressions.size());
        assertTrue(single.expressions.get(0) instanceof Expr.Call);
    }

    @Test
    void strict_mode_rejects_missing_operand() {
        LucasError err = syntaxError("variavel x = ;");
        assertEquals("Esperada uma expressão.", err.getMessage());
        assertEquals(14, err.location().column);
    }

    @Test
    void lenient_mode_turns_missing_operand_into_nil() {
        LucasScript es = new LucasScript();
        es.setMode(LucasScript.Mode.LENIENT);
        Map<String, Value> env = es.run("variavel x = ; variavel y = 2 @ ;");
        assertTrue(env.get("x").isNil());
        assertEquals(2.0, env.get("y").asNumber(), 0.0);
    }

    @Test
    void missing_paren_reports_position() {
        LucasError err = syntaxError("se (x > 1 { }");
        assertEquals(1, err.location().line);
        assertEquals(11, err.location().column);
    }

    @Test
    void deeply_nested_expression_is_a_syntax_error() {
        String src = "imprimir " + "(".repeat(3000) + "1" + ")".repeat(3000) + ";";
        LucasError err = syntaxError(src);
        assertTrue(err.getMessage().startsWith("Aninhamento profundo demais"), err.getMessage());
        assertEquals(1, err.location().line);
    }

    @Test
    void deeply_nested_blocks_are_a_syntax_error() {
        LucasError err = syntaxError("{".repeat(3000) + "}".repeat(3000));
        assertTrue(err.getMessage().startsWith("Aninhamento profundo demais"), err.getMessage());
    }

    @Test
    void moderate_nesting_still_parses_and_runs() {
        String src = "variavel x = " + "(".repeat(100) + "41 + 1" + ")".repeat(100) + ";";
        Map<String, Value> env = new LucasScript().run(src);
        assertEquals(42.0, env.get("x").asNumber(), 0.0);
    }
}
