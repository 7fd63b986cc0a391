import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.lox.script.parser.Environment;
import com.lox.script.parser.RuntimeError;
import com.lox.script.parser.Token;
import com.lox.script.parser.TokenType;
import com.lox.script.parser.Value;

public class EnvironmentTest {

    private static Token name(String lexeme) {
        return new Token(TokenType.IDENTIFIER, lexeme, null, 7);
    }

    @Test
    void get_walks_child_then_enclosing() {
        Environment root = new Environment();
        root.define("a", Value.number(1));
        root.define("shadow", Value.number(10));

        Environment child = root.childScope();
        child.define("b", Value.number(2));
        child.define("shadow", Value.number(20)); // local shadows parent

        assertEquals(2.0, child.get(name("b")).asNumber());
        assertEquals(1.0, child.get(name("a")).asNumber());
        assertEquals(20.0, child.get(name("shadow")).asNumber());
        assertEquals(10.0, root.get(name("shadow")).asNumber());
        assertSame(root, child.enclosing);
    }

    @Test
    void assign_updates_nearest_existing_binding() {
        Environment root = new Environment();
        root.define("x", Value.number(1));
        Environment child = root.childScope();

        child.assign(name("x"), Value.number(5));

        assertEquals(5.0, root.get(name("x")).asNumber());
        assertFalse(child.snapshot().containsKey("x"));
    }

    @Test
    void nil_values_are_real_bindings() {
        Environment root = new Environment();
        root.define("n", Value.nil());

        assertTrue(root.exists("n"));
        assertTrue(root.get(name("n")).isNil());
        assertFalse(root.exists("missing"));
    }

    @Test
    void undefined_names_raise_runtime_errors_with_the_token_line() {
        Environment root = new Environment();

        RuntimeError read = assertThrows(RuntimeError.class, () -> root.get(name("ghost")));
        assertEquals("Undefined variable 'ghost'.", read.getMessage());
        assertEquals(7, read.line());

        RuntimeError write = assertThrows(RuntimeError.class, () -> root.childScope().assign(name("ghost"), Value.nil()));
        assertEquals("Undefined variable 'ghost'.", write.getMessage());
    }

    @Test
    void define_overwrites_in_same_scope() {
        Environment root = new Environment();
        root.define("v", Value.string("first"));
        root.define("v", Value.string("second"));

        assertEquals("second", root.get(name("v")).asString());
        assertEquals(1, root.snapshot().size());
    }
}
