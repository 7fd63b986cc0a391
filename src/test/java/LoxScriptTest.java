import com.lox.script.LoxScript;
import com.lox.script.RunResult;
import com.lox.script.parser.Value;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LoxScriptTest {

    private static RunResult run(String src) {
        LoxScript lox = new LoxScript();
        lox.setPrinter(null);
        return lox.run(src);
    }

    @Test
    void arithmetic_and_precedence() {
        RunResult r = run(String.join("\n",
            "print 1 + 2 * 3;",
            "print (1 + 2) * 3;",
            "print 10 / 4;",
            "print -3 - -3;",
            "print 2 * 3 - 4 / 2;",
            ""
        ));

        assertFalse(r.hadError());
        assertFalse(r.hadRuntimeError());
        assertEquals(List.of("7", "9", "2.5", "0", "4"), r.output());
    }

    @Test
    void printing_all_value_kinds() {
        RunResult r = run(String.join("\n",
            "fun f() {}",
            "class Point {}",
            "print nil;",
            "print true;",
            "print !true;",
            "print \"text\";",
            "print f;",
            "print clock;",
            "print Point;",
            "print Point();",
            ""
        ));

        assertEquals(List.of("nil", "true", "false", "text", "<fn f>", "<native fn>", "Point", "Point instance"),
                r.output());
    }

    @Test
    void string_concatenation_and_equality() {
        RunResult r = run(String.join("\n",
            "print \"1\" + \"1\";",
            "print 1 == 1;",
            "print \"a\" == \"a\";",
            "print nil == nil;",
            "print nil == false;",
            "print 1 == \"1\";",
            "print 3 != 4;",
            ""
        ));

        assertEquals(List.of("11", "true", "true", "true", "false", "false", "true"), r.output());
    }

    @Test
    void logical_operators_short_circuit_and_return_operand() {
        RunResult r = run(String.join("\n",
            "print nil or \"fallback\";",
            "print 0 and \"zero is truthy\";",
            "print false and undefinedName;",
            "print true or undefinedName;",
            ""
        ));

        assertFalse(r.hadRuntimeError());
        assertEquals(List.of("fallback", "zero is truthy", "false", "true"), r.output());
    }

    @Test
    void control_flow_if_while_for_break() {
        RunResult r = run(String.join("\n",
            "var total = 0;",
            "for (var i = 0; i < 10; i = i + 1) {",
            "  if (i == 5) break;",
            "  total = total + i;",
            "}",
            "print total;",
            "var n = 3;",
            "while (n > 0) n = n - 1;",
            "if (n == 0) print \"done\"; else print \"not done\";",
            ""
        ));

        assertEquals(List.of("10", "done"), r.output());
    }

    @Test
    void break_leaves_only_the_innermost_loop() {
        RunResult r = run(String.join("\n",
            "var hits = 0;",
            "for (var i = 0; i < 3; i = i + 1) {",
            "  while (true) {",
            "    hits = hits + 1;",
            "    break;",
            "  }",
            "}",
            "print hits;",
            ""
        ));

        assertEquals(List.of("3"), r.output());
    }

    @Test
    void global_redeclaration_last_write_wins() {
        RunResult r = run("var a = \"1\"; var a = \"2\"; print a;");
        assertEquals(List.of("2"), r.output());
    }

    @Test
    void local_redeclaration_is_allowed() {
        RunResult r = run("{ var a = 1; var a = 2; print a; }");
        assertFalse(r.hadError());
        assertEquals(List.of("2"), r.output());

        // the new binding is not ready while its own initializer runs
        RunResult self = run("{ var a = 1; var a = a + 1; }");
        assertTrue(self.hadError());
    }

    @Test
    void globals_snapshot_exposes_final_values() {
        RunResult r = run("var x = 40; x = x + 2; var s = \"hi\";");

        Value x = r.globals().get("x");
        assertEquals(Value.Type.NUMBER, x.getType());
        assertEquals(42.0, x.asNumber(), 0.0);
        assertEquals("hi", r.globals().get("s").asString());
        assertTrue(r.globals().containsKey("clock"));
    }

    @Test
    void uninitialized_var_is_nil() {
        RunResult r = run("var a; print a;");
        assertEquals(List.of("nil"), r.output());
    }

    @Test
    void return_without_value_yields_nil() {
        RunResult r = run("fun f(){ return; } print f();");
        assertEquals(List.of("nil"), r.output());
    }

    @Test
    void printer_receives_lines_in_order() {
        List<String> seen = new ArrayList<>();
        LoxScript lox = new LoxScript();
        lox.setPrinter(seen::add);

        RunResult r = lox.run("print 1; print 2;");

        assertEquals(List.of("1", "2"), seen);
        assertEquals(seen, r.output());
    }

    @Test
    void registered_builtin_is_callable_with_fixed_arity() {
        LoxScript lox = new LoxScript();
        lox.setPrinter(null);
        lox.registerFunction("twice", 1, args -> Value.number(args.get(0).asNumber() * 2));

        RunResult ok = lox.run("print twice(21);");
        assertEquals(List.of("42"), ok.output());

        RunResult bad = lox.run("twice(1, 2);");
        assertTrue(bad.hadRuntimeError());
        assertEquals("Expected 1 arguments but got 2.", bad.diagnostics().all().get(0).message);
    }

    @Test
    void host_misuse_throws_illegal_argument() {
        LoxScript lox = new LoxScript();
        assertThrows(IllegalArgumentException.class, () -> lox.registerFunction("", 0, args -> Value.nil()));
        assertThrows(IllegalArgumentException.class, () -> lox.registerFunction("f", -1, args -> Value.nil()));
        assertThrows(IllegalArgumentException.class, () -> lox.registerFunction("f", 0, null));
        assertThrows(IllegalArgumentException.class, () -> lox.setMaxCallDepth(0));
        assertThrows(IllegalArgumentException.class, () -> lox.run(null));
    }

    @Test
    void compile_errors_prevent_execution() {
        RunResult r = run("print \"before\"; print 1 +;");

        assertTrue(r.hadError());
        assertFalse(r.hadRuntimeError());
        assertTrue(r.output().isEmpty());
    }

    @Test
    void check_reports_without_running() {
        List<String> seen = new ArrayList<>();
        LoxScript lox = new LoxScript();
        lox.setPrinter(seen::add);

        assertFalse(lox.check("print 1;").hasErrors());
        assertTrue(lox.check("return 1;").hasErrors());
        assertTrue(seen.isEmpty());
    }
}
