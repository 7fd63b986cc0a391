import com.lox.script.LoxScript;
import com.lox.script.RunResult;
import com.lox.script.parser.Diagnostics;
import com.lox.script.parser.Diagnostics.Diagnostic;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class HostStackSafetyTest {

    private static String nestedBlocks(int depth) {
        StringBuilder sb = new StringBuilder(depth * 2);
        for (int i = 0; i < depth; i++) sb.append('{');
        for (int i = 0; i < depth; i++) sb.append('}');
        return sb.toString();
    }

    @Test
    void call_depth_limit_is_capped() {
        LoxScript lox = new LoxScript();

        assertThrows(IllegalArgumentException.class, () -> lox.setMaxCallDepth(1_000_000));
        assertThrows(IllegalArgumentException.class, () -> lox.setMaxCallDepth(LoxScript.MAX_CALL_DEPTH_LIMIT + 1));

        lox.setMaxCallDepth(LoxScript.MAX_CALL_DEPTH_LIMIT);
        assertEquals(LoxScript.MAX_CALL_DEPTH_LIMIT, lox.getMaxCallDepth());
    }

    @Test
    void runaway_recursion_at_the_highest_limit_is_a_runtime_error() {
        LoxScript lox = new LoxScript();
        lox.setPrinter(null);
        lox.setMaxCallDepth(LoxScript.MAX_CALL_DEPTH_LIMIT);

        RunResult r = lox.run("fun f(n) { return f(n + 1); } f(0);");

        assertTrue(r.hadRuntimeError());
        Diagnostic d = r.diagnostics().all().get(0);
        assertEquals(Diagnostics.Phase.RUNTIME, d.phase);
        assertEquals("Stack overflow.", d.message);
    }

    @Test
    void absurdly_nested_source_is_a_syntax_error() {
        LoxScript lox = new LoxScript();
        lox.setPrinter(null);

        RunResult r = lox.run(nestedBlocks(100_000));

        assertTrue(r.hadError());
        assertFalse(r.hadRuntimeError());
        Diagnostic d = r.diagnostics().all().get(0);
        assertEquals(Diagnostics.Phase.SYNTAX, d.phase);
        assertEquals("Stack overflow.", d.message);
    }

    @Test
    void session_survives_a_stack_overflow() {
        LoxScript lox = new LoxScript();
        lox.setPrinter(null);
        lox.setMaxCallDepth(LoxScript.MAX_CALL_DEPTH_LIMIT);
        LoxScript.Session session = lox.newSession();

        assertTrue(session.run("var kept = \"yes\"; fun f() { f(); } f();").hadRuntimeError());
        assertTrue(session.run(nestedBlocks(100_000)).hadError());

        RunResult after = session.run("print kept;");
        assertFalse(after.hadError());
        assertFalse(after.hadRuntimeError());
        assertEquals(List.of("yes"), after.output());
    }

    @Test
    void check_reports_overflow_instead_of_throwing() {
        Diagnostics d = new LoxScript().check(nestedBlocks(100_000));
        assertTrue(d.has(Diagnostics.Phase.SYNTAX));
    }
}
