import com.lox.debug.Debug;
import com.lox.debug.DebugLevel;
import com.lox.script.LoxScript;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DebugLoggingTest {

    private final List<String> lines = new ArrayList<>();

    @AfterEach
    void resetSink() {
        Debug.get().setSink(null);
    }

    private void capture() {
        Debug.get().setSink((level, tag, message, error) -> lines.add(level + " " + tag + " " + message));
    }

    @Test
    void phases_log_at_debug_and_aborts_at_warn() {
        capture();
        LoxScript lox = new LoxScript();
        lox.setPrinter(null);

        lox.run("print 1;");
        assertTrue(lines.stream().anyMatch(l -> l.startsWith("DEBUG LoxScript parsed 1")), lines::toString);
        assertTrue(lines.stream().anyMatch(l -> l.startsWith("DEBUG Resolver resolved")), lines::toString);

        lines.clear();
        lox.run("print ;");
        assertTrue(lines.stream().anyMatch(l -> l.startsWith("WARN LoxScript run stopped after parse")), lines::toString);
    }

    @Test
    void runtime_errors_log_the_call_stack() {
        capture();
        LoxScript lox = new LoxScript();
        lox.setPrinter(null);

        lox.run("fun inner() { return nil + 1; }\nfun outer() { return inner(); }\nouter();");

        String warn = null;
        for (String l : lines) {
            if (l.startsWith("WARN LoxScript runtime error")) warn = l;
        }
        assertNotNull(warn, lines::toString);
        assertTrue(warn.contains("inner [line 2]"), warn);
        assertTrue(warn.contains("outer [line 3]"), warn);
    }

    @Test
    void null_sink_falls_back_to_noop() {
        Debug.get().setSink(null);
        assertNotNull(Debug.get().getSink());
        Debug.get().log(DebugLevel.ERROR, "test", "dropped", new IllegalStateException("x"));
    }
}
