import com.lox.debug.Debug;
import org.junit.jupiter.api.Test;

import java.net.URL;
import java.net.URLClassLoader;
import java.util.List;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Loads the engine in its own class loader so the debug hub is initialized
 * from scratch, whatever other test classes did to the shared instance.
 */
public class DebugDefaultSinkTest {

    private static URLClassLoader freshLoader() {
        URL classes = Debug.class.getProtectionDomain().getCodeSource().getLocation();
        return new URLClassLoader(new URL[] { classes }, ClassLoader.getPlatformClassLoader());
    }

    @Test
    void freshly_loaded_hub_has_a_noop_sink() throws Exception {
        try (URLClassLoader loader = freshLoader()) {
            Class<?> debugClass = Class.forName("com.lox.debug.Debug", true, loader);
            assertNotSame(Debug.class, debugClass);

            Object hub = debugClass.getMethod("get").invoke(null);
            assertNotNull(debugClass.getMethod("getSink").invoke(hub));

            // must not throw with no sink installed
            debugClass.getMethod("d", String.class, String.class).invoke(hub, "test", "nobody listening");
        }
    }

    @Test
    void engine_runs_before_any_sink_is_installed() throws Exception {
        try (URLClassLoader loader = freshLoader()) {
            Class<?> engineClass = Class.forName("com.lox.script.LoxScript", true, loader);
            Object engine = engineClass.getConstructor().newInstance();
            engineClass.getMethod("setPrinter", Consumer.class).invoke(engine, (Object) null);

            Object result = engineClass.getMethod("run", String.class).invoke(engine, "var a = 1; print a + 1;");

            Class<?> resultClass = result.getClass();
            assertEquals(Boolean.FALSE, resultClass.getMethod("hadError").invoke(result));
            assertEquals(Boolean.FALSE, resultClass.getMethod("hadRuntimeError").invoke(result));
            assertEquals(List.of("2"), resultClass.getMethod("output").invoke(result));
        }
    }

    @Test
    void shared_hub_always_has_a_sink() {
        assertNotNull(Debug.get().getSink());
    }
}
