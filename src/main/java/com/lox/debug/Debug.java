package com.lox.debug;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide debug hub for the engine.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...)
 * - No-op until a sink is installed
 *
 * This is developer logging only. Script diagnostics travel through
 * {@link com.lox.script.parser.Diagnostics}.
 */
public final class Debug {

    // must precede INSTANCE: the constructor installs it
    private static final DebugSink NOOP = (level, tag, message, error) -> {
    };

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Routes every level to System.out, errors with their stack trace. */
    public static void useSysOut() {
        INSTANCE.setSink((level, tag, message, error) -> {
            System.out.println("[" + level + "][" + tag + "] " + message);
            if (error != null) error.printStackTrace(System.out);
        });
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        sinkRef.get().log(level, tag, message, error);
    }
}
