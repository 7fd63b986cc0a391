package com.lox.debug;

/** Pluggable debug output target (stdout, test capture, host logger). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
