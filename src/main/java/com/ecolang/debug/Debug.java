package com.ecolang.debug;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Global debug hub for all EcoLang components.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...)
 * - Safe default (no-op) if no sink installed
 */
public final class Debug {

    // NOOP must be initialized before INSTANCE reads it
    private static final DebugSink NOOP = (level, tag, message, error) -> {
        // no sink installed
    };

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);
    private volatile DebugLevel threshold = DebugLevel.TRACE;

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Route everything at INFO and above to stdout, errors to stderr. */
    public static void useSysOut() {
        INSTANCE.threshold = DebugLevel.INFO;
        INSTANCE.setSink((level, tag, message, error) -> {
            PrintStream out = (level == DebugLevel.ERROR) ? System.err : System.out;
            out.println("[" + level + "][" + tag + "] " + message);
            if (error != null) error.printStackTrace(out);
        });
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    public void setThreshold(DebugLevel level) {
        this.threshold = (level == null) ? DebugLevel.TRACE : level;
    }

    // Convenience methods
    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (level.ordinal() < threshold.ordinal()) return;
        DebugSink sink = sinkRef.get();
        if (sink != null) sink.log(level, tag, message, error);
    }
}
