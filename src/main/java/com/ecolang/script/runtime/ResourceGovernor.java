package com.ecolang.script.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * Enforces the per-run ceilings (statements, loop iterations, wall clock,
 * output size, call depth) and owns the output and warning buffers those
 * ceilings are measured against. One instance per run, shared by every nested
 * block and function body of that run.
 */
public final class ResourceGovernor {
    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final RunSettings settings;
    private final EcoMeter meter;
    private final LongSupplier clock;
    private final long startNanos;

    private final List<String> output = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private long outputChars;
    private long statements;

    public ResourceGovernor(RunSettings settings, EcoMeter meter) {
        this(settings, meter, System::nanoTime);
    }

    /** @param clock monotonic nanosecond source; tests pass a fake one */
    public ResourceGovernor(RunSettings settings, EcoMeter meter, LongSupplier clock) {
        this.settings = settings;
        this.meter = meter;
        this.clock = clock;
        this.startNanos = clock.getAsLong();
    }

    /** Called before every statement at any nesting depth. */
    public void beforeStatement() {
        checkClock();
        if (statements >= settings.maxSteps()) {
            warnings.add("Step limit exceeded");
            throw ScriptError.of(ErrorCode.STEP_LIMIT, "Step limit exceeded");
        }
        statements++;
    }

    /**
     * Called before every loop iteration. A wall-clock breach is fatal; the
     * other two ceilings stop the loop softly.
     *
     * @return the warning to record when the loop must stop, or null to continue
     */
    public String checkIteration(String keyword, long iterationsDone) {
        checkClock();
        if (iterationsDone >= settings.maxLoop()) {
            return capitalize(keyword) + " iterations limited to " + settings.maxLoop();
        }
        if (meter.total() > settings.maxSteps()) {
            return "Step limit exceeded inside " + keyword + "; aborted";
        }
        return null;
    }

    public void checkClock() {
        if (elapsedSeconds() > settings.maxTimeS()) {
            throw ScriptError.of(ErrorCode.TIMEOUT, "Time limit exceeded");
        }
    }

    /** Depth is the frame-stack height the call would reach. */
    public void checkCallDepth(int depth) {
        if (depth > settings.maxCallDepth()) {
            throw ScriptError.runtime("Call depth limit exceeded");
        }
    }

    /** Appends one output line, or fails without touching the buffer. */
    public void emit(String line) {
        if (outputChars + line.length() > settings.maxOutputChars()) {
            throw ScriptError.of(ErrorCode.OUTPUT_LIMIT, "Output length limit reached");
        }
        outputChars += line.length();
        output.add(line);
    }

    public void warn(String warning) {
        warnings.add(warning);
    }

    public double elapsedSeconds() {
        return (clock.getAsLong() - startNanos) / NANOS_PER_SECOND;
    }

    public List<String> output() { return Collections.unmodifiableList(output); }

    public List<String> warnings() { return Collections.unmodifiableList(warnings); }

    public long statementsExecuted() { return statements; }

    public RunSettings settings() { return settings; }

    public EcoMeter meter() { return meter; }

    private static String capitalize(String keyword) {
        if (keyword.isEmpty()) return keyword;
        return Character.toUpperCase(keyword.charAt(0)) + keyword.substring(1);
    }
}
