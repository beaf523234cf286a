package com.ecolang.script;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.ecolang.debug.Debug;
import com.ecolang.script.parser.Interpreter;
import com.ecolang.script.parser.Statement.Stmt;
import com.ecolang.script.parser.StatementParser;
import com.ecolang.script.runtime.EcoMeter;
import com.ecolang.script.runtime.EcoStats;
import com.ecolang.script.runtime.ErrorCode;
import com.ecolang.script.runtime.ResourceGovernor;
import com.ecolang.script.runtime.RunError;
import com.ecolang.script.runtime.RunResult;
import com.ecolang.script.runtime.RunSettings;
import com.ecolang.script.runtime.ScriptError;
import com.ecolang.script.sandbox.ProcessSandboxRunner;
import com.ecolang.script.sandbox.SandboxRunner;

/**
 * EcoLang engine.
 *
 * - Line-oriented statements: say / let / const / ask / warn / ecoTip / savePower
 * - Blocks: if..elif..else..end, while..end, for..end, repeat..end, func..end
 * - Every statement is charged an op cost; a successful run reports the
 *   estimated energy and CO2 of those ops
 * - Budgets (steps, loop iterations, wall clock, output, call depth) come from
 *   {@link RunSettings} and end the run with a structured error when breached
 * - {@code use_subprocess} hands the code to an out-of-process sandbox instead
 *
 * Holds only immutable state, so one instance may serve concurrent callers.
 * {@code execute} never throws for script problems, including programs
 * nested deeply enough to exhaust the thread stack.
 */
public class EcoLang {
    private static final String TAG = "EcoLang";
    static final String STACK_EXHAUSTED = "Program nested too deeply to run";

    private final RunSettings defaults;
    private final SandboxRunner sandbox;

    public EcoLang() {
        this(RunSettings.defaults(), new ProcessSandboxRunner());
    }

    public EcoLang(RunSettings defaults, SandboxRunner sandbox) {
        this.defaults = (defaults == null) ? RunSettings.defaults() : defaults;
        this.sandbox = sandbox;
    }

    public RunResult execute(String source) {
        return execute(source, Collections.<String, Object>emptyMap(), defaults);
    }

    public RunResult execute(String source, Map<String, ?> inputs) {
        return execute(source, inputs, defaults);
    }

    /** Overlays a snake_case settings map on this engine's defaults. */
    public RunResult execute(String source, Map<String, ?> inputs, Map<String, ?> settings) {
        RunSettings resolved;
        try {
            resolved = RunSettings.overlay(defaults, settings);
        } catch (IllegalArgumentException e) {
            return RunResult.failure(Collections.<String>emptyList(), Collections.<String>emptyList(),
                    RunError.of(ErrorCode.RUNTIME_ERROR, "Invalid settings: " + e.getMessage()));
        }
        return execute(source, inputs, resolved);
    }

    public RunResult execute(String source, Map<String, ?> inputs, RunSettings settings) {
        RunSettings s = (settings == null) ? defaults : settings;
        String code = (source == null) ? "" : source;

        if (s.useSubprocess()) {
            Debug.get().d(TAG, "delegating to sandbox");
            return sandbox.run(code, s);
        }

        EcoMeter meter = new EcoMeter();
        ResourceGovernor governor = new ResourceGovernor(s, meter);
        Debug.get().d(TAG, "run start: " + code.length() + " chars");
        try {
            List<Stmt> program = new StatementParser(code, s.maxFuncParams()).parse();
            new Interpreter(governor, inputs).run(program);
        } catch (ScriptError e) {
            Debug.get().w(TAG, "run failed: " + e.error());
            return RunResult.failure(new ArrayList<>(governor.output()), new ArrayList<>(governor.warnings()),
                    e.error());
        } catch (RuntimeException e) {
            Debug.get().e(TAG, "internal failure", e);
            return RunResult.failure(new ArrayList<>(governor.output()), new ArrayList<>(governor.warnings()),
                    RunError.of(ErrorCode.INTERNAL, "Internal error: " + e.getClass().getSimpleName()));
        } catch (StackOverflowError e) {
            // the parse and value caps should stop this first; the stack is unwound by now
            Debug.get().w(TAG, "run overflowed the stack");
            return RunResult.failure(new ArrayList<>(governor.output()), new ArrayList<>(governor.warnings()),
                    RunError.of(ErrorCode.RUNTIME_ERROR, STACK_EXHAUSTED));
        }

        long total = meter.total();
        EcoStats eco = EcoStats.compute(total, governor.elapsedSeconds(), s);
        List<String> warnings = new ArrayList<>(governor.warnings());
        if (EcoStats.isHighUsage(total)) warnings.add(EcoStats.HIGH_USAGE_WARNING);
        Debug.get().d(TAG, "run end: total_ops=" + total + " statements=" + governor.statementsExecuted());
        return RunResult.success(new ArrayList<>(governor.output()), warnings, eco);
    }

    public RunSettings defaults() {
        return defaults;
    }
}
