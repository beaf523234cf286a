package com.ecolang.script.runtime;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable per-run configuration: safety ceilings, eco tunables and sandbox
 * options. Built once before a run starts and threaded through every nested
 * execution of that run.
 */
public final class RunSettings {

    public static final String MAX_STEPS = "max_steps";
    public static final String MAX_LOOP = "max_loop";
    public static final String MAX_TIME_S = "max_time_s";
    public static final String MAX_OUTPUT_CHARS = "max_output_chars";
    public static final String MAX_CALL_DEPTH = "max_call_depth";
    public static final String MAX_FUNC_PARAMS = "max_func_params";
    public static final String MAX_STRING_LENGTH = "max_string_length";
    public static final String MAX_ARRAY_LENGTH = "max_array_length";
    public static final String ENERGY_PER_OP_J = "energy_per_op_J";
    public static final String IDLE_POWER_W = "idle_power_W";
    public static final String CO2_PER_KWH_G = "co2_per_kwh_g";
    public static final String USE_SUBPROCESS = "use_subprocess";
    public static final String TIMEOUT_S = "timeout_s";
    public static final String CPU_SECONDS = "cpu_seconds";
    public static final String MEM_LIMIT_MB = "mem_limit_mb";

    private static final RunSettings DEFAULTS = new Builder().build();

    private final int maxSteps;
    private final int maxLoop;
    private final double maxTimeS;
    private final int maxOutputChars;
    private final int maxCallDepth;
    private final int maxFuncParams;
    private final int maxStringLength;
    private final int maxArrayLength;
    private final double energyPerOpJ;
    private final double idlePowerW;
    private final double co2PerKwhG;
    private final boolean useSubprocess;
    private final double timeoutS;
    private final int cpuSeconds;
    private final int memLimitMb;

    private RunSettings(Builder b) {
        this.maxSteps = b.maxSteps;
        this.maxLoop = b.maxLoop;
        this.maxTimeS = b.maxTimeS;
        this.maxOutputChars = b.maxOutputChars;
        this.maxCallDepth = b.maxCallDepth;
        this.maxFuncParams = b.maxFuncParams;
        this.maxStringLength = b.maxStringLength;
        this.maxArrayLength = b.maxArrayLength;
        this.energyPerOpJ = b.energyPerOpJ;
        this.idlePowerW = b.idlePowerW;
        this.co2PerKwhG = b.co2PerKwhG;
        this.useSubprocess = b.useSubprocess;
        this.timeoutS = b.timeoutS;
        this.cpuSeconds = b.cpuSeconds;
        this.memLimitMb = b.memLimitMb;
    }

    public static RunSettings defaults() { return DEFAULTS; }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.maxSteps = maxSteps;
        b.maxLoop = maxLoop;
        b.maxTimeS = maxTimeS;
        b.maxOutputChars = maxOutputChars;
        b.maxCallDepth = maxCallDepth;
        b.maxFuncParams = maxFuncParams;
        b.maxStringLength = maxStringLength;
        b.maxArrayLength = maxArrayLength;
        b.energyPerOpJ = energyPerOpJ;
        b.idlePowerW = idlePowerW;
        b.co2PerKwhG = co2PerKwhG;
        b.useSubprocess = useSubprocess;
        b.timeoutS = timeoutS;
        b.cpuSeconds = cpuSeconds;
        b.memLimitMb = memLimitMb;
        return b;
    }

    /**
     * Overlay caller-supplied settings (JSON-ish map, snake_case keys) on the
     * defaults. Unknown keys are ignored; malformed values are rejected.
     */
    public static RunSettings fromMap(Map<String, ?> raw) {
        return overlay(DEFAULTS, raw);
    }

    public static RunSettings overlay(RunSettings base, Map<String, ?> raw) {
        Builder b = base.toBuilder();
        if (raw == null || raw.isEmpty()) return b.build();

        if (raw.containsKey(MAX_STEPS)) b.maxSteps(asInt(raw, MAX_STEPS));
        if (raw.containsKey(MAX_LOOP)) b.maxLoop(asInt(raw, MAX_LOOP));
        if (raw.containsKey(MAX_TIME_S)) b.maxTimeS(asDouble(raw, MAX_TIME_S));
        if (raw.containsKey(MAX_OUTPUT_CHARS)) b.maxOutputChars(asInt(raw, MAX_OUTPUT_CHARS));
        if (raw.containsKey(MAX_CALL_DEPTH)) b.maxCallDepth(asInt(raw, MAX_CALL_DEPTH));
        if (raw.containsKey(MAX_FUNC_PARAMS)) b.maxFuncParams(asInt(raw, MAX_FUNC_PARAMS));
        if (raw.containsKey(MAX_STRING_LENGTH)) b.maxStringLength(asInt(raw, MAX_STRING_LENGTH));
        if (raw.containsKey(MAX_ARRAY_LENGTH)) b.maxArrayLength(asInt(raw, MAX_ARRAY_LENGTH));
        if (raw.containsKey(ENERGY_PER_OP_J)) b.energyPerOpJ(asDouble(raw, ENERGY_PER_OP_J));
        if (raw.containsKey(IDLE_POWER_W)) b.idlePowerW(asDouble(raw, IDLE_POWER_W));
        if (raw.containsKey(CO2_PER_KWH_G)) b.co2PerKwhG(asDouble(raw, CO2_PER_KWH_G));
        if (raw.containsKey(USE_SUBPROCESS)) b.useSubprocess(asBool(raw, USE_SUBPROCESS));
        if (raw.containsKey(TIMEOUT_S)) b.timeoutS(asDouble(raw, TIMEOUT_S));
        if (raw.containsKey(CPU_SECONDS)) b.cpuSeconds(asInt(raw, CPU_SECONDS));
        if (raw.containsKey(MEM_LIMIT_MB)) b.memLimitMb(asInt(raw, MEM_LIMIT_MB));
        return b.build();
    }

    /**
     * Server-side caps: every safety ceiling is lowered to the one in
     * {@code ceilings}; eco tunables and the subprocess flag pass through.
     */
    public RunSettings clampTo(RunSettings ceilings) {
        return toBuilder()
                .maxSteps(Math.min(maxSteps, ceilings.maxSteps))
                .maxLoop(Math.min(maxLoop, ceilings.maxLoop))
                .maxTimeS(Math.min(maxTimeS, ceilings.maxTimeS))
                .maxOutputChars(Math.min(maxOutputChars, ceilings.maxOutputChars))
                .maxCallDepth(Math.min(maxCallDepth, ceilings.maxCallDepth))
                .maxFuncParams(Math.min(maxFuncParams, ceilings.maxFuncParams))
                .maxStringLength(Math.min(maxStringLength, ceilings.maxStringLength))
                .maxArrayLength(Math.min(maxArrayLength, ceilings.maxArrayLength))
                .timeoutS(Math.min(timeoutS, ceilings.timeoutS))
                .cpuSeconds(Math.min(cpuSeconds, ceilings.cpuSeconds))
                .memLimitMb(Math.min(memLimitMb, ceilings.memLimitMb))
                .build();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(MAX_STEPS, maxSteps);
        out.put(MAX_LOOP, maxLoop);
        out.put(MAX_TIME_S, maxTimeS);
        out.put(MAX_OUTPUT_CHARS, maxOutputChars);
        out.put(MAX_CALL_DEPTH, maxCallDepth);
        out.put(MAX_FUNC_PARAMS, maxFuncParams);
        out.put(MAX_STRING_LENGTH, maxStringLength);
        out.put(MAX_ARRAY_LENGTH, maxArrayLength);
        out.put(ENERGY_PER_OP_J, energyPerOpJ);
        out.put(IDLE_POWER_W, idlePowerW);
        out.put(CO2_PER_KWH_G, co2PerKwhG);
        out.put(USE_SUBPROCESS, useSubprocess);
        out.put(TIMEOUT_S, timeoutS);
        out.put(CPU_SECONDS, cpuSeconds);
        out.put(MEM_LIMIT_MB, memLimitMb);
        return out;
    }

    public int maxSteps() { return maxSteps; }
    public int maxLoop() { return maxLoop; }
    public double maxTimeS() { return maxTimeS; }
    public int maxOutputChars() { return maxOutputChars; }
    public int maxCallDepth() { return maxCallDepth; }
    public int maxFuncParams() { return maxFuncParams; }
    public int maxStringLength() { return maxStringLength; }
    public int maxArrayLength() { return maxArrayLength; }
    public double energyPerOpJ() { return energyPerOpJ; }
    public double idlePowerW() { return idlePowerW; }
    public double co2PerKwhG() { return co2PerKwhG; }
    public boolean useSubprocess() { return useSubprocess; }
    public double timeoutS() { return timeoutS; }
    public int cpuSeconds() { return cpuSeconds; }
    public int memLimitMb() { return memLimitMb; }

    @Override
    public String toString() {
        return "RunSettings" + toMap();
    }

    private static int asInt(Map<String, ?> raw, String key) {
        Object v = raw.get(key);
        if (v instanceof Number) return ((Number) v).intValue();
        if (v instanceof String) {
            try {
                return (int) Double.parseDouble(((String) v).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Setting '" + key + "' must be a number, got: " + v, e);
            }
        }
        throw new IllegalArgumentException("Setting '" + key + "' must be a number, got: " + v);
    }

    private static double asDouble(Map<String, ?> raw, String key) {
        Object v = raw.get(key);
        if (v instanceof Number) return ((Number) v).doubleValue();
        if (v instanceof String) {
            try {
                return Double.parseDouble(((String) v).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Setting '" + key + "' must be a number, got: " + v, e);
            }
        }
        throw new IllegalArgumentException("Setting '" + key + "' must be a number, got: " + v);
    }

    private static boolean asBool(Map<String, ?> raw, String key) {
        Object v = raw.get(key);
        if (v instanceof Boolean) return (Boolean) v;
        if (v instanceof String) return Boolean.parseBoolean(((String) v).trim());
        if (v instanceof Number) return ((Number) v).intValue() != 0;
        throw new IllegalArgumentException("Setting '" + key + "' must be a boolean, got: " + v);
    }

    public static final class Builder {
        private int maxSteps = 100_000;
        private int maxLoop = 10_000;
        private double maxTimeS = 1.5;
        private int maxOutputChars = 5_000;
        private int maxCallDepth = 5;
        private int maxFuncParams = 3;
        private int maxStringLength = 100_000;
        private int maxArrayLength = 10_000;
        private double energyPerOpJ = 1e-9;
        private double idlePowerW = 0.5;
        private double co2PerKwhG = 475;
        private boolean useSubprocess = false;
        private double timeoutS = 5.0;
        private int cpuSeconds = 5;
        private int memLimitMb = 128;

        private Builder() {}

        public Builder maxSteps(int v) { this.maxSteps = v; return this; }
        public Builder maxLoop(int v) { this.maxLoop = v; return this; }
        public Builder maxTimeS(double v) { this.maxTimeS = v; return this; }
        public Builder maxOutputChars(int v) { this.maxOutputChars = v; return this; }
        public Builder maxCallDepth(int v) { this.maxCallDepth = v; return this; }
        public Builder maxFuncParams(int v) { this.maxFuncParams = v; return this; }
        public Builder maxStringLength(int v) { this.maxStringLength = v; return this; }
        public Builder maxArrayLength(int v) { this.maxArrayLength = v; return this; }
        public Builder energyPerOpJ(double v) { this.energyPerOpJ = v; return this; }
        public Builder idlePowerW(double v) { this.idlePowerW = v; return this; }
        public Builder co2PerKwhG(double v) { this.co2PerKwhG = v; return this; }
        public Builder useSubprocess(boolean v) { this.useSubprocess = v; return this; }
        public Builder timeoutS(double v) { this.timeoutS = v; return this; }
        public Builder cpuSeconds(int v) { this.cpuSeconds = v; return this; }
        public Builder memLimitMb(int v) { this.memLimitMb = v; return this; }

        public RunSettings build() {
            if (maxSteps < 0 || maxLoop < 0 || maxOutputChars < 0) {
                throw new IllegalArgumentException("step, loop and output limits must not be negative");
            }
            if (maxTimeS < 0 || timeoutS <= 0) {
                throw new IllegalArgumentException("time limits must be positive");
            }
            if (maxCallDepth < 0 || maxFuncParams < 0) {
                throw new IllegalArgumentException("call depth and parameter limits must not be negative");
            }
            if (maxStringLength < 0 || maxArrayLength < 0) {
                throw new IllegalArgumentException("string and array limits must not be negative");
            }
            if (cpuSeconds <= 0 || memLimitMb <= 0) {
                throw new IllegalArgumentException("sandbox cpu and memory limits must be positive");
            }
            return new RunSettings(this);
        }
    }
}
