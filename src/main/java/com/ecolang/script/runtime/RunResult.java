package com.ecolang.script.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Outcome of one run. A failed run never carries eco statistics; an in-process
 * success always does. Sandbox runs carry none either way.
 */
@JsonPropertyOrder({"output", "warnings", "eco", "errors"})
public final class RunResult {
    private final List<String> outputLines;
    private final List<String> warnings;
    private final RunError error;
    private final EcoStats eco;

    private RunResult(List<String> outputLines, List<String> warnings, RunError error, EcoStats eco) {
        this.outputLines = Collections.unmodifiableList(new ArrayList<>(outputLines));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
        this.error = error;
        this.eco = eco;
    }

    public static RunResult success(List<String> outputLines, List<String> warnings, EcoStats eco) {
        if (eco == null) throw new IllegalArgumentException("eco is required for a successful run");
        return new RunResult(outputLines, warnings, null, eco);
    }

    public static RunResult failure(List<String> outputLines, List<String> warnings, RunError error) {
        if (error == null) throw new IllegalArgumentException("error is required for a failed run");
        return new RunResult(outputLines, warnings, error, null);
    }

    /** Result of the out-of-process path: no op accounting, error optional. */
    public static RunResult sandboxed(List<String> outputLines, RunError error) {
        return new RunResult(outputLines, Collections.<String>emptyList(), error, null);
    }

    @JsonIgnore
    public List<String> getOutputLines() { return outputLines; }

    /** Output lines joined by newlines; a successful run ends with a trailing newline. */
    @JsonProperty("output")
    public String getOutput() {
        String joined = String.join("\n", outputLines);
        if (error == null && !outputLines.isEmpty()) return joined + "\n";
        return joined;
    }

    @JsonProperty("warnings")
    public List<String> getWarnings() { return warnings; }

    @JsonProperty("errors")
    public RunError getError() { return error; }

    @JsonProperty("eco")
    public EcoStats getEco() { return eco; }

    @JsonIgnore
    public boolean isSuccess() { return error == null; }

    @Override
    public String toString() {
        return "RunResult{output=" + outputLines + ", warnings=" + warnings
                + ", error=" + error + ", eco=" + (eco == null ? "none" : eco.getTotalOps() + " ops") + "}";
    }
}
