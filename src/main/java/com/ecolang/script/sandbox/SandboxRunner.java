package com.ecolang.script.sandbox;

import com.ecolang.script.runtime.RunResult;
import com.ecolang.script.runtime.RunSettings;

/** Runs code out of process and maps the outcome onto a {@link RunResult}. Never throws. */
public interface SandboxRunner {
    RunResult run(String code, RunSettings settings);
}
