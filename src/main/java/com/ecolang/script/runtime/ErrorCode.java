package com.ecolang.script.runtime;

/** Fatal error kinds surfaced in {@link RunResult#getError()}. */
public enum ErrorCode {
    /** Malformed statement or unterminated block, detected before execution. */
    SYNTAX_ERROR,
    /** Expression failure, missing input, undefined variable, argument mismatch. */
    RUNTIME_ERROR,
    TIMEOUT,
    STEP_LIMIT,
    OUTPUT_LIMIT,
    /** The sandbox child could not be spawned or talked to. */
    SUBPROCESS_ERROR,
    /** The sandbox child exited abnormally or answered with garbage. */
    SUBPROCESS_FAILED,
    /** Dispatcher invariant violated; indicates a bug. */
    INTERNAL
}
