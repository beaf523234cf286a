package com.ecolang.script.runtime;

/**
 * Fatal condition raised anywhere inside a run. The engine facade converts it
 * into {@link RunResult#getError()}; it never crosses the public boundary.
 */
public class ScriptError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final RunError error;

    public ScriptError(RunError error) {
        super(error.getMessage(), null, false, false);
        this.error = error;
    }

    public ScriptError(RunError error, Throwable cause) {
        super(error.getMessage(), cause, false, false);
        this.error = error;
    }

    public RunError error() {
        return error;
    }

    public ErrorCode code() {
        return error.getCode();
    }

    public static ScriptError syntax(String message, int line, int column, String lineText, String hint) {
        return new ScriptError(new RunError(ErrorCode.SYNTAX_ERROR, message, line, column, lineText, hint));
    }

    public static ScriptError runtime(String message) {
        return new ScriptError(RunError.of(ErrorCode.RUNTIME_ERROR, message));
    }

    public static ScriptError of(ErrorCode code, String message) {
        return new ScriptError(RunError.of(code, message));
    }
}
