package com.ecolang.script.parser;

/**
 * Failure to parse, validate or evaluate a single expression. The column, when
 * known, is 1-based within the expression text; callers add the expression's
 * offset in the statement line.
 */
public class EvalError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final Integer column;

    public EvalError(String message) {
        this(message, null);
    }

    public EvalError(String message, Integer column) {
        super(message);
        this.column = column;
    }

    public EvalError(String message, Integer column, Throwable cause) {
        super(message, cause);
        this.column = column;
    }

    /** 1-based column inside the expression, or null when not derivable. */
    public Integer getColumn() {
        return column;
    }
}
