package com.ecolang.script.parser;

/**
 * An expression nested deeper than the parser accepts. Unlike other
 * {@link EvalError}s it is not deferred to run time: the statement parser
 * reports it as a syntax error straight away.
 */
public class NestingLimitError extends EvalError {
    private static final long serialVersionUID = 1L;

    public NestingLimitError(String message, Integer column) {
        super(message, column);
    }
}
