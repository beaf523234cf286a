package com.ecolang.script.parser;

import com.ecolang.script.parser.Expr.ExprInterface;

/**
 * An expression parsed and validated once, when its statement is parsed. A
 * parse or validation failure is kept and only raised when the owning
 * statement runs, so a bad expression in a branch that never executes does not
 * fail the program.
 */
public final class CompiledExpression {
    private final String source;
    private final int offset;
    private final ExprInterface tree;
    private final EvalError failure;
    private final boolean arithmetic;

    private CompiledExpression(String source, int offset, ExprInterface tree, EvalError failure, boolean arithmetic) {
        this.source = source;
        this.offset = offset;
        this.tree = tree;
        this.failure = failure;
        this.arithmetic = arithmetic;
    }

    /**
     * @throws NestingLimitError when the expression is nested too deeply to
     *         compile at all
     * @param offset 0-based position of {@code source} inside its statement line
     */
    public static CompiledExpression compile(String source, int offset, ExpressionValidator.Policy policy) {
        try {
            ExprInterface tree = ExprParser.parse(source);
            ExpressionValidator validator = new ExpressionValidator(policy);
            validator.validate(tree);
            return new CompiledExpression(source, offset, tree, null, validator.sawArithmetic());
        } catch (NestingLimitError e) {
            throw e;
        } catch (EvalError e) {
            return new CompiledExpression(source, offset, null, e, false);
        }
    }

    public static CompiledExpression compile(String source, int offset) {
        return compile(source, offset, ExpressionValidator.Policy.STANDARD);
    }

    public Value evaluate(Environment env) {
        if (failure != null) {
            throw new EvalError(failure.getMessage(), failure.getColumn(), failure);
        }
        return new ExpressionEvaluator(env).evaluate(tree);
    }

    /** Column in the statement line for an error reported at {@code exprColumn}. */
    public int lineColumn(Integer exprColumn) {
        return offset + ((exprColumn == null) ? 1 : exprColumn);
    }

    public boolean isValid() { return failure == null; }

    public boolean hasArithmetic() { return arithmetic; }

    public String source() { return source; }

    public int offset() { return offset; }

    @Override
    public String toString() {
        return source;
    }
}
