package com.ecolang.script.parser;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import com.ecolang.script.parser.Expr.Binary;
import com.ecolang.script.parser.Expr.Call;
import com.ecolang.script.parser.Expr.Compare;
import com.ecolang.script.parser.Expr.ExprInterface;
import com.ecolang.script.parser.Expr.ExprVisitor;
import com.ecolang.script.parser.Expr.GetExpr;
import com.ecolang.script.parser.Expr.IndexExpr;
import com.ecolang.script.parser.Expr.ListExpr;
import com.ecolang.script.parser.Expr.Literal;
import com.ecolang.script.parser.Expr.Logical;
import com.ecolang.script.parser.Expr.Rejected;
import com.ecolang.script.parser.Expr.Unary;
import com.ecolang.script.parser.Expr.Variable;

/**
 * Static walk over a parsed expression. Runs before any evaluation and fails on
 * the first node outside the allowed subset.
 */
public final class ExpressionValidator implements ExprVisitor<Void> {

    public enum Policy {
        /** Statement expressions: whitelisted builtin calls allowed. */
        STANDARD,
        /** Sandbox worker: no calls at all. */
        STRICT
    }

    /** Bare names refused even though nothing could bind them. */
    public static final Set<String> FORBIDDEN_NAMES = Collections.unmodifiableSet(
            new HashSet<>(Arrays.asList("__import__", "eval", "exec", "open", "os", "sys")));

    private final Policy policy;
    private boolean arithmetic;

    public ExpressionValidator(Policy policy) {
        this.policy = (policy == null) ? Policy.STANDARD : policy;
    }

    public void validate(ExprInterface expr) {
        expr.accept(this);
    }

    /** True once the walk has passed an arithmetic operator. */
    public boolean sawArithmetic() {
        return arithmetic;
    }

    @Override
    public Void visitLiteralExpr(Literal expr) {
        return null;
    }

    @Override
    public Void visitVariableExpr(Variable expr) {
        String name = expr.name.lexeme;
        if (FORBIDDEN_NAMES.contains(name)) {
            String msg = (policy == Policy.STRICT)
                    ? "name " + name + " not allowed"
                    : "Unsupported name in expression: " + name;
            throw new EvalError(msg, expr.column());
        }
        return null;
    }

    @Override
    public Void visitUnaryExpr(Unary expr) {
        return expr.right.accept(this);
    }

    @Override
    public Void visitBinaryExpr(Binary expr) {
        arithmetic = true;
        expr.left.accept(this);
        return expr.right.accept(this);
    }

    @Override
    public Void visitLogicalExpr(Logical expr) {
        expr.left.accept(this);
        return expr.right.accept(this);
    }

    @Override
    public Void visitCompareExpr(Compare expr) {
        if (expr.operators.size() != 1) {
            throw new EvalError("Chained comparisons not supported", expr.operators.get(1).column);
        }
        expr.left.accept(this);
        for (ExprInterface c : expr.comparators) c.accept(this);
        return null;
    }

    @Override
    public Void visitCallExpr(Call expr) {
        if (policy == Policy.STRICT) throw reject("Call", expr.column());
        String name = expr.calleeName();
        if (name == null || !ExpressionEvaluator.BUILTINS.contains(name)) {
            throw new EvalError("Unsupported function call", expr.column());
        }
        for (ExprInterface arg : expr.arguments) arg.accept(this);
        return null;
    }

    @Override
    public Void visitGetExpr(GetExpr expr) {
        throw reject("Attribute", expr.name.column);
    }

    @Override
    public Void visitIndexExpr(IndexExpr expr) {
        throw reject("Subscript", expr.bracket.column);
    }

    @Override
    public Void visitListExpr(ListExpr expr) {
        throw reject("List", expr.column());
    }

    @Override
    public Void visitRejectedExpr(Rejected expr) {
        throw reject(expr.element, expr.column());
    }

    private EvalError reject(String element, int column) {
        String msg = (policy == Policy.STRICT)
                ? element + " not allowed"
                : "Unsupported expression element: " + element;
        return new EvalError(msg, column);
    }
}
