package com.ecolang.script.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

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
 * Tree-walking evaluation of an already validated expression. Reads the
 * environment, never writes it. Every fault surfaces as {@link EvalError}.
 */
public final class ExpressionEvaluator implements ExprVisitor<Value> {

    public static final Set<String> BUILTINS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "len", "length", "toNumber", "toString", "array", "append", "at", "ecoOps")));

    /** Largest accepted |exponent| for '**'. */
    public static final int MAX_EXPONENT = 8;

    private static final Pattern DECIMAL =
            Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final Environment env;

    public ExpressionEvaluator(Environment env) {
        this.env = env;
    }

    public Value evaluate(ExprInterface expr) {
        return expr.accept(this);
    }

    @Override
    public Value visitLiteralExpr(Literal expr) {
        return expr.value;
    }

    @Override
    public Value visitVariableExpr(Variable expr) {
        Value v = env.get(expr.name.lexeme);
        if (v == null) {
            throw new EvalError("Undefined variable '" + expr.name.lexeme + "'", expr.column());
        }
        return v;
    }

    @Override
    public Value visitUnaryExpr(Unary expr) {
        Value right = evaluate(expr.right);
        switch (expr.operator.type) {
            case NOT:
                return Value.bool(!right.isTruthy());
            case MINUS:
                if (right.getType() == Value.Type.INT) {
                    if (right.asInt() == Long.MIN_VALUE) throw new EvalError("Integer overflow", expr.column());
                    return Value.integer(-right.asInt());
                }
                if (right.getType() == Value.Type.FLOAT) return Value.number(-right.asNumber());
                throw new EvalError("Unsupported operand type for unary -: " + typeName(right), expr.column());
            case PLUS:
                if (right.isNumeric()) return right;
                throw new EvalError("Unsupported operand type for unary +: " + typeName(right), expr.column());
            default:
                throw new EvalError("Unsupported unary operator: " + expr.operator.lexeme, expr.column());
        }
    }

    @Override
    public Value visitBinaryExpr(Binary expr) {
        Value left = evaluate(expr.left);
        Value right = evaluate(expr.right);
        Token op = expr.operator;

        if (op.type == TokenType.PLUS
                && (left.getType() == Value.Type.STRING || right.getType() == Value.Type.STRING)) {
            int max = env.maxStringLength();
            String l = limited(left, max, max, op.column);
            String r = limited(right, max - l.length(), max, op.column);
            return Value.string(l + r);
        }
        requireNumbers(op, left, right);
        boolean ints = left.getType() == Value.Type.INT && right.getType() == Value.Type.INT;

        try {
            switch (op.type) {
                case PLUS:
                    return ints ? Value.integer(Math.addExact(left.asInt(), right.asInt()))
                                : Value.number(left.asNumber() + right.asNumber());
                case MINUS:
                    return ints ? Value.integer(Math.subtractExact(left.asInt(), right.asInt()))
                                : Value.number(left.asNumber() - right.asNumber());
                case STAR:
                    return ints ? Value.integer(Math.multiplyExact(left.asInt(), right.asInt()))
                                : Value.number(left.asNumber() * right.asNumber());
                case SLASH:
                    requireNonZero(op, right, "division by zero");
                    return Value.number(left.asNumber() / right.asNumber());
                case DOUBLE_SLASH:
                    requireNonZero(op, right, "division by zero");
                    if (ints) {
                        if (left.asInt() == Long.MIN_VALUE && right.asInt() == -1L) {
                            throw new ArithmeticException("overflow");
                        }
                        return Value.integer(Math.floorDiv(left.asInt(), right.asInt()));
                    }
                    return Value.number(Math.floor(left.asNumber() / right.asNumber()));
                case PERCENT:
                    requireNonZero(op, right, "modulo by zero");
                    if (ints) return Value.integer(Math.floorMod(left.asInt(), right.asInt()));
                    return Value.number(floatMod(left.asNumber(), right.asNumber()));
                case DOUBLE_STAR:
                    return power(op, left, right, ints);
                default:
                    throw new EvalError("Unsupported binary operator: " + op.lexeme, op.column);
            }
        } catch (ArithmeticException e) {
            throw new EvalError("Integer overflow", op.column, e);
        }
    }

    private Value power(Token op, Value base, Value exponent, boolean ints) {
        if (Math.abs(exponent.asNumber()) > MAX_EXPONENT) {
            throw new EvalError("Exponent too large; max " + MAX_EXPONENT, op.column);
        }
        if (base.asNumber() == 0.0 && exponent.asNumber() < 0) {
            throw new EvalError("division by zero", op.column);
        }
        if (ints && exponent.asInt() >= 0) {
            long result = 1L;
            for (long i = 0; i < exponent.asInt(); i++) {
                result = Math.multiplyExact(result, base.asInt());
            }
            return Value.integer(result);
        }
        double result = Math.pow(base.asNumber(), exponent.asNumber());
        if (Double.isNaN(result)) {
            throw new EvalError("Result is not a real number", op.column);
        }
        return Value.number(result);
    }

    /** Remainder with the sign of the divisor. */
    private static double floatMod(double a, double b) {
        double m = a % b;
        if (m != 0.0 && ((m < 0) != (b < 0))) m += b;
        return m;
    }

    @Override
    public Value visitLogicalExpr(Logical expr) {
        Value left = evaluate(expr.left);
        if (expr.operator.type == TokenType.OR) {
            if (left.isTruthy()) return Value.bool(true);
        } else {
            if (!left.isTruthy()) return Value.bool(false);
        }
        return Value.bool(evaluate(expr.right).isTruthy());
    }

    @Override
    public Value visitCompareExpr(Compare expr) {
        if (expr.operators.size() != 1) {
            throw new EvalError("Chained comparisons not supported", expr.operators.get(1).column);
        }
        Value left = evaluate(expr.left);
        Value right = evaluate(expr.comparators.get(0));
        Token op = expr.operators.get(0);

        switch (op.type) {
            case EQUAL_EQUAL: return Value.bool(left.equals(right));
            case BANG_EQUAL:  return Value.bool(!left.equals(right));
            default:
                break;
        }

        int cmp;
        if (left.getType() == Value.Type.INT && right.getType() == Value.Type.INT) {
            cmp = Long.compare(left.asInt(), right.asInt());
        } else if (left.isNumeric() && right.isNumeric()) {
            double a = left.asNumber();
            double b = right.asNumber();
            if (Double.isNaN(a) || Double.isNaN(b)) return Value.bool(false);
            cmp = (a < b) ? -1 : ((a > b) ? 1 : 0);
        } else if (left.getType() == Value.Type.STRING && right.getType() == Value.Type.STRING) {
            cmp = left.asString().compareTo(right.asString());
        } else {
            throw new EvalError("Unsupported operand types for '" + op.lexeme + "': "
                    + typeName(left) + " and " + typeName(right), op.column);
        }

        switch (op.type) {
            case LESS:          return Value.bool(cmp < 0);
            case LESS_EQUAL:    return Value.bool(cmp <= 0);
            case GREATER:       return Value.bool(cmp > 0);
            case GREATER_EQUAL: return Value.bool(cmp >= 0);
            default:
                throw new EvalError("Unsupported comparison " + op.lexeme, op.column);
        }
    }

    @Override
    public Value visitCallExpr(Call expr) {
        String name = expr.calleeName();
        if (name == null || !BUILTINS.contains(name)) {
            throw new EvalError("Unsupported function call", expr.column());
        }
        List<Value> args = new ArrayList<>(expr.arguments.size());
        for (ExprInterface a : expr.arguments) args.add(evaluate(a));
        int col = expr.column();

        switch (name) {
            case "len":
            case "length": {
                arity("length", args, 1, col);
                Value x = args.get(0);
                if (x.getType() == Value.Type.STRING) {
                    String s = x.asString();
                    return Value.integer(s.codePointCount(0, s.length()));
                }
                if (x.getType() == Value.Type.ARRAY) return Value.integer(x.asArray().size());
                throw new EvalError("length expects a string or array", col);
            }
            case "toNumber":
                arity("toNumber", args, 1, col);
                return toNumber(args.get(0), col);
            case "toString":
                arity("toString", args, 1, col);
                return Value.string(limited(args.get(0), env.maxStringLength(), env.maxStringLength(), col));
            case "array":
                if (!args.isEmpty()) throw new EvalError("array expects 0 args", col);
                return Value.array(Collections.<Value>emptyList());
            case "append": {
                arity("append", args, 2, col);
                if (args.get(0).getType() != Value.Type.ARRAY) {
                    throw new EvalError("append first arg must be array", col);
                }
                Value target = args.get(0);
                Value item = args.get(1);
                if (target.nestedCount() + 1 + item.nestedCount() > env.maxArrayLength()) {
                    throw new EvalError("Array too large (max " + env.maxArrayLength() + " elements)", col);
                }
                if (item.depth() + 1 > Value.MAX_DEPTH) {
                    throw new EvalError("Array nested too deeply (max " + Value.MAX_DEPTH + " levels)", col);
                }
                List<Value> copy = new ArrayList<>(target.asArray());
                copy.add(item);
                return Value.array(copy);
            }
            case "at": {
                arity("at", args, 2, col);
                if (args.get(0).getType() != Value.Type.ARRAY) {
                    throw new EvalError("at first arg must be array", col);
                }
                return at(args.get(0).asArray(), args.get(1), col);
            }
            case "ecoOps": {
                if (!args.isEmpty()) throw new EvalError("ecoOps expects 0 args", col);
                Value ops = env.get(Environment.ECO_OPS);
                if (ops == null) return Value.integer(0);
                return Value.integer((long) ops.asNumber());
            }
            default:
                throw new EvalError("Unsupported function call", col);
        }
    }

    private static Value toNumber(Value x, int col) {
        switch (x.getType()) {
            case INT:
                return x;
            case BOOL:
                return Value.integer(x.asBool() ? 1 : 0);
            case FLOAT: {
                double d = x.asNumber();
                if (Double.isNaN(d) || Double.isInfinite(d) || Math.abs(d) >= 9.2e18) {
                    throw new EvalError("toNumber failed", col);
                }
                return Value.integer((long) d);
            }
            case STRING: {
                String s = x.asString().trim();
                try {
                    if (s.contains(".")) {
                        if (!DECIMAL.matcher(s).matches()) throw new NumberFormatException(s);
                        return Value.number(Double.parseDouble(s));
                    }
                    return Value.integer(Long.parseLong(s));
                } catch (NumberFormatException e) {
                    throw new EvalError("toNumber failed", col, e);
                }
            }
            default:
                throw new EvalError("toNumber failed", col);
        }
    }

    private static Value at(List<Value> items, Value index, int col) {
        long i;
        if (index.getType() == Value.Type.INT) i = index.asInt();
        else if (index.getType() == Value.Type.FLOAT) i = (long) index.asNumber();
        else throw new EvalError("index out of range", col);

        if (i < 0) i += items.size();
        if (i < 0 || i >= items.size()) throw new EvalError("index out of range", col);
        return items.get((int) i);
    }

    @Override
    public Value visitGetExpr(GetExpr expr) {
        throw new EvalError("Unsupported expression: Attribute", expr.name.column);
    }

    @Override
    public Value visitIndexExpr(IndexExpr expr) {
        throw new EvalError("Unsupported expression: Subscript", expr.bracket.column);
    }

    @Override
    public Value visitListExpr(ListExpr expr) {
        throw new EvalError("Unsupported expression: List", expr.column());
    }

    @Override
    public Value visitRejectedExpr(Rejected expr) {
        throw new EvalError("Unsupported expression: " + expr.element, expr.column());
    }

    /** Display text of {@code v} if it fits in {@code budget} chars of a string capped at {@code max}. */
    private static String limited(Value v, int budget, int max, int column) {
        try {
            return v.display(budget);
        } catch (EvalError e) {
            throw new EvalError(Value.tooLong(max).getMessage(), column, e);
        }
    }

    private static void arity(String name, List<Value> args, int expected, int col) {
        if (args.size() != expected) {
            throw new EvalError(name + " expects " + expected + (expected == 1 ? " arg" : " args"), col);
        }
    }

    private static void requireNumbers(Token op, Value left, Value right) {
        if (!left.isNumeric() || !right.isNumeric()) {
            throw new EvalError("Unsupported operand types for '" + op.lexeme + "': "
                    + typeName(left) + " and " + typeName(right), op.column);
        }
    }

    private static void requireNonZero(Token op, Value divisor, String message) {
        if (divisor.asNumber() == 0.0) throw new EvalError(message, op.column);
    }

    private static String typeName(Value v) {
        return v.getType().name().toLowerCase();
    }
}
