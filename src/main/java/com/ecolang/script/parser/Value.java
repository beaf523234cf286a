package com.ecolang.script.parser;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Value {
    public enum Type { INT, FLOAT, BOOL, STRING, ARRAY, NONE }

    /** Deepest array nesting a script may build. */
    public static final int MAX_DEPTH = 100;

    private static final Value NONE = new Value(Type.NONE, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;
    // array shape, cached so size checks never walk the tree
    private final int depth;
    private final long nestedCount;

    private Value(Type type, Object value) {
        this(type, value, 0, 0L);
    }

    private Value(Type type, Object value, int depth, long nestedCount) {
        this.type = type;
        this.value = value;
        this.depth = depth;
        this.nestedCount = nestedCount;
    }

    public static Value integer(long l) { return new Value(Type.INT, l); }
    public static Value number(double d) { return new Value(Type.FLOAT, d); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value string(String s) {
        if (s == null) throw new IllegalArgumentException("string value is null");
        return new Value(Type.STRING, s);
    }
    public static Value array(List<Value> a) {
        List<Value> items = Collections.unmodifiableList(new ArrayList<>(a));
        int deepest = 0;
        long count = 0L;
        for (Value item : items) {
            deepest = Math.max(deepest, item.depth);
            count += 1L + item.nestedCount;
        }
        return new Value(Type.ARRAY, items, deepest + 1, count);
    }
    public static Value none() { return NONE; }

    /**
     * Converts a host value (inputs map, JSON-decoded data) into a script value.
     * Accepts numbers, booleans, strings, lists of those, and null.
     */
    public static Value fromJava(Object o) {
        if (o == null) return NONE;
        if (o instanceof Value) return (Value) o;
        if (o instanceof Boolean) return bool((Boolean) o);
        if (o instanceof Integer || o instanceof Long || o instanceof Short || o instanceof Byte) {
            return integer(((Number) o).longValue());
        }
        if (o instanceof Number) return number(((Number) o).doubleValue());
        if (o instanceof CharSequence) return string(o.toString());
        if (o instanceof List) {
            List<?> src = (List<?>) o;
            List<Value> out = new ArrayList<>(src.size());
            for (Object item : src) out.add(fromJava(item));
            return array(out);
        }
        throw new IllegalArgumentException("Unsupported value type: " + o.getClass().getSimpleName());
    }

    /** Inverse of {@link #fromJava}: Long, Double, Boolean, String, List or null. */
    public Object toJava() {
        switch (type) {
            case ARRAY: {
                List<Value> items = asArray();
                List<Object> out = new ArrayList<>(items.size());
                for (Value v : items) out.add(v.toJava());
                return out;
            }
            case NONE:
                return null;
            default:
                return value;
        }
    }

    public Type getType() { return type; }

    public boolean isNumeric() { return type == Type.INT || type == Type.FLOAT; }

    public boolean isNone() { return type == Type.NONE; }

    public long asInt() {
        if (type != Type.INT) throw new EvalError("Expected int, got " + type);
        return (long) value;
    }

    /** Numeric view of an INT or FLOAT. */
    public double asNumber() {
        if (type == Type.INT) return (long) value;
        if (type == Type.FLOAT) return (double) value;
        throw new EvalError("Expected number, got " + type);
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new EvalError("Expected bool, got " + type);
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new EvalError("Expected string, got " + type);
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asArray() {
        if (type != Type.ARRAY) throw new EvalError("Expected array, got " + type);
        return (List<Value>) value;
    }

    /** Array nesting level: 0 for scalars, 1 for a flat array. */
    public int depth() { return depth; }

    /** Values reachable inside this one, counting shared elements once per occurrence. */
    public long nestedCount() { return nestedCount; }

    public boolean isTruthy() {
        switch (type) {
            case BOOL: return asBool();
            case INT: return asInt() != 0L;
            case FLOAT: return asNumber() != 0.0;
            case STRING: return !asString().isEmpty();
            case ARRAY: return !asArray().isEmpty();
            default: return false;
        }
    }

    /** Text written by {@code say}, {@code warn} and {@code toString()}. */
    public String display() {
        return display(Integer.MAX_VALUE);
    }

    /**
     * {@link #display()} that gives up once the text would exceed
     * {@code maxChars}.
     *
     * @throws EvalError when the text is longer than {@code maxChars}
     */
    public String display(int maxChars) {
        if (type == Type.STRING) {
            String s = asString();
            if (s.length() > maxChars) throw tooLong(maxChars);
            return s;
        }
        StringBuilder sb = new StringBuilder();
        write(sb, maxChars);
        return sb.toString();
    }

    /** Like {@link #display()}, but strings are quoted; used for array elements. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        write(sb, Integer.MAX_VALUE);
        return sb.toString();
    }

    private void write(StringBuilder sb, int maxChars) {
        switch (type) {
            case INT:
                append(sb, Long.toString(asInt()), maxChars);
                return;
            case FLOAT:
                append(sb, formatFloat((double) value), maxChars);
                return;
            case BOOL:
                append(sb, asBool() ? "true" : "false", maxChars);
                return;
            case STRING:
                append(sb, "\"", maxChars);
                append(sb, asString(), maxChars);
                append(sb, "\"", maxChars);
                return;
            case ARRAY: {
                append(sb, "[", maxChars);
                List<Value> items = asArray();
                for (int i = 0; i < items.size(); i++) {
                    if (i > 0) append(sb, ", ", maxChars);
                    items.get(i).write(sb, maxChars);
                }
                append(sb, "]", maxChars);
                return;
            }
            default:
                append(sb, "none", maxChars);
        }
    }

    private static void append(StringBuilder sb, String s, int maxChars) {
        if (s.length() > maxChars - sb.length()) throw tooLong(maxChars);
        sb.append(s);
    }

    static EvalError tooLong(int maxChars) {
        return new EvalError("String too long (max " + maxChars + " chars)");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (isNumeric() && other.isNumeric()) {
            if (type == Type.INT && other.type == Type.INT) return asInt() == other.asInt();
            return asNumber() == other.asNumber();
        }
        if (type != other.type) return false;
        return (value == null) ? other.value == null : value.equals(other.value);
    }

    @Override
    public int hashCode() {
        if (isNumeric()) return Double.hashCode(asNumber());
        return (value == null) ? 0 : value.hashCode();
    }

    /**
     * Shortest round-trip form, always with a fraction or an exponent:
     * 2.0, 2.5, 1e-05, 1e+16, inf, nan.
     */
    static String formatFloat(double d) {
        if (Double.isNaN(d)) return "nan";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == 0.0) return Double.toString(d);

        double abs = Math.abs(d);
        String raw = Double.toString(d);
        if (abs >= 1e-4 && abs < 1e16) {
            if (raw.indexOf('E') < 0) return raw;
            String plain = new BigDecimal(raw).toPlainString();
            return plain.indexOf('.') < 0 ? plain + ".0" : plain;
        }

        // Double.toString already uses E notation outside [1e-3, 1e7)
        int e = raw.indexOf('E');
        String mantissa = raw.substring(0, e);
        int exp = Integer.parseInt(raw.substring(e + 1));
        if (mantissa.endsWith(".0")) mantissa = mantissa.substring(0, mantissa.length() - 2);
        String sign = exp < 0 ? "-" : "+";
        int absExp = Math.abs(exp);
        return mantissa + "e" + sign + (absExp < 10 ? "0" : "") + absExp;
    }
}
