package com.ecolang.script.sandbox;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.ecolang.script.parser.Environment;
import com.ecolang.script.parser.EvalError;
import com.ecolang.script.parser.Expr.ExprInterface;
import com.ecolang.script.parser.ExprParser;
import com.ecolang.script.parser.ExpressionEvaluator;
import com.ecolang.script.parser.ExpressionValidator;
import com.ecolang.script.parser.Value;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * The worker-side language: blank lines, {@code #} comments, {@code name = expr}
 * assignments and bare expressions, validated under the strict policy. The
 * whole program is checked before any line runs; the value left in
 * {@code result} is returned.
 */
public final class SandboxEvaluator {
    public static final String RESULT = "result";

    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final ObjectMapper om;

    public SandboxEvaluator(ObjectMapper om) {
        this.om = om;
    }

    public SandboxResponse evaluate(String code) {
        List<Line> program = new ArrayList<>();
        String[] lines = (code == null) ? new String[0] : code.split("\\r\\n|\\r|\\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String t = lines[i].trim();
            if (t.isEmpty() || t.startsWith("#")) continue;
            try {
                program.add(parseLine(t));
            } catch (EvalError e) {
                return SandboxResponse.error("parse_error: " + e.getMessage() + " (line " + (i + 1) + ")");
            }
        }

        ExpressionValidator validator = new ExpressionValidator(ExpressionValidator.Policy.STRICT);
        for (Line line : program) {
            if (line.target != null && ExpressionValidator.FORBIDDEN_NAMES.contains(line.target)) {
                return SandboxResponse.error("name " + line.target + " not allowed");
            }
            try {
                validator.validate(line.expr);
            } catch (EvalError e) {
                return SandboxResponse.error(e.getMessage());
            }
        }

        Environment env = new Environment();
        ExpressionEvaluator evaluator = new ExpressionEvaluator(env);
        for (Line line : program) {
            try {
                Value v = evaluator.evaluate(line.expr);
                if (line.target != null) env.define(line.target, v);
            } catch (EvalError e) {
                return SandboxResponse.error("error: " + e.getMessage());
            }
        }

        Value result = env.get(RESULT);
        if (result == null || result.isNone()) return SandboxResponse.ok(null);
        return SandboxResponse.ok(om.valueToTree(result.toJava()));
    }

    private static Line parseLine(String t) {
        int eq = assignmentIndex(t);
        if (eq < 0) return new Line(null, ExprParser.parse(t));

        String target = t.substring(0, eq).trim();
        if (!NAME.matcher(target).matches()) {
            throw new EvalError("cannot assign to expression");
        }
        if (Environment.isReserved(target)) {
            throw new EvalError("cannot assign to reserved name '" + target + "'");
        }
        return new Line(target, ExprParser.parse(t.substring(eq + 1).trim()));
    }

    /** Index of a lone top-level {@code =}, or -1 when the line is a bare expression. */
    private static int assignmentIndex(String t) {
        char quote = 0;
        for (int i = 0; i < t.length(); i++) {
            char c = t.charAt(i);
            if (quote != 0) {
                if (c == '\\') i++;
                else if (c == quote) quote = 0;
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
                continue;
            }
            if (c != '=') continue;
            char prev = (i > 0) ? t.charAt(i - 1) : ' ';
            char next = (i + 1 < t.length()) ? t.charAt(i + 1) : ' ';
            if (next == '=') {
                i++;
                continue;
            }
            if (prev == '!' || prev == '<' || prev == '>') continue;
            return i;
        }
        return -1;
    }

    private static final class Line {
        final String target;
        final ExprInterface expr;

        Line(String target, ExprInterface expr) {
            this.target = target;
            this.expr = expr;
        }
    }
}
