package com.ecolang.script.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import com.ecolang.script.parser.Statement.Stmt;
import com.ecolang.script.runtime.ScriptError;

/**
 * Single pass over the source lines producing the statement tree. Every
 * structural problem (unknown statement, malformed header, stray block keyword,
 * unterminated block) is reported here, before anything runs.
 */
public class StatementParser {
    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

    /** Deepest allowed nesting of if/while/for/repeat/func bodies. */
    public static final int MAX_BLOCK_DEPTH = 100;

    private static final Set<String> TOP = Collections.emptySet();
    private static final Set<String> END_ONLY = Collections.singleton("end");
    private static final Set<String> IF_ARMS =
            Collections.unmodifiableSet(new HashSet<>(Arrays.asList("end", "else", "elif")));

    private final String[] lines;
    private final int maxFuncParams;
    private int current = 0;
    private int functionDepth = 0;
    private int blockDepth = 0;
    // 1-based line of the header being parsed; current may already be past it
    private int headerLine = 0;

    public StatementParser(String source, int maxFuncParams) {
        this.lines = (source == null) ? new String[0] : source.split("\\r\\n|\\r|\\n", -1);
        this.maxFuncParams = maxFuncParams;
    }

    public List<Stmt> parse() {
        List<Stmt> program = new ArrayList<>();
        statements(program, TOP);
        return program;
    }

    /**
     * Parses statements into {@code out} until a block keyword in
     * {@code accepted} (left unconsumed and returned) or end of input (null).
     */
    private String statements(List<Stmt> out, Set<String> accepted) {
        if (blockDepth > MAX_BLOCK_DEPTH) {
            // current is the first body line, so the opener sits just above it
            throw ScriptError.syntax("Too many nested blocks (max " + MAX_BLOCK_DEPTH + ")", current, 1,
                    lines[current - 1].trim(), "Move the inner blocks into a func.");
        }
        blockDepth++;
        try {
            return statementsAtDepth(out, accepted);
        } finally {
            blockDepth--;
        }
    }

    private String statementsAtDepth(List<Stmt> out, Set<String> accepted) {
        while (current < lines.length) {
            String t = lines[current].trim();
            if (t.isEmpty() || t.startsWith("#")) {
                current++;
                continue;
            }
            String kw = keyword(t);
            if (kw.equals("end") || kw.equals("else") || kw.equals("elif")) {
                if (!accepted.contains(kw)) throw stray(kw, t);
                if (!kw.equals("elif") && !t.equals(kw)) {
                    throw error("Unexpected text after '" + kw + "'", kw.length() + 2, t,
                            "Write '" + kw + "' on its own line.");
                }
                return kw;
            }
            headerLine = lineNo();
            out.add(statement(t, kw));
        }
        return null;
    }

    private Stmt statement(String t, String kw) {
        switch (kw) {
            case "say":       return say(t);
            case "let":       return assign(t, false);
            case "const":     return assign(t, true);
            case "ask":       return ask(t);
            case "warn":      return warn(t);
            case "ecoTip":
                if (t.equals("ecoTip")) {
                    current++;
                    return new Statement.EcoTip(current, t);
                }
                break;
            case "savePower": return savePower(t);
            case "func":      return func(t);
            case "call":      return call(t);
            case "return":    return returnStmt(t);
            case "if":        return ifStmt(t);
            case "while":     return whileStmt(t);
            case "for":       return forStmt(t);
            case "repeat":    return repeat(t);
            default:
                break;
        }
        throw error("Unknown statement: " + t, 1, t, "Check the command name or syntax.");
    }

    // -------------------------
    // Simple statements
    // -------------------------

    private Stmt say(String t) {
        if (t.length() == 3) throw error("Missing expression after 'say'", 4, t, "Use: say <expression>");
        int line = lineNo();
        current++;
        return new Statement.Say(line, t, expr(t, 3, t.length()));
    }

    private Stmt warn(String t) {
        if (t.length() == 4) throw error("Missing expression after 'warn'", 5, t, "Use: warn <expression>");
        int line = lineNo();
        current++;
        return new Statement.Warn(line, t, expr(t, 4, t.length()));
    }

    private Stmt assign(String t, boolean constant) {
        String kw = constant ? "const" : "let";
        int eq = t.indexOf('=', kw.length());
        if (eq < 0) {
            throw error(constant ? "Expected '=' in const" : "Expected '=' in let statement", 1, t,
                    constant ? "Use: const NAME = expr" : "Use: let name = expr");
        }
        String name = t.substring(kw.length(), eq).trim();
        if (!isName(name)) {
            throw error(constant ? "Invalid const name" : "Invalid identifier in let", kw.length() + 2, t,
                    "Identifiers must be letters/digits/_ and not start with a digit.");
        }
        requireNotReserved(name, kw.length() + 2, t);
        int line = lineNo();
        current++;
        return new Statement.Assign(line, t, name, expr(t, eq + 1, t.length()), constant);
    }

    private Stmt ask(String t) {
        String name = t.substring(3).trim();
        if (!isName(name)) throw error("Invalid identifier in ask", 5, t, "Use: ask name");
        requireNotReserved(name, 5, t);
        int line = lineNo();
        current++;
        return new Statement.Ask(line, t, name);
    }

    private Stmt savePower(String t) {
        String level = t.substring("savePower".length()).trim();
        if (!DECIMAL.matcher(level).matches()) {
            throw error("Invalid number for savePower", "savePower".length() + 2, t, "Use: savePower <number>");
        }
        int line = lineNo();
        current++;
        return new Statement.SavePower(line, t, Double.parseDouble(level));
    }

    private Stmt returnStmt(String t) {
        if (functionDepth == 0) {
            throw error("'return' outside of a function", 1, t, "Use 'return' only inside a func..end block.");
        }
        int line = lineNo();
        current++;
        CompiledExpression value = t.equals("return") ? null : expr(t, 6, t.length());
        return new Statement.ReturnStmt(line, t, value);
    }

    // -------------------------
    // Functions
    // -------------------------

    private Stmt func(String t) {
        String[] parts = t.substring(4).trim().split("\\s+");
        if (parts.length == 0 || parts[0].isEmpty()) {
            throw error("Missing function name", 1, t, "Use: func name [args]");
        }
        String name = parts[0];
        if (!isName(name)) throw error("Invalid function name", 6, t, "Use: func name [args]");

        Set<String> params = new LinkedHashSet<>();
        for (int i = 1; i < parts.length; i++) {
            String p = parts[i];
            int col = t.indexOf(p, 5) + 1;
            if (!isName(p)) throw error("Invalid parameter name '" + p + "'", col, t, "Use: func name [args]");
            requireNotReserved(p, col, t);
            if (!params.add(p)) throw error("Duplicate parameter '" + p + "'", col, t, null);
        }
        if (params.size() > maxFuncParams) {
            throw error("Too many params (max " + maxFuncParams + ")", 1, t, null);
        }

        int line = lineNo();
        current++;
        List<Stmt> body = new ArrayList<>();
        functionDepth++;
        try {
            closeBlock(statements(body, END_ONLY), "func", line, t);
        } finally {
            functionDepth--;
        }
        return new Statement.FuncStmt(line, t, name, new ArrayList<>(params), body);
    }

    private Stmt call(String t) {
        final String usage = "Use: call name [with a, b] [into var]";
        int restStart = 4;
        if (t.length() == 4) throw error("Missing function name", 1, t, usage);

        int mainEnd = t.length();
        String into = null;
        int intoIdx = indexOfTopLevel(t, " into ", restStart);
        if (intoIdx >= 0) {
            into = t.substring(intoIdx + " into ".length()).trim();
            int col = intoIdx + " into ".length() + 1;
            if (!isName(into)) throw error("Invalid target after 'into'", col, t, usage);
            requireNotReserved(into, col, t);
            mainEnd = intoIdx;
        }

        List<CompiledExpression> args = new ArrayList<>();
        int nameEnd = mainEnd;
        int withIdx = indexOfTopLevel(t.substring(0, mainEnd), " with ", restStart);
        if (withIdx >= 0) {
            nameEnd = withIdx;
            int argsStart = withIdx + " with ".length();
            for (int[] range : splitTopLevel(t, argsStart, mainEnd)) {
                if (t.substring(range[0], range[1]).trim().isEmpty()) continue;
                args.add(expr(t, range[0], range[1]));
            }
        }

        String name = t.substring(restStart, nameEnd).trim();
        if (!isName(name)) throw error("Invalid function name", restStart + 2, t, usage);

        int line = lineNo();
        current++;
        return new Statement.CallStmt(line, t, name, args, into);
    }

    // -------------------------
    // Blocks
    // -------------------------

    private Stmt ifStmt(String t) {
        int line = lineNo();
        CompiledExpression cond = header(t, "if", " then", "Expected 'then' after if condition",
                "Write: if <condition> then");
        current++;

        List<Statement.Branch> branches = new ArrayList<>();
        List<Stmt> body = new ArrayList<>();
        String stop = statements(body, IF_ARMS);
        branches.add(new Statement.Branch(line, t, cond, body));

        while ("elif".equals(stop)) {
            String et = lines[current].trim();
            int elifLine = lineNo();
            headerLine = elifLine;
            CompiledExpression elifCond = header(et, "elif", " then", "Expected 'then' after elif condition",
                    "Write: elif <condition> then");
            current++;
            List<Stmt> elifBody = new ArrayList<>();
            stop = statements(elifBody, IF_ARMS);
            branches.add(new Statement.Branch(elifLine, et, elifCond, elifBody));
        }

        List<Stmt> elseBody = null;
        if ("else".equals(stop)) {
            current++;
            elseBody = new ArrayList<>();
            stop = statements(elseBody, END_ONLY);
        }
        closeBlock(stop, "if", line, t);
        return new Statement.If(line, t, branches, elseBody);
    }

    private Stmt whileStmt(String t) {
        int line = lineNo();
        CompiledExpression cond = header(t, "while", " then", "Expected 'then' after while condition",
                "Write: while <condition> then");
        current++;
        List<Stmt> body = new ArrayList<>();
        closeBlock(statements(body, END_ONLY), "while", line, t);
        return new Statement.While(line, t, cond, body);
    }

    private Stmt forStmt(String t) {
        final String usage = "Use: for name = start to end [step s]";
        int eq = t.indexOf('=');
        if (eq < 0 || t.indexOf(" to ", eq) < 0) throw error(usage, 1, t, null);

        String var = t.substring(3, eq).trim();
        if (!isName(var)) throw error("Invalid loop variable name", 5, t, usage);
        requireNotReserved(var, 5, t);

        int rangeEnd = t.length();
        CompiledExpression step = null;
        int stepIdx = indexOfTopLevel(t, " step ", eq + 1);
        if (stepIdx >= 0) {
            step = expr(t, stepIdx + " step ".length(), t.length());
            rangeEnd = stepIdx;
        }
        int toIdx = indexOfTopLevel(t.substring(0, rangeEnd), " to ", eq + 1);
        if (toIdx < 0) throw error("Missing 'to' in for range", 1, t, usage);
        CompiledExpression start = expr(t, eq + 1, toIdx);
        CompiledExpression end = expr(t, toIdx + " to ".length(), rangeEnd);

        int line = lineNo();
        current++;
        List<Stmt> body = new ArrayList<>();
        closeBlock(statements(body, END_ONLY), "for", line, t);
        return new Statement.For(line, t, var, start, end, step, body);
    }

    private Stmt repeat(String t) {
        final String usage = "Write: repeat <number> times";
        if (!t.endsWith(" times")) {
            throw error("Expected 'times' at end of repeat", t.length() + 1, t, usage);
        }
        String count = between(t, "repeat", " times").trim();
        long n;
        if (!INTEGER.matcher(count).matches()) {
            throw error("Invalid repeat count", 8, t, "Use: repeat <number> times");
        }
        try {
            n = Long.parseLong(count);
        } catch (NumberFormatException e) {
            throw new ScriptError(ScriptError.syntax("Invalid repeat count", lineNo(), 8, t,
                    "Use: repeat <number> times").error(), e);
        }

        int line = lineNo();
        current++;
        List<Stmt> body = new ArrayList<>();
        closeBlock(statements(body, END_ONLY), "repeat", line, t);
        return new Statement.Repeat(line, t, n, body);
    }

    /** Compiles the condition between {@code kw} and {@code suffix} of a block header. */
    private CompiledExpression header(String t, String kw, String suffix, String message, String hint) {
        if (!t.endsWith(suffix)) throw error(message, t.length() + 1, t, hint);
        int end = t.length() - suffix.length();
        if (end <= kw.length() || t.substring(kw.length(), end).trim().isEmpty()) {
            throw error("Missing condition after '" + kw + "'", kw.length() + 2, t, hint);
        }
        return expr(t, kw.length(), end);
    }

    private void closeBlock(String stop, String kw, int openerLine, String openerText) {
        if (stop == null) {
            throw ScriptError.syntax("Missing end for block", openerLine, 1, openerText,
                    "Add a matching 'end' for this '" + kw + "'.");
        }
        current++; // the 'end'
    }

    // -------------------------
    // Helpers
    // -------------------------

    /** Compiles {@code t[from, to)} trimmed, remembering where it sits in the line. */
    private CompiledExpression expr(String t, int from, int to) {
        int start = from;
        while (start < to && Character.isWhitespace(t.charAt(start))) start++;
        int end = to;
        while (end > start && Character.isWhitespace(t.charAt(end - 1))) end--;
        try {
            return CompiledExpression.compile(t.substring(start, end), start);
        } catch (NestingLimitError e) {
            int column = start + ((e.getColumn() == null) ? 1 : e.getColumn());
            throw new ScriptError(ScriptError.syntax(e.getMessage(), headerLine, column, t,
                    "Split the expression across several let statements.").error(), e);
        }
    }

    private static String between(String t, String kw, String suffix) {
        int end = t.length() - suffix.length();
        return (end <= kw.length()) ? "" : t.substring(kw.length(), end);
    }

    private static String keyword(String t) {
        int i = 0;
        while (i < t.length() && !Character.isWhitespace(t.charAt(i))) i++;
        return t.substring(0, i);
    }

    static boolean isName(String s) {
        return NAME.matcher(s).matches() && !Lexer.isKeyword(s);
    }

    /**
     * First index of {@code needle} at or after {@code from}, outside string
     * literals and parentheses/brackets; -1 when absent.
     */
    static int indexOfTopLevel(String s, String needle, int from) {
        int depth = 0;
        char quote = 0;
        for (int i = from; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == '\\') i++;
                else if (c == quote) quote = 0;
                continue;
            }
            if (c == '"' || c == '\'') quote = c;
            else if (c == '(' || c == '[') depth++;
            else if ((c == ')' || c == ']') && depth > 0) depth--;
            else if (depth == 0 && s.startsWith(needle, i)) return i;
        }
        return -1;
    }

    /** Ranges of {@code s[from, to)} separated by top-level commas. */
    static List<int[]> splitTopLevel(String s, int from, int to) {
        List<int[]> out = new ArrayList<>();
        String slice = s.substring(0, to);
        int start = from;
        while (true) {
            int comma = indexOfTopLevel(slice, ",", start);
            if (comma < 0) {
                out.add(new int[] {start, to});
                return out;
            }
            out.add(new int[] {start, comma});
            start = comma + 1;
        }
    }

    private void requireNotReserved(String name, int column, String t) {
        if (Environment.isReserved(name)) {
            throw error("'" + name + "' is reserved", column, t, "Choose a different name.");
        }
    }

    private ScriptError stray(String kw, String t) {
        switch (kw) {
            case "end":
                return error("Unexpected 'end'", 1, t, "Remove extra 'end' or match it with if/repeat/func.");
            case "else":
                return error("'else' without matching 'if'", 1, t, "Place 'else' inside an if..end block.");
            default:
                return error("'elif' without matching 'if'", 1, t, "Place 'elif' inside an if..end block.");
        }
    }

    private int lineNo() {
        return current + 1;
    }

    private ScriptError error(String message, int column, String t, String hint) {
        return ScriptError.syntax(message, lineNo(), column, t, hint);
    }
}
