package com.ecolang.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.ecolang.debug.Debug;
import com.ecolang.script.parser.Statement.Assign;
import com.ecolang.script.parser.Statement.Ask;
import com.ecolang.script.parser.Statement.Branch;
import com.ecolang.script.parser.Statement.CallStmt;
import com.ecolang.script.parser.Statement.EcoTip;
import com.ecolang.script.parser.Statement.For;
import com.ecolang.script.parser.Statement.FuncStmt;
import com.ecolang.script.parser.Statement.If;
import com.ecolang.script.parser.Statement.Repeat;
import com.ecolang.script.parser.Statement.ReturnStmt;
import com.ecolang.script.parser.Statement.Say;
import com.ecolang.script.parser.Statement.SavePower;
import com.ecolang.script.parser.Statement.Stmt;
import com.ecolang.script.parser.Statement.StmtVisitor;
import com.ecolang.script.parser.Statement.Warn;
import com.ecolang.script.parser.Statement.While;
import com.ecolang.script.runtime.EcoMeter;
import com.ecolang.script.runtime.ErrorCode;
import com.ecolang.script.runtime.OpCategory;
import com.ecolang.script.runtime.ResourceGovernor;
import com.ecolang.script.runtime.RunError;
import com.ecolang.script.runtime.ScriptError;

/**
 * Executes a parsed program. Blocks run inline against the current frame;
 * only {@code call} pushes a new one. One instance per run.
 */
public class Interpreter implements StmtVisitor {
    private static final String TAG = "Interpreter";

    static final String[] ECO_TIPS = {
            "Turn off unused devices",
            "Reduce loop counts",
            "Prefer simpler math operations",
    };

    Environment env;
    private final Environment globals;
    private final Map<String, ?> inputs;
    private final ResourceGovernor governor;
    private final EcoMeter meter;
    private final Map<String, UserFunction> userFunctions = new LinkedHashMap<>();
    private final Deque<CallFrame> callStack = new ArrayDeque<CallFrame>();

    public Interpreter(ResourceGovernor governor, Map<String, ?> inputs) {
        this.governor = governor;
        this.meter = governor.meter();
        this.inputs = (inputs == null) ? Collections.<String, Object>emptyMap() : inputs;
        this.globals = new Environment(governor.settings().maxStringLength(), governor.settings().maxArrayLength());
        this.env = globals;
    }

    public void run(List<Stmt> program) {
        executeBlock(program);
    }

    void executeBlock(List<Stmt> statements) {
        for (Stmt stmt : statements) {
            execute(stmt);
        }
    }

    private void execute(Stmt stmt) {
        try {
            governor.beforeStatement();
            charge(OpCategory.OTHER);
            env.setSignal(Environment.ECO_OPS, Value.integer(meter.total()));
            stmt.accept(this);
        } catch (ScriptError e) {
            if (e.error().getLine() != null) throw e;
            throw new ScriptError(e.error().withPosition(stmt.line(), 1, stmt.text(), null), e);
        }
    }

    private String display(Value v) {
        try {
            return v.display(env.maxStringLength());
        } catch (EvalError e) {
            throw new ScriptError(RunError.of(ErrorCode.RUNTIME_ERROR, e.getMessage()), e);
        }
    }

    /** Height of the function frame stack; 0 outside any call. */
    public int callDepth() {
        return callStack.size();
    }

    /** Top-level bindings, runtime signals excluded. */
    public Map<String, Value> globals() {
        return globals.snapshot();
    }

    // -------------------------
    // Simple statements
    // -------------------------

    @Override
    public void visitSayStmt(Say stmt) {
        Value v = eval(stmt.expr, stmt.line(), stmt.text(), null);
        governor.emit(display(v));
        charge(OpCategory.PRINT);
    }

    @Override
    public void visitAssignStmt(Assign stmt) {
        if (stmt.constant) {
            if (env.contains(stmt.name)) throw ScriptError.runtime("'" + stmt.name + "' already defined");
        } else {
            requireMutable(stmt.name);
        }
        Value v = eval(stmt.expr, stmt.line(), stmt.text(), null);
        charge(OpCategory.ASSIGN);
        if (stmt.expr.hasArithmetic()) charge(OpCategory.MATH);
        if (stmt.constant) env.defineConst(stmt.name, v);
        else env.define(stmt.name, v);
    }

    @Override
    public void visitAskStmt(Ask stmt) {
        if (!inputs.containsKey(stmt.name)) {
            throw ScriptError.runtime("Missing input for '" + stmt.name + "'");
        }
        requireMutable(stmt.name);
        Value v;
        try {
            v = Value.fromJava(inputs.get(stmt.name));
        } catch (IllegalArgumentException e) {
            throw new ScriptError(RunError.of(ErrorCode.RUNTIME_ERROR,
                    "Unsupported input type for '" + stmt.name + "'"), e);
        }
        env.define(stmt.name, v);
        charge(OpCategory.IO);
    }

    @Override
    public void visitWarnStmt(Warn stmt) {
        Value v = eval(stmt.expr, stmt.line(), stmt.text(), null);
        governor.warn(display(v));
        charge(OpCategory.OTHER);
    }

    @Override
    public void visitEcoTipStmt(EcoTip stmt) {
        String tip = ECO_TIPS[(int) (meter.total() % ECO_TIPS.length)];
        governor.emit("ecoTip: " + tip);
        charge(OpCategory.OTHER);
    }

    @Override
    public void visitSavePowerStmt(SavePower stmt) {
        double scale = Math.max(0.1, 1.0 - stmt.level * 0.01);
        env.setSignal(Environment.OPS_SCALE, Value.number(scale));
        governor.warn("savePower applied: level " + Value.formatFloat(stmt.level));
    }

    // -------------------------
    // Functions
    // -------------------------

    @Override
    public void visitFuncStmt(FuncStmt stmt) {
        charge(OpCategory.OTHER);
        UserFunction existing = userFunctions.get(stmt.name);
        if (existing != null) {
            if (existing.definition == stmt) return;
            throw ScriptError.runtime("Function '" + stmt.name + "' is already defined");
        }
        userFunctions.put(stmt.name, new UserFunction(stmt));
        governor.warn("func defined: " + stmt.name);
    }

    @Override
    public void visitCallStmt(CallStmt stmt) {
        UserFunction fn = userFunctions.get(stmt.name);
        if (fn == null) throw ScriptError.runtime("Unknown function '" + stmt.name + "'");
        if (fn.arity() != stmt.args.size()) throw ScriptError.runtime("Argument count mismatch");
        if (stmt.into != null) requireMutable(stmt.into);

        List<Value> args = new ArrayList<>(stmt.args.size());
        for (CompiledExpression arg : stmt.args) {
            args.add(eval(arg, stmt.line(), stmt.text(), "Fix the call arguments."));
        }
        charge(OpCategory.FUNC_CALL);

        governor.checkCallDepth(callStack.size() + 1);
        callStack.push(new CallFrame(stmt.name, args));
        CallFrame frame = callStack.peek();
        Debug.get().t(TAG, "call " + frame.functionName + frame.arguments + " depth=" + callStack.size());
        Value result;
        try {
            result = fn.call(this, args);
        } finally {
            callStack.pop();
        }

        if (stmt.into != null) {
            env.define(stmt.into, result);
        } else if (!result.isNone()) {
            governor.emit(display(result));
        }
    }

    @Override
    public void visitReturnStmt(ReturnStmt stmt) {
        Value v = (stmt.value == null) ? Value.none() : eval(stmt.value, stmt.line(), stmt.text(), null);
        throw new ReturnSignal(v);
    }

    // -------------------------
    // Blocks
    // -------------------------

    @Override
    public void visitIfStmt(If stmt) {
        boolean first = true;
        for (Branch branch : stmt.branches) {
            String hint = first ? "Fix the condition expression after 'if'." : "Fix the elif condition.";
            first = false;
            if (eval(branch.condition, branch.line, branch.text, hint).isTruthy()) {
                executeBlock(branch.body);
                return;
            }
        }
        if (stmt.elseBranch != null) executeBlock(stmt.elseBranch);
    }

    @Override
    public void visitWhileStmt(While stmt) {
        long iterations = 0;
        while (eval(stmt.condition, stmt.line(), stmt.text(), "Fix the while condition.").isTruthy()) {
            if (stopLoop("while", iterations)) break;
            charge(OpCategory.LOOP_CHECK);
            executeBlock(stmt.body);
            iterations++;
        }
    }

    @Override
    public void visitForStmt(For stmt) {
        requireMutable(stmt.variable);
        Value startV = eval(stmt.start, stmt.line(), stmt.text(), null);
        Value endV = eval(stmt.end, stmt.line(), stmt.text(), null);
        Value stepV = (stmt.step == null) ? null : eval(stmt.step, stmt.line(), stmt.text(), null);
        if (!startV.isNumeric() || !endV.isNumeric() || (stepV != null && !stepV.isNumeric())) {
            throw ScriptError.runtime("Invalid numeric values in for");
        }
        double start = startV.asNumber();
        double end = endV.asNumber();
        double step = (stepV != null) ? stepV.asNumber() : (end >= start ? 1.0 : -1.0);
        if (step == 0.0) throw ScriptError.runtime("for step cannot be 0");

        double cur = start;
        long iterations = 0;
        while (step > 0 ? cur <= end : cur >= end) {
            if (stopLoop("for", iterations)) break;
            env.define(stmt.variable, loopValue(cur));
            charge(OpCategory.LOOP_CHECK);
            executeBlock(stmt.body);
            cur += step;
            iterations++;
        }
    }

    @Override
    public void visitRepeatStmt(Repeat stmt) {
        long maxLoop = governor.settings().maxLoop();
        long count = stmt.count;
        if (count > maxLoop) {
            governor.warn("Repeat count limited to " + maxLoop);
            count = maxLoop;
        }
        for (long i = 0; i < count; i++) {
            if (stopLoop("repeat", i)) break;
            charge(OpCategory.LOOP_CHECK);
            executeBlock(stmt.body);
        }
    }

    private boolean stopLoop(String keyword, long iterations) {
        String warning = governor.checkIteration(keyword, iterations);
        if (warning == null) return false;
        governor.warn(warning);
        return true;
    }

    private static Value loopValue(double cur) {
        long whole = (long) cur;
        if (Math.abs(cur - whole) < 1e-9) return Value.integer(whole);
        return Value.number(cur);
    }

    // -------------------------
    // Helpers
    // -------------------------

    private Value eval(CompiledExpression expr, int line, String text, String hint) {
        try {
            return expr.evaluate(env);
        } catch (EvalError e) {
            RunError error = new RunError(ErrorCode.RUNTIME_ERROR, e.getMessage(), line,
                    expr.lineColumn(e.getColumn()), text, hint);
            throw new ScriptError(error, e);
        }
    }

    private void requireMutable(String name) {
        if (env.isConst(name)) throw ScriptError.runtime("Cannot reassign const '" + name + "'");
    }

    private void charge(OpCategory category) {
        meter.charge(category, env.opsScale());
    }

    public static final class ReturnSignal extends RuntimeException {
        private static final long serialVersionUID = 1L;
        final Value value;
        ReturnSignal(Value value) { super(null, null, false, false); this.value = value; }
    }
}
