package com.ecolang.script.parser;

import java.util.Collections;
import java.util.List;

public class Statement {

    public enum Kind {
        SAY, LET, CONST, ASK, WARN, ECO_TIP, SAVE_POWER,
        FUNC, CALL, RETURN,
        IF, WHILE, FOR, REPEAT
    }

    public interface Stmt {
        void accept(StmtVisitor visitor);
        Kind kind();
        /** 1-based source line. */
        int line();
        /** Trimmed source text of the statement's own line. */
        String text();
    }

    public interface StmtVisitor {
        void visitSayStmt(Say stmt);
        void visitAssignStmt(Assign stmt);
        void visitAskStmt(Ask stmt);
        void visitWarnStmt(Warn stmt);
        void visitEcoTipStmt(EcoTip stmt);
        void visitSavePowerStmt(SavePower stmt);
        void visitFuncStmt(FuncStmt stmt);
        void visitCallStmt(CallStmt stmt);
        void visitReturnStmt(ReturnStmt stmt);
        void visitIfStmt(If stmt);
        void visitWhileStmt(While stmt);
        void visitForStmt(For stmt);
        void visitRepeatStmt(Repeat stmt);
    }

    abstract static class Base implements Stmt {
        private final int line;
        private final String text;

        Base(int line, String text) {
            this.line = line;
            this.text = text;
        }

        @Override public int line() { return line; }
        @Override public String text() { return text; }

        @Override
        public String toString() {
            return kind() + "@" + line + ": " + text;
        }
    }

    public static final class Say extends Base {
        public final CompiledExpression expr;
        Say(int line, String text, CompiledExpression expr) { super(line, text); this.expr = expr; }
        public Kind kind() { return Kind.SAY; }
        public void accept(StmtVisitor visitor) { visitor.visitSayStmt(this); }
    }

    /** {@code let} and {@code const}. */
    public static final class Assign extends Base {
        public final String name;
        public final CompiledExpression expr;
        public final boolean constant;
        Assign(int line, String text, String name, CompiledExpression expr, boolean constant) {
            super(line, text);
            this.name = name;
            this.expr = expr;
            this.constant = constant;
        }
        public Kind kind() { return constant ? Kind.CONST : Kind.LET; }
        public void accept(StmtVisitor visitor) { visitor.visitAssignStmt(this); }
    }

    public static final class Ask extends Base {
        public final String name;
        Ask(int line, String text, String name) { super(line, text); this.name = name; }
        public Kind kind() { return Kind.ASK; }
        public void accept(StmtVisitor visitor) { visitor.visitAskStmt(this); }
    }

    public static final class Warn extends Base {
        public final CompiledExpression expr;
        Warn(int line, String text, CompiledExpression expr) { super(line, text); this.expr = expr; }
        public Kind kind() { return Kind.WARN; }
        public void accept(StmtVisitor visitor) { visitor.visitWarnStmt(this); }
    }

    public static final class EcoTip extends Base {
        EcoTip(int line, String text) { super(line, text); }
        public Kind kind() { return Kind.ECO_TIP; }
        public void accept(StmtVisitor visitor) { visitor.visitEcoTipStmt(this); }
    }

    public static final class SavePower extends Base {
        public final double level;
        SavePower(int line, String text, double level) { super(line, text); this.level = level; }
        public Kind kind() { return Kind.SAVE_POWER; }
        public void accept(StmtVisitor visitor) { visitor.visitSavePowerStmt(this); }
    }

    public static final class FuncStmt extends Base {
        public final String name;
        public final List<String> params;
        public final List<Stmt> body;
        FuncStmt(int line, String text, String name, List<String> params, List<Stmt> body) {
            super(line, text);
            this.name = name;
            this.params = Collections.unmodifiableList(params);
            this.body = Collections.unmodifiableList(body);
        }
        public Kind kind() { return Kind.FUNC; }
        public void accept(StmtVisitor visitor) { visitor.visitFuncStmt(this); }
    }

    public static final class CallStmt extends Base {
        public final String name;
        public final List<CompiledExpression> args;
        public final String into; // may be null
        CallStmt(int line, String text, String name, List<CompiledExpression> args, String into) {
            super(line, text);
            this.name = name;
            this.args = Collections.unmodifiableList(args);
            this.into = into;
        }
        public Kind kind() { return Kind.CALL; }
        public void accept(StmtVisitor visitor) { visitor.visitCallStmt(this); }
    }

    public static final class ReturnStmt extends Base {
        public final CompiledExpression value; // may be null
        ReturnStmt(int line, String text, CompiledExpression value) { super(line, text); this.value = value; }
        public Kind kind() { return Kind.RETURN; }
        public void accept(StmtVisitor visitor) { visitor.visitReturnStmt(this); }
    }

    /** One {@code if}/{@code elif} arm: its header line, condition and body. */
    public static final class Branch {
        public final int line;
        public final String text;
        public final CompiledExpression condition;
        public final List<Stmt> body;
        Branch(int line, String text, CompiledExpression condition, List<Stmt> body) {
            this.line = line;
            this.text = text;
            this.condition = condition;
            this.body = Collections.unmodifiableList(body);
        }
    }

    public static final class If extends Base {
        public final List<Branch> branches;
        public final List<Stmt> elseBranch; // may be null
        If(int line, String text, List<Branch> branches, List<Stmt> elseBranch) {
            super(line, text);
            this.branches = Collections.unmodifiableList(branches);
            this.elseBranch = (elseBranch == null) ? null : Collections.unmodifiableList(elseBranch);
        }
        public Kind kind() { return Kind.IF; }
        public void accept(StmtVisitor visitor) { visitor.visitIfStmt(this); }
    }

    public static final class While extends Base {
        public final CompiledExpression condition;
        public final List<Stmt> body;
        While(int line, String text, CompiledExpression condition, List<Stmt> body) {
            super(line, text);
            this.condition = condition;
            this.body = Collections.unmodifiableList(body);
        }
        public Kind kind() { return Kind.WHILE; }
        public void accept(StmtVisitor visitor) { visitor.visitWhileStmt(this); }
    }

    public static final class For extends Base {
        public final String variable;
        public final CompiledExpression start;
        public final CompiledExpression end;
        public final CompiledExpression step; // may be null
        public final List<Stmt> body;
        For(int line, String text, String variable, CompiledExpression start, CompiledExpression end,
            CompiledExpression step, List<Stmt> body) {
            super(line, text);
            this.variable = variable;
            this.start = start;
            this.end = end;
            this.step = step;
            this.body = Collections.unmodifiableList(body);
        }
        public Kind kind() { return Kind.FOR; }
        public void accept(StmtVisitor visitor) { visitor.visitForStmt(this); }
    }

    public static final class Repeat extends Base {
        public final long count;
        public final List<Stmt> body;
        Repeat(int line, String text, long count, List<Stmt> body) {
            super(line, text);
            this.count = count;
            this.body = Collections.unmodifiableList(body);
        }
        public Kind kind() { return Kind.REPEAT; }
        public void accept(StmtVisitor visitor) { visitor.visitRepeatStmt(this); }
    }
}
