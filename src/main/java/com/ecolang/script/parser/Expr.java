package com.ecolang.script.parser;

import java.util.List;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);

        /** 1-based column of the node's first token inside the expression. */
        int column();
    }

    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitVariableExpr(Variable expr);
        R visitUnaryExpr(Unary expr);
        R visitBinaryExpr(Binary expr);
        R visitLogicalExpr(Logical expr);
        R visitCompareExpr(Compare expr);
        R visitCallExpr(Call expr);

        // Parsed only so they can be rejected with a precise message.
        R visitGetExpr(GetExpr expr);
        R visitIndexExpr(IndexExpr expr);
        R visitListExpr(ListExpr expr);
        R visitRejectedExpr(Rejected expr);
    }

    // -------------------------
    // Core expression nodes
    // -------------------------

    public static final class Literal implements ExprInterface {
        public final Value value;
        private final int column;

        public Literal(Value value, int column) {
            this.value = value;
            this.column = column;
        }

        @Override public int column() { return column; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    public static final class Variable implements ExprInterface {
        public final Token name;

        public Variable(Token name) {
            this.name = name;
        }

        @Override public int column() { return name.column; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }
    }

    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface right;

        public Unary(Token operator, ExprInterface right) {
            this.operator = operator;
            this.right = right;
        }

        @Override public int column() { return operator.column; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    /** Arithmetic: + - * / // % ** */
    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override public int column() { return left.column(); }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    public static final class Logical implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Logical(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override public int column() { return left.column(); }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLogicalExpr(this);
        }
    }

    /**
     * A comparison chain {@code a < b <= c}. Kept as a chain so the validator
     * can reject chains instead of silently re-associating them.
     */
    public static final class Compare implements ExprInterface {
        public final ExprInterface left;
        public final List<Token> operators;
        public final List<ExprInterface> comparators;

        public Compare(ExprInterface left, List<Token> operators, List<ExprInterface> comparators) {
            this.left = left;
            this.operators = operators;
            this.comparators = comparators;
        }

        @Override public int column() { return left.column(); }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCompareExpr(this);
        }
    }

    public static final class Call implements ExprInterface {
        public final ExprInterface callee;
        public final Token paren;
        public final List<ExprInterface> arguments;

        public Call(ExprInterface callee, Token paren, List<ExprInterface> arguments) {
            this.callee = callee;
            this.paren = paren;
            this.arguments = arguments;
        }

        @Override public int column() { return callee.column(); }

        /** Name of the called function when the target is a bare identifier, else null. */
        public String calleeName() {
            return (callee instanceof Variable) ? ((Variable) callee).name.lexeme : null;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }

    // -------------------------
    // Shapes the language does not allow
    // -------------------------

    /** Attribute access: obj.name */
    public static final class GetExpr implements ExprInterface {
        public final ExprInterface object;
        public final Token name;

        public GetExpr(ExprInterface object, Token name) {
            this.object = object;
            this.name = name;
        }

        @Override public int column() { return object.column(); }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitGetExpr(this);
        }
    }

    /** Subscript: target[index] */
    public static final class IndexExpr implements ExprInterface {
        public final ExprInterface target;
        public final Token bracket;
        public final ExprInterface index;

        public IndexExpr(ExprInterface target, Token bracket, ExprInterface index) {
            this.target = target;
            this.bracket = bracket;
            this.index = index;
        }

        @Override public int column() { return target.column(); }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIndexExpr(this);
        }
    }

    /** List display: [a, b, c] */
    public static final class ListExpr implements ExprInterface {
        public final Token bracket;
        public final List<ExprInterface> elements;

        public ListExpr(Token bracket, List<ExprInterface> elements) {
            this.bracket = bracket;
            this.elements = elements;
        }

        @Override public int column() { return bracket.column; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitListExpr(this);
        }
    }

    /**
     * Placeholder for a construct recognized by its leading keyword (lambda,
     * import, comprehension, conditional expression...). Its tokens are
     * skipped, never evaluated.
     */
    public static final class Rejected implements ExprInterface {
        public final Token keyword;
        /** Element name used in diagnostics, e.g. "Lambda", "ListComp", "IfExp". */
        public final String element;

        public Rejected(Token keyword, String element) {
            this.keyword = keyword;
            this.element = element;
        }

        @Override public int column() { return keyword.column; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitRejectedExpr(this);
        }
    }
}
