package com.ecolang.script.parser;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.ecolang.script.parser.Expr.Binary;
import com.ecolang.script.parser.Expr.Call;
import com.ecolang.script.parser.Expr.Compare;
import com.ecolang.script.parser.Expr.ExprInterface;
import com.ecolang.script.parser.Expr.GetExpr;
import com.ecolang.script.parser.Expr.IndexExpr;
import com.ecolang.script.parser.Expr.ListExpr;
import com.ecolang.script.parser.Expr.Literal;
import com.ecolang.script.parser.Expr.Logical;
import com.ecolang.script.parser.Expr.Rejected;
import com.ecolang.script.parser.Expr.Unary;
import com.ecolang.script.parser.Expr.Variable;

/**
 * Precedence-climbing parser for one expression.
 *
 * <pre>
 * expression := or ( "if" ... )?            conditional form is parsed as Rejected
 * or         := and ( "or" and )*
 * and        := not ( "and" not )*
 * not        := "not" not | comparison
 * comparison := sum ( ("=="|"!="|"&lt;"|"&lt;="|"&gt;"|"&gt;=") sum )*
 * sum        := term ( ("+"|"-") term )*
 * term       := unary ( ("*"|"/"|"//"|"%") unary )*
 * unary      := ("+"|"-") unary | power
 * power      := postfix ( "**" unary )?
 * postfix    := primary ( "(" args ")" | "." IDENT | "[" expression "]" )*
 * </pre>
 *
 * Both the parse recursion and the height of the resulting tree are capped,
 * since validation and evaluation walk the tree recursively.
 */
public class ExprParser {
    private static final String SYNTAX = "Syntax error in expression";

    /** Deepest allowed nesting of brackets, unary operators and exponents. */
    public static final int MAX_NESTING = 100;
    /** Tallest allowed tree, which also bounds operator chains like 1+1+...+1. */
    public static final int MAX_HEIGHT = 500;

    private final List<Token> tokens;
    private final Map<ExprInterface, Integer> heights = new IdentityHashMap<>();
    private int current = 0;
    private int nesting = 0;

    public ExprParser(List<Token> tokens) { this.tokens = tokens; }

    public static ExprInterface parse(String source) {
        return new ExprParser(new Lexer(source).tokenize()).parseExpression();
    }

    public ExprInterface parseExpression() {
        if (isAtEnd()) throw error(peek(), SYNTAX);
        ExprInterface expr = expression();
        if (!isAtEnd()) throw error(peek(), SYNTAX);
        return expr;
    }

    private ExprInterface expression() {
        descend();
        try {
            return conditional();
        } finally {
            nesting--;
        }
    }

    private ExprInterface conditional() {
        ExprInterface expr = or();
        if (check(TokenType.IF)) {
            Token keyword = advance();
            skipGroup();
            return new Rejected(keyword, "IfExp");
        }
        return expr;
    }

    private ExprInterface or() {
        ExprInterface expr = and();
        while (match(TokenType.OR)) {
            Token operator = previous();
            ExprInterface right = and();
            expr = node(new Logical(expr, operator, right), operator, expr, right);
        }
        return expr;
    }

    private ExprInterface and() {
        ExprInterface expr = not();
        while (match(TokenType.AND)) {
            Token operator = previous();
            ExprInterface right = not();
            expr = node(new Logical(expr, operator, right), operator, expr, right);
        }
        return expr;
    }

    private ExprInterface not() {
        if (match(TokenType.NOT)) {
            Token operator = previous();
            ExprInterface right = nested(TokenType.NOT);
            return node(new Unary(operator, right), operator, right);
        }
        return comparison();
    }

    private ExprInterface comparison() {
        ExprInterface left = sum();
        List<Token> operators = new ArrayList<>();
        List<ExprInterface> comparators = new ArrayList<>();
        while (true) {
            if (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL,
                    TokenType.LESS, TokenType.LESS_EQUAL,
                    TokenType.GREATER, TokenType.GREATER_EQUAL)) {
                operators.add(previous());
                comparators.add(sum());
                continue;
            }
            if (check(TokenType.IN) || check(TokenType.IS)
                    || (check(TokenType.NOT) && checkNext(TokenType.IN))) {
                throw error(peek(), "Unsupported comparison: " + peek().lexeme);
            }
            break;
        }
        if (operators.isEmpty()) return left;
        List<ExprInterface> children = new ArrayList<>(comparators);
        children.add(left);
        return node(new Compare(left, operators, comparators), operators.get(0), children);
    }

    private ExprInterface sum() {
        ExprInterface expr = term();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token operator = previous();
            ExprInterface right = term();
            expr = node(new Binary(expr, operator, right), operator, expr, right);
        }
        return expr;
    }

    private ExprInterface term() {
        ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.DOUBLE_SLASH, TokenType.PERCENT)) {
            Token operator = previous();
            ExprInterface right = unary();
            expr = node(new Binary(expr, operator, right), operator, expr, right);
        }
        return expr;
    }

    private ExprInterface unary() {
        if (match(TokenType.PLUS, TokenType.MINUS)) {
            Token operator = previous();
            ExprInterface right = nested(TokenType.PLUS);
            return node(new Unary(operator, right), operator, right);
        }
        return power();
    }

    private ExprInterface power() {
        ExprInterface base = postfix();
        if (match(TokenType.DOUBLE_STAR)) {
            Token operator = previous();
            // right-associative, and binds tighter than a unary minus on its left
            ExprInterface exponent = nested(TokenType.PLUS);
            return node(new Binary(base, operator, exponent), operator, base, exponent);
        }
        return base;
    }

    private ExprInterface postfix() {
        ExprInterface expr = primary();
        while (true) {
            if (match(TokenType.LEFT_PAREN)) {
                Token paren = previous();
                ExprInterface callee = expr;
                expr = finishCall(callee, paren);
                if (expr instanceof Call) {
                    List<ExprInterface> children = new ArrayList<>(((Call) expr).arguments);
                    children.add(callee);
                    expr = node(expr, paren, children);
                }
            } else if (match(TokenType.DOT)) {
                Token name = consume(TokenType.IDENTIFIER, SYNTAX);
                expr = node(new GetExpr(expr, name), name, expr);
            } else if (match(TokenType.LEFT_BRACKET)) {
                Token bracket = previous();
                ExprInterface index = expression();
                consume(TokenType.RIGHT_BRACKET, SYNTAX);
                expr = node(new IndexExpr(expr, bracket, index), bracket, expr, index);
            } else {
                break;
            }
        }
        return expr;
    }

    private ExprInterface finishCall(ExprInterface callee, Token paren) {
        List<ExprInterface> args = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (check(TokenType.RIGHT_PAREN)) break; // trailing comma
                ExprInterface arg = expression();
                if (check(TokenType.FOR)) {
                    return comprehension(TokenType.RIGHT_PAREN, "GeneratorExp");
                }
                args.add(arg);
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, SYNTAX);
        return new Call(callee, paren, args);
    }

    private ExprInterface primary() {
        Token token = peek();
        switch (token.type) {
            case INT:
                advance();
                return new Literal(Value.integer((Long) token.literal), token.column);
            case FLOAT:
                advance();
                return new Literal(Value.number((Double) token.literal), token.column);
            case STRING:
                advance();
                return new Literal(Value.string((String) token.literal), token.column);
            case TRUE:
                advance();
                return new Literal(Value.bool(true), token.column);
            case FALSE:
                advance();
                return new Literal(Value.bool(false), token.column);
            case IDENTIFIER:
                advance();
                return new Variable(token);
            case LEFT_PAREN:
                return grouping();
            case LEFT_BRACKET:
                return listDisplay();
            case LAMBDA:
                return lambda();
            case YIELD:        return rejectRest("Yield");
            case AWAIT:        return rejectRest("Await");
            case IMPORT:       return rejectRest("Import");
            case FROM:         return rejectRest("ImportFrom");
            case DEF:          return rejectRest("FunctionDef");
            case CLASS:        return rejectRest("ClassDef");
            case GLOBAL:       return rejectRest("Global");
            case NONLOCAL:     return rejectRest("Nonlocal");
            default:
                throw error(token, SYNTAX);
        }
    }

    private ExprInterface grouping() {
        Token paren = advance();
        if (check(TokenType.RIGHT_PAREN)) throw error(peek(), SYNTAX);
        ExprInterface inner = expression();
        if (check(TokenType.FOR)) {
            return comprehension(TokenType.RIGHT_PAREN, "GeneratorExp");
        }
        if (check(TokenType.COMMA)) {
            skipGroup();
            consume(TokenType.RIGHT_PAREN, SYNTAX);
            return new Rejected(paren, "Tuple");
        }
        consume(TokenType.RIGHT_PAREN, SYNTAX);
        return inner;
    }

    private ExprInterface listDisplay() {
        Token bracket = advance();
        List<ExprInterface> elements = new ArrayList<>();
        if (!check(TokenType.RIGHT_BRACKET)) {
            do {
                if (check(TokenType.RIGHT_BRACKET)) break;
                ExprInterface element = expression();
                if (check(TokenType.FOR)) {
                    return comprehension(TokenType.RIGHT_BRACKET, "ListComp");
                }
                elements.add(element);
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_BRACKET, SYNTAX);
        return node(new ListExpr(bracket, elements), bracket, elements);
    }

    /** Positioned on 'for'; skips through the closing delimiter. */
    private ExprInterface comprehension(TokenType closer, String element) {
        Token keyword = advance();
        int depth = 0;
        while (!isAtEnd() && !(depth == 0 && check(closer))) {
            TokenType type = advance().type;
            if (type == TokenType.LEFT_PAREN || type == TokenType.LEFT_BRACKET) depth++;
            else if (type == TokenType.RIGHT_PAREN || type == TokenType.RIGHT_BRACKET) depth--;
        }
        consume(closer, SYNTAX);
        return new Rejected(keyword, element);
    }

    private ExprInterface lambda() {
        Token keyword = advance();
        while (!isAtEnd() && !check(TokenType.COLON)) advance();
        consume(TokenType.COLON, SYNTAX);
        skipGroup();
        return new Rejected(keyword, "Lambda");
    }

    private ExprInterface rejectRest(String element) {
        Token keyword = advance();
        skipGroup();
        return new Rejected(keyword, element);
    }

    /**
     * Skips tokens up to (not including) the next ')' ']' ',' or end of input
     * at the current nesting level.
     */
    private void skipGroup() {
        int depth = 0;
        while (!isAtEnd()) {
            TokenType type = peek().type;
            if (type == TokenType.LEFT_PAREN || type == TokenType.LEFT_BRACKET) {
                depth++;
            } else if (type == TokenType.RIGHT_PAREN || type == TokenType.RIGHT_BRACKET) {
                if (depth == 0) return;
                depth--;
            } else if (type == TokenType.COMMA && depth == 0) {
                return;
            }
            advance();
        }
    }

    // -------------------------
    // Nesting limits
    // -------------------------

    /** Recurses into a unary operand (NOT for 'not', PLUS for sign and exponent). */
    private ExprInterface nested(TokenType kind) {
        descend();
        try {
            return (kind == TokenType.NOT) ? not() : unary();
        } finally {
            nesting--;
        }
    }

    private void descend() {
        if (++nesting > MAX_NESTING) {
            nesting--;
            throw new NestingLimitError("Expression is nested too deeply", peek().column);
        }
    }

    private ExprInterface node(ExprInterface parent, Token at, ExprInterface... children) {
        int tallest = 0;
        for (ExprInterface child : children) tallest = Math.max(tallest, height(child));
        return record(parent, at, tallest);
    }

    private ExprInterface node(ExprInterface parent, Token at, List<ExprInterface> children) {
        int tallest = 0;
        for (ExprInterface child : children) tallest = Math.max(tallest, height(child));
        return record(parent, at, tallest);
    }

    private ExprInterface record(ExprInterface parent, Token at, int tallestChild) {
        int h = tallestChild + 1;
        if (h > MAX_HEIGHT) throw new NestingLimitError("Expression is too long or nested too deeply", at.column);
        heights.put(parent, h);
        return parent;
    }

    private int height(ExprInterface e) {
        Integer h = heights.get(e);
        return (h == null) ? 1 : h;
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return type == TokenType.EOF;
        return peek().type == type;
    }

    private boolean checkNext(TokenType type) {
        if (current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private EvalError error(Token token, String message) {
        return new EvalError(message, token.column);
    }
}
