package com.ecolang.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class Lexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("and", TokenType.AND);
        map.put("or", TokenType.OR);
        map.put("not", TokenType.NOT);
        map.put("true", TokenType.TRUE);
        map.put("false", TokenType.FALSE);
        map.put("lambda", TokenType.LAMBDA);
        map.put("if", TokenType.IF);
        map.put("else", TokenType.ELSE);
        map.put("for", TokenType.FOR);
        map.put("in", TokenType.IN);
        map.put("is", TokenType.IS);
        map.put("yield", TokenType.YIELD);
        map.put("await", TokenType.AWAIT);
        map.put("import", TokenType.IMPORT);
        map.put("from", TokenType.FROM);
        map.put("def", TokenType.DEF);
        map.put("class", TokenType.CLASS);
        map.put("global", TokenType.GLOBAL);
        map.put("nonlocal", TokenType.NONLOCAL);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String source) {
        this.source = source;
    }

    /** True for words the expression grammar reserves; they cannot name variables. */
    public static boolean isKeyword(String word) {
        return keywords.containsKey(word);
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, current + 1));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '*': addToken(match('*') ? TokenType.DOUBLE_STAR : TokenType.STAR); break;
            case '/': addToken(match('/') ? TokenType.DOUBLE_SLASH : TokenType.SLASH); break;
            case '=': addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL); break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case '!':
                if (match('=')) addToken(TokenType.BANG_EQUAL);
                else throw error("Syntax error in expression");
                break;
            case '.':
                if (isDigit(peek())) number();
                else addToken(TokenType.DOT);
                break;
            case ' ': case '\r': case '\t':
                break;
            case '"':
            case '\'':
                string(c);
                break;
            default:
                if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                else throw error("Syntax error in expression");
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        addToken(type);
    }

    private void number() {
        boolean isFloat = source.charAt(start) == '.';
        while (isDigit(peek())) advance();
        if (!isFloat && peek() == '.') {
            isFloat = true;
            advance();
            while (isDigit(peek())) advance();
        }
        if (peek() == 'e' || peek() == 'E') {
            int mark = current;
            advance();
            if (peek() == '+' || peek() == '-') advance();
            if (!isDigit(peek())) {
                current = mark;
                throw error("Syntax error in expression");
            }
            while (isDigit(peek())) advance();
            isFloat = true;
        }
        if (isAlpha(peek())) throw error("Syntax error in expression");

        String text = source.substring(start, current);
        if (isFloat) {
            addToken(TokenType.FLOAT, Double.parseDouble(text));
            return;
        }
        try {
            addToken(TokenType.INT, Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw new EvalError("Integer literal too large", start + 1, e);
        }
    }

    private void string(char quote) {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (isAtEnd()) break;
            char esc = advance();
            switch (esc) {
                case 'n': sb.append('\n'); break;
                case 't': sb.append('\t'); break;
                case 'r': sb.append('\r'); break;
                case '\\': sb.append('\\'); break;
                case '"': sb.append('"'); break;
                case '\'': sb.append('\''); break;
                default:
                    // unknown escapes are kept verbatim
                    sb.append('\\').append(esc);
            }
        }
        if (isAtEnd()) throw error("Unterminated string");
        advance();
        addToken(TokenType.STRING, sb.toString());
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, start + 1));
    }

    private EvalError error(String msg) {
        return new EvalError(msg, start + 1);
    }
}
