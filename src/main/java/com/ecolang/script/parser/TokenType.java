package com.ecolang.script.parser;

public enum TokenType {
    // Punctuation
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACKET, RIGHT_BRACKET, COMMA, DOT, COLON,

    // Operators
    PLUS, MINUS, STAR, DOUBLE_STAR, SLASH, DOUBLE_SLASH, PERCENT,
    EQUAL, EQUAL_EQUAL, BANG_EQUAL,
    LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,

    // Literals
    IDENTIFIER, INT, FLOAT, STRING,

    // Keywords
    AND, OR, NOT, TRUE, FALSE,

    // Keywords that only exist so the validator can name and reject them
    LAMBDA, IF, ELSE, FOR, IN, IS, YIELD, AWAIT,
    IMPORT, FROM, DEF, CLASS, GLOBAL, NONLOCAL,

    EOF
}
