package com.finplan.core.formula;

enum TokenType {
    NUMBER, IDENT,
    LPAREN, RPAREN, COMMA,
    PLUS, MINUS, STAR, SLASH,
    LT, LE, GT, GE, EQ, NE,
    EOF
}
