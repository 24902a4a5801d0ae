package com.finplan.core.formula;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a fully substituted formula into tokens. Accepts number literals in plain, decimal and
 * exponent form, bare identifiers (function names), operators and parentheses.
 */
final class FormulaLexer {

    private final String text;
    private int pos;

    FormulaLexer(String text) {
        this.text = text;
    }

    List<Token> tokenize() {
        var tokens = new ArrayList<Token>();
        while (true) {
            skipWhitespace();
            if (pos >= text.length()) {
                tokens.add(new Token(TokenType.EOF, null, pos));
                return tokens;
            }
            char c = text.charAt(pos);
            int start = pos;
            if (Character.isDigit(c) || (c == '.' && pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1)))) {
                tokens.add(new Token(TokenType.NUMBER, readNumber(), start));
            } else if (Character.isLetter(c) || c == '_') {
                while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
                    pos++;
                }
                tokens.add(new Token(TokenType.IDENT, text.substring(start, pos), start));
            } else {
                tokens.add(readSymbol(c, start));
            }
        }
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private String readNumber() {
        int start = pos;
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
            pos++;
        }
        if (pos < text.length() && text.charAt(pos) == '.') {
            pos++;
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                pos++;
            }
        }
        if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
                pos++;
            }
            if (pos >= text.length() || !Character.isDigit(text.charAt(pos))) {
                pos = mark;
                throw new FormulaSyntaxException("Malformed exponent at position " + mark);
            }
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                pos++;
            }
        }
        return text.substring(start, pos);
    }

    private Token readSymbol(char c, int start) {
        pos++;
        return switch (c) {
            case '(' -> new Token(TokenType.LPAREN, "(", start);
            case ')' -> new Token(TokenType.RPAREN, ")", start);
            case ',' -> new Token(TokenType.COMMA, ",", start);
            case '+' -> new Token(TokenType.PLUS, "+", start);
            case '-' -> new Token(TokenType.MINUS, "-", start);
            case '*' -> new Token(TokenType.STAR, "*", start);
            case '/' -> new Token(TokenType.SLASH, "/", start);
            case '<' -> match('=') ? new Token(TokenType.LE, "<=", start) : new Token(TokenType.LT, "<", start);
            case '>' -> match('=') ? new Token(TokenType.GE, ">=", start) : new Token(TokenType.GT, ">", start);
            case '=' -> {
                if (!match('=')) {
                    throw new FormulaSyntaxException("Expected '==' at position " + start);
                }
                yield new Token(TokenType.EQ, "==", start);
            }
            case '!' -> {
                if (!match('=')) {
                    throw new FormulaSyntaxException("Expected '!=' at position " + start);
                }
                yield new Token(TokenType.NE, "!=", start);
            }
            default -> throw new FormulaSyntaxException("Unexpected character '" + c + "' at position " + start);
        };
    }

    private boolean match(char expected) {
        if (pos < text.length() && text.charAt(pos) == expected) {
            pos++;
            return true;
        }
        return false;
    }
}
