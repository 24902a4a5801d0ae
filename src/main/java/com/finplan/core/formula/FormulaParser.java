package com.finplan.core.formula;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for substituted formulas.
 *
 * <pre>
 * expr       := additive (('&lt;' | '&lt;=' | '&gt;' | '&gt;=' | '==' | '!=') additive)?
 * additive   := term (('+' | '-') term)*
 * term       := unary (('*' | '/') unary)*
 * unary      := '-' unary | '+' unary | primary
 * primary    := NUMBER | FUNC '(' expr (',' expr)* ')' | '(' expr ')'
 * </pre>
 */
final class FormulaParser {

    private final List<Token> tokens;
    private int index;

    private FormulaParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    static FormulaNode parse(String text) {
        if (text == null || text.isBlank()) {
            throw new FormulaSyntaxException("Empty expression");
        }
        var parser = new FormulaParser(new FormulaLexer(text).tokenize());
        FormulaNode node = parser.parseExpression();
        parser.expect(TokenType.EOF);
        return node;
    }

    private FormulaNode parseExpression() {
        FormulaNode left = parseAdditive();
        FormulaNode.Operator comparison = switch (peek().type()) {
            case LT -> FormulaNode.Operator.LESS;
            case LE -> FormulaNode.Operator.LESS_EQUAL;
            case GT -> FormulaNode.Operator.GREATER;
            case GE -> FormulaNode.Operator.GREATER_EQUAL;
            case EQ -> FormulaNode.Operator.EQUAL;
            case NE -> FormulaNode.Operator.NOT_EQUAL;
            default -> null;
        };
        if (comparison == null) {
            return left;
        }
        advance();
        return new FormulaNode.Binary(comparison, left, parseAdditive());
    }

    private FormulaNode parseAdditive() {
        FormulaNode node = parseTerm();
        while (peek().type() == TokenType.PLUS || peek().type() == TokenType.MINUS) {
            var op = advance().type() == TokenType.PLUS ? FormulaNode.Operator.ADD : FormulaNode.Operator.SUBTRACT;
            node = new FormulaNode.Binary(op, node, parseTerm());
        }
        return node;
    }

    private FormulaNode parseTerm() {
        FormulaNode node = parseUnary();
        while (peek().type() == TokenType.STAR || peek().type() == TokenType.SLASH) {
            var op = advance().type() == TokenType.STAR ? FormulaNode.Operator.MULTIPLY : FormulaNode.Operator.DIVIDE;
            node = new FormulaNode.Binary(op, node, parseUnary());
        }
        return node;
    }

    private FormulaNode parseUnary() {
        if (peek().type() == TokenType.MINUS) {
            advance();
            return new FormulaNode.Negate(parseUnary());
        }
        if (peek().type() == TokenType.PLUS) {
            advance();
            return parseUnary();
        }
        return parsePrimary();
    }

    private FormulaNode parsePrimary() {
        Token token = advance();
        switch (token.type()) {
            case NUMBER:
                try {
                    return new FormulaNode.Literal(Double.parseDouble(token.text()));
                } catch (NumberFormatException e) {
                    throw new FormulaSyntaxException("Invalid number '" + token.text() + "'");
                }
            case LPAREN:
                FormulaNode inner = parseExpression();
                expect(TokenType.RPAREN);
                return inner;
            case IDENT:
                return parseCall(token);
            default:
                throw new FormulaSyntaxException("Unexpected token " + token);
        }
    }

    private FormulaNode parseCall(Token name) {
        var function = FormulaNode.Function.lookup(name.text().toUpperCase());
        if (function == null) {
            throw new FormulaSyntaxException("Unknown identifier '" + name.text() + "' at position " + name.position());
        }
        expect(TokenType.LPAREN);
        var args = new ArrayList<FormulaNode>();
        if (peek().type() != TokenType.RPAREN) {
            args.add(parseExpression());
            while (peek().type() == TokenType.COMMA) {
                advance();
                args.add(parseExpression());
            }
        }
        expect(TokenType.RPAREN);
        function.checkArity(args.size());
        return new FormulaNode.Call(function, List.copyOf(args));
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token advance() {
        Token token = tokens.get(index);
        if (token.type() != TokenType.EOF) {
            index++;
        }
        return token;
    }

    private Token expect(TokenType type) {
        Token token = peek();
        if (token.type() != type) {
            throw new FormulaSyntaxException("Expected " + type + " but found " + token);
        }
        return advance();
    }
}
