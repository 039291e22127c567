package com.unnc.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.unnc.script.parser.Expr.Binary;
import com.unnc.script.parser.Expr.Call;
import com.unnc.script.parser.Expr.Comparison;
import com.unnc.script.parser.Expr.ExprInterface;
import com.unnc.script.parser.Expr.ListLiteral;
import com.unnc.script.parser.Expr.Literal;
import com.unnc.script.parser.Expr.Logical;
import com.unnc.script.parser.Expr.Unary;
import com.unnc.script.parser.Expr.Variable;

/**
 * Recursive-descent parser for normalized fallback expressions.
 *
 * Precedence, lowest first: || , && , ! , comparisons (chainable), + - , * / % , unary - ,
 * primary.
 */
public class Parser {
    private final List<Token> tokens;
    private int current = 0;

    public Parser(List<Token> tokens) { this.tokens = tokens; }

    /** Parses exactly one expression; trailing tokens are an error. */
    public ExprInterface parse() {
        if (isAtEnd()) throw error(peek(), "Expect expression.");
        ExprInterface expr = expression();
        if (!isAtEnd()) throw error(peek(), "Unexpected " + peek().lexeme + " after expression.");
        return expr;
    }

    private ExprInterface expression() { return or(); }

    private ExprInterface or() {
        ExprInterface expr = and();
        while (match(TokenType.OR_OR)) {
            Token op = previous();
            ExprInterface right = and();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private ExprInterface and() {
        ExprInterface expr = not();
        while (match(TokenType.AND_AND)) {
            Token op = previous();
            ExprInterface right = not();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private ExprInterface not() {
        if (match(TokenType.BANG)) {
            Token op = previous();
            ExprInterface right = not();
            return new Unary(op, right);
        }
        return comparison();
    }

    private ExprInterface comparison() {
        ExprInterface first = term();
        if (!checkComparison()) return first;

        List<ExprInterface> operands = new ArrayList<>();
        List<Token> operators = new ArrayList<>();
        operands.add(first);
        while (checkComparison()) {
            operators.add(advance());
            operands.add(term());
        }
        return new Comparison(operands, operators);
    }

    private boolean checkComparison() {
        return check(TokenType.LESS) || check(TokenType.LESS_EQUAL)
                || check(TokenType.GREATER) || check(TokenType.GREATER_EQUAL)
                || check(TokenType.EQUAL_EQUAL) || check(TokenType.BANG_EQUAL);
    }

    private ExprInterface term() {
        ExprInterface expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            ExprInterface right = factor();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface factor() {
        ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Token op = previous();
            ExprInterface right = unary();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface unary() {
        if (match(TokenType.MINUS, TokenType.PLUS)) {
            Token op = previous();
            ExprInterface right = unary();
            return new Unary(op, right);
        }
        return call();
    }

    private ExprInterface call() {
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.LEFT_PAREN)) {
            Token name = advance();
            advance(); // (
            List<ExprInterface> arguments = new ArrayList<>();
            if (!check(TokenType.RIGHT_PAREN)) {
                do {
                    arguments.add(expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments.");
            return new Call(name, arguments);
        }
        return primary();
    }

    private ExprInterface primary() {
        if (match(TokenType.FALSE)) return new Literal(Value.bool(false));
        if (match(TokenType.TRUE)) return new Literal(Value.bool(true));
        if (match(TokenType.NIL)) {
            // Nil() is the builtin call spelling of the same value
            if (match(TokenType.LEFT_PAREN)) consume(TokenType.RIGHT_PAREN, "Nil() takes no arguments.");
            return new Literal(Value.emptyList());
        }
        if (match(TokenType.LEAF)) return new Literal(Value.leaf());
        if (match(TokenType.INTEGER)) return new Literal(Value.integer((Long) previous().literal));
        if (match(TokenType.FLOAT)) return new Literal(Value.floating((Double) previous().literal));
        if (match(TokenType.STRING)) return new Literal(Value.string((String) previous().literal));
        if (match(TokenType.IDENTIFIER)) return new Variable(previous());

        if (match(TokenType.LEFT_PAREN)) {
            ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            return expr;
        }

        if (match(TokenType.LEFT_BRACKET)) {
            List<ExprInterface> items = new ArrayList<>();
            if (!check(TokenType.RIGHT_BRACKET)) {
                do {
                    items.add(expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_BRACKET, "Expect ']' after list literal.");
            return new ListLiteral(items);
        }

        throw error(peek(), "Expect expression.");
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
        if (isAtEnd()) return false;
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

    private RuntimeException error(Token token, String message) {
        return new RuntimeException("[col " + (token.position + 1) + "] " + message);
    }
}
