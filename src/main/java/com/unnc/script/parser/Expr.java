package com.unnc.script.parser;

import java.util.List;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitBinaryExpr(Binary expr);
        R visitComparisonExpr(Comparison expr);
        R visitUnaryExpr(Unary expr);
        R visitLogicalExpr(Logical expr);
        R visitLiteralExpr(Literal expr);
        R visitListLiteralExpr(ListLiteral expr);
        R visitVariableExpr(Variable expr);
        R visitCallExpr(Call expr);
    }

    // -------------------------
    // Operators
    // -------------------------

    /** Arithmetic: + - * / % */
    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    /**
     * A comparison chain {@code a < b <= c}: true when every adjacent pair holds. Each operand is
     * evaluated at most once.
     */
    public static final class Comparison implements ExprInterface {
        public final List<ExprInterface> operands;
        public final List<Token> operators; // operators.size() == operands.size() - 1

        public Comparison(List<ExprInterface> operands, List<Token> operators) {
            this.operands = operands;
            this.operators = operators;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitComparisonExpr(this);
        }
    }

    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface right;

        public Unary(Token operator, ExprInterface right) {
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
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

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLogicalExpr(this);
        }
    }

    // -------------------------
    // Primaries
    // -------------------------

    public static final class Literal implements ExprInterface {
        public final Value value;

        public Literal(Value value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    /** {@code [a, b, c]}, front-to-back. */
    public static final class ListLiteral implements ExprInterface {
        public final List<ExprInterface> items;

        public ListLiteral(List<ExprInterface> items) {
            this.items = items;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitListLiteralExpr(this);
        }
    }

    public static final class Variable implements ExprInterface {
        public final Token name;

        public Variable(Token name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }
    }

    /** Calls are by name only; the language has no first-class functions. */
    public static final class Call implements ExprInterface {
        public final Token callee;
        public final List<ExprInterface> arguments;

        public Call(Token callee, List<ExprInterface> arguments) {
            this.callee = callee;
            this.arguments = arguments;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }
}
