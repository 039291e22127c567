package com.unnc.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.unnc.script.UnncScript.BuiltinFunction;
import com.unnc.script.data.PersistentList;
import com.unnc.script.error.ArityException;
import com.unnc.script.error.EvaluationException;
import com.unnc.script.error.NameResolutionException;
import com.unnc.script.error.StructuralTypeException;
import com.unnc.script.parser.Expr.Binary;
import com.unnc.script.parser.Expr.Call;
import com.unnc.script.parser.Expr.Comparison;
import com.unnc.script.parser.Expr.ExprInterface;
import com.unnc.script.parser.Expr.ExprVisitor;
import com.unnc.script.parser.Expr.ListLiteral;
import com.unnc.script.parser.Expr.Literal;
import com.unnc.script.parser.Expr.Logical;
import com.unnc.script.parser.Expr.Unary;
import com.unnc.script.parser.Expr.Variable;

/**
 * Resolves a {@link Resolvable} against the interpreter's current scope, in this order:
 *
 * <ol>
 *   <li>whole-text call: builtin first, then algorithm</li>
 *   <li>literal</li>
 *   <li>identifier bound in the current scope chain</li>
 *   <li>identifier bound as a global</li>
 *   <li>operator expression over the normalized text</li>
 * </ol>
 *
 * Failures on the last path surface as {@link EvaluationException}; arity and structural errors
 * raised underneath pass through unwrapped.
 */
public class ExpressionEvaluator implements ExprVisitor<Value> {

    private final Interpreter interpreter;

    ExpressionEvaluator(Interpreter interpreter) {
        this.interpreter = interpreter;
    }

    public Value evaluate(Resolvable expr) {
        if (expr instanceof Resolvable.Call) {
            Resolvable.Call call = (Resolvable.Call) expr;
            List<Value> args = new ArrayList<>(call.arguments.size());
            for (Resolvable a : call.arguments) args.add(evaluate(a));
            return invoke(call.name, args);
        }
        if (expr instanceof Resolvable.Literal) {
            return ((Resolvable.Literal) expr).value;
        }
        if (expr instanceof Resolvable.Name) {
            Resolvable.Name name = (Resolvable.Name) expr;
            Value v = interpreter.arena.lookup(interpreter.scope, name.name);
            if (v != null) return v;
            v = interpreter.environment.getGlobal(name.name);
            if (v != null) return v;
            return fallback(name.fallback);
        }
        return fallback((Resolvable.Fallback) expr);
    }

    private Value fallback(Resolvable.Fallback expr) {
        try {
            if (!expr.isValid()) throw expr.syntaxError;
            return expr.tree.accept(this);
        } catch (ArityException | StructuralTypeException | EvaluationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EvaluationException(expr.text, expr.normalized, e);
        }
    }

    /** Call step: builtins shadow algorithms of the same name. */
    Value invoke(String name, List<Value> args) {
        BuiltinFunction fn = interpreter.environment.builtin(name);
        if (fn != null) return fn.call(args);
        if (interpreter.environment.hasAlgorithm(name)) {
            return interpreter.invoke(name, args, interpreter.scope);
        }
        if (interpreter.environment.constant(name) != null) {
            throw new NameResolutionException(name, name + " is a value and cannot be called");
        }
        throw NameResolutionException.unknownFunction(name);
    }

    // ===================== OPERATOR EXPRESSIONS =====================

    @Override
    public Value visitLiteralExpr(Literal expr) {
        return expr.value;
    }

    @Override
    public Value visitListLiteralExpr(ListLiteral expr) {
        List<Value> items = new ArrayList<>(expr.items.size());
        for (ExprInterface item : expr.items) items.add(item.accept(this));
        return Value.list(PersistentList.of(items));
    }

    @Override
    public Value visitVariableExpr(Variable expr) {
        String name = expr.name.lexeme;
        Value v = interpreter.arena.lookup(interpreter.scope, name);
        if (v != null) return v;
        v = interpreter.environment.getGlobal(name);
        if (v != null) return v;
        v = interpreter.environment.constant(name);
        if (v != null) return v;
        if (interpreter.environment.builtin(name) != null || interpreter.environment.hasAlgorithm(name)) {
            throw new NameResolutionException(name, name + " is a function; call it as " + name + "(...)");
        }
        throw NameResolutionException.unknownVariable(name);
    }

    @Override
    public Value visitCallExpr(Call expr) {
        List<Value> args = new ArrayList<>(expr.arguments.size());
        for (ExprInterface a : expr.arguments) args.add(a.accept(this));
        return invoke(expr.callee.lexeme, args);
    }

    @Override
    public Value visitUnaryExpr(Unary expr) {
        Value right = expr.right.accept(this);
        switch (expr.operator.type) {
            case BANG:
                return Value.bool(!right.isTruthy());
            case MINUS:
                requireNumber(expr.operator, right);
                if (right.type == Value.Type.FLOAT) return Value.floating(-right.asDouble());
                return Value.integer(Math.negateExact(integral(right)));
            case PLUS:
                requireNumber(expr.operator, right);
                return right.type == Value.Type.BOOL ? Value.integer(integral(right)) : right;
            default:
                throw new RuntimeException("Unknown unary operator " + expr.operator.lexeme);
        }
    }

    @Override
    public Value visitLogicalExpr(Logical expr) {
        Value left = expr.left.accept(this);
        if (expr.operator.type == TokenType.OR_OR) {
            return left.isTruthy() ? left : expr.right.accept(this);
        }
        return left.isTruthy() ? expr.right.accept(this) : left;
    }

    @Override
    public Value visitComparisonExpr(Comparison expr) {
        Value left = expr.operands.get(0).accept(this);
        for (int i = 0; i < expr.operators.size(); i++) {
            Value right = expr.operands.get(i + 1).accept(this);
            if (!compare(expr.operators.get(i), left, right)) return Value.bool(false);
            left = right;
        }
        return Value.bool(true);
    }

    @Override
    public Value visitBinaryExpr(Binary expr) {
        Value left = expr.left.accept(this);
        Value right = expr.right.accept(this);
        Token op = expr.operator;

        if (op.type == TokenType.PLUS && (left.type == Value.Type.STRING || right.type == Value.Type.STRING)) {
            return Value.string(text(left) + text(right));
        }
        requireNumber(op, left);
        requireNumber(op, right);
        boolean integral = left.type != Value.Type.FLOAT && right.type != Value.Type.FLOAT;

        switch (op.type) {
            case PLUS:
                return integral ? Value.integer(Math.addExact(integral(left), integral(right)))
                        : Value.floating(left.asDouble() + right.asDouble());
            case MINUS:
                return integral ? Value.integer(Math.subtractExact(integral(left), integral(right)))
                        : Value.floating(left.asDouble() - right.asDouble());
            case STAR:
                return integral ? Value.integer(Math.multiplyExact(integral(left), integral(right)))
                        : Value.floating(left.asDouble() * right.asDouble());
            case SLASH:
                if (right.asDouble() == 0.0) throw new ArithmeticException("division by zero");
                return Value.floating(left.asDouble() / right.asDouble());
            case PERCENT:
                if (right.asDouble() == 0.0) throw new ArithmeticException("modulo by zero");
                if (integral) return Value.integer(Math.floorMod(integral(left), integral(right)));
                double a = left.asDouble();
                double b = right.asDouble();
                return Value.floating(a - b * Math.floor(a / b));
            default:
                throw new RuntimeException("Unknown operator " + op.lexeme);
        }
    }

    private static boolean compare(Token op, Value a, Value b) {
        switch (op.type) {
            case EQUAL_EQUAL: return a.equals(b);
            case BANG_EQUAL: return !a.equals(b);
            default:
                break;
        }
        int c;
        if (isNumeric(a) && isNumeric(b)) {
            c = (a.type == Value.Type.INT && b.type == Value.Type.INT)
                    ? Long.compare(a.asInt(), b.asInt())
                    : Double.compare(a.asDouble(), b.asDouble());
        } else if (a.type == Value.Type.STRING && b.type == Value.Type.STRING) {
            c = a.asString().compareTo(b.asString());
        } else {
            throw new RuntimeException("'" + op.lexeme + "' not supported between " + a.describe() + " and " + b.describe());
        }
        switch (op.type) {
            case LESS: return c < 0;
            case LESS_EQUAL: return c <= 0;
            case GREATER: return c > 0;
            case GREATER_EQUAL: return c >= 0;
            default: throw new RuntimeException("Unknown comparison " + op.lexeme);
        }
    }

    private static boolean isNumeric(Value v) {
        return v.type == Value.Type.INT || v.type == Value.Type.FLOAT || v.type == Value.Type.BOOL;
    }

    private static void requireNumber(Token op, Value v) {
        if (!isNumeric(v)) {
            throw new RuntimeException("Unsupported operand for '" + op.lexeme + "': " + v.describe());
        }
    }

    private static String text(Value v) {
        return v.type == Value.Type.STRING ? v.asString() : v.toString();
    }

    private static long integral(Value v) {
        return v.type == Value.Type.BOOL ? (v.asBool() ? 1 : 0) : v.asInt();
    }
}
