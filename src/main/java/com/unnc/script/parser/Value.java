package com.unnc.script.parser;

import java.util.Objects;

import com.unnc.script.data.PersistentList;
import com.unnc.script.data.PersistentTree;
import com.unnc.script.error.StructuralTypeException;

public class Value {
    public enum Type { INT, FLOAT, BOOL, STRING, LIST, TREE, NONE }

    private static final Value NONE = new Value(Type.NONE, null);
    private static final Value EMPTY_LIST = new Value(Type.LIST, PersistentList.<Value>empty());
    private static final Value LEAF = new Value(Type.TREE, PersistentTree.<Value>leaf());
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value integer(long n) { return new Value(Type.INT, n); }
    public static Value floating(double d) { return new Value(Type.FLOAT, d); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value string(String s) { return new Value(Type.STRING, Objects.requireNonNull(s)); }
    public static Value none() { return NONE; }
    public static Value emptyList() { return EMPTY_LIST; }
    public static Value leaf() { return LEAF; }

    public static Value list(PersistentList<Value> l) {
        return l.isEmpty() ? EMPTY_LIST : new Value(Type.LIST, l);
    }

    public static Value tree(PersistentTree<Value> t) {
        return t.isLeaf() ? LEAF : new Value(Type.TREE, t);
    }


    public boolean isNone() { return type == Type.NONE; }
    public boolean isNumber() { return type == Type.INT || type == Type.FLOAT; }
    public boolean isList() { return type == Type.LIST; }
    public boolean isTree() { return type == Type.TREE; }
    public boolean isEmptyList() { return type == Type.LIST && asList().isEmpty(); }
    public boolean isLeaf() { return type == Type.TREE && asTree().isLeaf(); }

    public long asInt() {
        if (type != Type.INT) throw new RuntimeException("Expected integer, got " + type);
        return (long) value;
    }

    /** Numeric view of INT, FLOAT or BOOL. */
    public double asDouble() {
        switch (type) {
            case INT: return (long) value;
            case FLOAT: return (double) value;
            case BOOL: return asBool() ? 1 : 0;
            default: throw new RuntimeException("Expected number, got " + type);
        }
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new RuntimeException("Expected bool, got " + type);
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new RuntimeException("Expected string, got " + type);
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    public PersistentList<Value> asList() {
        if (type != Type.LIST) throw new StructuralTypeException("Expected a list, got " + describe());
        return (PersistentList<Value>) value;
    }

    @SuppressWarnings("unchecked")
    public PersistentTree<Value> asTree() {
        if (type != Type.TREE) throw new StructuralTypeException("Expected a tree, got " + describe());
        return (PersistentTree<Value>) value;
    }

    /**
     * Condition semantics: BOOL as is, numbers when non-zero, strings when non-empty, NONE is false,
     * lists and trees (empty ones included) are true.
     */
    public boolean isTruthy() {
        switch (type) {
            case BOOL: return asBool();
            case INT: return asInt() != 0;
            case FLOAT: return asDouble() != 0.0;
            case STRING: return !asString().isEmpty();
            case NONE: return false;
            default: return true;
        }
    }

    /** Type name plus value, for error messages. */
    public String describe() {
        if (type == Type.LIST && ((PersistentList<?>) value).isEmpty()) return "empty list";
        if (type == Type.TREE && ((PersistentTree<?>) value).isLeaf()) return "leaf";
        return type.name().toLowerCase() + " " + this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (isNumericLike() && other.isNumericLike()) {
            if (type == Type.INT && other.type == Type.INT) return asInt() == other.asInt();
            return asDouble() == other.asDouble();
        }
        return type == other.type && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        if (isNumericLike()) return Double.hashCode(asDouble());
        return Objects.hash(type, value);
    }

    private boolean isNumericLike() {
        return type == Type.INT || type == Type.FLOAT || type == Type.BOOL;
    }

    @Override
    public String toString() {
        switch (type) {
            case INT:
                return Long.toString(asInt());
            case FLOAT:
                return Double.toString(asDouble());
            case BOOL:
                return asBool() ? "True" : "False";
            case STRING:
                return '"' + asString() + '"';
            case LIST:
            case TREE:
                return value.toString();
            default:
                return "None";
        }
    }
}
