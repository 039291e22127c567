package com.unnc.script.error;

/** Argument count does not match the declared parameter count. */
public class ArityException extends UnncException {
    private final String callee;
    private final int expected;
    private final int actual;

    public ArityException(String callee, int expected, int actual) {
        super("Argument mismatch for " + callee + ": expected " + expected + ", got " + actual);
        this.callee = callee;
        this.expected = expected;
        this.actual = actual;
    }

    public String callee() { return callee; }
    public int expected() { return expected; }
    public int actual() { return actual; }
}
