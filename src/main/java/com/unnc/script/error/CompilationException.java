package com.unnc.script.error;

/** Malformed algorithm header or malformed block-construct header. */
public class CompilationException extends UnncException {
    private final int line;

    public CompilationException(String message, int line) {
        super(line > 0 ? "[line " + line + "] " + message : message);
        this.line = line;
    }

    /** 1-based source line, or 0 when unknown. */
    public int line() {
        return line;
    }
}
