package com.unnc.script.error;

/** Root of every failure raised by the compiler and interpreter. */
public class UnncException extends RuntimeException {

    public UnncException(String message) {
        super(message);
    }

    public UnncException(String message, Throwable cause) {
        super(message, cause);
    }
}
