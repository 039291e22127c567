package com.unnc.script.error;

/** A list or tree operation was applied to the wrong variant (or to a non-structure). */
public class StructuralTypeException extends UnncException {

    public StructuralTypeException(String message) {
        super(message);
    }
}
