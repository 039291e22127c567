package com.unnc.script.error;

/** Unknown function, algorithm or variable. */
public class NameResolutionException extends UnncException {
    private final String name;

    public NameResolutionException(String name, String message) {
        super(message);
        this.name = name;
    }

    public String name() {
        return name;
    }

    public static NameResolutionException unknownFunction(String name) {
        return new NameResolutionException(name, "Unknown function: " + name);
    }

    public static NameResolutionException unknownAlgorithm(String name) {
        return new NameResolutionException(name, "Unknown algorithm: " + name);
    }

    public static NameResolutionException unknownVariable(String name) {
        return new NameResolutionException(name, "Undefined variable: " + name);
    }
}
