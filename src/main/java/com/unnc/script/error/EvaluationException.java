package com.unnc.script.error;

/**
 * Fallback expression evaluation failed. Carries the text as written and the text after
 * operator normalisation.
 */
public class EvaluationException extends UnncException {
    private final String originalText;
    private final String normalizedText;

    public EvaluationException(String originalText, String normalizedText, Throwable cause) {
        super("Could not evaluate expression '" + originalText + "' (normalized: " + normalizedText + "): "
                + (cause == null ? "unknown error" : describe(cause)), cause);
        this.originalText = originalText;
        this.normalizedText = normalizedText;
    }

    public String originalText() { return originalText; }
    public String normalizedText() { return normalizedText; }

    private static String describe(Throwable t) {
        return t.getMessage() == null ? t.toString() : t.getMessage();
    }
}
