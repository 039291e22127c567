package com.unnc.script.parser;

/** One body line after label stripping, with its 1-based line number in the source text. */
public final class SourceLine {
    public final int number;
    public final String text;

    public SourceLine(int number, String text) {
        this.number = number;
        this.text = text;
    }

    @Override
    public String toString() {
        return number + ": " + text;
    }
}
