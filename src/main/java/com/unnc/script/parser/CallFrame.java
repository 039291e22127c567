package com.unnc.script.parser;

import java.util.List;

public class CallFrame {
    final String algorithmName;
    final List<Value> arguments;

    CallFrame(String algorithmName, List<Value> arguments) {
        this.algorithmName = algorithmName;
        this.arguments = arguments;
    }

    @Override
    public String toString() {
        return algorithmName + arguments;
    }
}
