package com.tinyc.pipeline;

public enum Stage {
    TOKENS("tokens"),
    AST("ast"),
    EVAL("eval"),
    COMPILE("compile");

    private final String label;

    Stage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
