package com.zzf.koda.core.agent;

/**
 * How a tool-use loop ended normally: the model's final text and how much budget it used.
 */
public final class LoopResult {

    private final String text;
    private final int iterations;
    private final int toolCalls;

    public LoopResult(String text, int iterations, int toolCalls) {
        this.text = text == null ? "" : text;
        this.iterations = iterations;
        this.toolCalls = toolCalls;
    }

    public String getText() {
        return text;
    }

    public int getIterations() {
        return iterations;
    }

    public int getToolCalls() {
        return toolCalls;
    }
}
