package com.zzf.koda.core.tool;

/**
 * What happened to one dispatched call. Only {@link Kind#EXECUTED} is a success.
 */
public final class ToolOutcome {

    public enum Kind {
        EXECUTED,
        TOOL_ERROR,
        REJECTED,
        INVALID_ARGUMENTS
    }

    private final Kind kind;
    private final String output;

    private ToolOutcome(Kind kind, String output) {
        this.kind = kind;
        this.output = output == null ? "" : output;
    }

    public static ToolOutcome executed(String output) {
        return new ToolOutcome(Kind.EXECUTED, output);
    }

    public static ToolOutcome toolError(String message) {
        return new ToolOutcome(Kind.TOOL_ERROR, message);
    }

    public static ToolOutcome rejected(String message) {
        return new ToolOutcome(Kind.REJECTED, message);
    }

    public static ToolOutcome invalidArguments(String message) {
        return new ToolOutcome(Kind.INVALID_ARGUMENTS, message);
    }

    public Kind getKind() {
        return kind;
    }

    public String getOutput() {
        return output;
    }

    public boolean isError() {
        return kind != Kind.EXECUTED;
    }

    @Override
    public String toString() {
        return "ToolOutcome{" + kind + ", " + output.length() + " chars}";
    }
}
