package com.zzf.koda.core.symbol;

/**
 * A named declaration found in a source file. Lines are 1-based.
 */
public final class CodeSymbol {

    private final String name;
    private final SymbolKind kind;
    private final String path;
    private final int startLine;
    private final int endLine;
    private final String signature;
    private final String parent;

    public CodeSymbol(String name, SymbolKind kind, String path, int startLine, int endLine, String signature, String parent) {
        this.name = name;
        this.kind = kind;
        this.path = path;
        this.startLine = startLine;
        this.endLine = Math.max(startLine, endLine);
        this.signature = signature;
        this.parent = parent;
    }

    public String getName() {
        return name;
    }

    public SymbolKind getKind() {
        return kind;
    }

    public String getPath() {
        return path;
    }

    public int getStartLine() {
        return startLine;
    }

    public int getEndLine() {
        return endLine;
    }

    public String getSignature() {
        return signature;
    }

    public String getParent() {
        return parent;
    }

    public String qualifiedName() {
        return parent == null || parent.isEmpty() ? name : parent + "." + name;
    }

    /**
     * One-line listing form, e.g. {@code [method] Greeter.greet  String greet(String)  src/Greeter.java:4-6}.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(kind.wireName()).append("] ").append(qualifiedName());
        if (signature != null && !signature.isEmpty()) {
            sb.append("  ").append(signature);
        }
        sb.append("  ").append(path).append(':').append(startLine);
        if (endLine > startLine) {
            sb.append('-').append(endLine);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return describe();
    }
}
