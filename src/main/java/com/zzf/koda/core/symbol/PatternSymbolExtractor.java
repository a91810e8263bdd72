package com.zzf.koda.core.symbol;

import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-pattern extraction for Python and JavaScript/TypeScript sources. Python block ends follow
 * indentation; JS/TS block ends follow brace depth.
 */
@Component
public class PatternSymbolExtractor implements SymbolExtractor {

    private static final Pattern PY_CLASS = Pattern.compile("^(\\s*)class\\s+(\\w+)");
    private static final Pattern PY_DEF = Pattern.compile("^(\\s*)(?:async\\s+)?def\\s+(\\w+)\\s*(\\([^)]*\\)?)(?:\\s*->\\s*([^:]+))?");
    private static final Pattern PY_IMPORT = Pattern.compile("^(?:import|from)\\s+\\S.*");

    private static final Pattern JS_CLASS = Pattern.compile("^\\s*(?:export\\s+)?(?:default\\s+)?(?:abstract\\s+)?class\\s+(\\w+)");
    private static final Pattern JS_INTERFACE = Pattern.compile("^\\s*(?:export\\s+)?interface\\s+(\\w+)");
    private static final Pattern JS_FUNCTION = Pattern.compile("^\\s*(?:export\\s+)?(?:default\\s+)?(?:async\\s+)?function\\s*\\*?\\s*(\\w+)\\s*(\\([^)]*\\)?)");
    private static final Pattern JS_ARROW = Pattern.compile("^\\s*(?:export\\s+)?(?:const|let|var)\\s+(\\w+)\\s*(?::[^=]+)?=\\s*(?:async\\s+)?(\\([^)]*\\)|\\w+)\\s*(?::[^=]+)?=>");
    private static final Pattern JS_METHOD = Pattern.compile("^\\s+(?:(?:public|private|protected|static|async|readonly|get|set)\\s+)*(\\w+)\\s*(\\([^)]*\\))\\s*(?::[^{]+)?\\{");
    private static final Pattern JS_IMPORT = Pattern.compile("^\\s*import\\s+\\S.*");
    private static final Set<String> JS_KEYWORDS = Set.of("if", "for", "while", "switch", "catch", "return", "function", "with", "constructor");

    @Override
    public boolean supports(String path) {
        return language(path) != null;
    }

    @Override
    public List<CodeSymbol> extract(String path, String source) {
        String[] lines = source.split("\n", -1);
        return "py".equals(language(path)) ? python(path, lines) : javascript(path, lines);
    }

    private static String language(String path) {
        if (path == null) {
            return null;
        }
        String lower = path.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".py")) {
            return "py";
        }
        if (lower.endsWith(".js") || lower.endsWith(".jsx") || lower.endsWith(".mjs")
                || lower.endsWith(".ts") || lower.endsWith(".tsx")) {
            return "js";
        }
        return null;
    }

    private static List<CodeSymbol> python(String path, String[] lines) {
        List<Pending> found = new ArrayList<>();
        Deque<Pending> classes = new ArrayDeque<>();
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank() || line.strip().startsWith("#")) {
                continue;
            }
            int indent = indentOf(line);
            while (!classes.isEmpty() && classes.peek().indent >= indent) {
                classes.pop();
            }
            Matcher m;
            if ((m = PY_CLASS.matcher(line)).find()) {
                Pending cls = new Pending(m.group(2), SymbolKind.CLASS, i + 1, indent, null, parentName(classes));
                found.add(cls);
                classes.push(cls);
            } else if ((m = PY_DEF.matcher(line)).find()) {
                String parent = parentName(classes);
                String signature = "def " + m.group(2) + (m.group(3).isEmpty() ? "()" : m.group(3));
                if (m.group(4) != null) {
                    signature += " -> " + m.group(4).trim();
                }
                found.add(new Pending(m.group(2), parent == null ? SymbolKind.FUNCTION : SymbolKind.METHOD,
                        i + 1, indent, signature, parent));
            } else if (indent == 0 && PY_IMPORT.matcher(line).matches()) {
                found.add(new Pending(line.strip(), SymbolKind.IMPORT, i + 1, indent, null, null));
            }
        }
        List<CodeSymbol> symbols = new ArrayList<>();
        for (Pending p : found) {
            int end = p.kind == SymbolKind.IMPORT ? p.line : pythonBlockEnd(lines, p.line - 1, p.indent);
            symbols.add(new CodeSymbol(p.name, p.kind, path, p.line, end, p.signature, p.parent));
        }
        return symbols;
    }

    private static int pythonBlockEnd(String[] lines, int startIndex, int indent) {
        int last = startIndex;
        for (int i = startIndex + 1; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank()) {
                continue;
            }
            if (indentOf(line) <= indent) {
                break;
            }
            last = i;
        }
        return last + 1;
    }

    private static List<CodeSymbol> javascript(String path, String[] lines) {
        List<Pending> found = new ArrayList<>();
        Deque<Pending> open = new ArrayDeque<>();
        int depth = 0;
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            Pending declared = null;
            Matcher m;
            if ((m = JS_IMPORT.matcher(line)).matches()) {
                found.add(new Pending(line.strip(), SymbolKind.IMPORT, i + 1, depth, null, null));
            } else if ((m = JS_CLASS.matcher(line)).find()) {
                declared = new Pending(m.group(1), SymbolKind.CLASS, i + 1, depth, "class " + m.group(1), enclosingClass(open));
            } else if ((m = JS_INTERFACE.matcher(line)).find()) {
                declared = new Pending(m.group(1), SymbolKind.INTERFACE, i + 1, depth, "interface " + m.group(1), null);
            } else if ((m = JS_FUNCTION.matcher(line)).find()) {
                declared = new Pending(m.group(1), SymbolKind.FUNCTION, i + 1, depth,
                        "function " + m.group(1) + (m.group(2).isEmpty() ? "()" : m.group(2)), null);
            } else if ((m = JS_ARROW.matcher(line)).find()) {
                String params = m.group(2).startsWith("(") ? m.group(2) : "(" + m.group(2) + ")";
                declared = new Pending(m.group(1), SymbolKind.FUNCTION, i + 1, depth, m.group(1) + " = " + params + " =>", null);
            } else if (isClassBody(open, depth) && (m = JS_METHOD.matcher(line)).find() && !JS_KEYWORDS.contains(m.group(1))) {
                declared = new Pending(m.group(1), SymbolKind.METHOD, i + 1, depth, m.group(1) + m.group(2), enclosingClass(open));
            } else if (isClassBody(open, depth) && line.matches("^\\s+constructor\\s*\\(.*")) {
                Pending cls = open.peek();
                declared = new Pending("constructor", SymbolKind.CONSTRUCTOR, i + 1, depth, "constructor", cls.name);
            }
            if (declared != null) {
                found.add(declared);
            }
            int before = depth;
            depth += braceDelta(line);
            if (declared != null && depth > before) {
                open.push(declared);
            } else if (declared != null) {
                declared.end = i + 1;
            }
            while (!open.isEmpty() && depth <= open.peek().indent) {
                open.pop().end = i + 1;
            }
        }
        List<CodeSymbol> symbols = new ArrayList<>();
        for (Pending p : found) {
            int end = p.end > 0 ? p.end : (p.kind == SymbolKind.IMPORT ? p.line : lines.length);
            symbols.add(new CodeSymbol(p.name, p.kind, path, p.line, end, p.signature, p.parent));
        }
        return symbols;
    }

    private static boolean isClassBody(Deque<Pending> open, int depth) {
        Pending top = open.peek();
        return top != null && top.kind == SymbolKind.CLASS && depth == top.indent + 1;
    }

    private static String enclosingClass(Deque<Pending> open) {
        for (Pending p : open) {
            if (p.kind == SymbolKind.CLASS) {
                return p.name;
            }
        }
        return null;
    }

    private static String parentName(Deque<Pending> classes) {
        return classes.isEmpty() ? null : classes.peek().name;
    }

    private static int braceDelta(String line) {
        int delta = 0;
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '/' && i + 1 < line.length() && line.charAt(i + 1) == '/') {
                break;
            }
            if (c == '"' || c == '\'' || c == '`') {
                quote = c;
            } else if (c == '{') {
                delta++;
            } else if (c == '}') {
                delta--;
            }
        }
        return delta;
    }

    private static int indentOf(String line) {
        int n = 0;
        while (n < line.length() && (line.charAt(n) == ' ' || line.charAt(n) == '\t')) {
            n++;
        }
        return n;
    }

    /**
     * Declaration seen but not yet closed. {@code indent} is the indentation (Python) or brace
     * depth (JS/TS) at the declaration line.
     */
    private static final class Pending {
        final String name;
        final SymbolKind kind;
        final int line;
        final int indent;
        final String signature;
        final String parent;
        int end;

        Pending(String name, SymbolKind kind, int line, int indent, String signature, String parent) {
            this.name = name;
            this.kind = kind;
            this.line = line;
            this.indent = indent;
            this.signature = signature;
            this.parent = parent;
        }
    }
}
