package com.zzf.koda.core.symbol;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JavaParserSymbolExtractorTest {

    private final JavaParserSymbolExtractor extractor = new JavaParserSymbolExtractor();

    @Test
    void shouldExtractTypesMembersAndImports() {
        String source = String.join("\n",
                "package demo;",
                "",
                "import java.util.List;",
                "",
                "public class Greeter {",
                "    public Greeter() {",
                "    }",
                "",
                "    public String greet(String name, int times) {",
                "        return name;",
                "    }",
                "",
                "    enum Mood { HAPPY, SAD }",
                "}",
                "");

        List<CodeSymbol> symbols = extractor.extract("src/demo/Greeter.java", source);

        assertEquals(5, symbols.size());
        CodeSymbol imported = find(symbols, "java.util.List");
        assertEquals(SymbolKind.IMPORT, imported.getKind());

        CodeSymbol type = find(symbols, "Greeter");
        assertEquals(SymbolKind.CLASS, type.getKind());
        assertEquals(5, type.getStartLine());
        assertEquals(14, type.getEndLine());

        CodeSymbol method = find(symbols, "greet");
        assertEquals(SymbolKind.METHOD, method.getKind());
        assertEquals("Greeter.greet", method.qualifiedName());
        assertEquals("String greet(String, int)", method.getSignature());
        assertEquals("[method] Greeter.greet  String greet(String, int)  src/demo/Greeter.java:9-11", method.describe());

        assertEquals("Greeter", find(symbols, "Mood").getParent());
        assertTrue(symbols.stream().anyMatch(s -> s.getKind() == SymbolKind.CONSTRUCTOR));
    }

    @Test
    void shouldParseRecordsAtJava17Level() {
        List<CodeSymbol> symbols = extractor.extract("P.java", "record Point(int x, int y) { int sum() { return x + y; } }");

        assertEquals("sum", symbols.get(0).getName());
    }

    @Test
    void shouldFailOnBrokenSource() {
        assertThrows(RuntimeException.class, () -> extractor.extract("Broken.java", "class {"));
    }

    @Test
    void shouldOnlySupportJavaFiles() {
        assertTrue(extractor.supports("a/B.java"));
        assertFalse(extractor.supports("a/b.py"));
    }

    private static CodeSymbol find(List<CodeSymbol> symbols, String name) {
        return symbols.stream().filter(s -> s.getName().equals(name)).findFirst().orElseThrow();
    }
}
