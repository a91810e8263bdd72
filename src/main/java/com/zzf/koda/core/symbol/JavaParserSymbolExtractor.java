package com.zzf.koda.core.symbol;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseProblemException;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
public class JavaParserSymbolExtractor implements SymbolExtractor {

    @Override
    public boolean supports(String path) {
        return path != null && path.toLowerCase(Locale.ROOT).endsWith(".java");
    }

    @Override
    public List<CodeSymbol> extract(String path, String source) {
        ParseResult<CompilationUnit> parsed = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)).parse(source);
        if (!parsed.isSuccessful() || parsed.getResult().isEmpty()) {
            throw new ParseProblemException(parsed.getProblems());
        }
        CompilationUnit cu = parsed.getResult().get();
        List<CodeSymbol> symbols = new ArrayList<>();

        cu.accept(new VoidVisitorAdapter<Void>() {
            @Override
            public void visit(ImportDeclaration n, Void arg) {
                String name = n.getNameAsString() + (n.isAsterisk() ? ".*" : "");
                symbols.add(symbol(n, name, SymbolKind.IMPORT, null, null));
            }

            @Override
            public void visit(ClassOrInterfaceDeclaration n, Void arg) {
                SymbolKind kind = n.isInterface() ? SymbolKind.INTERFACE : SymbolKind.CLASS;
                String signature = (n.isInterface() ? "interface " : "class ") + n.getNameAsString();
                symbols.add(symbol(n, n.getNameAsString(), kind, signature, enclosingType(n)));
                super.visit(n, arg);
            }

            @Override
            public void visit(EnumDeclaration n, Void arg) {
                symbols.add(symbol(n, n.getNameAsString(), SymbolKind.ENUM, "enum " + n.getNameAsString(), enclosingType(n)));
                super.visit(n, arg);
            }

            @Override
            public void visit(MethodDeclaration n, Void arg) {
                symbols.add(symbol(n, n.getNameAsString(), SymbolKind.METHOD, methodSignature(n), enclosingType(n)));
                super.visit(n, arg);
            }

            @Override
            public void visit(ConstructorDeclaration n, Void arg) {
                symbols.add(symbol(n, n.getNameAsString(), SymbolKind.CONSTRUCTOR, constructorSignature(n), enclosingType(n)));
                super.visit(n, arg);
            }

            private CodeSymbol symbol(Node n, String name, SymbolKind kind, String signature, String parent) {
                int start = n.getBegin().map(p -> p.line).orElse(0);
                int end = n.getEnd().map(p -> p.line).orElse(start);
                return new CodeSymbol(name, kind, path, start, end, signature, parent);
            }
        }, null);

        return symbols;
    }

    private static String enclosingType(Node n) {
        return n.getParentNode()
                .filter(p -> p instanceof TypeDeclaration)
                .map(p -> ((TypeDeclaration<?>) p).getNameAsString())
                .orElse(null);
    }

    private static String methodSignature(MethodDeclaration n) {
        return n.getTypeAsString() + " " + n.getNameAsString() + "(" + parameterTypes(n.getParameters()) + ")";
    }

    private static String constructorSignature(ConstructorDeclaration n) {
        return n.getNameAsString() + "(" + parameterTypes(n.getParameters()) + ")";
    }

    private static String parameterTypes(List<Parameter> params) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(params.get(i).getTypeAsString());
        }
        return sb.toString();
    }
}
