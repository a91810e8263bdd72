package com.zzf.koda.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.koda.config.AgentConfig;
import com.zzf.koda.core.symbol.CodeSymbol;
import com.zzf.koda.core.symbol.SymbolIndex;
import com.zzf.koda.core.symbol.SymbolKind;
import com.zzf.koda.core.tool.ToolSchema.FieldType;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * index_symbols: declarations (kind, name, signature, location) under a path.
 */
@Component
@RequiredArgsConstructor
public class SymbolIndexTool implements Tool {

    private static final ToolSchema SCHEMA = ToolSchema.builder()
            .required("path", FieldType.STRING, "Directory or file to index, '.' for the whole repository")
            .optional("kind", FieldType.STRING, "Only list one kind: class, interface, enum, method, constructor, function, import")
            .build();

    private final SymbolIndex symbolIndex;
    private final AgentConfig config;
    private final ResourceLoader resourceLoader;

    @Override
    public String getId() {
        return "index_symbols";
    }

    @Override
    public String getDescription() {
        return ToolDescriptions.load(resourceLoader, getId(), "List classes, functions and methods declared under a path.");
    }

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public ToolCapability getCapability() {
        return ToolCapability.READ;
    }

    @Override
    public CompletableFuture<Result> execute(JsonNode args, Context ctx) {
        return CompletableFuture.supplyAsync(() -> {
            String path = ctx.relativePath(args.get("path").asText());
            SymbolKind kind = null;
            if (args.hasNonNull("kind")) {
                kind = SymbolKind.fromWire(args.get("kind").asText());
                if (kind == null) {
                    throw new IllegalArgumentException("Unknown kind '" + args.get("kind").asText()
                            + "'. Use: class, interface, enum, method, constructor, function, import");
                }
            }
            List<CodeSymbol> symbols;
            try {
                symbols = symbolIndex.index(ctx.workspace(), path);
            } catch (IOException e) {
                throw new UncheckedIOException("Could not index " + path, e);
            }

            List<CodeSymbol> selected = new ArrayList<>();
            Map<SymbolKind, Integer> counts = new EnumMap<>(SymbolKind.class);
            for (CodeSymbol symbol : symbols) {
                counts.merge(symbol.getKind(), 1, Integer::sum);
                boolean wanted = kind == null ? symbol.getKind() != SymbolKind.IMPORT : symbol.getKind() == kind;
                if (wanted) {
                    selected.add(symbol);
                }
            }
            int cap = config.getMaxSymbols();
            StringBuilder output = new StringBuilder();
            output.append("Found ").append(selected.size()).append(' ')
                    .append(kind == null ? "symbol(s)" : kind.wireName() + "(s)")
                    .append(" under ").append(path).append(' ').append(describeCounts(counts)).append('\n');
            for (int i = 0; i < selected.size() && i < cap; i++) {
                output.append(selected.get(i).describe()).append('\n');
            }
            if (selected.size() > cap) {
                output.append("... and ").append(selected.size() - cap).append(" more\n");
            }
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("count", selected.size());
            return Result.builder().title(path).metadata(metadata).output(output.toString().trim()).build();
        });
    }

    private static String describeCounts(Map<SymbolKind, Integer> counts) {
        List<String> parts = new ArrayList<>();
        for (Map.Entry<SymbolKind, Integer> entry : counts.entrySet()) {
            parts.add(entry.getKey().wireName() + "=" + entry.getValue());
        }
        return "(" + String.join(", ", parts) + ")";
    }
}
