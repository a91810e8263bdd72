package com.zzf.koda.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.koda.config.AgentConfig;
import com.zzf.koda.core.symbol.CodeSymbol;
import com.zzf.koda.core.symbol.SymbolIndex;
import com.zzf.koda.core.tool.ToolSchema.FieldType;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
@RequiredArgsConstructor
public class FindSymbolTool implements Tool {

    private static final ToolSchema SCHEMA = ToolSchema.builder()
            .required("name", FieldType.STRING, "Symbol name or part of it, case-insensitive")
            .build();

    private final SymbolIndex symbolIndex;
    private final AgentConfig config;
    private final ResourceLoader resourceLoader;

    @Override
    public String getId() {
        return "find_symbol";
    }

    @Override
    public String getDescription() {
        return ToolDescriptions.load(resourceLoader, getId(), "Find where a class, function or method is declared.");
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
            String name = args.get("name").asText().trim();
            if (name.isEmpty()) {
                throw new IllegalArgumentException("name is blank");
            }
            List<CodeSymbol> matches;
            try {
                matches = symbolIndex.find(ctx.workspace(), name);
            } catch (IOException e) {
                throw new UncheckedIOException("Symbol search failed", e);
            }
            if (matches.isEmpty()) {
                return Result.builder().title(name).metadata(Map.of("count", 0))
                        .output("No symbols found matching '" + name + "'").build();
            }
            int cap = config.getMaxSymbols();
            StringBuilder output = new StringBuilder();
            output.append("Found ").append(matches.size()).append(" symbol(s) matching '").append(name).append("':\n");
            for (int i = 0; i < matches.size() && i < cap; i++) {
                output.append(matches.get(i).describe()).append('\n');
            }
            if (matches.size() > cap) {
                output.append("... and ").append(matches.size() - cap).append(" more\n");
            }
            return Result.builder().title(name).metadata(Map.of("count", matches.size()))
                    .output(output.toString().trim()).build();
        });
    }
}
