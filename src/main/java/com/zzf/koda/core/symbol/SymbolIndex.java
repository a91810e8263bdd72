package com.zzf.koda.core.symbol;

import com.zzf.koda.core.change.WorkspaceView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Builds symbol listings on demand from the task's workspace, staged content included. Nothing is
 * cached, so the index always matches what the task has staged so far.
 */
@Slf4j
@Component
public class SymbolIndex {

    private static final int MAX_FILE_CHARS = 1_000_000;

    private final List<SymbolExtractor> extractors;

    public SymbolIndex(List<SymbolExtractor> extractors) {
        this.extractors = List.copyOf(extractors);
    }

    public List<CodeSymbol> index(WorkspaceView workspace, String path) throws IOException {
        List<CodeSymbol> symbols = new ArrayList<>();
        for (String file : workspace.files(path)) {
            SymbolExtractor extractor = extractorFor(file);
            if (extractor == null) {
                continue;
            }
            Optional<String> source = workspace.read(file);
            if (source.isEmpty() || source.get().length() > MAX_FILE_CHARS) {
                continue;
            }
            try {
                symbols.addAll(extractor.extract(file, source.get()));
            } catch (RuntimeException e) {
                log.debug("symbol.skip path={} err={}", file, e.toString());
            }
        }
        return symbols;
    }

    /**
     * Case-insensitive substring match on the symbol name, imports excluded.
     */
    public List<CodeSymbol> find(WorkspaceView workspace, String name) throws IOException {
        String needle = name.toLowerCase(Locale.ROOT);
        List<CodeSymbol> matches = new ArrayList<>();
        for (CodeSymbol symbol : index(workspace, ".")) {
            if (symbol.getKind() != SymbolKind.IMPORT && symbol.getName().toLowerCase(Locale.ROOT).contains(needle)) {
                matches.add(symbol);
            }
        }
        return matches;
    }

    private SymbolExtractor extractorFor(String file) {
        for (SymbolExtractor extractor : extractors) {
            if (extractor.supports(file)) {
                return extractor;
            }
        }
        return null;
    }
}
