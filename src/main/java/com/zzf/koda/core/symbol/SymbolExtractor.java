package com.zzf.koda.core.symbol;

import java.util.List;

public interface SymbolExtractor {

    boolean supports(String path);

    /**
     * @throws RuntimeException when the source cannot be parsed; the index skips such files
     */
    List<CodeSymbol> extract(String path, String source);
}
