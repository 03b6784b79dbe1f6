package com.sentinel.core.diff;

import java.util.Map;
import java.util.Set;

/**
 * Extracts the named top-level symbols of one language family.
 */
interface SymbolExtractor {

    /** File extensions (lower case, without dot) handled by this extractor. */
    Set<String> extensions();

    /**
     * @return symbol name → normalized signature; overloads share one entry
     */
    Map<String, String> extract(String source);
}
