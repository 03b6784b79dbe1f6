package com.sentinel.core.diff;

import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Column-0 {@code def}, {@code async def} and {@code class} statements.
 */
final class PythonSymbolExtractor implements SymbolExtractor {

    private static final Pattern DECL = Pattern.compile("^(async\\s+def|def|class)\\s+([A-Za-z_]\\w*)");

    @Override
    public Set<String> extensions() {
        return Set.of("py", "pyi");
    }

    @Override
    public Map<String, String> extract(String source) {
        var text = SourceText.of(source, SourceText.Syntax.PYTHON);
        var symbols = new Symbols();
        for (var line : text.lines()) {
            if (line.isBlank() || line.indent() > 0) {
                continue;
            }
            Matcher m = DECL.matcher(line.masked());
            if (m.find()) {
                symbols.add(m.group(2), text.readHeader(line.start(), ":", false));
            }
        }
        return symbols.toMap();
    }
}
