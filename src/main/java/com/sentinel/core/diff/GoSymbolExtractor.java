package com.sentinel.core.diff;

import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Top-level {@code func} (methods keyed as {@code Receiver.Name}) and {@code type}
 * declarations; types include their body.
 */
final class GoSymbolExtractor implements SymbolExtractor {

    private static final Pattern FUNC = Pattern.compile(
            "^func\\s*(?:\\(\\s*(?:\\w+\\s+)?\\*?\\s*(\\w+)(?:\\[[^\\]]*\\])?\\s*\\))?\\s*(\\w+)");
    private static final Pattern TYPE = Pattern.compile("^type\\s+(\\w+)");

    @Override
    public Set<String> extensions() {
        return Set.of("go");
    }

    @Override
    public Map<String, String> extract(String source) {
        var text = SourceText.of(source, SourceText.Syntax.GO);
        var symbols = new Symbols();
        for (var line : text.lines()) {
            if (line.isBlank() || line.depth() != 0 || line.indent() > 0) {
                continue;
            }
            Matcher func = FUNC.matcher(line.masked());
            if (func.find()) {
                String name = func.group(1) != null ? func.group(1) + "." + func.group(2) : func.group(2);
                symbols.add(name, text.readHeader(line.start(), "{", true));
                continue;
            }
            Matcher type = TYPE.matcher(line.masked());
            if (type.find()) {
                symbols.add(type.group(1), text.readBody(line.start(), true));
            }
        }
        return symbols.toMap();
    }
}
