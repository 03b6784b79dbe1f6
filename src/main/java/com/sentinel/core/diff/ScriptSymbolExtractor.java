package com.sentinel.core.diff;

import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * JavaScript and TypeScript: top-level functions and classes, plus exported
 * interfaces, type aliases, enums, namespaces and bindings. Type-like declarations
 * include their body; bindings only their name, type annotation and arrow parameters.
 */
final class ScriptSymbolExtractor implements SymbolExtractor {

    private static final Pattern DECL = Pattern.compile(
            "^(export\\s+(?:default\\s+)?)?(?:declare\\s+)?(?:async\\s+)?"
            + "(function\\*?|abstract\\s+class|class|interface|type|const\\s+enum|enum|namespace|const|let|var)"
            + "(?![\\w$])(?:\\s*\\*?\\s*([A-Za-z_$][\\w$]*))?");

    @Override
    public Set<String> extensions() {
        return Set.of("js", "jsx", "mjs", "cjs", "ts", "tsx", "mts", "cts");
    }

    @Override
    public Map<String, String> extract(String source) {
        var text = SourceText.of(source, SourceText.Syntax.SCRIPT);
        var symbols = new Symbols();
        for (var line : text.lines()) {
            if (line.isBlank() || line.depth() != 0) {
                continue;
            }
            Matcher m = DECL.matcher(line.trimmed());
            if (!m.find()) {
                continue;
            }
            boolean exported = m.group(1) != null;
            String kind = m.group(2).replaceAll("\\s+", " ");
            String name = m.group(3);
            if ("extends".equals(name) || "implements".equals(name)) {
                name = null;
            }
            if (name == null) {
                if (exported && m.group(1).contains("default")) {
                    name = "default";
                } else {
                    continue;
                }
            }
            int start = line.start() + line.indent();

            switch (kind) {
                case "function", "function*", "class", "abstract class" ->
                        symbols.add(name, text.readHeader(start, "{;", false));
                case "interface", "type", "enum", "const enum", "namespace" -> {
                    if (exported) {
                        symbols.add(name, text.readBody(start, true));
                    }
                }
                default -> {
                    if (exported) {
                        symbols.add(name, binding(text.readHeader(start, "{;", true)));
                    }
                }
            }
        }
        return symbols.toMap();
    }

    /** {@code export const f = (a: A) => ...} keeps the arrow head; plain values drop the initializer. */
    private static String binding(String header) {
        int arrow = header.indexOf("=>");
        if (arrow >= 0) {
            return header.substring(0, arrow + 2);
        }
        int assign = header.indexOf('=');
        return assign >= 0 ? header.substring(0, assign) : header;
    }
}
