package com.sentinel.core.diff;

import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Top-level types and their public/protected members (every member of an interface
 * or annotation type). Annotations on their own lines are not part of a signature.
 */
final class JavaSymbolExtractor implements SymbolExtractor {

    private static final String ANNOTATIONS = "(?:@[\\w.]+(?:\\([^)]*\\))?\\s+)*";

    private static final Pattern TYPE_DECL = Pattern.compile("^" + ANNOTATIONS
            + "(?:(?:public|protected|private|abstract|final|static|sealed|non-sealed|strictfp)\\s+)*"
            + "(class|interface|enum|record|@interface)\\s+(\\w+)");

    private static final Pattern MEMBER = Pattern.compile("^" + ANNOTATIONS
            + "((?:(?:public|protected|private|abstract|final|static|default|synchronized|native"
            + "|transient|volatile|strictfp)\\s+)*)(.*)$");

    private static final Pattern METHOD_NAME = Pattern.compile("(\\w+)\\s*\\(");
    private static final Pattern FIELD_NAME = Pattern.compile("(\\w+)\\s*(?:=|;|$)");

    @Override
    public Set<String> extensions() {
        return Set.of("java");
    }

    @Override
    public Map<String, String> extract(String source) {
        var text = SourceText.of(source, SourceText.Syntax.C_LIKE);
        var symbols = new Symbols();
        String currentType = null;
        boolean currentIsInterface = false;

        for (var line : text.lines()) {
            if (line.isBlank()) {
                continue;
            }
            String trimmed = line.trimmed();
            int start = line.start() + line.indent();

            if (line.depth() == 0) {
                Matcher type = TYPE_DECL.matcher(trimmed);
                if (type.find()) {
                    currentType = type.group(2);
                    currentIsInterface = type.group(1).contains("interface");
                    symbols.add(currentType, text.readHeader(start, "{;", false));
                }
                continue;
            }
            if (line.depth() != 1 || currentType == null) {
                continue;
            }

            Matcher member = MEMBER.matcher(trimmed);
            if (!member.matches()) {
                continue;
            }
            String modifiers = member.group(1);
            String rest = member.group(2);
            if (rest.isBlank() || rest.startsWith("}") || rest.startsWith("{")) {
                continue;
            }
            boolean exposed = modifiers.contains("public") || modifiers.contains("protected")
                    || (currentIsInterface && !modifiers.contains("private"));
            if (!exposed) {
                continue;
            }

            Matcher nested = TYPE_DECL.matcher(trimmed);
            if (nested.find()) {
                symbols.add(currentType + "." + nested.group(2), text.readHeader(start, "{;", false));
                continue;
            }
            int paren = rest.indexOf('(');
            int assign = rest.indexOf('=');
            if (paren >= 0 && (assign < 0 || paren < assign)) {
                Matcher name = METHOD_NAME.matcher(rest);
                if (name.find()) {
                    symbols.add(currentType + "." + name.group(1), text.readHeader(start, "{;", false));
                }
            } else {
                String declaration = assign >= 0 ? rest.substring(0, assign) : rest;
                Matcher name = FIELD_NAME.matcher(declaration.trim());
                if (name.find()) {
                    symbols.add(currentType + "." + name.group(1), text.readHeader(start, "=;", false));
                }
            }
        }
        return symbols.toMap();
    }
}
