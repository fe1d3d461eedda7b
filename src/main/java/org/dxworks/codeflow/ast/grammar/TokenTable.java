package org.dxworks.codeflow.ast.grammar;

import java.util.Set;

/**
 * Per-language lexical data used by variable extraction.
 */
public final class TokenTable {

    public static final TokenTable JAVA = new TokenTable(
            Set.of("abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class",
                    "const", "continue", "default", "do", "double", "else", "enum", "extends", "final",
                    "finally", "float", "for", "goto", "if", "implements", "import", "instanceof", "int",
                    "interface", "long", "native", "new", "package", "private", "protected", "public",
                    "return", "short", "static", "strictfp", "super", "switch", "synchronized", "this",
                    "throw", "throws", "transient", "try", "void", "volatile", "while", "var", "yield",
                    "record", "true", "false", "null", "String"),
            Set.of("Integer", "String", "Boolean"),
            "//",
            true);

    public static final TokenTable PYTHON = new TokenTable(
            Set.of("False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
                    "continue", "def", "del", "elif", "else", "except", "finally", "for", "from",
                    "global", "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass",
                    "raise", "return", "try", "while", "with", "yield"),
            Set.of("Integer", "String", "Boolean"),
            "#",
            false);

    private final Set<String> keywords;
    private final Set<String> typeNameAllowList;
    private final String lineCommentPrefix;
    private final boolean blockComments;

    public TokenTable(Set<String> keywords, Set<String> typeNameAllowList, String lineCommentPrefix, boolean blockComments) {
        this.keywords = keywords;
        this.typeNameAllowList = typeNameAllowList;
        this.lineCommentPrefix = lineCommentPrefix;
        this.blockComments = blockComments;
    }

    public boolean isKeyword(String name) {
        return keywords.contains(name);
    }

    /** Capitalized names are taken for type names unless allow-listed. */
    public boolean looksLikeTypeName(String name) {
        return !name.isEmpty() && Character.isUpperCase(name.charAt(0)) && !typeNameAllowList.contains(name);
    }

    /**
     * Blanks out string literals and comments in one line of source, keeping the other characters
     * at their positions.
     */
    public String stripCommentsAndStrings(String line) {
        StringBuilder result = new StringBuilder(line.length());
        char quote = 0;
        boolean inBlockComment = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (inBlockComment) {
                if (c == '*' && i + 1 < line.length() && line.charAt(i + 1) == '/') {
                    inBlockComment = false;
                    result.append("  ");
                    i++;
                } else {
                    result.append(' ');
                }
            } else if (quote != 0) {
                if (c == '\\' && i + 1 < line.length()) {
                    result.append("  ");
                    i++;
                } else {
                    if (c == quote) quote = 0;
                    result.append(' ');
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
                result.append(' ');
            } else if (line.startsWith(lineCommentPrefix, i)) {
                break;
            } else if (blockComments && c == '/' && i + 1 < line.length() && line.charAt(i + 1) == '*') {
                inBlockComment = true;
                result.append("  ");
                i++;
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }
}
