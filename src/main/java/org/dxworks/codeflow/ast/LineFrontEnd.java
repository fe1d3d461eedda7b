package org.dxworks.codeflow.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Degraded front end: one {@link NodeKind#LINE} node per non-blank line of the procedure body.
 * <p>
 * For brace-delimited languages the body is the text between the first {@code '{'} and the last
 * {@code '}'}; otherwise a leading header line ending with {@code ':'} is skipped.
 */
public class LineFrontEnd implements FrontEnd {

    private final boolean braceDelimited;

    public LineFrontEnd(boolean braceDelimited) {
        this.braceDelimited = braceDelimited;
    }

    @Override
    public AstNode parse(String sourceCode) {
        String source = sourceCode.replace("\r\n", "\n").replace("\r", "\n");
        int open = source.indexOf('{');
        int close = source.lastIndexOf('}');

        int bodyStart;
        int bodyEnd;
        if (braceDelimited && open >= 0 && close > open) {
            bodyStart = open + 1;
            bodyEnd = close;
        } else {
            bodyStart = skipHeaderLine(source);
            bodyEnd = source.length();
        }

        int line = countLines(source, bodyStart);
        String body = source.substring(bodyStart, bodyEnd);
        List<AstNode> lines = new ArrayList<>();
        for (String raw : body.split("\n", -1)) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                lines.add(LineAstNode.line(trimmed, line));
            }
            line++;
        }
        return LineAstNode.body(body, countLines(source, bodyStart), lines);
    }

    private static int skipHeaderLine(String source) {
        int offset = 0;
        while (offset < source.length()) {
            int newline = source.indexOf('\n', offset);
            int end = newline < 0 ? source.length() : newline;
            String trimmed = source.substring(offset, end).trim();
            if (!trimmed.isEmpty()) {
                return trimmed.endsWith(":") && newline >= 0 ? newline + 1 : offset;
            }
            if (newline < 0) break;
            offset = newline + 1;
        }
        return offset;
    }

    /** 1-based line number of {@code offset}. */
    private static int countLines(String source, int offset) {
        int line = 1;
        for (int i = 0; i < offset && i < source.length(); i++) {
            if (source.charAt(i) == '\n') line++;
        }
        return line;
    }
}
