package org.dxworks.codeflow.ast;

import java.nio.charset.StandardCharsets;

/**
 * Source code together with its UTF-8 encoding.
 * Tree-sitter reports byte offsets, Java strings are indexed by UTF-16 units.
 */
public final class SourceText {

    private final String source;
    private final byte[] bytes;

    public SourceText(String source) {
        this.source = source;
        this.bytes = source.getBytes(StandardCharsets.UTF_8);
    }

    public String getSource() {
        return source;
    }

    public String slice(int startByte, int endByte) {
        int start = Math.max(0, startByte);
        int end = Math.min(bytes.length, endByte);
        if (start >= end) return "";
        String text = new String(bytes, start, end - start, StandardCharsets.UTF_8);
        // Normalize line endings to LF for cross-platform consistency
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }
}
