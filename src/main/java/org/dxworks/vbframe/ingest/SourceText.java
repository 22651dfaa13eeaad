package org.dxworks.vbframe.ingest;

import org.dxworks.vbframe.ir.SourceSpan;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Decoded source text plus the position tables needed to turn parser indexes into {@link SourceSpan}s.
 * <p>
 * ANTLR indexes code points while Java strings index UTF-16 units; both are mapped here. Byte offsets are
 * computed against the charset the file was decoded with and include the byte-order mark length.
 */
public final class SourceText {

    private final String text;
    private final Charset charset;
    private final int bomLength;
    private final int[] lineStarts;
    private final int[] codePointToChar;
    private final int[] charToByte;

    public SourceText(String text, Charset charset, int bomLength) {
        this.text = Objects.requireNonNull(text, "text");
        this.charset = charset == null ? StandardCharsets.UTF_8 : charset;
        this.bomLength = bomLength;
        this.lineStarts = computeLineStarts(text);
        this.codePointToChar = computeCodePointTable(text);
        this.charToByte = computeByteTable(text, this.charset);
    }

    public static SourceText of(String text) {
        return new SourceText(text, StandardCharsets.UTF_8, 0);
    }

    public String getText() {
        return text;
    }

    public Charset getCharset() {
        return charset;
    }

    public int length() {
        return text.length();
    }

    /**
     * Converts a code point index (as used by ANTLR token start/stop indexes) into a char index.
     */
    public int charIndex(int codePointIndex) {
        if (codePointToChar == null) {
            return clamp(codePointIndex);
        }
        if (codePointIndex <= 0) {
            return 0;
        }
        if (codePointIndex >= codePointToChar.length) {
            return text.length();
        }
        return codePointToChar[codePointIndex];
    }

    public String slice(int charStart, int charEnd) {
        int s = clamp(charStart);
        int e = Math.max(s, clamp(charEnd));
        return text.substring(s, e);
    }

    /**
     * Span for the half-open char range {@code [charStart, charEnd)}.
     */
    public SourceSpan span(int charStart, int charEnd) {
        int s = clamp(charStart);
        int e = Math.max(s, clamp(charEnd));
        int startLine = lineOf(s);
        int endLine = lineOf(e);
        return new SourceSpan(
                startLine + 1, s - lineStarts[startLine] + 1,
                endLine + 1, e - lineStarts[endLine] + 1,
                byteOffset(s), byteOffset(e));
    }

    public int byteOffset(int charIndex) {
        int c = clamp(charIndex);
        int bytes = charToByte == null ? c : charToByte[c];
        return bomLength + bytes;
    }

    /**
     * Zero-based line index containing the char offset.
     */
    public int lineOf(int charIndex) {
        int lo = 0;
        int hi = lineStarts.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (lineStarts[mid] <= charIndex) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo;
    }

    public int lineCount() {
        return lineStarts.length;
    }

    public int lineStart(int line) {
        return lineStarts[line];
    }

    /**
     * Char offset just past the line content, excluding its terminator.
     */
    public int lineContentEnd(int line) {
        int end = line + 1 < lineStarts.length ? lineStarts[line + 1] : text.length();
        while (end > lineStarts[line] && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) {
            end--;
        }
        return end;
    }

    public boolean isBlankLine(int line) {
        int start = lineStarts[line];
        int end = lineContentEnd(line);
        for (int i = start; i < end; i++) {
            char c = text.charAt(i);
            if (c != ' ' && c != '\t') {
                return false;
            }
        }
        return true;
    }

    private int clamp(int charIndex) {
        return Math.max(0, Math.min(charIndex, text.length()));
    }

    private static int[] computeLineStarts(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\r') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                starts.add(i + 1);
            } else if (c == '\n') {
                starts.add(i + 1);
            }
        }
        int[] out = new int[starts.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = starts.get(i);
        }
        return out;
    }

    // null when the text has no surrogate pairs, which is the common case
    private static int[] computeCodePointTable(String text) {
        int codePoints = text.codePointCount(0, text.length());
        if (codePoints == text.length()) {
            return null;
        }
        int[] table = new int[codePoints + 1];
        int cp = 0;
        for (int i = 0; i < text.length(); ) {
            table[cp++] = i;
            i += Character.charCount(text.codePointAt(i));
        }
        table[cp] = text.length();
        return table;
    }

    // null for single-byte charsets where byte offset == char offset
    private static int[] computeByteTable(String text, Charset charset) {
        if (charset.newEncoder().maxBytesPerChar() <= 1.0f) {
            return null;
        }
        boolean utf16 = charset.name().startsWith("UTF-16");
        int[] table = new int[text.length() + 1];
        int bytes = 0;
        for (int i = 0; i < text.length(); i++) {
            table[i] = bytes;
            char c = text.charAt(i);
            if (utf16) {
                bytes += 2;
            } else if (c < 0x80) {
                bytes += 1;
            } else if (c < 0x800) {
                bytes += 2;
            } else if (Character.isSurrogate(c)) {
                bytes += 2;
            } else {
                bytes += 3;
            }
        }
        table[text.length()] = bytes;
        return table;
    }
}
