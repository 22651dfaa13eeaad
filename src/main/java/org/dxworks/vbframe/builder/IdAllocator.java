package org.dxworks.vbframe.builder;

import org.dxworks.vbframe.ir.SourceSpan;

import java.util.HashMap;
import java.util.Map;

/**
 * Hands out node ids of the form {@code prefix@start:end} (byte offsets). Ids depend only on the node
 * kind and its position, so the same input always yields the same ids; the rare collision gets a
 * {@code #n} suffix in allocation order.
 */
class IdAllocator {

    private final Map<String, Integer> seen = new HashMap<>();

    String next(String prefix, SourceSpan span) {
        String base = prefix + "@" + span.getStartOffset() + ":" + span.getEndOffset();
        int count = seen.merge(base, 1, Integer::sum);
        return count == 1 ? base : base + "#" + count;
    }
}
