package com.composeops.core.operations;

import java.util.List;

/**
 * Log entries of one operation after a given index.
 *
 * @param entries   entries in append order
 * @param nextIndex index to pass on the next read
 * @param terminal  whether the operation had reached a terminal status when read
 */
public record LogSlice(
    List<String> entries,
    int nextIndex,
    boolean terminal
) {

    /** True when the operation is terminal and nothing remains to be read. */
    public boolean drained() {
        return terminal && entries.isEmpty();
    }
}
