package org.perlfront.astnode;

/**
 * Hands out sequential node ids, starting at 1. One instance per parse.
 */
public class NodeIdGenerator {
    private int next = 1;

    public int next() {
        return next++;
    }

    /**
     * Number of ids handed out so far.
     */
    public int count() {
        return next - 1;
    }
}
