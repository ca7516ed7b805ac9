package com.querytree.visitor;

public class TreeDepthExceededException extends IllegalStateException {
    private final int maxDepth;

    public TreeDepthExceededException(int maxDepth) {
        super("Query tree is nested deeper than the configured limit of " + maxDepth);
        this.maxDepth = maxDepth;
    }

    public int maxDepth() {
        return maxDepth;
    }
}
