package com.querytree.visitor;

/**
 * Thrown when rewriting a whole tree yields no node or several nodes.
 */
public class TransformationArityException extends IllegalStateException {
    private final int resultCount;

    public TransformationArityException(int resultCount) {
        super("The visit of the tree should have produced exactly one element (the transformed tree), got "
            + resultCount);
        this.resultCount = resultCount;
    }

    public int resultCount() {
        return resultCount;
    }
}
