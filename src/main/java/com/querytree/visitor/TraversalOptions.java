package com.querytree.visitor;

/**
 * Switches shared by {@link TreeVisitor} and {@link TreeTransformer}.
 *
 * @param trackParents    record the original ancestors under {@link VisitContext#PARENTS}
 * @param trackNewParents record the ancestors of the rebuilt tree under
 *                        {@link VisitContext#NEW_PARENTS}; only a transformer does this
 * @param trackPaths      record child indexes from the root under {@link VisitContext#PATH}
 * @param maxDepth        deepest node a traversal will descend to, the root being at depth 0
 */
public record TraversalOptions(boolean trackParents, boolean trackNewParents, boolean trackPaths, int maxDepth) {
    public static final int DEFAULT_MAX_DEPTH = 1000;

    private static final TraversalOptions DEFAULTS = new TraversalOptions(false, false, false, DEFAULT_MAX_DEPTH);

    public TraversalOptions {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, got " + maxDepth);
        }
    }

    public static TraversalOptions defaults() {
        return DEFAULTS;
    }

    public TraversalOptions withTrackParents(boolean trackParents) {
        return new TraversalOptions(trackParents, trackNewParents, trackPaths, maxDepth);
    }

    public TraversalOptions withTrackNewParents(boolean trackNewParents) {
        return new TraversalOptions(trackParents, trackNewParents, trackPaths, maxDepth);
    }

    public TraversalOptions withTrackPaths(boolean trackPaths) {
        return new TraversalOptions(trackParents, trackNewParents, trackPaths, maxDepth);
    }

    public TraversalOptions withMaxDepth(int maxDepth) {
        return new TraversalOptions(trackParents, trackNewParents, trackPaths, maxDepth);
    }
}
