package com.querytree.visitor;

import com.querytree.tree.Item;
import com.querytree.tree.NodeKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;
import java.util.Optional;

/**
 * Dispatch and context bookkeeping shared by the visitor and the transformer.
 *
 * <p>Subclasses register their handlers from their constructor with
 * {@link #on(NodeKind, Object)}; once constructed a walker holds no mutable
 * state, so a single instance may run any number of traversals.
 *
 * @param <H> handler type
 */
public abstract class AbstractTreeWalker<H> {
    private static final Logger LOG = LogManager.getLogger(AbstractTreeWalker.class);

    private final NodeDispatcher<H> dispatcher = new NodeDispatcher<>();
    private final TraversalOptions options;

    protected AbstractTreeWalker(TraversalOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public TraversalOptions options() {
        return options;
    }

    protected final void on(NodeKind kind, H handler) {
        dispatcher.register(kind, handler);
    }

    protected final Optional<H> handlerFor(Item node) {
        return dispatcher.resolve(node);
    }

    protected VisitContext rootContext(VisitContext context) {
        VisitContext root = context == null ? VisitContext.empty() : context;
        if (options.trackPaths()) {
            root = root.withReserved(VisitContext.PATH, Lists.immutable.<Integer>empty());
        }
        return root;
    }

    /**
     * Context for the {@code index}-th child of {@code node}: the parent's
     * context, one level deeper, with the tracked chains extended.
     *
     * @throws TreeDepthExceededException when the child would sit below {@link TraversalOptions#maxDepth()}
     */
    protected VisitContext childContext(Item node, int index, VisitContext context) {
        if (context.depth() >= options.maxDepth()) {
            LOG.debug("Refusing to descend below {} at depth {}", node.kind().variantName(), context.depth());
            throw new TreeDepthExceededException(options.maxDepth());
        }
        VisitContext child = context.descend();
        if (options.trackParents()) {
            child = child.withReserved(VisitContext.PARENTS, context.parents().newWith(node));
        }
        if (options.trackPaths()) {
            child = child.withReserved(VisitContext.PATH, context.path().newWith(index));
        }
        return child;
    }
}
