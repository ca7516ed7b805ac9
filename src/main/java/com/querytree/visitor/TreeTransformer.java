package com.querytree.visitor;

import com.querytree.tree.Item;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;
import java.util.Optional;

/**
 * Rewrites a query tree bottom-up into a new tree.
 *
 * <p>A handler replaces the node it receives with a list of nodes: an empty
 * list removes it, a single node keeps or substitutes it, several nodes take
 * its place side by side in the parent. Nodes without a handler are rebuilt
 * by {@link #rebuild(Item, VisitContext)}, which splices the children's
 * replacement lists into the new child list in their original order.
 *
 * <p>A typical operation handler rebuilds first and then decides on the
 * remaining operand count:
 *
 * <pre>{@code
 * on(NodeKind.BASE_OPERATION, (node, context) -> {
 *     Item rebuilt = rebuild(node, context);
 *     switch (rebuilt.children().size()) {
 *         case 0: return Lists.immutable.empty();
 *         case 1: return rebuilt.children();
 *         default: return Lists.immutable.of(rebuilt);
 *     }
 * });
 * }</pre>
 *
 * <p>The input tree is never modified.
 */
public class TreeTransformer extends AbstractTreeWalker<TreeTransformer.Handler> {
    private static final Logger LOG = LogManager.getLogger(TreeTransformer.class);

    @FunctionalInterface
    public interface Handler {
        ImmutableList<Item> handle(Item node, VisitContext context);
    }

    public TreeTransformer() {
        this(TraversalOptions.defaults());
    }

    public TreeTransformer(boolean trackParents, boolean trackNewParents) {
        this(TraversalOptions.defaults().withTrackParents(trackParents).withTrackNewParents(trackNewParents));
    }

    public TreeTransformer(TraversalOptions options) {
        super(options);
    }

    public Item visit(Item tree) {
        return visit(tree, null);
    }

    /**
     * Rewrites {@code tree}.
     *
     * @param context initial context, {@code null} meaning empty
     * @throws TransformationArityException if the root was replaced by zero or several nodes
     */
    public Item visit(Item tree, VisitContext context) {
        Objects.requireNonNull(tree, "tree");
        ImmutableList<Item> result = visitNode(tree, rootContext(context));
        if (result.size() != 1) {
            LOG.debug("Rewriting {} produced {} nodes", tree.kind().variantName(), result.size());
            throw new TransformationArityException(result.size());
        }
        return result.get(0);
    }

    /**
     * Replacement nodes for {@code node}, from its handler or from
     * {@link #genericVisit(Item, VisitContext)}.
     */
    protected ImmutableList<Item> visitNode(Item node, VisitContext context) {
        Optional<Handler> handler = handlerFor(node);
        if (handler.isPresent()) {
            return handler.get().handle(node, context);
        }
        return genericVisit(node, context);
    }

    protected ImmutableList<Item> genericVisit(Item node, VisitContext context) {
        return Lists.immutable.of(rebuild(node, context));
    }

    /**
     * Visits every child of {@code node} and builds a copy of it from the
     * concatenated replacements.
     *
     * @throws IllegalArgumentException if {@code node}'s variant cannot hold the resulting number of children
     */
    protected final Item rebuild(Item node, VisitContext context) {
        ImmutableList<Item> children = node.children();
        MutableList<Item> newChildren = Lists.mutable.empty();
        children.forEachWithIndex((child, index) ->
            newChildren.addAllIterable(visitNode(child, childContext(node, index, context))));
        return node.withChildren(newChildren.toImmutable());
    }

    @Override
    protected VisitContext childContext(Item node, int index, VisitContext context) {
        VisitContext child = super.childContext(node, index, context);
        if (options().trackNewParents()) {
            child = child.withReserved(VisitContext.NEW_PARENTS, context.newParents().newWith(node));
        }
        return child;
    }
}
