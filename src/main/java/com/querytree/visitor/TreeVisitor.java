package com.querytree.visitor;

import com.querytree.tree.Item;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Read-only traversal of a query tree.
 *
 * <p>Every node is handed to the most specific handler registered for its
 * kind, or to {@link #genericVisit(Item, VisitContext)} when there is none.
 * Results are whatever the handlers emit, in the order they emit them; a
 * visitor without handlers emits nothing.
 *
 * <pre>{@code
 * class WordCollector extends TreeVisitor<String> {
 *     WordCollector() {
 *         on(NodeKind.WORD, (node, context) -> Stream.of(((Item.Word) node).value()));
 *     }
 * }
 * }</pre>
 *
 * @param <R> result type
 */
public class TreeVisitor<R> extends AbstractTreeWalker<TreeVisitor.Handler<R>> {

    @FunctionalInterface
    public interface Handler<R> {
        Stream<R> handle(Item node, VisitContext context);
    }

    public TreeVisitor() {
        this(TraversalOptions.defaults());
    }

    public TreeVisitor(boolean trackParents) {
        this(TraversalOptions.defaults().withTrackParents(trackParents));
    }

    public TreeVisitor(TraversalOptions options) {
        super(options);
    }

    public Stream<R> visit(Item tree) {
        return visit(tree, null);
    }

    /**
     * Lazily visits {@code tree}. Handlers below the root only run while the
     * returned stream is consumed, and their exceptions surface from the
     * terminal operation.
     *
     * @param context initial context, {@code null} meaning empty
     */
    public Stream<R> visit(Item tree, VisitContext context) {
        Objects.requireNonNull(tree, "tree");
        return visitNode(tree, rootContext(context));
    }

    public ImmutableList<R> visitAll(Item tree) {
        return visitAll(tree, null);
    }

    public ImmutableList<R> visitAll(Item tree, VisitContext context) {
        return Lists.immutable.fromStream(visit(tree, context));
    }

    protected Stream<R> visitNode(Item node, VisitContext context) {
        Optional<Handler<R>> handler = handlerFor(node);
        if (handler.isPresent()) {
            return handler.get().handle(node, context);
        }
        return genericVisit(node, context);
    }

    /**
     * Emits nothing for {@code node} itself and visits its children in order.
     * Handlers call this to keep descending after emitting their own results.
     */
    protected Stream<R> genericVisit(Item node, VisitContext context) {
        return StreamSupport.stream(new ChildResults(node, context), false);
    }

    /**
     * Pulls the results of one child at a time, opening the next child's
     * stream only once the previous one is drained. Nesting costs a couple of
     * stack frames per tree level.
     */
    private final class ChildResults implements Spliterator<R> {
        private final Item node;
        private final VisitContext context;
        private final ImmutableList<Item> children;
        private int next;
        private Spliterator<R> current;

        ChildResults(Item node, VisitContext context) {
            this.node = node;
            this.context = context;
            this.children = node.children();
        }

        @Override
        public boolean tryAdvance(Consumer<? super R> action) {
            while (true) {
                if (current != null && current.tryAdvance(action)) {
                    return true;
                }
                if (next >= children.size()) {
                    current = null;
                    return false;
                }
                int index = next++;
                current = visitNode(children.get(index), childContext(node, index, context)).spliterator();
            }
        }

        @Override
        public Spliterator<R> trySplit() {
            return null;
        }

        @Override
        public long estimateSize() {
            return Long.MAX_VALUE;
        }

        @Override
        public int characteristics() {
            return ORDERED;
        }
    }
}
