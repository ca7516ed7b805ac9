package com.querytree.visitor;

import com.querytree.tree.Item;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.impl.factory.Sets;

import java.util.Map;
import java.util.Objects;

/**
 * Immutable key/value context handed to every handler during a traversal.
 *
 * <p>Caller keys are passed down unchanged. The walker owns three reserved
 * keys, {@link #PARENTS}, {@link #NEW_PARENTS} and {@link #PATH}, which are
 * only present when the corresponding tracking option is enabled.
 */
public final class VisitContext {
    public static final String PARENTS = "parents";
    public static final String NEW_PARENTS = "new_parents";
    public static final String PATH = "path";

    private static final ImmutableSet<String> RESERVED_KEYS = Sets.immutable.of(PARENTS, NEW_PARENTS, PATH);
    private static final VisitContext EMPTY = new VisitContext(Maps.immutable.empty(), 0);

    private final ImmutableMap<String, Object> values;
    private final int depth;

    private VisitContext(ImmutableMap<String, Object> values, int depth) {
        this.values = values;
        this.depth = depth;
    }

    public static VisitContext empty() {
        return EMPTY;
    }

    public static VisitContext of(String key, Object value) {
        return EMPTY.with(key, value);
    }

    public static VisitContext of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        values.keySet().forEach(VisitContext::checkNotReserved);
        return new VisitContext(Maps.mutable.<String, Object>ofMap(values).toImmutable(), 0);
    }

    /**
     * Derives a context with one more caller key, e.g. to hand a subtree
     * some information its ancestors computed.
     *
     * @throws IllegalArgumentException if {@code key} is one of the reserved keys
     */
    public VisitContext with(String key, Object value) {
        checkNotReserved(key);
        return new VisitContext(values.newWithKeyValue(key, value), depth);
    }

    VisitContext withReserved(String key, Object value) {
        return new VisitContext(values.newWithKeyValue(key, value), depth);
    }

    VisitContext descend() {
        return new VisitContext(values, depth + 1);
    }

    public Object get(String key) {
        return values.get(key);
    }

    public Object getOrDefault(String key, Object defaultValue) {
        return values.containsKey(key) ? values.get(key) : defaultValue;
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    /**
     * Strict ancestors of the current node in the original tree, root first.
     * Empty at the root, and at every depth when parent tracking is off.
     */
    public ImmutableList<Item> parents() {
        return listUnder(PARENTS);
    }

    /**
     * Ancestors along the tree being rebuilt by a {@link TreeTransformer}.
     */
    public ImmutableList<Item> newParents() {
        return listUnder(NEW_PARENTS);
    }

    /**
     * Child indexes leading from the root to the current node.
     */
    public ImmutableList<Integer> path() {
        return listUnder(PATH);
    }

    /**
     * Number of edges between the root and the current node.
     */
    public int depth() {
        return depth;
    }

    public ImmutableMap<String, Object> toMap() {
        return values;
    }

    // Only the walker writes reserved keys, always with lists of the matching element type
    private <T> ImmutableList<T> listUnder(String key) {
        Object list = values.get(key);
        return list == null ? Lists.immutable.empty() : (ImmutableList<T>) list;
    }

    private static void checkNotReserved(String key) {
        Objects.requireNonNull(key, "key");
        if (RESERVED_KEYS.contains(key)) {
            throw new IllegalArgumentException("Context key is reserved for traversal tracking: " + key);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VisitContext other)) {
            return false;
        }
        return depth == other.depth && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values, depth);
    }

    @Override
    public String toString() {
        return "VisitContext" + values + "@" + depth;
    }
}
