package com.querytree.visitor;

import com.querytree.tree.Item;
import com.querytree.tree.NodeKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Maps;

import java.util.Objects;
import java.util.Optional;

/**
 * Table of handlers keyed by {@link NodeKind}.
 *
 * <p>A node is resolved by walking its kind's lineage, most specific first,
 * and taking the first kind that has a handler. A handler registered for an
 * abstract kind such as {@link NodeKind#BASE_OPERATION} therefore applies to
 * every operation variant that has no handler of its own.
 *
 * @param <H> handler type
 */
public class NodeDispatcher<H> {
    private static final Logger LOG = LogManager.getLogger(NodeDispatcher.class);

    private final MutableMap<NodeKind, H> handlers = Maps.mutable.empty();

    public void register(NodeKind kind, H handler) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(handler, "handler");
        H previous = handlers.put(kind, handler);
        if (previous != null) {
            LOG.debug("Replaced handler for {}", kind.variantName());
        } else {
            LOG.debug("Registered handler for {}", kind.variantName());
        }
    }

    public Optional<H> resolve(Item node) {
        return resolve(node.kind());
    }

    public Optional<H> resolve(NodeKind kind) {
        for (NodeKind candidate : kind.lineage()) {
            H handler = handlers.get(candidate);
            if (handler != null) {
                return Optional.of(handler);
            }
        }
        LOG.trace("No handler for {}, falling back to generic visit", kind.variantName());
        return Optional.empty();
    }

    public boolean isRegistered(NodeKind kind) {
        return handlers.containsKey(kind);
    }

    public ImmutableSet<NodeKind> registeredKinds() {
        return handlers.keysView().toSet().toImmutable();
    }
}
