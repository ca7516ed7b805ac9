package com.querytree.tree;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Variant tags of the query tree, each with its declared parent kind.
 * Abstract kinds are never reported by a node, they only exist so that
 * handlers can be registered for a whole family of variants.
 */
public enum NodeKind {
    TERM(null, true),
    WORD(TERM),
    PHRASE(TERM),
    REGEX(TERM),

    BASE_GROUP(null, true),
    GROUP(BASE_GROUP),
    FIELD_GROUP(BASE_GROUP),

    BASE_APPROX(null, true),
    PROXIMITY(BASE_APPROX),
    FUZZY(BASE_APPROX),

    BOOST(null),
    SEARCH_FIELD(null),
    RANGE(null),

    BASE_OPERATION(null, true),
    AND_OPERATION(BASE_OPERATION),
    OR_OPERATION(BASE_OPERATION),
    UNKNOWN_OPERATION(BASE_OPERATION),

    UNARY(null, true),
    NOT(UNARY),
    PLUS(UNARY),
    PROHIBIT(UNARY),

    NONE_ITEM(null);

    private final NodeKind parent;
    private final boolean abstractKind;
    private final ImmutableList<NodeKind> lineage;
    private final String variantName;

    NodeKind(NodeKind parent) {
        this(parent, false);
    }

    NodeKind(NodeKind parent, boolean abstractKind) {
        this.parent = parent;
        this.abstractKind = abstractKind;
        this.lineage = parent == null
            ? Lists.immutable.of(this)
            : Lists.immutable.of(this).newWithAll(parent.lineage);
        this.variantName = toVariantName(name());
    }

    public NodeKind parent() {
        return parent;
    }

    public boolean isAbstract() {
        return abstractKind;
    }

    /**
     * This kind followed by its declared ancestors, most specific first.
     */
    public ImmutableList<NodeKind> lineage() {
        return lineage;
    }

    public boolean isA(NodeKind other) {
        return lineage.contains(other);
    }

    /**
     * CamelCase name of the variant, e.g. {@code BaseOperation}.
     */
    public String variantName() {
        return variantName;
    }

    private static String toVariantName(String constant) {
        StringBuilder sb = new StringBuilder(constant.length());
        for (String part : constant.split("_")) {
            sb.append(part.charAt(0)).append(part.substring(1).toLowerCase());
        }
        return sb.toString();
    }
}
