package com.querytree.tree;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;

/**
 * A node of a parsed search query.
 *
 * <p>Generic traversal code only ever goes through {@link #children()} and
 * {@link #withChildren(ImmutableList)}; whatever other attributes a node
 * carries are copied over untouched when it is rebuilt.
 */
public interface Item {
    Item NONE_ITEM = NoneItem.NONE_ITEM;

    NodeKind kind();

    ImmutableList<Item> children();

    /**
     * Returns a node of the same variant holding {@code children}, every
     * other attribute being taken from this node.
     *
     * @throws IllegalArgumentException if the variant cannot hold that many children
     */
    Item withChildren(ImmutableList<Item> children);

    private static Item onlyChild(Item node, ImmutableList<Item> children) {
        if (children.size() != 1) {
            throw new IllegalArgumentException(
                node.kind().variantName() + " expects exactly 1 child, got " + children.size());
        }
        return children.get(0);
    }

    // Terms

    interface Term extends Item {
        String value();

        @Override
        default ImmutableList<Item> children() {
            return Lists.immutable.empty();
        }

        @Override
        default Item withChildren(ImmutableList<Item> children) {
            if (children.notEmpty()) {
                throw new IllegalArgumentException(
                    kind().variantName() + " cannot have children, got " + children.size());
            }
            return this;
        }
    }

    record Word(String value) implements Term {
        public Word {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.WORD;
        }
    }

    record Phrase(String value) implements Term {
        public Phrase {
            Objects.requireNonNull(value, "value");
            if (value.length() < 2 || !value.startsWith("\"") || !value.endsWith("\"")) {
                throw new IllegalArgumentException("Phrase must be enclosed in double quotes: " + value);
            }
        }

        @Override
        public NodeKind kind() {
            return NodeKind.PHRASE;
        }
    }

    record Regex(String value) implements Term {
        public Regex {
            Objects.requireNonNull(value, "value");
            if (value.length() < 2 || !value.startsWith("/") || !value.endsWith("/")) {
                throw new IllegalArgumentException("Regex must be enclosed in slashes: " + value);
            }
        }

        @Override
        public NodeKind kind() {
            return NodeKind.REGEX;
        }
    }

    // Groups

    interface BaseGroup extends Item {
        Item expr();

        @Override
        default ImmutableList<Item> children() {
            return Lists.immutable.of(expr());
        }
    }

    record Group(Item expr) implements BaseGroup {
        public Group {
            Objects.requireNonNull(expr, "expr");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.GROUP;
        }

        @Override
        public Item withChildren(ImmutableList<Item> children) {
            return new Group(onlyChild(this, children));
        }
    }

    // the parenthesised part of title:(a OR b)
    record FieldGroup(Item expr) implements BaseGroup {
        public FieldGroup {
            Objects.requireNonNull(expr, "expr");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FIELD_GROUP;
        }

        @Override
        public Item withChildren(ImmutableList<Item> children) {
            return new FieldGroup(onlyChild(this, children));
        }
    }

    // Approximations: "a b"~2 and word~0.8

    interface BaseApprox extends Item {
        Item term();

        @Override
        default ImmutableList<Item> children() {
            return Lists.immutable.of(term());
        }
    }

    record Proximity(Item term, int degree) implements BaseApprox {
        public static final int DEFAULT_DEGREE = 1;

        public Proximity {
            Objects.requireNonNull(term, "term");
            if (degree < 0) {
                throw new IllegalArgumentException("Proximity degree must not be negative: " + degree);
            }
        }

        public Proximity(Item term) {
            this(term, DEFAULT_DEGREE);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.PROXIMITY;
        }

        @Override
        public Item withChildren(ImmutableList<Item> children) {
            return new Proximity(onlyChild(this, children), degree);
        }
    }

    record Fuzzy(Item term, double degree) implements BaseApprox {
        public static final double DEFAULT_DEGREE = 0.5;

        public Fuzzy {
            Objects.requireNonNull(term, "term");
            if (degree < 0) {
                throw new IllegalArgumentException("Fuzzy degree must not be negative: " + degree);
            }
        }

        public Fuzzy(Item term) {
            this(term, DEFAULT_DEGREE);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FUZZY;
        }

        @Override
        public Item withChildren(ImmutableList<Item> children) {
            return new Fuzzy(onlyChild(this, children), degree);
        }
    }

    record Boost(Item expr, double force) implements Item {
        public Boost {
            Objects.requireNonNull(expr, "expr");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.BOOST;
        }

        @Override
        public ImmutableList<Item> children() {
            return Lists.immutable.of(expr);
        }

        @Override
        public Item withChildren(ImmutableList<Item> children) {
            return new Boost(onlyChild(this, children), force);
        }
    }

    record SearchField(String name, Item expr) implements Item {
        public SearchField {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(expr, "expr");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.SEARCH_FIELD;
        }

        @Override
        public ImmutableList<Item> children() {
            return Lists.immutable.of(expr);
        }

        @Override
        public Item withChildren(ImmutableList<Item> children) {
            return new SearchField(name, onlyChild(this, children));
        }
    }

    record Range(Item low, Item high, boolean includeLow, boolean includeHigh) implements Item {
        public Range {
            Objects.requireNonNull(low, "low");
            Objects.requireNonNull(high, "high");
        }

        public Range(Item low, Item high) {
            this(low, high, true, true);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.RANGE;
        }

        @Override
        public ImmutableList<Item> children() {
            return Lists.immutable.of(low, high);
        }

        @Override
        public Item withChildren(ImmutableList<Item> children) {
            if (children.size() != 2) {
                throw new IllegalArgumentException("Range expects exactly 2 children, got " + children.size());
            }
            return new Range(children.get(0), children.get(1), includeLow, includeHigh);
        }
    }

    // Boolean operations

    interface BaseOperation extends Item {
        ImmutableList<Item> operands();

        @Override
        default ImmutableList<Item> children() {
            return operands();
        }
    }

    record AndOperation(ImmutableList<Item> operands) implements BaseOperation {
        public AndOperation {
            Objects.requireNonNull(operands, "operands");
        }

        public AndOperation(Item... operands) {
            this(Lists.immutable.of(operands));
        }

        @Override
        public NodeKind kind() {
            return NodeKind.AND_OPERATION;
        }

        @Override
        public Item withChildren(ImmutableList<Item> children) {
            return new AndOperation(children);
        }
    }

    record OrOperation(ImmutableList<Item> operands) implements BaseOperation {
        public OrOperation {
            Objects.requireNonNull(operands, "operands");
        }

        public OrOperation(Item... operands) {
            this(Lists.immutable.of(operands));
        }

        @Override
        public NodeKind kind() {
            return NodeKind.OR_OPERATION;
        }

        @Override
        public Item withChildren(ImmutableList<Item> children) {
            return new OrOperation(children);
        }
    }

    // Implicit operator between juxtaposed terms: "foo bar"
    record UnknownOperation(ImmutableList<Item> operands) implements BaseOperation {
        public UnknownOperation {
            Objects.requireNonNull(operands, "operands");
        }

        public UnknownOperation(Item... operands) {
            this(Lists.immutable.of(operands));
        }

        @Override
        public NodeKind kind() {
            return NodeKind.UNKNOWN_OPERATION;
        }

        @Override
        public Item withChildren(ImmutableList<Item> children) {
            return new UnknownOperation(children);
        }
    }

    // Unary prefixes: NOT a, +a, -a

    interface Unary extends Item {
        Item operand();

        @Override
        default ImmutableList<Item> children() {
            return Lists.immutable.of(operand());
        }
    }

    record Not(Item operand) implements Unary {
        public Not {
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.NOT;
        }

        @Override
        public Item withChildren(ImmutableList<Item> children) {
            return new Not(onlyChild(this, children));
        }
    }

    record Plus(Item operand) implements Unary {
        public Plus {
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.PLUS;
        }

        @Override
        public Item withChildren(ImmutableList<Item> children) {
            return new Plus(onlyChild(this, children));
        }
    }

    record Prohibit(Item operand) implements Unary {
        public Prohibit {
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.PROHIBIT;
        }

        @Override
        public Item withChildren(ImmutableList<Item> children) {
            return new Prohibit(onlyChild(this, children));
        }
    }

    /**
     * Placeholder for an operand that is syntactically present but carries no value.
     */
    enum NoneItem implements Item {
        NONE_ITEM;

        @Override
        public NodeKind kind() {
            return NodeKind.NONE_ITEM;
        }

        @Override
        public ImmutableList<Item> children() {
            return Lists.immutable.empty();
        }

        @Override
        public Item withChildren(ImmutableList<Item> children) {
            if (children.notEmpty()) {
                throw new IllegalArgumentException("NoneItem cannot have children, got " + children.size());
            }
            return this;
        }
    }
}
