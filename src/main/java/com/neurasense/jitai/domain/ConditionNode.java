package com.neurasense.jitai.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable boolean expression tree evaluated against a tailoring context.
 * <p>
 * A node is either a combinator ({@link Kind#AND}, {@link Kind#OR} over an ordered list of
 * children, {@link Kind#NOT} over one child) or a {@link Kind#LEAF} wrapping a {@link Condition}.
 * Children are owned; there are no back-references, so a tree built through the factories
 * is acyclic by construction.
 */
public final class ConditionNode {

    public enum Kind {
        AND, OR, NOT, LEAF
    }

    private static final ConditionNode ALWAYS = new ConditionNode(Kind.AND, List.of(), null);

    private final Kind kind;
    private final List<ConditionNode> children;
    private final Condition leaf;

    private ConditionNode(Kind kind, List<ConditionNode> children, Condition leaf) {
        this.kind = kind;
        this.children = children;
        this.leaf = leaf;
    }

    public static ConditionNode allOf(List<ConditionNode> children) {
        return new ConditionNode(Kind.AND, List.copyOf(children), null);
    }

    public static ConditionNode allOf(ConditionNode... children) {
        return allOf(List.of(children));
    }

    public static ConditionNode anyOf(List<ConditionNode> children) {
        return new ConditionNode(Kind.OR, List.copyOf(children), null);
    }

    public static ConditionNode anyOf(ConditionNode... children) {
        return anyOf(List.of(children));
    }

    /**
     * Negates a child. A {@code null} child yields a malformed NOT, which evaluates false.
     */
    public static ConditionNode not(ConditionNode child) {
        return new ConditionNode(Kind.NOT, child == null ? List.of() : List.of(child), null);
    }

    public static ConditionNode leaf(Condition condition) {
        return new ConditionNode(Kind.LEAF, List.of(), Objects.requireNonNull(condition, "condition"));
    }

    public static ConditionNode leaf(String field, String operator, Object value) {
        return leaf(new Condition(field, operator, value));
    }

    /**
     * The empty conjunction. Used for rules without a condition.
     */
    public static ConditionNode always() {
        return ALWAYS;
    }

    public Kind getKind() {
        return kind;
    }

    public List<ConditionNode> getChildren() {
        return children;
    }

    public Condition getLeaf() {
        return leaf;
    }

    /**
     * Whether this tree has more than {@code levels} levels; a single leaf has one level.
     * Descends at most {@code levels + 1} nodes deep, so arbitrarily deep trees are safe to check.
     */
    public boolean deeperThan(int levels) {
        if (levels <= 0) {
            return true;
        }
        for (ConditionNode child : children) {
            if (child.deeperThan(levels - 1)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Renders the node in the rule document shape, e.g. {"AND": [{"field": ..., "op": ..., "value": ...}]}.
     */
    @JsonValue
    public Object toDocument() {
        return switch (kind) {
            case LEAF -> {
                Map<String, Object> doc = new LinkedHashMap<>();
                doc.put("field", leaf.getField());
                doc.put("op", leaf.getOperator().symbol());
                doc.put("value", leaf.getValue());
                yield doc;
            }
            case NOT -> Map.of("NOT", children.isEmpty() ? Map.of() : children.get(0).toDocument());
            case AND, OR -> Map.of(kind.name(), children.stream().map(ConditionNode::toDocument).toList());
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConditionNode that = (ConditionNode) o;
        return kind == that.kind &&
               Objects.equals(children, that.children) &&
               Objects.equals(leaf, that.leaf);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, children, leaf);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case LEAF -> leaf.toString();
            case NOT -> "NOT(" + (children.isEmpty() ? "" : children.get(0)) + ")";
            case AND, OR -> kind.name() + children;
        };
    }
}
