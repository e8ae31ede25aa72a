package org.pragmatica.combinator.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result node populated by a parser: the matched text, ordered children
 * and an optional semantic value.
 *
 * <p>Nodes are mutable and owned by a single parser invocation. A node written
 * by a failed match carries no meaning and must not be read by the caller.
 */
public final class Node {
    private String token;
    private final List<Node> children;
    private Object value;
    private String label;

    public Node() {
        this.token = "";
        this.children = new ArrayList<>();
    }

    public static Node leaf(String token) {
        var node = new Node();
        node.token = token;
        return node;
    }

    // === Token ===

    public String token() {
        return token;
    }

    public void setToken(String token) {
        this.token = Objects.requireNonNull(token, "token");
    }

    // === Children ===

    public List<Node> children() {
        return Collections.unmodifiableList(children);
    }

    public Node child(int index) {
        return children.get(index);
    }

    public int childCount() {
        return children.size();
    }

    /**
     * Append a fresh empty child and return it.
     */
    public Node newChild() {
        var child = new Node();
        children.add(child);
        return child;
    }

    public void addChild(Node child) {
        children.add(Objects.requireNonNull(child, "child"));
    }

    public void removeLastChild() {
        children.remove(children.size() - 1);
    }

    public void setChildren(List<Node> newChildren) {
        children.clear();
        children.addAll(newChildren);
    }

    // === Semantic value ===

    /**
     * Semantic value, or {@code null} when none was attached.
     */
    public Object value() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    public void setValue(Object value) {
        this.value = value;
    }

    /**
     * Semantic value cast to the expected type.
     */
    public <T> T valueAs(Class<T> type) {
        return type.cast(value);
    }

    // === Label ===

    /**
     * Name of the named matcher which produced this node, or {@code null}.
     */
    public String label() {
        return label;
    }

    public boolean hasLabel() {
        return label != null;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    // === Whole-node operations ===

    /**
     * True for an absent result: no text, no children and no value.
     */
    public boolean isEmpty() {
        return token.isEmpty() && children.isEmpty() && value == null;
    }

    public void clear() {
        token = "";
        children.clear();
        value = null;
        label = null;
    }

    /**
     * Overwrite this node with the contents of another one. Children are shared, not copied.
     */
    public void copyFrom(Node other) {
        token = other.token;
        children.clear();
        children.addAll(other.children);
        value = other.value;
        label = other.label;
    }

    /**
     * Depth-first concatenation of the tokens of all leaves below this node.
     * A node without children contributes its own token.
     */
    public String flatten() {
        if (children.isEmpty()) {
            return token;
        }
        var sb = new StringBuilder();
        for (var child : children) {
            sb.append(child.flatten());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("'").append(token).append('\'');
        if (value != null) {
            sb.append(" => ").append(value);
        }
        if (!children.isEmpty()) {
            sb.append(' ').append(children);
        }
        return sb.toString();
    }
}
