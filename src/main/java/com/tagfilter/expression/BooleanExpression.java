package com.tagfilter.expression;

import com.tagfilter.exception.ExpressionStateException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * A boolean expression of values that are connected by ANDs and ORs.
 * <p>
 * The tree is built incrementally by a token consumer that keeps a cursor node, starting at
 * {@link #root()}. Each builder call returns the node to use as cursor for the next token:
 * <pre>
 * BooleanExpression&lt;V, S&gt; root = BooleanExpression.root();
 * BooleanExpression&lt;V, S&gt; cursor = root;
 * cursor = cursor.addValue(a);
 * cursor = cursor.addAnd();
 * cursor = cursor.addValue(b);
 * cursor = cursor.addOr();
 * cursor = cursor.addValue(c);   // root is now "a and b or c"
 * </pre>
 * Precedence (AND binds tighter than OR) is maintained while building, without lookahead.
 * Brackets open a placeholder node via {@link #addOpenBracket()}; the caller restores its
 * saved cursor when the bracket closes.
 * <p>
 * Not thread-safe while being built or normalized. Once finished, {@link #matches(Object)}
 * may be called concurrently.
 *
 * @param <T> Leaf value type
 * @param <S> Subject type the leaf values are matched against
 */
public final class BooleanExpression<T extends BooleanExpressionValue<S>, S> {

    // once set, type and value are final
    private NodeType type;
    private T value;

    private BooleanExpression<T, S> parent;
    private final List<BooleanExpression<T, S>> children = new ArrayList<>();

    private BooleanExpression() {
    }

    /**
     * Create the root node of a new expression tree.
     */
    public static <T extends BooleanExpressionValue<S>, S> BooleanExpression<T, S> root() {
        BooleanExpression<T, S> root = new BooleanExpression<>();
        root.assignType(NodeType.ROOT);
        return root;
    }

    static <T extends BooleanExpressionValue<S>, S> BooleanExpression<T, S> placeholder() {
        return new BooleanExpression<>();
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    /**
     * Get the node type, or empty for a pending placeholder.
     */
    public Optional<NodeType> getType() {
        return Optional.ofNullable(type);
    }

    /**
     * Get the leaf value.
     *
     * @throws ExpressionStateException if this is not a leaf
     */
    public T getValue() {
        if (type != NodeType.LEAF) {
            throw new ExpressionStateException("Only leaf nodes carry a value, node type is " + describeType());
        }
        return value;
    }

    public Optional<BooleanExpression<T, S>> getParent() {
        return Optional.ofNullable(parent);
    }

    /**
     * Get a snapshot of the children.
     */
    public List<BooleanExpression<T, S>> getChildren() {
        return List.copyOf(children);
    }

    public Optional<BooleanExpression<T, S>> getFirstChild() {
        return children.isEmpty() ? Optional.empty() : Optional.of(children.get(0));
    }

    public boolean isAnd() {
        return type == NodeType.AND;
    }

    public boolean isOr() {
        return type == NodeType.OR;
    }

    public boolean isValue() {
        return type == NodeType.LEAF;
    }

    public boolean isRoot() {
        return type == NodeType.ROOT;
    }

    public boolean isPending() {
        return type == null;
    }

    // ---------------------------------------------------------------------
    // Builder protocol
    // ---------------------------------------------------------------------

    /**
     * Continue in an AND group. The last operand added to this node becomes the first
     * operand of the group.
     *
     * @return Cursor for the next token
     */
    public BooleanExpression<T, S> addAnd() {
        if (!isAnd()) {
            BooleanExpression<T, S> newChild = createIntermediateChild();
            newChild.assignType(NodeType.AND);
            return newChild;
        }
        return this;
    }

    /**
     * Continue in an OR group. An AND group that is being built is closed and becomes
     * the operand of the OR.
     *
     * @return Cursor for the next token
     */
    public BooleanExpression<T, S> addOr() {
        BooleanExpression<T, S> node = this;

        if (isAnd()) {
            BooleanExpression<T, S> andParent = requireParent();
            if (andParent.isRoot()) {
                node = createIntermediateParent();
                node.assignType(NodeType.OR);
            } else {
                node = andParent;
            }
        }

        if (!node.isOr()) {
            BooleanExpression<T, S> newChild = node.createIntermediateChild();
            newChild.assignType(NodeType.OR);
            return newChild;
        }
        return node;
    }

    /**
     * Add a leaf value as last child of this node.
     *
     * @return This node, which stays the cursor
     */
    public BooleanExpression<T, S> addValue(T value) {
        Objects.requireNonNull(value, "value");
        BooleanExpression<T, S> child = createChild();
        child.assignType(NodeType.LEAF);
        child.value = value;
        return this;
    }

    /**
     * Open a bracket. The returned placeholder is the cursor for the bracket's contents.
     */
    public BooleanExpression<T, S> addOpenBracket() {
        return createChild();
    }

    private BooleanExpression<T, S> createChild() {
        BooleanExpression<T, S> child = new BooleanExpression<>();
        addChild(child);
        return child;
    }

    private BooleanExpression<T, S> createIntermediateParent() {
        BooleanExpression<T, S> newParent = new BooleanExpression<>();
        BooleanExpression<T, S> oldParent = requireParent();
        oldParent.removeChild(this);
        newParent.addChild(this);
        oldParent.addChild(newParent);
        return newParent;
    }

    private BooleanExpression<T, S> createIntermediateChild() {
        BooleanExpression<T, S> lastChild = removeLastChild();
        BooleanExpression<T, S> newNode = createChild();
        if (lastChild != null) {
            newNode.addChild(lastChild);
        }
        return newNode;
    }

    private BooleanExpression<T, S> requireParent() {
        if (parent == null) {
            throw new ExpressionStateException("Node of type " + describeType() + " has no parent");
        }
        return parent;
    }

    // ---------------------------------------------------------------------
    // Primitive mutators, shared with ExpressionNormalizer
    // ---------------------------------------------------------------------

    void assignType(NodeType newType) {
        if (type != null) {
            throw new ExpressionStateException("Node type already assigned: " + type + ", cannot change to " + newType);
        }
        type = Objects.requireNonNull(newType, "newType");
    }

    void addChild(BooleanExpression<T, S> child) {
        child.parent = this;
        children.add(child);
    }

    void removeChild(BooleanExpression<T, S> child) {
        if (children.remove(child)) {
            child.parent = null;
        }
    }

    private BooleanExpression<T, S> removeLastChild() {
        if (children.isEmpty()) {
            return null;
        }
        BooleanExpression<T, S> last = children.remove(children.size() - 1);
        last.parent = null;
        return last;
    }

    int childCount() {
        return children.size();
    }

    BooleanExpression<T, S> childAt(int index) {
        return children.get(index);
    }

    /**
     * Replace the child at the given position with the given nodes, in order.
     * The replaced child is detached.
     */
    void replaceChildAt(int index, List<BooleanExpression<T, S>> with) {
        BooleanExpression<T, S> removed = children.remove(index);
        removed.parent = null;
        int position = index;
        for (BooleanExpression<T, S> node : with) {
            node.parent = this;
            children.add(position++, node);
        }
    }

    void replaceChild(BooleanExpression<T, S> replace, BooleanExpression<T, S> with) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == replace) {
                replaceChildAt(i, List.of(with));
                return;
            }
        }
    }

    /**
     * Detach and return all children of this node.
     */
    List<BooleanExpression<T, S>> detachChildren() {
        List<BooleanExpression<T, S>> detached = new ArrayList<>(children);
        children.clear();
        for (BooleanExpression<T, S> child : detached) {
            child.parent = null;
        }
        return detached;
    }

    boolean hasSameTypeAs(BooleanExpression<T, S> other) {
        return type == other.type;
    }

    // ---------------------------------------------------------------------
    // Evaluation and normalization
    // ---------------------------------------------------------------------

    /**
     * Evaluate this expression against a subject.
     *
     * @param subject Subject to test
     * @return true if the subject satisfies the expression
     * @throws ExpressionStateException if the tree still contains a placeholder that is not
     *                                  a single bracketed operand
     */
    public boolean matches(S subject) {
        if (type == null) {
            // an unflattened bracket group
            if (children.size() != 1) {
                throw new ExpressionStateException(
                        "Cannot match a pending node with " + children.size() + " children");
            }
            return children.get(0).matches(subject);
        }
        return switch (type) {
            case LEAF -> value.matches(subject);
            case OR -> children.stream().anyMatch(c -> c.matches(subject));
            case AND -> children.stream().allMatch(c -> c.matches(subject));
            case ROOT -> !children.isEmpty() && children.get(0).matches(subject);
        };
    }

    /**
     * Remove unnecessary depth in the expression tree: placeholders left by superfluous
     * brackets, and nested nodes with the same operator as their parent.
     */
    public void flatten() {
        ExpressionNormalizer.flatten(this);
    }

    /**
     * Expand the expression so that all ANDs have only leaves, i.e. an OR of ANDs.
     */
    public void expand() {
        ExpressionNormalizer.expand(this);
    }

    /**
     * Deep copy of this node and its descendants. Leaf values are shared, not copied.
     * The copy has no parent.
     */
    public BooleanExpression<T, S> copy() {
        BooleanExpression<T, S> result = new BooleanExpression<>();
        result.type = type;
        result.value = value;
        for (BooleanExpression<T, S> child : children) {
            result.addChild(child.copy());
        }
        return result;
    }

    private String describeType() {
        return type != null ? type.toString() : "PENDING";
    }

    @Override
    public String toString() {
        if (type == NodeType.LEAF) {
            return value.toString();
        }

        boolean bracketed = isOr() && parent != null && !parent.isRoot();
        String separator = type != null ? " " + type.toString().toLowerCase(Locale.US) + " " : " ";

        StringBuilder builder = new StringBuilder();
        if (bracketed) {
            builder.append('(');
        }
        boolean first = true;
        for (BooleanExpression<T, S> child : children) {
            if (first) {
                first = false;
            } else {
                builder.append(separator);
            }
            builder.append(child);
        }
        if (bracketed) {
            builder.append(')');
        }
        return builder.toString();
    }
}
