package com.tagfilter.expression;

import com.tagfilter.exception.ExpressionStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * In-place rewrites of a {@link BooleanExpression} tree.
 * <ul>
 *   <li>flatten: remove bracket placeholders and merge nested nodes of the same operator</li>
 *   <li>expand: distribute AND over OR until every AND only has leaves</li>
 * </ul>
 */
final class ExpressionNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ExpressionNormalizer.class);

    private ExpressionNormalizer() {
    }

    static <T extends BooleanExpressionValue<S>, S> void flatten(BooleanExpression<T, S> node) {
        removeEmptyNodes(node);
        mergeNodesWithSameOperator(node);
    }

    static <T extends BooleanExpressionValue<S>, S> void expand(BooleanExpression<T, S> node) {
        // placeholders would hide an OR from its enclosing AND
        flatten(node);
        moveDownAnds(node);
        mergeNodesWithSameOperator(node);
    }

    /**
     * Remove placeholders from superfluous brackets.
     */
    private static <T extends BooleanExpressionValue<S>, S> void removeEmptyNodes(BooleanExpression<T, S> node) {
        int i = 0;
        while (i < node.childCount()) {
            BooleanExpression<T, S> child = node.childAt(i);
            if (child.isPending() && child.childCount() == 1) {
                // the node spliced in at i is checked again
                node.replaceChildAt(i, child.detachChildren());
            } else {
                removeEmptyNodes(child);
                i++;
            }
        }
    }

    /**
     * Merge children recursively which have the same operator as their parent.
     */
    static <T extends BooleanExpressionValue<S>, S> void mergeNodesWithSameOperator(BooleanExpression<T, S> node) {
        if (node.isValue()) {
            return;
        }

        int i = 0;
        while (i < node.childCount()) {
            BooleanExpression<T, S> child = node.childAt(i);
            mergeNodesWithSameOperator(child);

            if (child.hasSameTypeAs(node)) {
                List<BooleanExpression<T, S>> grandChildren = child.detachChildren();
                node.replaceChildAt(i, grandChildren);
                i += grandChildren.size();
            } else {
                i++;
            }
        }
    }

    private static <T extends BooleanExpressionValue<S>, S> void moveDownAnds(BooleanExpression<T, S> node) {
        if (node.isValue()) {
            return;
        }

        if (node.isAnd()) {
            BooleanExpression<T, S> or = removeFirstOr(node);
            if (or != null) {
                BooleanExpression<T, S> parent = node.getParent().orElseThrow(
                        () -> new ExpressionStateException("Cannot distribute a detached AND node: " + node));
                log.trace("Distributing '{}' over '{}'", node, or);

                // the OR moves into the place of the AND, which is now a template
                parent.replaceChild(node, or);
                addCopiesInBetweenChildrenOf(node, or);
                mergeNodesWithSameOperator(or);
                moveDownAnds(or);
                return;
            }
        }

        for (BooleanExpression<T, S> child : node.getChildren()) {
            moveDownAnds(child);
        }
    }

    /**
     * Find the first OR child, detach it and leave a placeholder in its slot.
     *
     * @return The detached OR, or null if there is none
     */
    private static <T extends BooleanExpressionValue<S>, S> BooleanExpression<T, S> removeFirstOr(
            BooleanExpression<T, S> and) {
        for (int i = 0; i < and.childCount(); i++) {
            BooleanExpression<T, S> child = and.childAt(i);
            if (child.isOr()) {
                and.replaceChildAt(i, List.of(BooleanExpression.placeholder()));
                return child;
            }
        }
        return null;
    }

    /**
     * Replace each child of the OR by a copy of the template that takes the child in
     * place of its placeholder.
     */
    private static <T extends BooleanExpressionValue<S>, S> void addCopiesInBetweenChildrenOf(
            BooleanExpression<T, S> template, BooleanExpression<T, S> or) {
        for (int i = 0; i < or.childCount(); i++) {
            BooleanExpression<T, S> child = or.childAt(i);
            BooleanExpression<T, S> clone = template.copy();
            or.replaceChildAt(i, List.of(clone));
            replacePlaceholder(clone, child);
        }
    }

    private static <T extends BooleanExpressionValue<S>, S> void replacePlaceholder(
            BooleanExpression<T, S> node, BooleanExpression<T, S> with) {
        for (int i = 0; i < node.childCount(); i++) {
            if (node.childAt(i).isPending()) {
                node.replaceChildAt(i, List.of(with));
                return;
            }
        }
        throw new ExpressionStateException("No placeholder found in " + node);
    }
}
