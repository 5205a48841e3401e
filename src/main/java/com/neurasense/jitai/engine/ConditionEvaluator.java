package com.neurasense.jitai.engine;

import com.neurasense.jitai.domain.Condition;
import com.neurasense.jitai.domain.ConditionNode;
import com.neurasense.jitai.domain.TailoringContext;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Evaluates condition trees against a tailoring context.
 * <p>
 * Stateless and side-effect free; one instance is shared by all concurrent decisions.
 * Unresolvable paths, type mismatches and malformed NOT nodes evaluate to false.
 */
@ApplicationScoped
public class ConditionEvaluator {

    private static final Logger LOG = Logger.getLogger(ConditionEvaluator.class);

    /**
     * Deepest tree, counted in levels, that is evaluated. The loader rejects deeper trees;
     * this is checked again here for trees built in code.
     */
    public static final int MAX_DEPTH = 20;

    public boolean evaluate(ConditionNode node, TailoringContext context) {
        if (node == null) {
            return false;
        }
        if (node.deeperThan(MAX_DEPTH)) {
            LOG.warnf("Condition tree deeper than %d levels evaluated as false", MAX_DEPTH);
            return false;
        }
        return evaluate(node, context, 1);
    }

    private boolean evaluate(ConditionNode node, TailoringContext context, int depth) {
        if (node == null || depth > MAX_DEPTH) {
            return false;
        }
        switch (node.getKind()) {
            case AND:
                for (ConditionNode child : node.getChildren()) {
                    if (!evaluate(child, context, depth + 1)) {
                        return false;
                    }
                }
                return true;
            case OR:
                for (ConditionNode child : node.getChildren()) {
                    if (evaluate(child, context, depth + 1)) {
                        return true;
                    }
                }
                return false;
            case NOT:
                if (node.getChildren().size() != 1) {
                    return false;
                }
                return !evaluate(node.getChildren().get(0), context, depth + 1);
            case LEAF:
                return evaluateLeaf(node.getLeaf(), context);
            default:
                return false;
        }
    }

    private boolean evaluateLeaf(Condition condition, TailoringContext context) {
        Object actual = context.resolve(condition.path());
        boolean result = condition.test(actual);
        if (LOG.isDebugEnabled()) {
            LOG.debugf("Leaf %s with actual=%s -> %s", condition, actual, result);
        }
        return result;
    }
}
