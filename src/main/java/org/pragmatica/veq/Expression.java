package org.pragmatica.veq;

import org.pragmatica.veq.eval.Bindings;
import org.pragmatica.veq.eval.Evaluator;
import org.pragmatica.veq.tree.Node;
import org.pragmatica.veq.tree.NodePrinter;
import org.pragmatica.veq.tree.Variable;

import java.util.ArrayDeque;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Parsed equation {@code y = f(x, t)}, ready for repeated evaluation.
 *
 * <p>Instances are immutable and may be evaluated concurrently from any
 * number of threads. When the equation text changes, parse a new instance.
 */
public final class Expression {
    private final String text;
    private final Node root;

    private Expression(String text, Node root) {
        this.text = text;
        this.root = root;
    }

    /**
     * Wrap an already built tree. {@code text} is the source it came from.
     */
    public static Expression of(String text, Node root) {
        return new Expression(checkNotNull(text, "text"), checkNotNull(root, "root"));
    }

    /**
     * Evaluate at the given point in space and time.
     */
    public double evaluate(double x, double t) {
        return Evaluator.evaluate(root, Bindings.of(x, t));
    }

    public double evaluate(Bindings bindings) {
        return Evaluator.evaluate(root, bindings);
    }

    /**
     * Whether the value can change when only {@code variable} changes.
     * A renderer can skip resampling a curve that does not depend on {@code t}.
     */
    public boolean dependsOn(Variable variable) {
        var pending = new ArrayDeque<Node>();
        pending.push(root);
        while (!pending.isEmpty()) {
            var node = pending.pop();
            if (node instanceof Node.VariableRef ref && ref.variable() == variable) {
                return true;
            } else if (node instanceof Node.Negate negate) {
                pending.push(negate.operand());
            } else if (node instanceof Node.Binary binary) {
                pending.push(binary.left());
                pending.push(binary.right());
            } else if (node instanceof Node.Call call) {
                pending.push(call.argument());
            }
        }
        return false;
    }

    /**
     * Equation text as supplied by the user.
     */
    public String text() {
        return text;
    }

    public Node root() {
        return root;
    }

    /**
     * Canonical rendering of the parsed tree.
     */
    @Override
    public String toString() {
        return NodePrinter.print(root);
    }
}
