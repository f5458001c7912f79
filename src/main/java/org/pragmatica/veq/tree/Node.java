package org.pragmatica.veq.tree;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Abstract syntax tree of a parsed equation.
 *
 * <p>Nodes are immutable and acyclic, so subtrees may be shared freely
 * and evaluated from any number of threads.
 */
public sealed interface Node {

    /**
     * Numeric literal. Named constants are folded into literals by the parser.
     */
    record Literal(double value) implements Node {}

    /**
     * Reference to a runtime variable.
     */
    record VariableRef(Variable variable) implements Node {
        public VariableRef {
            checkNotNull(variable, "variable");
        }
    }

    /**
     * Arithmetic negation: -e
     */
    record Negate(Node operand) implements Node {
        public Negate {
            checkNotNull(operand, "operand");
        }
    }

    /**
     * Infix operation: left op right
     */
    record Binary(BinaryOperator operator, Node left, Node right) implements Node {
        public Binary {
            checkNotNull(operator, "operator");
            checkNotNull(left, "left");
            checkNotNull(right, "right");
        }
    }

    /**
     * Function application: fn(e)
     */
    record Call(MathFunction function, Node argument) implements Node {
        public Call {
            checkNotNull(function, "function");
            checkNotNull(argument, "argument");
        }
    }
}
