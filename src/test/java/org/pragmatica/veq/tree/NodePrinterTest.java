package org.pragmatica.veq.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.veq.Veq;

import static org.junit.jupiter.api.Assertions.*;

class NodePrinterTest {

    @Test
    void print_keepsOnlyNeededParentheses() {
        assertEquals("x + t * 2", reprint("x + (t * 2)"));
        assertEquals("(x + t) * 2", reprint("(x + t) * 2"));
        assertEquals("x - (t - 1)", reprint("x - (t - 1)"));
        assertEquals("x - t - 1", reprint("(x - t) - 1"));
    }

    @Test
    void print_powerChains_respectAssociativity() {
        assertEquals("2^3^2", reprint("2^(3^2)"));
        assertEquals("(2^3)^2", reprint("(2^3)^2"));
    }

    @Test
    void print_negation_distinguishesPowerOperand() {
        assertEquals("-x^2", reprint("-(x^2)"));
        assertEquals("(-x)^2", reprint("(-x)^2"));
        assertEquals("-(x + 1)", reprint("-(x + 1)"));
        assertEquals("2^-x", reprint("2^-x"));
    }

    @Test
    void print_constantsAppearAsValues() {
        assertEquals("sin(3.141592653589793 * x)", reprint("sin(pi * x)"));
        assertEquals("9.81", reprint("g"));
        assertEquals("0.5", reprint("0.50"));
    }

    @Test
    void print_reparsesToSameTree() {
        var sources = new String[] {
            "-2^2", "2^3^2", "x % 3 * 2", "round(x / 2.5) - sign(t)", "--x", "x * -t",
            "acosh(1 + x^2) ^ -(t - 1)", "(x + 1) / (x - 1) % 4"
        };
        for (var source : sources) {
            var tree = Veq.parse(source).unwrap().root();
            var printed = NodePrinter.print(tree);
            assertEquals(tree, Veq.parse(printed).unwrap().root(), () -> source + " printed as " + printed);
        }
    }

    @Test
    void print_handBuiltNegativeLiteral_isParenthesized() {
        var tree = new Node.Binary(BinaryOperator.POWER, new Node.Literal(-2), new Node.Literal(2));

        assertEquals("(-2)^2", NodePrinter.print(tree));
    }

    private static String reprint(String source) {
        return NodePrinter.print(Veq.parse(source).unwrap().root());
    }
}
