package org.pragmatica.veq.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.veq.error.LexError;
import org.pragmatica.veq.error.ParseError;
import org.pragmatica.veq.error.SyntaxError;
import org.pragmatica.veq.tree.BinaryOperator;
import org.pragmatica.veq.tree.MathFunction;
import org.pragmatica.veq.tree.Node;
import org.pragmatica.veq.tree.Variable;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionParserTest {

    private static final Node X = new Node.VariableRef(Variable.X);
    private static final Node T = new Node.VariableRef(Variable.T);

    // === Tree shape ===

    @Test
    void parse_sum_isLeftAssociative() {
        var root = parseTree("x - 1 - 2");

        assertEquals(
            new Node.Binary(BinaryOperator.SUBTRACT,
                            new Node.Binary(BinaryOperator.SUBTRACT, X, literal(1)),
                            literal(2)),
            root);
    }

    @Test
    void parse_power_isRightAssociative() {
        var root = parseTree("2^3^2");

        assertEquals(
            new Node.Binary(BinaryOperator.POWER,
                            literal(2),
                            new Node.Binary(BinaryOperator.POWER, literal(3), literal(2))),
            root);
    }

    @Test
    void parse_negation_appliesToWholePower() {
        var root = parseTree("-x^2");

        assertEquals(new Node.Negate(new Node.Binary(BinaryOperator.POWER, X, literal(2))), root);
    }

    @Test
    void parse_negatedExponent_isAllowed() {
        var root = parseTree("2^-x");

        assertEquals(new Node.Binary(BinaryOperator.POWER, literal(2), new Node.Negate(X)), root);
    }

    @Test
    void parse_productBindsTighterThanSum() {
        var root = parseTree("x + t * 2");

        assertEquals(
            new Node.Binary(BinaryOperator.ADD,
                            X,
                            new Node.Binary(BinaryOperator.MULTIPLY, T, literal(2))),
            root);
    }

    @Test
    void parse_moduloSharesProductLevel() {
        var root = parseTree("x % 3 * 2");

        assertEquals(
            new Node.Binary(BinaryOperator.MULTIPLY,
                            new Node.Binary(BinaryOperator.MODULO, X, literal(3)),
                            literal(2)),
            root);
    }

    @Test
    void parse_parentheses_overridePrecedence() {
        var root = parseTree("(x + 1) * 2");

        assertEquals(
            new Node.Binary(BinaryOperator.MULTIPLY,
                            new Node.Binary(BinaryOperator.ADD, X, literal(1)),
                            literal(2)),
            root);
    }

    @Test
    void parse_functionCall_createsCall() {
        var root = parseTree("atanh(x)");

        assertEquals(new Node.Call(MathFunction.ATANH, X), root);
    }

    @Test
    void parse_constants_foldedToLiterals() {
        assertEquals(literal(Math.PI), parseTree("pi"));
        assertEquals(literal(Math.E), parseTree("e"));
        assertEquals(literal(9.81), parseTree("g"));
    }

    @Test
    void parse_everyFunctionName_isAccepted() {
        for (var function : MathFunction.values()) {
            var root = parseTree(function.keyword() + "(t)");
            assertEquals(new Node.Call(function, T), root, function.keyword());
        }
    }

    // === Errors ===

    @Test
    void parse_missingClosingParen_reportsPositionAfterLastDigit() {
        var error = parseError("(1+2");

        var end = assertInstanceOf(ParseError.UnexpectedEnd.class, error);
        assertEquals(4, end.position());
        assertEquals("')'", end.expected());
        assertTrue(end.message().contains("expected ')'"));
    }

    @Test
    void parse_unknownIdentifier_reportsPositionZero() {
        var error = parseError("q");

        var unknown = assertInstanceOf(ParseError.UnknownIdentifier.class, error);
        assertEquals(0, unknown.position());
        assertEquals("q", unknown.name());
    }

    @Test
    void parse_adjacentKeywords_areUnknownIdentifier() {
        var error = parseError("2 * sinx");

        var unknown = assertInstanceOf(ParseError.UnknownIdentifier.class, error);
        assertEquals(4, unknown.position());
        assertEquals("sinx", unknown.name());
    }

    @Test
    void parse_unmatchedClosingParen_isReported() {
        var error = parseError("(x))");

        assertInstanceOf(ParseError.UnmatchedParenthesis.class, error);
        assertEquals(3, error.position());
    }

    @Test
    void parse_functionWithoutParen_fails() {
        var error = parseError("sin x");

        var unexpected = assertInstanceOf(ParseError.UnexpectedToken.class, error);
        assertEquals(4, unexpected.position());
        assertEquals("'(' after 'sin'", unexpected.expected());
    }

    @Test
    void parse_functionAtEnd_fails() {
        assertInstanceOf(ParseError.UnexpectedEnd.class, parseError("cos"));
    }

    @Test
    void parse_missingFunctionArgument_fails() {
        var error = parseError("log()");

        var unexpected = assertInstanceOf(ParseError.UnexpectedToken.class, error);
        assertEquals(4, unexpected.position());
        assertEquals(")", unexpected.found());
    }

    @Test
    void parse_trailingToken_fails() {
        var error = parseError("x 2");

        var unexpected = assertInstanceOf(ParseError.UnexpectedToken.class, error);
        assertEquals(2, unexpected.position());
        assertEquals("operator or end of input", unexpected.expected());
    }

    @Test
    void parse_emptyInput_fails() {
        var error = parseError("   ");

        var end = assertInstanceOf(ParseError.UnexpectedEnd.class, error);
        assertEquals("expression", end.expected());
    }

    @Test
    void parse_danglingOperator_fails() {
        assertInstanceOf(ParseError.UnexpectedEnd.class, parseError("x +"));
        assertInstanceOf(ParseError.UnexpectedToken.class, parseError("* x"));
    }

    @Test
    void parse_badCharacter_isLexError() {
        var error = parseError("x # 2");

        var lex = assertInstanceOf(LexError.class, error);
        assertEquals(2, lex.position());
        assertEquals('#', lex.character());
    }

    // === Limits ===

    @Test
    void parse_deepNesting_failsWithoutStackOverflow() {
        var text = "(".repeat(300) + "x" + ")".repeat(300);

        var error = parseError(text);

        var nested = assertInstanceOf(ParseError.TooDeeplyNested.class, error);
        assertEquals(256, nested.limit());
        assertTrue(nested.position() < 300);
    }

    @Test
    void parse_longNegationChain_isBounded() {
        assertInstanceOf(ParseError.TooDeeplyNested.class, parseError("-".repeat(10_000 - 1) + "x"));
    }

    @Test
    void parse_longOperatorChain_isBounded() {
        var error = parseError("1" + "+1".repeat(4999));

        var nested = assertInstanceOf(ParseError.TooDeeplyNested.class, error);
        assertEquals(256, nested.limit());
        assertEquals(512, nested.position());
    }

    @Test
    void parse_longProductChain_isBounded() {
        assertInstanceOf(ParseError.TooDeeplyNested.class, parseError("x" + "*x".repeat(300)));
    }

    @Test
    void parse_chainsInsideGroups_shareTheLimit() {
        var config = new ParserConfig(4, 100);

        assertTrue(ExpressionParser.parse("1+1+1", config).isSuccess());
        assertInstanceOf(ParseError.TooDeeplyNested.class, errorOf(ExpressionParser.parse("((1+1+1))", config)));
    }

    @Test
    void parse_nestingWithinLimit_succeeds() {
        var text = "(".repeat(200) + "x" + ")".repeat(200);

        assertTrue(ExpressionParser.parse(text).isSuccess());
    }

    @Test
    void parse_customDepth_isRespected() {
        var config = new ParserConfig(3, 100);

        assertTrue(ExpressionParser.parse("((x))", config).isSuccess());
        assertInstanceOf(ParseError.TooDeeplyNested.class, errorOf(ExpressionParser.parse("(((x)))", config)));
    }

    @Test
    void parse_inputOverLimit_fails() {
        var config = new ParserConfig(10, 5);

        var error = errorOf(ExpressionParser.parse("x + 1 + 2", config));

        var tooLong = assertInstanceOf(ParseError.InputTooLong.class, error);
        assertEquals(9, tooLong.length());
        assertEquals(5, tooLong.limit());
    }

    @Test
    void config_nonPositiveLimits_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new ParserConfig(0, 10));
        assertThrows(IllegalArgumentException.class, () -> new ParserConfig(10, -1));
    }

    // === Helpers ===

    private static Node literal(double value) {
        return new Node.Literal(value);
    }

    private static Node parseTree(String text) {
        var result = ExpressionParser.parse(text);
        assertTrue(result.isSuccess(), () -> "Expected success for: " + text);
        return result.unwrap().root();
    }

    private static SyntaxError parseError(String text) {
        return errorOf(ExpressionParser.parse(text));
    }

    private static SyntaxError errorOf(ParseResult<?> result) {
        assertTrue(result.isFailure());
        return ((ParseResult.Failure<?>) result).error();
    }
}
