package com.darboux.evaluation;

import com.darboux.expression.Expression;
import com.darboux.parser.PostfixParser;
import com.darboux.test.TestBase;
import com.darboux.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ExpressionEvaluator}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Expression
@DisplayName("ExpressionEvaluator Tests")
public class ExpressionEvaluatorTest extends TestBase {

    private final PostfixParser parser = new PostfixParser();

    private double eval(String integrand, double x) {
        return ExpressionEvaluator.evaluate(parser.parse(integrand), x);
    }

    @ParameterizedTest
    @CsvSource({
        "'x 1 +', 3.0, 4.0",
        "'x 1 -', 3.0, 2.0",
        "'1 x -', 3.0, -2.0",
        "'x 2 *', 3.0, 6.0",
        "'x 2 /', 3.0, 1.5",
        "'2 x /', 4.0, 0.5",
        "'x 2 ^', 3.0, 9.0",
        "'2 x ^', 3.0, 8.0",
        "'x 2 ^ x sin +', 0.0, 0.0",
        "'x exp ln', 1.5, 1.5",
        "'7', 123.0, 7.0",
        "'2 3 +', 0.0, 5.0",
        "'x 2 *', 5.0, 10.0",
        "'x sin', 0.0, 0.0"
    })
    @DisplayName("Evaluation follows operand order")
    void testEvaluate(String integrand, double x, double expected) {
        assertThat(eval(integrand, x)).isCloseTo(expected, within(1e-12));
    }

    @Test
    @DisplayName("Variable evaluates to its argument")
    void testIdentity() {
        for (double x : new double[] {-2.5, 0.0, 1e-9, 42.0}) {
            assertThat(eval("x", x)).isEqualTo(x);
        }
    }

    @Test
    @DisplayName("Null tree evaluates to zero")
    void testNullTree() {
        assertThat(ExpressionEvaluator.evaluate(null, 5.0)).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Numeric domain errors propagate as NaN and infinity")
    void testDomainErrors() {
        assertThat(eval("x ln", -1.0)).isNaN();
        assertThat(eval("1 x /", 0.0)).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(eval("x ctg", 0.0)).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(eval("x ln 1 +", -1.0)).isNaN();
    }

    @Test
    @DisplayName("Trees can be sampled as plain functions")
    void testAsFunction() {
        Expression tree = parser.parse("x x *");
        UnivariateFunction f = ExpressionEvaluator.asFunction(tree);

        assertThat(f.evaluate(4.0)).isEqualTo(16.0);
        assertThatThrownBy(() -> ExpressionEvaluator.asFunction(null))
            .isInstanceOf(NullPointerException.class);
    }
}
