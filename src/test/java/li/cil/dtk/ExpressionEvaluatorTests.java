package li.cil.dtk;

import li.cil.dtk.dts.ExpressionEvaluator;
import li.cil.dtk.dts.Lexer;
import li.cil.dtk.exception.ParseException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public final class ExpressionEvaluatorTests {
    private static BigInteger evaluate(final String expression) throws ParseException {
        return new ExpressionEvaluator(new Lexer(expression, "test.dts", Collections.emptyList())).primary();
    }

    private static void assertValue(final long expected, final String expression) throws ParseException {
        assertEquals(BigInteger.valueOf(expected), evaluate(expression));
    }

    @Test
    public void precedenceFollowsC() throws ParseException {
        assertValue(7, "(1 + 2 * 3)");
        assertValue(9, "((1 + 2) * 3)");
        assertValue(16, "(1 << 2 + 2)");
        assertValue(1, "(1 | 2 & 0)");
        assertValue(3, "(1 ^ 2 | 0)");
        assertValue(1, "(2 > 1 == 1)");
    }

    @Test
    public void divisionRoundsTowardsNegativeInfinity() throws ParseException {
        assertValue(-4, "(-7 / 2)");
        assertValue(1, "(-7 % 2)");
        assertValue(-4, "(7 / -2)");
        assertValue(-1, "(7 % -2)");
        assertValue(3, "(-7 / -2)");
        assertValue(-1, "(-7 % -2)");
        assertValue(3, "(7 / 2)");
        assertValue(1, "(7 % 2)");
        assertValue(-3, "(-6 / 2)");
        assertValue(0, "(-6 % 2)");
    }

    @Test
    public void unaryOperators() throws ParseException {
        assertValue(-1, "(~0)");
        assertValue(1, "(!0)");
        assertValue(0, "(!5)");
        assertValue(5, "(- -5)");
    }

    @Test
    public void logicalAndConditionalOperators() throws ParseException {
        assertValue(1, "(0 || 3)");
        assertValue(0, "(1 && 0)");
        assertValue(10, "(1 ? 10 : 20)");
        assertValue(20, "(0 ? 10 : 20)");
        assertValue(3, "(0 ? 1 : 0 ? 2 : 3)");
    }

    @Test
    public void characterLiteralsAreNumbers() throws ParseException {
        assertValue('a', "'a'");
        assertValue(10, "'\\n'");
    }

    @Test
    public void valuesAreArbitraryPrecision() throws ParseException {
        assertEquals(BigInteger.ONE.shiftLeft(100), evaluate("(1 << 100)"));
    }

    @Test
    public void divisionByZeroIsAnError() {
        final ParseException e = assertThrows(ParseException.class, () -> evaluate("(1 / 0)"));
        assertEquals("division by zero", e.getReason());

        assertThrows(ParseException.class, () -> evaluate("(1 % (2 - 2))"));
    }

    @Test
    public void negativeShiftIsAnError() {
        final ParseException e = assertThrows(ParseException.class, () -> evaluate("(1 << -1)"));
        assertEquals("negative shift count", e.getReason());
    }

    @Test
    public void bareOperatorIsNotAPrimary() {
        final ParseException e = assertThrows(ParseException.class, () -> evaluate("+"));
        assertEquals("expected number or parenthesized expression", e.getReason());
    }
}
