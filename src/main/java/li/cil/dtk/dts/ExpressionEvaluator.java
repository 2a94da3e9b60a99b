package li.cil.dtk.dts;

import li.cil.dtk.exception.ParseException;

import java.math.BigInteger;

/**
 * Evaluates the C-like integer expressions allowed inside cell arrays, e.g.
 * {@code < (1 << 4) (SIZE - 1) >}.
 * <p>
 * Values are arbitrary precision. Division rounds towards negative infinity and the
 * remainder takes the sign of the divisor.
 * Both operands of the logical operators and both branches of the conditional operator
 * are always evaluated, so errors in either are reported.
 */
public final class ExpressionEvaluator {
    // Generous upper bound, anything beyond this cannot end up in a 64-bit cell anyway.
    private static final int MAX_SHIFT = 1 << 16;

    private final Lexer lexer;

    public ExpressionEvaluator(final Lexer lexer) {
        this.lexer = lexer;
    }

    /**
     * Evaluates a full expression.
     */
    public BigInteger evaluate() throws ParseException {
        return ternary();
    }

    /**
     * Evaluates a primary expression: a number, a character literal or a parenthesized
     * expression. This is what is allowed where expressions may not contain bare operators,
     * e.g. in cell arrays and memory reservations.
     */
    public BigInteger primary() throws ParseException {
        final Token token = lexer.peek();
        if (token.type == TokenType.NUMBER) {
            lexer.next();
            assert token.number != null;
            return token.number;
        }

        if (token.type == TokenType.CHAR_LITERAL) {
            lexer.next();
            final byte[] value = lexer.unescape(token.text);
            if (value.length != 1) {
                throw lexer.error("character literals must be length 1");
            }
            return BigInteger.valueOf(value[0] & 0xFF);
        }

        if (!lexer.next().is("(")) {
            throw lexer.error("expected number or parenthesized expression");
        }
        final BigInteger value = ternary();
        lexer.expect(")");
        return value;
    }

    private BigInteger ternary() throws ParseException {
        final BigInteger condition = or();
        if (lexer.accept("?")) {
            final BigInteger ifTrue = ternary();
            lexer.expect(":");
            final BigInteger ifFalse = ternary();
            return isTrue(condition) ? ifTrue : ifFalse;
        }
        return condition;
    }

    private BigInteger or() throws ParseException {
        BigInteger value = and();
        while (lexer.accept("||")) {
            final BigInteger rhs = and();
            value = toBoolean(isTrue(value) || isTrue(rhs));
        }
        return value;
    }

    private BigInteger and() throws ParseException {
        BigInteger value = bitOr();
        while (lexer.accept("&&")) {
            final BigInteger rhs = bitOr();
            value = toBoolean(isTrue(value) && isTrue(rhs));
        }
        return value;
    }

    private BigInteger bitOr() throws ParseException {
        BigInteger value = bitXor();
        while (lexer.accept("|")) {
            value = value.or(bitXor());
        }
        return value;
    }

    private BigInteger bitXor() throws ParseException {
        BigInteger value = bitAnd();
        while (lexer.accept("^")) {
            value = value.xor(bitAnd());
        }
        return value;
    }

    private BigInteger bitAnd() throws ParseException {
        BigInteger value = equality();
        while (lexer.accept("&")) {
            value = value.and(equality());
        }
        return value;
    }

    private BigInteger equality() throws ParseException {
        BigInteger value = relational();
        for (; ; ) {
            if (lexer.accept("==")) {
                value = toBoolean(value.equals(relational()));
            } else if (lexer.accept("!=")) {
                value = toBoolean(!value.equals(relational()));
            } else {
                return value;
            }
        }
    }

    private BigInteger relational() throws ParseException {
        BigInteger value = shift();
        for (; ; ) {
            if (lexer.accept("<")) {
                value = toBoolean(value.compareTo(shift()) < 0);
            } else if (lexer.accept(">")) {
                value = toBoolean(value.compareTo(shift()) > 0);
            } else if (lexer.accept("<=")) {
                value = toBoolean(value.compareTo(shift()) <= 0);
            } else if (lexer.accept(">=")) {
                value = toBoolean(value.compareTo(shift()) >= 0);
            } else {
                return value;
            }
        }
    }

    private BigInteger shift() throws ParseException {
        BigInteger value = additive();
        for (; ; ) {
            if (lexer.accept("<<")) {
                value = value.shiftLeft(shiftCount(additive()));
            } else if (lexer.accept(">>")) {
                value = value.shiftRight(shiftCount(additive()));
            } else {
                return value;
            }
        }
    }

    private BigInteger additive() throws ParseException {
        BigInteger value = multiplicative();
        for (; ; ) {
            if (lexer.accept("+")) {
                value = value.add(multiplicative());
            } else if (lexer.accept("-")) {
                value = value.subtract(multiplicative());
            } else {
                return value;
            }
        }
    }

    private BigInteger multiplicative() throws ParseException {
        BigInteger value = unary();
        for (; ; ) {
            if (lexer.accept("*")) {
                value = value.multiply(unary());
            } else if (lexer.accept("/")) {
                value = floorDivide(value, divisor(unary()));
            } else if (lexer.accept("%")) {
                value = floorModulo(value, divisor(unary()));
            } else {
                return value;
            }
        }
    }

    private BigInteger unary() throws ParseException {
        if (lexer.accept("-")) {
            return unary().negate();
        }
        if (lexer.accept("~")) {
            return unary().not();
        }
        if (lexer.accept("!")) {
            return toBoolean(!isTrue(unary()));
        }
        return primary();
    }

    /**
     * Division rounding towards negative infinity.
     */
    private static BigInteger floorDivide(final BigInteger dividend, final BigInteger divisor) {
        final BigInteger[] quotientAndRemainder = dividend.divideAndRemainder(divisor);
        if (quotientAndRemainder[1].signum() != 0 && dividend.signum() != divisor.signum()) {
            return quotientAndRemainder[0].subtract(BigInteger.ONE);
        }
        return quotientAndRemainder[0];
    }

    /**
     * Remainder of {@link #floorDivide}, which has the sign of the divisor.
     */
    private static BigInteger floorModulo(final BigInteger dividend, final BigInteger divisor) {
        return dividend.subtract(floorDivide(dividend, divisor).multiply(divisor));
    }

    private BigInteger divisor(final BigInteger value) throws ParseException {
        if (value.signum() == 0) {
            throw lexer.error("division by zero");
        }
        return value;
    }

    private int shiftCount(final BigInteger value) throws ParseException {
        if (value.signum() < 0) {
            throw lexer.error("negative shift count");
        }
        if (value.compareTo(BigInteger.valueOf(MAX_SHIFT)) > 0) {
            throw lexer.error("shift count too large");
        }
        return value.intValue();
    }

    private static boolean isTrue(final BigInteger value) {
        return value.signum() != 0;
    }

    private static BigInteger toBoolean(final boolean value) {
        return value ? BigInteger.ONE : BigInteger.ZERO;
    }
}
