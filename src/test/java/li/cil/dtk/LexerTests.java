package li.cil.dtk;

import li.cil.dtk.dts.Lexer;
import li.cil.dtk.dts.Token;
import li.cil.dtk.dts.TokenType;
import li.cil.dtk.exception.ParseException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public final class LexerTests {
    private static List<Token> tokenize(final String text) throws ParseException {
        final Lexer lexer = new Lexer(text, "test.dts", Collections.emptyList());
        final List<Token> result = new ArrayList<>();
        for (; ; ) {
            final Token token = lexer.next();
            if (token.type == TokenType.EOF) {
                return result;
            }
            result.add(token);
        }
    }

    @Test
    public void nodeNamesAreLexedAfterOpeningBrace() throws ParseException {
        final List<Token> tokens = tokenize("/ { cpu@0 { }; };");

        assertEquals(TokenType.MISC, tokens.get(0).type);
        assertEquals(TokenType.MISC, tokens.get(1).type);
        assertEquals(TokenType.NAME, tokens.get(2).type);
        assertEquals("cpu@0", tokens.get(2).text);
    }

    @Test
    public void numbersSupportHexOctalAndSuffixes() throws ParseException {
        final List<Token> tokens = tokenize("0x10 010 10 10ULL");

        assertEquals(4, tokens.size());
        assertEquals(BigInteger.valueOf(16), tokens.get(0).number);
        assertEquals(BigInteger.valueOf(8), tokens.get(1).number);
        assertEquals(BigInteger.valueOf(10), tokens.get(2).number);
        assertEquals(BigInteger.valueOf(10), tokens.get(3).number);
    }

    @Test
    public void invalidOctalIsBadToken() throws ParseException {
        assertEquals(TokenType.BAD, tokenize("09").get(0).type);
    }

    @Test
    public void bytesAreLexedInsideBrackets() throws ParseException {
        final List<Token> tokens = tokenize("[ab 01] 10");

        assertEquals(TokenType.BYTE, tokens.get(1).type);
        assertEquals(BigInteger.valueOf(0xab), tokens.get(1).number);
        assertEquals(TokenType.BYTE, tokens.get(2).type);
        assertEquals(TokenType.NUMBER, tokens.get(4).type);
    }

    @Test
    public void labelsAndReferences() throws ParseException {
        final List<Token> tokens = tokenize("uart0: &uart1 &{/soc/uart@1000}");

        assertEquals(TokenType.LABEL, tokens.get(0).type);
        assertEquals("uart0", tokens.get(0).text);
        assertEquals(TokenType.REFERENCE, tokens.get(1).type);
        assertEquals("uart1", tokens.get(1).text);
        assertEquals("{/soc/uart@1000}", tokens.get(2).text);
    }

    @Test
    public void commentsAreSkippedAndLinesCounted() throws ParseException {
        final Lexer lexer = new Lexer("/* one\n two */\n// three\n  42", "test.dts", Collections.emptyList());

        final Token token = lexer.next();
        assertEquals(TokenType.NUMBER, token.type);
        assertEquals(4, lexer.getLine());
        assertEquals(3, lexer.getColumn());
    }

    @Test
    public void unterminatedCommentIsAnError() {
        final ParseException e = assertThrows(ParseException.class, () -> tokenize("/* never closed"));
        assertEquals("unterminated comment", e.getReason());
    }

    @Test
    public void lineDirectiveUpdatesLocation() throws ParseException {
        final Lexer lexer = new Lexer("#line 100 \"board.dts\"\n1", "test.dts", Collections.emptyList());

        lexer.next();
        assertEquals("board.dts", lexer.getFileName());
        assertEquals(100, lexer.getLine());
    }

    @Test
    public void escapesAreResolved() throws ParseException {
        final Lexer lexer = new Lexer("", "test.dts", Collections.emptyList());

        assertArrayEquals(new byte[]{'a', '\n', 0x41, 0x07, '"'}, lexer.unescape("a\\n\\x41\\007\\\""));
    }

    @Test
    public void octalEscapeAboveByteRangeIsAnError() {
        final Lexer lexer = new Lexer("", "test.dts", Collections.emptyList());

        final ParseException e = assertThrows(ParseException.class, () -> lexer.unescape("\\777"));
        assertEquals("octal escape out of range (> 255)", e.getReason());
    }

    @Test
    public void errorsCarryFileAndPosition() {
        final Lexer lexer = new Lexer("\n  x", "board.dts", Collections.emptyList());

        final ParseException e = assertThrows(ParseException.class, () -> lexer.expect(";"));
        assertEquals("board.dts", e.getFileName());
        assertEquals(2, e.getLine());
        assertEquals(3, e.getColumn());
        assertTrue(e.getMessage().startsWith("board.dts:2 (column 3): parse error:"));
    }
}
