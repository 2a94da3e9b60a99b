package li.cil.dtk.dts;

import it.unimi.dsi.fastutil.bytes.ByteArrayList;
import li.cil.dtk.exception.ParseException;
import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nullable;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits device tree source text into {@link Token}s.
 * <p>
 * What a run of characters means depends on context, e.g. {@code 10} is a number in a
 * cell array, a byte in a byte array and a valid node name after an opening brace. The
 * lexer tracks this through a {@link Mode} that is updated as tokens are produced.
 * <p>
 * {@code /include/} directives are handled here: the including file is suspended on a
 * stack and resumed when the included file is exhausted. {@code #line} markers left by
 * an external preprocessor update the reported file name and line.
 */
public final class Lexer {
    private static final Logger LOGGER = LogManager.getLogger();

    private enum Mode {
        DEFAULT,
        EXPECT_NAME,
        EXPECT_BYTE,
    }

    private static final Pattern INCLUDE_PATTERN = Pattern.compile("/include/\\s*\"((?:[^\\\\\"]|\\\\.)*)\"");
    private static final Pattern LINE_PATTERN = Pattern.compile("^#(?:line)?[ \\t]+([0-9]+)[ \\t]+\"((?:[^\\\\\"]|\\\\.)*)\"(?:[ \\t]+[0-9]+)?", Pattern.MULTILINE);
    private static final Pattern STRING_PATTERN = Pattern.compile("\"((?:[^\\\\\"]|\\\\.)*)\"");
    private static final Pattern LABEL_PATTERN = Pattern.compile("([a-zA-Z_][a-zA-Z0-9_]*):");
    private static final Pattern CHAR_LITERAL_PATTERN = Pattern.compile("'((?:[^\\\\']|\\\\.)*)'");
    private static final Pattern REFERENCE_PATTERN = Pattern.compile("&([a-zA-Z_][a-zA-Z0-9_]*|\\{[a-zA-Z0-9,._+*#?@/-]*})");
    private static final Pattern SKIP_PATTERN = Pattern.compile("\\s+|/\\*[\\s\\S]*?\\*/|//[^\\n]*");
    private static final Pattern NUMBER_PATTERN = Pattern.compile("(0[xX][0-9a-fA-F]+|[0-9]+)(?:ULL|UL|LL|U|L)?");
    private static final Pattern NAME_PATTERN = Pattern.compile("\\\\?([a-zA-Z0-9,._+*#?@-]+)");
    private static final Pattern BYTE_PATTERN = Pattern.compile("[0-9a-fA-F]{2}");
    private static final Pattern ESCAPE_PATTERN = Pattern.compile("\\\\(\\\\|\"|'|a|b|t|n|v|f|r|[0-7]{1,3}|x[0-9A-Fa-f]{1,2})");

    private static final String[] KEYWORDS = {
            "/dts-v1/", "/plugin/", "/memreserve/", "/bits/",
            "/delete-property/", "/delete-node/", "/omit-if-no-ref/",
    };
    private static final TokenType[] KEYWORD_TYPES = {
            TokenType.DTS_V1, TokenType.PLUGIN, TokenType.MEMRESERVE, TokenType.BITS,
            TokenType.DELETE_PROPERTY, TokenType.DELETE_NODE, TokenType.OMIT_IF_NO_REF,
    };

    // Longer operators must come before their prefixes.
    private static final String[] OPERATORS = {
            "==", "!=", "!", "=", ",", ";", "+", "-", "*", "/", "%", "~", "?", ":",
            "^", "(", ")", "{", "}", "[", "]", "<<", "<=", "<", ">>", ">=", ">",
            "||", "|", "&&", "&",
    };

    private static final class Frame {
        final String fileName;
        final int line;
        final String contents;
        final int position;

        Frame(final String fileName, final int line, final String contents, final int position) {
            this.fileName = fileName;
            this.line = line;
            this.contents = contents;
            this.position = position;
        }
    }

    private final List<Path> includePath;
    private final Deque<Frame> fileStack = new ArrayDeque<>();

    private String fileName;
    private String contents;
    private int line = 1;
    private int position;
    private int tokenStart;
    private Mode mode = Mode.DEFAULT;
    @Nullable private Token peeked;

    public Lexer(final String contents, final String fileName, final List<Path> includePath) {
        this.contents = contents;
        this.fileName = fileName;
        this.includePath = new ArrayList<>(includePath);
    }

    public String getFileName() {
        return fileName;
    }

    public int getLine() {
        return line;
    }

    /**
     * The 1-based column of the most recently lexed token.
     */
    public int getColumn() {
        return tokenStart - contents.lastIndexOf('\n', Math.min(tokenStart, contents.length() - 1));
    }

    /**
     * Creates a parse error located at the most recently lexed token.
     */
    public ParseException error(final String reason) {
        return new ParseException(fileName, line, getColumn(), reason);
    }

    public Token peek() throws ParseException {
        if (peeked == null) {
            peeked = lex();
        }
        return peeked;
    }

    public Token next() throws ParseException {
        if (peeked != null) {
            final Token token = peeked;
            peeked = null;
            return token;
        }
        return lex();
    }

    /**
     * Consumes the next token if it is the given operator.
     */
    public boolean accept(final String misc) throws ParseException {
        if (peek().is(misc)) {
            next();
            return true;
        }
        return false;
    }

    public Token expect(final String misc) throws ParseException {
        final Token token = next();
        if (!token.is(misc)) {
            throw error(String.format("expected '%s', not '%s'", misc, token.text));
        }
        return token;
    }

    /**
     * Resolves escape sequences in string and character literals. Works on bytes since
     * hex and octal escapes may produce invalid UTF-8.
     */
    public byte[] unescape(final String text) throws ParseException {
        final byte[] raw = text.getBytes(StandardCharsets.UTF_8);
        // Escapes are pure ASCII, so matching on an ISO-8859-1 view keeps offsets identical to bytes.
        final String view = new String(raw, StandardCharsets.ISO_8859_1);
        final ByteArrayList result = new ByteArrayList(raw.length);
        final Matcher matcher = ESCAPE_PATTERN.matcher(view);
        int previous = 0;
        while (matcher.find()) {
            result.addElements(result.size(), raw, previous, matcher.start() - previous);
            result.add(unescapeSequence(matcher.group(1)));
            previous = matcher.end();
        }
        result.addElements(result.size(), raw, previous, raw.length - previous);
        return result.toByteArray();
    }

    private byte unescapeSequence(final String escape) throws ParseException {
        switch (escape) {
            case "\\":
                return '\\';
            case "\"":
                return '"';
            case "'":
                return '\'';
            case "a":
                return 0x07;
            case "b":
                return '\b';
            case "t":
                return '\t';
            case "n":
                return '\n';
            case "v":
                return 0x0B;
            case "f":
                return '\f';
            case "r":
                return '\r';
        }

        if (escape.startsWith("x")) {
            return (byte) Integer.parseInt(escape.substring(1), 16);
        }

        final int value = Integer.parseInt(escape, 8);
        if (value > 0xFF) {
            throw error("octal escape out of range (> 255)");
        }
        return (byte) value;
    }

    /**
     * Locates a file referenced by {@code /include/} or {@code /incbin/}: first relative to
     * the directory of the current file, then in each include path entry in order.
     */
    public Path findFile(final String name) throws ParseException {
        final List<Path> candidates = new ArrayList<>();
        try {
            final Path parent = Paths.get(fileName).getParent();
            candidates.add(parent != null ? parent.resolve(name) : Paths.get(name));
            for (final Path directory : includePath) {
                candidates.add(directory.resolve(name));
            }
        } catch (final InvalidPathException e) {
            throw error(String.format("'%s' is not a valid path: %s", name, e.getMessage()));
        }

        for (final Path candidate : candidates) {
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }

        throw error(String.format("'%s' could not be found", name));
    }

    // --------------------------------------------------------------------- //

    private Token lex() throws ParseException {
        for (; ; ) {
            tokenStart = position;

            if (position >= contents.length()) {
                if (!fileStack.isEmpty()) {
                    leaveFile();
                    continue;
                }
                return new Token(TokenType.EOF, "<EOF>");
            }

            Matcher matcher;
            if ((matcher = match(INCLUDE_PATTERN)) != null) {
                consume(matcher);
                enterFile(matcher.group(1));
                continue;
            }

            if ((matcher = match(LINE_PATTERN)) != null) {
                position = matcher.end();
                // The newline ending the directive is counted as usual.
                line = Integer.parseInt(matcher.group(1)) - 1;
                fileName = matcher.group(2);
                continue;
            }

            if ((matcher = match(STRING_PATTERN)) != null) {
                consume(matcher);
                return new Token(TokenType.STRING, matcher.group(1));
            }

            final Token keyword = lexKeyword();
            if (keyword != null) {
                return keyword;
            }

            if ((matcher = match(LABEL_PATTERN)) != null) {
                consume(matcher);
                return new Token(TokenType.LABEL, matcher.group(1));
            }

            if ((matcher = match(CHAR_LITERAL_PATTERN)) != null) {
                consume(matcher);
                return new Token(TokenType.CHAR_LITERAL, matcher.group(1));
            }

            if ((matcher = match(REFERENCE_PATTERN)) != null) {
                consume(matcher);
                return new Token(TokenType.REFERENCE, matcher.group(1));
            }

            if (contents.startsWith("/incbin/", position)) {
                position += "/incbin/".length();
                return new Token(TokenType.INCBIN, "/incbin/");
            }

            if ((matcher = match(SKIP_PATTERN)) != null) {
                consume(matcher);
                continue;
            }

            if (contents.startsWith("/*", position)) {
                throw error("unterminated comment");
            }

            final Token token = lexModal();
            if (token != null) {
                return token;
            }

            final Token operator = lexOperator();
            if (operator != null) {
                return operator;
            }

            // Stray names and bad characters end up here. The parser knows the context and
            // reports something more helpful than the lexer could.
            return new Token(TokenType.BAD, "<unknown token>");
        }
    }

    @Nullable
    private Token lexKeyword() {
        for (int i = 0; i < KEYWORDS.length; i++) {
            if (contents.startsWith(KEYWORDS[i], position)) {
                position += KEYWORDS[i].length();
                final TokenType type = KEYWORD_TYPES[i];
                switch (type) {
                    case DELETE_PROPERTY, DELETE_NODE, OMIT_IF_NO_REF -> mode = Mode.EXPECT_NAME;
                    case MEMRESERVE, BITS -> mode = Mode.DEFAULT;
                    default -> {
                    }
                }
                return new Token(type, KEYWORDS[i]);
            }
        }
        return null;
    }

    @Nullable
    private Token lexModal() {
        final Matcher matcher;
        switch (mode) {
            case DEFAULT -> {
                matcher = match(NUMBER_PATTERN);
                if (matcher == null) {
                    return null;
                }
                consume(matcher);
                final String digits = matcher.group(1);
                final BigInteger value;
                if (digits.startsWith("0x") || digits.startsWith("0X")) {
                    value = new BigInteger(digits.substring(2), 16);
                } else if (digits.length() > 1 && digits.charAt(0) == '0') {
                    try {
                        value = new BigInteger(digits.substring(1), 8);
                    } catch (final NumberFormatException e) {
                        // Something like 09, not valid octal. Leave it to the parser to complain.
                        return new Token(TokenType.BAD, digits);
                    }
                } else {
                    value = new BigInteger(digits);
                }
                return new Token(TokenType.NUMBER, matcher.group(), value);
            }
            case EXPECT_NAME -> {
                matcher = match(NAME_PATTERN);
                if (matcher == null) {
                    return null;
                }
                consume(matcher);
                mode = Mode.DEFAULT;
                return new Token(TokenType.NAME, matcher.group(1));
            }
            case EXPECT_BYTE -> {
                matcher = match(BYTE_PATTERN);
                if (matcher == null) {
                    return null;
                }
                consume(matcher);
                return new Token(TokenType.BYTE, matcher.group(), new BigInteger(matcher.group(), 16));
            }
        }
        return null;
    }

    @Nullable
    private Token lexOperator() {
        for (final String operator : OPERATORS) {
            if (contents.startsWith(operator, position)) {
                position += operator.length();
                switch (operator) {
                    case "{", ";" -> mode = Mode.EXPECT_NAME;
                    case "[" -> mode = Mode.EXPECT_BYTE;
                    case "]" -> mode = Mode.DEFAULT;
                    default -> {
                    }
                }
                return new Token(TokenType.MISC, operator);
            }
        }
        return null;
    }

    @Nullable
    private Matcher match(final Pattern pattern) {
        final Matcher matcher = pattern.matcher(contents);
        matcher.region(position, contents.length());
        // Lets '^' see line starts before the region and '$' see the real end of lines.
        matcher.useAnchoringBounds(false);
        matcher.useTransparentBounds(true);
        return matcher.lookingAt() ? matcher : null;
    }

    private void consume(final Matcher matcher) {
        final String text = matcher.group();
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        position = matcher.end();
    }

    private void enterFile(final String escapedName) throws ParseException {
        final String name;
        try {
            name = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(unescape(escapedName)))
                    .toString();
        } catch (final CharacterCodingException e) {
            throw error("filename is not valid UTF-8");
        }

        final Path path = findFile(name);
        final String includedName = path.toString();

        final List<String> chain = new ArrayList<>();
        boolean isRecursive = false;
        for (final var iterator = fileStack.descendingIterator(); iterator.hasNext(); ) {
            final Frame frame = iterator.next();
            if (isRecursive || frame.fileName.equals(includedName)) {
                isRecursive = true;
                chain.add(frame.fileName + ":" + frame.line);
            }
        }
        if (isRecursive || fileName.equals(includedName)) {
            chain.add(fileName + ":" + line);
            chain.add(includedName);
            throw error("recursive /include/:\n" + String.join(" ->\n", chain));
        }

        final String includedContents;
        try {
            includedContents = FileUtils.readFileToString(path.toFile(), StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw error(String.format("could not read '%s': %s", name, e.getMessage()));
        }

        LOGGER.debug("Entering included file [{}].", includedName);

        fileStack.push(new Frame(fileName, line, contents, position));
        fileName = includedName;
        contents = includedContents;
        line = 1;
        position = 0;
    }

    private void leaveFile() {
        final Frame frame = fileStack.pop();
        LOGGER.debug("Leaving included file [{}].", fileName);
        fileName = frame.fileName;
        line = frame.line;
        contents = frame.contents;
        position = frame.position;
    }
}
