package li.cil.dtk.dts;

import li.cil.dtk.devicetree.*;
import li.cil.dtk.exception.ParseException;
import li.cil.dtk.exception.SemanticException;
import li.cil.dtk.utils.ByteArrayUtils;
import org.apache.commons.io.IOUtils;
import org.apache.commons.io.input.BoundedInputStream;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser building a raw {@link DeviceTree} from a token stream.
 * <p>
 * References are not resolved here beyond what the grammar requires (reopening and
 * deleting nodes). Path and phandle references inside property values are recorded as
 * {@link Marker}s and patched in by {@link DeviceTreePostProcessor}, so forward references
 * and references to nodes deleted later behave as expected.
 */
public final class DeviceTreeParser {
    private final Lexer lexer;
    private final ExpressionEvaluator evaluator;
    private final DeviceTree tree;

    public DeviceTreeParser(final Lexer lexer) {
        this.lexer = lexer;
        this.evaluator = new ExpressionEvaluator(lexer);
        this.tree = new DeviceTree(lexer.getFileName());
    }

    /**
     * Parses the whole input. The returned tree has not been post-processed yet.
     */
    public DeviceTree parse() throws ParseException {
        if (lexer.next().type != TokenType.DTS_V1) {
            throw lexer.error("expected /dts-v1/ -- other versions are not supported");
        }
        lexer.expect(";");

        if (lexer.peek().type == TokenType.PLUGIN) {
            throw lexer.error("/plugin/ is not supported");
        }

        parseMemoryReservations();

        for (; ; ) {
            final Token token = lexer.next();
            switch (token.type) {
                case MISC -> {
                    if (!token.is("/")) {
                        throw lexer.error("expected '/' or label reference");
                    }
                    lexer.expect("{");
                    parseNode(tree.getOrCreateRoot());
                }
                case LABEL, REFERENCE -> {
                    String label = null;
                    Token reference = token;
                    if (token.type == TokenType.LABEL) {
                        label = token.text;
                        reference = lexer.next();
                    }
                    if (reference.type != TokenType.REFERENCE) {
                        throw lexer.error("expected label reference");
                    }

                    final Node node = resolve(reference.text);
                    lexer.expect("{");
                    parseNode(node);

                    if (label != null) {
                        node.addLabel(label);
                    }
                }
                case DELETE_NODE -> {
                    final Node node = resolveNextReference();
                    if (node.isRoot()) {
                        throw lexer.error("cannot delete the root node");
                    }
                    node.remove();
                    lexer.expect(";");
                }
                case OMIT_IF_NO_REF -> {
                    resolveNextReference().setOmitIfNoRef();
                    lexer.expect(";");
                }
                case EOF -> {
                    if (!tree.hasRoot()) {
                        throw lexer.error("no root node defined");
                    }
                    return tree;
                }
                default -> throw lexer.error("expected '/' or label reference");
            }
        }
    }

    private void parseMemoryReservations() throws ParseException {
        for (; ; ) {
            final List<String> labels = new ArrayList<>();
            while (lexer.peek().type == TokenType.LABEL) {
                final String label = lexer.next().text;
                if (!labels.contains(label)) {
                    labels.add(label);
                }
            }

            if (lexer.peek().type != TokenType.MEMRESERVE) {
                if (!labels.isEmpty()) {
                    throw lexer.error("expected /memreserve/ after labels at beginning of file");
                }
                return;
            }

            lexer.next();
            final long address = toLong(evaluator.primary());
            final long length = toLong(evaluator.primary());
            lexer.expect(";");

            tree.addMemoryReservation(new MemoryReservation(labels, address, length));
        }
    }

    /**
     * Parses the {@code ... };} part of a node definition into the given node.
     */
    private void parseNode(final Node node) throws ParseException {
        for (; ; ) {
            Token token = lexer.next();

            final List<String> labels = new ArrayList<>();
            boolean omitIfNoRef = false;
            while (token.type == TokenType.LABEL || token.type == TokenType.OMIT_IF_NO_REF) {
                if (token.type == TokenType.LABEL) {
                    if (!labels.contains(token.text)) {
                        labels.add(token.text);
                    }
                } else {
                    omitIfNoRef = true;
                }
                token = lexer.next();
            }

            if (token.type != TokenType.NAME && (!labels.isEmpty() || omitIfNoRef)) {
                throw lexer.error("expected node or property name");
            }

            if (token.type == TokenType.NAME) {
                final String name = token.text;
                final Token next = lexer.next();

                if (next.is("{")) {
                    if (StringUtils.countMatches(name, '@') > 1) {
                        throw lexer.error("multiple '@' in node name");
                    }

                    final Node child = node.getOrCreateChild(name);
                    labels.forEach(child::addLabel);
                    if (omitIfNoRef) {
                        child.setOmitIfNoRef();
                    }
                    parseNode(child);
                } else if (omitIfNoRef) {
                    throw lexer.error("/omit-if-no-ref/ can only be used on nodes");
                } else if (next.is("=")) {
                    final Property property = getOrCreateProperty(node, name);
                    parseAssignment(property);
                    labels.forEach(property::addLabel);
                } else if (next.is(";")) {
                    final Property property = getOrCreateProperty(node, name);
                    labels.forEach(property::addLabel);
                } else {
                    throw lexer.error("expected '{', '=', or ';'");
                }
            } else if (token.type == TokenType.DELETE_NODE) {
                final Token name = lexer.next();
                if (name.type != TokenType.NAME) {
                    throw lexer.error("expected node name");
                }
                final Node child = node.getChild(name.text);
                if (child != null) {
                    child.remove();
                }
                lexer.expect(";");
            } else if (token.type == TokenType.DELETE_PROPERTY) {
                final Token name = lexer.next();
                if (name.type != TokenType.NAME) {
                    throw lexer.error("expected property name");
                }
                node.removeProperty(name.text);
                lexer.expect(";");
            } else if (token.is("}")) {
                lexer.expect(";");
                return;
            } else {
                throw lexer.error("expected node name, property name, or '}'");
            }
        }
    }

    private Property getOrCreateProperty(final Node node, final String name) throws ParseException {
        if (!node.hasProperty(name) && name.contains("@")) {
            throw lexer.error("'@' is only allowed in node names");
        }
        return node.getOrCreateProperty(name);
    }

    /**
     * Parses the right-hand side of an assignment. Assigning replaces any previous value,
     * including its pending references and labels.
     */
    private void parseAssignment(final Property property) throws ParseException {
        property.clearValue();

        for (; ; ) {
            parseValueLabels(property);

            final Token token = lexer.next();
            switch (token.type) {
                case MISC -> {
                    if (token.is("<")) {
                        parseCells(property, 32);
                    } else if (token.is("[")) {
                        parseBytes(property);
                    } else {
                        throw lexer.error("malformed value");
                    }
                }
                case BITS -> {
                    final Token bits = lexer.next();
                    if (bits.type != TokenType.NUMBER) {
                        throw lexer.error("expected number");
                    }
                    assert bits.number != null;
                    final int width = bits.number.intValue();
                    if (bits.number.bitLength() > 7 || (width != 8 && width != 16 && width != 32 && width != 64)) {
                        throw lexer.error("expected 8, 16, 32, or 64");
                    }
                    lexer.expect("<");
                    parseCells(property, width);
                }
                case CHAR_LITERAL -> {
                    final byte[] value = lexer.unescape(token.text);
                    if (value.length != 1) {
                        throw lexer.error("character literals must be length 1");
                    }
                    property.append(value);
                }
                case STRING -> {
                    property.append(lexer.unescape(token.text));
                    property.append((byte) 0);
                }
                case REFERENCE -> property.addMarker(token.text, Marker.Type.PATH);
                case INCBIN -> parseIncbin(property);
                default -> throw lexer.error("malformed value");
            }

            parseValueLabels(property);

            final Token separator = lexer.next();
            if (separator.is(";")) {
                return;
            }
            if (!separator.is(",")) {
                throw lexer.error("expected ';' or ','");
            }
        }
    }

    private void parseCells(final Property property, final int bits) throws ParseException {
        for (; ; ) {
            final Token token = lexer.peek();
            if (token.type == TokenType.REFERENCE) {
                lexer.next();
                if (bits != 32) {
                    throw lexer.error("phandle references are only allowed in arrays with 32-bit elements");
                }
                property.addMarker(token.text, Marker.Type.PHANDLE);
            } else if (token.type == TokenType.LABEL) {
                lexer.next();
                property.addMarker(token.text, Marker.Type.LABEL);
            } else if (lexer.accept(">")) {
                return;
            } else {
                property.append(encode(evaluator.primary(), bits));
            }
        }
    }

    private void parseBytes(final Property property) throws ParseException {
        for (; ; ) {
            final Token token = lexer.next();
            if (token.type == TokenType.BYTE) {
                assert token.number != null;
                property.append(token.number.byteValue());
            } else if (token.type == TokenType.LABEL) {
                property.addMarker(token.text, Marker.Type.LABEL);
            } else if (token.is("]")) {
                return;
            } else {
                throw lexer.error("expected two-digit byte or ']'");
            }
        }
    }

    /**
     * Parses {@code /incbin/ ("file")} and {@code /incbin/ ("file", offset, size)}. At most
     * {@code size} bytes are read, fewer if the file ends first.
     */
    private void parseIncbin(final Property property) throws ParseException {
        lexer.expect("(");

        final Token file = lexer.next();
        if (file.type != TokenType.STRING) {
            throw lexer.error("expected quoted filename");
        }
        final String name = new String(lexer.unescape(file.text), StandardCharsets.UTF_8);

        long offset = 0;
        long size = Long.MAX_VALUE;
        final Token token = lexer.next();
        if (token.is(",")) {
            offset = toIncbinOffset(evaluator.primary());
            lexer.expect(",");
            size = new BigInteger(1, encode(evaluator.primary(), 64)).min(BigInteger.valueOf(Long.MAX_VALUE)).longValue();
            lexer.expect(")");
        } else if (!token.is(")")) {
            throw lexer.error("expected ',' or ')'");
        }

        final Path path = lexer.findFile(name);
        try (final InputStream stream = Files.newInputStream(path)) {
            IOUtils.skip(stream, offset);
            property.append(IOUtils.toByteArray(new BoundedInputStream(stream, size)));
        } catch (final IOException e) {
            throw lexer.error(String.format("could not read '%s': %s", name, e.getMessage()));
        }
    }

    private void parseValueLabels(final Property property) throws ParseException {
        while (lexer.peek().type == TokenType.LABEL) {
            property.addMarker(lexer.next().text, Marker.Type.LABEL);
        }
    }

    private Node resolveNextReference() throws ParseException {
        final Token token = lexer.next();
        if (token.type != TokenType.REFERENCE) {
            throw lexer.error("expected label reference or path");
        }
        return resolve(token.text);
    }

    private Node resolve(final String reference) throws ParseException {
        try {
            return tree.resolveReference(reference);
        } catch (final SemanticException e) {
            throw lexer.error(e.getMessage());
        }
    }

    /**
     * Encodes a value big-endian into {@code bits} bits. Values that do not fit unsigned
     * are accepted if they fit as two's complement, so {@code -1} yields all ones.
     */
    private byte[] encode(final BigInteger value, final int bits) throws ParseException {
        final BigInteger limit = BigInteger.ONE.shiftLeft(bits);
        final BigInteger minimum = BigInteger.ONE.shiftLeft(bits - 1).negate();
        if (value.compareTo(limit) >= 0 || value.compareTo(minimum) < 0) {
            throw lexer.error(String.format("%s does not fit in %d bits", value, bits));
        }
        return ByteArrayUtils.toBigEndian(value.mod(limit), bits / 8);
    }

    private long toIncbinOffset(final BigInteger value) throws ParseException {
        final BigInteger unsigned = new BigInteger(1, encode(value, 64));
        if (unsigned.bitLength() > 63) {
            throw lexer.error(String.format("/incbin/ offset out of range (%s)", value));
        }
        return unsigned.longValue();
    }

    private long toLong(final BigInteger value) throws ParseException {
        return new BigInteger(1, encode(value, 64)).longValue();
    }
}
