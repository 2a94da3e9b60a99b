package li.cil.dtk;

import li.cil.dtk.devicetree.DeviceTree;
import li.cil.dtk.devicetree.MemoryReservation;
import li.cil.dtk.devicetree.Node;
import li.cil.dtk.devicetree.Property;
import li.cil.dtk.dts.DeviceTreeSource;
import li.cil.dtk.exception.ParseException;
import li.cil.dtk.exception.SemanticException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public final class DeviceTreeParserTests {
    private static DeviceTree parse(final String text) throws ParseException, SemanticException {
        return DeviceTreeSource.parse(text, "test.dts");
    }

    private static byte[] bytes(final int... values) {
        final byte[] result = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = (byte) values[i];
        }
        return result;
    }

    @Test
    public void cellsBytesAndStringsAreConcatenated() throws Exception {
        final DeviceTree tree = parse("/dts-v1/;\n/ { a = <1 0x2>, [ab cd], \"hi\", /bits/ 8 <3 (-1)>, /bits/ 16 <0x1234>; };");

        final Property a = tree.getNode("/").getProperty("a");
        assertNotNull(a);
        assertArrayEquals(bytes(0, 0, 0, 1, 0, 0, 0, 2, 0xab, 0xcd, 'h', 'i', 0, 3, 0xff, 0x12, 0x34), a.getValue());
    }

    @Test
    public void sixtyFourBitCellsAcceptNegativeValues() throws Exception {
        final DeviceTree tree = parse("/dts-v1/;\n/ { a = /bits/ 64 <(-2)>; };");

        assertArrayEquals(bytes(0xff, 0xff, 0xff, 0xff, 0xff, 0xff, 0xff, 0xfe), tree.getNode("/").getProperty("a").getValue());
    }

    @Test
    public void valueThatDoesNotFitIsAnError() {
        final ParseException e = assertThrows(ParseException.class, () -> parse("/dts-v1/;\n/ { a = /bits/ 8 <256>; };"));
        assertEquals("256 does not fit in 8 bits", e.getReason());
    }

    @Test
    public void emptyPropertyHasNoValue() throws Exception {
        final DeviceTree tree = parse("/dts-v1/;\n/ { flag; };");

        assertTrue(tree.getNode("/").getProperty("flag").isEmpty());
    }

    @Test
    public void reopeningNodeMergesProperties() throws Exception {
        final DeviceTree tree = parse("/dts-v1/;\n" +
                "/ { n: node { a = <1>; b = <2>; }; };\n" +
                "&n { c = <3>; b = <4>; };\n" +
                "/ { node { d; }; };");

        final Node node = tree.getNode("/node");
        assertEquals(Arrays.asList("a", "b", "c", "d"), node.getProperties().stream().map(Property::getName).collect(Collectors.toList()));
        assertEquals(4, node.getProperty("b").toCell());
    }

    @Test
    public void reopeningByPathAddsLabel() throws Exception {
        final DeviceTree tree = parse("/dts-v1/;\n/ { node { }; };\nextra: &{/node} { a; };");

        assertSame(tree.getNode("/node"), tree.getNodeByLabel("extra"));
        assertTrue(tree.getNode("/node").hasProperty("a"));
    }

    @Test
    public void deletedNodeCannotBeReferenced() {
        final ParseException e = assertThrows(ParseException.class, () -> parse("/dts-v1/;\n" +
                "/ { gone: node { }; };\n" +
                "/delete-node/ &gone;\n" +
                "&gone { };"));
        assertEquals("undefined node label 'gone'", e.getReason());
    }

    @Test
    public void deletedNodeCannotBeReferencedFromValues() {
        final SemanticException e = assertThrows(SemanticException.class, () -> parse("/dts-v1/;\n" +
                "/ { gone: node { }; user { ref = <&gone>; }; };\n" +
                "/ { /delete-node/ node; };"));
        assertEquals("/user: undefined node label 'gone'", e.getMessage());
    }

    @Test
    public void deletePropertyAndMissingChildrenAreIgnored() throws Exception {
        final DeviceTree tree = parse("/dts-v1/;\n/ { a; b; /delete-property/ a; /delete-property/ missing; /delete-node/ missing; };");

        assertFalse(tree.getNode("/").hasProperty("a"));
        assertTrue(tree.getNode("/").hasProperty("b"));
    }

    @Test
    public void rootCannotBeDeleted() {
        final ParseException e = assertThrows(ParseException.class, () -> parse("/dts-v1/;\n/ { };\n/delete-node/ &{/};"));
        assertEquals("cannot delete the root node", e.getReason());
    }

    @Test
    public void memoryReservationsKeepLabelsAndOrder() throws Exception {
        final DeviceTree tree = parse("/dts-v1/;\n" +
                "r1: r2: /memreserve/ 0x1000 0x100;\n" +
                "/memreserve/ 0x2000 (0x10 * 2);\n" +
                "/ { };");

        final List<MemoryReservation> reservations = tree.getMemoryReservations();
        assertEquals(2, reservations.size());
        assertEquals(Arrays.asList("r1", "r2"), reservations.get(0).labels);
        assertEquals(0x1000, reservations.get(0).address);
        assertEquals(0x20, reservations.get(1).length);
    }

    @Test
    public void headerIsRequired() {
        final ParseException e = assertThrows(ParseException.class, () -> parse("/ { };"));
        assertEquals("expected /dts-v1/ -- other versions are not supported", e.getReason());
    }

    @Test
    public void pluginsAreRejected() {
        final ParseException e = assertThrows(ParseException.class, () -> parse("/dts-v1/;\n/plugin/;\n/ { };"));
        assertEquals("/plugin/ is not supported", e.getReason());
    }

    @Test
    public void rootNodeIsRequired() {
        final ParseException e = assertThrows(ParseException.class, () -> parse("/dts-v1/;\n"));
        assertEquals("no root node defined", e.getReason());
    }

    @Test
    public void atSignIsOnlyAllowedInNodeNames() {
        final ParseException e = assertThrows(ParseException.class, () -> parse("/dts-v1/;\n/ { a@1 = <1>; };"));
        assertEquals("'@' is only allowed in node names", e.getReason());
    }

    @Test
    public void omitIfNoRefIsOnlyAllowedOnNodes() {
        final ParseException e = assertThrows(ParseException.class, () -> parse("/dts-v1/;\n/ { /omit-if-no-ref/ a; };"));
        assertEquals("/omit-if-no-ref/ can only be used on nodes", e.getReason());
    }

    @Test
    public void phandleReferencesNeedThirtyTwoBitCells() {
        final ParseException e = assertThrows(ParseException.class, () -> parse("/dts-v1/;\n/ { n: node { }; a = /bits/ 16 <&n>; };"));
        assertEquals("phandle references are only allowed in arrays with 32-bit elements", e.getReason());
    }

    @Test
    public void pathReferencesExpandToPaths() throws Exception {
        final DeviceTree tree = parse("/dts-v1/;\n/ { soc { u: uart@10 { }; }; a = &u; };");

        assertEquals("/soc/uart@10", tree.getNode("/").getProperty("a").toText());
    }

    @Test
    public void errorsReportLineNumbers() {
        final ParseException e = assertThrows(ParseException.class, () -> parse("/dts-v1/;\n\n/ {\n\ta = <1>\n};"));
        assertEquals(5, e.getLine());
        assertEquals("expected ';' or ','", e.getReason());
    }

    @Test
    public void unitAddressIsTextAfterAt() throws Exception {
        final DeviceTree tree = parse("/dts-v1/;\n/ { uart@10000000 { }; };");

        assertEquals("10000000", tree.getNode("/uart@10000000").getUnitAddress());
        assertEquals(BigInteger.valueOf(0x10000000L), new BigInteger(tree.getNode("/uart@10000000").getUnitAddress(), 16));
    }
}
