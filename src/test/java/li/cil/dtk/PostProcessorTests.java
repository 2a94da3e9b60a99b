package li.cil.dtk;

import li.cil.dtk.devicetree.DeviceTree;
import li.cil.dtk.devicetree.Node;
import li.cil.dtk.devicetree.PropertyOffset;
import li.cil.dtk.dts.DeviceTreeSource;
import li.cil.dtk.exception.ParseException;
import li.cil.dtk.exception.SemanticException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public final class PostProcessorTests {
    private static DeviceTree parse(final String body) throws ParseException, SemanticException {
        return DeviceTreeSource.parse("/dts-v1/;\n" + body, "test.dts");
    }

    @Test
    public void phandlesAreAllocatedForReferencedNodes() throws Exception {
        final DeviceTree tree = parse("/ { a: a { }; b: b { phandle = <1>; }; user { refs = <&a &b>; }; };");

        final Node a = tree.getNode("/a");
        assertEquals(2, a.getProperty("phandle").toCell());
        assertSame(a, tree.getNodeByPhandle(2));
        assertSame(tree.getNode("/b"), tree.getNodeByPhandle(1));
        assertArrayEquals(new byte[]{0, 0, 0, 2, 0, 0, 0, 1}, tree.getNode("/user").getProperty("refs").getValue());
    }

    @Test
    public void selfReferentialPhandleAllocatesPhandle() throws Exception {
        final DeviceTree tree = parse("/ { n: node { phandle = <&n>; }; };");

        final Node node = tree.getNode("/node");
        assertEquals(1, node.getProperty("phandle").toCell());
        assertSame(node, tree.getNodeByPhandle(1));
    }

    @Test
    public void phandleReferringToAnotherNodeIsAnError() {
        final SemanticException e = assertThrows(SemanticException.class,
                () -> parse("/ { other: other { }; node { phandle = <&other>; }; };"));
        assertEquals("/node: phandle refers to another node", e.getMessage());
    }

    @Test
    public void reservedPhandleValuesAreRejected() {
        assertEquals("/node: bad value 0x00000000 for phandle",
                assertThrows(SemanticException.class, () -> parse("/ { node { phandle = <0>; }; };")).getMessage());
        assertEquals("/node: bad value 0xffffffff for phandle",
                assertThrows(SemanticException.class, () -> parse("/ { node { phandle = <0xffffffff>; }; };")).getMessage());
    }

    @Test
    public void phandleMustBeOneCell() {
        final SemanticException e = assertThrows(SemanticException.class, () -> parse("/ { node { phandle = [01]; }; };"));
        assertEquals("/node: bad phandle length (1), expected 4 bytes", e.getMessage());
    }

    @Test
    public void duplicatePhandlesNameBothNodes() {
        final SemanticException e = assertThrows(SemanticException.class,
                () -> parse("/ { a { phandle = <5>; }; b { phandle = <5>; }; };"));
        assertEquals("/b: duplicated phandle 0x5 (seen before at /a)", e.getMessage());
    }

    @Test
    public void duplicateLabelsAreReportedSorted() {
        final SemanticException e = assertThrows(SemanticException.class,
                () -> parse("/ { x: zeta { }; x: alpha { }; };"));
        assertEquals("Label 'x' appears on /alpha and on /zeta", e.getMessage());
    }

    @Test
    public void sameLabelTwiceOnOneNodeIsFine() throws Exception {
        final DeviceTree tree = parse("/ { x: node { }; };\nx: &x { };");

        assertSame(tree.getNode("/node"), tree.getNodeByLabel("x"));
    }

    @Test
    public void labelsInsideValuesRecordOffsets() throws Exception {
        final DeviceTree tree = parse("/ { p: prop = <1 mid: 2> end:; };");

        final PropertyOffset mid = tree.getPropertyOffsetByLabel("mid");
        assertNotNull(mid);
        assertEquals(4, mid.offset);
        assertEquals(8, tree.getPropertyOffsetByLabel("end").offset);
        assertSame(mid.property, tree.getPropertyByLabel("p"));
    }

    @Test
    public void aliasesResolveToNodes() throws Exception {
        final DeviceTree tree = parse("/ { aliases { serial0 = \"/soc/uart@0\"; }; soc { uart@0 { child { }; }; }; };");

        assertSame(tree.getNode("/soc/uart@0"), tree.getAliases().get("serial0"));
        assertSame(tree.getNode("/soc/uart@0/child"), tree.getNode("serial0/child"));
    }

    @Test
    public void badAliasNamesAreRejected() {
        final SemanticException e = assertThrows(SemanticException.class,
                () -> parse("/ { aliases { Serial = \"/\"; }; };"));
        assertEquals("/aliases: alias property name 'Serial' should include only characters from [0-9a-z-]", e.getMessage());
    }

    @Test
    public void unknownAliasIsReported() throws Exception {
        final DeviceTree tree = parse("/ { };");

        final SemanticException e = assertThrows(SemanticException.class, () -> tree.getNode("serial0"));
        assertEquals("no alias 'serial0' found -- did you forget the leading '/' in the node path?", e.getMessage());
    }

    @Test
    public void missingPathComponentIsReported() throws Exception {
        final DeviceTree tree = parse("/ { soc { }; };");

        final SemanticException e = assertThrows(SemanticException.class, () -> tree.getNode("/soc/uart"));
        assertEquals("component 2 ('uart') in path '/soc/uart' does not exist", e.getMessage());
    }

    @Test
    public void unreferencedNodesAreOmitted() throws Exception {
        final DeviceTree tree = parse("/ { /omit-if-no-ref/ unused: unused { }; /omit-if-no-ref/ used: used { }; user { ref = <&used>; }; };\n" +
                "/omit-if-no-ref/ &{/user};");

        assertFalse(tree.hasNode("/unused"));
        assertTrue(tree.hasNode("/used"));
        assertFalse(tree.hasNode("/user"));
        assertNull(tree.getNodeByLabel("unused"));
    }

    @Test
    public void finishedTreeIsReadOnly() throws Exception {
        final DeviceTree tree = parse("/ { };");

        assertTrue(tree.isFinished());
        assertThrows(IllegalStateException.class, () -> tree.getRoot().getOrCreateChild("late"));
        assertThrows(IllegalStateException.class, () -> tree.getRoot().addLabel("late"));
    }
}
