package li.cil.dtk;

import li.cil.dtk.devicetree.DeviceTree;
import li.cil.dtk.devicetree.Node;
import li.cil.dtk.devicetree.Property;
import li.cil.dtk.dts.DeviceTreeSource;
import li.cil.dtk.dts.DeviceTreeWriter;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public final class DeviceTreeWriterTests {
    private static final String SOURCE = "/dts-v1/;\n" +
            "res: /memreserve/ 0x80000000 0x1000;\n" +
            "/ {\n" +
            "\t#address-cells = <1>;\n" +
            "\tmodel = \"test board\";\n" +
            "\tintc: interrupt-controller@0 {\n" +
            "\t\tinterrupt-controller;\n" +
            "\t\t#interrupt-cells = <2>;\n" +
            "\t};\n" +
            "\tuart@1000 {\n" +
            "\t\treg = <0x1000 start: 0x100 end:>;\n" +
            "\t\tinterrupt-parent = <&intc>;\n" +
            "\t\tpath = &intc;\n" +
            "\t\tbytes = [de ad be ef];\n" +
            "\t};\n" +
            "};\n";

    @Test
    public void writesTabIndentedByteStrings() throws Exception {
        final DeviceTree tree = DeviceTreeSource.parse("/dts-v1/;\n/ { l: node { p: a = <1>; b; }; };", "test.dts");

        assertEquals("/dts-v1/;\n\n" +
                "/ {\n" +
                "\tl: node {\n" +
                "\t\tp: a = [ 00 00 00 01 ];\n" +
                "\t\tb;\n" +
                "\t};\n" +
                "};\n", DeviceTreeWriter.write(tree));
    }

    @Test
    public void writesMemoryReservations() throws Exception {
        final DeviceTree tree = DeviceTreeSource.parse("/dts-v1/;\nr: /memreserve/ 0x10 0x20;\n/ { };", "test.dts");

        assertTrue(DeviceTreeWriter.write(tree).startsWith("/dts-v1/;\n\nr: /memreserve/ 0x0000000000000010 0x0000000000000020;\n\n"));
    }

    @Test
    public void writesLabelsInsideValues() throws Exception {
        final DeviceTree tree = DeviceTreeSource.parse(SOURCE, "test.dts");

        assertEquals("reg = [ 00 00 10 00 start: 00 00 01 00 end: ];",
                DeviceTreeWriter.write(tree.getNode("/uart@1000").getProperty("reg")));
    }

    @Test
    public void parsingOutputYieldsEqualTree() throws Exception {
        final DeviceTree tree = DeviceTreeSource.parse(SOURCE, "test.dts");
        final String written = DeviceTreeWriter.write(tree);
        final DeviceTree reparsed = DeviceTreeSource.parse(written, "written.dts");

        assertNodesEqual(tree.getRoot(), reparsed.getRoot());
        assertEquals(tree.getMemoryReservations().size(), reparsed.getMemoryReservations().size());
        assertEquals(tree.getMemoryReservations().get(0).labels, reparsed.getMemoryReservations().get(0).labels);
        assertEquals(written, DeviceTreeWriter.write(reparsed));
    }

    @Test
    public void rootLabelsAreWrittenAsReopenedRoot() throws Exception {
        final DeviceTree tree = DeviceTreeSource.parse("/dts-v1/;\n/ { a; };\nr: &{/} { };\ns: &{/} { };", "test.dts");
        final String written = DeviceTreeWriter.write(tree);

        assertEquals("/dts-v1/;\n\n" +
                "/ {\n" +
                "\ta;\n" +
                "};\n" +
                "\nr: &{/} {\n};\n" +
                "\ns: &{/} {\n};\n", written);

        final DeviceTree reparsed = DeviceTreeSource.parse(written, "written.dts");
        assertNodesEqual(tree.getRoot(), reparsed.getRoot());
        assertSame(reparsed.getRoot(), reparsed.getNodeByLabel("r"));
    }

    @Test
    public void labelsInsideEmptyValuesAreKept() throws Exception {
        final DeviceTree tree = DeviceTreeSource.parse("/dts-v1/;\n/ { p = [ l: ]; q; };", "test.dts");
        final String written = DeviceTreeWriter.write(tree);

        assertTrue(written.contains("\tp = [ l: ];\n"), written);
        assertTrue(written.contains("\tq;\n"), written);

        final DeviceTree reparsed = DeviceTreeSource.parse(written, "written.dts");
        assertNotNull(reparsed.getPropertyOffsetByLabel("l"));
        assertNodesEqual(tree.getRoot(), reparsed.getRoot());
    }

    private static void assertNodesEqual(final Node expected, final Node actual) {
        assertEquals(expected.getPath(), actual.getPath());
        assertEquals(expected.getLabels(), actual.getLabels());

        final List<Property> expectedProperties = new ArrayList<>(expected.getProperties());
        final List<Property> actualProperties = new ArrayList<>(actual.getProperties());
        assertEquals(expectedProperties.size(), actualProperties.size(), expected.getPath());
        for (int i = 0; i < expectedProperties.size(); i++) {
            final Property expectedProperty = expectedProperties.get(i);
            final Property actualProperty = actualProperties.get(i);
            assertEquals(expectedProperty.getName(), actualProperty.getName());
            assertArrayEquals(expectedProperty.getValue(), actualProperty.getValue(), expectedProperty.toString());
            assertEquals(expectedProperty.getLabels(), actualProperty.getLabels());
            assertEquals(expectedProperty.getOffsetLabels(), actualProperty.getOffsetLabels());
        }

        assertEquals(expected.getChildren().size(), actual.getChildren().size(), expected.getPath());
        final Iterator<Node> actualChildren = actual.getChildren().iterator();
        for (final Node expectedChild : expected.getChildren()) {
            assertNodesEqual(expectedChild, actualChildren.next());
        }
    }
}
