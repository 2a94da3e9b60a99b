package li.cil.dtk;

import li.cil.dtk.devicetree.DeviceTree;
import li.cil.dtk.dts.DeviceTreeSource;
import li.cil.dtk.exception.ParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public final class IncludeTests {
    @TempDir
    Path directory;

    private Path sharedDirectory;

    @BeforeEach
    public void setupEach() throws IOException {
        sharedDirectory = Files.createDirectory(directory.resolve("shared"));
    }

    private Path write(final Path path, final String contents) throws IOException {
        Files.write(path, contents.getBytes(StandardCharsets.UTF_8));
        return path;
    }

    @Test
    public void includedFilesAreSpliced() throws Exception {
        write(directory.resolve("soc.dtsi"), "/ { soc { compatible = \"simple-bus\"; }; };\n");
        final Path board = write(directory.resolve("board.dts"), "/dts-v1/;\n/include/ \"soc.dtsi\"\n/ { soc { extra; }; };\n");

        final DeviceTree tree = DeviceTreeSource.parse(board);

        assertEquals("simple-bus", tree.getNode("/soc").getProperty("compatible").toText());
        assertTrue(tree.getNode("/soc").hasProperty("extra"));
    }

    @Test
    public void includePathIsSearchedAfterCurrentDirectory() throws Exception {
        write(sharedDirectory.resolve("common.dtsi"), "/ { from-shared; };\n");
        final Path board = write(directory.resolve("board.dts"), "/dts-v1/;\n/include/ \"common.dtsi\"\n");

        final DeviceTree tree = DeviceTreeSource.parse(board, Collections.singletonList(sharedDirectory));

        assertTrue(tree.getRoot().hasProperty("from-shared"));
    }

    @Test
    public void errorsInIncludedFilesReportThatFile() throws Exception {
        final Path included = write(directory.resolve("broken.dtsi"), "/ {\n\tbad = <1>\n};\n");
        final Path board = write(directory.resolve("board.dts"), "/dts-v1/;\n/include/ \"broken.dtsi\"\n");

        final ParseException e = assertThrows(ParseException.class, () -> DeviceTreeSource.parse(board));
        assertEquals(included.toString(), e.getFileName());
        assertEquals(3, e.getLine());
    }

    @Test
    public void lineNumbersResumeAfterInclude() throws Exception {
        write(directory.resolve("empty.dtsi"), "\n\n\n\n");
        final Path board = write(directory.resolve("board.dts"), "/dts-v1/;\n/include/ \"empty.dtsi\"\n/ {\n\tbad = <1>\n};\n");

        final ParseException e = assertThrows(ParseException.class, () -> DeviceTreeSource.parse(board));
        assertEquals(board.toString(), e.getFileName());
        assertEquals(5, e.getLine());
    }

    @Test
    public void missingIncludeIsAParseError() throws Exception {
        final Path board = write(directory.resolve("board.dts"), "/dts-v1/;\n/include/ \"missing.dtsi\"\n/ { };\n");

        final ParseException e = assertThrows(ParseException.class, () -> DeviceTreeSource.parse(board));
        assertEquals("'missing.dtsi' could not be found", e.getReason());
    }

    @Test
    public void recursiveIncludeIsDetected() throws Exception {
        write(directory.resolve("a.dtsi"), "/include/ \"b.dtsi\"\n");
        write(directory.resolve("b.dtsi"), "/include/ \"a.dtsi\"\n");
        final Path board = write(directory.resolve("board.dts"), "/dts-v1/;\n/include/ \"a.dtsi\"\n/ { };\n");

        final ParseException e = assertThrows(ParseException.class, () -> DeviceTreeSource.parse(board));
        assertTrue(e.getReason().startsWith("recursive /include/:"), e.getReason());
        assertTrue(e.getReason().contains("b.dtsi"));
    }

    @Test
    public void incbinReadsWholeFileOrSlice() throws Exception {
        Files.write(directory.resolve("blob.bin"), new byte[]{1, 2, 3, 4, 5});
        final Path board = write(directory.resolve("board.dts"),
                "/dts-v1/;\n/ { all = /incbin/(\"blob.bin\"); part = /incbin/(\"blob.bin\", 1, 2); };\n");

        final DeviceTree tree = DeviceTreeSource.parse(board);

        assertArrayEquals(new byte[]{1, 2, 3, 4, 5}, tree.getRoot().getProperty("all").getValue());
        assertArrayEquals(new byte[]{2, 3}, tree.getRoot().getProperty("part").getValue());
    }

    @Test
    public void incbinReadsAtMostSizeBytes() throws Exception {
        Files.write(directory.resolve("blob.bin"), new byte[]{1, 2, 3});
        final Path board = write(directory.resolve("board.dts"),
                "/dts-v1/;\n/ {\n" +
                "\ttail = /incbin/(\"blob.bin\", 1, 10);\n" +
                "\tlarge = /incbin/(\"blob.bin\", 0, 0xffffffff);\n" +
                "\thuge = /incbin/(\"blob.bin\", 0, 0x100000000);\n" +
                "\tpast = /incbin/(\"blob.bin\", 5, 1);\n" +
                "};\n");

        final DeviceTree tree = DeviceTreeSource.parse(board);

        assertArrayEquals(new byte[]{2, 3}, tree.getRoot().getProperty("tail").getValue());
        assertArrayEquals(new byte[]{1, 2, 3}, tree.getRoot().getProperty("large").getValue());
        assertArrayEquals(new byte[]{1, 2, 3}, tree.getRoot().getProperty("huge").getValue());
        assertEquals(0, tree.getRoot().getProperty("past").length());
    }

    @Test
    public void incbinOffsetOutOfRangeIsParseError() throws Exception {
        Files.write(directory.resolve("blob.bin"), new byte[]{1, 2, 3});
        final Path board = write(directory.resolve("board.dts"),
                "/dts-v1/;\n/ { p = /incbin/(\"blob.bin\", (-1), 1); };\n");

        final ParseException e = assertThrows(ParseException.class, () -> DeviceTreeSource.parse(board));
        assertTrue(e.getReason().contains("offset out of range"), e.getReason());
    }
}
