package li.cil.dtk.dts;

import li.cil.dtk.devicetree.DeviceTree;
import li.cil.dtk.devicetree.DeviceTreePostProcessor;
import li.cil.dtk.exception.ParseException;
import li.cil.dtk.exception.SemanticException;
import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * Entry point for turning device tree source into a finished {@link DeviceTree}.
 * <p>
 * Parsing is all or nothing, either a fully resolved, read-only tree is returned or an
 * exception is thrown.
 */
public final class DeviceTreeSource {
    private static final Logger LOGGER = LogManager.getLogger();

    public static DeviceTree parse(final Path file) throws IOException, ParseException, SemanticException {
        return parse(file, Collections.emptyList());
    }

    /**
     * Parses a source file.
     *
     * @param file        the file to parse.
     * @param includePath directories searched for {@code /include/}d and {@code /incbin/}'d
     *                    files after the directory of the including file.
     * @return the finished tree.
     * @throws IOException        if the file itself cannot be read.
     * @throws ParseException     if the source is malformed or included files are missing.
     * @throws SemanticException  if references cannot be resolved or phandles or labels clash.
     */
    public static DeviceTree parse(final Path file, final List<Path> includePath) throws IOException, ParseException, SemanticException {
        final String text = FileUtils.readFileToString(file.toFile(), StandardCharsets.UTF_8);
        return parse(text, file.toString(), includePath);
    }

    /**
     * Parses in-memory source text. Relative includes are resolved against the directory
     * part of {@code fileName}, if any.
     */
    public static DeviceTree parse(final String text, final String fileName, final List<Path> includePath) throws ParseException, SemanticException {
        LOGGER.debug("Parsing device tree [{}].", fileName);

        final DeviceTree tree = new DeviceTreeParser(new Lexer(text, fileName, includePath)).parse();
        DeviceTreePostProcessor.process(tree);
        return tree;
    }

    public static DeviceTree parse(final String text, final String fileName) throws ParseException, SemanticException {
        return parse(text, fileName, Collections.emptyList());
    }
}
