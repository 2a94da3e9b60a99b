package li.cil.dtk.binding;

import li.cil.dtk.api.Diagnostics;
import li.cil.dtk.devicetree.DeviceTree;
import li.cil.dtk.devicetree.Node;
import li.cil.dtk.devicetree.Property;
import li.cil.dtk.exception.BindingException;
import li.cil.dtk.exception.SemanticException;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.LineIterator;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nullable;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Maps (compatible, bus) pairs to {@link Binding}s.
 * <p>
 * All {@code *.yaml} files below a bindings directory are considered. To avoid parsing
 * every file, the compatible string a binding declares is first extracted with a cheap
 * line scan, and only bindings for compatible strings that actually occur in the device
 * tree are loaded.
 */
public final class BindingResolver {
    private static final Logger LOGGER = LogManager.getLogger();

    private static final Pattern CONSTRAINT_PATTERN = Pattern.compile("\\s+constraint:\\s*\"([^\"]*)\"");

    private final Map<Pair<String, String>, Binding> bindings;

    private BindingResolver(final Map<Pair<String, String>, Binding> bindings) {
        this.bindings = bindings;
    }

    /**
     * Loads the bindings below {@code directory} needed for the given tree.
     *
     * @throws BindingException  if a needed binding is malformed or cannot be read.
     * @throws SemanticException if a {@code compatible} property in the tree is malformed.
     */
    public static BindingResolver load(final Path directory, final DeviceTree tree, final Diagnostics diagnostics) throws BindingException, SemanticException {
        return load(findBindingFiles(directory), collectCompatibles(tree), diagnostics);
    }

    public static BindingResolver load(final Path directory, final DeviceTree tree) throws BindingException, SemanticException {
        return load(directory, tree, Diagnostics.LOGGER);
    }

    /**
     * Loads the bindings among {@code bindingFiles} that declare one of the given compatible
     * strings. All files take part in {@code !include} resolution.
     */
    public static BindingResolver load(final List<Path> bindingFiles, final Set<String> compatibles, final Diagnostics diagnostics) throws BindingException {
        final BindingLoader loader = new BindingLoader(bindingFiles, diagnostics);
        final Map<Pair<String, String>, Binding> bindings = new HashMap<>();

        for (final Path path : bindingFiles) {
            final String compatible = scanCompatible(path);
            if (compatible == null || !compatibles.contains(compatible)) {
                continue;
            }

            final Binding binding = loader.load(path);
            final Pair<String, String> key = Pair.of(compatible, binding.getBus());
            final Binding existing = bindings.put(key, binding);
            if (existing != null) {
                diagnostics.warn(String.format("%s: binding for '%s' on bus '%s' already defined in %s, replacing it",
                        path, compatible, binding.getBus(), existing.getPath()));
            }
        }

        LOGGER.debug("Loaded [{}] binding(s) out of [{}] file(s).", bindings.size(), bindingFiles.size());

        return new BindingResolver(bindings);
    }

    public static BindingResolver empty() {
        return new BindingResolver(Collections.emptyMap());
    }

    /**
     * Looks up the binding for a compatible string on a bus.
     *
     * @param compatible the compatible string.
     * @param bus        the bus the device sits on, i.e. the child bus declared by the binding
     *                   of its parent, or {@code null} if there is none.
     */
    @Nullable
    public Binding find(final String compatible, @Nullable final String bus) {
        return bindings.get(Pair.of(compatible, bus));
    }

    public Collection<Binding> getBindings() {
        return Collections.unmodifiableCollection(bindings.values());
    }

    // --------------------------------------------------------------------- //

    static List<Path> findBindingFiles(final Path directory) throws BindingException {
        if (!Files.isDirectory(directory)) {
            throw new BindingException(directory, "bindings directory does not exist");
        }

        return FileUtils.listFiles(directory.toFile(), new String[]{"yaml"}, true).stream()
                .map(File::toPath)
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * Extracts the compatible string from the first {@code constraint: "..."} line.
     */
    @Nullable
    static String scanCompatible(final Path path) throws BindingException {
        try (final LineIterator lines = FileUtils.lineIterator(path.toFile(), StandardCharsets.UTF_8.name())) {
            while (lines.hasNext()) {
                final Matcher matcher = CONSTRAINT_PATTERN.matcher(lines.next());
                if (matcher.lookingAt()) {
                    return matcher.group(1);
                }
            }
            return null;
        } catch (final IOException e) {
            throw new BindingException(path, "could not read binding: " + e.getMessage(), e);
        }
    }

    private static Set<String> collectCompatibles(final DeviceTree tree) throws SemanticException {
        final Set<String> result = new HashSet<>();
        for (final Node node : tree.nodes()) {
            final Property compatible = node.getProperty("compatible");
            if (compatible != null) {
                result.addAll(compatible.toStrings());
            }
        }
        return result;
    }
}
