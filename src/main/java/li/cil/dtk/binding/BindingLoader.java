package li.cil.dtk.binding;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLParser;
import li.cil.dtk.api.Diagnostics;
import li.cil.dtk.exception.BindingException;
import org.apache.commons.io.FilenameUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Reads binding files, resolving {@code !include} tags and merging {@code inherits:}.
 * <p>
 * {@code !include name.yaml} is replaced by a list holding the included document, and
 * {@code !include [a.yaml, b.yaml]} by a list holding one document per file. Included
 * files are looked up by their base name among all known binding files, which must be
 * unambiguous.
 * <p>
 * When merging, keys of the including document win over keys of the inherited ones, with
 * a warning for anything but {@code title}, {@code version}, {@code description} and
 * {@code category} being raised from {@code optional} to {@code required}.
 */
final class BindingLoader {
    private static final Logger LOGGER = LogManager.getLogger();

    private static final String INCLUDE_TAG = "include";
    private static final String INHERITS_KEY = "inherits";
    private static final String CATEGORY_KEY = "category";
    private static final Set<String> EXPECTED_KEYS = new LinkedHashSet<>(Arrays.asList("title", "version", "description"));

    private final YAMLFactory yamlFactory = new YAMLFactory();
    private final List<Path> bindingFiles;
    private final Diagnostics diagnostics;
    private final Deque<Path> loading = new ArrayDeque<>();

    BindingLoader(final List<Path> bindingFiles, final Diagnostics diagnostics) {
        this.bindingFiles = bindingFiles;
        this.diagnostics = diagnostics;
    }

    /**
     * Loads and merges a top-level binding file.
     */
    public Binding load(final Path path) throws BindingException {
        LOGGER.debug("Loading binding [{}].", path);
        final Map<String, Object> document = asDocument(path, readDocument(path));
        return Binding.create(path, merge(path, document), diagnostics);
    }

    // --------------------------------------------------------------------- //
    // Reading

    @Nullable
    private Object readDocument(final Path path) throws BindingException {
        if (loading.contains(path)) {
            final List<String> chain = loading.stream().map(Path::toString).collect(Collectors.toList());
            Collections.reverse(chain);
            chain.add(path.toString());
            throw new BindingException(path, "recursive !include: " + String.join(" -> ", chain));
        }

        loading.push(path);
        try (final YAMLParser parser = yamlFactory.createParser(path.toFile())) {
            if (parser.nextToken() == null) {
                return null;
            }
            return readValue(path, parser);
        } catch (final IOException e) {
            throw new BindingException(path, "could not read binding: " + e.getMessage(), e);
        } finally {
            loading.pop();
        }
    }

    @Nullable
    private Object readValue(final Path path, final YAMLParser parser) throws IOException, BindingException {
        final JsonToken token = parser.currentToken();
        final boolean isInclude = INCLUDE_TAG.equals(parser.getTypeId());

        switch (token) {
            case START_OBJECT -> {
                if (isInclude) {
                    throw new BindingException(path, "unrecognised node type in !include statement");
                }
                final Map<String, Object> map = new LinkedHashMap<>();
                while (parser.nextToken() == JsonToken.FIELD_NAME) {
                    final String key = parser.getCurrentName();
                    parser.nextToken();
                    map.put(key, readValue(path, parser));
                }
                return map;
            }
            case START_ARRAY -> {
                final List<Object> list = new ArrayList<>();
                while (parser.nextToken() != JsonToken.END_ARRAY) {
                    list.add(readValue(path, parser));
                }
                if (!isInclude) {
                    return list;
                }

                final List<Object> documents = new ArrayList<>();
                for (final Object name : list) {
                    if (!(name instanceof String)) {
                        throw new BindingException(path, "unrecognised node type in !include statement");
                    }
                    documents.add(include(path, (String) name));
                }
                return documents;
            }
            case VALUE_STRING -> {
                if (isInclude) {
                    final List<Object> documents = new ArrayList<>();
                    documents.add(include(path, parser.getText()));
                    return documents;
                }
                return parser.getText();
            }
            case VALUE_NUMBER_INT -> {
                if (parser.getNumberType() == JsonParser.NumberType.BIG_INTEGER) {
                    return parser.getBigIntegerValue();
                }
                return parser.getLongValue();
            }
            case VALUE_NUMBER_FLOAT -> {
                return parser.getDoubleValue();
            }
            case VALUE_TRUE -> {
                return Boolean.TRUE;
            }
            case VALUE_FALSE -> {
                return Boolean.FALSE;
            }
            case VALUE_NULL -> {
                return null;
            }
            default -> throw new BindingException(path, "unexpected YAML content: " + token);
        }
    }

    private Object include(final Path includingPath, final String name) throws BindingException {
        final List<Path> candidates = bindingFiles.stream()
                .filter(file -> FilenameUtils.getName(file.toString()).equals(name))
                .collect(Collectors.toList());

        if (candidates.isEmpty()) {
            throw new BindingException(includingPath, String.format("'%s' not found", name));
        }
        if (candidates.size() > 1) {
            throw new BindingException(includingPath, String.format("multiple candidates for '%s' in !include: %s",
                    name, candidates.stream().map(Path::toString).collect(Collectors.joining(", "))));
        }

        LOGGER.debug("Including binding [{}] from [{}].", candidates.get(0), includingPath);

        final Object document = readDocument(candidates.get(0));
        return document != null ? document : new LinkedHashMap<String, Object>();
    }

    // --------------------------------------------------------------------- //
    // Merging

    /**
     * Merges a document into the documents it inherits from, depth first.
     */
    private Map<String, Object> merge(final Path path, final Map<String, Object> document) throws BindingException {
        for (final String key : EXPECTED_KEYS) {
            if (!document.containsKey(key)) {
                diagnostics.warn(String.format("'%s' lacks '%s' property", path, key));
            }
        }

        final Object inherits = document.remove(INHERITS_KEY);
        if (inherits == null) {
            return document;
        }

        Map<String, Object> result = document;
        for (final Object inherited : flatten(inherits)) {
            final Map<String, Object> base = merge(path, asDocument(path, inherited));
            mergeInto(path, null, base, result);
            result = base;
        }
        return result;
    }

    private static List<Object> flatten(final Object value) {
        final List<Object> result = new ArrayList<>();
        if (value instanceof List) {
            for (final Object item : (List<?>) value) {
                result.addAll(flatten(item));
            }
        } else {
            result.add(value);
        }
        return result;
    }

    private void mergeInto(final Path path, @Nullable final String parentKey,
                           final Map<String, Object> to, final Map<String, Object> from) throws BindingException {
        for (final Map.Entry<String, Object> entry : from.entrySet()) {
            final String key = entry.getKey();
            final Object fromValue = entry.getValue();
            final Object toValue = to.get(key);

            final boolean isFromMap = fromValue instanceof Map;
            final boolean isToMap = toValue instanceof Map;
            if (isFromMap && isToMap) {
                @SuppressWarnings("unchecked") final Map<String, Object> toMap = (Map<String, Object>) toValue;
                @SuppressWarnings("unchecked") final Map<String, Object> fromMap = (Map<String, Object>) fromValue;
                mergeInto(path, key, toMap, fromMap);
                continue;
            }

            if (to.containsKey(key) && !Objects.equals(toValue, fromValue)) {
                if (toValue != null && fromValue != null && isFromMap != isToMap) {
                    throw new BindingException(path, String.format("bad merge of '%s' (in '%s'): cannot merge '%s' into '%s'",
                            key, parentKey, fromValue, toValue));
                }

                if (CATEGORY_KEY.equals(key) && "required".equals(toValue) && "optional".equals(fromValue)) {
                    throw new BindingException(path, String.format("bad merge of '%s' (in '%s'): cannot change 'required' to 'optional'",
                            key, parentKey));
                }

                if (isSuspiciousOverwrite(key, toValue, fromValue)) {
                    diagnostics.warn(String.format("%s (in '%s'): '%s' from !include'd file overwritten ('%s' replaced with '%s')",
                            path, parentKey, key, toValue, fromValue));
                }
            }

            to.put(key, fromValue);
        }
    }

    private static boolean isSuspiciousOverwrite(final String key, @Nullable final Object toValue, @Nullable final Object fromValue) {
        if (EXPECTED_KEYS.contains(key)) {
            return false;
        }
        return !(CATEGORY_KEY.equals(key) && "optional".equals(toValue) && "required".equals(fromValue));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asDocument(final Path path, @Nullable final Object document) throws BindingException {
        if (document == null) {
            return new LinkedHashMap<>();
        }
        if (!(document instanceof Map)) {
            throw new BindingException(path, "binding is not a mapping");
        }
        return (Map<String, Object>) document;
    }
}
