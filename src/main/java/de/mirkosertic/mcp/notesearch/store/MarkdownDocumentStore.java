package de.mirkosertic.mcp.notesearch.store;

import de.mirkosertic.mcp.notesearch.index.Category;
import de.mirkosertic.mcp.notesearch.index.IndexedDocument;
import de.mirkosertic.mcp.notesearch.util.TextCleaner;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Reads PARA organized markdown notes below a context root.
 *
 * <ul>
 *   <li>title: frontmatter {@code title}, else the first level one heading, else the file name without
 *       extension</li>
 *   <li>tags: frontmatter {@code tags} as a YAML list or a comma separated string, a leading {@code #} is
 *       dropped</li>
 *   <li>created / modified: frontmatter dates or timestamps, else the file times</li>
 *   <li>category: the first path segment ({@code projects}, {@code areas}, {@code resources},
 *       {@code archives}), else Resources</li>
 * </ul>
 */
public class MarkdownDocumentStore implements DocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(MarkdownDocumentStore.class);

    private static final Pattern FIRST_HEADING = Pattern.compile("^#\\s+(.+)$", Pattern.MULTILINE);
    private static final String MARKDOWN_EXTENSION = ".md";

    private final Path root;
    private final FilePatternMatcher patternMatcher;
    private final FrontmatterParser frontmatterParser = new FrontmatterParser();

    public MarkdownDocumentStore(final Path root) {
        this(root, FilePatternMatcher.MARKDOWN_ONLY);
    }

    public MarkdownDocumentStore(final Path root, final FilePatternMatcher patternMatcher) {
        this.root = root.toAbsolutePath().normalize();
        this.patternMatcher = patternMatcher;
    }

    public Path getRoot() {
        return root;
    }

    public FilePatternMatcher getPatternMatcher() {
        return patternMatcher;
    }

    /**
     * A missing context root is logged and yields no documents.
     */
    @Override
    public List<String> list() throws IOException {
        if (!Files.isDirectory(root)) {
            logger.warn("Context root {} does not exist or is not a directory", root);
            return List.of();
        }
        try (final Stream<Path> files = Files.walk(root)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(patternMatcher::shouldInclude)
                    .map(this::toRelativePath)
                    .sorted()
                    .toList();
        }
    }

    @Override
    public IndexedDocument read(final String path) throws IOException {
        final Path file = resolve(path);
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(path);
        }

        final String text = TextCleaner.cleanMarkdown(Files.readString(file, StandardCharsets.UTF_8));
        final Frontmatter frontmatter = frontmatterParser.parse(path, text);
        final Map<String, Object> properties = frontmatter.properties();
        final BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);

        final Instant created = dateProperty(path, properties.get("created"));
        final Instant modified = dateProperty(path, properties.get("modified"));

        return new IndexedDocument(
                path,
                title(properties, frontmatter.body(), file),
                frontmatter.body(),
                tags(properties.get("tags")),
                category(path),
                created != null ? created : attributes.creationTime().toInstant(),
                modified != null ? modified : attributes.lastModifiedTime().toInstant());
    }

    /**
     * Converts an absolute file below the root into the {@code /} separated path used as document key.
     */
    public String toRelativePath(final Path file) {
        return root.relativize(file.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }

    private Path resolve(final String path) throws IOException {
        final Path file = root.resolve(path).normalize();
        if (!file.startsWith(root)) {
            throw new IOException("Path " + path + " is outside of the context root");
        }
        return file;
    }

    private static String title(final Map<String, Object> properties, final String body, final Path file) {
        final Object title = properties.get("title");
        if (title != null && !title.toString().isBlank()) {
            return TextCleaner.cleanValue(title.toString());
        }
        final Matcher heading = FIRST_HEADING.matcher(body);
        if (heading.find()) {
            final String text = TextCleaner.cleanValue(heading.group(1));
            if (!text.isEmpty()) {
                return text;
            }
        }
        final String fileName = file.getFileName().toString();
        return fileName.endsWith(MARKDOWN_EXTENSION)
                ? fileName.substring(0, fileName.length() - MARKDOWN_EXTENSION.length())
                : fileName;
    }

    static Set<String> tags(final @Nullable Object value) {
        final List<String> raw = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (final Object element : collection) {
                if (element != null) {
                    raw.add(element.toString());
                }
            }
        } else if (value != null) {
            for (final String part : value.toString().split(",")) {
                raw.add(part);
            }
        }

        final Set<String> tags = new LinkedHashSet<>();
        for (final String tag : raw) {
            String cleaned = TextCleaner.cleanValue(tag);
            if (cleaned.startsWith("#")) {
                cleaned = cleaned.substring(1).trim();
            }
            if (!cleaned.isEmpty()) {
                tags.add(cleaned);
            }
        }
        return tags;
    }

    static Category category(final String path) {
        final int separator = path.indexOf('/');
        if (separator <= 0) {
            return Category.RESOURCES;
        }
        final Category category = Category.fromString(path.substring(0, separator));
        return category != null ? category : Category.RESOURCES;
    }

    /**
     * SnakeYAML turns unquoted timestamps into {@link Date}, quoted ones stay strings.
     */
    static @Nullable Instant dateProperty(final String path, final @Nullable Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        final String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (final DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        } catch (final DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (final DateTimeParseException e) {
            logger.warn("Ignoring unparseable date '{}' in {}", text, path);
            return null;
        }
    }
}
