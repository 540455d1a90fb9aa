package de.mirkosertic.mcp.notesearch.store;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;

/**
 * Decides which files under the context root are notes.
 *
 * <p>Include globs are matched against the file name ({@code *.md}), exclude globs against the full path
 * ({@code **}{@code /.git/**}). Excludes win. Without include globs every file that is not excluded counts.</p>
 */
public class FilePatternMatcher {

    public static final FilePatternMatcher MARKDOWN_ONLY = new FilePatternMatcher(List.of("*.md"), List.of());

    private final List<PathMatcher> includeMatchers;
    private final List<PathMatcher> excludeMatchers;

    public FilePatternMatcher(final List<String> includePatterns, final List<String> excludePatterns) {
        this.includeMatchers = includePatterns.stream()
                .map(FilePatternMatcher::glob)
                .toList();
        this.excludeMatchers = excludePatterns.stream()
                .map(FilePatternMatcher::glob)
                .toList();
    }

    private static PathMatcher glob(final String pattern) {
        return FileSystems.getDefault().getPathMatcher("glob:" + pattern);
    }

    public boolean isExcluded(final Path path) {
        for (final PathMatcher excludeMatcher : excludeMatchers) {
            if (excludeMatcher.matches(path)) {
                return true;
            }
        }
        return false;
    }

    public boolean shouldInclude(final Path file) {
        if (isExcluded(file)) {
            return false;
        }
        if (includeMatchers.isEmpty()) {
            return true;
        }
        final Path fileName = file.getFileName();
        if (fileName == null) {
            return false;
        }
        for (final PathMatcher includeMatcher : includeMatchers) {
            if (includeMatcher.matches(fileName)) {
                return true;
            }
        }
        return false;
    }
}
