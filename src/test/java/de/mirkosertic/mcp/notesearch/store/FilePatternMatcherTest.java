package de.mirkosertic.mcp.notesearch.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FilePatternMatcher Tests")
class FilePatternMatcherTest {

    @Test
    @DisplayName("Markdown only matcher accepts .md files")
    void markdownOnly() {
        assertThat(FilePatternMatcher.MARKDOWN_ONLY.shouldInclude(Path.of("/notes/projects/plan.md"))).isTrue();
        assertThat(FilePatternMatcher.MARKDOWN_ONLY.shouldInclude(Path.of("/notes/projects/image.png"))).isFalse();
    }

    @Test
    @DisplayName("Excludes win over includes")
    void excludesWin() {
        final FilePatternMatcher matcher = new FilePatternMatcher(List.of("*.md"), List.of("**/.git/**", "**/templates/**"));

        assertThat(matcher.shouldInclude(Path.of("/notes/.git/info/readme.md"))).isFalse();
        assertThat(matcher.shouldInclude(Path.of("/notes/resources/templates/daily.md"))).isFalse();
        assertThat(matcher.shouldInclude(Path.of("/notes/resources/daily.md"))).isTrue();
        assertThat(matcher.isExcluded(Path.of("/notes/.git"))).isFalse();
        assertThat(matcher.isExcluded(Path.of("/notes/.git/objects/ab"))).isTrue();
    }

    @Test
    @DisplayName("Without includes every non excluded file counts")
    void noIncludes() {
        final FilePatternMatcher matcher = new FilePatternMatcher(List.of(), List.of("**/*.tmp"));

        assertThat(matcher.shouldInclude(Path.of("/notes/a.txt"))).isTrue();
        assertThat(matcher.shouldInclude(Path.of("/notes/a.tmp"))).isFalse();
    }
}
