package co.fanki.depgraph.graph.application;

import co.fanki.depgraph.shared.DomainException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link SourceFileCollector}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class SourceFileCollectorTest {

    private final SourceFileCollector collector = new SourceFileCollector();

    @Test
    void whenCollecting_givenExcludedDirectories_shouldSkipThem(
            @TempDir final Path root) throws IOException {
        touch(root, "src/app.ts");
        touch(root, "src/build.ts");
        touch(root, "node_modules/lib/index.js");
        touch(root, "target/classes/App.class");
        touch(root, ".git/HEAD");

        assertEquals(List.of(root.resolve("src/app.ts").toString(),
                root.resolve("src/build.ts").toString()),
                collector.collect(root));
    }

    @Test
    void whenExpanding_givenFileAndDirectory_shouldMergeWithoutDuplicates(
            @TempDir final Path root) throws IOException {
        touch(root, "a/one.py");
        touch(root, "a/two.py");
        touch(root, "b/three.py");

        final List<String> files = collector.expand(root,
                List.of("b/three.py", "a", "a/one.py"));

        assertEquals(List.of(root.resolve("b/three.py").toString(),
                root.resolve("a/one.py").toString(),
                root.resolve("a/two.py").toString()), files);
    }

    @Test
    void whenExpanding_givenMissingPath_shouldThrowDomainException(
            @TempDir final Path root) {
        final DomainException e = assertThrows(DomainException.class,
                () -> collector.expand(root, List.of("nope.js")));

        assertEquals(GraphRequest.INVALID_REQUEST, e.getErrorCode());
    }

    @Test
    void whenFiltering_givenIncludeAndExclude_shouldApplyBoth() {
        final List<String> files = List.of("/r/a.ts", "/r/b.TSX",
                "/r/c.js", "/r/d.md");

        assertEquals(List.of("/r/a.ts", "/r/b.TSX"),
                collector.filterByExtension(files, List.of("ts", ".tsx"),
                        List.of()));
        assertEquals(List.of("/r/a.ts", "/r/b.TSX", "/r/c.js"),
                collector.filterByExtension(files, List.of(),
                        List.of(".MD")));
    }

    private static void touch(final Path root, final String relative)
            throws IOException {
        final Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "");
    }

}
