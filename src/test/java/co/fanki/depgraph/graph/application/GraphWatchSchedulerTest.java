package co.fanki.depgraph.graph.application;

import co.fanki.depgraph.graph.domain.DependencyGraph;
import co.fanki.depgraph.graph.domain.FileDependencyGraph;
import co.fanki.depgraph.shared.DomainException;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.lib.PersonIdent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link GraphWatchScheduler} against a real repository.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class GraphWatchSchedulerTest {

    private static final PersonIdent AUTHOR = new PersonIdent(
            "Test Author", "author@fanki.co");

    @TempDir
    Path root;

    private Git git;

    private GraphAnalysisService service;

    private GraphSnapshotCache cache;

    private GraphWatchScheduler scheduler;

    @BeforeEach
    void setUp() throws Exception {
        git = Git.init().setDirectory(root.toFile()).call();
        Files.writeString(root.resolve("a.py"), "import b\n");
        git.add().addFilepattern(".").call();
        git.commit().setMessage("initial").setAuthor(AUTHOR)
                .setCommitter(AUTHOR).setSign(false).call();

        service = mock(GraphAnalysisService.class);
        cache = new GraphSnapshotCache();
        scheduler = new GraphWatchScheduler(service, cache, root.toString(),
                false);
    }

    @AfterEach
    void tearDown() {
        git.close();
    }

    @Test
    void whenPolling_givenFirstRun_shouldPublishSnapshot() {
        when(service.analyze(any())).thenReturn(analysis());

        scheduler.poll();

        assertTrue(cache.latest().isPresent());
        assertEquals("working tree",
                cache.latest().orElseThrow().analysis().label());
    }

    @Test
    void whenPolling_givenNoChanges_shouldNotRebuild() {
        when(service.analyze(any())).thenReturn(analysis());

        scheduler.poll();
        scheduler.poll();

        verify(service, times(1)).analyze(any());
    }

    @Test
    void whenPolling_givenWorkTreeChange_shouldRebuild() throws IOException {
        when(service.analyze(any())).thenReturn(analysis());

        scheduler.poll();
        final String first = cache.latest().orElseThrow().signature();

        Files.writeString(root.resolve("b.py"), "x = 1\n");
        scheduler.poll();

        verify(service, times(2)).analyze(any());
        assertNotEquals(first, cache.latest().orElseThrow().signature());
    }

    @Test
    void whenPolling_givenFailedRebuild_shouldKeepPreviousAndRetry()
            throws IOException {
        when(service.analyze(any())).thenReturn(analysis());
        scheduler.poll();
        final GraphSnapshot previous = cache.latest().orElseThrow();

        when(service.analyze(any())).thenThrow(new DomainException(
                "boom", GraphAnalysisService.SOURCE_UNAVAILABLE));
        Files.writeString(root.resolve("b.py"), "x = 1\n");
        scheduler.poll();
        scheduler.poll();

        assertEquals(previous, cache.latest().orElseThrow());
        verify(service, times(3)).analyze(any());
    }

    @Test
    void whenPolling_givenPlainDirectory_shouldSkipAnalysis(
            @TempDir final Path plain) {
        final GraphWatchScheduler watcher = new GraphWatchScheduler(service,
                cache, plain.toString(), false);

        watcher.poll();

        verify(service, never()).analyze(any());
        assertTrue(cache.latest().isEmpty());
    }

    private static GraphAnalysis analysis() {
        return new GraphAnalysis(
                FileDependencyGraph.create(DependencyGraph.empty(), null,
                        path -> false),
                Map.of(), List.of(), List.of(), "working tree", "/repo");
    }

}
