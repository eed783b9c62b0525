package co.fanki.depgraph.graph.application;

import co.fanki.depgraph.graph.domain.DependencyGraph;
import co.fanki.depgraph.graph.domain.FileDependencyGraph;
import co.fanki.depgraph.graph.domain.GraphClosureException;
import co.fanki.depgraph.graph.domain.ImportResolverRegistry;
import co.fanki.depgraph.graph.domain.NodeNamer;
import co.fanki.depgraph.shared.DomainException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.InvalidPathException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web layer tests for {@link GraphController}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class GraphControllerTest {

    private static final String BODY = "{\"repositoryPath\": \"/repo\"}";

    private GraphAnalysisService service;

    private GraphSnapshotCache cache;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        service = mock(GraphAnalysisService.class);
        cache = mock(GraphSnapshotCache.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new GraphController(
                service, new GraphViewAssembler(),
                ImportResolverRegistry.defaults(), cache)).build();
    }

    @Test
    void whenPostingGraph_givenValidRequest_shouldReturnView()
            throws Exception {
        when(service.analyze(any())).thenReturn(analysis());

        mockMvc.perform(post("/api/graph")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.label").value("working tree"))
                .andExpect(jsonPath("$.summary.nodes").value(2))
                .andExpect(jsonPath("$.summary.cycles").value(1))
                .andExpect(jsonPath("$.nodes[0].name").value("a.py"))
                .andExpect(jsonPath("$.edges[0].inCycle").value(true));
    }

    @Test
    void whenPostingCycles_givenValidRequest_shouldReturnCyclesOnly()
            throws Exception {
        when(service.analyze(any())).thenReturn(analysis());

        mockMvc.perform(post("/api/graph/cycles")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.cycles[0].files[0]")
                        .value("/repo/a.py"));
    }

    @Test
    void whenPostingGraph_givenInvalidRequest_shouldReturnBadRequest()
            throws Exception {
        when(service.analyze(any())).thenThrow(new DomainException(
                "Level must be at least 1", GraphRequest.INVALID_REQUEST));

        mockMvc.perform(post("/api/graph")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_REQUEST"))
                .andExpect(jsonPath("$.error")
                        .value("Level must be at least 1"));
    }

    @Test
    void whenPostingGraph_givenMalformedPath_shouldReturnBadRequest()
            throws Exception {
        when(service.analyze(any())).thenThrow(
                new IllegalArgumentException("Path must not be blank"));

        mockMvc.perform(post("/api/graph")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_REQUEST"))
                .andExpect(jsonPath("$.error")
                        .value("Path must not be blank"));
    }

    @Test
    void whenPostingCycles_givenInvalidPath_shouldReturnBadRequest()
            throws Exception {
        when(service.analyze(any())).thenThrow(
                new InvalidPathException("src/<a>", "Illegal char"));

        mockMvc.perform(post("/api/graph/cycles")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_REQUEST"));
    }

    @Test
    void whenPostingGraph_givenClosureViolation_shouldReturnServerError()
            throws Exception {
        when(service.analyze(any())).thenThrow(new GraphClosureException(
                Map.of("/repo/a.py", Set.of("/elsewhere/b.py"))));

        mockMvc.perform(post("/api/graph")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.errorCode")
                        .value("CLOSURE_VIOLATION"));
    }

    @Test
    void whenListingLanguages_shouldReturnRegisteredResolvers()
            throws Exception {
        mockMvc.perform(get("/api/graph/languages"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].language").value("Java"))
                .andExpect(jsonPath("$[3].extensions[0]").value(".py"));
    }

    @Test
    void whenGettingLatest_givenNoSnapshot_shouldReturnNotFound()
            throws Exception {
        when(cache.latest()).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/graph/latest"))
                .andExpect(status().isNotFound());
    }

    @Test
    void whenGettingLatest_givenSnapshot_shouldReturnView()
            throws Exception {
        when(cache.latest()).thenReturn(Optional.of(new GraphSnapshot(
                analysis(), "main:abc", Instant.now())));

        mockMvc.perform(get("/api/graph/latest"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary.edges").value(2));
    }

    private static GraphAnalysis analysis() {
        final DependencyGraph graph = DependencyGraph.of(Map.of(
                "/repo/a.py", List.of("/repo/b.py"),
                "/repo/b.py", List.of("/repo/a.py")));
        return new GraphAnalysis(
                FileDependencyGraph.create(graph, null, path -> false),
                NodeNamer.buildNodeNames(graph.sortedNodes()),
                List.of(), List.of(), "working tree", "/repo");
    }

}
