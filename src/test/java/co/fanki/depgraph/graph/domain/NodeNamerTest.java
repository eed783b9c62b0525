package co.fanki.depgraph.graph.domain;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for {@link NodeNamer}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class NodeNamerTest {

    @Test
    void whenNaming_givenCollidingBaseNames_shouldUseTwoSegments() {
        final Map<String, String> names = NodeNamer.buildNodeNames(List.of(
                "/repo/test/res.send.js",
                "/repo/test/support/utils.js",
                "/repo/lib/utils.js"));

        assertEquals("res.send.js", names.get("/repo/test/res.send.js"));
        assertEquals("support/utils.js",
                names.get("/repo/test/support/utils.js"));
        assertEquals("lib/utils.js", names.get("/repo/lib/utils.js"));
    }

    @Test
    void whenNaming_givenDeepCollision_shouldGrowWholeGroupTogether() {
        final Map<String, String> names = NodeNamer.buildNodeNames(List.of(
                "/x/a/lib/utils.js",
                "/y/a/lib/utils.js",
                "/z/b/lib/utils.js"));

        assertEquals("x/a/lib/utils.js", names.get("/x/a/lib/utils.js"));
        assertEquals("y/a/lib/utils.js", names.get("/y/a/lib/utils.js"));
        assertEquals("z/b/lib/utils.js", names.get("/z/b/lib/utils.js"));
    }

    @Test
    void whenNaming_givenIndependentGroups_shouldPickDepthPerGroup() {
        final Map<String, String> names = NodeNamer.buildNodeNames(List.of(
                "/p/a/index.ts",
                "/p/b/index.ts",
                "/p/x/one/model.ts",
                "/p/y/one/model.ts"));

        assertEquals("a/index.ts", names.get("/p/a/index.ts"));
        assertEquals("x/one/model.ts", names.get("/p/x/one/model.ts"));
    }

    @Test
    void whenNaming_givenShortPath_shouldCapAtFullLength() {
        final Map<String, String> names = NodeNamer.buildNodeNames(List.of(
                "/utils.js", "/a/utils.js"));

        assertEquals("utils.js", names.get("/utils.js"));
        assertEquals("a/utils.js", names.get("/a/utils.js"));
    }

    @Test
    void whenNaming_givenManyPaths_shouldProduceDistinctNames() {
        final List<String> paths = List.of(
                "/r/src/a/Order.java", "/r/src/b/Order.java",
                "/r/test/a/Order.java", "/r/src/a/Line.java",
                "/r/main.py", "/r/pkg/main.py", "/r/pkg/sub/main.py",
                "/r/web/index.ts", "/r/web/admin/index.ts");

        final Map<String, String> names = NodeNamer.buildNodeNames(paths);

        assertEquals(paths.size(), names.size());
        assertEquals(paths.size(), new HashSet<>(names.values()).size());
    }

    @Test
    void whenSuffixing_givenDepthBeyondSegments_shouldReturnWholePath() {
        assertEquals("a/b.js", NodeNamer.suffix("/a/b.js", 5));
        assertEquals("b.js", NodeNamer.suffix("/a/b.js", 1));
    }

}
