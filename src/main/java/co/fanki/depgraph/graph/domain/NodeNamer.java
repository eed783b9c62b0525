package co.fanki.depgraph.graph.domain;

import co.fanki.depgraph.shared.Preconditions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Assigns short, collision-free display names to file paths.
 *
 * <p>A file is named by its base name. Files sharing a base name are
 * named by their trailing path segments, starting at two segments and
 * growing until every member of the colliding group is distinct. The
 * depth is chosen per group and segments are joined with {@code /}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class NodeNamer {

    private NodeNamer() {
    }

    /**
     * Builds display names for a set of paths.
     *
     * @param paths the file paths
     * @return path to display name, distinct across all paths
     */
    public static Map<String, String> buildNodeNames(
            final Iterable<String> paths) {
        Preconditions.requireNonNull(paths, "Paths are required");

        final Map<String, List<String>> byBaseName = new LinkedHashMap<>();
        for (final String path : new LinkedHashSet<>(toList(paths))) {
            Preconditions.requireNonBlank(path, "Path must not be blank");
            byBaseName.computeIfAbsent(suffix(path, 1),
                    k -> new ArrayList<>()).add(path);
        }

        final Map<String, String> names = new LinkedHashMap<>();
        for (final Map.Entry<String, List<String>> group
                : byBaseName.entrySet()) {
            final List<String> members = group.getValue();
            if (members.size() == 1) {
                names.put(members.get(0), group.getKey());
                continue;
            }
            names.putAll(disambiguate(members));
        }
        return names;
    }

    private static Map<String, String> disambiguate(
            final List<String> members) {
        int maxDepth = 0;
        for (final String path : members) {
            maxDepth = Math.max(maxDepth, segments(path).length);
        }

        for (int depth = 2; depth <= maxDepth; depth++) {
            final Map<String, String> candidate = new LinkedHashMap<>();
            final Set<String> used = new HashSet<>();
            boolean distinct = true;
            for (final String path : members) {
                final String name = suffix(path, depth);
                if (!used.add(name)) {
                    distinct = false;
                    break;
                }
                candidate.put(path, name);
            }
            if (distinct) {
                return candidate;
            }
        }

        // Only reachable when normalized forms collide; full paths are unique.
        final Map<String, String> fallback = new LinkedHashMap<>();
        for (final String path : members) {
            fallback.put(path, path);
        }
        return fallback;
    }

    /**
     * Returns the last {@code depth} segments of a path, capped at the
     * number of segments the path has.
     */
    static String suffix(final String path, final int depth) {
        final String[] parts = segments(path);
        if (parts.length == 0) {
            return path;
        }
        final int from = Math.max(0, parts.length - depth);
        return String.join("/", Arrays.copyOfRange(parts, from, parts.length));
    }

    private static String[] segments(final String path) {
        final String normalized = path.replace('\\', '/');
        final List<String> parts = new ArrayList<>();
        for (final String part : normalized.split("/")) {
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        return parts.toArray(new String[0]);
    }

    private static List<String> toList(final Iterable<String> paths) {
        final List<String> list = new ArrayList<>();
        paths.forEach(list::add);
        return list;
    }

}
