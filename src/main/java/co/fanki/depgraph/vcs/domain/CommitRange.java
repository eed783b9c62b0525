package co.fanki.depgraph.vcs.domain;

import co.fanki.depgraph.shared.Preconditions;
import co.fanki.depgraph.shared.ValueObject;

/**
 * A commit selection: either a single revision or a range of two.
 *
 * <p>Ranges are written {@code A..B} or {@code A...B}; both mean the
 * changes between the trees of {@code A} and {@code B}. A missing side
 * stands for {@code HEAD}, as in {@code main..}.</p>
 *
 * @param from the older revision, null for a single commit
 * @param to the revision whose content is analyzed
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CommitRange(String from, String to) implements ValueObject {

    private static final String HEAD = "HEAD";

    /** Validates the target revision. */
    public CommitRange {
        Preconditions.requireNonBlank(to, "Target revision is required");
    }

    /**
     * Parses a commit selection.
     *
     * @param selection a revision, {@code A..B} or {@code A...B}
     * @return the parsed selection
     */
    public static CommitRange parse(final String selection) {
        Preconditions.requireNonBlank(selection, "Commit is required");
        final String trimmed = selection.trim();

        final String separator;
        if (trimmed.contains("...")) {
            separator = "...";
        } else if (trimmed.contains("..")) {
            separator = "..";
        } else {
            return new CommitRange(null, trimmed);
        }

        final int at = trimmed.indexOf(separator);
        final String from = trimmed.substring(0, at).trim();
        final String to = trimmed.substring(at + separator.length()).trim();
        return new CommitRange(from.isEmpty() ? HEAD : from,
                to.isEmpty() ? HEAD : to);
    }

    /** Returns true when two revisions are compared. */
    public boolean isRange() {
        return from != null;
    }

    /** Returns the same range with its ends swapped. */
    public CommitRange reversed() {
        Preconditions.require(isRange(), "A single commit has no order");
        return new CommitRange(to, from);
    }

    @Override
    public String toString() {
        return isRange() ? from + ".." + to : to;
    }

}
