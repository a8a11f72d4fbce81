/**
 * SearchState.java
 *
 * Immutable snapshot of a typeahead search: the typed buffer, the ascending indices of matching
 * visible nodes, the position of the active match within them, and the last rejected query.
 * Produced by TypeaheadSearch#state() for announcements and API snapshots.
 */
package club.ppmc.keynav.model;

import java.util.List;

/**
 * @param buffer          accumulated, lower-cased typed characters.
 * @param matches         indices into the visible sequence, ascending.
 * @param matchCursor     index into {@code matches}, or -1 when there are none.
 * @param lastFailedQuery the last query that matched nothing, or null.
 */
public record SearchState(String buffer, List<Integer> matches, int matchCursor, String lastFailedQuery) {

    public static SearchState empty() {
        return new SearchState("", List.of(), -1, null);
    }

    public boolean isActive() {
        return !buffer.isEmpty();
    }
}
