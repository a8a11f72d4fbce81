/**
 * TypeaheadSearch.java
 *
 * Incremental, case-insensitive substring search over the labels of the visible sequence.
 * Each typed character narrows the match set; a character that would leave nothing to match is
 * rejected and the previous search stays in place. Backspace widens the search again.
 * Match indices refer to one particular visible sequence; callers clear the search whenever the
 * tree is re-flattened.
 */
package club.ppmc.keynav.engine;

import club.ppmc.keynav.model.MatchOutcome;
import club.ppmc.keynav.model.SearchState;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class TypeaheadSearch {

    private String buffer = "";
    private List<Integer> matches = new ArrayList<>();
    private int matchCursor = -1;
    private String lastFailedQuery;

    /**
     * Adds a character to the search.
     *
     * @param c            typed character, case-folded here.
     * @param labels       labels of the visible sequence, by index.
     * @param currentIndex cursor position; the selected match is the first one at or after it.
     * @return MATCHED with the index to select, or REJECTED when nothing contains the extended query.
     */
    public MatchOutcome processCharacter(char c, List<String> labels, int currentIndex) {
        String candidate = buffer + Character.toString(c).toLowerCase(Locale.ROOT);
        List<Integer> found = findMatches(candidate, labels);
        if (found.isEmpty()) {
            lastFailedQuery = candidate;
            return MatchOutcome.rejected(candidate);
        }
        buffer = candidate;
        matches = found;
        matchCursor = firstAtOrAfter(currentIndex);
        return MatchOutcome.matched(matches.get(matchCursor), buffer);
    }

    /**
     * Removes the last typed character. An emptied buffer clears the whole search.
     */
    public MatchOutcome processBackspace(List<String> labels, int currentIndex) {
        if (buffer.isEmpty()) {
            return MatchOutcome.inactive();
        }
        buffer = buffer.substring(0, buffer.length() - 1);
        if (buffer.isEmpty()) {
            clear();
            return MatchOutcome.cleared();
        }
        matches = findMatches(buffer, labels);
        if (matches.isEmpty()) {
            // Only reachable when the labels changed under an active search.
            matchCursor = -1;
            return MatchOutcome.rejected(buffer);
        }
        matchCursor = firstAtOrAfter(currentIndex);
        return MatchOutcome.matched(matches.get(matchCursor), buffer);
    }

    /**
     * The first match strictly after {@code currentIndex}, wrapping to the first match.
     *
     * @return a visible index, or -1 when there are no matches.
     */
    public int nextMatch(int currentIndex) {
        if (matches.isEmpty()) {
            return -1;
        }
        int position = 0;
        for (int i = 0; i < matches.size(); i++) {
            if (matches.get(i) > currentIndex) {
                position = i;
                break;
            }
        }
        matchCursor = position;
        return matches.get(position);
    }

    /**
     * The last match strictly before {@code currentIndex}, wrapping to the last match.
     *
     * @return a visible index, or -1 when there are no matches.
     */
    public int previousMatch(int currentIndex) {
        if (matches.isEmpty()) {
            return -1;
        }
        int position = matches.size() - 1;
        for (int i = matches.size() - 1; i >= 0; i--) {
            if (matches.get(i) < currentIndex) {
                position = i;
                break;
            }
        }
        matchCursor = position;
        return matches.get(position);
    }

    public void clear() {
        buffer = "";
        matches = new ArrayList<>();
        matchCursor = -1;
        lastFailedQuery = null;
    }

    public boolean hasActiveSearch() {
        return !buffer.isEmpty();
    }

    /** An active search whose match set went empty; arrows then navigate normally. */
    public boolean hasNoMatches() {
        return hasActiveSearch() && matches.isEmpty();
    }

    public int matchCount() {
        return matches.size();
    }

    /** 1-based position of the active match, 0 when there is none. */
    public int currentMatchPosition() {
        return matchCursor + 1;
    }

    public String searchBuffer() {
        return buffer;
    }

    public String lastFailedQuery() {
        return lastFailedQuery;
    }

    public SearchState state() {
        return new SearchState(buffer, List.copyOf(matches), matchCursor, lastFailedQuery);
    }

    private int firstAtOrAfter(int currentIndex) {
        for (int i = 0; i < matches.size(); i++) {
            if (matches.get(i) >= currentIndex) {
                return i;
            }
        }
        return 0;
    }

    private static List<Integer> findMatches(String query, List<String> labels) {
        List<Integer> found = new ArrayList<>();
        for (int i = 0; i < labels.size(); i++) {
            String label = labels.get(i);
            if (label != null && label.toLowerCase(Locale.ROOT).contains(query)) {
                found.add(i);
            }
        }
        return found;
    }
}
