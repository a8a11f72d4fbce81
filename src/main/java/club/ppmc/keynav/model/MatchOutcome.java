package club.ppmc.keynav.model;

/**
 * Result of feeding a character or a backspace to the typeahead search.
 *
 * @param status what happened to the search.
 * @param index  the visible index now selected by the search, or -1 when the cursor must not move.
 * @param query  the query involved: the committed buffer, or the rejected query.
 */
public record MatchOutcome(Status status, int index, String query) {

    public enum Status {
        /** The buffer was extended or shortened and has at least one match. */
        MATCHED,
        /** Nothing matched; the previous search state is kept. */
        REJECTED,
        /** The buffer became empty and the search was cleared. */
        CLEARED,
        /** There was no search to edit. */
        INACTIVE
    }

    public static MatchOutcome matched(int index, String query) {
        return new MatchOutcome(Status.MATCHED, index, query);
    }

    public static MatchOutcome rejected(String query) {
        return new MatchOutcome(Status.REJECTED, -1, query);
    }

    public static MatchOutcome cleared() {
        return new MatchOutcome(Status.CLEARED, -1, "");
    }

    public static MatchOutcome inactive() {
        return new MatchOutcome(Status.INACTIVE, -1, "");
    }

    public boolean isMatched() {
        return status == Status.MATCHED;
    }
}
