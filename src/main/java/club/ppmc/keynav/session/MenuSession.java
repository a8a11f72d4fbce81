/**
 * MenuSession.java
 *
 * Base class of every keyboard-navigable menu. A session owns one tree, its cursor, its typeahead
 * search and its action table for the whole time the menu is open, maps keys to the engine
 * operations, and narrates the result of each one.
 *
 * Key map:
 *   Up/Down      previous/next entry, or previous/next search match while a search has matches
 *   Right/Left   expand or drill down / collapse or drill up
 *   Home/End     first/last entry of the sibling group; with Ctrl, of the whole tree
 *   Enter        run the entry's action, or toggle expansion
 *   Escape       clear the search, or close the menu
 *   Backspace    shorten the search
 *   *            expand every container (screens with containers only)
 *   letters and digits (onCharacter) feed the typeahead search
 *
 * While a confirmation is pending, Enter confirms, Escape cancels and every other key or character
 * repeats the prompt.
 *
 * Subclasses supply the tree (buildTree) and may add keys through handleCustomKey.
 */
package club.ppmc.keynav.session;

import static club.ppmc.keynav.engine.AnnouncementFormatter.formatExpansionState;
import static club.ppmc.keynav.engine.AnnouncementFormatter.formatLevelSuffix;
import static club.ppmc.keynav.engine.AnnouncementFormatter.formatNoMatches;
import static club.ppmc.keynav.engine.AnnouncementFormatter.formatPosition;
import static club.ppmc.keynav.engine.AnnouncementFormatter.formatSearchStatus;
import static club.ppmc.keynav.engine.AnnouncementFormatter.formatTreeItem;

import club.ppmc.keynav.engine.CursorNavigator;
import club.ppmc.keynav.engine.LevelTracker;
import club.ppmc.keynav.engine.TypeaheadSearch;
import club.ppmc.keynav.model.KeyResult;
import club.ppmc.keynav.model.KeyStroke;
import club.ppmc.keynav.model.MatchOutcome;
import club.ppmc.keynav.model.MenuSnapshot;
import club.ppmc.keynav.model.NarrationCue;
import club.ppmc.keynav.model.NarrationEvent;
import club.ppmc.keynav.model.NavNode;
import club.ppmc.keynav.model.NavigationOutcome;
import club.ppmc.keynav.model.NavigationSettings;
import club.ppmc.keynav.model.SearchState;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public abstract class MenuSession {

    private final String screen;
    private final LevelTracker levelTracker;
    private final NarrationSink narrationSink;
    private final NavigationSettings settings;

    protected final CursorNavigator navigator = new CursorNavigator();
    protected final TypeaheadSearch typeahead = new TypeaheadSearch();
    protected final NodeActionTable actions = new NodeActionTable();

    private boolean open;
    private String lastAnnouncement = "";
    private PendingConfirmation pendingConfirmation;
    private Consumer<MenuSession> closeListener = session -> {};

    /**
     * @param screen        screen name, spoken in generic announcements and used as the level-tracking context.
     * @param levelTracker  shared per-context level memory.
     * @param narrationSink receiver of everything this session says.
     * @param settings      navigation preferences in effect while the session is open.
     */
    protected MenuSession(
            String screen, LevelTracker levelTracker, NarrationSink narrationSink, NavigationSettings settings) {
        this.screen = screen;
        this.levelTracker = levelTracker;
        this.narrationSink = narrationSink;
        this.settings = settings;
    }

    /**
     * Converts the screen's domain data into nodes. Called on open and on every refresh, and must
     * return a fresh tree each time.
     */
    protected abstract List<NavNode> buildTree();

    // ---- lifecycle ----

    public void open() {
        open = true;
        pendingConfirmation = null;
        levelTracker.reset(screen);
        typeahead.clear();
        navigator.reset(buildTree());
        log.info("{} opened with {} visible entries.", screen, navigator.size());
        speak(openingAnnouncement(), NarrationCue.OPEN);
        if (!navigator.isEmpty()) {
            announceCurrent(NarrationCue.NONE);
        }
    }

    public void close() {
        if (!open) {
            return;
        }
        open = false;
        pendingConfirmation = null;
        typeahead.clear();
        levelTracker.reset(screen);
        navigator.reset(List.of());
        log.info("{} closed.", screen);
        speak(closingAnnouncement(), NarrationCue.CLOSE);
        closeListener.accept(this);
    }

    /**
     * Rebuilds the tree from the current domain data without closing the menu. Expansion state and
     * the selected entry survive where their nodes still exist; the search does not.
     */
    public void refresh() {
        if (!open) {
            return;
        }
        navigator.rebuild(buildTree());
        typeahead.clear();
        log.info("{} refreshed, {} visible entries.", screen, navigator.size());
    }

    public void setCloseListener(Consumer<MenuSession> closeListener) {
        this.closeListener = Objects.requireNonNull(closeListener);
    }

    // ---- input ----

    /**
     * Input entry point for physical keys.
     *
     * @return HANDLED when the key was consumed and the host must not process it further.
     */
    public KeyResult onKey(KeyStroke stroke) {
        if (!open || stroke == null) {
            return KeyResult.NOT_HANDLED;
        }
        log.debug("{} <- {}", screen, stroke);
        if (pendingConfirmation != null) {
            answerConfirmation(stroke);
            return KeyResult.HANDLED;
        }
        boolean handled = switch (stroke.key()) {
            case UP -> selectPrevious();
            case DOWN -> selectNext();
            case RIGHT -> expandCurrent();
            case LEFT -> collapseCurrent();
            case HOME -> jumpHome(stroke.ctrl());
            case END -> jumpEnd(stroke.ctrl());
            case ENTER -> activateCurrent();
            case ESCAPE -> goBack();
            case BACKSPACE -> typeahead.hasActiveSearch() ? shortenSearch() : handleCustomKey(stroke);
            case STAR -> supportsExpandAll() ? expandAllContainers() : handleCustomKey(stroke);
            default -> handleCustomKey(stroke);
        };
        return KeyResult.of(handled);
    }

    /**
     * Input entry point for printable characters. Letters and digits extend the typeahead search;
     * everything else is left to the host.
     */
    public KeyResult onCharacter(char c) {
        if (!open) {
            return KeyResult.NOT_HANDLED;
        }
        if (pendingConfirmation != null) {
            speak(pendingConfirmation.prompt(), NarrationCue.REJECT);
            return KeyResult.HANDLED;
        }
        if (!Character.isLetterOrDigit(c) || navigator.isEmpty()) {
            return KeyResult.NOT_HANDLED;
        }
        MatchOutcome outcome = typeahead.processCharacter(c, navigator.labels(), navigator.cursor());
        if (outcome.isMatched()) {
            navigator.moveTo(outcome.index());
            announceCurrent(NarrationCue.TICK);
        } else {
            speak(formatNoMatches(outcome.query()), NarrationCue.REJECT);
        }
        return KeyResult.HANDLED;
    }

    /** Screen-specific keys (Delete, Alt combinations...). */
    protected boolean handleCustomKey(KeyStroke stroke) {
        return false;
    }

    /** Whether '*' expands containers here. Flat screens return false and leave the key to the host. */
    protected boolean supportsExpandAll() {
        return true;
    }

    /**
     * Speaks {@code prompt} and holds all input until Enter runs {@code onConfirm} or Escape runs
     * {@code onCancel}.
     */
    protected void requestConfirmation(String prompt, Runnable onConfirm, Runnable onCancel) {
        pendingConfirmation = new PendingConfirmation(prompt, onConfirm, onCancel);
        speak(prompt, NarrationCue.TICK);
    }

    public boolean isAwaitingConfirmation() {
        return pendingConfirmation != null;
    }

    // ---- queries ----

    public String getScreen() {
        return screen;
    }

    public boolean isOpen() {
        return open;
    }

    public NavNode currentSelection() {
        return navigator.current();
    }

    /** The text most recently handed to the narration sink. */
    public String currentAnnouncementText() {
        return lastAnnouncement;
    }

    public List<String> visibleLabels() {
        return navigator.labels();
    }

    public int cursor() {
        return navigator.cursor();
    }

    public SearchState searchState() {
        return typeahead.state();
    }

    public MenuSnapshot snapshot() {
        NavNode selected = navigator.current();
        return new MenuSnapshot(
                screen,
                open,
                navigator.labels(),
                navigator.cursor(),
                selected != null ? selected.getLabel() : null,
                lastAnnouncement,
                typeahead.searchBuffer(),
                typeahead.matchCount());
    }

    // ---- announcement hooks ----

    protected String openingAnnouncement() {
        return navigator.isEmpty() ? screen + " opened. " + emptyAnnouncement() : screen + " opened.";
    }

    protected String closingAnnouncement() {
        return screen + " closed.";
    }

    protected String emptyAnnouncement() {
        return screen + " is empty.";
    }

    /** Noun for the nodes '*' expands, used in its feedback. */
    protected String containerNoun(boolean plural) {
        return plural ? "sections" : "section";
    }

    /**
     * Text spoken for the selected node. Default shape: label, expansion state, sibling position
     * and level change, or the search status while a search is being cycled.
     */
    protected String describe(NavNode node) {
        String label = Objects.requireNonNullElse(node.getLabel(), "");
        String state = formatExpansionState(node);
        if (isCyclingMatches()) {
            String base = state.isEmpty() ? label : label + " " + state;
            return base + ", " + formatSearchStatus(typeahead);
        }
        String position = settings.isAnnouncePosition() ? formatPosition(navigator.siblingPosition(node)) : "";
        String level = settings.isAnnounceLevel() ? formatLevelSuffix(levelTracker, screen, node.getDepth()) : "";
        return formatTreeItem(label, state, position, level);
    }

    protected boolean isCyclingMatches() {
        return typeahead.hasActiveSearch() && !typeahead.hasNoMatches();
    }

    protected NavigationSettings getSettings() {
        return settings;
    }

    protected void announceCurrent(NarrationCue cue) {
        NavNode node = navigator.current();
        if (node == null) {
            speak(emptyAnnouncement(), NarrationCue.NONE);
            return;
        }
        speak(describe(node), cue);
    }

    protected void speak(String text, NarrationCue cue) {
        lastAnnouncement = text;
        narrationSink.narrate(NarrationEvent.of(screen, text, cue));
    }

    protected void speakUrgent(String text, NarrationCue cue) {
        lastAnnouncement = text;
        narrationSink.narrate(NarrationEvent.urgent(screen, text, cue));
    }

    // ---- key handlers ----

    private boolean selectNext() {
        if (isCyclingMatches()) {
            int next = typeahead.nextMatch(navigator.cursor());
            if (next >= 0) {
                navigator.moveTo(next);
                announceCurrent(NarrationCue.TICK);
            }
            return true;
        }
        return respond(navigator.next(), null);
    }

    private boolean selectPrevious() {
        if (isCyclingMatches()) {
            int previous = typeahead.previousMatch(navigator.cursor());
            if (previous >= 0) {
                navigator.moveTo(previous);
                announceCurrent(NarrationCue.TICK);
            }
            return true;
        }
        return respond(navigator.previous(), null);
    }

    protected boolean expandCurrent() {
        // Expanding changes the visible sequence, so match indices would be stale.
        typeahead.clear();
        return respond(navigator.expandOrDrillDown(), "Cannot expand this item.");
    }

    protected boolean collapseCurrent() {
        typeahead.clear();
        return respond(navigator.collapseOrDrillUp(), "Already at top level.");
    }

    private boolean jumpHome(boolean absolute) {
        typeahead.clear();
        return respond(absolute ? navigator.absoluteHome() : navigator.homeWithinLevel(), null);
    }

    private boolean jumpEnd(boolean absolute) {
        typeahead.clear();
        return respond(absolute ? navigator.absoluteEnd() : navigator.endWithinLevel(), null);
    }

    private boolean activateCurrent() {
        NavNode node = navigator.current();
        if (node == null) {
            speak(emptyAnnouncement(), NarrationCue.NONE);
            return true;
        }
        if (actions.supports(node)) {
            try {
                actions.dispatch(node);
            } catch (RuntimeException e) {
                log.error("Action on '{}' in {} failed.", node.getLabel(), screen, e);
                speakUrgent("Action failed.", NarrationCue.REJECT);
            }
            return true;
        }
        if (node.isBranch()) {
            return node.isExpanded() ? collapseCurrent() : expandCurrent();
        }
        speak("This item has no actions.", NarrationCue.REJECT);
        return true;
    }

    private boolean goBack() {
        if (typeahead.hasActiveSearch()) {
            typeahead.clear();
            speak("Search cleared.", NarrationCue.TICK);
            announceCurrent(NarrationCue.NONE);
            return true;
        }
        close();
        return true;
    }

    private boolean shortenSearch() {
        MatchOutcome outcome = typeahead.processBackspace(navigator.labels(), navigator.cursor());
        if (outcome.isMatched()) {
            navigator.moveTo(outcome.index());
        }
        announceCurrent(NarrationCue.TICK);
        return true;
    }

    private boolean expandAllContainers() {
        if (navigator.roots().isEmpty()) {
            speak("No " + containerNoun(true) + " to expand.", NarrationCue.REJECT);
            return true;
        }
        int count = navigator.expandAll(node -> node.getKind().isContainer());
        if (count > 0) {
            typeahead.clear();
            speak("Expanded " + count + " " + containerNoun(count != 1), NarrationCue.CLICK);
        } else {
            speak("All " + containerNoun(true) + " already expanded", NarrationCue.NONE);
        }
        return true;
    }

    private void answerConfirmation(KeyStroke stroke) {
        PendingConfirmation pending = pendingConfirmation;
        switch (stroke.key()) {
            case ENTER -> {
                pendingConfirmation = null;
                try {
                    pending.onConfirm().run();
                } catch (RuntimeException e) {
                    log.error("Confirmed action in {} failed.", screen, e);
                    speakUrgent("Action failed.", NarrationCue.REJECT);
                }
            }
            case ESCAPE -> {
                pendingConfirmation = null;
                pending.onCancel().run();
            }
            default -> speak(pending.prompt(), NarrationCue.REJECT);
        }
    }

    private boolean respond(NavigationOutcome outcome, String rejection) {
        if (outcome == NavigationOutcome.EMPTY) {
            speak(emptyAnnouncement(), NarrationCue.NONE);
        } else if (outcome.isRejected()) {
            speakUrgent(rejection, NarrationCue.REJECT);
        } else {
            announceCurrent(outcome.isStructural() ? NarrationCue.CLICK : NarrationCue.TICK);
        }
        return true;
    }

    private record PendingConfirmation(String prompt, Runnable onConfirm, Runnable onCancel) {}
}
