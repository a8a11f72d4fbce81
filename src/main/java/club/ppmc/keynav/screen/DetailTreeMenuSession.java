/**
 * DetailTreeMenuSession.java
 *
 * Read-only tree of information about one thing (a pawn, an item, a building). The host describes
 * it declaratively as nested DetailSection records; sections become expandable nodes, their
 * detail lines become leaves listed before any subsection.
 */
package club.ppmc.keynav.screen;

import club.ppmc.keynav.engine.LevelTracker;
import club.ppmc.keynav.model.DetailSection;
import club.ppmc.keynav.model.NavNode;
import club.ppmc.keynav.model.NavigationSettings;
import club.ppmc.keynav.model.NodeKind;
import club.ppmc.keynav.session.MenuSession;
import club.ppmc.keynav.session.NarrationSink;
import java.util.ArrayList;
import java.util.List;

public class DetailTreeMenuSession extends MenuSession {

    public static final String SCREEN = "Details";

    private final String title;
    private final List<DetailSection> sections;

    public DetailTreeMenuSession(
            String title,
            List<DetailSection> sections,
            LevelTracker levelTracker,
            NarrationSink narrationSink,
            NavigationSettings settings) {
        super(SCREEN, levelTracker, narrationSink, settings);
        this.title = title;
        this.sections = sections == null ? List.of() : List.copyOf(sections);
    }

    @Override
    protected List<NavNode> buildTree() {
        List<NavNode> roots = new ArrayList<>();
        for (DetailSection section : sections) {
            roots.add(sectionNode(section, ""));
        }
        return roots;
    }

    private NavNode sectionNode(DetailSection section, String parentPath) {
        String path = parentPath + "/" + section.title();
        NavNode node = new NavNode(section.title(), NodeKind.SECTION, "section:" + path, section);
        int line = 0;
        for (String detail : section.details()) {
            node.addChild(new NavNode(detail, NodeKind.DETAIL, "detail:" + path + "#" + line++, null));
        }
        for (DetailSection subsection : section.subsections()) {
            node.addChild(sectionNode(subsection, path));
        }
        return node;
    }

    @Override
    protected String openingAnnouncement() {
        if (navigator.isEmpty()) {
            return title + " details opened. " + emptyAnnouncement();
        }
        return title + " details opened.";
    }

    @Override
    protected String closingAnnouncement() {
        return title + " details closed.";
    }

    @Override
    protected String emptyAnnouncement() {
        return "No details available.";
    }
}
