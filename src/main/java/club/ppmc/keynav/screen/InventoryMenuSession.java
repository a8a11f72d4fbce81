/**
 * InventoryMenuSession.java
 *
 * Colony inventory as a tree: categories nest by their slash-separated path, each leaf category
 * lists its items (stacks with the same name and carrier are merged), and each item expands to its
 * actions. Subcategories come before items; both keep the order in which the host reported them.
 *
 * Extra keys: Delete drops the selected carried item.
 */
package club.ppmc.keynav.screen;

import club.ppmc.keynav.engine.LevelTracker;
import club.ppmc.keynav.model.InventoryRecord;
import club.ppmc.keynav.model.KeyStroke;
import club.ppmc.keynav.model.NarrationCue;
import club.ppmc.keynav.model.NavKey;
import club.ppmc.keynav.model.NavNode;
import club.ppmc.keynav.model.NavigationSettings;
import club.ppmc.keynav.model.NodeKind;
import club.ppmc.keynav.session.MenuSession;
import club.ppmc.keynav.session.NarrationSink;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class InventoryMenuSession extends MenuSession {

    public static final String SCREEN = "Inventory";
    static final String UNCATEGORIZED = "Uncategorized";

    /** One merged stack as shown in the menu. */
    public record InventoryItem(String categoryPath, String name, int quantity, String carriedBy) {

        public boolean isCarried() {
            return carriedBy != null && !carriedBy.isBlank();
        }

        public String label() {
            String label = name + " x" + quantity;
            return isCarried() ? label + " (carried by " + carriedBy + ")" : label;
        }

        boolean covers(InventoryRecord record) {
            return categoryPath.equals(normalizePath(record.categoryPath()))
                    && name.equals(record.itemName())
                    && Objects.equals(carriedBy, record.isCarried() ? record.carriedBy() : null);
        }
    }

    private enum ItemAction {
        VIEW_DETAILS("View details"),
        DROP("Drop");

        private final String label;

        ItemAction(String label) {
            this.label = label;
        }
    }

    private record ActionRef(ItemAction action, InventoryItem item) {}

    private final List<InventoryRecord> records;
    private Consumer<InventoryItem> detailsHandler;

    public InventoryMenuSession(
            List<InventoryRecord> records,
            LevelTracker levelTracker,
            NarrationSink narrationSink,
            NavigationSettings settings) {
        super(SCREEN, levelTracker, narrationSink, settings);
        this.records = new ArrayList<>(records);
        this.detailsHandler = item -> speak(describeItem(item), NarrationCue.CLICK);
        actions.register(NodeKind.ACTION, this::runAction);
    }

    /** Replaces the default "View details" behaviour, which only narrates a summary of the item. */
    public void setDetailsHandler(Consumer<InventoryItem> detailsHandler) {
        this.detailsHandler = Objects.requireNonNull(detailsHandler);
    }

    public List<InventoryRecord> getRecords() {
        return List.copyOf(records);
    }

    @Override
    protected List<NavNode> buildTree() {
        CategoryBucket root = new CategoryBucket("", "");
        for (InventoryRecord record : records) {
            String path = normalizePath(record.categoryPath());
            CategoryBucket bucket = root;
            for (String segment : path.split("/")) {
                bucket = bucket.child(segment);
            }
            bucket.add(record, path);
        }
        List<NavNode> roots = new ArrayList<>();
        for (CategoryBucket category : root.subcategories.values()) {
            roots.add(category.toNode());
        }
        return roots;
    }

    @Override
    protected boolean handleCustomKey(KeyStroke stroke) {
        if (stroke.key() != NavKey.DELETE) {
            return false;
        }
        InventoryItem item = selectedItem();
        if (item == null) {
            return false;
        }
        if (!item.isCarried()) {
            speak(item.name() + " is not carried by anyone.", NarrationCue.REJECT);
            return true;
        }
        drop(item);
        return true;
    }

    @Override
    protected String openingAnnouncement() {
        if (navigator.isEmpty()) {
            return "Colony inventory opened. " + emptyAnnouncement();
        }
        int categories = navigator.roots().size();
        return "Colony inventory opened. " + categories + (categories == 1 ? " category." : " categories.");
    }

    @Override
    protected String closingAnnouncement() {
        return "Inventory menu closed.";
    }

    @Override
    protected String emptyAnnouncement() {
        return "No items in inventory.";
    }

    @Override
    protected String containerNoun(boolean plural) {
        return plural ? "categories" : "category";
    }

    private void runAction(NavNode node) {
        if (!(node.getPayload() instanceof ActionRef ref)) {
            speak("This item has no actions.", NarrationCue.REJECT);
            return;
        }
        switch (ref.action()) {
            case VIEW_DETAILS -> detailsHandler.accept(ref.item());
            case DROP -> drop(ref.item());
        }
    }

    private void drop(InventoryItem item) {
        int before = records.size();
        records.removeIf(item::covers);
        log.info("Dropped {} ({} stacks) carried by {}.", item.name(), before - records.size(), item.carriedBy());
        refresh();
        speak("Dropped " + item.name() + ".", NarrationCue.CLICK);
        announceCurrent(NarrationCue.NONE);
    }

    private InventoryItem selectedItem() {
        NavNode node = currentSelection();
        if (node == null) {
            return null;
        }
        if (node.getPayload() instanceof InventoryItem item) {
            return item;
        }
        if (node.getPayload() instanceof ActionRef ref) {
            return ref.item();
        }
        return null;
    }

    static String describeItem(InventoryItem item) {
        StringBuilder text = new StringBuilder(item.name())
                .append(", quantity ").append(item.quantity())
                .append(", category ").append(item.categoryPath().replace("/", ", "));
        if (item.isCarried()) {
            text.append(", carried by ").append(item.carriedBy());
        }
        return text.append('.').toString();
    }

    static String normalizePath(String categoryPath) {
        if (categoryPath == null || categoryPath.isBlank()) {
            return UNCATEGORIZED;
        }
        String[] segments = Arrays.stream(categoryPath.split("/"))
                .map(String::trim)
                .filter(segment -> !segment.isEmpty())
                .toArray(String[]::new);
        return segments.length == 0 ? UNCATEGORIZED : String.join("/", segments);
    }

    /** Intermediate grouping while the tree is built. */
    private static final class CategoryBucket {
        private final String name;
        private final String path;
        private final Map<String, CategoryBucket> subcategories = new LinkedHashMap<>();
        private final Map<String, InventoryItem> items = new LinkedHashMap<>();

        private CategoryBucket(String name, String path) {
            this.name = name;
            this.path = path;
        }

        private CategoryBucket child(String segment) {
            String childPath = path.isEmpty() ? segment : path + "/" + segment;
            return subcategories.computeIfAbsent(segment, s -> new CategoryBucket(s, childPath));
        }

        private void add(InventoryRecord record, String categoryPath) {
            String carriedBy = record.isCarried() ? record.carriedBy() : null;
            String itemKey = carriedBy == null ? record.itemName() : record.itemName() + ":carried:" + carriedBy;
            items.merge(
                    itemKey,
                    new InventoryItem(categoryPath, record.itemName(), record.quantity(), carriedBy),
                    (a, b) -> new InventoryItem(a.categoryPath(), a.name(), a.quantity() + b.quantity(), a.carriedBy()));
        }

        private NavNode toNode() {
            NavNode node = new NavNode(name, NodeKind.CATEGORY, "cat:" + path, path);
            for (CategoryBucket sub : subcategories.values()) {
                node.addChild(sub.toNode());
            }
            for (Map.Entry<String, InventoryItem> entry : items.entrySet()) {
                node.addChild(itemNode(entry.getKey(), entry.getValue()));
            }
            return node;
        }

        private NavNode itemNode(String itemKey, InventoryItem item) {
            String key = "item:" + path + "/" + itemKey;
            NavNode node = new NavNode(item.label(), NodeKind.ITEM, key, item);
            node.addChild(new NavNode(
                    ItemAction.VIEW_DETAILS.label, NodeKind.ACTION, key + ":details",
                    new ActionRef(ItemAction.VIEW_DETAILS, item)));
            if (item.isCarried()) {
                node.addChild(new NavNode(
                        ItemAction.DROP.label, NodeKind.ACTION, key + ":drop",
                        new ActionRef(ItemAction.DROP, item)));
            }
            return node;
        }
    }
}
