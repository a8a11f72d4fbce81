/**
 * LevelTracker.java
 *
 * Remembers, per navigation context ("Inventory", "Details", ...), the depth that was last
 * announced, so "level N" is only spoken when the user actually changes level.
 * One instance is owned by MenuSessionService; contexts are reset when their menu opens or closes.
 */
package club.ppmc.keynav.engine;

import java.util.HashMap;
import java.util.Map;

public class LevelTracker {

    private final Map<String, Integer> lastAnnouncedDepth = new HashMap<>();

    /**
     * Records {@code depth} for the context.
     *
     * @return true when it differs from the previously recorded depth (or nothing was recorded).
     */
    public synchronized boolean update(String context, int depth) {
        Integer previous = lastAnnouncedDepth.put(context, depth);
        return previous == null || previous != depth;
    }

    public synchronized void reset(String context) {
        lastAnnouncedDepth.remove(context);
    }

    public synchronized Integer lastDepth(String context) {
        return lastAnnouncedDepth.get(context);
    }
}
