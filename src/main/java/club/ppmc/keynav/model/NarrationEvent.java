/**
 * NarrationEvent.java
 *
 * One message for the screen reader: the text to speak, the sound cue the host should play with it,
 * and whether it should interrupt speech already queued.
 * Created by MenuSession and pushed to clients by NarrationService.
 */
package club.ppmc.keynav.model;

public record NarrationEvent(String screen, String text, NarrationCue cue, boolean highPriority) {

    public static NarrationEvent of(String screen, String text, NarrationCue cue) {
        return new NarrationEvent(screen, text, cue, false);
    }

    public static NarrationEvent urgent(String screen, String text, NarrationCue cue) {
        return new NarrationEvent(screen, text, cue, true);
    }
}
