package club.ppmc.keynav.session;

import club.ppmc.keynav.model.NarrationEvent;

/**
 * Where a menu session sends what should be spoken. Implemented by NarrationService for
 * WebSocket clients; tests substitute a mock.
 */
@FunctionalInterface
public interface NarrationSink {

    void narrate(NarrationEvent event);
}
