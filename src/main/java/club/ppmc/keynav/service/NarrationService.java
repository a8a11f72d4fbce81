/**
 * NarrationService.java
 *
 * Sends everything menu sessions say to the connected screen-reader client. Events are serialized
 * with Gson and published on a single STOMP topic (app.narration.destination).
 */
package club.ppmc.keynav.service;

import club.ppmc.keynav.model.NarrationEvent;
import club.ppmc.keynav.session.NarrationSink;
import com.google.gson.Gson;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class NarrationService implements NarrationSink {

    private final SimpMessagingTemplate messagingTemplate;
    private final Gson gson;
    private final String destination;

    public NarrationService(
            SimpMessagingTemplate messagingTemplate,
            Gson gson,
            @Value("${app.narration.destination:/topic/narration}") String destination) {
        this.messagingTemplate = messagingTemplate;
        this.gson = gson;
        this.destination = destination;
    }

    @Override
    public void narrate(NarrationEvent event) {
        log.debug("[{}] {} ({})", event.screen(), event.text(), event.cue());
        messagingTemplate.convertAndSend(destination, gson.toJson(event));
    }
}
