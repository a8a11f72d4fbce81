/**
 * WebSocketSessionListener.java
 *
 * Follows the narration clients. When the last one disconnects nobody can hear the open menu any
 * more, so it is closed.
 */
package club.ppmc.keynav.listener;

import club.ppmc.keynav.service.MenuSessionService;
import java.security.Principal;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

@Component
@Slf4j
public class WebSocketSessionListener {

    private final MenuSessionService menuSessionService;
    private final Set<String> connectedSessions = ConcurrentHashMap.newKeySet();

    public WebSocketSessionListener(MenuSessionService menuSessionService) {
        this.menuSessionService = menuSessionService;
    }

    @EventListener
    public void handleWebSocketConnectListener(SessionConnectedEvent event) {
        var headerAccessor = StompHeaderAccessor.wrap(event.getMessage());
        String sessionId = headerAccessor.getSessionId();
        Principal user = headerAccessor.getUser();

        if (sessionId == null) {
            log.error("SessionConnectedEvent without a session id.");
            return;
        }
        connectedSessions.add(sessionId);
        log.info("Narration client connected, session {} user {}", sessionId, user != null ? user.getName() : "-");
    }

    @EventListener
    public void handleWebSocketDisconnectListener(SessionDisconnectEvent event) {
        String sessionId = event.getSessionId();
        if (sessionId == null || !connectedSessions.remove(sessionId)) {
            return;
        }
        log.info("Narration client disconnected, session {}", sessionId);
        if (connectedSessions.isEmpty() && menuSessionService.closeActive()) {
            log.info("Closed the open menu, no narration client left.");
        }
    }
}
