/**
 * KeyNavApplication.java
 *
 * Entry point of the keyboard navigation service. The STOMP broker used for narration is enabled
 * in WebSocketConfig.
 */
package club.ppmc.keynav;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KeyNavApplication {

    public static void main(String[] args) {
        SpringApplication.run(KeyNavApplication.class, args);
    }
}
